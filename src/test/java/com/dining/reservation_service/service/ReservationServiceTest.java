package com.dining.reservation_service.service;

import com.dining.reservation_service.dto.CreateReservationRequest;
import com.dining.reservation_service.dto.ReservationResponse;
import com.dining.reservation_service.dto.UpdateReservationRequest;
import com.dining.reservation_service.entity.Reservation;
import com.dining.reservation_service.entity.Restaurant;
import com.dining.reservation_service.entity.Role;
import com.dining.reservation_service.entity.User;
import com.dining.reservation_service.exception.AdmissionDeniedException;
import com.dining.reservation_service.exception.ForbiddenException;
import com.dining.reservation_service.exception.NotFoundException;
import com.dining.reservation_service.exception.ValidationException;
import com.dining.reservation_service.repository.ReservationRepository;
import com.dining.reservation_service.repository.RestaurantRepository;
import com.dining.reservation_service.repository.UserRepository;
import com.dining.reservation_service.security.Caller;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReservationService unit tests")
class ReservationServiceTest {

    private static final Long OWNER_ID = 7L;
    private static final Long OTHER_ID = 8L;
    private static final Long ADMIN_ID = 1L;
    private static final LocalDateTime APPT_DATE = LocalDateTime.of(2022, 4, 20, 0, 0);

    @Mock
    private ReservationRepository reservationRepository;
    @Mock
    private RestaurantRepository restaurantRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private ReservationEventPublisher eventPublisher;

    private ReservationService reservationService;
    private Restaurant restaurant;
    private Caller owner;
    private Caller other;
    private Caller admin;

    @BeforeEach
    void setUp() {
        reservationService = new ReservationService(reservationRepository, restaurantRepository,
                userRepository, eventPublisher, ReservationService.DEFAULT_MAX_RESERVATIONS);

        restaurant = new Restaurant("Bistro", "1 Main St", "021234567", "09:00-22:00");
        restaurant.setId(10L);
        owner = new Caller(OWNER_ID, Role.USER);
        other = new Caller(OTHER_ID, Role.USER);
        admin = new Caller(ADMIN_ID, Role.ADMIN);
    }

    private Reservation reservation(Long id, Long userId) {
        Reservation reservation = new Reservation(userId, restaurant, APPT_DATE);
        reservation.setId(id);
        reservation.setCreatedAt(LocalDateTime.of(2022, 4, 1, 12, 0));
        return reservation;
    }

    @Test
    @DisplayName("Non-admin listing only reads the caller's reservations and ignores the restaurant scope")
    void getReservations_UserScopedToOwnRecords() {
        // given
        given(reservationRepository.findByUserId(OWNER_ID)).willReturn(List.of(reservation(100L, OWNER_ID)));

        // when
        List<ReservationResponse> result = reservationService.getReservations(owner, 99L);

        // then
        assertThat(result).hasSize(1);
        assertThat(result.get(0).getUser()).isEqualTo(OWNER_ID);
        assertThat(result.get(0).getRestaurant().getName()).isEqualTo("Bistro");
        verify(reservationRepository, never()).findByRestaurantId(any());
        verify(reservationRepository, never()).findAllWithRestaurant();
    }

    @Test
    @DisplayName("Admin listing with a restaurant scope reads that restaurant's reservations")
    void getReservations_AdminWithScope() {
        // given
        given(reservationRepository.findByRestaurantId(10L))
                .willReturn(List.of(reservation(100L, OWNER_ID), reservation(101L, OTHER_ID)));

        // when
        List<ReservationResponse> result = reservationService.getReservations(admin, 10L);

        // then
        assertThat(result).extracting(ReservationResponse::getId).containsExactly(100L, 101L);
    }

    @Test
    @DisplayName("Admin listing without scope reads everything")
    void getReservations_AdminWithoutScope() {
        // given
        given(reservationRepository.findAllWithRestaurant()).willReturn(List.of(reservation(100L, OWNER_ID)));

        // when
        List<ReservationResponse> result = reservationService.getReservations(admin, null);

        // then
        assertThat(result).hasSize(1);
        verify(reservationRepository, never()).findByUserId(any());
    }

    @Test
    @DisplayName("Get returns NotFound before checking ownership")
    void getReservation_NotFound() {
        // given
        given(reservationRepository.findWithRestaurantById(404L)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> reservationService.getReservation(other, 404L))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("No reservation with the id of 404");
    }

    @Test
    @DisplayName("Get by a non-owner fails with Forbidden")
    void getReservation_Forbidden() {
        // given
        given(reservationRepository.findWithRestaurantById(100L)).willReturn(Optional.of(reservation(100L, OWNER_ID)));

        // when & then
        assertThatThrownBy(() -> reservationService.getReservation(other, 100L))
                .isInstanceOf(ForbiddenException.class)
                .hasMessageContaining("User " + OTHER_ID);
    }

    @Test
    @DisplayName("Admin can read any reservation")
    void getReservation_Admin() {
        // given
        given(reservationRepository.findWithRestaurantById(100L)).willReturn(Optional.of(reservation(100L, OWNER_ID)));

        // when
        ReservationResponse result = reservationService.getReservation(admin, 100L);

        // then
        assertThat(result.getId()).isEqualTo(100L);
        assertThat(result.getUser()).isEqualTo(OWNER_ID);
    }

    @Test
    @DisplayName("Create stores the caller as owner and publishes an event")
    void createReservation_Success() {
        // given
        given(restaurantRepository.findById(10L)).willReturn(Optional.of(restaurant));
        given(userRepository.findByIdForUpdate(OWNER_ID)).willReturn(Optional.of(new User()));
        given(reservationRepository.countByUserId(OWNER_ID)).willReturn(2L);
        given(reservationRepository.save(any(Reservation.class))).willAnswer(invocation -> {
            Reservation saved = invocation.getArgument(0);
            saved.setId(500L);
            return saved;
        });

        // when
        ReservationResponse result = reservationService.createReservation(owner, 10L,
                new CreateReservationRequest(APPT_DATE));

        // then
        ArgumentCaptor<Reservation> captor = ArgumentCaptor.forClass(Reservation.class);
        verify(reservationRepository).save(captor.capture());
        assertThat(captor.getValue().getUserId()).isEqualTo(OWNER_ID);
        assertThat(captor.getValue().getRestaurant()).isSameAs(restaurant);
        assertThat(result.getId()).isEqualTo(500L);
        assertThat(result.getApptDate()).isEqualTo(APPT_DATE);
        verify(eventPublisher).publishReservationCreated(result);
    }

    @Test
    @DisplayName("Create fails with AdmissionDenied once the user holds three reservations")
    void createReservation_CapReached() {
        // given
        given(restaurantRepository.findById(10L)).willReturn(Optional.of(restaurant));
        given(userRepository.findByIdForUpdate(OWNER_ID)).willReturn(Optional.of(new User()));
        given(reservationRepository.countByUserId(OWNER_ID)).willReturn(3L);

        // when & then
        assertThatThrownBy(() -> reservationService.createReservation(owner, 10L,
                new CreateReservationRequest(APPT_DATE)))
                .isInstanceOf(AdmissionDeniedException.class)
                .hasMessage("The user with ID 7 has already made 3 reservations");
        verify(reservationRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("Admins are not subject to the reservation cap")
    void createReservation_AdminBypassesCap() {
        // given
        given(restaurantRepository.findById(10L)).willReturn(Optional.of(restaurant));
        given(reservationRepository.save(any(Reservation.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        reservationService.createReservation(admin, 10L, new CreateReservationRequest(APPT_DATE));

        // then
        verify(reservationRepository, never()).countByUserId(any());
        verify(userRepository, never()).findByIdForUpdate(any());
    }

    @Test
    @DisplayName("Create for a missing restaurant fails with NotFound")
    void createReservation_RestaurantNotFound() {
        // given
        given(restaurantRepository.findById(99L)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> reservationService.createReservation(owner, 99L,
                new CreateReservationRequest(APPT_DATE)))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("No restaurant with the id of 99");
    }

    @Test
    @DisplayName("Create without an appointment date fails with a validation error")
    void createReservation_MissingDate() {
        // when & then
        assertThatThrownBy(() -> reservationService.createReservation(owner, 10L, new CreateReservationRequest()))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(restaurantRepository);
    }

    @Test
    @DisplayName("Update applies a new appointment date for the owner")
    void updateReservation_Success() {
        // given
        Reservation existing = reservation(100L, OWNER_ID);
        LocalDateTime newDate = APPT_DATE.plusDays(3);
        given(reservationRepository.findWithRestaurantById(100L)).willReturn(Optional.of(existing));
        given(reservationRepository.save(existing)).willReturn(existing);

        // when
        ReservationResponse result = reservationService.updateReservation(owner, 100L,
                new UpdateReservationRequest(newDate));

        // then
        assertThat(result.getApptDate()).isEqualTo(newDate);
        assertThat(result.getUser()).isEqualTo(OWNER_ID);
        verify(eventPublisher).publishReservationUpdated(result);
    }

    @Test
    @DisplayName("An empty patch leaves the reservation untouched and publishes nothing")
    void updateReservation_EmptyPatch() {
        // given
        given(reservationRepository.findWithRestaurantById(100L)).willReturn(Optional.of(reservation(100L, OWNER_ID)));

        // when
        ReservationResponse result = reservationService.updateReservation(owner, 100L, new UpdateReservationRequest());

        // then
        assertThat(result.getApptDate()).isEqualTo(APPT_DATE);
        verify(reservationRepository, never()).save(any());
        verify(eventPublisher, never()).publishReservationUpdated(any());
    }

    @Test
    @DisplayName("An explicit null appointment date is rejected")
    void updateReservation_NullDate() {
        // given
        given(reservationRepository.findWithRestaurantById(100L)).willReturn(Optional.of(reservation(100L, OWNER_ID)));

        // when & then
        assertThatThrownBy(() -> reservationService.updateReservation(owner, 100L, new UpdateReservationRequest(null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Update by a non-owner fails with Forbidden and changes nothing")
    void updateReservation_Forbidden() {
        // given
        given(reservationRepository.findWithRestaurantById(100L)).willReturn(Optional.of(reservation(100L, OWNER_ID)));

        // when & then
        assertThatThrownBy(() -> reservationService.updateReservation(other, 100L,
                new UpdateReservationRequest(APPT_DATE.plusDays(1))))
                .isInstanceOf(ForbiddenException.class);
        verify(reservationRepository, never()).save(any());
    }

    @Test
    @DisplayName("Delete by the owner removes the record")
    void deleteReservation_Success() {
        // given
        Reservation existing = reservation(100L, OWNER_ID);
        given(reservationRepository.findWithRestaurantById(100L)).willReturn(Optional.of(existing));

        // when
        reservationService.deleteReservation(owner, 100L);

        // then
        verify(reservationRepository).delete(existing);
        verify(eventPublisher).publishReservationDeleted(any(ReservationResponse.class));
    }

    @Test
    @DisplayName("Delete by a non-owner fails with Forbidden")
    void deleteReservation_Forbidden() {
        // given
        given(reservationRepository.findWithRestaurantById(100L)).willReturn(Optional.of(reservation(100L, OWNER_ID)));

        // when & then
        assertThatThrownBy(() -> reservationService.deleteReservation(other, 100L))
                .isInstanceOf(ForbiddenException.class);
        verify(reservationRepository, never()).delete(any(Reservation.class));
    }
}
