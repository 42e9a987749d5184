package com.dining.reservation_service.service;

import com.dining.reservation_service.dto.CreateReservationRequest;
import com.dining.reservation_service.dto.ReservationResponse;
import com.dining.reservation_service.dto.UpdateReservationRequest;
import com.dining.reservation_service.entity.Reservation;
import com.dining.reservation_service.entity.Restaurant;
import com.dining.reservation_service.exception.AdmissionDeniedException;
import com.dining.reservation_service.exception.ForbiddenException;
import com.dining.reservation_service.exception.NotFoundException;
import com.dining.reservation_service.exception.UnauthorizedException;
import com.dining.reservation_service.exception.ValidationException;
import com.dining.reservation_service.repository.ReservationRepository;
import com.dining.reservation_service.repository.RestaurantRepository;
import com.dining.reservation_service.repository.UserRepository;
import com.dining.reservation_service.security.Caller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Service layer for reservation operations.
 * Applies the per-user reservation cap and the owner-or-admin rule on every path; ownership is
 * always taken from the caller's token, never from the request body.
 */
@Service
public class ReservationService {

    private static final Logger logger = LoggerFactory.getLogger(ReservationService.class);

    public static final int DEFAULT_MAX_RESERVATIONS = 3;

    private final ReservationRepository reservationRepository;
    private final RestaurantRepository restaurantRepository;
    private final UserRepository userRepository;
    private final ReservationEventPublisher eventPublisher;
    private final int maxReservationsPerUser;

    public ReservationService(ReservationRepository reservationRepository,
                              RestaurantRepository restaurantRepository,
                              UserRepository userRepository,
                              ReservationEventPublisher eventPublisher,
                              @Value("${app.reservation.max-per-user:3}") int maxReservationsPerUser) {
        this.reservationRepository = reservationRepository;
        this.restaurantRepository = restaurantRepository;
        this.userRepository = userRepository;
        this.eventPublisher = eventPublisher;
        this.maxReservationsPerUser = maxReservationsPerUser;
    }

    /**
     * List reservations visible to the caller.
     * Users only ever see their own; admins see one restaurant's when restaurantId is given, else all.
     */
    @Transactional(readOnly = true)
    public List<ReservationResponse> getReservations(Caller caller, Long restaurantId) {
        List<Reservation> reservations;
        if (!caller.isAdmin()) {
            reservations = reservationRepository.findByUserId(caller.getId());
        } else if (restaurantId != null) {
            reservations = reservationRepository.findByRestaurantId(restaurantId);
        } else {
            reservations = reservationRepository.findAllWithRestaurant();
        }

        logger.debug("Found {} reservations for {}", reservations.size(), caller);
        return reservations.stream()
                .map(ReservationResponse::fromReservation)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ReservationResponse getReservation(Caller caller, Long id) {
        Reservation reservation = findAccessibleReservation(caller, id, "view");
        return ReservationResponse.fromReservation(reservation);
    }

    /**
     * Create a reservation for the caller at a restaurant.
     * For non-admins the caller's user row is locked first, so the count and the insert
     * cannot interleave with another creation by the same user.
     */
    @Transactional
    public ReservationResponse createReservation(Caller caller, Long restaurantId, CreateReservationRequest request) {
        logger.info("Creating reservation for user: {} at restaurant: {}", caller.getId(), restaurantId);

        if (request.getApptDate() == null) {
            throw ValidationException.forField("apptDate", "Please add an appointment date");
        }

        Restaurant restaurant = restaurantRepository.findById(restaurantId)
                .orElseThrow(() -> new NotFoundException("No restaurant with the id of " + restaurantId));

        if (!caller.isAdmin()) {
            userRepository.findByIdForUpdate(caller.getId())
                    .orElseThrow(() -> new UnauthorizedException("No user found with this token"));

            long existing = reservationRepository.countByUserId(caller.getId());
            if (existing >= maxReservationsPerUser) {
                logger.warn("User {} already holds {} reservations", caller.getId(), existing);
                throw new AdmissionDeniedException("The user with ID " + caller.getId()
                        + " has already made " + maxReservationsPerUser + " reservations");
            }
        }

        Reservation reservation = new Reservation(caller.getId(), restaurant, request.getApptDate());
        reservation = reservationRepository.save(reservation);
        logger.info("Reservation created successfully (ID: {})", reservation.getId());

        ReservationResponse response = ReservationResponse.fromReservation(reservation);
        eventPublisher.publishReservationCreated(response);
        return response;
    }

    /**
     * Update a reservation. Only the appointment date can change.
     */
    @Transactional
    public ReservationResponse updateReservation(Caller caller, Long id, UpdateReservationRequest request) {
        logger.info("Updating reservation: {}", id);

        Reservation reservation = findAccessibleReservation(caller, id, "update");

        if (request.isApptDateProvided()) {
            if (request.getApptDate() == null) {
                throw ValidationException.forField("apptDate", "Please add an appointment date");
            }
            reservation.setApptDate(request.getApptDate());
            reservation = reservationRepository.save(reservation);

            logger.info("Reservation updated successfully (ID: {})", reservation.getId());
            ReservationResponse response = ReservationResponse.fromReservation(reservation);
            eventPublisher.publishReservationUpdated(response);
            return response;
        }

        logger.debug("No changes for reservation {}", id);
        return ReservationResponse.fromReservation(reservation);
    }

    @Transactional
    public void deleteReservation(Caller caller, Long id) {
        logger.info("Deleting reservation: {} by user: {} (role: {})", id, caller.getId(), caller.getRole());

        Reservation reservation = findAccessibleReservation(caller, id, "delete");
        ReservationResponse response = ReservationResponse.fromReservation(reservation);

        reservationRepository.delete(reservation);
        logger.info("Reservation deleted successfully (ID: {})", id);
        eventPublisher.publishReservationDeleted(response);
    }

    /**
     * Load a reservation, failing with NotFound when absent and Forbidden when the caller
     * is neither its owner nor an admin
     */
    private Reservation findAccessibleReservation(Caller caller, Long id, String action) {
        Reservation reservation = reservationRepository.findWithRestaurantById(id)
                .orElseThrow(() -> new NotFoundException("No reservation with the id of " + id));

        if (!caller.canAccess(reservation.getUserId())) {
            logger.warn("User {} denied {} on reservation {} owned by {}",
                    caller.getId(), action, id, reservation.getUserId());
            throw new ForbiddenException("User " + caller.getId() + " is not authorized to " + action
                    + " this reservation");
        }
        return reservation;
    }
}
