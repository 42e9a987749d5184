package com.dining.reservation_service.service;

import com.dining.reservation_service.dto.Pagination;
import com.dining.reservation_service.dto.ReservationResponse;
import com.dining.reservation_service.dto.RestaurantDeletedEvent;
import com.dining.reservation_service.dto.RestaurantPage;
import com.dining.reservation_service.dto.RestaurantRequest;
import com.dining.reservation_service.dto.RestaurantResponse;
import com.dining.reservation_service.dto.UpdateRestaurantRequest;
import com.dining.reservation_service.entity.Restaurant;
import com.dining.reservation_service.exception.NotFoundException;
import com.dining.reservation_service.exception.ValidationException;
import com.dining.reservation_service.repository.ReservationRepository;
import com.dining.reservation_service.repository.RestaurantRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service layer for the restaurant catalog
 */
@Service
public class RestaurantService {

    private static final Logger logger = LoggerFactory.getLogger(RestaurantService.class);

    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP = new TypeReference<>() {};

    private final RestaurantRepository restaurantRepository;
    private final ReservationRepository reservationRepository;
    private final ReservationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    public RestaurantService(RestaurantRepository restaurantRepository,
                             ReservationRepository reservationRepository,
                             ReservationEventPublisher eventPublisher,
                             ObjectMapper objectMapper) {
        this.restaurantRepository = restaurantRepository;
        this.reservationRepository = reservationRepository;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
    }

    /**
     * Filtered, sorted and paginated listing. Each restaurant carries its reservations unless select drops them.
     */
    @Transactional(readOnly = true)
    public RestaurantPage getRestaurants(RestaurantQuery query) {
        Page<Restaurant> page = restaurantRepository.findAll(query.toSpecification(), query.toPageable());
        List<Restaurant> restaurants = page.getContent();

        Map<Long, List<ReservationResponse>> reservationsByRestaurant = Collections.emptyMap();
        if (query.includes(RestaurantQuery.RESERVATIONS) && !restaurants.isEmpty()) {
            List<Long> ids = restaurants.stream().map(Restaurant::getId).collect(Collectors.toList());
            reservationsByRestaurant = reservationRepository.findByRestaurantIdIn(ids).stream()
                    .map(ReservationResponse::fromReservation)
                    .collect(Collectors.groupingBy(reservation -> reservation.getRestaurant().getId()));
        }

        Map<Long, List<ReservationResponse>> grouped = reservationsByRestaurant;
        List<Map<String, Object>> rows = restaurants.stream()
                .map(restaurant -> RestaurantResponse.fromRestaurant(restaurant,
                        grouped.getOrDefault(restaurant.getId(), Collections.emptyList())))
                .map(response -> project(response, query))
                .collect(Collectors.toList());

        Pagination pagination = new Pagination(
                page.hasNext() ? new Pagination.PageLink(query.getPage() + 1, query.getLimit()) : null,
                query.getPage() > 1 ? new Pagination.PageLink(query.getPage() - 1, query.getLimit()) : null);

        logger.debug("Listed {} of {} restaurants (page {}, limit {})",
                rows.size(), page.getTotalElements(), query.getPage(), query.getLimit());
        return new RestaurantPage(rows, pagination);
    }

    @Transactional(readOnly = true)
    public RestaurantResponse getRestaurant(Long id) {
        return RestaurantResponse.fromRestaurant(findRestaurant(id));
    }

    @Transactional
    public RestaurantResponse createRestaurant(RestaurantRequest request) {
        String name = request.getName().trim();
        if (restaurantRepository.existsByName(name)) {
            throw ValidationException.forField("name", "Restaurant name '" + name + "' is already taken");
        }

        Restaurant restaurant = new Restaurant(
                name,
                request.getAddress().trim(),
                request.getTel().trim(),
                request.getOpeningHours().trim());
        restaurant = restaurantRepository.save(restaurant);

        logger.info("Restaurant created: {} (ID: {})", restaurant.getName(), restaurant.getId());
        return RestaurantResponse.fromRestaurant(restaurant);
    }

    @Transactional
    public RestaurantResponse updateRestaurant(Long id, UpdateRestaurantRequest request) {
        Restaurant restaurant = findRestaurant(id);

        if (request.getName() != null) {
            String name = request.getName().trim();
            if (restaurantRepository.existsByNameAndIdNot(name, id)) {
                throw ValidationException.forField("name", "Restaurant name '" + name + "' is already taken");
            }
            restaurant.setName(name);
        }
        if (request.getAddress() != null) {
            restaurant.setAddress(request.getAddress().trim());
        }
        if (request.getTel() != null) {
            restaurant.setTel(request.getTel().trim());
        }
        if (request.getOpeningHours() != null) {
            restaurant.setOpeningHours(request.getOpeningHours().trim());
        }

        restaurant = restaurantRepository.save(restaurant);
        logger.info("Restaurant updated: {} (ID: {})", restaurant.getName(), restaurant.getId());
        return RestaurantResponse.fromRestaurant(restaurant);
    }

    /**
     * Delete a restaurant together with every reservation that references it.
     * Both deletes share one transaction, so a failure leaves neither applied.
     */
    @Transactional
    public void deleteRestaurant(Long id) {
        Restaurant restaurant = findRestaurant(id);

        int deletedReservations = reservationRepository.deleteByRestaurantId(id);
        restaurantRepository.delete(restaurant);
        restaurantRepository.flush();

        logger.info("Restaurant deleted: {} (ID: {}), removed {} reservations",
                restaurant.getName(), id, deletedReservations);
        eventPublisher.publishRestaurantDeleted(
                new RestaurantDeletedEvent(id, restaurant.getName(), deletedReservations));
    }

    private Restaurant findRestaurant(Long id) {
        return restaurantRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("No restaurant with the id of " + id));
    }

    private Map<String, Object> project(RestaurantResponse response, RestaurantQuery query) {
        Map<String, Object> fields = objectMapper.convertValue(response, FIELD_MAP);
        if (query.getSelect() != null) {
            fields.keySet().retainAll(query.getSelect());
        }
        return fields;
    }
}
