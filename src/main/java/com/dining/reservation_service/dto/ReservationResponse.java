package com.dining.reservation_service.dto;

import com.dining.reservation_service.entity.Reservation;
import com.dining.reservation_service.entity.Restaurant;

import java.time.LocalDateTime;

/**
 * DTO for reservation response.
 * The restaurant is reduced to {id, name, address, tel}.
 */
public class ReservationResponse {

    private Long id;
    private LocalDateTime apptDate;
    private Long user;
    private RestaurantSummary restaurant;
    private LocalDateTime createdAt;

    // Constructors
    public ReservationResponse() {
    }

    /**
     * Map a reservation whose restaurant is already loaded
     */
    public static ReservationResponse fromReservation(Reservation reservation) {
        ReservationResponse response = new ReservationResponse();
        response.id = reservation.getId();
        response.apptDate = reservation.getApptDate();
        response.user = reservation.getUserId();
        response.restaurant = RestaurantSummary.fromRestaurant(reservation.getRestaurant());
        response.createdAt = reservation.getCreatedAt();
        return response;
    }

    // Getters
    public Long getId() {
        return id;
    }

    public LocalDateTime getApptDate() {
        return apptDate;
    }

    public Long getUser() {
        return user;
    }

    public RestaurantSummary getRestaurant() {
        return restaurant;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public static class RestaurantSummary {

        private Long id;
        private String name;
        private String address;
        private String tel;

        public RestaurantSummary() {
        }

        static RestaurantSummary fromRestaurant(Restaurant restaurant) {
            if (restaurant == null) {
                return null;
            }
            RestaurantSummary summary = new RestaurantSummary();
            summary.id = restaurant.getId();
            summary.name = restaurant.getName();
            summary.address = restaurant.getAddress();
            summary.tel = restaurant.getTel();
            return summary;
        }

        public Long getId() {
            return id;
        }

        public String getName() {
            return name;
        }

        public String getAddress() {
            return address;
        }

        public String getTel() {
            return tel;
        }
    }
}
