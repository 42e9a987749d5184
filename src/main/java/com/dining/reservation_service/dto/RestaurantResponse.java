package com.dining.reservation_service.dto;

import com.dining.reservation_service.entity.Restaurant;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.List;

/**
 * DTO for restaurant response. {@code reservations} is only filled in listings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RestaurantResponse {

    private Long id;
    private String name;
    private String address;
    private String tel;
    private String openingHours;
    private LocalDateTime createdAt;
    private List<ReservationResponse> reservations;

    public RestaurantResponse() {
    }

    public static RestaurantResponse fromRestaurant(Restaurant restaurant) {
        RestaurantResponse response = new RestaurantResponse();
        response.id = restaurant.getId();
        response.name = restaurant.getName();
        response.address = restaurant.getAddress();
        response.tel = restaurant.getTel();
        response.openingHours = restaurant.getOpeningHours();
        response.createdAt = restaurant.getCreatedAt();
        return response;
    }

    public static RestaurantResponse fromRestaurant(Restaurant restaurant, List<ReservationResponse> reservations) {
        RestaurantResponse response = fromRestaurant(restaurant);
        response.reservations = reservations;
        return response;
    }

    // Getters
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

    public String getOpeningHours() {
        return openingHours;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public List<ReservationResponse> getReservations() {
        return reservations;
    }
}
