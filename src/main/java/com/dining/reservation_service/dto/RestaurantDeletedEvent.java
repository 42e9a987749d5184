package com.dining.reservation_service.dto;

/**
 * Event payload published after a restaurant and its reservations are deleted
 */
public class RestaurantDeletedEvent {

    private Long restaurantId;
    private String name;
    private int deletedReservations;

    public RestaurantDeletedEvent() {
    }

    public RestaurantDeletedEvent(Long restaurantId, String name, int deletedReservations) {
        this.restaurantId = restaurantId;
        this.name = name;
        this.deletedReservations = deletedReservations;
    }

    public Long getRestaurantId() {
        return restaurantId;
    }

    public String getName() {
        return name;
    }

    public int getDeletedReservations() {
        return deletedReservations;
    }
}
