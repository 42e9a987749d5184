package com.dining.reservation_service.exception;

/**
 * Exception thrown when a referenced restaurant, reservation or user does not exist
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
