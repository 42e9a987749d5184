package com.dining.reservation_service.exception;

/**
 * Exception thrown when a login password does not match
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String message) {
        super(message);
    }
}
