package com.dining.reservation_service.exception;

/**
 * Exception thrown when a protected operation is called without a valid session token
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
