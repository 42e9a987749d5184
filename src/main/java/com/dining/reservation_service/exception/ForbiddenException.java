package com.dining.reservation_service.exception;

/**
 * Exception thrown when an authenticated caller is not entitled to the operation
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
