package com.dining.reservation_service.exception;

/**
 * Exception thrown when a reservation would exceed the per-user cap
 */
public class AdmissionDeniedException extends RuntimeException {

    public AdmissionDeniedException(String message) {
        super(message);
    }
}
