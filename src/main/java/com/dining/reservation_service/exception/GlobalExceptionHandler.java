package com.dining.reservation_service.exception;

import com.dining.reservation_service.dto.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates exceptions thrown by controllers and services into the response envelope
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(ValidationException e) {
        logger.warn("Validation failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error(e.getMessage(), e.getErrors()));
    }

    @ExceptionHandler(AdmissionDeniedException.class)
    public ResponseEntity<ApiResponse<Void>> handleAdmissionDenied(AdmissionDeniedException e) {
        logger.warn("Admission denied: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler({UnauthorizedException.class, InvalidCredentialsException.class})
    public ResponseEntity<ApiResponse<Void>> handleUnauthorized(RuntimeException e) {
        logger.warn("Authentication failed: {}", e.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ApiResponse<Void>> handleForbidden(ForbiddenException e) {
        logger.warn("Access denied: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(NotFoundException e) {
        logger.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResource(NoResourceFoundException e) {
        logger.warn("Route not found: {}", e.getResourcePath());
        return respond(HttpStatus.NOT_FOUND, ApiResponse.error("Route not found: /" + e.getResourcePath()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        logger.warn("Method not supported: {}", e.getMethod());
        return respond(HttpStatus.NOT_FOUND, ApiResponse.error("Route not found"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidBody(MethodArgumentNotValidException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        String message = errors.values().stream().distinct()
                .reduce((a, b) -> a + ", " + b)
                .orElse("Invalid request body");
        logger.warn("Validation failed: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error(message, errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error("Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        logger.warn("Bad value for {}: {}", e.getName(), e.getValue());
        String message = "Invalid " + e.getName() + ": " + e.getValue();
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error(message, Map.of(e.getName(), message)));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataIntegrity(DataIntegrityViolationException e) {
        logger.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error("Duplicate field value entered"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
        logger.error("Unexpected exception occurred", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ApiResponse.error("Server Error"));
    }

    private ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, ApiResponse<Void> body) {
        return ResponseEntity.status(status).body(body);
    }
}
