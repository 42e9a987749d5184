package com.dining.reservation_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Collection;
import java.util.Map;

/**
 * Envelope for every JSON response: {success, data?, count?, pagination?, message?, errors?}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Standard response envelope")
public class ApiResponse<T> {

    private boolean success;
    private Integer count;
    private Pagination pagination;
    private T data;
    private String message;
    private Map<String, String> errors;

    public ApiResponse() {
    }

    public static <T> ApiResponse<T> ok(T data) {
        ApiResponse<T> response = new ApiResponse<>();
        response.success = true;
        response.data = data;
        return response;
    }

    public static <C extends Collection<?>> ApiResponse<C> list(C data) {
        ApiResponse<C> response = ok(data);
        response.count = data.size();
        return response;
    }

    public static <C extends Collection<?>> ApiResponse<C> page(C data, Pagination pagination) {
        ApiResponse<C> response = list(data);
        response.pagination = pagination;
        return response;
    }

    /**
     * Success with an empty object as data, used by delete and logout
     */
    public static ApiResponse<Map<String, Object>> empty() {
        return ok(Map.of());
    }

    public static <T> ApiResponse<T> error(String message) {
        ApiResponse<T> response = new ApiResponse<>();
        response.success = false;
        response.message = message;
        return response;
    }

    public static <T> ApiResponse<T> error(String message, Map<String, String> errors) {
        ApiResponse<T> response = error(message);
        response.errors = errors == null || errors.isEmpty() ? null : errors;
        return response;
    }

    // Getters and Setters
    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public Integer getCount() {
        return count;
    }

    public void setCount(Integer count) {
        this.count = count;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public T getData() {
        return data;
    }

    public void setData(T data) {
        this.data = data;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Map<String, String> getErrors() {
        return errors;
    }

    public void setErrors(Map<String, String> errors) {
        this.errors = errors;
    }
}
