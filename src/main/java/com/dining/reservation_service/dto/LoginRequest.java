package com.dining.reservation_service.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * DTO for login
 */
public class LoginRequest {

    @NotBlank(message = "Please provide an email and password")
    private String email;

    @NotBlank(message = "Please provide an email and password")
    private String password;

    public LoginRequest() {
    }

    public LoginRequest(String email, String password) {
        this.email = email;
        this.password = password;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }
}
