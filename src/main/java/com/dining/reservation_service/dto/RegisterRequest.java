package com.dining.reservation_service.dto;

import com.dining.reservation_service.entity.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * DTO for user registration
 */
public class RegisterRequest {

    @NotBlank(message = "Please add a name")
    private String name;

    @NotBlank(message = "Please add a telephone number")
    private String tel;

    @NotBlank(message = "Please add an email")
    @Email(message = "Please add a valid email")
    private String email;

    @NotBlank(message = "Please add a password")
    @Size(min = 6, message = "Password must be at least 6 characters")
    private String password;

    private Role role;

    // Getters and Setters
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTel() {
        return tel;
    }

    public void setTel(String tel) {
        this.tel = tel;
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

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }
}
