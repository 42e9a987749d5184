package com.dining.reservation_service.dto;

import com.dining.reservation_service.entity.Role;
import com.dining.reservation_service.entity.User;

import java.time.LocalDateTime;

/**
 * DTO for user response. The password hash is never exposed.
 */
public class UserResponse {

    private Long id;
    private String name;
    private String tel;
    private String email;
    private Role role;
    private LocalDateTime createdAt;

    public UserResponse() {
    }

    public static UserResponse fromUser(User user) {
        UserResponse response = new UserResponse();
        response.id = user.getId();
        response.name = user.getName();
        response.tel = user.getTel();
        response.email = user.getEmail();
        response.role = user.getRole();
        response.createdAt = user.getCreatedAt();
        return response;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getTel() {
        return tel;
    }

    public String getEmail() {
        return email;
    }

    public Role getRole() {
        return role;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}
