package com.dining.reservation_service.security;

import com.dining.reservation_service.entity.Role;
import com.dining.reservation_service.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Objects;

/**
 * Identity resolved from the session token: user id and role.
 */
public final class Caller {

    public static final String USER_ID_ATTRIBUTE = "userId";
    public static final String USER_ROLE_ATTRIBUTE = "userRole";

    private final Long id;
    private final Role role;

    public Caller(Long id, Role role) {
        this.id = Objects.requireNonNull(id, "id");
        this.role = Objects.requireNonNull(role, "role");
    }

    /**
     * Read the identity that JwtAuthenticationFilter attached to the request
     */
    public static Caller from(HttpServletRequest request) {
        Object userId = request.getAttribute(USER_ID_ATTRIBUTE);
        Object userRole = request.getAttribute(USER_ROLE_ATTRIBUTE);
        if (!(userId instanceof Long) || !(userRole instanceof String)) {
            throw new UnauthorizedException("Not authorized to access this route");
        }
        return new Caller((Long) userId, Role.valueOf((String) userRole));
    }

    public Long getId() {
        return id;
    }

    public Role getRole() {
        return role;
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    /**
     * True when the caller owns the record or is an administrator
     */
    public boolean canAccess(Long ownerId) {
        return isAdmin() || id.equals(ownerId);
    }

    @Override
    public String toString() {
        return "Caller{id=" + id + ", role=" + role + "}";
    }
}
