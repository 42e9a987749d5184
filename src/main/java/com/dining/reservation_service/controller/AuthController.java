package com.dining.reservation_service.controller;

import com.dining.reservation_service.dto.ApiResponse;
import com.dining.reservation_service.dto.LoginRequest;
import com.dining.reservation_service.dto.RegisterRequest;
import com.dining.reservation_service.dto.TokenResponse;
import com.dining.reservation_service.dto.UserResponse;
import com.dining.reservation_service.security.Caller;
import com.dining.reservation_service.security.JwtAuthenticationFilter;
import com.dining.reservation_service.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

/**
 * Controller for authentication endpoints.
 * Issued tokens are returned in the body and also set as the "token" cookie.
 */
@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Auth", description = "Registration, login and session")
public class AuthController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);
    private static final String CLEARED_TOKEN = "none";
    private static final Duration LOGOUT_COOKIE_TTL = Duration.ofSeconds(10);

    private final AuthService authService;
    private final Duration cookieTtl;
    private final boolean secureCookie;

    public AuthController(AuthService authService,
                          @Value("${app.jwt.cookie-expire-days:30}") long cookieExpireDays,
                          Environment environment) {
        this.authService = authService;
        this.cookieTtl = Duration.ofDays(cookieExpireDays);
        this.secureCookie = environment.acceptsProfiles(Profiles.of("production"));
    }

    /**
     * Register a new user
     * POST /api/v1/auth/register
     * Authorization: PUBLIC
     */
    @PostMapping("/register")
    @Operation(summary = "Register a user")
    public ResponseEntity<TokenResponse> register(@Valid @RequestBody RegisterRequest request) {
        String token = authService.register(request);
        return tokenResponse(HttpStatus.CREATED, token);
    }

    /**
     * Log in with email and password
     * POST /api/v1/auth/login
     * Authorization: PUBLIC
     */
    @PostMapping("/login")
    @Operation(summary = "Log in")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        String token = authService.login(request);
        return tokenResponse(HttpStatus.OK, token);
    }

    /**
     * Get the current user
     * GET /api/v1/auth/me
     * Authorization: AUTHENTICATED
     */
    @GetMapping("/me")
    @Operation(summary = "Get the logged in user")
    public ResponseEntity<ApiResponse<UserResponse>> getMe(HttpServletRequest httpRequest) {
        Caller caller = Caller.from(httpRequest);
        return ResponseEntity.ok(ApiResponse.ok(authService.getUser(caller.getId())));
    }

    /**
     * Log out by overwriting the token cookie
     * GET /api/v1/auth/logout
     * Authorization: AUTHENTICATED
     */
    @GetMapping("/logout")
    @Operation(summary = "Log out and clear the token cookie")
    public ResponseEntity<ApiResponse<Map<String, Object>>> logout(HttpServletRequest httpRequest) {
        Caller caller = Caller.from(httpRequest);
        logger.info("User {} logged out", caller.getId());

        ResponseCookie cookie = ResponseCookie.from(JwtAuthenticationFilter.TOKEN_COOKIE, CLEARED_TOKEN)
                .httpOnly(true)
                .path("/")
                .maxAge(LOGOUT_COOKIE_TTL)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(ApiResponse.empty());
    }

    private ResponseEntity<TokenResponse> tokenResponse(HttpStatus status, String token) {
        ResponseCookie cookie = ResponseCookie.from(JwtAuthenticationFilter.TOKEN_COOKIE, token)
                .httpOnly(true)
                .secure(secureCookie)
                .path("/")
                .maxAge(cookieTtl)
                .build();
        return ResponseEntity.status(status)
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(new TokenResponse(token));
    }
}
