package com.dining.reservation_service.service;

import com.dining.reservation_service.dto.LoginRequest;
import com.dining.reservation_service.dto.RegisterRequest;
import com.dining.reservation_service.dto.UserResponse;
import com.dining.reservation_service.entity.Role;
import com.dining.reservation_service.entity.User;
import com.dining.reservation_service.exception.InvalidCredentialsException;
import com.dining.reservation_service.exception.NotFoundException;
import com.dining.reservation_service.exception.ValidationException;
import com.dining.reservation_service.repository.UserRepository;
import com.dining.reservation_service.security.JwtTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Service layer for registration, login and current-user lookup
 */
@Service
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider tokenProvider;

    public AuthService(UserRepository userRepository,
                       PasswordEncoder passwordEncoder,
                       JwtTokenProvider tokenProvider) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenProvider = tokenProvider;
    }

    /**
     * Create a user and return a session token for it
     */
    @Transactional
    public String register(RegisterRequest request) {
        String email = normalizeEmail(request.getEmail());
        if (userRepository.existsByEmail(email)) {
            throw ValidationException.forField("email", "Email is already registered");
        }

        User user = new User(
                request.getName().trim(),
                request.getTel().trim(),
                email,
                passwordEncoder.encode(request.getPassword()),
                request.getRole() != null ? request.getRole() : Role.USER);

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // unique index caught a concurrent registration
            throw ValidationException.forField("email", "Email is already registered");
        }

        logger.info("Registered user {} with role {}", user.getId(), user.getRole());
        return tokenProvider.generateToken(user);
    }

    /**
     * Check the credentials and return a session token
     */
    @Transactional(readOnly = true)
    public String login(LoginRequest request) {
        String email = normalizeEmail(request.getEmail());

        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new NotFoundException("User not found"));

        // BCrypt comparison is constant-time
        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            logger.warn("Invalid password for user {}", user.getId());
            throw new InvalidCredentialsException("Invalid credentials");
        }

        logger.info("User {} logged in", user.getId());
        return tokenProvider.generateToken(user);
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(Long id) {
        return userRepository.findById(id)
                .map(UserResponse::fromUser)
                .orElseThrow(() -> new NotFoundException("No user with the id of " + id));
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
