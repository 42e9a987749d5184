package com.dining.reservation_service.security;

import com.dining.reservation_service.dto.ApiResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Per-client request throttling. Each remote address gets its own limiter.
 */
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitFilter.class);

    private final ClientRateLimiters clientRateLimiters;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(ClientRateLimiters clientRateLimiters, ObjectMapper objectMapper) {
        this.clientRateLimiters = clientRateLimiters;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String client = request.getRemoteAddr();
        RateLimiter rateLimiter = clientRateLimiters.forClient(client);

        if (!rateLimiter.acquirePermission()) {
            logger.warn("Rate limit exceeded for client {} on {} {}", client, request.getMethod(), request.getRequestURI());
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(),
                    ApiResponse.error("Too many requests, please try again later."));
            return;
        }

        filterChain.doFilter(request, response);
    }
}
