package com.dining.reservation_service.security;

import com.dining.reservation_service.dto.ApiResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * JWT Authentication Filter.
 * Resolves the bearer token (Authorization header, then the "token" cookie) into userId/userRole
 * request attributes and rejects protected API calls that carry no valid token.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    public static final String API_PREFIX = "/api/v1";
    public static final String TOKEN_COOKIE = "token";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String CLEARED_TOKEN = "none";

    private static final List<PublicEndpoint> PUBLIC_ENDPOINTS = List.of(
            new PublicEndpoint(HttpMethod.POST, API_PREFIX + "/auth/register"),
            new PublicEndpoint(HttpMethod.POST, API_PREFIX + "/auth/login"),
            new PublicEndpoint(HttpMethod.GET, API_PREFIX + "/restaurants"),
            new PublicEndpoint(HttpMethod.GET, API_PREFIX + "/restaurants/{id}")
    );

    private final JwtTokenProvider tokenProvider;
    private final ObjectMapper objectMapper;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public JwtAuthenticationFilter(JwtTokenProvider tokenProvider, ObjectMapper objectMapper) {
        this.tokenProvider = tokenProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(API_PREFIX)
                || HttpMethod.OPTIONS.matches(request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Optional<Caller> caller = extractToken(request).flatMap(tokenProvider::parseToken);

        if (caller.isPresent()) {
            request.setAttribute(Caller.USER_ID_ATTRIBUTE, caller.get().getId());
            request.setAttribute(Caller.USER_ROLE_ATTRIBUTE, caller.get().getRole().name());
        } else if (!isPublicEndpoint(request)) {
            logger.warn("Rejected unauthenticated request: {} {}", request.getMethod(), request.getRequestURI());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(),
                    ApiResponse.error("Not authorized to access this route"));
            return;
        }

        filterChain.doFilter(request, response);
    }

    private Optional<String> extractToken(HttpServletRequest request) {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return Optional.of(token);
            }
        }

        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (TOKEN_COOKIE.equals(cookie.getName())
                        && cookie.getValue() != null
                        && !cookie.getValue().isBlank()
                        && !CLEARED_TOKEN.equals(cookie.getValue())) {
                    return Optional.of(cookie.getValue());
                }
            }
        }
        return Optional.empty();
    }

    private boolean isPublicEndpoint(HttpServletRequest request) {
        String path = request.getRequestURI();
        for (PublicEndpoint endpoint : PUBLIC_ENDPOINTS) {
            if (endpoint.method.matches(request.getMethod()) && pathMatcher.match(endpoint.pattern, path)) {
                return true;
            }
        }
        return false;
    }

    private static final class PublicEndpoint {
        private final HttpMethod method;
        private final String pattern;

        private PublicEndpoint(HttpMethod method, String pattern) {
            this.method = method;
            this.pattern = pattern;
        }
    }
}
