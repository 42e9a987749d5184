package com.dining.reservation_service.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * HTTP basic auth guard for the OpenAPI document and Swagger UI
 */
public class ApiDocsBasicAuthFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(ApiDocsBasicAuthFilter.class);

    private static final String BASIC_PREFIX = "Basic ";

    private final String username;
    private final String password;

    public ApiDocsBasicAuthFilter(String username, String password) {
        this.username = username;
        this.password = password;
    }

    public static boolean isDocsPath(String path) {
        return path.startsWith("/api-docs") || path.startsWith("/swagger-ui");
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !isDocsPath(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (!isAuthorized(request.getHeader(HttpHeaders.AUTHORIZATION))) {
            logger.warn("Rejected API docs request from {}", request.getRemoteAddr());
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"api-docs\"");
            response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
            return;
        }
        filterChain.doFilter(request, response);
    }

    private boolean isAuthorized(String authHeader) {
        if (username == null || username.isEmpty() || password == null || password.isEmpty()) {
            return false;
        }
        if (authHeader == null || !authHeader.startsWith(BASIC_PREFIX)) {
            return false;
        }

        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(authHeader.substring(BASIC_PREFIX.length()).trim()),
                    StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return false;
        }

        int separator = decoded.indexOf(':');
        if (separator < 0) {
            return false;
        }
        boolean userMatches = constantTimeEquals(username, decoded.substring(0, separator));
        boolean passwordMatches = constantTimeEquals(password, decoded.substring(separator + 1));
        return userMatches & passwordMatches;
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}
