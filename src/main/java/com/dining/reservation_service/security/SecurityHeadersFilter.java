package com.dining.reservation_service.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Adds standard security headers to every response
 */
public class SecurityHeadersFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        response.setHeader("X-Content-Type-Options", "nosniff");
        response.setHeader("X-Frame-Options", "SAMEORIGIN");
        response.setHeader("X-DNS-Prefetch-Control", "off");
        response.setHeader("Referrer-Policy", "no-referrer");
        response.setHeader("Strict-Transport-Security", "max-age=15552000; includeSubDomains");
        response.setHeader("Cross-Origin-Resource-Policy", "same-origin");
        response.setHeader("X-XSS-Protection", "0");

        // Swagger UI needs inline styles and scripts
        if (!ApiDocsBasicAuthFilter.isDocsPath(request.getRequestURI())) {
            response.setHeader("Content-Security-Policy", "default-src 'self'; frame-ancestors 'self'; object-src 'none'");
        }

        filterChain.doFilter(request, response);
    }
}
