package com.prospectpulse.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Checks the shared API token on {@code /api/**} and {@code /ws/**}, except the
 * health endpoint. The token comes from the X-API-Token header, or from the
 * {@code api_token} query parameter for browser event streams that cannot set
 * headers.
 */
@Component
public class ApiTokenAuthFilter extends OncePerRequestFilter {

    public static final String API_TOKEN_HEADER = "X-API-Token";
    static final String API_TOKEN_PARAM = "api_token";

    @Value("${prospectpulse.api.token:}")
    private String apiToken;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestPath = request.getRequestURI();

        if (!(requestPath.startsWith("/api/") || requestPath.startsWith("/ws/"))
                || requestPath.startsWith("/api/health")) {
            filterChain.doFilter(request, response);
            return;
        }

        // If no token is configured, allow the request (development mode)
        if (apiToken == null || apiToken.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        String providedToken = request.getHeader(API_TOKEN_HEADER);
        if (providedToken == null || providedToken.isBlank()) {
            providedToken = request.getParameter(API_TOKEN_PARAM);
        }

        if (providedToken == null || providedToken.isBlank()) {
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType("application/json");
            response.getWriter().write("{\"error\":\"UNAUTHORIZED\",\"message\":\"Missing X-API-Token header\"}");
            return;
        }

        if (!apiToken.equals(providedToken)) {
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType("application/json");
            response.getWriter().write("{\"error\":\"UNAUTHORIZED\",\"message\":\"Invalid API token\"}");
            return;
        }

        filterChain.doFilter(request, response);
    }
}
