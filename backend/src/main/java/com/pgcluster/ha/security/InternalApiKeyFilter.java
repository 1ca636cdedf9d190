package com.pgcluster.ha.security;

import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the cluster management endpoints with a static API key shared by the nodes'
 * operator tooling.
 */
@Slf4j
@Component
public class InternalApiKeyFilter extends OncePerRequestFilter {

    static final String API_KEY_HEADER = "X-Internal-Api-Key";
    static final String PROTECTED_PREFIX = "/internal/";
    private static final int MIN_KEY_LENGTH = 32;

    @Value("${security.internal-api-key:}")
    private String internalApiKey;

    @PostConstruct
    public void init() {
        if (internalApiKey == null || internalApiKey.isBlank()) {
            throw new IllegalStateException(
                    "INTERNAL_API_KEY environment variable must be set. " +
                    "Generate a secure random string for cluster API authentication.");
        }
        if (internalApiKey.length() < MIN_KEY_LENGTH) {
            throw new IllegalStateException(
                    "INTERNAL_API_KEY must be at least " + MIN_KEY_LENGTH + " characters. " +
                    "Current length: " + internalApiKey.length());
        }
        log.info("Internal API key filter initialized");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String requestUri = request.getRequestURI();

        if (requestUri.startsWith(PROTECTED_PREFIX)) {
            String providedKey = extractApiKey(request);

            if (providedKey == null || providedKey.isBlank()) {
                log.warn("Missing API key for cluster endpoint: {} from IP: {}",
                        requestUri, request.getRemoteAddr());
                reject(response, "Missing API key. Use X-Internal-Api-Key header or Authorization: Bearer");
                return;
            }

            if (!MessageDigest.isEqual(internalApiKey.getBytes(StandardCharsets.UTF_8),
                    providedKey.getBytes(StandardCharsets.UTF_8))) {
                log.warn("Invalid API key for cluster endpoint: {} from IP: {}",
                        requestUri, request.getRemoteAddr());
                reject(response, "Invalid API key");
                return;
            }

            log.debug("Internal API key validated for: {}", requestUri);
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, String error) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\":\"" + error + "\"}");
    }

    /**
     * API key from the X-Internal-Api-Key header, falling back to Authorization: Bearer.
     */
    private String extractApiKey(HttpServletRequest request) {
        String apiKey = request.getHeader(API_KEY_HEADER);
        if (apiKey != null && !apiKey.isBlank()) {
            return apiKey;
        }

        String authHeader = request.getHeader("Authorization");
        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            return authHeader.substring(7);
        }

        return null;
    }
}
