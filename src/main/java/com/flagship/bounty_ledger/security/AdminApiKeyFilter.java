package com.flagship.bounty_ledger.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.exception.GlobalExceptionHandler.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;

/**
 * Gate in front of the admin endpoints. Requests are refused before any controller runs:
 * 503 when no admin key is configured, 401 on a missing or wrong key, 429 over the rate ceiling.
 * The key is accepted from {@code X-API-Key} or {@code Authorization: Bearer}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
public class AdminApiKeyFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "X-API-Key";
    private static final String BEARER_PREFIX = "Bearer ";

    private final BountyProperties properties;
    private final AdminRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public AdminApiKeyFilter(BountyProperties properties, AdminRateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        if (!rateLimiter.tryAcquire(request.getRemoteAddr())) {
            log.warn("Admin rate limit exceeded for {}", request.getRemoteAddr());
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(rateLimiter.retryAfterSeconds()));
            reject(response, HttpStatus.TOO_MANY_REQUESTS, "Too many admin requests, please try again later");
            return;
        }

        BountyProperties.Admin admin = properties.getAdmin();
        if (!admin.isConfigured()) {
            log.warn("Admin API key not set, admin endpoints are disabled");
            reject(response, HttpStatus.SERVICE_UNAVAILABLE, "Admin API not configured");
            return;
        }

        if (!matches(presentedKey(request), admin.getApiKey())) {
            log.warn("Rejected admin request {} {}: invalid API key", request.getMethod(), request.getRequestURI());
            reject(response, HttpStatus.UNAUTHORIZED, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !AdminRoutes.isAdmin(request.getMethod(), pathWithinApplication(request));
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        return contextPath != null && !contextPath.isEmpty() ? uri.substring(contextPath.length()) : uri;
    }

    private static String presentedKey(HttpServletRequest request) {
        String key = request.getHeader(API_KEY_HEADER);
        if (key != null && !key.isBlank()) {
            return key.trim();
        }
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }

    private static boolean matches(String presented, String expected) {
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }

    private void reject(HttpServletResponse response, HttpStatus status, String message) throws IOException {
        ErrorResponse body = ErrorResponse.builder()
            .error(status.getReasonPhrase())
            .message(message)
            .timestamp(Instant.now())
            .build();
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
