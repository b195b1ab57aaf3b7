package com.modellifecycle.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Component
public class RequestGuardFilter extends OncePerRequestFilter {

    static final String WEBHOOK_PATH = "/api/v1/alerts/";

    @Value("${security.api-key.enabled:false}")
    private boolean apiKeyEnabled;

    @Value("${security.api-key.header:X-API-Key}")
    private String apiKeyHeader;

    @Value("${security.api-key.values:}")
    private String apiKeyValues;

    @Value("${security.webhook.token:}")
    private String webhookToken;

    @Value("${security.webhook.header:X-Webhook-Token}")
    private String webhookHeader;

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return !path.startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = resolveRequestId(request);
        response.setHeader("X-Request-ID", requestId);

        if (apiKeyEnabled && !isValidApiKey(request.getHeader(apiKeyHeader))) {
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED,
                    "Unauthorized", "Missing or invalid API key", request.getRequestURI(), requestId);
            return;
        }

        if (request.getRequestURI().startsWith(WEBHOOK_PATH) && !isValidWebhookToken(request.getHeader(webhookHeader))) {
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED,
                    "Unauthorized", "Missing or invalid webhook token", request.getRequestURI(), requestId);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private boolean isValidApiKey(String provided) {
        if (provided == null || provided.isBlank()) {
            return false;
        }
        Set<String> allowed = Arrays.stream(apiKeyValues.split(","))
                .map(String::trim)
                .filter(v -> !v.isBlank())
                .collect(Collectors.toSet());
        return !allowed.isEmpty() && allowed.contains(provided);
    }

    // no token configured means the webhook is open
    private boolean isValidWebhookToken(String provided) {
        if (webhookToken == null || webhookToken.isBlank()) {
            return true;
        }
        return provided != null && MessageDigest.isEqual(
                webhookToken.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String existing = request.getHeader("X-Request-ID");
        return (existing != null && !existing.isBlank()) ? existing : UUID.randomUUID().toString();
    }

    private void writeError(HttpServletResponse response, int status, String error, String message,
                            String path, String requestId) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        Map<String, Object> body = Map.of(
                "status", status,
                "error", error,
                "errorCode", "UNAUTHORIZED",
                "message", message,
                "path", path,
                "requestId", requestId,
                "timestamp", Instant.now().toString()
        );
        mapper.writeValue(response.getWriter(), body);
        log.warn("{} | status={} | path={} | requestId={}", message, status, path, requestId);
    }
}
