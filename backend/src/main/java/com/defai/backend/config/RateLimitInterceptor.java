package com.defai.backend.config;

import com.defai.backend.dto.ApiError;
import com.defai.backend.service.RateLimitService;
import com.defai.backend.service.ratelimit.RateLimitDecision;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Instant;

@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";

    private final RateLimitService rateLimitService;
    private final ObjectMapper objectMapper;

    public RateLimitInterceptor(RateLimitService rateLimitService, ObjectMapper objectMapper) {
        this.rateLimitService = rateLimitService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod()) || !rateLimitService.isEnabled()) {
            return true;
        }
        String clientId = ClientIdResolver.resolve(request);
        RateLimitDecision decision = isScanRequest(request)
                ? rateLimitService.allowScan(clientId)
                : rateLimitService.allowApi(clientId);
        response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        response.setHeader(RESET_HEADER, String.valueOf(decision.reset()));
        if (decision.allowed()) {
            return true;
        }
        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(HttpStatus.TOO_MANY_REQUESTS.value())
                .error(HttpStatus.TOO_MANY_REQUESTS.getReasonPhrase())
                .errorCode(HttpStatus.TOO_MANY_REQUESTS.name())
                .message("Rate limit exceeded")
                .requestId(MDC.get("requestId"))
                .correlationId(MDC.get("correlationId"))
                .details(decision.toDetails())
                .build();
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        objectMapper.writeValue(response.getOutputStream(), error);
        return false;
    }

    private boolean isScanRequest(HttpServletRequest request) {
        return "POST".equalsIgnoreCase(request.getMethod())
                && request.getRequestURI().endsWith("/api/v1/snipe/scan");
    }
}
