package com.defai.backend.controller;

import com.defai.backend.config.ClientIdResolver;
import com.defai.backend.dto.RateLimitStatsResponse;
import com.defai.backend.service.RateLimitService;
import com.defai.backend.service.ratelimit.RateLimitDecision;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/rate-limit")
@RequiredArgsConstructor
@Tag(name = "Rate limit")
public class RateLimitController {

    private final RateLimitService rateLimitService;

    @GetMapping("/stats")
    @Operation(summary = "Caller's current rate-limit standing")
    public ResponseEntity<RateLimitStatsResponse> stats(HttpServletRequest request) {
        String clientId = ClientIdResolver.resolve(request);
        RateLimitDecision decision = rateLimitService.peekApi(clientId);
        return ResponseEntity.ok(new RateLimitStatsResponse(clientId, decision.limit(), decision.remaining(),
                decision.reset()));
    }
}
