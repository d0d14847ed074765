package com.defai.backend.service.ratelimit;

import com.defai.backend.dto.ApiErrorDetail;

import java.util.List;

/**
 * Outcome of one admission check. {@code reset} is in epoch seconds.
 */
public record RateLimitDecision(boolean allowed, int limit, int remaining, long reset, long retryAfterSeconds) {

    public List<ApiErrorDetail> toDetails() {
        return List.of(
                ApiErrorDetail.builder().field("limit").issue(String.valueOf(limit)).build(),
                ApiErrorDetail.builder().field("remaining").issue(String.valueOf(remaining)).build(),
                ApiErrorDetail.builder().field("reset").issue(String.valueOf(reset)).build()
        );
    }
}
