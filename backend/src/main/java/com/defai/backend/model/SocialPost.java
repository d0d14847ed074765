package com.defai.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SocialPost(
        @NotBlank @Size(max = 2000) String text,
        @PositiveOrZero long likes,
        @PositiveOrZero long retweets,
        @PositiveOrZero long replies,
        Instant postedAt
) {
    public static SocialPost of(String text) {
        return new SocialPost(text, 0, 0, 0, null);
    }
}
