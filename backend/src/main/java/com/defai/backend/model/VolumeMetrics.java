package com.defai.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VolumeMetrics(
        @JsonProperty("volume_5m") @PositiveOrZero double volume5m,
        @JsonProperty("volume_1h") @PositiveOrZero double volume1h,
        @JsonProperty("volume_24h") @PositiveOrZero double volume24h,
        @PositiveOrZero double liquidityUsd,
        @PositiveOrZero double price,
        @JsonProperty("price_change_5m") double priceChange5m,
        @JsonProperty("price_change_1h") double priceChange1h,
        @JsonProperty("price_change_24h") double priceChange24h
) {
}
