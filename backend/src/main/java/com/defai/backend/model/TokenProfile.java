package com.defai.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.time.Instant;

@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TokenProfile(
        String symbol,
        String address,
        String name,
        String dex,
        String poolAddress,
        Instant createdAt
) {
    public static TokenProfile ofSymbol(String symbol, Instant createdAt) {
        return TokenProfile.builder().symbol(symbol).name(symbol).createdAt(createdAt).build();
    }
}
