package com.defai.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StreamStatusResponse(int connections, boolean pushEnabled, long intervalSeconds, String endpoint) {
}
