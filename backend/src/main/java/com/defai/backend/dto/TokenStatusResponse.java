package com.defai.backend.dto;

import com.defai.backend.model.TokenProfile;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TokenStatusResponse(int tokenCount, List<String> tokens, List<TokenProfile> profiles) {
}
