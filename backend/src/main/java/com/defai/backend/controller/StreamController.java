package com.defai.backend.controller;

import com.defai.backend.config.OracleProperties;
import com.defai.backend.config.WebSocketConfig;
import com.defai.backend.dto.StreamStatusResponse;
import com.defai.backend.service.stream.BroadcastHub;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/stream")
@RequiredArgsConstructor
@Tag(name = "Stream")
public class StreamController {

    private final BroadcastHub hub;
    private final OracleProperties properties;

    @GetMapping("/status")
    @Operation(summary = "Sentiment stream subscriber count")
    public ResponseEntity<StreamStatusResponse> status() {
        OracleProperties.Stream stream = properties.getStream();
        return ResponseEntity.ok(new StreamStatusResponse(hub.connectionCount(), stream.isEnabled(),
                stream.getIntervalSeconds(), WebSocketConfig.SENTIMENT_STREAM_PATH));
    }
}
