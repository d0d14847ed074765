package com.defai.backend.controller;

import com.defai.backend.dto.MessageResponse;
import com.defai.backend.dto.TokenRequest;
import com.defai.backend.dto.TokenStatusResponse;
import com.defai.backend.model.TokenProfile;
import com.defai.backend.service.TokenRegistry;
import com.defai.backend.service.cache.SentimentCache;
import com.defai.backend.service.history.SentimentHistoryRegistry;
import com.defai.backend.service.source.ObservationStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tokens")
@RequiredArgsConstructor
@Tag(name = "Tokens")
public class TokenController {

    private final TokenRegistry tokenRegistry;
    private final SentimentCache sentimentCache;
    private final ObservationStore observationStore;
    private final SentimentHistoryRegistry historyRegistry;

    @GetMapping
    @Operation(summary = "List tracked tokens")
    public ResponseEntity<TokenStatusResponse> list() {
        return ResponseEntity.ok(new TokenStatusResponse(tokenRegistry.tokens().size(), tokenRegistry.tokens(),
                tokenRegistry.profiles()));
    }

    @GetMapping("/{symbol}")
    @Operation(summary = "Get a tracked token's metadata")
    public ResponseEntity<TokenProfile> get(@PathVariable String symbol) {
        String normalized = tokenRegistry.requireTracked(symbol);
        return ResponseEntity.ok(tokenRegistry.profile(normalized).orElseThrow());
    }

    @PostMapping("/{symbol}")
    @Operation(summary = "Track a token or update its metadata")
    public ResponseEntity<MessageResponse> add(@PathVariable String symbol,
                                               @Valid @RequestBody(required = false) TokenRequest request) {
        TokenRequest body = request == null ? new TokenRequest() : request;
        TokenProfile profile = TokenProfile.builder()
                .symbol(symbol)
                .address(body.getAddress())
                .name(body.getName())
                .dex(body.getDex())
                .poolAddress(body.getPoolAddress())
                .build();
        boolean added = tokenRegistry.add(profile);
        String normalized = TokenRegistry.normalize(symbol);
        return ResponseEntity.ok(MessageResponse.ok(added
                ? "Token " + normalized + " added"
                : "Token " + normalized + " updated"));
    }

    @DeleteMapping("/{symbol}")
    @Operation(summary = "Stop tracking a token")
    public ResponseEntity<MessageResponse> remove(@PathVariable String symbol) {
        String normalized = tokenRegistry.requireTracked(symbol);
        tokenRegistry.remove(normalized);
        sentimentCache.invalidateToken(normalized);
        observationStore.forget(normalized);
        historyRegistry.remove(normalized);
        return ResponseEntity.ok(MessageResponse.ok("Token " + normalized + " removed"));
    }
}
