package com.defai.backend.controller;

import com.defai.backend.dto.MessageResponse;
import com.defai.backend.service.TokenRegistry;
import com.defai.backend.service.cache.CacheStats;
import com.defai.backend.service.cache.SentimentCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/cache")
@RequiredArgsConstructor
@Tag(name = "Cache")
public class CacheController {

    private final SentimentCache sentimentCache;

    @PostMapping("/invalidate/{token}")
    @Operation(summary = "Invalidate cached results for a token")
    public ResponseEntity<MessageResponse> invalidate(@PathVariable String token) {
        String symbol = TokenRegistry.normalize(token);
        sentimentCache.invalidateToken(symbol);
        return ResponseEntity.ok(MessageResponse.ok("Cache invalidated for " + symbol));
    }

    @PostMapping("/clear")
    @Operation(summary = "Clear all cached results")
    public ResponseEntity<MessageResponse> clear() {
        sentimentCache.invalidateAll();
        return ResponseEntity.ok(MessageResponse.ok("All cache cleared"));
    }

    @GetMapping("/stats")
    @Operation(summary = "Cache statistics")
    public ResponseEntity<CacheStats> stats() {
        return ResponseEntity.ok(sentimentCache.stats());
    }
}
