package com.defai.backend.controller;

import com.defai.backend.dto.MessageResponse;
import com.defai.backend.dto.PostsRequest;
import com.defai.backend.model.DevWalletMetrics;
import com.defai.backend.model.LiquidityMetrics;
import com.defai.backend.model.VolumeMetrics;
import com.defai.backend.service.TokenRegistry;
import com.defai.backend.service.cache.SentimentCache;
import com.defai.backend.service.source.ObservationStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingestion of point-in-time observations read by the default signal sources. Recording an
 * observation invalidates the token's cached results.
 */
@RestController
@RequestMapping("/api/v1/tokens/{symbol}")
@RequiredArgsConstructor
@Tag(name = "Observations")
public class ObservationController {

    private final TokenRegistry tokenRegistry;
    private final ObservationStore observationStore;
    private final SentimentCache sentimentCache;

    @PostMapping("/posts")
    @Operation(summary = "Record social posts")
    public ResponseEntity<MessageResponse> posts(@PathVariable String symbol, @Valid @RequestBody PostsRequest request) {
        String token = tokenRegistry.requireTracked(symbol);
        int retained = observationStore.recordPosts(token, request.getPosts());
        sentimentCache.invalidateToken(token);
        return ResponseEntity.ok(MessageResponse.ok("Recorded " + request.getPosts().size() + " posts for " + token
                + " (" + retained + " retained)"));
    }

    @PostMapping("/volume")
    @Operation(summary = "Record volume and price metrics")
    public ResponseEntity<MessageResponse> volume(@PathVariable String symbol, @Valid @RequestBody VolumeMetrics metrics) {
        String token = tokenRegistry.requireTracked(symbol);
        observationStore.recordVolume(token, metrics);
        sentimentCache.invalidateToken(token);
        return ResponseEntity.ok(MessageResponse.ok("Recorded volume metrics for " + token));
    }

    @PostMapping("/liquidity")
    @Operation(summary = "Record pool liquidity")
    public ResponseEntity<MessageResponse> liquidity(@PathVariable String symbol,
                                                     @Valid @RequestBody LiquidityMetrics metrics) {
        String token = tokenRegistry.requireTracked(symbol);
        observationStore.recordLiquidity(token, metrics);
        sentimentCache.invalidateToken(token);
        return ResponseEntity.ok(MessageResponse.ok("Recorded liquidity for " + token));
    }

    @PostMapping("/wallets")
    @Operation(summary = "Record developer wallet balances")
    public ResponseEntity<MessageResponse> wallets(@PathVariable String symbol,
                                                   @Valid @RequestBody DevWalletMetrics metrics) {
        String token = tokenRegistry.requireTracked(symbol);
        observationStore.recordWallets(token, metrics);
        sentimentCache.invalidateToken(token);
        return ResponseEntity.ok(MessageResponse.ok("Recorded " + metrics.balances().size() + " dev wallets for " + token));
    }
}
