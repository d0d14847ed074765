package com.defai.backend.controller;

import com.defai.backend.dto.DataResponse;
import com.defai.backend.model.SnipeSignal;
import com.defai.backend.service.SentimentQueryService;
import com.defai.backend.service.SniperService;
import com.defai.backend.service.TokenRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/api/v1/snipe")
@RequiredArgsConstructor
@Tag(name = "Snipe")
public class SnipeController {

    private final SentimentQueryService queryService;
    private final SniperService sniperService;
    private final TokenRegistry tokenRegistry;
    private final Clock clock;

    @GetMapping("/{token}")
    @Operation(summary = "Composite snipe signal for a token (cache-aside)")
    public ResponseEntity<DataResponse<SnipeSignal>> token(@PathVariable String token,
                                                           @RequestParam(defaultValue = "true") boolean useCache) {
        String symbol = tokenRegistry.requireTracked(token);
        return ResponseEntity.ok(DataResponse.of(queryService.snipe(symbol, useCache), clock.instant()));
    }

    @PostMapping("/scan")
    @Operation(summary = "Score every tracked token, best first")
    public ResponseEntity<DataResponse<List<SnipeSignal>>> scan() {
        return ResponseEntity.ok(DataResponse.ok(sniperService.scan(), clock.instant()));
    }
}
