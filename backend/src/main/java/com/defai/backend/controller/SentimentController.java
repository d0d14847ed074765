package com.defai.backend.controller;

import com.defai.backend.config.OracleProperties;
import com.defai.backend.dto.DataResponse;
import com.defai.backend.dto.MessageResponse;
import com.defai.backend.dto.ScoreStatsRequest;
import com.defai.backend.dto.ScoreStatsResponse;
import com.defai.backend.dto.SentimentHistoryView;
import com.defai.backend.dto.SentimentSummary;
import com.defai.backend.model.TokenSentiment;
import com.defai.backend.service.SentimentPipelineService;
import com.defai.backend.service.SentimentQueryService;
import com.defai.backend.service.TokenRegistry;
import com.defai.backend.service.history.SentimentAggregator;
import com.defai.backend.service.history.SentimentHistoryRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/sentiment")
@RequiredArgsConstructor
@Validated
@Tag(name = "Sentiment")
public class SentimentController {

    private final SentimentQueryService queryService;
    private final SentimentPipelineService pipelineService;
    private final SentimentHistoryRegistry historyRegistry;
    private final SentimentAggregator aggregator;
    private final TokenRegistry tokenRegistry;
    private final OracleProperties properties;
    private final Clock clock;

    @GetMapping("/{token}")
    @Operation(summary = "Latest sentiment for a token (cache-aside)")
    public ResponseEntity<DataResponse<TokenSentiment>> token(@PathVariable String token,
                                                              @RequestParam(defaultValue = "true") boolean useCache) {
        String symbol = tokenRegistry.requireTracked(token);
        return ResponseEntity.ok(DataResponse.of(queryService.tokenSentiment(symbol, useCache), clock.instant()));
    }

    @GetMapping
    @Operation(summary = "Latest sentiment for all tracked tokens")
    public ResponseEntity<DataResponse<Map<String, TokenSentiment>>> all(
            @RequestParam(defaultValue = "true") boolean useCache) {
        return ResponseEntity.ok(DataResponse.of(queryService.allSentiments(useCache), clock.instant()));
    }

    @GetMapping("/summary")
    @Operation(summary = "Summary of the latest recorded sentiment per tracked token")
    public ResponseEntity<SentimentSummary> summary() {
        return ResponseEntity.ok(pipelineService.summary());
    }

    @GetMapping("/{token}/history")
    @Operation(summary = "Recorded sentiment history within a lookback window")
    public ResponseEntity<DataResponse<SentimentHistoryView>> history(@PathVariable String token,
                                                                      @RequestParam(defaultValue = "24") @Min(1) @Max(720) int hours) {
        String symbol = tokenRegistry.requireTracked(token);
        return ResponseEntity.ok(DataResponse.of(queryService.history(symbol, hours), clock.instant()));
    }

    @GetMapping("/export")
    @Operation(summary = "Export the full sentiment history of every token")
    public ResponseEntity<SentimentHistoryRegistry.HistoryExport> export() {
        return ResponseEntity.ok(historyRegistry.export());
    }

    @PostMapping("/export")
    @Operation(summary = "Write a snapshot of the full sentiment history to the export directory")
    public ResponseEntity<MessageResponse> exportToFile() {
        String fileName = "sentiment_history_" + clock.instant().getEpochSecond() + ".json";
        Path target = historyRegistry.exportTo(Path.of(properties.getSentiment().getExportDirectory(), fileName));
        return ResponseEntity.ok(MessageResponse.ok("History exported to " + target));
    }

    @PostMapping("/stats")
    @Operation(summary = "Statistics, outliers and trend over a batch of scores")
    public ResponseEntity<ScoreStatsResponse> stats(@Valid @RequestBody ScoreStatsRequest request) {
        List<Double> scores = request.getScores();
        return ResponseEntity.ok(new ScoreStatsResponse(
                aggregator.aggregate(scores),
                aggregator.detectOutliers(scores),
                aggregator.trend(scores)));
    }
}
