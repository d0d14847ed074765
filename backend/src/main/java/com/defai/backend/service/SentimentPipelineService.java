package com.defai.backend.service;

import com.defai.backend.dto.SentimentSummary;
import com.defai.backend.model.ClassifiedPost;
import com.defai.backend.model.SignalResult;
import com.defai.backend.model.SocialPost;
import com.defai.backend.model.TokenSentiment;
import com.defai.backend.service.cache.SentimentCache;
import com.defai.backend.service.history.SentimentHistory;
import com.defai.backend.service.history.SentimentHistoryRegistry;
import com.defai.backend.service.scoring.SentimentScorer;
import com.defai.backend.service.sentiment.SentimentClassifier;
import com.defai.backend.service.source.GuardedSourceClient;
import com.defai.backend.service.source.SignalSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fetches recent posts, classifies them, scores the batch and records the snapshot into the
 * token's history and the cache. Degraded inputs produce the neutral fallback, which is
 * returned to the caller but never recorded.
 */
@Slf4j
@Service
public class SentimentPipelineService {

    static final String SOCIAL_SOURCE = "social";
    static final String CLASSIFIER_SOURCE = "classifier";

    private final SignalSource<List<SocialPost>> socialPostSource;
    private final SentimentClassifier classifier;
    private final GuardedSourceClient guardedSourceClient;
    private final SentimentScorer scorer;
    private final SentimentHistoryRegistry historyRegistry;
    private final SentimentCache sentimentCache;
    private final TokenRegistry tokenRegistry;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final Executor analysisExecutor;

    public SentimentPipelineService(SignalSource<List<SocialPost>> socialPostSource,
                                    SentimentClassifier classifier,
                                    GuardedSourceClient guardedSourceClient,
                                    SentimentScorer scorer,
                                    SentimentHistoryRegistry historyRegistry,
                                    SentimentCache sentimentCache,
                                    TokenRegistry tokenRegistry,
                                    EngineMetrics metrics,
                                    Clock clock,
                                    @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.socialPostSource = socialPostSource;
        this.classifier = classifier;
        this.guardedSourceClient = guardedSourceClient;
        this.scorer = scorer;
        this.historyRegistry = historyRegistry;
        this.sentimentCache = sentimentCache;
        this.tokenRegistry = tokenRegistry;
        this.metrics = metrics;
        this.clock = clock;
        this.analysisExecutor = analysisExecutor;
    }

    /**
     * Recent posts for the token with their classifications. Empty on any source or classifier failure.
     */
    public SignalResult<List<ClassifiedPost>> classifyRecent(String token) {
        SignalResult<List<SocialPost>> posts = guardedSourceClient.fetch(SOCIAL_SOURCE, token, socialPostSource, List.of());
        if (!posts.isFresh()) {
            return SignalResult.fallback(List.of(), posts.getReason());
        }
        List<SocialPost> batch = posts.getValue();
        SignalResult<List<ClassifiedPost>> classified = guardedSourceClient.call(CLASSIFIER_SOURCE,
                () -> batch.stream()
                        .map(post -> new ClassifiedPost(post, classifier.classify(post.text())))
                        .toList(),
                List.of());
        if (!classified.isFresh()) {
            return SignalResult.fallback(List.of(), classified.getReason());
        }
        return classified;
    }

    public SignalResult<TokenSentiment> analyzeToken(String token) {
        long started = System.nanoTime();
        SignalResult<List<ClassifiedPost>> batch = classifyRecent(token);
        if (!batch.isFresh() || batch.getValue().isEmpty()) {
            String reason = batch.isFresh() ? "no_data" : batch.getReason();
            log.debug("No fresh sentiment for {} ({}), using neutral fallback", token, reason);
            return SignalResult.fallback(TokenSentiment.neutral(token, clock.instant()), reason);
        }

        TokenSentiment draft = scorer.score(token, batch.getValue(), clock.instant());
        TokenSentiment recorded = historyRegistry.record(draft);
        sentimentCache.put(SentimentCache.sentimentKey(token), recorded, sentimentCache.defaultTtl());
        sentimentCache.evictHistory(token);
        metrics.recordAnalysis(Duration.ofNanos(System.nanoTime() - started));
        log.debug("Sentiment for {}: {} ({}) from {} posts, trend {}", token,
                String.format("%.1f", recorded.sentimentScore()), recorded.sentimentLabel().wireName(),
                recorded.sampleSize(), recorded.trend().wireName());
        return SignalResult.fresh(recorded);
    }

    /**
     * Analyzes every tracked token concurrently. Order follows the registry.
     */
    public Map<String, SignalResult<TokenSentiment>> analyzeAll() {
        List<String> tokens = tokenRegistry.tokens();
        Map<String, CompletableFuture<SignalResult<TokenSentiment>>> pending = new LinkedHashMap<>();
        for (String token : tokens) {
            pending.put(token, CompletableFuture.supplyAsync(() -> analyzeToken(token), analysisExecutor)
                    .exceptionally(ex -> {
                        log.error("Sentiment analysis failed for {}", token, ex);
                        return SignalResult.failed(ex.getMessage());
                    }));
        }
        Map<String, SignalResult<TokenSentiment>> results = new LinkedHashMap<>();
        pending.forEach((token, future) -> results.put(token, future.join()));
        return results;
    }

    public SentimentSummary summary() {
        Duration window = historyRegistry.trendWindow();
        Map<String, SentimentSummary.TokenSummary> tokens = new LinkedHashMap<>();
        for (String token : tokenRegistry.tokens()) {
            SentimentHistory history = historyRegistry.find(token).orElse(null);
            TokenSentiment latest = history == null ? null : history.latest().orElse(null);
            if (latest == null) {
                tokens.put(token, SentimentSummary.TokenSummary.noData());
                continue;
            }
            tokens.put(token, new SentimentSummary.TokenSummary(
                    latest.sentimentLabel().wireName(),
                    latest.sentimentScore(),
                    latest.confidence(),
                    latest.sampleSize(),
                    latest.trend(),
                    latest.trendStrength(),
                    history.averageSentiment(window),
                    latest.timestamp()));
        }
        Instant now = clock.instant();
        return new SentimentSummary(now, tokens);
    }
}
