package com.defai.backend.service;

import com.defai.backend.dto.SentimentHistoryView;
import com.defai.backend.model.SignalResult;
import com.defai.backend.model.SnipeSignal;
import com.defai.backend.model.TokenSentiment;
import com.defai.backend.model.TrendDirection;
import com.defai.backend.service.cache.SentimentCache;
import com.defai.backend.service.history.SentimentHistory;
import com.defai.backend.service.history.SentimentHistoryRegistry;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache-aside reads for the HTTP and stream surfaces: check the cache, recompute on a miss,
 * write fresh results back. A degraded or failed recompute serves the last value ever cached
 * for the key, otherwise a neutral fallback, so reads never fail for lack of data.
 */
@Slf4j
@Service
public class SentimentQueryService {

    private final SentimentPipelineService pipelineService;
    private final SniperService sniperService;
    private final SentimentHistoryRegistry historyRegistry;
    private final SentimentCache sentimentCache;
    private final TokenRegistry tokenRegistry;
    private final Clock clock;
    private final JavaType sentimentType;
    private final JavaType sentimentMapType;
    private final JavaType snipeType;
    private final JavaType historyType;

    public SentimentQueryService(SentimentPipelineService pipelineService,
                                 SniperService sniperService,
                                 SentimentHistoryRegistry historyRegistry,
                                 SentimentCache sentimentCache,
                                 TokenRegistry tokenRegistry,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.pipelineService = pipelineService;
        this.sniperService = sniperService;
        this.historyRegistry = historyRegistry;
        this.sentimentCache = sentimentCache;
        this.tokenRegistry = tokenRegistry;
        this.clock = clock;
        this.sentimentType = objectMapper.constructType(TokenSentiment.class);
        this.sentimentMapType = objectMapper.getTypeFactory()
                .constructMapType(LinkedHashMap.class, String.class, TokenSentiment.class);
        this.snipeType = objectMapper.constructType(SnipeSignal.class);
        this.historyType = objectMapper.constructType(SentimentHistoryView.class);
    }

    public CachedRead<TokenSentiment> tokenSentiment(String token, boolean useCache) {
        return readThrough(SentimentCache.sentimentKey(token), sentimentType, sentimentCache.defaultTtl(), useCache,
                () -> pipelineService.analyzeToken(token),
                () -> TokenSentiment.neutral(token, clock.instant()));
    }

    public CachedRead<Map<String, TokenSentiment>> allSentiments(boolean useCache) {
        return readThrough(SentimentCache.ALL_SENTIMENTS_KEY, sentimentMapType, sentimentCache.defaultTtl(), useCache,
                this::analyzeAllForRead, this::neutralForAll);
    }

    public CachedRead<SnipeSignal> snipe(String token, boolean useCache) {
        return readThrough(SentimentCache.snipeKey(token), snipeType, sentimentCache.defaultTtl(), useCache,
                () -> sniperService.analyze(token),
                () -> sniperService.noDataSignal(token));
    }

    public CachedRead<SentimentHistoryView> history(String token, int hours) {
        return readThrough(SentimentCache.historyKey(token, hours), historyType, sentimentCache.historyTtl(), true,
                () -> SignalResult.fresh(historyView(token, hours)),
                () -> emptyHistoryView(token, hours));
    }

    SentimentHistoryView historyView(String token, int hours) {
        Duration window = Duration.ofHours(hours);
        Optional<SentimentHistory> history = historyRegistry.find(token);
        if (history.isEmpty()) {
            return emptyHistoryView(token, hours);
        }
        SentimentHistory h = history.get();
        List<TokenSentiment> entries = h.within(window);
        return new SentimentHistoryView(token, hours, h.trend(window), h.averageSentiment(window), h.trendStrength(),
                entries.size(), entries);
    }

    private SentimentHistoryView emptyHistoryView(String token, int hours) {
        return new SentimentHistoryView(token, hours, TrendDirection.INSUFFICIENT_DATA, 50.0, 0.0, 0, List.of());
    }

    private Map<String, TokenSentiment> neutralForAll() {
        Map<String, TokenSentiment> data = new LinkedHashMap<>();
        for (String token : tokenRegistry.tokens()) {
            data.put(token, TokenSentiment.neutral(token, clock.instant()));
        }
        return data;
    }

    private SignalResult<Map<String, TokenSentiment>> analyzeAllForRead() {
        Map<String, SignalResult<TokenSentiment>> results = pipelineService.analyzeAll();
        Map<String, TokenSentiment> data = new LinkedHashMap<>();
        boolean allFresh = true;
        for (Map.Entry<String, SignalResult<TokenSentiment>> entry : results.entrySet()) {
            SignalResult<TokenSentiment> result = entry.getValue();
            allFresh &= result.isFresh();
            data.put(entry.getKey(), result.orElse(TokenSentiment.neutral(entry.getKey(), clock.instant())));
        }
        return allFresh ? SignalResult.fresh(data) : SignalResult.fallback(data, "partial");
    }

    private <T> CachedRead<T> readThrough(String key, JavaType type, Duration ttl, boolean useCache,
                                          Supplier<SignalResult<T>> loader, Supplier<T> neutral) {
        if (useCache) {
            Optional<T> hit = sentimentCache.get(key, type);
            if (hit.isPresent()) {
                return CachedRead.hit(hit.get());
            }
        }
        SignalResult<T> result;
        try {
            result = loader.get();
        } catch (RuntimeException e) {
            log.error("Recompute failed for {}", key, e);
            result = SignalResult.failed(e.getMessage());
        }
        if (result.isFresh()) {
            sentimentCache.put(key, result.getValue(), ttl);
            return CachedRead.computed(result.getValue());
        }
        Optional<T> lastKnown = sentimentCache.lastKnown(key, type);
        if (lastKnown.isPresent()) {
            log.info("Serving last known value for {} ({})", key, result.getReason());
            return CachedRead.stale(lastKnown.get());
        }
        if (result.isFallback()) {
            return CachedRead.fallback(result.getValue());
        }
        log.warn("Nothing to serve for {} ({}), returning neutral fallback", key, result.getReason());
        return CachedRead.fallback(neutral.get());
    }
}
