package com.defai.backend.service;

import com.defai.backend.dto.SentimentHistoryView;
import com.defai.backend.model.SignalResult;
import com.defai.backend.model.SnipeSignal;
import com.defai.backend.model.TokenProfile;
import com.defai.backend.model.TokenSentiment;
import com.defai.backend.model.TrendDirection;
import com.defai.backend.service.cache.InMemoryCacheStore;
import com.defai.backend.service.cache.SentimentCache;
import com.defai.backend.service.history.SentimentHistoryRegistry;
import com.defai.backend.service.scoring.DevWalletAnalyzer;
import com.defai.backend.service.scoring.SentimentScorer;
import com.defai.backend.service.scoring.SnipeScorer;
import com.defai.backend.service.scoring.VolumeAnalyzer;
import com.defai.backend.support.MutableClock;
import com.defai.backend.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SentimentQueryServiceTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T12:00:00Z");
    private final InMemoryCacheStore store = new InMemoryCacheStore(clock);
    private final SentimentCache cache = new SentimentCache(store, TestFixtures.objectMapper(), TestFixtures.metrics(),
            TestFixtures.properties());
    private final SentimentHistoryRegistry histories =
            new SentimentHistoryRegistry(500, Duration.ofHours(24), clock, TestFixtures.objectMapper());
    private final SentimentPipelineService pipeline = mock(SentimentPipelineService.class);
    private final SniperService sniper = mock(SniperService.class);
    private final TokenRegistry tokens = new TokenRegistry(TestFixtures.properties(), clock);
    private final SentimentQueryService queries =
            new SentimentQueryService(pipeline, sniper, histories, cache, tokens, TestFixtures.objectMapper(), clock);

    @Test
    void missComputesThenHitsCache() {
        when(pipeline.analyzeToken("DOGE")).thenReturn(SignalResult.fresh(sentiment("DOGE", 71.0)));

        CachedRead<TokenSentiment> first = queries.tokenSentiment("DOGE", true);
        CachedRead<TokenSentiment> second = queries.tokenSentiment("DOGE", true);

        assertThat(first.cached()).isFalse();
        assertThat(second.cached()).isTrue();
        assertThat(second.data()).isEqualTo(first.data());
        verify(pipeline, times(1)).analyzeToken("DOGE");
    }

    @Test
    void bypassingCacheAlwaysRecomputes() {
        when(pipeline.analyzeToken("DOGE")).thenReturn(SignalResult.fresh(sentiment("DOGE", 71.0)));

        queries.tokenSentiment("DOGE", false);
        CachedRead<TokenSentiment> read = queries.tokenSentiment("DOGE", false);

        assertThat(read.cached()).isFalse();
        verify(pipeline, times(2)).analyzeToken("DOGE");
    }

    @Test
    void degradedRecomputeServesLastKnownValue() {
        when(pipeline.analyzeToken("DOGE"))
                .thenReturn(SignalResult.fresh(sentiment("DOGE", 71.0)))
                .thenReturn(SignalResult.fallback(TokenSentiment.neutral("DOGE", clock.instant()), "timeout"));
        queries.tokenSentiment("DOGE", true);
        clock.advanceSeconds(301);

        CachedRead<TokenSentiment> read = queries.tokenSentiment("DOGE", true);

        assertThat(read.stale()).isTrue();
        assertThat(read.data().sentimentScore()).isEqualTo(71.0);
    }

    @Test
    void fallbackWithoutHistoryIsServedButNotCached() {
        when(pipeline.analyzeToken("PEPE"))
                .thenReturn(SignalResult.fallback(TokenSentiment.neutral("PEPE", clock.instant()), "no_data"));

        CachedRead<TokenSentiment> read = queries.tokenSentiment("PEPE", true);

        assertThat(read.degraded()).isTrue();
        assertThat(read.stale()).isFalse();
        assertThat(read.data().sentimentScore()).isEqualTo(50.0);
        assertThat(store.get("sentiment:PEPE")).isEmpty();
    }

    @Test
    void failedSnipeWithNothingCachedServesNoDataSignal() {
        SnipeSignal noData = new SnipeScorer(new VolumeAnalyzer(), new DevWalletAnalyzer(), new SentimentScorer())
                .score(TokenProfile.ofSymbol("DOGE", null), null, null, null, List.of(), clock.instant());
        when(sniper.analyze("DOGE")).thenReturn(SignalResult.failed("scorer crashed"));
        when(sniper.noDataSignal("DOGE")).thenReturn(noData);

        CachedRead<SnipeSignal> read = queries.snipe("DOGE", true);

        assertThat(read.degraded()).isTrue();
        assertThat(read.stale()).isFalse();
        assertThat(read.data()).isEqualTo(noData);
        assertThat(store.get("snipe:DOGE")).isEmpty();
    }

    @Test
    void loaderExceptionServesNeutralSentiment() {
        when(pipeline.analyzeToken("DOGE")).thenThrow(new IllegalStateException("boom"));

        CachedRead<TokenSentiment> read = queries.tokenSentiment("DOGE", true);

        assertThat(read.degraded()).isTrue();
        assertThat(read.data().token()).isEqualTo("DOGE");
        assertThat(read.data().sentimentScore()).isEqualTo(50.0);
        assertThat(store.get("sentiment:DOGE")).isEmpty();
    }

    @Test
    void loaderExceptionAfterSuccessServesLastKnownValue() {
        when(pipeline.analyzeToken("DOGE"))
                .thenReturn(SignalResult.fresh(sentiment("DOGE", 71.0)))
                .thenThrow(new IllegalStateException("boom"));
        queries.tokenSentiment("DOGE", true);

        CachedRead<TokenSentiment> read = queries.tokenSentiment("DOGE", false);

        assertThat(read.stale()).isTrue();
        assertThat(read.data().sentimentScore()).isEqualTo(71.0);
    }

    @Test
    void failingAllSentimentsServesNeutralForTrackedTokens() {
        when(pipeline.analyzeAll()).thenThrow(new IllegalStateException("executor down"));

        CachedRead<Map<String, TokenSentiment>> read = queries.allSentiments(true);

        assertThat(read.degraded()).isTrue();
        assertThat(read.data()).containsOnlyKeys("DOGE", "SHIB", "PEPE");
        assertThat(read.data().values()).allSatisfy(s -> assertThat(s.sentimentScore()).isEqualTo(50.0));
    }

    @Test
    void partialAllSentimentsIsNotCached() {
        Map<String, SignalResult<TokenSentiment>> results = new LinkedHashMap<>();
        results.put("DOGE", SignalResult.fresh(sentiment("DOGE", 71.0)));
        results.put("PEPE", SignalResult.failed("boom"));
        when(pipeline.analyzeAll()).thenReturn(results);

        CachedRead<Map<String, TokenSentiment>> read = queries.allSentiments(true);

        assertThat(read.degraded()).isTrue();
        assertThat(read.data().get("PEPE").sentimentScore()).isEqualTo(50.0);
        assertThat(store.get(SentimentCache.ALL_SENTIMENTS_KEY)).isEmpty();
    }

    @Test
    void historyOfUnknownTokenIsInsufficient() {
        CachedRead<SentimentHistoryView> read = queries.history("SHIB", 24);

        assertThat(read.data().trend()).isEqualTo(TrendDirection.INSUFFICIENT_DATA);
        assertThat(read.data().averageSentiment()).isEqualTo(50.0);
        assertThat(read.data().count()).isZero();
        assertThat(store.get("history:SHIB:24h")).isPresent();
    }

    @Test
    void historyReflectsRecordedSnapshots() {
        histories.record(sentiment("DOGE", 60.0));
        clock.advanceSeconds(60);
        histories.record(sentiment("DOGE", 80.0));

        SentimentHistoryView view = queries.history("DOGE", 1).data();

        assertThat(view.count()).isEqualTo(2);
        assertThat(view.averageSentiment()).isEqualTo(70.0);
    }

    private TokenSentiment sentiment(String token, double score) {
        return TokenSentiment.neutral(token, clock.instant()).toBuilder()
                .sentimentScore(score)
                .sampleSize(5)
                .neutralCount(5)
                .confidence(0.5)
                .build();
    }
}
