package com.defai.backend.service.history;

import com.defai.backend.model.TokenSentiment;
import com.defai.backend.model.TrendDirection;
import com.defai.backend.support.MutableClock;
import com.defai.backend.support.TestFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SentimentHistoryRegistryTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T00:00:00Z");
    private final ObjectMapper objectMapper = TestFixtures.objectMapper();
    private final SentimentHistoryRegistry registry =
            new SentimentHistoryRegistry(500, Duration.ofHours(24), clock, objectMapper);

    @Test
    void recordEnrichesWithTrendOverWindow() {
        registry.record(draft("DOGE", 40));
        clock.advance(Duration.ofMinutes(5));
        TokenSentiment second = registry.record(draft("DOGE", 70));

        assertThat(second.trend()).isEqualTo(TrendDirection.RISING);
        assertThat(second.timestamp()).isEqualTo(clock.instant());
        assertThat(registry.find("PEPE")).isEmpty();
    }

    @Test
    void exportGroupsSnapshotsByToken() {
        registry.record(draft("PEPE", 30));
        registry.record(draft("DOGE", 60));
        registry.record(draft("DOGE", 65));

        SentimentHistoryRegistry.HistoryExport export = registry.export();

        assertThat(export.timestamp()).isEqualTo(clock.instant());
        assertThat(export.tokens()).containsOnlyKeys("DOGE", "PEPE");
        assertThat(export.tokens().get("DOGE")).hasSize(2);
    }

    @Test
    void exportToWritesJsonFile(@TempDir Path dir) throws Exception {
        registry.record(draft("DOGE", 60));

        Path written = registry.exportTo(dir.resolve("nested").resolve("history.json"));

        assertThat(written).exists();
        JsonNode json = objectMapper.readTree(Files.readString(written));
        assertThat(json.get("tokens").get("DOGE").get(0).get("sentiment_score").asDouble()).isEqualTo(60.0);
    }

    @Test
    void removeDropsHistory() {
        registry.record(draft("DOGE", 60));

        registry.remove("DOGE");

        assertThat(registry.find("DOGE")).isEmpty();
    }

    private TokenSentiment draft(String token, double score) {
        return TokenSentiment.neutral(token, null).toBuilder().sentimentScore(score).build();
    }
}
