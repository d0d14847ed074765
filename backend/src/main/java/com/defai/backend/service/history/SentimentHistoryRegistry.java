package com.defai.backend.service.history;

import com.defai.backend.config.OracleProperties;
import com.defai.backend.model.TokenSentiment;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class SentimentHistoryRegistry {

    private final int capacity;
    private final Duration trendWindow;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Map<String, SentimentHistory> histories = new ConcurrentHashMap<>();

    @Autowired
    public SentimentHistoryRegistry(OracleProperties properties, Clock clock, ObjectMapper objectMapper) {
        this(properties.getSentiment().getHistoryCapacity(),
                Duration.ofHours(properties.getSentiment().getTrendWindowHours()), clock, objectMapper);
    }

    public SentimentHistoryRegistry(int capacity, Duration trendWindow, Clock clock, ObjectMapper objectMapper) {
        this.capacity = capacity;
        this.trendWindow = trendWindow;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    public SentimentHistory historyFor(String token) {
        return histories.computeIfAbsent(token, key -> new SentimentHistory(key, capacity, clock));
    }

    public Optional<SentimentHistory> find(String token) {
        return Optional.ofNullable(histories.get(token));
    }

    public TokenSentiment record(TokenSentiment draft) {
        return historyFor(draft.token()).record(draft, trendWindow);
    }

    public Duration trendWindow() {
        return trendWindow;
    }

    public void remove(String token) {
        histories.remove(token);
    }

    public HistoryExport export() {
        Map<String, List<TokenSentiment>> tokens = new TreeMap<>();
        histories.forEach((token, history) -> tokens.put(token, history.snapshot()));
        return new HistoryExport(clock.instant(), tokens);
    }

    public Path exportTo(Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), export());
            log.info("Exported sentiment history for {} tokens to {}", histories.size(), target);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export sentiment history to " + target, e);
        }
    }

    public record HistoryExport(Instant timestamp, Map<String, List<TokenSentiment>> tokens) {
    }
}
