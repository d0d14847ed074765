package com.defai.backend.service.stream;

import com.defai.backend.exception.InvalidInputException;
import com.defai.backend.model.SignalResult;
import com.defai.backend.model.TokenSentiment;
import com.defai.backend.service.SentimentPipelineService;
import com.defai.backend.service.SentimentQueryService;
import com.defai.backend.service.TokenRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sentiment stream protocol: the handshake, replies to client messages, and the periodic
 * {@code sentiment_update} push.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SentimentStreamService {

    public static final String TYPE_CONNECTION = "connection";
    public static final String TYPE_SENTIMENT_UPDATE = "sentiment_update";
    public static final String TYPE_SENTIMENT = "sentiment";
    public static final String TYPE_SUBSCRIBED = "subscribed";
    public static final String TYPE_UNSUBSCRIBED = "unsubscribed";
    public static final String TYPE_PONG = "pong";
    public static final String TYPE_ERROR = "error";

    private final BroadcastHub hub;
    private final SentimentPipelineService pipelineService;
    private final SentimentQueryService queryService;
    private final TokenRegistry tokenRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Map<String, Object> connectionMessage() {
        Map<String, Object> message = envelope(TYPE_CONNECTION);
        message.put("status", "connected");
        message.put("tokens", tokenRegistry.tokens());
        message.put("message", "Connected to sentiment stream");
        return message;
    }

    public void handleClientMessage(String subscriberId, String raw) {
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            hub.sendPersonal(subscriberId, error("Malformed JSON message"));
            return;
        }
        if (node == null || !node.isObject()) {
            hub.sendPersonal(subscriberId, error("Message must be a JSON object"));
            return;
        }
        String type = node.path("type").asText("");
        try {
            switch (type) {
                case "ping" -> hub.sendPersonal(subscriberId, envelope(TYPE_PONG));
                case "request_sentiment" -> hub.sendPersonal(subscriberId, sentimentReply(requestedTokens(node)));
                case "subscribe" -> subscribe(subscriberId, requestedTokens(node));
                case "unsubscribe" -> {
                    hub.sendPersonal(subscriberId, envelope(TYPE_UNSUBSCRIBED));
                    hub.disconnect(subscriberId, "unsubscribed");
                }
                default -> hub.sendPersonal(subscriberId, error("Unknown message type: " + type));
            }
        } catch (InvalidInputException e) {
            hub.sendPersonal(subscriberId, error(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Failed to handle {} message from {}", type, subscriberId, e);
            hub.sendPersonal(subscriberId, error("Failed to handle " + type + " request"));
        }
    }

    /**
     * Recomputes all tracked tokens and pushes the result to every subscriber, filtered per subscriber.
     */
    public int pushUpdate() {
        Map<String, SignalResult<TokenSentiment>> results = pipelineService.analyzeAll();
        Map<String, TokenSentiment> data = new LinkedHashMap<>();
        results.forEach((token, result) -> data.put(token, result.orElse(TokenSentiment.neutral(token, clock.instant()))));
        int connections = hub.connectionCount();
        if (connections == 0) {
            return 0;
        }
        int delivered = hub.broadcast(filter -> sentimentUpdate(filtered(data, filter), connections));
        log.debug("Pushed sentiment update for {} tokens to {} subscribers", data.size(), delivered);
        return delivered;
    }

    Map<String, Object> sentimentUpdate(Map<String, TokenSentiment> data, int connections) {
        Map<String, Object> message = envelope(TYPE_SENTIMENT_UPDATE);
        message.put("data", data);
        message.put("connection_count", connections);
        return message;
    }

    Map<String, Object> error(String reason) {
        Map<String, Object> message = envelope(TYPE_ERROR);
        message.put("reason", reason);
        return message;
    }

    private void subscribe(String subscriberId, List<String> tokens) {
        hub.updateFilter(subscriberId, new LinkedHashSet<>(tokens));
        Map<String, Object> message = envelope(TYPE_SUBSCRIBED);
        message.put("tokens", tokens);
        hub.sendPersonal(subscriberId, message);
    }

    private Map<String, Object> sentimentReply(List<String> tokens) {
        Map<String, TokenSentiment> data = new LinkedHashMap<>();
        for (String token : tokens) {
            data.put(token, queryService.tokenSentiment(token, true).data());
        }
        Map<String, Object> message = envelope(TYPE_SENTIMENT);
        message.put("data", data);
        return message;
    }

    private List<String> requestedTokens(JsonNode node) {
        JsonNode tokens = node.get("tokens");
        if (tokens == null || tokens.isNull()) {
            return tokenRegistry.tokens();
        }
        if (!tokens.isArray()) {
            throw new InvalidInputException("tokens must be an array of symbols");
        }
        List<String> symbols = new ArrayList<>();
        for (JsonNode token : tokens) {
            if (!token.isTextual()) {
                throw new InvalidInputException("tokens must be an array of symbols");
            }
            symbols.add(tokenRegistry.requireTracked(token.asText()));
        }
        return symbols;
    }

    private Map<String, TokenSentiment> filtered(Map<String, TokenSentiment> data, Set<String> filter) {
        if (filter.isEmpty()) {
            return data;
        }
        Map<String, TokenSentiment> subset = new LinkedHashMap<>();
        data.forEach((token, sentiment) -> {
            if (filter.contains(token)) {
                subset.put(token, sentiment);
            }
        });
        return subset;
    }

    private Map<String, Object> envelope(String type) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("timestamp", clock.instant().toString());
        return message;
    }
}
