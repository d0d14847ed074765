package com.defai.backend.service.stream;

import com.defai.backend.service.EngineMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Set of live subscribers and best-effort fan-out to them. A subscriber becomes connected
 * once its handshake is delivered; any failed send disconnects it and removes it from the set,
 * without affecting delivery to the others.
 */
@Slf4j
@Service
public class BroadcastHub {

    private final ObjectMapper objectMapper;
    private final EngineMetrics metrics;
    private final Map<String, Registration> subscribers = new ConcurrentHashMap<>();

    public BroadcastHub(ObjectMapper objectMapper, EngineMetrics metrics) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @PostConstruct
    void registerGauges() {
        metrics.registerGauge("stream_subscribers", this::connectionCount);
    }

    /**
     * Registers the subscriber and delivers the handshake. Returns false, leaving the subscriber
     * disconnected, when the handshake cannot be delivered.
     */
    public boolean connect(Subscriber subscriber, Object handshake) {
        Registration registration = new Registration(subscriber);
        Registration previous = subscribers.put(subscriber.id(), registration);
        if (previous != null) {
            previous.state = SubscriberState.DISCONNECTED;
        }
        try {
            subscriber.send(serialize(handshake));
            registration.state = SubscriberState.CONNECTED;
            log.info("Subscriber {} connected ({} total)", subscriber.id(), connectionCount());
            return true;
        } catch (Exception e) {
            log.warn("Handshake to {} failed: {}", subscriber.id(), e.toString());
            release(registration, "handshake failed");
            return false;
        }
    }

    public void disconnect(String subscriberId, String reason) {
        Registration registration = subscribers.get(subscriberId);
        if (registration != null) {
            release(registration, reason);
        }
    }

    /**
     * Delivers the same message to every connected subscriber. Returns the number of deliveries.
     */
    public int broadcast(Object message) {
        return broadcast(filter -> message);
    }

    /**
     * Delivers a message built per token filter, so subscribers with a filter only receive their
     * tokens. Each distinct filter is serialized once.
     */
    public int broadcast(Function<Set<String>, Object> messageForFilter) {
        Map<Set<String>, Optional<String>> payloads = new HashMap<>();
        int delivered = 0;
        int failed = 0;
        for (Registration registration : List.copyOf(subscribers.values())) {
            if (registration.state != SubscriberState.CONNECTED) {
                continue;
            }
            Optional<String> payload = payloads.computeIfAbsent(registration.tokenFilter,
                    filter -> build(messageForFilter, filter));
            if (payload.isEmpty()) {
                continue;
            }
            try {
                registration.subscriber.send(payload.get());
                delivered++;
            } catch (Exception e) {
                failed++;
                log.warn("Broadcast to {} failed: {}", registration.subscriber.id(), e.toString());
                release(registration, "send failed");
            }
        }
        metrics.recordBroadcast(delivered, failed);
        return delivered;
    }

    private Optional<String> build(Function<Set<String>, Object> messageForFilter, Set<String> filter) {
        try {
            return Optional.of(serialize(messageForFilter.apply(filter)));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Broadcast message for filter {} could not be built", filter, e);
            return Optional.empty();
        }
    }

    public boolean sendPersonal(String subscriberId, Object message) {
        Registration registration = subscribers.get(subscriberId);
        if (registration == null || registration.state != SubscriberState.CONNECTED) {
            return false;
        }
        try {
            registration.subscriber.send(serialize(message));
            return true;
        } catch (Exception e) {
            log.warn("Personal message to {} failed: {}", subscriberId, e.toString());
            release(registration, "send failed");
            return false;
        }
    }

    public void updateFilter(String subscriberId, Set<String> tokens) {
        Registration registration = subscribers.get(subscriberId);
        if (registration != null) {
            registration.tokenFilter = tokens == null ? Set.of() : Set.copyOf(tokens);
        }
    }

    public Optional<SubscriberState> state(String subscriberId) {
        Registration registration = subscribers.get(subscriberId);
        return registration == null ? Optional.empty() : Optional.of(registration.state);
    }

    public Set<String> filterOf(String subscriberId) {
        Registration registration = subscribers.get(subscriberId);
        return registration == null ? Set.of() : registration.tokenFilter;
    }

    public int connectionCount() {
        int count = 0;
        for (Registration registration : subscribers.values()) {
            if (registration.state == SubscriberState.CONNECTED) {
                count++;
            }
        }
        return count;
    }

    private void release(Registration registration, String reason) {
        registration.state = SubscriberState.DISCONNECTED;
        if (subscribers.remove(registration.subscriber.id(), registration)) {
            registration.subscriber.close();
            log.info("Subscriber {} disconnected: {} ({} remaining)", registration.subscriber.id(), reason,
                    connectionCount());
        }
    }

    private String serialize(Object message) throws JsonProcessingException {
        return message instanceof String text ? text : objectMapper.writeValueAsString(message);
    }

    private static final class Registration {
        private final Subscriber subscriber;
        private volatile SubscriberState state = SubscriberState.CONNECTING;
        private volatile Set<String> tokenFilter = Set.of();

        private Registration(Subscriber subscriber) {
            this.subscriber = subscriber;
        }
    }
}
