package com.defai.backend.service;

import com.defai.backend.config.OracleProperties;
import com.defai.backend.exception.InvalidInputException;
import com.defai.backend.model.TokenProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.regex.Pattern;

/**
 * Set of tracked tokens and their identity metadata. Symbols are normalized to upper case.
 */
@Slf4j
@Service
public class TokenRegistry {

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("^[A-Z0-9][A-Z0-9._-]{0,19}$");

    private final Clock clock;
    private final Map<String, TokenProfile> tracked = new ConcurrentSkipListMap<>();

    public TokenRegistry(OracleProperties properties, Clock clock) {
        this.clock = clock;
        for (String symbol : properties.getTokens().getInitial()) {
            String normalized = normalize(symbol);
            tracked.put(normalized, TokenProfile.ofSymbol(normalized, clock.instant()));
        }
        log.info("Tracking {} tokens: {}", tracked.size(), tracked.keySet());
    }

    public static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidInputException("Token symbol is required");
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        if (!SYMBOL_PATTERN.matcher(normalized).matches()) {
            throw new InvalidInputException("Invalid token symbol: " + symbol);
        }
        return normalized;
    }

    /**
     * Normalizes the symbol and rejects tokens that are not tracked.
     */
    public String requireTracked(String symbol) {
        String normalized = normalize(symbol);
        if (!tracked.containsKey(normalized)) {
            throw new InvalidInputException("Token not tracked: " + normalized);
        }
        return normalized;
    }

    public boolean isTracked(String symbol) {
        try {
            return tracked.containsKey(normalize(symbol));
        } catch (InvalidInputException e) {
            return false;
        }
    }

    /**
     * Adds the token or refreshes its metadata. Returns true when the token was not tracked before.
     */
    public boolean add(TokenProfile profile) {
        String normalized = normalize(profile.symbol());
        TokenProfile stored = profile.toBuilder()
                .symbol(normalized)
                .name(profile.name() == null || profile.name().isBlank() ? normalized : profile.name())
                .createdAt(profile.createdAt() == null ? clock.instant() : profile.createdAt())
                .build();
        boolean added = tracked.put(normalized, stored) == null;
        if (added) {
            log.info("Started tracking {}", normalized);
        }
        return added;
    }

    public boolean remove(String symbol) {
        String normalized = normalize(symbol);
        boolean removed = tracked.remove(normalized) != null;
        if (removed) {
            log.info("Stopped tracking {}", normalized);
        }
        return removed;
    }

    public List<String> tokens() {
        return new ArrayList<>(tracked.keySet());
    }

    public Optional<TokenProfile> profile(String symbol) {
        return Optional.ofNullable(tracked.get(normalize(symbol)));
    }

    public List<TokenProfile> profiles() {
        return new ArrayList<>(tracked.values());
    }
}
