package com.defai.backend.service.cache;

import com.defai.backend.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCacheStoreTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T00:00:00Z");
    private final InMemoryCacheStore store = new InMemoryCacheStore(clock);

    @Test
    void returnsValueUntilTtlElapses() {
        store.set("sentiment:DOGE", "{\"score\":70}", Duration.ofSeconds(300));

        clock.advanceSeconds(300);
        assertThat(store.get("sentiment:DOGE")).contains("{\"score\":70}");

        clock.advanceSeconds(1);
        assertThat(store.get("sentiment:DOGE")).isEmpty();
        assertThat(store.stats().size()).isZero();
        assertThat(store.stats().expirations()).isEqualTo(1);
    }

    @Test
    void setIsIdempotentAndOverwritesTtl() {
        store.set("k", "v", Duration.ofSeconds(10));
        store.set("k", "v", Duration.ofSeconds(10));
        assertThat(store.get("k")).contains("v");
        assertThat(store.stats().size()).isEqualTo(1);

        clock.advanceSeconds(8);
        store.set("k", "v2", Duration.ofSeconds(10));
        clock.advanceSeconds(8);
        assertThat(store.get("k")).contains("v2");
    }

    @Test
    void deletePatternRemovesOnlyMatchingKeys() {
        store.set("history:DOGE:24h", "[]", Duration.ofHours(1));
        store.set("history:DOGE:6h", "[]", Duration.ofHours(1));
        store.set("history:DOGEX:24h", "[]", Duration.ofHours(1));
        store.set("sentiment:DOGE", "{}", Duration.ofHours(1));

        int removed = store.deletePattern("history:DOGE:*");

        assertThat(removed).isEqualTo(2);
        assertThat(store.get("history:DOGEX:24h")).isPresent();
        assertThat(store.get("sentiment:DOGE")).isPresent();
    }

    @Test
    void globTreatsRegexCharactersLiterally() {
        store.set("a.b", "1", Duration.ofSeconds(5));
        store.set("axb", "2", Duration.ofSeconds(5));

        assertThat(store.deletePattern("a.b")).isEqualTo(1);
        assertThat(store.get("axb")).contains("2");
        assertThat(store.deletePattern("a?b")).isEqualTo(1);
    }

    @Test
    void purgeDropsExpiredEntries() {
        store.set("short", "1", Duration.ofSeconds(5));
        store.set("long", "2", Duration.ofSeconds(500));
        clock.advanceSeconds(10);

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.stats().size()).isEqualTo(1);
    }

    @Test
    void tracksHitsAndMisses() {
        store.set("k", "v", Duration.ofSeconds(5));
        store.get("k");
        store.get("missing");

        CacheStats stats = store.stats();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);
    }

    @Test
    void rejectsNegativeTtl() {
        assertThatThrownBy(() -> store.set("k", "v", Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
