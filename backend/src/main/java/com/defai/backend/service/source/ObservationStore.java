package com.defai.backend.service.source;

import com.defai.backend.config.OracleProperties;
import com.defai.backend.model.DevWalletMetrics;
import com.defai.backend.model.LiquidityMetrics;
import com.defai.backend.model.SocialPost;
import com.defai.backend.model.VolumeMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest point-in-time observations pushed in by collectors. Backs the default signal sources.
 */
@Slf4j
@Component
public class ObservationStore {

    private final int maxPosts;
    private final Map<String, Deque<SocialPost>> posts = new ConcurrentHashMap<>();
    private final Map<String, VolumeMetrics> volumes = new ConcurrentHashMap<>();
    private final Map<String, LiquidityMetrics> liquidity = new ConcurrentHashMap<>();
    private final Map<String, DevWalletMetrics> wallets = new ConcurrentHashMap<>();

    @Autowired
    public ObservationStore(OracleProperties properties) {
        this(properties.getSentiment().getMaxPosts());
    }

    ObservationStore(int maxPosts) {
        this.maxPosts = Math.max(1, maxPosts);
    }

    public int recordPosts(String token, List<SocialPost> batch) {
        Deque<SocialPost> deque = posts.computeIfAbsent(token, ignored -> new ArrayDeque<>());
        synchronized (deque) {
            for (SocialPost post : batch) {
                deque.addLast(post);
                if (deque.size() > maxPosts) {
                    deque.pollFirst();
                }
            }
            log.debug("Recorded {} posts for {} (retained {})", batch.size(), token, deque.size());
            return deque.size();
        }
    }

    public void recordVolume(String token, VolumeMetrics metrics) {
        volumes.put(token, metrics);
    }

    public void recordLiquidity(String token, LiquidityMetrics metrics) {
        liquidity.put(token, metrics);
    }

    public void recordWallets(String token, DevWalletMetrics metrics) {
        wallets.put(token, metrics);
    }

    public Optional<List<SocialPost>> recentPosts(String token) {
        Deque<SocialPost> deque = posts.get(token);
        if (deque == null) {
            return Optional.empty();
        }
        synchronized (deque) {
            return deque.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(deque));
        }
    }

    public Optional<VolumeMetrics> latestVolume(String token) {
        return Optional.ofNullable(volumes.get(token));
    }

    public Optional<LiquidityMetrics> latestLiquidity(String token) {
        return Optional.ofNullable(liquidity.get(token));
    }

    public Optional<DevWalletMetrics> latestWallets(String token) {
        return Optional.ofNullable(wallets.get(token));
    }

    public void forget(String token) {
        posts.remove(token);
        volumes.remove(token);
        liquidity.remove(token);
        wallets.remove(token);
    }
}
