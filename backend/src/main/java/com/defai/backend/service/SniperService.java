package com.defai.backend.service;

import com.defai.backend.model.ClassifiedPost;
import com.defai.backend.model.DevWalletMetrics;
import com.defai.backend.model.LiquidityMetrics;
import com.defai.backend.model.SentimentClass;
import com.defai.backend.model.SignalResult;
import com.defai.backend.model.SnipeSignal;
import com.defai.backend.model.TokenProfile;
import com.defai.backend.model.VolumeMetrics;
import com.defai.backend.service.cache.SentimentCache;
import com.defai.backend.service.scoring.SnipeScorer;
import com.defai.backend.service.source.GuardedSourceClient;
import com.defai.backend.service.source.SignalSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Gathers volume, liquidity, wallet and sentiment inputs for a token and scores them into a
 * {@link SnipeSignal}. Each scan supersedes the previous signal for that token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SniperService {

    private final SignalSource<VolumeMetrics> volumeSource;
    private final SignalSource<LiquidityMetrics> liquiditySource;
    private final SignalSource<DevWalletMetrics> devWalletSource;
    private final GuardedSourceClient guardedSourceClient;
    private final SentimentPipelineService pipelineService;
    private final SnipeScorer snipeScorer;
    private final SentimentCache sentimentCache;
    private final TokenRegistry tokenRegistry;
    private final Clock clock;

    public SignalResult<SnipeSignal> analyze(String token) {
        TokenProfile profile = tokenRegistry.profile(token)
                .orElseGet(() -> TokenProfile.ofSymbol(token, null));

        SignalResult<VolumeMetrics> volume = guardedSourceClient.fetch("volume", token, volumeSource, null);
        SignalResult<LiquidityMetrics> liquidity = guardedSourceClient.fetch("liquidity", token, liquiditySource, null);
        SignalResult<DevWalletMetrics> wallets = guardedSourceClient.fetch("dev-wallets", token, devWalletSource, null);
        SignalResult<List<ClassifiedPost>> posts = pipelineService.classifyRecent(token);
        List<SentimentClass> sentiments = posts.orElse(List.of()).stream()
                .map(ClassifiedPost::sentiment)
                .toList();

        SnipeSignal signal = snipeScorer.score(profile, volume.getValue(), liquidity.getValue(), wallets.getValue(),
                sentiments, clock.instant());

        boolean anyFresh = Stream.of(volume, liquidity, wallets, posts).anyMatch(SignalResult::isFresh);
        if (!anyFresh) {
            log.debug("No fresh inputs for {}, snipe signal is a fallback", token);
            return SignalResult.fallback(signal, "no_data");
        }
        sentimentCache.put(SentimentCache.snipeKey(token), signal, sentimentCache.defaultTtl());
        if (log.isDebugEnabled()) {
            log.debug("Snipe {}: overall={} prediction={} risks={}", token,
                    String.format("%.1f", signal.overallScore()), signal.prediction().label(), signal.risks().size());
        }
        return SignalResult.fresh(signal);
    }

    /**
     * Signal scored with no volume, liquidity, wallet or sentiment input.
     */
    public SnipeSignal noDataSignal(String token) {
        TokenProfile profile = tokenRegistry.profile(token)
                .orElseGet(() -> TokenProfile.ofSymbol(token, null));
        return snipeScorer.score(profile, null, null, null, List.of(), clock.instant());
    }

    /**
     * Scores every tracked token, best overall score first.
     */
    public List<SnipeSignal> scan() {
        List<SnipeSignal> signals = new ArrayList<>();
        for (String token : tokenRegistry.tokens()) {
            SignalResult<SnipeSignal> result = analyze(token);
            if (!result.isFailed()) {
                signals.add(result.getValue());
            }
        }
        signals.sort(Comparator.comparingDouble(SnipeSignal::overallScore).reversed());
        log.info("Snipe scan complete: {} tokens, top={}", signals.size(),
                signals.isEmpty() ? "-" : signals.get(0).tokenSymbol());
        return signals;
    }
}
