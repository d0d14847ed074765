package com.defai.backend.config;

import com.defai.backend.model.DevWalletMetrics;
import com.defai.backend.model.LiquidityMetrics;
import com.defai.backend.model.SocialPost;
import com.defai.backend.model.VolumeMetrics;
import com.defai.backend.service.source.ObservationStore;
import com.defai.backend.service.source.SignalSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Default signal sources backed by ingested observations. Replace a bean to plug in a live feed.
 */
@Configuration
public class SignalSourceConfig {

    @Bean
    public SignalSource<List<SocialPost>> socialPostSource(ObservationStore store) {
        return store::recentPosts;
    }

    @Bean
    public SignalSource<VolumeMetrics> volumeSource(ObservationStore store) {
        return store::latestVolume;
    }

    @Bean
    public SignalSource<LiquidityMetrics> liquiditySource(ObservationStore store) {
        return store::latestLiquidity;
    }

    @Bean
    public SignalSource<DevWalletMetrics> devWalletSource(ObservationStore store) {
        return store::latestWallets;
    }
}
