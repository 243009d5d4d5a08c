package com.jay.underwriter.config;

import com.jay.underwriter.layer1_data.RecordStore;
import com.jay.underwriter.layer2_analysis.InputExtractor;
import com.jay.underwriter.layer2_analysis.MetricsEngine;
import com.jay.underwriter.layer3_sync.Sleeper;
import com.jay.underwriter.layer3_sync.SyncOrchestrator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class SyncConfiguration {

    @Bean
    public SyncOrchestrator syncOrchestrator(RecordStore recordStore, InputExtractor inputExtractor,
                                             MetricsEngine metricsEngine, UnderwriterConfig config) {
        UnderwriterConfig.Sync sync = config.sync();
        return new SyncOrchestrator(recordStore, inputExtractor, metricsEngine, config.fieldMapping(),
            sync.getMaxAttempts(), Duration.ofMillis(sync.getBaseDelayMs()), Sleeper.THREAD);
    }
}
