package com.jay.underwriter.scheduler;

import com.jay.underwriter.config.UnderwriterConfig;
import com.jay.underwriter.layer3_sync.SyncOrchestrator;
import com.jay.underwriter.model.SyncReport;
import com.jay.underwriter.model.enums.RunStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives board synchronisation.
 *
 *   Daily    : underwriter.sync-cron (default 06:00) — full board sync
 *   Startup  : one sync when sync.run_on_startup is set
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncScheduler {

    private final SyncOrchestrator orchestrator;
    private final UnderwriterConfig config;

    @Scheduled(cron = "${underwriter.sync-cron:0 0 6 * * *}")
    public void scheduledSync() {
        log.info("=== SCHEDULED SYNC ===");
        runSafely();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void runOnStartup() {
        if (!config.sync().isRunOnStartup()) return;
        log.info("=== STARTUP SYNC ===");
        runSafely();
    }

    private void runSafely() {
        try {
            SyncReport report = orchestrator.run(config.sync().isDryRunEnabled());
            if (report.getStatus() == RunStatus.FAILED) {
                log.error("Sync failed: {}", report.getFailureReason());
            }
        } catch (Exception e) {
            log.error("Sync run crashed: {}", e.getMessage(), e);
        }
    }
}
