package com.jay.underwriter.layer3_sync;

import com.jay.underwriter.config.FieldMapping;
import com.jay.underwriter.layer1_data.RecordStore;
import com.jay.underwriter.layer2_analysis.InputExtractor;
import com.jay.underwriter.layer2_analysis.MetricFormatter;
import com.jay.underwriter.layer2_analysis.MetricsEngine;
import com.jay.underwriter.model.BoardItem;
import com.jay.underwriter.model.ColumnWrite;
import com.jay.underwriter.model.MetricResult;
import com.jay.underwriter.model.RawInputs;
import com.jay.underwriter.model.SyncOutcome;
import com.jay.underwriter.model.SyncReport;
import com.jay.underwriter.model.enums.RunStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Layer 3 — Board synchronisation.
 *
 * One run:
 *   1. Fetch every item on the board (retried; fatal if it still fails).
 *   2. Per item: extract inputs → compute metrics → build the output column map.
 *   3. Dry-run stops there; otherwise write the item back (retried).
 *
 * A failure on one item is recorded against that item and the loop moves on.
 * The engine is pure and writes overwrite, so re-running with unchanged inputs
 * sends identical column maps.
 */
@Slf4j
public class SyncOrchestrator {

    private final RecordStore store;
    private final InputExtractor extractor;
    private final MetricsEngine engine;
    private final FieldMapping mapping;
    private final RetryExecutor retry;

    private volatile SyncReport lastReport;

    public SyncOrchestrator(RecordStore store, InputExtractor extractor, MetricsEngine engine,
                            FieldMapping mapping, int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        this.store = store;
        this.extractor = extractor;
        this.engine = engine;
        this.mapping = mapping;
        this.retry = new RetryExecutor(maxAttempts, baseDelay, sleeper);
    }

    public synchronized SyncReport run(boolean dryRun) {
        LocalDateTime startedAt = LocalDateTime.now();
        log.info("=== SYNC START (dryRun={}) ===", dryRun);

        List<BoardItem> items;
        try {
            items = retry.execute("Fetch board items", store::fetchItems);
        } catch (RuntimeException e) {
            log.error("Sync aborted — could not fetch board items: {}", e.getMessage());
            return finish(SyncReport.builder()
                .status(RunStatus.FAILED)
                .dryRun(dryRun)
                .startedAt(startedAt)
                .failureReason(e.getMessage()));
        }

        if (items == null || items.isEmpty()) {
            log.info("No records on the board — nothing to sync");
            return finish(SyncReport.builder()
                .status(RunStatus.NO_RECORDS)
                .dryRun(dryRun)
                .startedAt(startedAt));
        }

        List<SyncOutcome> outcomes = new ArrayList<>();
        for (BoardItem item : items) {
            outcomes.add(processItem(item, dryRun));
        }

        SyncReport report = finish(SyncReport.builder()
            .status(RunStatus.COMPLETED)
            .dryRun(dryRun)
            .startedAt(startedAt)
            .outcomes(List.copyOf(outcomes)));
        log.info("=== SYNC DONE — {} ===", report.summary());
        return report;
    }

    /** Extract, compute and (unless dry-run) write one item. Never throws. */
    SyncOutcome processItem(BoardItem item, boolean dryRun) {
        List<ColumnWrite> writes = List.of();
        try {
            RawInputs inputs = extractor.extract(item, mapping);
            MetricResult metrics = engine.compute(inputs);
            writes = MetricFormatter.toWrites(metrics, mapping.outputColumns());

            if (dryRun) {
                log.info("[DRY RUN] Would update {} ({}): {}", item.getName(), item.getId(), describe(writes));
                return SyncOutcome.skipped(item, writes);
            }

            List<ColumnWrite> payload = writes;
            retry.run("Update item " + item.getId(), () -> store.writeColumns(item.getId(), payload));
            log.info("Updated {} ({}): {}", item.getName(), item.getId(), describe(writes));
            return SyncOutcome.updated(item, writes);
        } catch (RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Item {} ({}) failed: {}", item.getName(), item.getId(), reason);
            return SyncOutcome.failed(item, writes, reason);
        }
    }

    public Optional<SyncReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    public FieldMapping getMapping() {
        return mapping;
    }

    private SyncReport finish(SyncReport.SyncReportBuilder builder) {
        SyncReport report = builder.finishedAt(LocalDateTime.now()).build();
        this.lastReport = report;
        return report;
    }

    private static String describe(List<ColumnWrite> writes) {
        StringBuilder sb = new StringBuilder();
        for (ColumnWrite w : writes) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(w.columnId()).append('=').append(w.isClear() ? "<clear>" : w.value().get());
        }
        return sb.toString();
    }
}
