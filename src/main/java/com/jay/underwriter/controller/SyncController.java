package com.jay.underwriter.controller;

import com.jay.underwriter.config.UnderwriterConfig;
import com.jay.underwriter.layer2_analysis.CashflowBuilder;
import com.jay.underwriter.layer2_analysis.MetricFormatter;
import com.jay.underwriter.layer2_analysis.MetricsEngine;
import com.jay.underwriter.layer3_sync.SyncOrchestrator;
import com.jay.underwriter.model.MetricResult;
import com.jay.underwriter.model.RawInputs;
import com.jay.underwriter.model.SyncReport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API — sync control and metric preview.
 *
 * Endpoints:
 *   GET  /api/status           — configuration summary and last run
 *   POST /api/sync/run         — run a sync now (?dryRun=true|false)
 *   GET  /api/sync/last        — full report of the last run
 *   POST /api/metrics/preview  — compute metrics for posted inputs, no board access
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SyncController {

    private final UnderwriterConfig config;
    private final SyncOrchestrator orchestrator;
    private final MetricsEngine metricsEngine;
    private final CashflowBuilder cashflowBuilder;

    // ── GET /api/status ────────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "RUNNING");
        body.put("timestamp", LocalDateTime.now().toString());
        body.put("boardId", config.monday().getBoardId());
        body.put("credentialsConfigured", config.monday().isConfigured());
        body.put("mode", config.sync().isDryRunEnabled() ? "DRY_RUN" : "LIVE");
        body.put("inputColumns", orchestrator.getMapping().inputColumns().size());
        body.put("outputColumns", orchestrator.getMapping().outputColumns().size());
        body.put("lastRun", orchestrator.getLastReport().map(SyncReport::summary).orElse("never"));
        return ResponseEntity.ok(body);
    }

    // ── POST /api/sync/run ─────────────────────────────────────────────────────

    @PostMapping("/sync/run")
    public ResponseEntity<SyncReport> runSync(@RequestParam(required = false) Boolean dryRun) {
        boolean effective = dryRun != null ? dryRun : config.sync().isDryRunEnabled();
        return ResponseEntity.ok(orchestrator.run(effective));
    }

    // ── GET /api/sync/last ─────────────────────────────────────────────────────

    @GetMapping("/sync/last")
    public ResponseEntity<SyncReport> lastSync() {
        return orchestrator.getLastReport()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // ── POST /api/metrics/preview ──────────────────────────────────────────────

    @PostMapping("/metrics/preview")
    public ResponseEntity<Map<String, Object>> preview(@RequestBody RawInputs inputs) {
        MetricResult result = metricsEngine.compute(inputs);

        Map<String, String> formatted = new LinkedHashMap<>();
        result.asMap().forEach((metric, value) ->
            formatted.put(metric.key(), value.isPresent() ? MetricFormatter.format(value.getAsDouble()) : null));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cashflows", cashflowBuilder.build(inputs).toArray());
        body.put("metrics", result.toDisplayMap());
        body.put("formatted", formatted);
        return ResponseEntity.ok(body);
    }
}
