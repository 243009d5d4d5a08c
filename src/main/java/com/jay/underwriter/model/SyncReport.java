package com.jay.underwriter.model;

import com.jay.underwriter.model.enums.OutcomeStatus;
import com.jay.underwriter.model.enums.RunStatus;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of one sync run. Returned by SyncOrchestrator.run and served by GET /api/sync/last.
 */
@Data
@Builder
public class SyncReport {

    private RunStatus     status;
    private boolean       dryRun;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    @Builder.Default
    private List<SyncOutcome> outcomes = List.of();
    private String        failureReason;   // non-null only when status == FAILED

    public long count(OutcomeStatus outcomeStatus) {
        return outcomes.stream().filter(o -> o.status() == outcomeStatus).count();
    }

    public String summary() {
        if (status == RunStatus.FAILED) return "FAILED: " + failureReason;
        if (status == RunStatus.NO_RECORDS) return "No records on board";
        return String.format("%d updated, %d skipped, %d failed",
            count(OutcomeStatus.UPDATED), count(OutcomeStatus.SKIPPED), count(OutcomeStatus.FAILED));
    }
}
