package com.jay.underwriter.model;

import com.jay.underwriter.model.enums.OutcomeStatus;

import java.util.List;

/**
 * Per-item result of a sync run. {@code writes} is what was (or, in dry-run, would have been) sent.
 */
public record SyncOutcome(String itemId, String itemName, OutcomeStatus status,
                          List<ColumnWrite> writes, String reason) {

    public static SyncOutcome updated(BoardItem item, List<ColumnWrite> writes) {
        return new SyncOutcome(item.getId(), item.getName(), OutcomeStatus.UPDATED, List.copyOf(writes), null);
    }

    public static SyncOutcome skipped(BoardItem item, List<ColumnWrite> writes) {
        return new SyncOutcome(item.getId(), item.getName(), OutcomeStatus.SKIPPED, List.copyOf(writes), "dry-run");
    }

    public static SyncOutcome failed(BoardItem item, List<ColumnWrite> writes, String reason) {
        return new SyncOutcome(item.getId(), item.getName(), OutcomeStatus.FAILED, List.copyOf(writes), reason);
    }
}
