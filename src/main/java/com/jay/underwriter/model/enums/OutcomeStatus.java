package com.jay.underwriter.model.enums;

public enum OutcomeStatus {
    UPDATED,
    SKIPPED,
    FAILED
}
