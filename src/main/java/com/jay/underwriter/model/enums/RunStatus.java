package com.jay.underwriter.model.enums;

public enum RunStatus {
    COMPLETED,
    NO_RECORDS,
    FAILED
}
