package com.jay.underwriter.model.enums;

/**
 * How a formatted metric is wrapped when written to a board column.
 *   TEXT / NUMBERS  → plain string, cleared with ""
 *   WRAPPED_NUMBER  → {"number": "12.34"}, cleared with {}
 */
public enum ColumnType {
    TEXT,
    NUMBERS,
    WRAPPED_NUMBER
}
