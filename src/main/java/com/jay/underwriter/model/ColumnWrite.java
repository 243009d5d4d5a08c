package com.jay.underwriter.model;

import com.jay.underwriter.model.enums.ColumnType;

import java.util.Optional;

/**
 * A single output column in a write: either a formatted value or an explicit clear.
 */
public record ColumnWrite(String columnId, ColumnType type, Optional<String> value) {

    public static ColumnWrite set(String columnId, ColumnType type, String formatted) {
        return new ColumnWrite(columnId, type, Optional.of(formatted));
    }

    public static ColumnWrite clear(String columnId, ColumnType type) {
        return new ColumnWrite(columnId, type, Optional.empty());
    }

    public boolean isClear() {
        return value.isEmpty();
    }
}
