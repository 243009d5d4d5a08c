package com.jay.underwriter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One column value of a board item as returned by the store.
 * {@code value} is the machine-readable JSON payload (may be null),
 * {@code text} is the human-readable rendering.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldValue {
    private String columnId;
    private String text;
    private String value;
}
