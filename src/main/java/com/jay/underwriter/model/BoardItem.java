package com.jay.underwriter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An investment record on the board. Owned by the store; this service only
 * reads its fields and writes back the output columns.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoardItem {

    private String id;
    private String name;

    @Builder.Default
    private Map<String, FieldValue> fields = new LinkedHashMap<>();

    /** Returns the field stored under the given column id, or null if the item has none. */
    public FieldValue field(String columnId) {
        return fields == null ? null : fields.get(columnId);
    }
}
