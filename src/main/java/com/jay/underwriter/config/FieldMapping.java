package com.jay.underwriter.config;

import com.jay.underwriter.model.enums.InputField;
import com.jay.underwriter.model.enums.Metric;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Logical field → board column id mapping. Built from config.yaml; nothing in
 * the engine or sync loop refers to a column id directly.
 */
public final class FieldMapping {

    private final Map<InputField, String> inputColumns;
    private final Map<Metric, OutputColumn> outputColumns;

    public FieldMapping(Map<InputField, String> inputColumns, Map<Metric, OutputColumn> outputColumns) {
        this.inputColumns = Collections.unmodifiableMap(copy(inputColumns, InputField.class));
        this.outputColumns = Collections.unmodifiableMap(copy(outputColumns, Metric.class));
    }

    public Optional<String> inputColumn(InputField field) {
        return Optional.ofNullable(inputColumns.get(field));
    }

    public Optional<OutputColumn> outputColumn(Metric metric) {
        return Optional.ofNullable(outputColumns.get(metric));
    }

    public Map<InputField, String> inputColumns() {
        return inputColumns;
    }

    public Map<Metric, OutputColumn> outputColumns() {
        return outputColumns;
    }

    private static <K extends Enum<K>, V> EnumMap<K, V> copy(Map<K, V> source, Class<K> type) {
        EnumMap<K, V> map = new EnumMap<>(type);
        if (source != null) map.putAll(source);
        return map;
    }
}
