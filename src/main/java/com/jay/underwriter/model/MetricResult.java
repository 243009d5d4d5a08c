package com.jay.underwriter.model;

import com.jay.underwriter.model.enums.Metric;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Metric set for one record. A metric whose preconditions were not met is
 * absent ({@link OptionalDouble#empty()}), never a numeric zero.
 */
public final class MetricResult {

    private final Map<Metric, OptionalDouble> values;

    public MetricResult(Map<Metric, OptionalDouble> values) {
        EnumMap<Metric, OptionalDouble> copy = new EnumMap<>(Metric.class);
        for (Metric m : Metric.values()) {
            OptionalDouble v = values.get(m);
            copy.put(m, v != null ? v : OptionalDouble.empty());
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public OptionalDouble get(Metric metric) {
        return values.get(metric);
    }

    public boolean isPresent(Metric metric) {
        return values.get(metric).isPresent();
    }

    public Map<Metric, OptionalDouble> asMap() {
        return values;
    }

    /** metric key → value, with null for absent metrics. Used for JSON responses. */
    public Map<String, Double> toDisplayMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        values.forEach((m, v) -> out.put(m.key(), v.isPresent() ? v.getAsDouble() : null));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricResult)) return false;
        return values.equals(((MetricResult) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "MetricResult" + toDisplayMap();
    }
}
