package com.jay.underwriter.layer2_analysis;

import com.jay.underwriter.config.OutputColumn;
import com.jay.underwriter.model.ColumnWrite;
import com.jay.underwriter.model.MetricResult;
import com.jay.underwriter.model.enums.Metric;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Presentation of metrics: two decimal places, HALF_UP, no locale grouping.
 */
public final class MetricFormatter {

    private MetricFormatter() {}

    public static String format(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot format non-finite metric value " + value);
        }
        String text = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).toPlainString();
        return "-0.00".equals(text) ? "0.00" : text;
    }

    /**
     * Output column writes for every mapped metric, in metric order.
     * Absent metrics become explicit clears.
     */
    public static List<ColumnWrite> toWrites(MetricResult result, Map<Metric, OutputColumn> outputs) {
        List<ColumnWrite> writes = new ArrayList<>();
        for (Metric metric : Metric.values()) {
            OutputColumn column = outputs.get(metric);
            if (column == null) continue;
            OptionalDouble value = result.get(metric);
            writes.add(value.isPresent()
                ? ColumnWrite.set(column.columnId(), column.type(), format(value.getAsDouble()))
                : ColumnWrite.clear(column.columnId(), column.type()));
        }
        return writes;
    }
}
