package com.jay.underwriter.layer2_analysis;

import com.jay.underwriter.config.OutputColumn;
import com.jay.underwriter.model.ColumnWrite;
import com.jay.underwriter.model.MetricResult;
import com.jay.underwriter.model.enums.ColumnType;
import com.jay.underwriter.model.enums.Metric;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MetricFormatterTest {

    @Test
    void format_shouldUseTwoDecimals() {
        assertThat(MetricFormatter.format(10)).isEqualTo("10.00");
        assertThat(MetricFormatter.format(1.4)).isEqualTo("1.40");
        assertThat(MetricFormatter.format(123.076923)).isEqualTo("123.08");
        assertThat(MetricFormatter.format(1_234_567.891)).isEqualTo("1234567.89");
        assertThat(MetricFormatter.format(-3.456)).isEqualTo("-3.46");
    }

    @Test
    void format_shouldNotRenderNegativeZero() {
        assertThat(MetricFormatter.format(-0.001)).isEqualTo("0.00");
        assertThat(MetricFormatter.format(-0.0)).isEqualTo("0.00");
    }

    @Test
    void format_nonFinite_shouldThrow() {
        assertThatThrownBy(() -> MetricFormatter.format(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formattedValue_shouldParseBackWithinHalfACent() {
        NumericParser parser = new NumericParser();
        double[] samples = {0.0, 9.999, 10.004999, 1.394, -12.3456, 87_654.321, 0.0049};

        for (double v : samples) {
            assertThat(parser.parseText(MetricFormatter.format(v))).isCloseTo(v, within(0.005));
        }
    }

    @Test
    void toWrites_shouldFormatPresentAndClearAbsent() {
        Map<Metric, OptionalDouble> values = new EnumMap<>(Metric.class);
        values.put(Metric.IRR, OptionalDouble.of(12.3456));
        values.put(Metric.EQUITY_MULTIPLE, OptionalDouble.empty());
        values.put(Metric.CAP_RATE, OptionalDouble.of(6.0));
        MetricResult result = new MetricResult(values);

        Map<Metric, OutputColumn> outputs = new EnumMap<>(Metric.class);
        outputs.put(Metric.EQUITY_MULTIPLE, new OutputColumn("em", ColumnType.NUMBERS));
        outputs.put(Metric.IRR, new OutputColumn("irr", ColumnType.WRAPPED_NUMBER));

        List<ColumnWrite> writes = MetricFormatter.toWrites(result, outputs);

        assertThat(writes).containsExactly(
            ColumnWrite.set("irr", ColumnType.WRAPPED_NUMBER, "12.35"),
            ColumnWrite.clear("em", ColumnType.NUMBERS));
        assertThat(writes).extracting(ColumnWrite::isClear).containsExactly(false, true);
    }
}
