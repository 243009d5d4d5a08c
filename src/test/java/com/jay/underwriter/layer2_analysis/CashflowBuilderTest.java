package com.jay.underwriter.layer2_analysis;

import com.jay.underwriter.model.CashflowVector;
import com.jay.underwriter.model.RawInputs;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CashflowBuilderTest {

    private final CashflowBuilder builder = new CashflowBuilder();

    private static RawInputs inputs(double equity, double sale) {
        return RawInputs.builder()
            .equityInvestment(equity)
            .year1Cf(10).year2Cf(10).year3Cf(10).year4Cf(10).year5Cf(10)
            .saleProceeds(sale)
            .build();
    }

    @Test
    void build_shouldPutEquityOutflowFirstAndSaleInFinalPeriod() {
        CashflowVector v = builder.build(inputs(100, 50));

        assertThat(v.toArray()).containsExactly(-100, 10, 10, 10, 10, 60);
        assertThat(v.periods()).isEqualTo(5);
    }

    @Test
    void build_shouldTreatNegativeEquityAsMagnitude() {
        assertThat(builder.build(inputs(-100, 50)).toArray()).containsExactly(-100, 10, 10, 10, 10, 60);
    }

    @Test
    void build_withZeroEquity_shouldHaveNoOutflowAndNoSignChange() {
        CashflowVector v = builder.build(inputs(0, 50));

        assertThat(v.get(0)).isEqualTo(0.0);
        assertThat(Double.doubleToRawLongBits(v.get(0))).isEqualTo(Double.doubleToRawLongBits(0.0));
        assertThat(v.hasSignChange()).isFalse();
    }

    @Test
    void inflowTotal_shouldSumEverythingAfterPeriodZero() {
        assertThat(builder.build(inputs(100, 100)).inflowTotal()).isEqualTo(150.0);
    }
}
