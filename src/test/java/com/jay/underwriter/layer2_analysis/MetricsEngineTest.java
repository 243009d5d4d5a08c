package com.jay.underwriter.layer2_analysis;

import com.jay.underwriter.config.UnderwriterConfig;
import com.jay.underwriter.model.MetricResult;
import com.jay.underwriter.model.RawInputs;
import com.jay.underwriter.model.enums.Metric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricsEngineTest {

    private MetricsEngine engine;

    @BeforeEach
    void setUp() {
        engine = new MetricsEngine(new CashflowBuilder(), new IrrSolver(new UnderwriterConfig.Irr()));
    }

    private static RawInputs.RawInputsBuilder stabilisedDeal() {
        return RawInputs.builder()
            .equityInvestment(100)
            .noi(8)
            .totalProjectCost(100)
            .loanAmount(65)
            .marketCapRate(5)
            .exitCapRate(6.5)
            .year1Cf(10).year2Cf(10).year3Cf(10).year4Cf(10).year5Cf(10)
            .saleProceeds(100);
    }

    @Test
    void compute_fullDeal_shouldPopulateEveryMetric() {
        MetricResult r = engine.compute(stabilisedDeal().build());

        assertThat(r.get(Metric.CAP_RATE).getAsDouble()).isCloseTo(8.0, within(1e-9));
        assertThat(r.get(Metric.LTV).getAsDouble()).isCloseTo(65.0, within(1e-9));
        assertThat(r.get(Metric.YIELD_ON_COST).getAsDouble()).isCloseTo(8.0, within(1e-9));
        assertThat(r.get(Metric.SPREAD).getAsDouble()).isCloseTo(3.0, within(1e-9));
        assertThat(r.get(Metric.REVERSION_VALUE).getAsDouble()).isCloseTo(123.0769, within(1e-4));
        assertThat(r.get(Metric.CASH_ON_CASH).getAsDouble()).isCloseTo(10.0, within(1e-9));
        assertThat(r.get(Metric.IRR).getAsDouble()).isCloseTo(10.0, within(1e-4));
        assertThat(r.get(Metric.EQUITY_MULTIPLE).getAsDouble()).isCloseTo(1.40, within(1e-9));
    }

    @Test
    void compute_zeroProjectCost_shouldOmitCostRatiosAndSpread() {
        MetricResult r = engine.compute(stabilisedDeal().totalProjectCost(0).build());

        assertThat(r.isPresent(Metric.CAP_RATE)).isFalse();
        assertThat(r.isPresent(Metric.LTV)).isFalse();
        assertThat(r.isPresent(Metric.YIELD_ON_COST)).isFalse();
        assertThat(r.isPresent(Metric.SPREAD)).isFalse();
        // unrelated metrics unaffected
        assertThat(r.isPresent(Metric.IRR)).isTrue();
        assertThat(r.isPresent(Metric.REVERSION_VALUE)).isTrue();
    }

    @Test
    void compute_negativeProjectCost_shouldOmitCostRatios() {
        MetricResult r = engine.compute(stabilisedDeal().totalProjectCost(-50).build());

        assertThat(r.isPresent(Metric.CAP_RATE)).isFalse();
        assertThat(r.isPresent(Metric.LTV)).isFalse();
    }

    @Test
    void compute_zeroMarketCap_shouldOmitSpreadOnly() {
        MetricResult r = engine.compute(stabilisedDeal().marketCapRate(0).build());

        assertThat(r.isPresent(Metric.SPREAD)).isFalse();
        assertThat(r.isPresent(Metric.YIELD_ON_COST)).isTrue();
    }

    @Test
    void compute_zeroExitCap_shouldOmitReversionValue() {
        assertThat(engine.compute(stabilisedDeal().exitCapRate(0).build()).isPresent(Metric.REVERSION_VALUE)).isFalse();
    }

    @Test
    void compute_zeroEquity_shouldOmitEquityMetricsAndIrr() {
        MetricResult r = engine.compute(stabilisedDeal().equityInvestment(0).build());

        assertThat(r.isPresent(Metric.CASH_ON_CASH)).isFalse();
        assertThat(r.isPresent(Metric.EQUITY_MULTIPLE)).isFalse();
        assertThat(r.isPresent(Metric.IRR)).isFalse();
        assertThat(r.isPresent(Metric.CAP_RATE)).isTrue();
    }

    @Test
    void compute_negativeEquity_shouldUseMagnitude() {
        MetricResult r = engine.compute(stabilisedDeal().equityInvestment(-100).build());

        assertThat(r.get(Metric.EQUITY_MULTIPLE).getAsDouble()).isCloseTo(1.40, within(1e-9));
        assertThat(r.get(Metric.CASH_ON_CASH).getAsDouble()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void compute_breakEvenDeal_shouldReportZeroIrrAsPresent() {
        RawInputs inputs = RawInputs.builder().equityInvestment(100).year1Cf(50).year2Cf(50).build();

        MetricResult r = engine.compute(inputs);

        assertThat(r.isPresent(Metric.IRR)).isTrue();
        assertThat(r.get(Metric.IRR).getAsDouble()).isCloseTo(0.0, within(1e-4));
        assertThat(r.get(Metric.EQUITY_MULTIPLE).getAsDouble()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void compute_emptyInputs_shouldLeaveEveryMetricAbsent() {
        MetricResult r = engine.compute(new RawInputs());

        for (Metric m : Metric.values()) {
            assertThat(r.isPresent(m)).as(m.key()).isFalse();
        }
    }

    @Test
    void compute_shouldBePure() {
        RawInputs inputs = stabilisedDeal().build();

        assertThat(engine.compute(inputs)).isEqualTo(engine.compute(inputs));
    }
}
