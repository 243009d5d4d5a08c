package com.jay.underwriter.layer2_analysis;

import com.jay.underwriter.model.CashflowVector;
import com.jay.underwriter.model.MetricResult;
import com.jay.underwriter.model.RawInputs;
import com.jay.underwriter.model.enums.Metric;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Layer 2 — Underwriting metrics for one record. Pure; no I/O.
 *
 *   cap_rate        = noi / total_project_cost × 100          (cost > 0)
 *   ltv             = loan_amount / total_project_cost × 100  (cost > 0)
 *   yield_on_cost   = noi / total_project_cost × 100          (cost > 0)
 *   spread          = yield_on_cost − market_cap_rate         (yield present, market cap > 0)
 *   reversion_value = noi / (exit_cap_rate / 100)             (exit cap > 0)
 *   cash_on_cash    = year_1_cf / equity × 100                (equity > 0)
 *   irr             = IrrSolver root × 100                    (solver converged)
 *   equity_multiple = Σ inflows / equity                      (equity > 0)
 *
 * A metric whose precondition fails is absent, not zero.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsEngine {

    private final CashflowBuilder cashflowBuilder;
    private final IrrSolver irrSolver;

    public MetricResult compute(RawInputs inputs) {
        Map<Metric, OptionalDouble> values = new EnumMap<>(Metric.class);

        double cost = inputs.getTotalProjectCost();
        double noi = inputs.getNoi();
        double equity = Math.abs(inputs.getEquityInvestment());

        // ── Cost-based ratios ──────────────────────────────────────────────────
        OptionalDouble yieldOnCost = cost > 0 ? percent(noi / cost) : OptionalDouble.empty();
        values.put(Metric.CAP_RATE, cost > 0 ? percent(noi / cost) : OptionalDouble.empty());
        values.put(Metric.LTV, cost > 0 ? percent(inputs.getLoanAmount() / cost) : OptionalDouble.empty());
        values.put(Metric.YIELD_ON_COST, yieldOnCost);

        double marketCap = inputs.getMarketCapRate();
        values.put(Metric.SPREAD, yieldOnCost.isPresent() && marketCap > 0
            ? finite(yieldOnCost.getAsDouble() - marketCap)
            : OptionalDouble.empty());

        // ── Exit ───────────────────────────────────────────────────────────────
        double exitCap = inputs.getExitCapRate();
        values.put(Metric.REVERSION_VALUE, exitCap > 0 ? finite(noi / (exitCap / 100.0)) : OptionalDouble.empty());

        // ── Equity returns ─────────────────────────────────────────────────────
        CashflowVector cashflows = cashflowBuilder.build(inputs);
        values.put(Metric.CASH_ON_CASH, equity > 0 ? percent(inputs.getYear1Cf() / equity) : OptionalDouble.empty());
        values.put(Metric.EQUITY_MULTIPLE, equity > 0 ? finite(cashflows.inflowTotal() / equity) : OptionalDouble.empty());

        OptionalDouble irr = irrSolver.solve(cashflows);
        values.put(Metric.IRR, irr.isPresent() ? percent(irr.getAsDouble()) : OptionalDouble.empty());

        MetricResult result = new MetricResult(values);
        log.debug("Metrics for cashflows {}: {}", cashflows, result);
        return result;
    }

    private static OptionalDouble percent(double ratio) {
        return finite(ratio * 100.0);
    }

    private static OptionalDouble finite(double v) {
        return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
    }
}
