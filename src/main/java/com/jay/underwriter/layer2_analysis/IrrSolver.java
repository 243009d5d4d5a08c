package com.jay.underwriter.layer2_analysis;

import com.jay.underwriter.config.UnderwriterConfig;
import com.jay.underwriter.model.CashflowVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Internal rate of return: the per-period rate r > -1 at which
 * NPV(r) = Σ cf[t] / (1+r)^t is zero.
 *
 * Strategy:
 *   1. No sign change in the flows → no root, absent.
 *   2. Newton–Raphson from the configured guess (10%). A root is accepted once
 *      |NPV| < tolerance and the Newton step has shrunk below 1e-12.
 *   3. If Newton leaves the domain, stalls on a flat slope, or runs out of
 *      iterations, bisect the sign-change bracket on a coarse rate grid that
 *      lies closest to the guess, down to a width of 1e-12.
 *   4. No bracket either → absent.
 *
 * A converged 0% rate is returned as present(0.0), never confused with absent.
 */
@Slf4j
@Component
public class IrrSolver {

    // Keeps iterates off the pole at r = -1
    private static final double POLE_MARGIN = 1e-6;
    private static final double MIN_BRACKET_WIDTH = 1e-12;
    private static final double STEP_PRECISION = 1e-12;
    private static final int BISECTION_ITERATIONS = 200;

    private final double initialGuess;
    private final double tolerance;
    private final int maxIterations;
    private final double gridMin;
    private final double gridMax;
    private final int gridSteps;

    @Autowired
    public IrrSolver(UnderwriterConfig config) {
        this(config.irr());
    }

    public IrrSolver(UnderwriterConfig.Irr settings) {
        this.initialGuess  = settings.getInitialGuess();
        this.tolerance     = settings.getTolerance();
        this.maxIterations = settings.getMaxIterations();
        this.gridMin       = Math.max(settings.getGridMin(), -1.0 + POLE_MARGIN);
        this.gridMax       = settings.getGridMax();
        this.gridSteps     = Math.max(1, settings.getGridSteps());
    }

    public OptionalDouble solve(CashflowVector cashflows) {
        if (!cashflows.hasSignChange()) {
            log.debug("IRR: no sign change in {} — no root", cashflows);
            return OptionalDouble.empty();
        }
        double[] flows = cashflows.toArray();

        OptionalDouble newton = newton(flows);
        if (newton.isPresent()) return newton;

        OptionalDouble bisected = bisect(flows);
        if (bisected.isEmpty()) {
            log.debug("IRR: no bracketing sign change on [{}, {}] for {}", gridMin, gridMax, cashflows);
        }
        return bisected;
    }

    public static double npv(double[] flows, double rate) {
        double factor = 1.0 / (1.0 + rate);
        double discount = 1.0;
        double sum = 0.0;
        for (double cf : flows) {
            sum += cf * discount;
            discount *= factor;
        }
        return sum;
    }

    /** dNPV/dr = Σ -t·cf[t] / (1+r)^(t+1) */
    static double npvDerivative(double[] flows, double rate) {
        double factor = 1.0 / (1.0 + rate);
        double discount = factor;
        double sum = 0.0;
        for (int t = 0; t < flows.length; t++) {
            sum -= t * flows[t] * discount;
            discount *= factor;
        }
        return sum;
    }

    // ── Newton–Raphson ────────────────────────────────────────────────────────

    private OptionalDouble newton(double[] flows) {
        double rate = initialGuess;
        for (int i = 0; i < maxIterations; i++) {
            double value = npv(flows, rate);
            if (!Double.isFinite(value)) return OptionalDouble.empty();
            if (value == 0.0) {
                log.debug("IRR: Newton hit an exact root {} after {} iterations", rate, i);
                return OptionalDouble.of(rate);
            }
            double slope = npvDerivative(flows, rate);
            if (slope == 0.0 || !Double.isFinite(slope)) {
                log.debug("IRR: flat slope at r={} — switching to bisection", rate);
                return OptionalDouble.empty();
            }
            double next = rate - value / slope;
            if (!Double.isFinite(next) || next <= -1.0 + POLE_MARGIN) {
                log.debug("IRR: Newton step from r={} left the domain — switching to bisection", rate);
                return OptionalDouble.empty();
            }
            if (Math.abs(value) < tolerance && Math.abs(next - rate) < STEP_PRECISION) {
                log.debug("IRR: Newton converged to {} after {} iterations", next, i + 1);
                return OptionalDouble.of(next);
            }
            rate = next;
        }
        log.debug("IRR: Newton did not converge in {} iterations", maxIterations);
        return OptionalDouble.empty();
    }

    // ── Bracketing fallback ───────────────────────────────────────────────────

    private OptionalDouble bisect(double[] flows) {
        double[] bracket = findBracket(flows);
        if (bracket == null) return OptionalDouble.empty();

        double lo = bracket[0];
        double hi = bracket[1];
        double npvLo = npv(flows, lo);
        for (int i = 0; i < BISECTION_ITERATIONS && hi - lo >= MIN_BRACKET_WIDTH; i++) {
            double mid = 0.5 * (lo + hi);
            double npvMid = npv(flows, mid);
            if (npvMid == 0.0) return OptionalDouble.of(mid);
            if (Math.signum(npvMid) == Math.signum(npvLo)) {
                lo = mid;
                npvLo = npvMid;
            } else {
                hi = mid;
            }
        }
        double root = 0.5 * (lo + hi);
        log.debug("IRR: bisection converged to {}", root);
        return OptionalDouble.of(root);
    }

    /**
     * Samples NPV on the rate grid and returns the sign-change interval whose
     * midpoint is nearest the initial guess, or null when NPV never changes sign.
     */
    private double[] findBracket(double[] flows) {
        double step = (gridMax - gridMin) / gridSteps;
        double[] best = null;
        double bestDistance = Double.MAX_VALUE;

        double prevRate = gridMin;
        double prevNpv = npv(flows, prevRate);
        for (int i = 1; i <= gridSteps; i++) {
            double rate = gridMin + i * step;
            double value = npv(flows, rate);
            if (Double.isFinite(prevNpv) && Double.isFinite(value)) {
                boolean crosses = prevNpv == 0.0 || value == 0.0 || (prevNpv < 0) != (value < 0);
                if (crosses) {
                    double distance = Math.abs(0.5 * (prevRate + rate) - initialGuess);
                    if (distance < bestDistance) {
                        bestDistance = distance;
                        best = exactOrInterval(prevRate, prevNpv, rate, value);
                    }
                }
            }
            prevRate = rate;
            prevNpv = value;
        }
        return best;
    }

    private static double[] exactOrInterval(double lo, double npvLo, double hi, double npvHi) {
        if (npvLo == 0.0) return new double[]{lo, lo};
        if (npvHi == 0.0) return new double[]{hi, hi};
        return new double[]{lo, hi};
    }
}
