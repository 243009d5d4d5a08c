package com.jay.underwriter.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Arrays;

/**
 * Ordered signed cash flows: index 0 is the equity outflow, then one entry per period.
 * Immutable.
 */
@EqualsAndHashCode
public final class CashflowVector {

    private final double[] amounts;

    private CashflowVector(double[] amounts) {
        this.amounts = amounts;
    }

    public static CashflowVector of(double... amounts) {
        if (amounts == null || amounts.length == 0) {
            throw new IllegalArgumentException("A cash-flow vector needs at least one amount");
        }
        return new CashflowVector(amounts.clone());
    }

    public int size() {
        return amounts.length;
    }

    /** Number of periods after the initial investment. */
    public int periods() {
        return amounts.length - 1;
    }

    public double get(int period) {
        return amounts[period];
    }

    /** Sum of every amount after period 0. */
    public double inflowTotal() {
        double total = 0;
        for (int t = 1; t < amounts.length; t++) total += amounts[t];
        return total;
    }

    /**
     * True when the non-zero amounts contain both a positive and a negative value.
     * Without one there is no rate at which the NPV crosses zero.
     */
    public boolean hasSignChange() {
        boolean positive = false;
        boolean negative = false;
        for (double a : amounts) {
            if (a > 0) positive = true;
            else if (a < 0) negative = true;
        }
        return positive && negative;
    }

    @JsonValue
    public double[] toArray() {
        return amounts.clone();
    }

    @Override
    public String toString() {
        return Arrays.toString(amounts);
    }
}
