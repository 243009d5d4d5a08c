package com.jay.underwriter.model.enums;

import java.util.Arrays;
import java.util.Optional;

public enum Metric {
    CAP_RATE("cap_rate"),
    LTV("ltv"),
    YIELD_ON_COST("yield_on_cost"),
    SPREAD("spread"),
    REVERSION_VALUE("reversion_value"),
    CASH_ON_CASH("cash_on_cash"),
    IRR("irr"),
    EQUITY_MULTIPLE("equity_multiple");

    private final String key;

    Metric(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<Metric> fromKey(String key) {
        return Arrays.stream(values())
            .filter(m -> m.key.equalsIgnoreCase(key == null ? "" : key.trim()))
            .findFirst();
    }
}
