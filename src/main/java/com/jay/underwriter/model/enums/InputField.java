package com.jay.underwriter.model.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Logical input fields read from each board item.
 * The key is the name used in config.yaml under fields.inputs.
 */
public enum InputField {
    EQUITY_INVESTMENT("equity_investment"),
    NOI("noi"),
    TOTAL_PROJECT_COST("total_project_cost"),
    LOAN_AMOUNT("loan_amount"),
    MARKET_CAP_RATE("market_cap_rate"),
    EXIT_CAP_RATE("exit_cap_rate"),
    YEAR_1_CF("year_1_cf"),
    YEAR_2_CF("year_2_cf"),
    YEAR_3_CF("year_3_cf"),
    YEAR_4_CF("year_4_cf"),
    YEAR_5_CF("year_5_cf"),
    SALE_PROCEEDS("sale_proceeds");

    private final String key;

    InputField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<InputField> fromKey(String key) {
        return Arrays.stream(values())
            .filter(f -> f.key.equalsIgnoreCase(key == null ? "" : key.trim()))
            .findFirst();
    }
}
