package com.jay.underwriter.layer2_analysis;

import com.jay.underwriter.config.FieldMapping;
import com.jay.underwriter.model.BoardItem;
import com.jay.underwriter.model.RawInputs;
import com.jay.underwriter.model.enums.InputField;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads the underwriting inputs of one board item through the configured column mapping.
 * Unmapped or unparseable fields read as 0.0. Equity is always taken as a magnitude.
 */
@Component
@RequiredArgsConstructor
public class InputExtractor {

    private final NumericParser parser;

    public RawInputs extract(BoardItem item, FieldMapping mapping) {
        return RawInputs.builder()
            .equityInvestment(Math.abs(read(item, mapping, InputField.EQUITY_INVESTMENT)))
            .noi(read(item, mapping, InputField.NOI))
            .totalProjectCost(read(item, mapping, InputField.TOTAL_PROJECT_COST))
            .loanAmount(read(item, mapping, InputField.LOAN_AMOUNT))
            .marketCapRate(read(item, mapping, InputField.MARKET_CAP_RATE))
            .exitCapRate(read(item, mapping, InputField.EXIT_CAP_RATE))
            .year1Cf(read(item, mapping, InputField.YEAR_1_CF))
            .year2Cf(read(item, mapping, InputField.YEAR_2_CF))
            .year3Cf(read(item, mapping, InputField.YEAR_3_CF))
            .year4Cf(read(item, mapping, InputField.YEAR_4_CF))
            .year5Cf(read(item, mapping, InputField.YEAR_5_CF))
            .saleProceeds(read(item, mapping, InputField.SALE_PROCEEDS))
            .build();
    }

    private double read(BoardItem item, FieldMapping mapping, InputField field) {
        return mapping.inputColumn(field)
            .map(item::field)
            .map(parser::parse)
            .orElse(0.0);
    }
}
