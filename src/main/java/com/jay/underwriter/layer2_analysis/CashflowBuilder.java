package com.jay.underwriter.layer2_analysis;

import com.jay.underwriter.model.CashflowVector;
import com.jay.underwriter.model.RawInputs;
import org.springframework.stereotype.Component;

/**
 * Assembles [-equity, y1, y2, y3, y4, y5 + sale] for one record.
 * The outflow sign is applied here regardless of the sign the input carried.
 */
@Component
public class CashflowBuilder {

    public CashflowVector build(RawInputs inputs) {
        double equity = Math.abs(inputs.getEquityInvestment());
        double[] periods = inputs.periodCashflows();

        double[] amounts = new double[periods.length + 1];
        amounts[0] = equity > 0 ? -equity : 0.0;
        System.arraycopy(periods, 0, amounts, 1, periods.length);
        amounts[amounts.length - 1] += inputs.getSaleProceeds();
        return CashflowVector.of(amounts);
    }
}
