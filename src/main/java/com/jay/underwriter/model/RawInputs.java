package com.jay.underwriter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scalars extracted from one board item. Every field defaults to 0.0.
 * Cap rates are expressed in percent (5.5 means 5.5%).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawInputs {

    private double equityInvestment;
    private double noi;
    private double totalProjectCost;
    private double loanAmount;
    private double marketCapRate;
    private double exitCapRate;

    // ── Hold-period cash flows ────────────────────────────────────────────────
    private double year1Cf;
    private double year2Cf;
    private double year3Cf;
    private double year4Cf;
    private double year5Cf;
    private double saleProceeds;

    public double[] periodCashflows() {
        return new double[]{year1Cf, year2Cf, year3Cf, year4Cf, year5Cf};
    }
}
