package com.jay.dcf.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** CAPM and capital-structure inputs for the cost-of-capital calculation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WaccInputs {
    private double riskFreeRate;
    private double marketRiskPremium;
    private double beta;
    private double costOfDebt;       // pre-tax
    private double taxRate;
    private double debtWeight;
    private double equityWeight;
}
