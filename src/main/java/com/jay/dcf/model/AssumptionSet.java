package com.jay.dcf.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Raw valuation assumptions as they arrive from valuation.yaml scenarios or a request body.
 * Turned into {@link ValuationInputs} by the ValuationService.
 *
 * Margins: either a per-period {@code margins} list (same length as {@code growthRates})
 * or one {@code fcfMargin} for all periods.
 * Discount rate: when absent, computed from {@code wacc} if given, otherwise defaults.discount_rate.
 * Terminal growth: when absent, the configured default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssumptionSet {
    private String description;
    private double baseRevenue;
    private List<Double> growthRates;
    private List<Double> margins;
    private Double fcfMargin;
    private Double discountRate;
    private Double terminalGrowthRate;
    private WaccInputs wacc;
    private double netDebt;
    private double sharesOutstanding;
    private Double currentPrice;
}
