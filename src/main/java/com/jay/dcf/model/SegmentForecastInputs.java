package com.jay.dcf.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Inputs for a multi-year segment revenue forecast.
 * Segment order in {@code baseRevenues} is preserved in the output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentForecastInputs {
    private Map<String, Double> baseRevenues;
    private Map<String, Double> growthRates;
    // Per-year multipliers; a list shorter than the horizon repeats its last value, a missing one means 1.0
    private Map<String, List<Double>> diversificationFactors;
    private int years;
    private double baseGrossMargin;
    private double annualMarginDecline;
    private double grossMarginFloor;
    private double netIncomeMargin;
}
