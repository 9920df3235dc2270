package com.jay.dcf.model;

import lombok.Builder;
import lombok.Value;

/**
 * Caller-supplied constants for one valuation run. Built once, never mutated.
 * Net debt may be negative (net cash). Current price is optional and only feeds the upside figure.
 */
@Value
@Builder(toBuilder = true)
public class ValuationInputs {
    String label;
    double baseRevenue;
    GrowthSchedule schedule;
    double discountRate;
    double terminalGrowthRate;
    double netDebt;
    double sharesOutstanding;
    Double currentPrice;

    public int horizon() {
        return schedule == null ? 0 : schedule.horizon();
    }
}
