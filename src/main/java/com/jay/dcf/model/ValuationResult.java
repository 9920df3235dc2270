package com.jay.dcf.model;

import lombok.Builder;
import lombok.Value;

/**
 * Enterprise value, equity value and implied per-share value for one
 * (discount rate, terminal growth) pair.
 */
@Value
@Builder
public class ValuationResult {
    double discountRate;
    double terminalGrowthRate;

    double sumOfDiscountedFlows;
    double discountedTerminalValue;
    double enterpriseValue;

    double netDebt;
    double equityValue;
    double sharesOutstanding;
    double impliedPerShareValue;

    // null when no positive market price was supplied
    Double currentPrice;
    Double upsidePct;

    /** (implied / price − 1) × 100. */
    public static double upsidePct(double impliedPerShareValue, double currentPrice) {
        return (impliedPerShareValue / currentPrice - 1) * 100;
    }
}
