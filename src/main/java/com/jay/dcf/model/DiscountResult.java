package com.jay.dcf.model;

import java.util.List;

/**
 * Output of a single discounting pass.
 * The terminal value belongs to the final period and is discounted at that same power.
 */
public record DiscountResult(
    List<DiscountedFlow> flows,
    double terminalValue,
    double discountedTerminalValue,
    double discountRate,
    double terminalGrowthRate
) {
    public DiscountResult {
        flows = List.copyOf(flows);
    }

    public double sumOfPresentValues() {
        double sum = 0;
        for (DiscountedFlow f : flows) sum += f.presentValue();
        return sum;
    }
}
