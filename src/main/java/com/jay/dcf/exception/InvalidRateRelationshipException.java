package com.jay.dcf.exception;

/**
 * Thrown when the discount rate does not strictly exceed the terminal growth rate.
 * The Gordon growth terminal value is undefined (or negative) in that case.
 */
public class InvalidRateRelationshipException extends ValuationException {

    private final double discountRate;
    private final double terminalGrowthRate;

    public InvalidRateRelationshipException(double discountRate, double terminalGrowthRate) {
        super(String.format("Discount rate %.4f must exceed terminal growth rate %.4f",
            discountRate, terminalGrowthRate));
        this.discountRate = discountRate;
        this.terminalGrowthRate = terminalGrowthRate;
    }

    public double getDiscountRate() {
        return discountRate;
    }

    public double getTerminalGrowthRate() {
        return terminalGrowthRate;
    }
}
