package com.jay.dcf.exception;

public class InvalidShareCountException extends ValuationException {

    private final double sharesOutstanding;

    public InvalidShareCountException(double sharesOutstanding) {
        super(String.format("Shares outstanding must be positive, got %s", sharesOutstanding));
        this.sharesOutstanding = sharesOutstanding;
    }

    public double getSharesOutstanding() {
        return sharesOutstanding;
    }
}
