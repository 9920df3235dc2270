package com.jay.dcf.exception;

/**
 * Base class for caller contract violations detected by the valuation pipeline.
 * These are deterministic: retrying with the same inputs always fails the same way.
 */
public class ValuationException extends RuntimeException {

    public ValuationException(String message) {
        super(message);
    }

    public ValuationException(String message, Throwable cause) {
        super(message, cause);
    }
}
