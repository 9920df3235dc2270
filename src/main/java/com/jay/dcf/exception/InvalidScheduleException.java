package com.jay.dcf.exception;

/**
 * Thrown when a growth schedule is empty, malformed, or contains a growth rate of -100% or less.
 */
public class InvalidScheduleException extends ValuationException {

    private final Integer period;

    public InvalidScheduleException(String message) {
        super(message);
        this.period = null;
    }

    public InvalidScheduleException(int period, String message) {
        super(String.format("Period %d: %s", period, message));
        this.period = period;
    }

    /** 1-indexed offending period, or null when the schedule as a whole is invalid. */
    public Integer getPeriod() {
        return period;
    }
}
