package com.jay.dcf.model;

/** A nominal cash flow and its present value at the period it falls in. */
public record DiscountedFlow(int period, double cashFlow, double presentValue) {}
