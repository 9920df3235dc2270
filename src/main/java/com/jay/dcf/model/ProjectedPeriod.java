package com.jay.dcf.model;

/** One projected period: 1-indexed period, revenue and free cash flow. */
public record ProjectedPeriod(int period, double revenue, double freeCashFlow) {}
