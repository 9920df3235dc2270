package com.jay.dcf.model;

/**
 * Growth and free-cash-flow margin assumed for one projected period.
 * Both are decimals: 0.20 means 20%.
 */
public record PeriodAssumption(double growthRate, double margin) {}
