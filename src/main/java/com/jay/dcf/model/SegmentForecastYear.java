package com.jay.dcf.model;

import java.util.Map;

public record SegmentForecastYear(
    int year,
    double totalRevenue,
    double grossMargin,
    double netIncome,
    Map<String, Double> segmentRevenues,
    Map<String, Double> segmentSharePct
) {}
