package com.jay.dcf.model;

import java.util.List;

/**
 * Everything produced by a single end-to-end valuation: the inputs, the projection,
 * the discounting pass and the aggregated result.
 */
public record ValuationRun(
    ValuationInputs inputs,
    List<ProjectedPeriod> projection,
    DiscountResult discounting,
    ValuationResult result
) {
    public ValuationRun {
        projection = List.copyOf(projection);
    }
}
