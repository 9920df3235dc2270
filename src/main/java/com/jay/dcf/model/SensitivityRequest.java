package com.jay.dcf.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Body of POST /api/sensitivity. Missing axes fall back to the configured ranges. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensitivityRequest {
    private AssumptionSet assumptions;
    private List<Double> discountRates;
    private List<Double> terminalGrowthRates;
}
