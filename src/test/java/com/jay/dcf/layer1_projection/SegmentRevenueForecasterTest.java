package com.jay.dcf.layer1_projection;

import com.jay.dcf.exception.InvalidScheduleException;
import com.jay.dcf.model.SegmentForecastInputs;
import com.jay.dcf.model.SegmentForecastYear;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SegmentRevenueForecasterTest {

    private static final double EPS = 1e-9;

    private final SegmentRevenueForecaster forecaster = new SegmentRevenueForecaster();

    private SegmentForecastInputs twoSegments(int years) {
        Map<String, Double> base = new LinkedHashMap<>();
        base.put("Data Center", 100.0);
        base.put("Gaming", 50.0);
        Map<String, Double> growth = new LinkedHashMap<>();
        growth.put("Data Center", 0.50);
        growth.put("Gaming", -0.10);
        Map<String, List<Double>> diversification = new LinkedHashMap<>();
        diversification.put("Data Center", List.of(1.0, 0.8));
        return SegmentForecastInputs.builder()
            .baseRevenues(base)
            .growthRates(growth)
            .diversificationFactors(diversification)
            .years(years)
            .baseGrossMargin(0.735)
            .annualMarginDecline(0.02)
            .grossMarginFloor(0.68)
            .netIncomeMargin(0.5)
            .build();
    }

    @Test
    void forecast_compoundsAndScalesEachSegment() {
        List<SegmentForecastYear> years = forecaster.forecast(twoSegments(3));

        assertEquals(3, years.size());

        SegmentForecastYear y1 = years.get(0);
        assertEquals(150.0, y1.segmentRevenues().get("Data Center"), EPS);
        assertEquals(45.0, y1.segmentRevenues().get("Gaming"), EPS);
        assertEquals(195.0, y1.totalRevenue(), EPS);
        assertEquals(97.5, y1.netIncome(), EPS);

        // year 2 multiplier 0.8 applies on top of compounding
        SegmentForecastYear y2 = years.get(1);
        assertEquals(150.0 * 1.5 * 0.8, y2.segmentRevenues().get("Data Center"), EPS);
        assertEquals(40.5, y2.segmentRevenues().get("Gaming"), EPS);

        // year 3 reuses the last multiplier
        SegmentForecastYear y3 = years.get(2);
        assertEquals(180.0 * 1.5 * 0.8, y3.segmentRevenues().get("Data Center"), EPS);
    }

    @Test
    void forecast_sharesSumToOneHundredAndKeepSegmentOrder() {
        for (SegmentForecastYear y : forecaster.forecast(twoSegments(2))) {
            double sum = y.segmentSharePct().values().stream().mapToDouble(Double::doubleValue).sum();
            assertEquals(100.0, sum, 1e-9);
            assertEquals(List.of("Data Center", "Gaming"), List.copyOf(y.segmentRevenues().keySet()));
        }
    }

    @Test
    void forecast_grossMarginDeclinesToFloor() {
        List<SegmentForecastYear> years = forecaster.forecast(twoSegments(4));

        assertEquals(0.715, years.get(0).grossMargin(), EPS);
        assertEquals(0.695, years.get(1).grossMargin(), EPS);
        assertEquals(0.68, years.get(2).grossMargin(), EPS);
        assertEquals(0.68, years.get(3).grossMargin(), EPS);
    }

    @Test
    void forecast_rejectsMissingGrowthRateAndBadHorizon() {
        SegmentForecastInputs in = twoSegments(2);
        in.getGrowthRates().remove("Gaming");
        assertThrows(InvalidScheduleException.class, () -> forecaster.forecast(in));

        assertThrows(InvalidScheduleException.class, () -> forecaster.forecast(twoSegments(0)));

        SegmentForecastInputs empty = twoSegments(2);
        empty.setBaseRevenues(Map.of());
        assertThrows(InvalidScheduleException.class, () -> forecaster.forecast(empty));
    }
}
