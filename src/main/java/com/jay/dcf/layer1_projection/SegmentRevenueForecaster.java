package com.jay.dcf.layer1_projection;

import com.jay.dcf.exception.InvalidScheduleException;
import com.jay.dcf.model.SegmentForecastInputs;
import com.jay.dcf.model.SegmentForecastYear;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-year revenue forecast broken down by business segment.
 *
 * Each year a segment's revenue compounds at its own growth rate and is then scaled by that
 * year's diversification multiplier; the scaled figure is the base for the following year.
 * Gross margin declines linearly down to a floor; net income is a fixed share of total revenue.
 */
@Slf4j
@Component
public class SegmentRevenueForecaster {

    public List<SegmentForecastYear> forecast(SegmentForecastInputs in) {
        validate(in);

        Map<String, Double> current = new LinkedHashMap<>(in.getBaseRevenues());
        List<SegmentForecastYear> years = new ArrayList<>(in.getYears());

        for (int year = 1; year <= in.getYears(); year++) {
            Map<String, Double> revenues = new LinkedHashMap<>();
            double total = 0;
            for (Map.Entry<String, Double> e : current.entrySet()) {
                String segment = e.getKey();
                double grown = e.getValue() * (1 + in.getGrowthRates().get(segment));
                double adjusted = grown * multiplier(in, segment, year);
                revenues.put(segment, adjusted);
                total += adjusted;
            }

            Map<String, Double> shares = new LinkedHashMap<>();
            for (Map.Entry<String, Double> e : revenues.entrySet()) {
                shares.put(e.getKey(), total != 0 ? e.getValue() / total * 100 : 0.0);
            }

            double grossMargin = Math.max(in.getBaseGrossMargin() - year * in.getAnnualMarginDecline(),
                in.getGrossMarginFloor());
            years.add(new SegmentForecastYear(year, total, grossMargin, total * in.getNetIncomeMargin(),
                Collections.unmodifiableMap(revenues), Collections.unmodifiableMap(shares)));
            current = revenues;
        }

        log.debug("Segment forecast: {} segments over {} years, final total revenue {}",
            current.size(), in.getYears(), years.get(years.size() - 1).totalRevenue());
        return List.copyOf(years);
    }

    // Lists shorter than the horizon hold their last value; no list means no adjustment
    private double multiplier(SegmentForecastInputs in, String segment, int year) {
        if (in.getDiversificationFactors() == null) return 1.0;
        List<Double> factors = in.getDiversificationFactors().get(segment);
        if (factors == null || factors.isEmpty()) return 1.0;
        return factors.get(Math.min(year, factors.size()) - 1);
    }

    private void validate(SegmentForecastInputs in) {
        if (in == null || in.getBaseRevenues() == null || in.getBaseRevenues().isEmpty()) {
            throw new InvalidScheduleException("Segment forecast needs at least one segment");
        }
        if (in.getYears() < 1) {
            throw new InvalidScheduleException("Forecast horizon must be at least 1 year, got " + in.getYears());
        }
        for (Map.Entry<String, Double> e : in.getBaseRevenues().entrySet()) {
            if (e.getValue() == null) {
                throw new InvalidScheduleException("No base revenue for segment '" + e.getKey() + "'");
            }
            Double g = in.getGrowthRates() != null ? in.getGrowthRates().get(e.getKey()) : null;
            if (g == null) {
                throw new InvalidScheduleException("No growth rate for segment '" + e.getKey() + "'");
            }
            if (!Double.isFinite(g) || g <= -1) {
                throw new InvalidScheduleException(String.format(
                    "Growth rate for segment '%s' must be greater than -1, got %s", e.getKey(), g));
            }
            List<Double> factors = in.getDiversificationFactors() != null
                ? in.getDiversificationFactors().get(e.getKey()) : null;
            if (factors != null && factors.stream().anyMatch(f -> f == null || !Double.isFinite(f))) {
                throw new InvalidScheduleException(
                    "Diversification factors for segment '" + e.getKey() + "' must be finite numbers");
            }
        }
    }
}
