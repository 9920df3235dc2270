package com.jay.dcf.layer4_sensitivity;

import com.jay.dcf.config.ValuationConfig;

import java.util.ArrayList;
import java.util.List;

/** Builders for sensitivity axes. */
public final class RateAxis {

    private RateAxis() {}

    /**
     * {@code steps} evenly spaced values from start to end, both inclusive.
     * A single step yields just {@code start}.
     */
    public static List<Double> linspace(double start, double end, int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException("Axis needs at least one step, got " + steps);
        }
        List<Double> values = new ArrayList<>(steps);
        if (steps == 1) {
            values.add(start);
            return List.copyOf(values);
        }
        double step = (end - start) / (steps - 1);
        for (int i = 0; i < steps - 1; i++) {
            values.add(start + i * step);
        }
        values.add(end);
        return List.copyOf(values);
    }

    public static List<Double> from(ValuationConfig.AxisRange range) {
        return linspace(range.getStart(), range.getEnd(), range.getSteps());
    }
}
