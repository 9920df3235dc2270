package com.jay.dcf.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.jay.dcf.exception.InvalidScheduleException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered per-period growth/margin assumptions that drive a projection.
 * The schedule length is the projection horizon.
 *
 * Range checks on the growth rates (> -1, non-empty) are applied by ProjectionEngine
 * when the schedule is used, not here, so a schedule can be built and inspected freely.
 */
public final class GrowthSchedule {

    private final List<PeriodAssumption> periods;

    private GrowthSchedule(List<PeriodAssumption> periods) {
        this.periods = Collections.unmodifiableList(new ArrayList<>(periods));
    }

    public static GrowthSchedule of(List<PeriodAssumption> periods) {
        Objects.requireNonNull(periods, "periods");
        for (PeriodAssumption p : periods) {
            Objects.requireNonNull(p, "period assumption");
        }
        return new GrowthSchedule(periods);
    }

    public static GrowthSchedule of(PeriodAssumption... periods) {
        return of(List.of(periods));
    }

    /** Same growth and margin for every period. */
    public static GrowthSchedule constant(double growthRate, double margin, int horizon) {
        if (horizon < 1) {
            throw new InvalidScheduleException("Horizon must be at least 1 period, got " + horizon);
        }
        List<PeriodAssumption> periods = new ArrayList<>(horizon);
        for (int i = 0; i < horizon; i++) {
            periods.add(new PeriodAssumption(growthRate, margin));
        }
        return new GrowthSchedule(periods);
    }

    /** Varying growth at a single free-cash-flow margin. */
    public static GrowthSchedule withConstantMargin(List<Double> growthRates, double margin) {
        Objects.requireNonNull(growthRates, "growthRates");
        List<PeriodAssumption> periods = new ArrayList<>(growthRates.size());
        for (Double g : growthRates) {
            periods.add(new PeriodAssumption(Objects.requireNonNull(g, "growth rate"), margin));
        }
        return new GrowthSchedule(periods);
    }

    /** Parallel growth and margin lists, one entry per period. */
    public static GrowthSchedule withMargins(List<Double> growthRates, List<Double> margins) {
        Objects.requireNonNull(growthRates, "growthRates");
        Objects.requireNonNull(margins, "margins");
        if (growthRates.size() != margins.size()) {
            throw new InvalidScheduleException(String.format(
                "Growth and margin lists differ in length (%d vs %d)", growthRates.size(), margins.size()));
        }
        List<PeriodAssumption> periods = new ArrayList<>(growthRates.size());
        for (int i = 0; i < growthRates.size(); i++) {
            periods.add(new PeriodAssumption(
                Objects.requireNonNull(growthRates.get(i), "growth rate"),
                Objects.requireNonNull(margins.get(i), "margin")));
        }
        return new GrowthSchedule(periods);
    }

    @JsonValue
    public List<PeriodAssumption> periods() { return periods; }
    public int horizon()                    { return periods.size(); }
    public boolean isEmpty()                { return periods.isEmpty(); }

    /** Assumption for a 1-indexed period. */
    public PeriodAssumption period(int t) { return periods.get(t - 1); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GrowthSchedule other)) return false;
        return periods.equals(other.periods);
    }

    @Override
    public int hashCode() {
        return periods.hashCode();
    }

    @Override
    public String toString() {
        return "GrowthSchedule" + periods;
    }
}
