package com.jay.dcf.layer1_projection;

import com.jay.dcf.exception.InvalidScheduleException;
import com.jay.dcf.model.GrowthSchedule;
import com.jay.dcf.model.PeriodAssumption;
import com.jay.dcf.model.ProjectedPeriod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 1: Projection Engine.
 * Compounds a base-period revenue through a growth schedule and applies each period's
 * free-cash-flow margin.
 *
 *   revenue[t] = revenue[t-1] × (1 + growth[t]),  revenue[0] = base revenue
 *   fcf[t]     = revenue[t] × margin[t]
 *
 * Pure: every call returns a fresh immutable list.
 */
@Slf4j
@Component
public class ProjectionEngine {

    public List<ProjectedPeriod> project(double baseRevenue, GrowthSchedule schedule) {
        validate(schedule);

        List<ProjectedPeriod> projection = new ArrayList<>(schedule.horizon());
        double revenue = baseRevenue;
        for (int t = 1; t <= schedule.horizon(); t++) {
            PeriodAssumption p = schedule.period(t);
            revenue = revenue * (1 + p.growthRate());
            projection.add(new ProjectedPeriod(t, revenue, revenue * p.margin()));
        }

        log.debug("Projected {} periods from base revenue {}: final revenue {}, final FCF {}",
            projection.size(), baseRevenue,
            projection.get(projection.size() - 1).revenue(),
            projection.get(projection.size() - 1).freeCashFlow());
        return List.copyOf(projection);
    }

    /** Rejects empty schedules, non-finite entries and growth rates of -100% or below. */
    public void validate(GrowthSchedule schedule) {
        if (schedule == null || schedule.isEmpty()) {
            throw new InvalidScheduleException("Growth schedule must contain at least one period");
        }
        for (int t = 1; t <= schedule.horizon(); t++) {
            PeriodAssumption p = schedule.period(t);
            if (!Double.isFinite(p.growthRate()) || p.growthRate() <= -1) {
                throw new InvalidScheduleException(t,
                    "growth rate must be finite and greater than -1, got " + p.growthRate());
            }
            if (!Double.isFinite(p.margin())) {
                throw new InvalidScheduleException(t, "margin must be finite, got " + p.margin());
            }
        }
    }
}
