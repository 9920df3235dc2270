package com.jay.dcf.layer2_discounting;

import com.jay.dcf.exception.InvalidRateRelationshipException;
import com.jay.dcf.exception.InvalidScheduleException;
import com.jay.dcf.model.DiscountResult;
import com.jay.dcf.model.DiscountedFlow;
import com.jay.dcf.model.ProjectedPeriod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 2: Discounting Engine.
 * Brings projected cash flows to present value and adds a Gordon growth terminal value.
 *
 *   PV[t]  = flow[t] / (1 + r)^t
 *   TV     = flow[last] × (1 + g) / (r − g)
 *   PV(TV) = TV / (1 + r)^horizon
 *
 * The terminal value is realised at the end of the explicit horizon, so it is discounted at the
 * same power as the final projected period. No rounding is applied here.
 */
@Slf4j
@Component
public class DiscountingEngine {

    public DiscountResult discount(List<ProjectedPeriod> projection, double discountRate, double terminalGrowthRate) {
        List<Double> flows = new ArrayList<>(projection.size());
        for (ProjectedPeriod p : projection) flows.add(p.freeCashFlow());
        return discountCashFlows(flows, discountRate, terminalGrowthRate);
    }

    /**
     * Discounts an ordered sequence of cash flows; element i falls in period i + 1.
     *
     * @throws InvalidRateRelationshipException if discountRate is not strictly greater than terminalGrowthRate
     */
    public DiscountResult discountCashFlows(List<Double> cashFlows, double discountRate, double terminalGrowthRate) {
        checkRates(discountRate, terminalGrowthRate);
        if (cashFlows == null || cashFlows.isEmpty()) {
            throw new InvalidScheduleException("No cash flows to discount");
        }

        List<DiscountedFlow> discounted = new ArrayList<>(cashFlows.size());
        for (int t = 1; t <= cashFlows.size(); t++) {
            double flow = cashFlows.get(t - 1);
            discounted.add(new DiscountedFlow(t, flow, presentValue(flow, discountRate, t)));
        }

        int horizon = cashFlows.size();
        double terminalValue = terminalValue(cashFlows.get(horizon - 1), discountRate, terminalGrowthRate);
        double discountedTerminalValue = presentValue(terminalValue, discountRate, horizon);

        log.debug("Discounted {} flows at r={} g={}: TV={} PV(TV)={}",
            horizon, discountRate, terminalGrowthRate, terminalValue, discountedTerminalValue);
        return new DiscountResult(discounted, terminalValue, discountedTerminalValue,
            discountRate, terminalGrowthRate);
    }

    /** Gordon growth value of a perpetuity starting one period after {@code finalFlow}. */
    public double terminalValue(double finalFlow, double discountRate, double terminalGrowthRate) {
        checkRates(discountRate, terminalGrowthRate);
        return finalFlow * (1 + terminalGrowthRate) / (discountRate - terminalGrowthRate);
    }

    public static double presentValue(double amount, double discountRate, int period) {
        return amount / Math.pow(1 + discountRate, period);
    }

    // Written as a negated '>' so that NaN rates are rejected too
    private static void checkRates(double discountRate, double terminalGrowthRate) {
        if (!(discountRate > terminalGrowthRate)) {
            throw new InvalidRateRelationshipException(discountRate, terminalGrowthRate);
        }
    }
}
