package com.jay.dcf.service;

import com.jay.dcf.config.ValuationConfig;
import com.jay.dcf.exception.InvalidScheduleException;
import com.jay.dcf.exception.ScenarioNotFoundException;
import com.jay.dcf.layer1_projection.ProjectionEngine;
import com.jay.dcf.layer1_projection.SegmentRevenueForecaster;
import com.jay.dcf.layer2_discounting.DiscountingEngine;
import com.jay.dcf.layer2_discounting.WaccCalculator;
import com.jay.dcf.layer3_valuation.ValuationAggregator;
import com.jay.dcf.layer4_sensitivity.RateAxis;
import com.jay.dcf.layer4_sensitivity.SensitivityAnalyzer;
import com.jay.dcf.layer5_report.ValuationReportGenerator;
import com.jay.dcf.model.AssumptionSet;
import com.jay.dcf.model.DiscountResult;
import com.jay.dcf.model.GrowthSchedule;
import com.jay.dcf.model.ProjectedPeriod;
import com.jay.dcf.model.SegmentForecastInputs;
import com.jay.dcf.model.SegmentForecastYear;
import com.jay.dcf.model.SensitivityGrid;
import com.jay.dcf.model.SensitivityRequest;
import com.jay.dcf.model.ValuationInputs;
import com.jay.dcf.model.ValuationResult;
import com.jay.dcf.model.ValuationRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the full pipeline (projection → discounting → aggregation) for configured scenarios
 * or ad-hoc assumption sets, plus sensitivity sweeps and text reports.
 *
 * Used by the /api endpoints in ValuationController.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValuationService {

    private final ProjectionEngine projectionEngine;
    private final DiscountingEngine discountingEngine;
    private final ValuationAggregator aggregator;
    private final SensitivityAnalyzer sensitivityAnalyzer;
    private final WaccCalculator waccCalculator;
    private final SegmentRevenueForecaster segmentForecaster;
    private final ValuationReportGenerator reportGenerator;
    private final ValuationConfig config;

    // ── Single run ────────────────────────────────────────────────────────────

    public ValuationRun value(ValuationInputs inputs) {
        log.info("Valuing '{}' over {} periods at r={} g={}", inputs.getLabel(), inputs.horizon(),
            inputs.getDiscountRate(), inputs.getTerminalGrowthRate());

        List<ProjectedPeriod> projection = projectionEngine.project(inputs.getBaseRevenue(), inputs.getSchedule());
        DiscountResult discounted = discountingEngine.discount(projection,
            inputs.getDiscountRate(), inputs.getTerminalGrowthRate());
        ValuationResult result = aggregator.aggregate(discounted, inputs.getNetDebt(),
            inputs.getSharesOutstanding(), inputs.getCurrentPrice());

        log.info("'{}': EV={} equity={} per share={}", inputs.getLabel(),
            result.getEnterpriseValue(), result.getEquityValue(), result.getImpliedPerShareValue());
        return new ValuationRun(inputs, projection, discounted, result);
    }

    public ValuationRun value(AssumptionSet assumptions) {
        return value(toInputs("ad-hoc", assumptions));
    }

    public ValuationRun valueScenario(String name) {
        return value(toInputs(name, scenario(name)));
    }

    // ── Sensitivity ───────────────────────────────────────────────────────────

    public SensitivityGrid sweep(ValuationInputs inputs, List<Double> discountRates, List<Double> terminalGrowthRates) {
        return sensitivityAnalyzer.sweep(inputs,
            discountRates != null ? discountRates : RateAxis.from(config.sensitivity().getDiscountRateAxis()),
            terminalGrowthRates != null ? terminalGrowthRates : RateAxis.from(config.sensitivity().getTerminalGrowthAxis()));
    }

    public SensitivityGrid sweep(SensitivityRequest request) {
        if (request == null || request.getAssumptions() == null) {
            throw new InvalidScheduleException("Sensitivity request needs an assumptions block");
        }
        return sweep(toInputs("ad-hoc", request.getAssumptions()),
            request.getDiscountRates(), request.getTerminalGrowthRates());
    }

    public SensitivityGrid sweepScenario(String name) {
        return sweep(toInputs(name, scenario(name)), null, null);
    }

    // ── Reports / forecasts ───────────────────────────────────────────────────

    public String reportScenario(String name) {
        ValuationInputs inputs = toInputs(name, scenario(name));
        ValuationRun run = value(inputs);
        SensitivityGrid grid = sweep(inputs, null, null);
        return reportGenerator.generate(run) + "\n" + reportGenerator.generateGrid(grid);
    }

    public List<SegmentForecastYear> forecastSegments(SegmentForecastInputs inputs) {
        return segmentForecaster.forecast(inputs);
    }

    // ── Scenarios ─────────────────────────────────────────────────────────────

    /** Scenario name → description, in file order. */
    public Map<String, String> scenarios() {
        Map<String, String> out = new LinkedHashMap<>();
        config.scenarios().forEach((name, a) -> out.put(name, a.getDescription() != null ? a.getDescription() : ""));
        return out;
    }

    public AssumptionSet scenario(String name) {
        AssumptionSet a = config.scenarios().get(name);
        if (a == null) throw new ScenarioNotFoundException(name);
        return a;
    }

    /**
     * Resolves an assumption set into immutable inputs: builds the schedule from the margin list
     * or the single FCF margin. A missing discount rate comes from the set's own WACC inputs,
     * or from defaults.discount_rate when it has none. A missing terminal growth uses the default.
     */
    public ValuationInputs toInputs(String label, AssumptionSet a) {
        if (a == null) {
            throw new InvalidScheduleException("No assumptions supplied");
        }
        if (a.getGrowthRates() == null || a.getGrowthRates().isEmpty()) {
            throw new InvalidScheduleException("Growth schedule must contain at least one period");
        }

        GrowthSchedule schedule;
        if (a.getMargins() != null && !a.getMargins().isEmpty()) {
            schedule = GrowthSchedule.withMargins(a.getGrowthRates(), a.getMargins());
        } else if (a.getFcfMargin() != null) {
            schedule = GrowthSchedule.withConstantMargin(a.getGrowthRates(), a.getFcfMargin());
        } else {
            throw new InvalidScheduleException("Either a margin per period or a single FCF margin is required");
        }

        double discountRate;
        if (a.getDiscountRate() != null) {
            discountRate = a.getDiscountRate();
        } else if (a.getWacc() != null) {
            discountRate = waccCalculator.calculate(a.getWacc()).wacc();
            log.debug("'{}': no discount rate given, using WACC {}", label, discountRate);
        } else {
            discountRate = config.defaults().getDiscountRate();
            log.debug("'{}': no discount rate or WACC inputs given, using default {}", label, discountRate);
        }
        double terminalGrowth = a.getTerminalGrowthRate() != null
            ? a.getTerminalGrowthRate() : config.defaults().getTerminalGrowthRate();

        return ValuationInputs.builder()
            .label(label)
            .baseRevenue(a.getBaseRevenue())
            .schedule(schedule)
            .discountRate(discountRate)
            .terminalGrowthRate(terminalGrowth)
            .netDebt(a.getNetDebt())
            .sharesOutstanding(a.getSharesOutstanding())
            .currentPrice(a.getCurrentPrice())
            .build();
    }
}
