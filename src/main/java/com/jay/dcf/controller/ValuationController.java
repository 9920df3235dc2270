package com.jay.dcf.controller;

import com.jay.dcf.config.ValuationConfig;
import com.jay.dcf.model.AssumptionSet;
import com.jay.dcf.model.SegmentForecastInputs;
import com.jay.dcf.model.SegmentForecastYear;
import com.jay.dcf.model.SensitivityGrid;
import com.jay.dcf.model.SensitivityRequest;
import com.jay.dcf.model.ValuationRun;
import com.jay.dcf.service.ValuationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * REST API: DCF valuation.
 *
 * Endpoints:
 *   GET  /api/status                        Engine status and configured defaults
 *   GET  /api/scenarios                     Configured scenarios (name → description)
 *   GET  /api/scenarios/{name}/valuation    Single valuation run for a scenario
 *   GET  /api/scenarios/{name}/sensitivity  Sensitivity grid over the configured axes
 *   GET  /api/scenarios/{name}/report       Plain-text report (valuation + grid)
 *   POST /api/valuation                     Value an ad-hoc assumption set
 *   POST /api/sensitivity                   Sweep an ad-hoc assumption set
 *   POST /api/forecast/segments             Segment revenue forecast
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ValuationController {

    private final ValuationService valuationService;
    private final ValuationConfig config;

    // ── GET /api/status ────────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
            "status", "RUNNING",
            "timestamp", LocalDateTime.now().toString(),
            "scenarios", config.scenarios().size(),
            "defaultTerminalGrowthRate", config.defaults().getTerminalGrowthRate(),
            "parallelSweep", config.sensitivity().isParallel()
        ));
    }

    // ── Scenarios ──────────────────────────────────────────────────────────────

    @GetMapping("/scenarios")
    public ResponseEntity<Map<String, String>> scenarios() {
        return ResponseEntity.ok(valuationService.scenarios());
    }

    @GetMapping("/scenarios/{name}/valuation")
    public ResponseEntity<ValuationRun> valueScenario(@PathVariable String name) {
        return ResponseEntity.ok(valuationService.valueScenario(name));
    }

    @GetMapping("/scenarios/{name}/sensitivity")
    public ResponseEntity<SensitivityGrid> sweepScenario(@PathVariable String name) {
        return ResponseEntity.ok(valuationService.sweepScenario(name));
    }

    @GetMapping(value = "/scenarios/{name}/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> report(@PathVariable String name) {
        return ResponseEntity.ok(valuationService.reportScenario(name));
    }

    // ── Ad-hoc ─────────────────────────────────────────────────────────────────

    @PostMapping("/valuation")
    public ResponseEntity<ValuationRun> value(@RequestBody AssumptionSet assumptions) {
        return ResponseEntity.ok(valuationService.value(assumptions));
    }

    @PostMapping("/sensitivity")
    public ResponseEntity<SensitivityGrid> sweep(@RequestBody SensitivityRequest request) {
        return ResponseEntity.ok(valuationService.sweep(request));
    }

    @PostMapping("/forecast/segments")
    public ResponseEntity<List<SegmentForecastYear>> forecastSegments(@RequestBody SegmentForecastInputs inputs) {
        return ResponseEntity.ok(valuationService.forecastSegments(inputs));
    }
}
