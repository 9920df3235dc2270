package com.jay.dcf.layer4_sensitivity;

import com.jay.dcf.config.ValuationConfig;
import com.jay.dcf.exception.InvalidScheduleException;
import com.jay.dcf.exception.InvalidShareCountException;
import com.jay.dcf.layer1_projection.ProjectionEngine;
import com.jay.dcf.layer2_discounting.DiscountingEngine;
import com.jay.dcf.layer3_valuation.ValuationAggregator;
import com.jay.dcf.model.GrowthSchedule;
import com.jay.dcf.model.PeriodAssumption;
import com.jay.dcf.model.SensitivityCell;
import com.jay.dcf.model.SensitivityGrid;
import com.jay.dcf.model.ValuationInputs;
import com.jay.dcf.model.enums.CellStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SensitivityAnalyzerTest {

    private final ValuationConfig config = new ValuationConfig();
    private final SensitivityAnalyzer analyzer = new SensitivityAnalyzer(
        new ProjectionEngine(), new DiscountingEngine(), new ValuationAggregator(), config);

    @AfterEach
    void tearDown() {
        analyzer.shutdown();
    }

    private ValuationInputs scenario() {
        return ValuationInputs.builder()
            .label("single-period")
            .baseRevenue(100.0)
            .schedule(GrowthSchedule.of(new PeriodAssumption(0.20, 0.35)))
            .discountRate(0.10)
            .terminalGrowthRate(0.03)
            .netDebt(0.0)
            .sharesOutstanding(10.0)
            .build();
    }

    @Test
    void sweep_producesEveryCellInAxisOrder() {
        List<Double> rates = List.of(0.12, 0.08, 0.10);
        List<Double> growths = List.of(0.01, 0.03);
        SensitivityGrid grid = analyzer.sweep(scenario(), rates, growths);

        assertEquals(3, grid.rowCount());
        assertEquals(2, grid.columnCount());
        assertEquals(6, grid.cellCount());
        assertEquals(6, grid.validCellCount());
        assertEquals(rates, grid.discountRates());
        assertEquals(growths, grid.terminalGrowthRates());
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 2; j++) {
                SensitivityCell c = grid.cell(i, j);
                assertEquals(i, c.row());
                assertEquals(j, c.column());
                assertEquals(rates.get(i), c.discountRate());
                assertEquals(growths.get(j), c.terminalGrowthRate());
            }
        }
    }

    @Test
    void sweep_cellMatchesSingleRunValue() {
        SensitivityGrid grid = analyzer.sweep(scenario(), List.of(0.10), List.of(0.03));
        assertEquals(60.0, grid.valueAt(0, 0).getAsDouble(), 1e-9);
    }

    @Test
    void sweep_marksInvalidRatePairsWithoutAborting() {
        List<Double> rates = List.of(0.03, 0.05, 0.08);
        List<Double> growths = List.of(0.02, 0.05, 0.06);
        SensitivityGrid grid = analyzer.sweep(scenario(), rates, growths);

        assertEquals(9, grid.cellCount());
        // r=0.03: only g=0.02 works; r=0.05: only g=0.02; r=0.08: all three
        assertEquals(5, grid.validCellCount());
        assertEquals(4, grid.invalidCellCount());

        SensitivityCell equal = grid.cell(1, 1);
        assertFalse(equal.valid());
        assertEquals(CellStatus.INVALID_RATE_RELATIONSHIP, equal.status());
        assertNull(equal.impliedPerShareValue());
        assertNotNull(equal.reason());
        assertTrue(grid.valueAt(1, 1).isEmpty());

        assertTrue(grid.cell(2, 2).valid());
        assertTrue(grid.valueAt(0, 0).isPresent());
    }

    @Test
    void sweep_valuesFallAsDiscountRateRisesAndRiseWithTerminalGrowth() {
        SensitivityGrid grid = analyzer.sweep(scenario(),
            RateAxis.linspace(0.10, 0.15, 6), RateAxis.linspace(0.03, 0.05, 6));

        for (int i = 1; i < grid.rowCount(); i++) {
            for (int j = 0; j < grid.columnCount(); j++) {
                assertTrue(grid.valueAt(i, j).getAsDouble() < grid.valueAt(i - 1, j).getAsDouble());
            }
        }
        for (int i = 0; i < grid.rowCount(); i++) {
            for (int j = 1; j < grid.columnCount(); j++) {
                assertTrue(grid.valueAt(i, j).getAsDouble() > grid.valueAt(i, j - 1).getAsDouble());
            }
        }
    }

    @Test
    void sweep_parallelMatchesSequential() {
        List<Double> rates = RateAxis.linspace(0.02, 0.15, 14);
        List<Double> growths = RateAxis.linspace(0.0, 0.06, 7);
        SensitivityGrid sequential = analyzer.sweep(scenario(), rates, growths);

        config.sensitivity().setParallel(true);
        config.sensitivity().setParallelism(3);
        SensitivityGrid parallel = analyzer.sweep(scenario(), rates, growths);

        assertEquals(sequential, parallel);
    }

    @Test
    void sweep_picksUpParallelismChangesBetweenSweeps() {
        List<Double> rates = RateAxis.linspace(0.08, 0.15, 8);
        List<Double> growths = List.of(0.02, 0.03);
        config.sensitivity().setParallel(true);

        config.sensitivity().setParallelism(2);
        SensitivityGrid first = analyzer.sweep(scenario(), rates, growths);
        assertEquals(2, analyzer.poolSize());

        config.sensitivity().setParallelism(5);
        SensitivityGrid second = analyzer.sweep(scenario(), rates, growths);
        assertEquals(5, analyzer.poolSize());
        assertEquals(first, second);
    }

    @Test
    void executor_namesEachWorkerThreadDistinctly() throws Exception {
        config.sensitivity().setParallelism(3);
        CountDownLatch allStarted = new CountDownLatch(3);
        Set<String> names = new HashSet<>();
        List<CompletableFuture<String>> futures = List.of(
            CompletableFuture.supplyAsync(() -> holdUntilAllStarted(allStarted), analyzer.executor()),
            CompletableFuture.supplyAsync(() -> holdUntilAllStarted(allStarted), analyzer.executor()),
            CompletableFuture.supplyAsync(() -> holdUntilAllStarted(allStarted), analyzer.executor()));
        for (CompletableFuture<String> f : futures) names.add(f.get(5, TimeUnit.SECONDS));

        assertEquals(3, names.size());
        names.forEach(n -> assertTrue(n.startsWith("sensitivity-worker-"), n));
    }

    private static String holdUntilAllStarted(CountDownLatch latch) {
        latch.countDown();
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return Thread.currentThread().getName();
    }

    @Test
    void sweep_emptyAxisGivesEmptyGrid() {
        SensitivityGrid grid = analyzer.sweep(scenario(), List.of(), List.of(0.02));
        assertEquals(0, grid.cellCount());
    }

    @Test
    void sweep_propagatesScheduleAndShareErrors() {
        ValuationInputs badShares = scenario().toBuilder().sharesOutstanding(0).build();
        assertThrows(InvalidShareCountException.class,
            () -> analyzer.sweep(badShares, List.of(0.10), List.of(0.03)));

        ValuationInputs badSchedule = scenario().toBuilder().schedule(GrowthSchedule.of(List.of())).build();
        assertThrows(InvalidScheduleException.class,
            () -> analyzer.sweep(badSchedule, List.of(0.10), List.of(0.03)));
    }
}
