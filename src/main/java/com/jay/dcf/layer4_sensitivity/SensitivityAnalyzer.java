package com.jay.dcf.layer4_sensitivity;

import com.jay.dcf.config.ValuationConfig;
import com.jay.dcf.exception.InvalidRateRelationshipException;
import com.jay.dcf.layer1_projection.ProjectionEngine;
import com.jay.dcf.layer2_discounting.DiscountingEngine;
import com.jay.dcf.layer3_valuation.ValuationAggregator;
import com.jay.dcf.model.DiscountResult;
import com.jay.dcf.model.ProjectedPeriod;
import com.jay.dcf.model.SensitivityCell;
import com.jay.dcf.model.SensitivityGrid;
import com.jay.dcf.model.ValuationInputs;
import com.jay.dcf.model.ValuationResult;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Layer 4: Sensitivity Analyzer.
 * Re-runs discounting and aggregation for every (discount rate, terminal growth) pair on a single,
 * already-computed projection. Only the two swept rates vary between cells.
 *
 * A pair where the discount rate does not exceed terminal growth becomes an invalid cell;
 * it never aborts the rest of the sweep. Schedule and share-count errors still propagate,
 * since they would fail every cell alike.
 *
 * Rows are independent, so with sensitivity.parallel enabled they are computed on a worker pool.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SensitivityAnalyzer {

    private final ProjectionEngine projectionEngine;
    private final DiscountingEngine discountingEngine;
    private final ValuationAggregator aggregator;
    private final ValuationConfig config;

    private final AtomicInteger workerCount = new AtomicInteger();

    private ExecutorService executor;
    private int poolSize;

    public SensitivityGrid sweep(ValuationInputs base, List<Double> discountRates, List<Double> terminalGrowthRates) {
        List<ProjectedPeriod> projection = projectionEngine.project(base.getBaseRevenue(), base.getSchedule());
        return sweep(projection, base.getNetDebt(), base.getSharesOutstanding(), base.getCurrentPrice(),
            discountRates, terminalGrowthRates);
    }

    public SensitivityGrid sweep(List<ProjectedPeriod> projection, double netDebt, double sharesOutstanding,
                                 Double currentPrice, List<Double> discountRates, List<Double> terminalGrowthRates) {
        Objects.requireNonNull(discountRates, "discountRates");
        Objects.requireNonNull(terminalGrowthRates, "terminalGrowthRates");
        discountRates.forEach(r -> Objects.requireNonNull(r, "discount rate axis entry"));
        terminalGrowthRates.forEach(g -> Objects.requireNonNull(g, "terminal growth axis entry"));
        aggregator.checkShares(sharesOutstanding);

        log.info("Sensitivity sweep: {} discount rates × {} terminal growth rates over {} periods",
            discountRates.size(), terminalGrowthRates.size(), projection.size());

        List<List<SensitivityCell>> rows;
        if (runParallel(discountRates.size())) {
            rows = sweepParallel(projection, netDebt, sharesOutstanding, currentPrice, discountRates, terminalGrowthRates);
        } else {
            rows = new ArrayList<>(discountRates.size());
            for (int i = 0; i < discountRates.size(); i++) {
                rows.add(computeRow(i, discountRates.get(i), projection, netDebt, sharesOutstanding,
                    currentPrice, terminalGrowthRates));
            }
        }

        SensitivityGrid grid = new SensitivityGrid(discountRates, terminalGrowthRates, rows);
        if (grid.invalidCellCount() > 0) {
            log.warn("Sensitivity sweep skipped {} of {} cells where discount rate <= terminal growth",
                grid.invalidCellCount(), grid.cellCount());
        }
        return grid;
    }

    private List<List<SensitivityCell>> sweepParallel(List<ProjectedPeriod> projection, double netDebt,
                                                      double shares, Double currentPrice,
                                                      List<Double> discountRates, List<Double> terminalGrowthRates) {
        List<CompletableFuture<List<SensitivityCell>>> futures = new ArrayList<>(discountRates.size());
        for (int i = 0; i < discountRates.size(); i++) {
            final int row = i;
            final double rate = discountRates.get(i);
            futures.add(CompletableFuture.supplyAsync(() ->
                computeRow(row, rate, projection, netDebt, shares, currentPrice, terminalGrowthRates), executor()));
        }
        List<List<SensitivityCell>> rows = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<List<SensitivityCell>> f : futures) rows.add(f.join());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
        return rows;
    }

    private List<SensitivityCell> computeRow(int row, double discountRate, List<ProjectedPeriod> projection,
                                             double netDebt, double shares, Double currentPrice,
                                             List<Double> terminalGrowthRates) {
        List<SensitivityCell> cells = new ArrayList<>(terminalGrowthRates.size());
        for (int col = 0; col < terminalGrowthRates.size(); col++) {
            double growth = terminalGrowthRates.get(col);
            try {
                DiscountResult discounted = discountingEngine.discount(projection, discountRate, growth);
                ValuationResult result = aggregator.aggregate(discounted, netDebt, shares, currentPrice);
                cells.add(SensitivityCell.valid(row, col, discountRate, growth, result.getImpliedPerShareValue()));
            } catch (InvalidRateRelationshipException e) {
                log.debug("Cell ({}, {}) invalid: {}", row, col, e.getMessage());
                cells.add(SensitivityCell.invalid(row, col, discountRate, growth, e.getMessage()));
            }
        }
        return cells;
    }

    private boolean runParallel(int rows) {
        return config != null && config.sensitivity().isParallel() && rows > 1;
    }

    /** Rebuilds the pool when sensitivity.parallelism has changed since it was created. */
    synchronized ExecutorService executor() {
        int threads = Math.max(1, config.sensitivity().getParallelism());
        if (executor != null && poolSize != threads) {
            log.info("Sensitivity parallelism changed {} -> {}, rebuilding worker pool", poolSize, threads);
            executor.shutdown();
            executor = null;
        }
        if (executor == null) {
            executor = Executors.newFixedThreadPool(threads, r -> {
                Thread t = new Thread(r, "sensitivity-worker-" + workerCount.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            poolSize = threads;
        }
        return executor;
    }

    synchronized int poolSize() {
        return executor == null ? 0 : poolSize;
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (executor != null) {
            executor.shutdown();
            executor = null;
            poolSize = 0;
        }
    }
}
