package com.jay.dcf.layer3_valuation;

import com.jay.dcf.exception.InvalidShareCountException;
import com.jay.dcf.model.DiscountResult;
import com.jay.dcf.model.DiscountedFlow;
import com.jay.dcf.model.ValuationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValuationAggregatorTest {

    private final ValuationAggregator aggregator = new ValuationAggregator();

    private DiscountResult scenario() {
        return new DiscountResult(List.of(new DiscountedFlow(1, 42.0, 42.0 / 1.10)),
            618.0, 618.0 / 1.10, 0.10, 0.03);
    }

    @Test
    void aggregate_singlePeriodScenario() {
        ValuationResult r = aggregator.aggregate(scenario(), 0.0, 10.0);

        assertEquals(600.0, r.getEnterpriseValue(), 1e-9);
        assertEquals(600.0, r.getEquityValue(), 1e-9);
        assertEquals(60.0, r.getImpliedPerShareValue(), 1e-9);
        assertEquals(0.10, r.getDiscountRate());
        assertEquals(0.03, r.getTerminalGrowthRate());
        assertNull(r.getUpsidePct());
    }

    @Test
    void aggregate_netCashIncreasesEquity() {
        ValuationResult noDebt = aggregator.aggregate(scenario(), 0.0, 10.0);
        ValuationResult netCash = aggregator.aggregate(scenario(), -50.0, 10.0);
        ValuationResult netDebt = aggregator.aggregate(scenario(), 50.0, 10.0);

        assertTrue(netCash.getEquityValue() > noDebt.getEquityValue());
        assertEquals(650.0, netCash.getEquityValue(), 1e-9);
        assertEquals(550.0, netDebt.getEquityValue(), 1e-9);
        assertEquals(noDebt.getEnterpriseValue(), netCash.getEnterpriseValue(), 1e-12);
    }

    @Test
    void aggregate_reportsUpsideAgainstMarketPrice() {
        ValuationResult up = aggregator.aggregate(scenario(), 0.0, 10.0, 48.0);
        ValuationResult down = aggregator.aggregate(scenario(), 0.0, 10.0, 75.0);

        assertEquals(25.0, up.getUpsidePct(), 1e-9);
        assertEquals(-20.0, down.getUpsidePct(), 1e-9);
        assertEquals(48.0, up.getCurrentPrice());
    }

    @Test
    void aggregate_ignoresNonPositivePrice() {
        ValuationResult r = aggregator.aggregate(scenario(), 0.0, 10.0, 0.0);
        assertNull(r.getUpsidePct());
        assertNull(r.getCurrentPrice());
    }

    @Test
    void aggregate_rejectsNonPositiveShareCount() {
        InvalidShareCountException e = assertThrows(InvalidShareCountException.class,
            () -> aggregator.aggregate(scenario(), 0.0, 0.0));
        assertEquals(0.0, e.getSharesOutstanding());
        assertThrows(InvalidShareCountException.class, () -> aggregator.aggregate(scenario(), 0.0, -5.0));
    }
}
