package com.pairguard.hft.execution.engine;

import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.execution.model.MarketInventory;
import com.pairguard.hft.execution.model.MarketKey;
import com.pairguard.hft.execution.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InventoryTrackerTest {

    private static final MarketKey MARKET = MarketKey.of("btc-updown-15m-1705312800", "BTC");

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
    private final InventoryTracker tracker = new InventoryTracker(clock);

    @Test
    void accumulatesSharesAndCostBasisPerOutcome() {
        tracker.recordFill(MARKET, Outcome.UP, new BigDecimal("30"), new BigDecimal("0.40"));
        clock.advanceSeconds(2);
        tracker.recordFill(MARKET, Outcome.UP, new BigDecimal("10"), new BigDecimal("0.48"));
        MarketInventory inv = tracker.recordFill(MARKET, Outcome.DOWN, new BigDecimal("15"), new BigDecimal("0.50"));

        assertThat(inv.upShares()).isEqualByComparingTo("40");
        assertThat(inv.avgCost(Outcome.UP)).isEqualByComparingTo("0.42");
        assertThat(inv.pairedShares()).isEqualByComparingTo("15");
        assertThat(inv.unpairedShares()).isEqualByComparingTo("25");
        assertThat(inv.leadingOutcome()).isEqualTo(Outcome.UP);
        assertThat(inv.lastUpFillPrice()).isEqualByComparingTo("0.48");
        assertThat(inv.lastUpFillAt()).isEqualTo(clock.instant());
    }

    @Test
    void ignoresEmptyFillsAndForgetsClearedMarkets() {
        assertThat(tracker.recordFill(MARKET, Outcome.UP, BigDecimal.ZERO, new BigDecimal("0.40")).upShares()).isZero();
        assertThat(tracker.get(MARKET).avgCost(Outcome.DOWN)).isNull();

        tracker.recordFill(MARKET, Outcome.DOWN, BigDecimal.ONE, new BigDecimal("0.40"));
        tracker.clear(MARKET);

        assertThat(tracker.snapshot()).isEmpty();
    }
}
