package com.pairguard.hft.execution.state;

import com.pairguard.hft.events.HftEventTypes;
import com.pairguard.hft.execution.config.MarketStateConfig;
import com.pairguard.hft.execution.model.MarketKey;
import com.pairguard.hft.execution.support.MutableClock;
import com.pairguard.hft.execution.support.RecordingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class MarketStateManagerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final MarketKey BTC = MarketKey.of("btc-updown-15m-1705312800", "BTC");
    private static final BookData BOOK = new BookData(new BigDecimal("0.52"), new BigDecimal("0.47"));

    private MutableClock clock;
    private RecordingEventPublisher events;
    private MarketStateManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        events = new RecordingEventPublisher();
        manager = new MarketStateManager(MarketStateConfig.defaults(), clock, events);
    }

    @Test
    void oneSidedInventoryEntersPairingAndTimesOutOnce() {
        // Given: 40 UP and nothing on DOWN with 200s left
        TickResult first = manager.processTick(BTC, bd(40), bd(0), 200, bd("0.50"), BOOK);
        assertThat(first.state()).isEqualTo(PairingState.ONE_SIDED_UP);

        // When: a hedge chunk starts pairing
        assertThat(manager.beginPairing(BTC, PairingReason.HEDGE_CHUNK, BOOK)).isTrue();
        MarketStateContext ctx = manager.getContext(BTC);
        assertThat(ctx.getState()).isEqualTo(PairingState.PAIRING);
        assertThat(ctx.getPairingStartedAt()).isEqualTo(NOW);
        assertThat(ctx.getPairingReason()).isEqualTo(PairingReason.HEDGE_CHUNK);
        assertThat(events.ofType(HftEventTypes.MARKET_STATE_PAIRING_STARTED)).hasSize(1);

        // Then: inventory on one side only still derives ONE_SIDED_UP
        assertThat(manager.determineState(ctx, 200)).isEqualTo(PairingState.ONE_SIDED_UP);

        // And: after the timeout it reverts to the leading side exactly once
        clock.advanceSeconds(46);
        PairingTimeoutResult timedOut = manager.checkPairingTimeout(ctx);
        assertThat(timedOut.timedOut()).isTrue();
        assertThat(timedOut.timeInPairingSeconds()).isEqualTo(46.0);
        assertThat(timedOut.revertedTo()).isEqualTo(PairingState.ONE_SIDED_UP);
        assertThat(ctx.getState()).isEqualTo(PairingState.ONE_SIDED_UP);
        assertThat(ctx.getPairingStartedAt()).isNull();

        assertThat(manager.checkPairingTimeout(ctx).timedOut()).isFalse();
        assertThat(events.ofType(HftEventTypes.MARKET_STATE_PAIRING_TIMEOUT)).hasSize(1);
    }

    @Test
    void emptyHedgeLegDropsBackToOneSidedOnTheNextTick() {
        manager.processTick(BTC, bd(40), bd(0), 200, bd("0.50"), BOOK);
        manager.beginPairing(BTC, PairingReason.HEDGE_CHUNK, BOOK);

        clock.advanceSeconds(5);
        TickResult next = manager.processTick(BTC, bd(40), bd(0), 195, bd("0.50"), BOOK);

        assertThat(next.state()).isEqualTo(PairingState.ONE_SIDED_UP);
        assertThat(next.pairingTimedOut()).isFalse();
        assertThat(manager.getContext(BTC).getPairingStartedAt()).isNull();
    }

    @Test
    void partiallyHedgedPairingIsStickyUntilTheTimeout() {
        // Given: pairing started on 40 UP
        manager.processTick(BTC, bd(40), bd(0), 200, bd("0.50"), BOOK);
        manager.beginPairing(BTC, PairingReason.HEDGE_CHUNK, BOOK);

        // When: the hedge leg is partly filled
        clock.advanceSeconds(20);
        TickResult during = manager.processTick(BTC, bd(40), bd(5), 180, bd("0.50"), BOOK);

        // Then: PAIRING holds until the deadline, then reverts to the leading side once
        assertThat(during.state()).isEqualTo(PairingState.PAIRING);
        assertThat(during.pairingTimedOut()).isFalse();

        clock.advanceSeconds(26);
        TickResult timedOut = manager.processTick(BTC, bd(40), bd(5), 154, bd("0.50"), BOOK);
        assertThat(timedOut.pairingTimedOut()).isTrue();
        assertThat(timedOut.shouldCancelUnfilledHedges()).isTrue();
        assertThat(timedOut.timeInPairingSeconds()).isEqualTo(46.0);
        assertThat(timedOut.state()).isEqualTo(PairingState.ONE_SIDED_UP);

        TickResult after = manager.processTick(BTC, bd(40), bd(5), 153, bd("0.50"), BOOK);
        assertThat(after.pairingTimedOut()).isFalse();
        assertThat(after.state()).isEqualTo(PairingState.ONE_SIDED_UP);
        assertThat(events.ofType(HftEventTypes.MARKET_STATE_PAIRING_TIMEOUT)).hasSize(1);
    }

    @Test
    void pairingCompletesWhenBothSidesBalance() {
        manager.processTick(BTC, bd(40), bd(0), 400, null, BOOK);
        manager.beginPairing(BTC, PairingReason.HEDGE_CHUNK, BOOK);

        TickResult paired = manager.processTick(BTC, bd(40), bd(35), 390, null, BOOK);

        assertThat(paired.state()).isEqualTo(PairingState.PAIRED);
        assertThat(manager.getContext(BTC).getPairingStartedAt()).isNull();
    }

    @Test
    void imbalanceBeyondToleranceIsOneSidedOnTheLargerLeg() {
        assertThat(manager.processTick(BTC, bd(40), bd(30), 400, null, BOOK).state()).isEqualTo(PairingState.ONE_SIDED_UP);
        assertThat(manager.processTick(BTC, bd(10), bd(30), 400, null, BOOK).state()).isEqualTo(PairingState.ONE_SIDED_DOWN);
        assertThat(manager.processTick(BTC, bd(10), bd(10), 400, null, BOOK).state()).isEqualTo(PairingState.ONE_SIDED_DOWN);
        assertThat(manager.processTick(BTC, bd(0), bd(0), 400, null, BOOK).state()).isEqualTo(PairingState.FLAT);
    }

    @Test
    void unwindWindowIsAbsorbing() {
        assertThat(manager.processTick(BTC, bd(40), bd(40), 45, null, BOOK).state()).isEqualTo(PairingState.UNWIND_ONLY);
        assertThat(manager.processTick(BTC, bd(0), bd(0), 600, null, BOOK).state()).isEqualTo(PairingState.UNWIND_ONLY);
        assertThat(manager.beginPairing(BTC, PairingReason.HEDGE_CHUNK, BOOK)).isFalse();
    }

    @Test
    void beginPairingIsANoOpOutsideOneSidedStates() {
        manager.processTick(BTC, bd(0), bd(0), 400, null, BOOK);

        assertThat(manager.beginPairing(BTC, PairingReason.PAIR_EDGE, BOOK)).isFalse();
        assertThat(manager.getState(BTC)).isEqualTo(PairingState.FLAT);
    }

    @Test
    void hedgeCapUsesPerAssetBaseWithoutHistory() {
        MarketStateContext ctx = manager.getContext(BTC);

        DynamicHedgeCap cap = manager.calculateDynamicHedgeCap("BTC", ctx);
        assertThat(cap.recentVol()).isNull();
        assertThat(cap.finalCapCents()).isEqualTo(1.0);
        assertThat(manager.isHedgePriceAllowed("BTC", ctx, new BigDecimal("101.0"))).isTrue();
        assertThat(manager.isHedgePriceAllowed("BTC", ctx, new BigDecimal("101.5"))).isFalse();
        assertThat(manager.isHedgePriceAllowed("BTC", ctx, null)).isFalse();
        assertThat(manager.calculateDynamicHedgeCap("DOGE", ctx).finalCapCents()).isEqualTo(2.0);
    }

    @Test
    void volatilityWidensTheCapUpToTheAssetMaximum() {
        manager.processTick(BTC, bd(0), bd(0), 600, new BigDecimal("0.50"), BOOK);
        clock.advanceSeconds(30);
        manager.processTick(BTC, bd(0), bd(0), 570, new BigDecimal("0.51"), BOOK);
        MarketStateContext ctx = manager.getContext(BTC);

        DynamicHedgeCap cap = manager.calculateDynamicHedgeCap("BTC", ctx);

        assertThat(cap.recentVol()).isCloseTo(0.02, offset(1e-9));
        assertThat(cap.dynamicCapCents()).isGreaterThan(2.0);
        assertThat(cap.finalCapCents()).isEqualTo(2.0);
        assertThat(manager.isHedgePriceAllowed("BTC", ctx, new BigDecimal("101.9"))).isTrue();
        assertThat(manager.isHedgePriceAllowed("BTC", ctx, new BigDecimal("102.1"))).isFalse();
        assertThat(events.ofType(HftEventTypes.MARKET_STATE_HEDGE_CAP)).hasSize(1);
    }

    @Test
    void priceHistoryOutsideTheLookbackIsDropped() {
        manager.processTick(BTC, bd(0), bd(0), 900, new BigDecimal("0.50"), BOOK);
        clock.advanceSeconds(301);
        manager.processTick(BTC, bd(0), bd(0), 599, new BigDecimal("0.60"), BOOK);

        assertThat(manager.getContext(BTC).priceHistorySnapshot()).hasSize(1);
        assertThat(manager.calculateDynamicHedgeCap("BTC", manager.getContext(BTC)).recentVol()).isNull();
    }

    @Test
    void hedgeChunkIsAQuarterOfTheImbalanceWithinBounds() {
        assertThat(manager.calculateBoundedHedgeChunk(bd(40)).boundedChunk()).isEqualByComparingTo("25");
        assertThat(manager.calculateBoundedHedgeChunk(bd(200)).boundedChunk()).isEqualByComparingTo("50");
        HedgeChunk big = manager.calculateBoundedHedgeChunk(bd(1000));
        assertThat(big.rawChunk()).isEqualByComparingTo("250");
        assertThat(big.boundedChunk()).isEqualByComparingTo("100");

        assertThat(manager.isHedgeSizeAllowed(bd(25))).isTrue();
        assertThat(manager.isHedgeSizeAllowed(bd(24))).isFalse();
        assertThat(manager.isHedgeSizeAllowed(bd(101))).isFalse();
    }

    @Test
    void clearMarketForgetsState() {
        manager.processTick(BTC, bd(40), bd(0), 400, null, BOOK);

        manager.clearMarket(BTC);

        assertThat(manager.findContext(BTC)).isEmpty();
        assertThat(manager.getState(BTC)).isEqualTo(PairingState.FLAT);
    }

    private static BigDecimal bd(long v) {
        return BigDecimal.valueOf(v);
    }

    private static BigDecimal bd(String v) {
        return new BigDecimal(v);
    }
}
