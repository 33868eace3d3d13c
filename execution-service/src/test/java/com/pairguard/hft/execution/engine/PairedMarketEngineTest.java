package com.pairguard.hft.execution.engine;

import com.pairguard.hft.config.HftProperties;
import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.events.HftEventTypes;
import com.pairguard.hft.execution.cadence.CadenceLevel;
import com.pairguard.hft.execution.model.MarketInventory;
import com.pairguard.hft.execution.model.MarketKey;
import com.pairguard.hft.execution.model.PairedMarket;
import com.pairguard.hft.execution.order.TrackedOrder;
import com.pairguard.hft.execution.priority.HedgeResolution;
import com.pairguard.hft.execution.priority.HedgeState;
import com.pairguard.hft.execution.state.PairingState;
import com.pairguard.hft.execution.support.MutableClock;
import com.pairguard.hft.execution.support.RecordingEventPublisher;
import com.pairguard.hft.execution.venue.paper.PaperVenueClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PairedMarketEngineTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private MutableClock clock;
    private PaperVenueClient venue;
    private RecordingEventPublisher events;
    private List<Long> sleeps;
    private ExecutionEngineContext ctx;
    private PairedMarketEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        venue = new PaperVenueClient(clock, BigDecimal.valueOf(1000));
        events = new RecordingEventPublisher();
        sleeps = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown();
        }
    }

    private void start(List<HftProperties.Market> configuredMarkets) {
        HftProperties.Engine engineProps = new HftProperties.Engine(false, null, null, configuredMarkets, null, null,
                null, null, null, null, null, null, null, new HftProperties.Quoting(true, 2, BigDecimal.valueOf(20), null));
        HftProperties properties = new HftProperties(null, null, null, engineProps);
        ctx = new ExecutionEngineContext(properties, venue, clock, events, new SimpleMeterRegistry(), sleeps::add);
        engine = new PairedMarketEngine(ctx);
        venue.onFill(f -> engine.onFill(f.tokenId(), f.orderId(), f.shares(), f.price()));
        engine.startIfEnabled();
    }

    private PairedMarket market(long secondsToExpiry) {
        return new PairedMarket("btc-updown-15m-1705312800", "BTC", "btc-up", "btc-down", NOW.plusSeconds(secondsToExpiry));
    }

    private void books(String upBid, String upAsk, String downBid, String downAsk) {
        venue.setBook("btc-up", bd(upBid), bd(upAsk), bd("200"), bd("200"));
        venue.setBook("btc-down", bd(downBid), bd(downAsk), bd("200"), bd("200"));
    }

    @Test
    void quotesBothSidesWhileFlat() {
        start(List.of());
        PairedMarket market = market(600);
        engine.registerMarket(market);
        books("0.30", "0.35", "0.55", "0.60");

        engine.evaluateMarket(market);

        MarketKey key = market.key();
        assertThat(ctx.getMarketStateManager().getState(key)).isEqualTo(PairingState.FLAT);
        assertThat(ctx.getOrderManager().trackedOrders(key, Outcome.UP))
                .extracting(TrackedOrder::priceKey)
                .containsExactlyInAnyOrder(bd("0.31"), bd("0.3"));
        assertThat(ctx.getOrderManager().trackedOrders(key, Outcome.DOWN))
                .extracting(TrackedOrder::priceKey)
                .containsExactlyInAnyOrder(bd("0.56"), bd("0.55"));
        assertThat(venue.getOpenOrders().orders()).hasSize(4);
    }

    @Test
    void snapshotIsPublishedOnTheCadenceWhenNotHot() {
        start(List.of());
        PairedMarket market = market(600);
        engine.registerMarket(market);
        // asks sum to 1.00, so there is no mispricing to run hot on
        books("0.30", "0.40", "0.55", "0.60");

        engine.evaluateMarket(market);
        clock.advanceMillis(100);
        engine.evaluateMarket(market);

        assertThat(ctx.getCadenceController().getLevel(market.key())).isEqualTo(CadenceLevel.WARM);
        assertThat(events.ofType(HftEventTypes.ENGINE_SNAPSHOT)).singleElement().satisfies(p -> {
            PairedMarketEngine.EngineSnapshot snapshot = (PairedMarketEngine.EngineSnapshot) p.data();
            assertThat(snapshot.state()).isEqualTo(PairingState.FLAT);
            assertThat(snapshot.secondsRemaining()).isEqualTo(600);
        });
    }

    @Test
    void doesNotQuoteWhenThePairWouldNotLockTheEdge() {
        start(List.of());
        PairedMarket market = market(600);
        engine.registerMarket(market);
        books("0.47", "0.52", "0.50", "0.55");

        engine.evaluateMarket(market);

        assertThat(venue.placeCalls()).isZero();
        assertThat(ctx.getOrderManager().hasOpenOrders(market.key())).isFalse();
    }

    @Test
    void entryFillIsHedgedThenQuotingResumesOncePaired() {
        start(List.of());
        PairedMarket market = market(600);
        MarketKey key = market.key();
        engine.registerMarket(market);
        books("0.30", "0.35", "0.55", "0.60");
        engine.evaluateMarket(market);

        // Given an entry fill on the top UP level
        String entryOrder = orderAt(key, Outcome.UP, "0.31");
        venue.fill(entryOrder, bd("20"));

        HedgeState hedge = ctx.getHedgePriorityLane().getHedgeState(key).orElseThrow();
        assertThat(hedge.getEntrySide()).isEqualTo(Outcome.UP);
        assertThat(hedge.getEntryQty()).isEqualByComparingTo("20");

        // When the market is evaluated again
        clock.advanceSeconds(1);
        engine.evaluateMarket(market);

        // Then the DOWN quotes are replaced by one maker hedge for the whole entry
        assertThat(ctx.getMarketStateManager().getState(key)).isEqualTo(PairingState.PAIRING);
        List<TrackedOrder> downOrders = ctx.getOrderManager().trackedOrders(key, Outcome.DOWN);
        assertThat(downOrders).singleElement().satisfies(o -> {
            assertThat(o.price()).isEqualByComparingTo("0.56");
            assertThat(o.size()).isEqualByComparingTo("20");
        });
        assertThat(ctx.getFundsLedger().marketReserved(key.marketId())).isEqualByComparingTo("11.20");

        venue.fill(downOrders.get(0).orderId(), bd("20"));
        assertThat(hedge.getResolution()).isEqualTo(HedgeResolution.HEDGED);
        assertThat(ctx.getHedgePriorityLane().activeHedgeCount()).isZero();
        assertThat(ctx.getFundsLedger().marketReserved(key.marketId())).isEqualByComparingTo("0");

        clock.advanceSeconds(1);
        engine.evaluateMarket(market);

        assertThat(ctx.getMarketStateManager().getState(key)).isEqualTo(PairingState.PAIRED);
        assertThat(ctx.getOrderManager().trackedOrders(key, Outcome.UP)).hasSize(2);
        assertThat(ctx.getOrderManager().trackedOrders(key, Outcome.DOWN)).hasSize(2);
        MarketInventory inv = ctx.getInventoryTracker().get(key);
        assertThat(inv.pairedShares()).isEqualByComparingTo("20");
        assertThat(inv.totalCost()).isEqualByComparingTo("17.40");
        assertThat(events.ofType(HftEventTypes.HEDGE_COMPLETED)).hasSize(1);
    }

    @Test
    void repricedAndExpiredHedgesGiveTheirReservationBack() {
        start(List.of());
        PairedMarket market = market(600);
        MarketKey key = market.key();
        engine.registerMarket(market);
        books("0.30", "0.35", "0.55", "0.60");
        engine.evaluateMarket(market);
        venue.fill(orderAt(key, Outcome.UP, "0.31"), bd("20"));
        clock.advanceSeconds(1);
        engine.evaluateMarket(market);
        assertThat(ctx.getFundsLedger().totalReserved()).isEqualByComparingTo("11.20");

        // the resting hedge is cancelled and placed again once the reprice interval passes
        clock.advanceSeconds(6);
        engine.evaluateMarket(market);

        assertThat(ctx.getOrderManager().trackedOrders(key, Outcome.DOWN)).hasSize(1);
        assertThat(venue.getOpenOrders().orders()).filteredOn(o -> o.tokenId().equals("btc-down")).hasSize(1);
        assertThat(ctx.getFundsLedger().totalReserved()).isEqualByComparingTo("11.20");

        clock.advanceSeconds(600);
        engine.evaluateMarket(market);

        assertThat(engine.activeMarketCount()).isZero();
        assertThat(venue.getOpenOrders().orders()).isEmpty();
        assertThat(ctx.getFundsLedger().totalReserved()).isEqualByComparingTo("0");
    }

    @Test
    void nearExpiryTheHedgeCrossesTheSpreadOnce() {
        start(List.of());
        PairedMarket market = market(80);
        MarketKey key = market.key();
        engine.registerMarket(market);
        books("0.30", "0.35", "0.55", "0.60");
        engine.evaluateMarket(market);
        venue.fill(orderAt(key, Outcome.UP, "0.31"), bd("20"));

        clock.advanceSeconds(1);
        engine.evaluateMarket(market);

        MarketInventory inv = ctx.getInventoryTracker().get(key);
        assertThat(inv.downShares()).isEqualByComparingTo("20");
        assertThat(inv.cost(Outcome.DOWN)).isEqualByComparingTo("12.00");
        assertThat(ctx.getHedgePriorityLane().getHedgeState(key).orElseThrow().isResolved()).isTrue();
        assertThat(ctx.getPriceGuard().lastEmergencyOrderAt(key)).isEqualTo(clock.instant());
        assertThat(events.ofType(HftEventTypes.HEDGE_EMERGENCY_EXIT)).hasSize(1);
        assertThat(venue.getBalance()).isEqualByComparingTo("981.80");
    }

    @Test
    void expiredMarketIsCancelledAndUnregistered() {
        start(List.of());
        PairedMarket market = market(600);
        engine.registerMarket(market);
        books("0.30", "0.35", "0.55", "0.60");
        engine.evaluateMarket(market);
        venue.fill(orderAt(market.key(), Outcome.UP, "0.31"), bd("20"));

        clock.advanceSeconds(600);
        engine.evaluateMarket(market);

        assertThat(engine.activeMarketCount()).isZero();
        assertThat(venue.getOpenOrders().orders()).isEmpty();
        assertThat(events.ofType(HftEventTypes.HEDGE_EXPIRED)).hasSize(1);
        assertThat(ctx.getHedgePriorityLane().getHedgeState(market.key())).isEmpty();
    }

    @Test
    void oneSidedBookSkipsTheEvaluation() {
        start(List.of());
        PairedMarket market = market(600);
        engine.registerMarket(market);
        venue.setBook("btc-up", bd("0.30"), bd("0.35"), bd("200"), bd("200"));

        engine.evaluateMarket(market);

        assertThat(venue.placeCalls()).isZero();
        assertThat(events.ofType(HftEventTypes.ENGINE_SNAPSHOT)).isEmpty();
    }

    @Test
    void configuredMarketsAreRegisteredAtStartupAndIncompleteOnesSkipped() {
        start(List.of(
                new HftProperties.Market("btc-updown-15m-1705312800", "btc", "btc-up", "btc-down", NOW.plusSeconds(600)),
                new HftProperties.Market("eth-updown-15m-1705312800", "ETH", "eth-up", null, NOW.plusSeconds(600))));

        EngineStatus status = engine.status();

        assertThat(status.activeMarkets()).isEqualTo(1);
        assertThat(status.enabled()).isFalse();
        assertThat(status.running()).isFalse();
        assertThat(status.mode()).isEqualTo("PAPER");
        assertThat(engine.market("btc-updown-15m-1705312800")).get()
                .satisfies(m -> assertThat(m.asset()).isEqualTo("BTC"));
    }

    @Test
    void tickDispatchesDueMarketsToTheWorkers() throws Exception {
        start(List.of());
        PairedMarket market = market(600);
        engine.registerMarket(market);
        books("0.30", "0.35", "0.55", "0.60");

        engine.tick();

        long deadline = System.currentTimeMillis() + 5_000;
        while (venue.getOpenOrders().orders().size() < 4 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(venue.getOpenOrders().orders()).hasSize(4);
        assertThat(ctx.getCadenceController().shouldEvaluate(market.key())).isFalse();
    }

    @Test
    void fillsForUnknownTokensAndSpotMovesAreHandled() {
        start(List.of());
        PairedMarket market = market(600);
        engine.registerMarket(market);

        engine.onFill("someone-else", "x-1", bd("5"), bd("0.50"));
        engine.recordSpotPrice("btc", bd("42000"));

        assertThat(ctx.getInventoryTracker().snapshot()).isEmpty();
        assertThat(ctx.getCadenceController().spotMoveAgeMillis("BTC")).isZero();
    }

    @Test
    void shutdownCancelsRestingOrders() {
        start(List.of());
        PairedMarket market = market(600);
        engine.registerMarket(market);
        books("0.30", "0.35", "0.55", "0.60");
        engine.evaluateMarket(market);

        engine.shutdown();
        engine = null;

        assertThat(venue.getOpenOrders().orders()).isEmpty();
    }

    private String orderAt(MarketKey key, Outcome outcome, String price) {
        return ctx.getOrderManager().trackedOrders(key, outcome).stream()
                .filter(o -> o.price().compareTo(bd(price)) == 0)
                .findFirst()
                .orElseThrow()
                .orderId();
    }

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }
}
