package com.pairguard.hft.execution.cadence;

import com.pairguard.hft.events.HftEventTypes;
import com.pairguard.hft.execution.config.CadenceConfig;
import com.pairguard.hft.execution.model.MarketKey;
import com.pairguard.hft.execution.support.MutableClock;
import com.pairguard.hft.execution.support.RecordingEventPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CadenceControllerTest {

    private static final MarketKey BTC = MarketKey.of("btc-updown-15m-1705312800", "BTC");
    private static final MarketKey ETH = MarketKey.of("eth-updown-15m-1705312800", "ETH");

    private static final CadenceMetrics QUIET = metrics(0.0, false);
    private static final CadenceMetrics NEAR = metrics(0.013, false);
    private static final CadenceMetrics HOT = metrics(0.018, false);
    private static final CadenceMetrics SPREAD_ONLY = metrics(0.0, true);

    private MutableClock clock;
    private RecordingEventPublisher events;
    private SimpleMeterRegistry meterRegistry;
    private CadenceController controller;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
        events = new RecordingEventPublisher();
        meterRegistry = new SimpleMeterRegistry();
        controller = new CadenceController(CadenceConfig.defaults(), clock, events, meterRegistry);
        controller.registerMarket(BTC);
    }

    private static CadenceMetrics metrics(double mispricing, boolean spreadChanged) {
        return new CadenceMetrics(mispricing, 0.02, 0.0, Long.MAX_VALUE, Long.MAX_VALUE, spreadChanged);
    }

    @Test
    void quietMarketStaysCold() {
        assertThat(controller.updateState(BTC, QUIET)).isEqualTo(CadenceLevel.COLD);
        assertThat(controller.evalIntervalMillis(BTC)).isEqualTo(1_000);
        assertThat(events.all()).isEmpty();
    }

    @Test
    void nearSignalWarmsAndHotSignalJumpsStraightToHot() {
        assertThat(controller.updateState(BTC, NEAR)).isEqualTo(CadenceLevel.WARM);
        assertThat(controller.evalIntervalMillis(BTC)).isEqualTo(500);

        controller.registerMarket(ETH);
        assertThat(controller.updateState(ETH, HOT)).isEqualTo(CadenceLevel.HOT);
        assertThat(controller.evalIntervalMillis(ETH)).isEqualTo(250);

        assertThat(events.ofType(HftEventTypes.CADENCE_TRANSITION)).hasSize(2);
        assertThat(meterRegistry.counter("pairguard.cadence.transitions", "to", "HOT").count()).isEqualTo(1.0);
        assertThat(controller.getStats()).isEqualTo(new CadenceStats(0, 1, 1, 2));
    }

    @Test
    void hotCoolsToWarmAfterHysteresisWhileNearHolds() {
        controller.updateState(BTC, HOT);

        clock.advanceSeconds(1);
        assertThat(controller.updateState(BTC, NEAR)).isEqualTo(CadenceLevel.HOT);
        clock.advanceMillis(2_999);
        assertThat(controller.updateState(BTC, NEAR)).isEqualTo(CadenceLevel.HOT);
        clock.advanceMillis(1);
        assertThat(controller.updateState(BTC, NEAR)).isEqualTo(CadenceLevel.WARM);
    }

    @Test
    void hotFallsStraightToColdWhenNearHasBeenFalseLongEnough() {
        // spread changes keep it hot without any near signal
        controller.updateState(BTC, SPREAD_ONLY);
        clock.advanceSeconds(4);
        controller.updateState(BTC, SPREAD_ONLY);

        clock.advanceMillis(1);
        assertThat(controller.updateState(BTC, QUIET)).isEqualTo(CadenceLevel.HOT);
        clock.advanceMillis(3_000);

        assertThat(controller.updateState(BTC, QUIET)).isEqualTo(CadenceLevel.COLD);
    }

    @Test
    void warmCoolsToColdOnlyAfterNearCooldown() {
        controller.updateState(BTC, NEAR);

        controller.updateState(BTC, QUIET);
        clock.advanceMillis(4_999);
        assertThat(controller.updateState(BTC, QUIET)).isEqualTo(CadenceLevel.WARM);
        clock.advanceMillis(1);
        assertThat(controller.updateState(BTC, QUIET)).isEqualTo(CadenceLevel.COLD);
    }

    @Test
    void warmEscalatesToHotEvenDuringNearCooldown() {
        controller.updateState(BTC, NEAR);
        controller.updateState(BTC, QUIET);
        clock.advanceSeconds(2);

        assertThat(controller.updateState(BTC, HOT)).isEqualTo(CadenceLevel.HOT);
    }

    @Test
    void evaluationIsDueOncePerInterval() {
        assertThat(controller.shouldEvaluate(BTC)).isTrue();
        controller.markEvaluated(BTC);

        clock.advanceMillis(999);
        assertThat(controller.shouldEvaluate(BTC)).isFalse();
        clock.advanceMillis(1);
        assertThat(controller.shouldEvaluate(BTC)).isTrue();

        assertThat(controller.shouldEvaluate(ETH)).isTrue();
    }

    @Test
    void snapshotsAreTimedWhenColdAndEventDrivenWhenHot() {
        assertThat(controller.shouldLogFullSnapshot(BTC)).isTrue();
        controller.markFullSnapshot(BTC);
        clock.advanceMillis(1_999);
        assertThat(controller.shouldLogFullSnapshot(BTC)).isFalse();
        clock.advanceMillis(1);
        assertThat(controller.shouldLogFullSnapshot(BTC)).isTrue();

        controller.updateState(BTC, HOT);

        assertThat(controller.shouldLogFullSnapshot(BTC)).isFalse();
        assertThat(controller.snapshot(BTC)).get()
                .satisfies(s -> assertThat(s.snapshotIntervalMillis()).isNull());
    }

    @Test
    void spreadChangeOfOneTickInsideTheMoveWindowCounts() {
        controller.recordSpread(BTC, 0.02, 0.03);
        clock.advanceMillis(200);
        controller.recordSpread(BTC, 0.025, 0.03);
        assertThat(controller.checkSpreadChanged(BTC)).isFalse();

        clock.advanceMillis(200);
        controller.recordSpread(BTC, 0.03, 0.03);
        assertThat(controller.checkSpreadChanged(BTC)).isTrue();

        // the 0.02 sample has left the window
        clock.advanceMillis(700);
        controller.recordSpread(BTC, 0.03, 0.03);
        assertThat(controller.checkSpreadChanged(BTC)).isFalse();
    }

    @Test
    void stateScorePercentilesDriveSignals() {
        for (int i = 1; i <= 100; i++) {
            controller.recordStateScore("btc", i);
        }

        CadenceSignals nearOnly = controller.evaluateCadence(BTC,
                new CadenceMetrics(0.0, 0.02, 80.0, Long.MAX_VALUE, Long.MAX_VALUE, false));
        assertThat(nearOnly.near()).isTrue();
        assertThat(nearOnly.hot()).isFalse();

        CadenceSignals hot = controller.evaluateCadence(BTC,
                new CadenceMetrics(0.0, 0.02, 95.0, Long.MAX_VALUE, Long.MAX_VALUE, false));
        assertThat(hot.hot()).isTrue();
        assertThat(hot.hotReasons()).singleElement().asString().startsWith("stateScore");
    }

    @Test
    void stateScoreWeighsTheEdgeByTheThinnerAsk() {
        assertThat(controller.stateScore(0.0, 200, 20)).isZero();
        assertThat(controller.stateScore(-0.03, 200, 20)).isZero();
        // an edge of one threshold on a full book is halfway there
        assertThat(controller.stateScore(0.02, 200, 20)).isCloseTo(0.5, within(1e-9));
        assertThat(controller.stateScore(0.10, 200, 20)).isCloseTo(1.0, within(1e-9));
        assertThat(controller.stateScore(0.04, 5, 20)).isCloseTo(0.25, within(1e-9));
        assertThat(controller.stateScore(0.04, 0, 20)).isZero();
        assertThat(controller.stateScore(0.02, 0, 0)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void recentSpotMoveMakesTheMarketNear() {
        controller.recordSpotMove("btc");

        CadenceMetrics metrics = controller.buildMetrics(BTC, 0.0, 0.0, 0.02, 0.02);

        assertThat(metrics.spotMoveAgeMillis()).isZero();
        assertThat(metrics.polyMoveAgeMillis()).isEqualTo(Long.MAX_VALUE);
        assertThat(controller.updateState(BTC, metrics)).isEqualTo(CadenceLevel.WARM);
    }

    @Test
    void unregisteredMarketsStayCold() {
        controller.unregisterMarket(BTC);

        assertThat(controller.updateState(BTC, HOT)).isEqualTo(CadenceLevel.COLD);
        assertThat(controller.getStats().totalMarkets()).isZero();
    }
}
