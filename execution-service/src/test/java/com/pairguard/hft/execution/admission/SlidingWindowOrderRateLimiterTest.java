package com.pairguard.hft.execution.admission;

import com.pairguard.hft.execution.config.AdmissionConfig;
import com.pairguard.hft.execution.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SlidingWindowOrderRateLimiterTest {

    private static final String BTC = "btc-updown-15m-1705312800";
    private static final String ETH = "eth-updown-15m-1705312800";

    private MutableClock clock;
    private SlidingWindowOrderRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
        limiter = new SlidingWindowOrderRateLimiter(AdmissionConfig.defaults(), clock);
    }

    @Test
    void pausesAMarketOnceItsOrderWindowIsFull() {
        record(BTC, OrderKind.ORDER, 15);

        RateLimitDecision tripped = limiter.checkAllowed(BTC, OrderKind.ORDER);
        assertThat(tripped.allowed()).isFalse();
        assertThat(tripped.reason()).isEqualTo("MARKET_ORDER_LIMIT");
        assertThat(tripped.waitMillis()).isEqualTo(30_000);

        clock.advanceSeconds(10);
        RateLimitDecision paused = limiter.checkAllowed(BTC, OrderKind.ORDER);
        assertThat(paused.reason()).isEqualTo("MARKET_PAUSED");
        assertThat(paused.waitMillis()).isEqualTo(20_000);

        assertThat(limiter.checkAllowed(ETH, OrderKind.ORDER).allowed()).isTrue();
        assertThat(limiter.status().pausedMarkets()).isEqualTo(1);
    }

    @Test
    void eventsLeaveTheWindowAfterOneMinute() {
        record(BTC, OrderKind.ORDER, 15);

        clock.advanceSeconds(60);

        assertThat(limiter.checkAllowed(BTC, OrderKind.ORDER).allowed()).isTrue();
        assertThat(limiter.status().eventsLastMinute()).isZero();
    }

    @Test
    void cancelReplaceChurnHasItsOwnLowerLimit() {
        record(BTC, OrderKind.REPLACE, 6);
        record(BTC, OrderKind.CANCEL, 4);

        assertThat(limiter.checkAllowed(BTC, OrderKind.ORDER).allowed()).isTrue();
        RateLimitDecision replace = limiter.checkAllowed(BTC, OrderKind.REPLACE);
        assertThat(replace.allowed()).isFalse();
        assertThat(replace.reason()).isEqualTo("MARKET_CANCEL_LIMIT");
    }

    @Test
    void globalLimitsPauseEveryMarket() {
        for (int m = 0; m < 10; m++) {
            record("market-" + m, OrderKind.ORDER, 10);
        }

        assertThat(limiter.checkAllowed(BTC, OrderKind.ORDER).reason()).isEqualTo("GLOBAL_ORDER_LIMIT");
        clock.advanceSeconds(1);
        RateLimitDecision paused = limiter.checkAllowed(ETH, OrderKind.ORDER);
        assertThat(paused.reason()).isEqualTo("GLOBAL_PAUSE");
        assertThat(paused.waitMillis()).isEqualTo(59_000);
        assertThat(limiter.status().globalPaused()).isTrue();

        clock.advanceSeconds(59);
        assertThat(limiter.checkAllowed(ETH, OrderKind.ORDER).allowed()).isTrue();
    }

    @Test
    void globalCancelLimitTripsBeforeTheOrderLimit() {
        for (int m = 0; m < 5; m++) {
            record("market-" + m, OrderKind.CANCEL, 10);
        }

        assertThat(limiter.checkAllowed(BTC, OrderKind.ORDER).reason()).isEqualTo("GLOBAL_CANCEL_LIMIT");
    }

    @Test
    void consecutiveFailuresOpenTheBreakerUntilItResets() {
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure(BTC);
        }

        RateLimitDecision open = limiter.checkAllowed(ETH, OrderKind.ORDER);
        assertThat(open.reason()).isEqualTo("CIRCUIT_BREAKER_OPEN");
        assertThat(open.waitMillis()).isEqualTo(120_000);
        assertThat(limiter.status().circuitBreakerOpen()).isTrue();

        clock.advanceMillis(120_001);
        assertThat(limiter.checkAllowed(ETH, OrderKind.ORDER).allowed()).isTrue();
        assertThat(limiter.status().circuitBreakerOpen()).isFalse();
    }

    @Test
    void successResetsTheFailureStreak() {
        for (int i = 0; i < 4; i++) {
            limiter.recordFailure(BTC);
        }
        limiter.recordEvent(BTC, OrderKind.ORDER);
        for (int i = 0; i < 4; i++) {
            limiter.recordFailure(BTC);
        }

        assertThat(limiter.checkAllowed(BTC, OrderKind.ORDER).allowed()).isTrue();
    }

    @Test
    void forceResetClosesTheBreaker() {
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure(BTC);
        }

        limiter.forceResetCircuitBreaker();

        assertThat(limiter.checkAllowed(BTC, OrderKind.ORDER).allowed()).isTrue();
    }

    private void record(String marketId, OrderKind kind, int count) {
        for (int i = 0; i < count; i++) {
            limiter.recordEvent(marketId, kind);
        }
    }
}
