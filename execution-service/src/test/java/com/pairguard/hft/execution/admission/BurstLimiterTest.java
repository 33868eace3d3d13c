package com.pairguard.hft.execution.admission;

import com.pairguard.hft.config.HftProperties;
import com.pairguard.hft.execution.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BurstLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));

    @Test
    void allowsABurstThenRefillsAtTheConfiguredRate() {
        BurstLimiter limiter = new BurstLimiter(new HftProperties.RateLimit(true, 2.0, 3), clock);

        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();

        clock.advanceMillis(499);
        assertThat(limiter.tryAcquire()).isFalse();
        clock.advanceMillis(100);
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();

        clock.advanceSeconds(60);
        assertThat(limiter.availableTokens()).isEqualTo(3.0);
    }

    @Test
    void disabledLimiterNeverDenies() {
        BurstLimiter limiter = BurstLimiter.disabled(clock);

        for (int i = 0; i < 1_000; i++) {
            assertThat(limiter.tryAcquire()).isTrue();
        }
        assertThat(limiter.availableTokens()).isInfinite();
    }
}
