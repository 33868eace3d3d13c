package com.pairguard.hft.execution.admission;

import com.pairguard.hft.config.HftProperties;
import lombok.NonNull;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket over venue requests: refills at {@code requestsPerSecond} up to {@code burst} tokens.
 */
public class BurstLimiter {

    private final boolean enabled;
    private final double permitsPerSecond;
    private final double capacity;
    private final Clock clock;

    private double tokens;
    private Instant lastRefill;

    public BurstLimiter(@NonNull HftProperties.RateLimit rateLimit, @NonNull Clock clock) {
        this.enabled = Boolean.TRUE.equals(rateLimit.enabled())
                && rateLimit.requestsPerSecond() > 0
                && rateLimit.burst() > 0;
        this.permitsPerSecond = rateLimit.requestsPerSecond();
        this.capacity = rateLimit.burst();
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefill = clock.instant();
    }

    public static BurstLimiter disabled(Clock clock) {
        return new BurstLimiter(new HftProperties.RateLimit(false, 0.0, 0), clock);
    }

    public synchronized boolean tryAcquire() {
        if (!enabled) {
            return true;
        }
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    public synchronized double availableTokens() {
        if (!enabled) {
            return Double.POSITIVE_INFINITY;
        }
        refill();
        return tokens;
    }

    private void refill() {
        Instant now = clock.instant();
        long elapsedNanos = Duration.between(lastRefill, now).toNanos();
        if (elapsedNanos <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + permitsPerSecond * elapsedNanos / 1_000_000_000.0);
        lastRefill = now;
    }
}
