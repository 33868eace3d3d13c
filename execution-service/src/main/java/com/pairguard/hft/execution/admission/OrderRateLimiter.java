package com.pairguard.hft.execution.admission;

/**
 * Per-market and global order churn limits with a failure circuit breaker.
 */
public interface OrderRateLimiter {

    RateLimitDecision checkAllowed(String marketId, OrderKind kind);

    /**
     * Records a submitted operation; also resets the market's consecutive failure count.
     */
    void recordEvent(String marketId, OrderKind kind);

    void recordFailure(String marketId);

    Status status();

    record Status(
            boolean circuitBreakerOpen,
            boolean globalPaused,
            int pausedMarkets,
            int eventsLastMinute,
            int cancelsLastMinute
    ) {}

    static OrderRateLimiter unlimited() {
        return new OrderRateLimiter() {
            @Override
            public RateLimitDecision checkAllowed(String marketId, OrderKind kind) {
                return RateLimitDecision.allow();
            }

            @Override
            public void recordEvent(String marketId, OrderKind kind) {
            }

            @Override
            public void recordFailure(String marketId) {
            }

            @Override
            public Status status() {
                return new Status(false, false, 0, 0, 0);
            }
        };
    }
}
