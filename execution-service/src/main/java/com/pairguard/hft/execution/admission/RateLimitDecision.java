package com.pairguard.hft.execution.admission;

/**
 * Admission answer. {@code reason} is a stable code (e.g. {@code MARKET_ORDER_LIMIT}); {@code waitMillis} is how
 * long until the blocking condition lifts, 0 when allowed.
 */
public record RateLimitDecision(boolean allowed, String reason, long waitMillis) {

    public static RateLimitDecision allow() {
        return new RateLimitDecision(true, null, 0);
    }

    public static RateLimitDecision deny(String reason, long waitMillis) {
        return new RateLimitDecision(false, reason, Math.max(0, waitMillis));
    }
}
