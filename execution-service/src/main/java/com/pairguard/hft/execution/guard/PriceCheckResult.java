package com.pairguard.hft.execution.guard;

import java.math.BigDecimal;

/**
 * Either an allowed price ({@code safePrice}, {@code ticksFromEdge}) or a block ({@code reason},
 * {@code bestPrice}). {@code ticksFromEdge} is negative when the price crosses the spread in emergency mode.
 */
public record PriceCheckResult(
        boolean allowed,
        BigDecimal safePrice,
        int ticksFromEdge,
        BlockReason reason,
        BigDecimal bestPrice,
        String message
) {

    public static PriceCheckResult allowed(BigDecimal safePrice, int ticksFromEdge) {
        return new PriceCheckResult(true, safePrice, ticksFromEdge, null, null, null);
    }

    public static PriceCheckResult blocked(BlockReason reason, BigDecimal bestPrice, String message) {
        return new PriceCheckResult(false, null, 0, reason, bestPrice, message);
    }

    public boolean isBlocked() {
        return !allowed;
    }

    public boolean crossed() {
        return allowed && ticksFromEdge <= 0;
    }
}
