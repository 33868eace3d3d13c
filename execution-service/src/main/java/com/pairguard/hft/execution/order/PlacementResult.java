package com.pairguard.hft.execution.order;

import com.pairguard.hft.execution.guard.BlockReason;

import java.math.BigDecimal;

/**
 * {@code SUBMITTED}: accepted by the venue at {@code price}. {@code BLOCKED}: refused locally (guard or risk),
 * never retryable as is. {@code REJECTED}: the venue said no. {@code ERROR}: transport failure.
 */
public record PlacementResult(
        Status status,
        String orderId,
        BigDecimal price,
        BigDecimal filledSize,
        BigDecimal avgPrice,
        BlockReason blockReason,
        String message,
        int ticksFromEdge
) {
    public enum Status {
        SUBMITTED,
        BLOCKED,
        REJECTED,
        ERROR,
    }

    public static PlacementResult submitted(String orderId, BigDecimal price, BigDecimal filledSize,
                                            BigDecimal avgPrice, int ticksFromEdge) {
        return new PlacementResult(Status.SUBMITTED, orderId, price, filledSize, avgPrice, null, null, ticksFromEdge);
    }

    public static PlacementResult blocked(BlockReason reason, String message) {
        return new PlacementResult(Status.BLOCKED, null, null, null, null, reason, message, 0);
    }

    public static PlacementResult riskBlocked(String message) {
        return new PlacementResult(Status.BLOCKED, null, null, null, null, null, message, 0);
    }

    public static PlacementResult rejected(String message) {
        return new PlacementResult(Status.REJECTED, null, null, null, null, null, message, 0);
    }

    public static PlacementResult error(String message) {
        return new PlacementResult(Status.ERROR, null, null, null, null, null, message, 0);
    }

    public boolean isSubmitted() {
        return status == Status.SUBMITTED;
    }

    public BigDecimal filledOrZero() {
        return filledSize == null ? BigDecimal.ZERO : filledSize;
    }
}
