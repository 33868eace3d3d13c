package com.pairguard.hft.execution.order;

import com.pairguard.hft.domain.Outcome;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A resting BUY the engine believes is live on the venue. {@code size} is the unmatched remainder.
 */
public record TrackedOrder(
        String orderId,
        String tokenId,
        Outcome outcome,
        BigDecimal price,
        BigDecimal size,
        Instant placedAt
) {
    public BigDecimal priceKey() {
        return price.stripTrailingZeros();
    }

    public TrackedOrder withSize(BigDecimal remaining) {
        return new TrackedOrder(orderId, tokenId, outcome, price, remaining, placedAt);
    }
}
