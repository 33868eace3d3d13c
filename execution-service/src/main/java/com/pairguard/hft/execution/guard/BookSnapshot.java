package com.pairguard.hft.execution.guard;

import com.pairguard.hft.venue.OrderbookDepth;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Top of book as fetched at {@code fetchedAt}. Never repaired: a crossed or one-sided book stays as received
 * and is rejected by {@link PriceGuard}.
 */
public record BookSnapshot(
        BigDecimal bestBid,
        BigDecimal bestAsk,
        Instant fetchedAt,
        BigDecimal bidDepth,
        BigDecimal askDepth
) {
    public BookSnapshot {
        if (bidDepth == null) bidDepth = BigDecimal.ZERO;
        if (askDepth == null) askDepth = BigDecimal.ZERO;
    }

    public static BookSnapshot of(BigDecimal bestBid, BigDecimal bestAsk, Instant fetchedAt) {
        return new BookSnapshot(bestBid, bestAsk, fetchedAt, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public static BookSnapshot from(OrderbookDepth depth, Instant fetchedAt) {
        return new BookSnapshot(depth.topBid(), depth.topAsk(), fetchedAt, depth.bidDepth(), depth.askDepth());
    }

    public boolean isTwoSided() {
        return bestBid != null && bestAsk != null;
    }

    public BigDecimal spread() {
        if (!isTwoSided()) return null;
        return bestAsk.subtract(bestBid);
    }

    public BigDecimal mid() {
        if (!isTwoSided()) return null;
        return bestBid.add(bestAsk).divide(BigDecimal.valueOf(2), 6, RoundingMode.HALF_UP);
    }
}
