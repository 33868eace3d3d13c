package com.pairguard.hft.venue;

import java.math.BigDecimal;

/**
 * Top of book plus visible size at the best levels. Prices are null when that side is empty.
 */
public record OrderbookDepth(
    BigDecimal topBid,
    BigDecimal topAsk,
    BigDecimal bidDepth,
    BigDecimal askDepth
) {
  public OrderbookDepth {
    if (bidDepth == null) bidDepth = BigDecimal.ZERO;
    if (askDepth == null) askDepth = BigDecimal.ZERO;
  }

  public static OrderbookDepth empty() {
    return new OrderbookDepth(null, null, BigDecimal.ZERO, BigDecimal.ZERO);
  }

  public boolean isTwoSided() {
    return topBid != null && topAsk != null;
  }
}
