package com.pairguard.hft.venue;

import com.pairguard.hft.domain.OrderSide;

import java.math.BigDecimal;
import java.time.Instant;

public record OpenOrder(
    String orderId,
    String tokenId,
    OrderSide side,
    BigDecimal price,
    BigDecimal size,
    BigDecimal sizeMatched,
    Instant createdAt
) {
  public OpenOrder {
    if (size == null) size = BigDecimal.ZERO;
    if (sizeMatched == null) sizeMatched = BigDecimal.ZERO;
  }

  public BigDecimal remainingSize() {
    return size.subtract(sizeMatched).max(BigDecimal.ZERO);
  }
}
