package com.pairguard.hft.venue;

import com.pairguard.hft.domain.OrderSide;
import lombok.NonNull;

import java.math.BigDecimal;

public record PlaceOrderRequest(
    @NonNull String tokenId,
    @NonNull OrderSide side,
    @NonNull BigDecimal price,
    @NonNull BigDecimal size,
    OrderType orderType
) {
  public PlaceOrderRequest {
    if (orderType == null) {
      orderType = OrderType.GTC;
    }
  }
}
