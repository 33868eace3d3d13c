package com.pairguard.hft.venue;

import java.math.BigDecimal;

/**
 * Outcome of an order submission. {@code filledSize} and {@code avgPrice} are present only when the venue
 * reported an immediate (partial) fill.
 */
public record PlaceOrderResult(
    boolean success,
    String orderId,
    BigDecimal filledSize,
    BigDecimal avgPrice,
    String error
) {

  public static PlaceOrderResult accepted(String orderId) {
    return new PlaceOrderResult(true, orderId, null, null, null);
  }

  public static PlaceOrderResult filled(String orderId, BigDecimal filledSize, BigDecimal avgPrice) {
    return new PlaceOrderResult(true, orderId, filledSize, avgPrice, null);
  }

  public static PlaceOrderResult rejected(String error) {
    return new PlaceOrderResult(false, null, null, null, error);
  }
}
