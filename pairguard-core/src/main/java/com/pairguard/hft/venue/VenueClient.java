package com.pairguard.hft.venue;

import java.math.BigDecimal;

/**
 * Venue connectivity consumed by the engine. Implementations own transport, signing and retries;
 * methods may block on network I/O and may throw unchecked exceptions on transport failure.
 */
public interface VenueClient {

  OrderbookDepth getOrderbookDepth(String tokenId);

  PlaceOrderResult placeOrder(PlaceOrderRequest request);

  CancelResult cancelOrder(String orderId);

  OpenOrdersResult getOpenOrders();

  /**
   * Available collateral in USD.
   */
  BigDecimal getBalance();
}
