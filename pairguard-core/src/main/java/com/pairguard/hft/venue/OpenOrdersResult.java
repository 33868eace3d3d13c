package com.pairguard.hft.venue;

import java.util.List;

/**
 * Authoritative open-order list. When {@code error} is set the list must not be trusted.
 */
public record OpenOrdersResult(List<OpenOrder> orders, String error) {
  public OpenOrdersResult {
    orders = orders == null ? List.of() : List.copyOf(orders);
  }

  public static OpenOrdersResult of(List<OpenOrder> orders) {
    return new OpenOrdersResult(orders, null);
  }

  public static OpenOrdersResult failed(String error) {
    return new OpenOrdersResult(List.of(), error);
  }

  public boolean isError() {
    return error != null;
  }
}
