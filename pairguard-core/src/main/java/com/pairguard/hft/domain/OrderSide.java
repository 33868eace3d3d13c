package com.pairguard.hft.domain;

public enum OrderSide {
  BUY,
  SELL;

  public OrderSide opposite() {
    return this == BUY ? SELL : BUY;
  }
}
