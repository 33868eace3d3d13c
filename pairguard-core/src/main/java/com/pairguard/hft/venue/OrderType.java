package com.pairguard.hft.venue;

public enum OrderType {
  /**
   * Good-til-cancelled resting limit order.
   */
  GTC,
  /**
   * Fill-or-kill; used for emergency exits.
   */
  FOK,
}
