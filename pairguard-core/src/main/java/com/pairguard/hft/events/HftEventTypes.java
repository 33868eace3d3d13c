package com.pairguard.hft.events;

public final class HftEventTypes {

  private HftEventTypes() {
  }

  public static final String PRICE_GUARD_EMERGENCY_CROSS = "price_guard.emergency_cross";

  public static final String MARKET_STATE_TRANSITION = "market_state.transition";
  public static final String MARKET_STATE_PAIRING_STARTED = "market_state.pairing_started";
  public static final String MARKET_STATE_PAIRING_TIMEOUT = "market_state.pairing_timeout";
  public static final String MARKET_STATE_HEDGE_CAP = "market_state.hedge_cap";

  public static final String HEDGE_ESCALATOR_EVENT = "hedge.escalator";
  public static final String HEDGE_STARTED = "hedge.started";
  public static final String HEDGE_COMPLETED = "hedge.completed";
  public static final String HEDGE_EMERGENCY_EXIT = "hedge.emergency_exit";
  public static final String HEDGE_EXPIRED = "hedge.expired";
  public static final String HEDGE_RECOVERY = "hedge.recovery";

  public static final String CADENCE_TRANSITION = "cadence.transition";

  public static final String ORDERS_RECONCILED = "orders.reconciled";
  public static final String ORDERS_SYNCED = "orders.synced";

  public static final String ENGINE_SNAPSHOT = "engine.snapshot";
}
