package com.pairguard.hft.execution.priority;

/**
 * Escalating urgency ladder for completing a hedge.
 */
public enum HedgeIntent {
    HEDGE,
    HEDGE_URGENT,
    SURVIVAL,
    EMERGENCY_EXIT,
}
