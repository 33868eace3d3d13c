package com.pairguard.hft.execution.priority;

public enum HedgeAction {
    WAIT,
    PLACE_HEDGE,
    REPRICE_HEDGE,
    EMERGENCY_EXIT,
}
