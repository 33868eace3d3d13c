package com.pairguard.hft.execution.priority;

public enum HedgeResolution {
    PENDING,
    HEDGED,
    EXITED,
    EXPIRED_UNHEDGED,
}
