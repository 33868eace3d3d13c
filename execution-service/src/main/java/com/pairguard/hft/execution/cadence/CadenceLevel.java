package com.pairguard.hft.execution.cadence;

public enum CadenceLevel {
    COLD,
    WARM,
    HOT,
}
