package com.pairguard.hft.execution.hedge;

/**
 * Time-to-expiry tier. PANIC only widens liquidity acceptance; SURVIVAL also relaxes price and size rules.
 */
public enum HedgeMode {
    NORMAL,
    PANIC,
    SURVIVAL,
}
