package com.pairguard.hft.execution.config;

import com.pairguard.hft.config.HftProperties;

import java.math.BigDecimal;

/**
 * Price validation limits.
 */
public record PriceGuardConfig(
        BigDecimal tickSize,
        long maxBookAgeMillis,
        int emergencyMaxCrossTicks,
        long emergencyMinIntervalMillis,
        long maxSecondsRemainingForEmergency,
        BigDecimal minSpreadForMaker
) {
    public static PriceGuardConfig defaults() {
        return new PriceGuardConfig(
                new BigDecimal("0.01"),
                500,
                2,
                30_000,
                90,
                new BigDecimal("0.02")
        );
    }

    public static PriceGuardConfig from(HftProperties.PriceGuard p) {
        return new PriceGuardConfig(
                p.tickSize(),
                p.maxBookAgeMillis(),
                p.emergencyMaxCrossTicks(),
                p.emergencyMinIntervalMillis(),
                p.maxSecondsRemainingForEmergency(),
                p.minSpreadForMaker()
        );
    }
}
