package com.pairguard.hft.execution.config;

import com.pairguard.hft.config.HftProperties;

import java.math.BigDecimal;

/**
 * Adaptive evaluation cadence. Intervals in millis, percentiles in 0..100.
 */
public record CadenceConfig(
        long coldEvalMillis,
        long warmEvalMillis,
        long hotEvalMillis,
        long coldSnapshotMillis,
        long warmSnapshotMillis,
        double nearMispricingRatio,
        double hotMispricingRatio,
        double nearPercentile,
        double hotPercentile,
        long moveWindowMillis,
        long nearFalseCooldownMillis,
        long hotFalseCooldownMillis,
        int percentileWindow,
        long spreadHistoryMillis,
        double entryThreshold,
        BigDecimal tickSize
) {
    public static CadenceConfig defaults() {
        return new CadenceConfig(
                1_000,
                500,
                250,
                2_000,
                1_000,
                0.6,
                0.85,
                75,
                90,
                1_000,
                5_000,
                3_000,
                200,
                2_000,
                0.02,
                new BigDecimal("0.01")
        );
    }

    public static CadenceConfig from(HftProperties.Cadence p, BigDecimal tickSize) {
        return new CadenceConfig(
                p.coldEvalMillis(),
                p.warmEvalMillis(),
                p.hotEvalMillis(),
                p.coldSnapshotMillis(),
                p.warmSnapshotMillis(),
                p.nearMispricingRatio(),
                p.hotMispricingRatio(),
                p.nearPercentile(),
                p.hotPercentile(),
                p.moveWindowMillis(),
                p.nearFalseCooldownMillis(),
                p.hotFalseCooldownMillis(),
                p.percentileWindow(),
                p.spreadHistoryMillis(),
                p.entryThreshold(),
                tickSize
        );
    }
}
