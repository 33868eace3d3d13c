package com.pairguard.hft.execution.config;

import com.pairguard.hft.config.HftProperties;

import java.math.BigDecimal;

/**
 * Loss-minimization thresholds.
 */
public record RecoveryConfig(
        boolean enabled,
        BigDecimal minUnpairedShares,
        double minWinProbability,
        BigDecimal maxCombinedCost,
        long cooldownSeconds,
        BigDecimal defaultTrailingAsk
) {
    public static RecoveryConfig defaults() {
        return new RecoveryConfig(
                true,
                BigDecimal.valueOf(25),
                0.60,
                new BigDecimal("1.10"),
                10,
                new BigDecimal("0.70")
        );
    }

    public static RecoveryConfig from(HftProperties.Recovery p) {
        return new RecoveryConfig(
                p.enabled(),
                p.minUnpairedShares(),
                p.minWinProbability(),
                p.maxCombinedCost(),
                p.cooldownSeconds(),
                p.defaultTrailingAsk()
        );
    }
}
