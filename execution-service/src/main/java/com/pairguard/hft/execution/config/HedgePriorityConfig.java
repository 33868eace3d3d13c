package com.pairguard.hft.execution.config;

import com.pairguard.hft.config.HftProperties;

public record HedgePriorityConfig(
        long normalSeconds,
        long urgentSeconds,
        long survivalSeconds,
        long emergencyExitSeconds,
        long normalRepriceMillis,
        long urgentRepriceMillis,
        long survivalRepriceMillis,
        int maxHedgeAttempts
) {
    public static HedgePriorityConfig defaults() {
        return new HedgePriorityConfig(10, 30, 60, 90, 5_000, 3_000, 10_000, 10);
    }

    public static HedgePriorityConfig from(HftProperties.HedgePriority p) {
        return new HedgePriorityConfig(
                p.normalSeconds(),
                p.urgentSeconds(),
                p.survivalSeconds(),
                p.emergencyExitSeconds(),
                p.normalRepriceMillis(),
                p.urgentRepriceMillis(),
                p.survivalRepriceMillis(),
                p.maxHedgeAttempts()
        );
    }
}
