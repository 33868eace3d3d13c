package com.pairguard.hft.execution.config;

import com.pairguard.hft.config.HftProperties;

import java.math.BigDecimal;

/**
 * Scheduler, order tracking and quoting ladder settings.
 */
public record EngineConfig(
        boolean enabled,
        long tickMillis,
        int workerThreads,
        int maxConcurrentOrders,
        long reconcileIntervalMillis,
        boolean quotingEnabled,
        int quoteLevels,
        BigDecimal sharesPerLevel,
        BigDecimal minPairEdge
) {
    public static EngineConfig defaults() {
        return new EngineConfig(
                false,
                50,
                4,
                10,
                30_000,
                true,
                2,
                BigDecimal.TEN,
                new BigDecimal("0.02")
        );
    }

    public static EngineConfig from(HftProperties.Engine p) {
        return new EngineConfig(
                p.enabled(),
                p.tickMillis(),
                p.workerThreads(),
                p.orders().maxConcurrentOrders(),
                p.orders().reconcileIntervalMillis(),
                p.quoting().enabled(),
                p.quoting().levels(),
                p.quoting().sharesPerLevel(),
                p.quoting().minPairEdge()
        );
    }
}
