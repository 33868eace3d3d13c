package com.pairguard.hft.execution.state;

/**
 * Hedge slippage allowance in cents over a 100-cent pair. {@code recentVol} is null when the history has fewer
 * than two usable samples.
 */
public record DynamicHedgeCap(
        double baseCapCents,
        double dynamicCapCents,
        double finalCapCents,
        Double recentVol
) {}
