package com.pairguard.hft.execution.cadence;

/**
 * Inputs for one cadence evaluation. Move ages are {@link Long#MAX_VALUE} when no move was ever seen.
 */
public record CadenceMetrics(
        double mispricing,
        double entryThreshold,
        double stateScore,
        long spotMoveAgeMillis,
        long polyMoveAgeMillis,
        boolean spreadChangedTick
) {}
