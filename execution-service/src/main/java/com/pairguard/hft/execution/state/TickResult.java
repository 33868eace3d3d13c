package com.pairguard.hft.execution.state;

/**
 * Outcome of one {@link MarketStateManager#processTick} call.
 */
public record TickResult(
        PairingState state,
        boolean pairingTimedOut,
        double timeInPairingSeconds,
        boolean shouldCancelUnfilledHedges
) {}
