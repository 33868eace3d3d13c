package com.pairguard.hft.execution.priority;

/**
 * What the caller should do with a market's open hedge this evaluation.
 */
public record HedgeDecision(
        boolean shouldAct,
        HedgeAction action,
        HedgeIntent intent,
        String reason,
        boolean emergencyMode
) {
    public static HedgeDecision waitFor(String reason, HedgeIntent intent) {
        return new HedgeDecision(false, HedgeAction.WAIT, intent, reason, false);
    }
}
