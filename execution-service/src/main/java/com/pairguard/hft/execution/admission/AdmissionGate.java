package com.pairguard.hft.execution.admission;

import com.pairguard.hft.config.HftProperties;
import com.pairguard.hft.execution.priority.HedgePriorityLane;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Outer admission pipeline for quote and sync traffic: kill switch, burst limiter, order-rate limiter and the
 * cost-per-pair gate. Hedge priority intents skip the limiters and the pair-cost gate, never the kill switch.
 */
@Slf4j
public class AdmissionGate {

    public static final String KILL_SWITCH = "KILL_SWITCH";
    public static final String BURST_LIMIT = "BURST_LIMIT";
    public static final String CPP_GATE = "CPP_GATE";

    private final HftProperties.Risk risk;
    private final BurstLimiter burstLimiter;
    private final OrderRateLimiter rateLimiter;
    private final HedgePriorityLane priorityLane;
    private final BigDecimal maxPairCost;

    public AdmissionGate(@NonNull HftProperties.Risk risk,
                         @NonNull BurstLimiter burstLimiter,
                         @NonNull OrderRateLimiter rateLimiter,
                         @NonNull HedgePriorityLane priorityLane,
                         @NonNull BigDecimal maxPairCost) {
        this.risk = risk;
        this.burstLimiter = burstLimiter;
        this.rateLimiter = rateLimiter;
        this.priorityLane = priorityLane;
        this.maxPairCost = maxPairCost;
    }

    /**
     * @param projectedPairCost average cost of the opposite side plus the price about to be paid; null when there
     *                          is no opposite inventory and the gate does not apply
     */
    public RateLimitDecision admit(String marketId, OrderKind kind, String intent, BigDecimal projectedPairCost) {
        if (risk.killSwitch()) {
            return RateLimitDecision.deny(KILL_SWITCH, 0);
        }
        if (!priorityLane.shouldBypassBurstLimiter(intent) && !burstLimiter.tryAcquire()) {
            log.debug("RATE_LIMIT: burst limiter denied market={} kind={} intent={}", marketId, kind, intent);
            return RateLimitDecision.deny(BURST_LIMIT, 0);
        }
        if (!priorityLane.shouldBypassRateLimiter(intent)) {
            RateLimitDecision decision = rateLimiter.checkAllowed(marketId, kind);
            if (!decision.allowed()) {
                log.debug("RATE_LIMIT: denied market={} kind={} reason={} waitMs={}",
                        marketId, kind, decision.reason(), decision.waitMillis());
                return decision;
            }
        }
        if (projectedPairCost != null
                && !priorityLane.shouldBypassCppGating(intent)
                && projectedPairCost.compareTo(maxPairCost) > 0) {
            log.debug("RATE_LIMIT: pair cost gate market={} projected={} max={}", marketId, projectedPairCost, maxPairCost);
            return RateLimitDecision.deny(CPP_GATE, 0);
        }
        return RateLimitDecision.allow();
    }

    public BigDecimal maxPairCost() {
        return maxPairCost;
    }
}
