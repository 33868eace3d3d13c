package com.pairguard.hft.execution.engine;

import com.pairguard.hft.execution.admission.OrderRateLimiter;
import com.pairguard.hft.execution.cadence.CadenceStats;
import com.pairguard.hft.execution.hedge.HedgeEventLog;

import java.math.BigDecimal;

public record EngineStatus(
        String mode,
        boolean enabled,
        boolean running,
        int activeMarkets,
        int activeHedges,
        CadenceStats cadence,
        BigDecimal reservedNotionalUsd,
        OrderRateLimiter.Status rateLimiter,
        HedgeEventLog.Stats hedges
) {}
