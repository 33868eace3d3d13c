package com.pairguard.hft.execution.state;

import java.math.BigDecimal;

/**
 * Best asks on both legs at the moment of a state change, for telemetry.
 */
public record BookData(BigDecimal bestAskUp, BigDecimal bestAskDown) {

    public static BookData empty() {
        return new BookData(null, null);
    }

    public BigDecimal combinedAsk() {
        if (bestAskUp == null || bestAskDown == null) return null;
        return bestAskUp.add(bestAskDown);
    }

    public BigDecimal impliedPairCostCents() {
        BigDecimal combined = combinedAsk();
        return combined == null ? null : combined.multiply(BigDecimal.valueOf(100));
    }
}
