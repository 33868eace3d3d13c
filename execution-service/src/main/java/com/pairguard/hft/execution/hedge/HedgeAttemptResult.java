package com.pairguard.hft.execution.hedge;

import java.math.BigDecimal;

/**
 * Terminal result of an escalation run. On failure {@code errorCode} is always set.
 */
public record HedgeAttemptResult(
        boolean ok,
        String orderId,
        BigDecimal filledShares,
        BigDecimal avgPrice,
        BigDecimal finalPrice,
        BigDecimal finalShares,
        HedgeErrorCode errorCode,
        String error,
        int attempts
) {

    public static HedgeAttemptResult success(String orderId, BigDecimal filledShares, BigDecimal avgPrice,
                                             BigDecimal finalPrice, BigDecimal finalShares, int attempts) {
        return new HedgeAttemptResult(true, orderId, filledShares, avgPrice, finalPrice, finalShares, null, null, attempts);
    }

    public static HedgeAttemptResult failure(HedgeErrorCode code, String error, BigDecimal finalPrice,
                                             BigDecimal finalShares, int attempts) {
        return new HedgeAttemptResult(false, null, BigDecimal.ZERO, null, finalPrice, finalShares, code, error, attempts);
    }
}
