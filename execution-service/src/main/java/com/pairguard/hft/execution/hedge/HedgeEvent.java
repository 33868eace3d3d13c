package com.pairguard.hft.execution.hedge;

import java.math.BigDecimal;
import java.time.Instant;

public record HedgeEvent(
        Type type,
        Instant ts,
        String marketId,
        String asset,
        int step,
        BigDecimal price,
        BigDecimal shares,
        HedgeMode mode,
        HedgeErrorCode errorCode,
        String message
) {
    public enum Type {
        HEDGE_ATTEMPT,
        HEDGE_FAILED,
        HEDGE_ESCALATE_STEP,
        HEDGE_ABORTED,
        HEDGE_SUCCESS,
    }
}
