package com.pairguard.hft.execution.admission;

import java.math.BigDecimal;

public record FundsCheck(
        boolean canProceed,
        ReasonCode reasonCode,
        String reason,
        BigDecimal availableBalance,
        BigDecimal reservedNotional,
        BigDecimal freeBalance,
        BigDecimal requiredNotional
) {
    public enum ReasonCode {
        OK,
        BELOW_MIN_BALANCE,
        MARKET_RESERVE_LIMIT,
        TOTAL_RESERVE_LIMIT,
        INSUFFICIENT_BALANCE,
    }
}
