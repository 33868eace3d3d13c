package com.pairguard.hft.execution.hedge;

import java.math.BigDecimal;

public record RecoveryResult(
        boolean attempted,
        boolean success,
        String reason,
        RecoveryAnalysis analysis,
        String orderId,
        BigDecimal filledShares
) {
    public static RecoveryResult skipped(String reason) {
        return new RecoveryResult(false, false, reason, null, null, BigDecimal.ZERO);
    }

    public static RecoveryResult declined(RecoveryAnalysis analysis) {
        return new RecoveryResult(true, false, analysis.reason(), analysis, null, BigDecimal.ZERO);
    }
}
