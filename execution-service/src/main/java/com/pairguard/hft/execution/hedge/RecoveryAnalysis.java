package com.pairguard.hft.execution.hedge;

import com.pairguard.hft.domain.Outcome;

import java.math.BigDecimal;

/**
 * Outcome projections for buying the trailing side up to the leading side. Profit figures are signed:
 * negative means a loss. {@code lossReduction} is negative when recovering improves the worst case.
 */
public record RecoveryAnalysis(
        boolean shouldRecover,
        String reason,
        BigDecimal upShares,
        BigDecimal downShares,
        BigDecimal totalCost,
        BigDecimal unpaired,
        Outcome leadingSide,
        BigDecimal leadingPrice,
        BigDecimal trailingPrice,
        BigDecimal currentMaxLoss,
        BigDecimal currentMaxGain,
        BigDecimal sharesToBuy,
        BigDecimal buyPrice,
        BigDecimal recoveryCost,
        BigDecimal lockedLossAfterRecovery,
        BigDecimal lossReduction,
        BigDecimal gainSacrificed,
        BigDecimal projectedCombinedCost
) {
    public Outcome trailingSide() {
        return leadingSide.opposite();
    }
}
