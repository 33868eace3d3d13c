package com.pairguard.hft.execution.hedge;

import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.execution.model.MarketKey;
import com.pairguard.hft.execution.priority.HedgeIntent;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * One hedge BUY of {@code shares} on {@code hedgeSide}, starting at {@code initialPrice}.
 * {@code avgOtherSideCost} is the average price already paid for the leading side, net of fees.
 */
public record HedgeRequest(
        @NonNull MarketKey market,
        @NonNull String tokenId,
        @NonNull Outcome hedgeSide,
        @NonNull BigDecimal shares,
        @NonNull BigDecimal initialPrice,
        BigDecimal avgOtherSideCost,
        long secondsRemaining,
        HedgeIntent intent
) {
    public HedgeRequest {
        if (intent == null) {
            intent = HedgeIntent.HEDGE;
        }
    }
}
