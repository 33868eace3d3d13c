package com.pairguard.hft.execution.order;

import com.pairguard.hft.domain.OrderSide;
import com.pairguard.hft.execution.guard.BookSnapshot;
import com.pairguard.hft.execution.model.MarketKey;
import com.pairguard.hft.venue.OrderType;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * An order about to be validated and submitted. {@code book} is the snapshot the price was derived from.
 */
public record PlacementRequest(
        @NonNull MarketKey market,
        @NonNull String tokenId,
        @NonNull OrderSide side,
        @NonNull BigDecimal price,
        @NonNull BigDecimal size,
        OrderType orderType,
        BookSnapshot book,
        boolean emergencyMode,
        String intent
) {
    public PlacementRequest {
        if (orderType == null) {
            orderType = OrderType.GTC;
        }
    }
}
