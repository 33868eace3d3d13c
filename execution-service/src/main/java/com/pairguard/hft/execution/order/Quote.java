package com.pairguard.hft.execution.order;

import lombok.NonNull;

import java.math.BigDecimal;

/**
 * Target resting BUY level. Prices are compared by value, so 0.5 and 0.50 are the same level.
 */
public record Quote(@NonNull BigDecimal price, @NonNull BigDecimal size) {

    public BigDecimal priceKey() {
        return price.stripTrailingZeros();
    }
}
