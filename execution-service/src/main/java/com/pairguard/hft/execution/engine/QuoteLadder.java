package com.pairguard.hft.execution.engine;

import com.pairguard.hft.domain.OrderSide;
import com.pairguard.hft.execution.guard.BookSnapshot;
import com.pairguard.hft.execution.guard.PriceGuard;
import com.pairguard.hft.execution.order.Quote;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Maker BUY levels: the guard's maker price, then one tick lower per additional level.
 */
public class QuoteLadder {

    private final PriceGuard priceGuard;
    private final int levels;
    private final BigDecimal sharesPerLevel;

    public QuoteLadder(PriceGuard priceGuard, int levels, BigDecimal sharesPerLevel) {
        if (levels < 0) {
            throw new IllegalArgumentException("levels must be >= 0");
        }
        this.priceGuard = priceGuard;
        this.levels = levels;
        this.sharesPerLevel = sharesPerLevel;
    }

    public List<Quote> build(BookSnapshot book) {
        if (book == null || !book.isTwoSided() || levels == 0 || !priceGuard.isSpreadSufficient(book)) {
            return List.of();
        }
        BigDecimal top = priceGuard.selectMakerPrice(OrderSide.BUY, book);
        List<Quote> quotes = new ArrayList<>(levels);
        for (int i = 0; i < levels; i++) {
            BigDecimal price = top.subtract(priceGuard.tickSize().multiply(BigDecimal.valueOf(i)));
            if (price.signum() <= 0) {
                break;
            }
            quotes.add(new Quote(price, sharesPerLevel));
        }
        return quotes;
    }

    public BigDecimal topPrice(List<Quote> quotes) {
        return quotes.isEmpty() ? null : quotes.get(0).price();
    }
}
