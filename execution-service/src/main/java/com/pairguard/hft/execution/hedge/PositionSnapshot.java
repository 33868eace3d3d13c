package com.pairguard.hft.execution.hedge;

import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.execution.guard.BookSnapshot;
import com.pairguard.hft.execution.model.MarketInventory;
import com.pairguard.hft.execution.model.PairedMarket;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * Inventory plus the latest books for both outcomes. Either book may be null when it could not be fetched.
 */
public record PositionSnapshot(
        @NonNull PairedMarket market,
        @NonNull MarketInventory inventory,
        BookSnapshot upBook,
        BookSnapshot downBook
) {
    public BookSnapshot book(Outcome outcome) {
        return outcome == Outcome.UP ? upBook : downBook;
    }

    public BigDecimal bestBid(Outcome outcome) {
        BookSnapshot book = book(outcome);
        return book == null ? null : book.bestBid();
    }

    public BigDecimal bestAsk(Outcome outcome) {
        BookSnapshot book = book(outcome);
        return book == null ? null : book.bestAsk();
    }
}
