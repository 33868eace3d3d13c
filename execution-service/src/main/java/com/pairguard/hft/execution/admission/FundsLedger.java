package com.pairguard.hft.execution.admission;

import com.pairguard.hft.domain.Outcome;

import java.math.BigDecimal;

/**
 * Shared notional reservation ledger. {@link #reserve} is atomic: two concurrent callers can never both claim the
 * same free balance.
 */
public interface FundsLedger {

    FundsCheck canPlaceOrder(String marketId, Outcome side, BigDecimal notional);

    /**
     * @return false when the reservation would exceed a cap or the free balance; nothing is recorded then.
     */
    boolean reserve(String reservationId, String marketId, BigDecimal notional, Outcome side);

    void release(String reservationId);

    void onFill(String reservationId, BigDecimal filledNotional);

    void invalidateBalanceCache();

    BigDecimal totalReserved();

    BigDecimal marketReserved(String marketId);
}
