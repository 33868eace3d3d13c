package com.pairguard.hft.execution.model;

import com.pairguard.hft.domain.Outcome;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Per-market inventory with cost basis. Shares and cost are never negative.
 */
public record MarketInventory(
        BigDecimal upShares,
        BigDecimal downShares,
        BigDecimal upCost,
        BigDecimal downCost,
        Instant lastUpFillAt,
        Instant lastDownFillAt,
        BigDecimal lastUpFillPrice,
        BigDecimal lastDownFillPrice
) {
    public MarketInventory {
        upShares = nonNegative(upShares);
        downShares = nonNegative(downShares);
        upCost = nonNegative(upCost);
        downCost = nonNegative(downCost);
    }

    public static MarketInventory empty() {
        return new MarketInventory(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null, null, null, null);
    }

    public BigDecimal imbalance() {
        return upShares.subtract(downShares);
    }

    public BigDecimal unpairedShares() {
        return imbalance().abs();
    }

    public BigDecimal pairedShares() {
        return upShares.min(downShares);
    }

    public BigDecimal totalCost() {
        return upCost.add(downCost);
    }

    public BigDecimal shares(Outcome outcome) {
        return outcome == Outcome.UP ? upShares : downShares;
    }

    public BigDecimal cost(Outcome outcome) {
        return outcome == Outcome.UP ? upCost : downCost;
    }

    /**
     * Average price paid per share of {@code outcome}, or null when flat on that side.
     */
    public BigDecimal avgCost(Outcome outcome) {
        BigDecimal shares = shares(outcome);
        if (shares.signum() == 0) return null;
        return cost(outcome).divide(shares, 6, RoundingMode.HALF_UP);
    }

    /**
     * Side holding more shares; UP on ties.
     */
    public Outcome leadingOutcome() {
        return downShares.compareTo(upShares) > 0 ? Outcome.DOWN : Outcome.UP;
    }

    public MarketInventory addFill(Outcome outcome, BigDecimal shares, BigDecimal price, Instant fillAt) {
        BigDecimal notional = shares.multiply(price);
        if (outcome == Outcome.UP) {
            return new MarketInventory(
                    upShares.add(shares),
                    downShares,
                    upCost.add(notional),
                    downCost,
                    fillAt,
                    lastDownFillAt,
                    price,
                    lastDownFillPrice
            );
        }
        return new MarketInventory(
                upShares,
                downShares.add(shares),
                upCost,
                downCost.add(notional),
                lastUpFillAt,
                fillAt,
                lastUpFillPrice,
                price
        );
    }

    private static BigDecimal nonNegative(BigDecimal v) {
        if (v == null || v.signum() < 0) return BigDecimal.ZERO;
        return v;
    }
}
