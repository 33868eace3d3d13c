package com.pairguard.hft.execution.admission;

import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.execution.config.AdmissionConfig;
import com.pairguard.hft.venue.VenueClient;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process reservation ledger backed by the venue balance (cached for {@code staleBalanceMillis}).
 */
@Slf4j
public class ReservationLedger implements FundsLedger {

    private final AdmissionConfig config;
    private final VenueClient venue;
    private final Clock clock;

    private final Map<String, Reservation> reservations = new HashMap<>();
    private final AtomicReference<BalanceSnapshot> balance = new AtomicReference<>();

    public ReservationLedger(@NonNull AdmissionConfig config, @NonNull VenueClient venue, @NonNull Clock clock) {
        this.config = config;
        this.venue = venue;
        this.clock = clock;
    }

    @Override
    public FundsCheck canPlaceOrder(String marketId, Outcome side, BigDecimal notional) {
        BigDecimal available = availableBalance();
        synchronized (this) {
            return evaluate(marketId, notional, available);
        }
    }

    @Override
    public boolean reserve(String reservationId, String marketId, BigDecimal notional, Outcome side) {
        BigDecimal available = availableBalance();
        synchronized (this) {
            FundsCheck check = evaluate(marketId, notional, available);
            if (!check.canProceed()) {
                log.debug("FUNDS: reserve refused id={} market={} notional={} reason={}",
                        reservationId, marketId, notional, check.reasonCode());
                return false;
            }
            reservations.put(reservationId, new Reservation(reservationId, marketId, notional, side, clock.instant()));
            log.debug("FUNDS: reserved id={} market={} notional={}", reservationId, marketId, notional);
            return true;
        }
    }

    @Override
    public synchronized void release(String reservationId) {
        Reservation removed = reservations.remove(reservationId);
        if (removed != null) {
            log.debug("FUNDS: released id={} market={} notional={}", reservationId, removed.marketId(), removed.notional());
        }
    }

    @Override
    public synchronized void onFill(String reservationId, BigDecimal filledNotional) {
        Reservation current = reservations.get(reservationId);
        if (current == null) {
            return;
        }
        BigDecimal remaining = current.notional().subtract(filledNotional);
        if (remaining.signum() <= 0) {
            reservations.remove(reservationId);
        } else {
            reservations.put(reservationId, new Reservation(reservationId, current.marketId(), remaining, current.side(), current.createdAt()));
        }
    }

    /**
     * Drops reservations whose order is no longer open on the venue.
     */
    public synchronized int reconcile(Set<String> activeOrderIds) {
        List<String> stale = new ArrayList<>();
        for (String id : reservations.keySet()) {
            if (!activeOrderIds.contains(id)) {
                stale.add(id);
            }
        }
        stale.forEach(reservations::remove);
        if (!stale.isEmpty()) {
            log.info("FUNDS: released {} stale reservations", stale.size());
        }
        return stale.size();
    }

    @Override
    public void invalidateBalanceCache() {
        balance.set(null);
    }

    @Override
    public synchronized BigDecimal totalReserved() {
        return reservations.values().stream().map(Reservation::notional).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public synchronized BigDecimal marketReserved(String marketId) {
        return reservations.values().stream()
                .filter(r -> r.marketId().equals(marketId))
                .map(Reservation::notional)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public synchronized List<Reservation> reservations() {
        return List.copyOf(reservations.values());
    }

    private FundsCheck evaluate(String marketId, BigDecimal required, BigDecimal available) {
        BigDecimal reserved = totalReserved();
        BigDecimal marketReserved = marketReserved(marketId);
        BigDecimal free = available.subtract(reserved).subtract(config.safetyBufferUsd());

        if (available.compareTo(config.minBalanceForTradingUsd()) < 0) {
            return new FundsCheck(false, FundsCheck.ReasonCode.BELOW_MIN_BALANCE,
                    "balance %s below minimum %s".formatted(available, config.minBalanceForTradingUsd()),
                    available, reserved, free, required);
        }
        if (marketReserved.add(required).compareTo(config.maxReservedPerMarketUsd()) > 0) {
            return new FundsCheck(false, FundsCheck.ReasonCode.MARKET_RESERVE_LIMIT,
                    "market reserved %s + %s exceeds %s".formatted(marketReserved, required, config.maxReservedPerMarketUsd()),
                    available, reserved, free, required);
        }
        if (reserved.add(required).compareTo(config.maxTotalReservedUsd()) > 0) {
            return new FundsCheck(false, FundsCheck.ReasonCode.TOTAL_RESERVE_LIMIT,
                    "total reserved %s + %s exceeds %s".formatted(reserved, required, config.maxTotalReservedUsd()),
                    available, reserved, free, required);
        }
        if (free.compareTo(required) < 0) {
            return new FundsCheck(false, FundsCheck.ReasonCode.INSUFFICIENT_BALANCE,
                    "free balance %s below required %s".formatted(free, required),
                    available, reserved, free, required);
        }
        return new FundsCheck(true, FundsCheck.ReasonCode.OK, null, available, reserved, free, required);
    }

    private BigDecimal availableBalance() {
        Instant now = clock.instant();
        BalanceSnapshot cached = balance.get();
        if (cached != null && Duration.between(cached.fetchedAt(), now).toMillis() < config.staleBalanceMillis()) {
            return cached.usd();
        }
        try {
            BigDecimal usd = venue.getBalance();
            BalanceSnapshot next = new BalanceSnapshot(usd == null ? BigDecimal.ZERO : usd, now);
            balance.set(next);
            return next.usd();
        } catch (RuntimeException e) {
            log.warn("FUNDS: balance refresh failed, using cached value: {}", e.toString());
            return cached == null ? BigDecimal.ZERO : cached.usd();
        }
    }

    public record Reservation(String id, String marketId, BigDecimal notional, Outcome side, Instant createdAt) {}

    private record BalanceSnapshot(BigDecimal usd, Instant fetchedAt) {}
}
