package com.pairguard.hft.execution.state;

import com.pairguard.hft.execution.model.MarketKey;
import lombok.AccessLevel;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Mutable per-market pairing state. Written only by {@link MarketStateManager}; readers should use
 * {@link #snapshot()}.
 */
@Getter
public class MarketStateContext {

    private final MarketKey key;
    private final Instant createdAt;
    private PairingState state = PairingState.FLAT;
    private BigDecimal upShares = BigDecimal.ZERO;
    private BigDecimal downShares = BigDecimal.ZERO;
    private Instant pairingStartedAt;
    private PairingReason pairingReason;
    private Instant lastTransitionAt;
    private String lastTransitionReason;
    @Getter(AccessLevel.NONE)
    private final Deque<PriceSample> priceHistory = new ArrayDeque<>();

    MarketStateContext(MarketKey key, Instant createdAt) {
        this.key = key;
        this.createdAt = createdAt;
        this.lastTransitionAt = createdAt;
    }

    synchronized void updateShares(BigDecimal up, BigDecimal down) {
        this.upShares = up == null || up.signum() < 0 ? BigDecimal.ZERO : up;
        this.downShares = down == null || down.signum() < 0 ? BigDecimal.ZERO : down;
    }

    synchronized void setState(PairingState next, Instant at, String reason) {
        this.state = next;
        this.lastTransitionAt = at;
        this.lastTransitionReason = reason;
    }

    synchronized void startPairing(Instant at, PairingReason reason) {
        this.pairingStartedAt = at;
        this.pairingReason = reason;
    }

    synchronized void clearPairing() {
        this.pairingStartedAt = null;
        this.pairingReason = null;
    }

    /**
     * Appends a price and drops every sample older than the lookback.
     */
    synchronized void recordPrice(Instant at, BigDecimal price, Duration lookback) {
        priceHistory.addLast(new PriceSample(at, price));
        Instant cutoff = at.minus(lookback);
        while (!priceHistory.isEmpty() && priceHistory.peekFirst().at().isBefore(cutoff)) {
            priceHistory.removeFirst();
        }
    }

    public synchronized List<PriceSample> priceHistorySnapshot() {
        return List.copyOf(priceHistory);
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(
                key.marketId(),
                key.asset(),
                state,
                upShares,
                downShares,
                pairingStartedAt,
                pairingReason,
                lastTransitionAt,
                lastTransitionReason,
                priceHistory.size()
        );
    }

    public record Snapshot(
            String marketId,
            String asset,
            PairingState state,
            BigDecimal upShares,
            BigDecimal downShares,
            Instant pairingStartedAt,
            PairingReason pairingReason,
            Instant lastTransitionAt,
            String lastTransitionReason,
            int priceSamples
    ) {}
}
