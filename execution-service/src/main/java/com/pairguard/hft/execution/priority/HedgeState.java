package com.pairguard.hft.execution.priority;

import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.execution.model.MarketKey;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Lifecycle of one hedge, from the entry fill to a terminal resolution. {@code hedgeAttempts} never decreases.
 */
@Getter
public class HedgeState {

    private final MarketKey key;
    private final Instant entryFillAt;
    private final Outcome entrySide;
    private final BigDecimal entryQty;
    private int hedgeAttempts;
    private Instant lastAttemptAt;
    private HedgeIntent currentIntent = HedgeIntent.HEDGE;
    private BigDecimal hedgeFillQty = BigDecimal.ZERO;
    private HedgeResolution resolution = HedgeResolution.PENDING;
    private Instant resolvedAt;

    HedgeState(MarketKey key, Instant entryFillAt, Outcome entrySide, BigDecimal entryQty) {
        this.key = key;
        this.entryFillAt = entryFillAt;
        this.entrySide = entrySide;
        this.entryQty = entryQty;
    }

    public Outcome hedgeSide() {
        return entrySide.opposite();
    }

    public boolean isResolved() {
        return resolution != HedgeResolution.PENDING;
    }

    public BigDecimal remainingQty() {
        return entryQty.subtract(hedgeFillQty).max(BigDecimal.ZERO);
    }

    synchronized void recordAttempt(Instant at, HedgeIntent intent) {
        hedgeAttempts++;
        lastAttemptAt = at;
        currentIntent = intent;
    }

    synchronized void addFill(BigDecimal qty) {
        hedgeFillQty = hedgeFillQty.add(qty);
    }

    synchronized void resolve(HedgeResolution outcome, Instant at) {
        if (isResolved()) {
            return;
        }
        resolution = outcome;
        resolvedAt = at;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(key.marketId(), key.asset(), entryFillAt, entrySide, entryQty, hedgeAttempts,
                lastAttemptAt, currentIntent, hedgeFillQty, resolution, resolvedAt);
    }

    public record Snapshot(
            String marketId,
            String asset,
            Instant entryFillAt,
            Outcome entrySide,
            BigDecimal entryQty,
            int hedgeAttempts,
            Instant lastAttemptAt,
            HedgeIntent currentIntent,
            BigDecimal hedgeFillQty,
            HedgeResolution resolution,
            Instant resolvedAt
    ) {}
}
