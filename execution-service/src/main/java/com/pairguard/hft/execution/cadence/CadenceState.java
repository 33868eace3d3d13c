package com.pairguard.hft.execution.cadence;

import com.pairguard.hft.execution.model.MarketKey;
import lombok.Getter;

import java.time.Instant;

/**
 * Per-market cadence bookkeeping. Guarded by its own monitor in {@link CadenceController}.
 * A null {@code snapshotIntervalMillis} means snapshots are event-driven only.
 */
@Getter
public class CadenceState {

    private final MarketKey key;
    private CadenceLevel level = CadenceLevel.COLD;
    private Instant lastEvalAt;
    private Instant lastFullSnapshotAt;
    private Instant nearFalseSince;
    private Instant hotFalseSince;
    private Instant lastStateChangeAt;
    private long evalIntervalMillis;
    private Long snapshotIntervalMillis;

    CadenceState(MarketKey key, Instant now, long evalIntervalMillis, Long snapshotIntervalMillis) {
        this.key = key;
        this.lastStateChangeAt = now;
        this.evalIntervalMillis = evalIntervalMillis;
        this.snapshotIntervalMillis = snapshotIntervalMillis;
    }

    void setLevel(CadenceLevel level, Instant at, long evalIntervalMillis, Long snapshotIntervalMillis) {
        this.level = level;
        this.lastStateChangeAt = at;
        this.evalIntervalMillis = evalIntervalMillis;
        this.snapshotIntervalMillis = snapshotIntervalMillis;
    }

    void setLastEvalAt(Instant at) {
        this.lastEvalAt = at;
    }

    void setLastFullSnapshotAt(Instant at) {
        this.lastFullSnapshotAt = at;
    }

    void setNearFalseSince(Instant at) {
        this.nearFalseSince = at;
    }

    void setHotFalseSince(Instant at) {
        this.hotFalseSince = at;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(key.marketId(), key.asset(), level, lastEvalAt, lastFullSnapshotAt, evalIntervalMillis,
                snapshotIntervalMillis);
    }

    public record Snapshot(
            String marketId,
            String asset,
            CadenceLevel level,
            Instant lastEvalAt,
            Instant lastFullSnapshotAt,
            long evalIntervalMillis,
            Long snapshotIntervalMillis
    ) {}
}
