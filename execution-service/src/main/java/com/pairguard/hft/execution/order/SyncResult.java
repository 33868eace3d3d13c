package com.pairguard.hft.execution.order;

public record SyncResult(int placed, int cancelled, int blocked, int failed) {

    public static SyncResult empty() {
        return new SyncResult(0, 0, 0, 0);
    }

    public boolean changed() {
        return placed > 0 || cancelled > 0;
    }
}
