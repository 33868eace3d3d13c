package com.pairguard.hft.execution.order;

import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.execution.model.PairedMarket;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local order book of one market. Mutations go through {@link OrderManager} while holding {@link #syncLock()}.
 */
public class TrackedMarket {

    @Getter
    private final PairedMarket market;
    private final Map<String, TrackedOrder> upOrders = new ConcurrentHashMap<>();
    private final Map<String, TrackedOrder> downOrders = new ConcurrentHashMap<>();
    private final ReentrantLock syncLock = new ReentrantLock();
    private volatile Instant lastReconciledAt;

    TrackedMarket(PairedMarket market) {
        this.market = market;
    }

    Map<String, TrackedOrder> orders(Outcome outcome) {
        return outcome == Outcome.UP ? upOrders : downOrders;
    }

    ReentrantLock syncLock() {
        return syncLock;
    }

    Instant lastReconciledAt() {
        return lastReconciledAt;
    }

    void markReconciled(Instant at) {
        this.lastReconciledAt = at;
    }

    public List<TrackedOrder> snapshot(Outcome outcome) {
        return List.copyOf(orders(outcome).values());
    }

    public List<TrackedOrder> snapshot() {
        List<TrackedOrder> all = new ArrayList<>(upOrders.values());
        all.addAll(downOrders.values());
        return all;
    }

    public int openOrderCount() {
        return upOrders.size() + downOrders.size();
    }
}
