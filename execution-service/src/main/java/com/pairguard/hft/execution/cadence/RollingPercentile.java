package com.pairguard.hft.execution.cadence;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Nearest-rank percentile over the last {@code capacity} samples. Returns 0 while empty.
 */
public class RollingPercentile {

    private final int capacity;
    private final Deque<Double> values = new ArrayDeque<>();

    public RollingPercentile(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    public synchronized void push(double value) {
        if (Double.isNaN(value)) {
            return;
        }
        values.addLast(value);
        while (values.size() > capacity) {
            values.removeFirst();
        }
    }

    public synchronized double percentile(double p) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        int idx = (int) Math.floor((p / 100.0) * (sorted.length - 1));
        return sorted[Math.max(0, Math.min(sorted.length - 1, idx))];
    }

    public synchronized int size() {
        return values.size();
    }
}
