package com.pairguard.hft.execution.hedge;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded in-memory ring of the most recent hedge events plus lifetime counters per type.
 */
public class HedgeEventLog {

    private final int capacity;
    private final Deque<HedgeEvent> ring = new ArrayDeque<>();
    private final Map<HedgeEvent.Type, Long> counts = new EnumMap<>(HedgeEvent.Type.class);
    private Instant lastEventAt;

    public HedgeEventLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    public synchronized void append(HedgeEvent event) {
        if (ring.size() >= capacity) {
            ring.removeFirst();
        }
        ring.addLast(event);
        counts.merge(event.type(), 1L, Long::sum);
        lastEventAt = event.ts();
    }

    /**
     * Newest last.
     */
    public synchronized List<HedgeEvent> recent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<HedgeEvent> all = new ArrayList<>(ring);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized int size() {
        return ring.size();
    }

    public synchronized Stats stats() {
        return new Stats(
                counts.getOrDefault(HedgeEvent.Type.HEDGE_ATTEMPT, 0L),
                counts.getOrDefault(HedgeEvent.Type.HEDGE_SUCCESS, 0L),
                counts.getOrDefault(HedgeEvent.Type.HEDGE_FAILED, 0L),
                counts.getOrDefault(HedgeEvent.Type.HEDGE_ESCALATE_STEP, 0L),
                counts.getOrDefault(HedgeEvent.Type.HEDGE_ABORTED, 0L),
                ring.size(),
                lastEventAt
        );
    }

    public record Stats(
            long attempts,
            long successes,
            long failures,
            long escalations,
            long aborts,
            int bufferedEvents,
            Instant lastEventAt
    ) {}
}
