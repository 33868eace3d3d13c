package com.pairguard.hft.execution.cadence;

import com.pairguard.hft.events.HftEventPublisher;
import com.pairguard.hft.events.HftEventTypes;
import com.pairguard.hft.execution.config.CadenceConfig;
import com.pairguard.hft.execution.model.MarketKey;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides how often each market is evaluated. Markets close to an opportunity run hot (short interval), idle
 * markets cool down after a hysteresis delay. Snapshot logging has its own cadence and is event-driven when HOT.
 */
@Slf4j
public class CadenceController {

    private final CadenceConfig config;
    private final Clock clock;
    private final HftEventPublisher events;
    private final MeterRegistry meterRegistry;

    private final Map<MarketKey, CadenceState> states = new ConcurrentHashMap<>();
    private final Map<String, RollingPercentile> scoresByAsset = new ConcurrentHashMap<>();
    private final Map<MarketKey, Deque<SpreadSample>> spreadHistory = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastSpotMoveAt = new ConcurrentHashMap<>();
    private final Map<MarketKey, Instant> lastPolyMoveAt = new ConcurrentHashMap<>();

    public CadenceController(@NonNull CadenceConfig config,
                             @NonNull Clock clock,
                             @NonNull HftEventPublisher events,
                             @NonNull MeterRegistry meterRegistry) {
        this.config = config;
        this.clock = clock;
        this.events = events;
        this.meterRegistry = meterRegistry;
    }

    public void registerMarket(MarketKey key) {
        states.computeIfAbsent(key, k -> new CadenceState(k, clock.instant(), config.coldEvalMillis(), config.coldSnapshotMillis()));
        scoresByAsset.computeIfAbsent(assetKey(key.asset()), a -> new RollingPercentile(config.percentileWindow()));
    }

    public void unregisterMarket(MarketKey key) {
        states.remove(key);
        spreadHistory.remove(key);
        lastPolyMoveAt.remove(key);
    }

    public void recordSpotMove(String asset) {
        lastSpotMoveAt.put(assetKey(asset), clock.instant());
    }

    public void recordPolyMove(MarketKey key) {
        lastPolyMoveAt.put(key, clock.instant());
    }

    public void recordSpread(MarketKey key, double spreadUp, double spreadDown) {
        Instant now = clock.instant();
        Instant cutoff = now.minusMillis(config.spreadHistoryMillis());
        Deque<SpreadSample> history = spreadHistory.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(new SpreadSample(now, spreadUp, spreadDown));
            while (!history.isEmpty() && history.peekFirst().at().isBefore(cutoff)) {
                history.removeFirst();
            }
        }
    }

    /**
     * Only assets with a registered market collect scores.
     */
    public void recordStateScore(String asset, double score) {
        RollingPercentile p = scoresByAsset.get(assetKey(asset));
        if (p != null) {
            p.push(score);
        }
    }

    /**
     * Proximity to a tradeable pair in [0, 1]. The edge counts up to twice the entry threshold and is scaled by the
     * share of {@code fullDepth} the thinner ask can absorb, so a wide edge on an empty book scores low.
     */
    public double stateScore(double mispricing, double thinnerAskDepth, double fullDepth) {
        if (mispricing <= 0 || config.entryThreshold() <= 0) {
            return 0.0;
        }
        double edge = Math.min(mispricing / (2 * config.entryThreshold()), 1.0);
        double depth = fullDepth <= 0 ? 1.0 : Math.min(Math.max(thinnerAskDepth, 0.0) / fullDepth, 1.0);
        return edge * depth;
    }

    public CadenceSignals evaluateCadence(MarketKey key, CadenceMetrics metrics) {
        RollingPercentile p = scoresByAsset.get(assetKey(key.asset()));
        double nearPct = p == null ? 0.0 : p.percentile(config.nearPercentile());
        double hotPct = p == null ? 0.0 : p.percentile(config.hotPercentile());

        List<String> near = new ArrayList<>();
        List<String> hot = new ArrayList<>();

        double nearMispricing = config.nearMispricingRatio() * metrics.entryThreshold();
        if (metrics.mispricing() >= nearMispricing) {
            near.add(fmt("mispricing(%.3f)>=near(%.3f)", metrics.mispricing(), nearMispricing));
        }
        if (nearPct > 0 && metrics.stateScore() >= nearPct) {
            near.add(fmt("stateScore(%.3f)>=P%.0f(%.3f)", metrics.stateScore(), config.nearPercentile(), nearPct));
        }
        if (metrics.spotMoveAgeMillis() < config.moveWindowMillis()) {
            near.add("spotMoveAge(" + metrics.spotMoveAgeMillis() + "ms)");
        }
        if (metrics.polyMoveAgeMillis() < config.moveWindowMillis()) {
            near.add("polyMoveAge(" + metrics.polyMoveAgeMillis() + "ms)");
        }

        double hotMispricing = config.hotMispricingRatio() * metrics.entryThreshold();
        if (metrics.mispricing() >= hotMispricing) {
            hot.add(fmt("mispricing(%.3f)>=hot(%.3f)", metrics.mispricing(), hotMispricing));
        }
        if (hotPct > 0 && metrics.stateScore() >= hotPct) {
            hot.add(fmt("stateScore(%.3f)>=P%.0f(%.3f)", metrics.stateScore(), config.hotPercentile(), hotPct));
        }
        if (metrics.spreadChangedTick()) {
            hot.add("spreadChanged>=1tick");
        }
        return new CadenceSignals(!near.isEmpty(), !hot.isEmpty(), near, hot);
    }

    /**
     * COLD escalates immediately, WARM escalates to HOT immediately and cools to COLD after near has been false for
     * the near cooldown. HOT cools to WARM after the hot cooldown, and straight to COLD if near has also been false
     * long enough. Unregistered markets stay COLD.
     */
    public CadenceLevel updateState(MarketKey key, CadenceMetrics metrics) {
        CadenceState state = states.get(key);
        if (state == null) {
            return CadenceLevel.COLD;
        }
        CadenceSignals signals = evaluateCadence(key, metrics);
        Instant now = clock.instant();

        synchronized (state) {
            if (signals.near()) {
                state.setNearFalseSince(null);
            } else if (state.getNearFalseSince() == null) {
                state.setNearFalseSince(now);
            }
            if (signals.hot()) {
                state.setHotFalseSince(null);
            } else if (state.getHotFalseSince() == null) {
                state.setHotFalseSince(now);
            }

            CadenceLevel current = state.getLevel();
            CadenceLevel next = current;
            switch (current) {
                case COLD -> {
                    if (signals.hot()) next = CadenceLevel.HOT;
                    else if (signals.near()) next = CadenceLevel.WARM;
                }
                case WARM -> {
                    if (signals.hot()) next = CadenceLevel.HOT;
                    else if (elapsed(state.getNearFalseSince(), now) >= config.nearFalseCooldownMillis()) next = CadenceLevel.COLD;
                }
                case HOT -> {
                    if (elapsed(state.getHotFalseSince(), now) >= config.hotFalseCooldownMillis()) {
                        next = elapsed(state.getNearFalseSince(), now) >= config.nearFalseCooldownMillis()
                                ? CadenceLevel.COLD
                                : CadenceLevel.WARM;
                    }
                }
            }

            if (next != current) {
                state.setLevel(next, now, evalIntervalFor(next), snapshotIntervalFor(next));
                meterRegistry.counter("pairguard.cadence.transitions", "to", next.name()).increment();
                log.debug("CADENCE: {} {} -> {} near={} hot={} intervalMs={} reasons={}",
                        key, current, next, signals.near(), signals.hot(), state.getEvalIntervalMillis(),
                        signals.hot() ? signals.hotReasons() : signals.nearReasons());
                try {
                    events.publish(HftEventTypes.CADENCE_TRANSITION, key.toString(), new TransitionEvent(
                            key.marketId(), key.asset(), current, next, state.getEvalIntervalMillis(),
                            signals.nearReasons(), signals.hotReasons()));
                } catch (RuntimeException e) {
                    log.debug("CADENCE: event publish failed: {}", e.toString());
                }
            }
            return next;
        }
    }

    /**
     * Unregistered markets are always due.
     */
    public boolean shouldEvaluate(MarketKey key) {
        CadenceState state = states.get(key);
        if (state == null) {
            return true;
        }
        synchronized (state) {
            return state.getLastEvalAt() == null
                    || elapsed(state.getLastEvalAt(), clock.instant()) >= state.getEvalIntervalMillis();
        }
    }

    public void markEvaluated(MarketKey key) {
        CadenceState state = states.get(key);
        if (state != null) {
            synchronized (state) {
                state.setLastEvalAt(clock.instant());
            }
        }
    }

    public boolean shouldLogFullSnapshot(MarketKey key) {
        CadenceState state = states.get(key);
        if (state == null) {
            return true;
        }
        synchronized (state) {
            if (state.getSnapshotIntervalMillis() == null) {
                return false;
            }
            return state.getLastFullSnapshotAt() == null
                    || elapsed(state.getLastFullSnapshotAt(), clock.instant()) >= state.getSnapshotIntervalMillis();
        }
    }

    public void markFullSnapshot(MarketKey key) {
        CadenceState state = states.get(key);
        if (state != null) {
            synchronized (state) {
                state.setLastFullSnapshotAt(clock.instant());
            }
        }
    }

    /**
     * True when either outcome's spread moved by at least one tick within the move window.
     */
    public boolean checkSpreadChanged(MarketKey key) {
        Deque<SpreadSample> history = spreadHistory.get(key);
        if (history == null) {
            return false;
        }
        Instant cutoff = clock.instant().minusMillis(config.moveWindowMillis());
        SpreadSample first = null;
        SpreadSample last = null;
        synchronized (history) {
            for (SpreadSample s : history) {
                if (s.at().isBefore(cutoff)) {
                    continue;
                }
                if (first == null) {
                    first = s;
                }
                last = s;
            }
        }
        if (first == null || first == last) {
            return false;
        }
        double tick = config.tickSize().doubleValue() - 1e-9;
        return Math.abs(last.spreadUp() - first.spreadUp()) >= tick
                || Math.abs(last.spreadDown() - first.spreadDown()) >= tick;
    }

    public long spotMoveAgeMillis(String asset) {
        Instant at = lastSpotMoveAt.get(assetKey(asset));
        return at == null ? Long.MAX_VALUE : elapsed(at, clock.instant());
    }

    public long polyMoveAgeMillis(MarketKey key) {
        Instant at = lastPolyMoveAt.get(key);
        return at == null ? Long.MAX_VALUE : elapsed(at, clock.instant());
    }

    /**
     * Records the spread and state score, then assembles metrics from everything observed so far.
     */
    public CadenceMetrics buildMetrics(MarketKey key, double mispricing, double stateScore, double spreadUp, double spreadDown) {
        recordSpread(key, spreadUp, spreadDown);
        recordStateScore(key.asset(), stateScore);
        return new CadenceMetrics(
                mispricing,
                config.entryThreshold(),
                stateScore,
                spotMoveAgeMillis(key.asset()),
                polyMoveAgeMillis(key),
                checkSpreadChanged(key)
        );
    }

    public CadenceLevel getLevel(MarketKey key) {
        CadenceState state = states.get(key);
        return state == null ? CadenceLevel.COLD : state.getLevel();
    }

    public long evalIntervalMillis(MarketKey key) {
        CadenceState state = states.get(key);
        return state == null ? config.coldEvalMillis() : state.getEvalIntervalMillis();
    }

    public Optional<CadenceState.Snapshot> snapshot(MarketKey key) {
        return Optional.ofNullable(states.get(key)).map(CadenceState::snapshot);
    }

    public CadenceStats getStats() {
        int cold = 0;
        int warm = 0;
        int hot = 0;
        for (CadenceState s : states.values()) {
            switch (s.getLevel()) {
                case COLD -> cold++;
                case WARM -> warm++;
                case HOT -> hot++;
            }
        }
        return new CadenceStats(cold, warm, hot, states.size());
    }

    private long evalIntervalFor(CadenceLevel level) {
        return switch (level) {
            case COLD -> config.coldEvalMillis();
            case WARM -> config.warmEvalMillis();
            case HOT -> config.hotEvalMillis();
        };
    }

    private Long snapshotIntervalFor(CadenceLevel level) {
        return switch (level) {
            case COLD -> config.coldSnapshotMillis();
            case WARM -> config.warmSnapshotMillis();
            case HOT -> null;
        };
    }

    private static long elapsed(Instant since, Instant now) {
        return since == null ? 0 : Duration.between(since, now).toMillis();
    }

    private static String assetKey(String asset) {
        return asset == null ? "" : asset.trim().toUpperCase(Locale.ROOT);
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    private record SpreadSample(Instant at, double spreadUp, double spreadDown) {}

    public record TransitionEvent(
            String marketId,
            String asset,
            CadenceLevel from,
            CadenceLevel to,
            long evalIntervalMillis,
            List<String> nearReasons,
            List<String> hotReasons
    ) {}
}
