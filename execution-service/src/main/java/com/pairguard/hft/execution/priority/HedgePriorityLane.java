package com.pairguard.hft.execution.priority;

import com.pairguard.hft.domain.OrderSide;
import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.events.HftEventPublisher;
import com.pairguard.hft.events.HftEventTypes;
import com.pairguard.hft.execution.config.HedgePriorityConfig;
import com.pairguard.hft.execution.guard.BookSnapshot;
import com.pairguard.hft.execution.guard.PriceGuard;
import com.pairguard.hft.execution.model.MarketKey;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hedge operations pre-empt normal admission control, and per-market hedge bookkeeping decides when to place,
 * reprice or abandon a hedge for an emergency exit.
 */
@Slf4j
public class HedgePriorityLane {

    private static final Set<String> PRIORITY_INTENTS = Set.of(
            "HEDGE", "HEDGE_URGENT", "SURVIVAL", "EMERGENCY_EXIT", "FORCE", "FORCE_HEDGE", "PANIC_HEDGE"
    );
    private static final int EMERGENCY_CROSS_TICKS = 2;

    private final HedgePriorityConfig config;
    private final PriceGuard priceGuard;
    private final Clock clock;
    private final HftEventPublisher events;

    private final Map<MarketKey, HedgeState> hedges = new ConcurrentHashMap<>();

    public HedgePriorityLane(@NonNull HedgePriorityConfig config,
                             @NonNull PriceGuard priceGuard,
                             @NonNull Clock clock,
                             @NonNull HftEventPublisher events) {
        this.config = config;
        this.priceGuard = priceGuard;
        this.clock = clock;
        this.events = events;
    }

    public static boolean isHedgePriorityIntent(String intent) {
        return intent != null && PRIORITY_INTENTS.contains(intent.trim().toUpperCase(Locale.ROOT));
    }

    public boolean shouldBypassRateLimiter(String intent) {
        return isHedgePriorityIntent(intent);
    }

    public boolean shouldBypassBurstLimiter(String intent) {
        return isHedgePriorityIntent(intent);
    }

    /**
     * Cost-per-pair gating never blocks a hedge; the escalator applies its own pair-cost gate.
     */
    public boolean shouldBypassCppGating(String intent) {
        return isHedgePriorityIntent(intent);
    }

    public HedgeIntent getEscalationLevel(double secsSinceEntry) {
        if (secsSinceEntry <= config.normalSeconds()) return HedgeIntent.HEDGE;
        if (secsSinceEntry <= config.urgentSeconds()) return HedgeIntent.HEDGE_URGENT;
        if (secsSinceEntry <= config.survivalSeconds()) return HedgeIntent.SURVIVAL;
        return HedgeIntent.EMERGENCY_EXIT;
    }

    /**
     * Begins tracking after an entry fill. An unresolved hedge for the same market is kept as is.
     */
    public HedgeState startHedgeTracking(MarketKey key, Outcome entrySide, BigDecimal entryQty) {
        Instant now = clock.instant();
        boolean[] created = new boolean[1];
        HedgeState state = hedges.compute(key, (k, existing) -> {
            if (existing != null && !existing.isResolved()) {
                return existing;
            }
            created[0] = true;
            return new HedgeState(k, now, entrySide, entryQty);
        });
        if (created[0]) {
            log.info("HEDGE: tracking started market={} entrySide={} entryQty={}", key, entrySide, entryQty);
            publish(HftEventTypes.HEDGE_STARTED, key, new HedgeStartedEvent(key.marketId(), key.asset(), entrySide, entryQty));
        }
        return state;
    }

    public void recordHedgeFill(MarketKey key, BigDecimal fillQty) {
        HedgeState state = hedges.get(key);
        if (state == null || state.isResolved() || fillQty == null || fillQty.signum() <= 0) {
            return;
        }
        state.addFill(fillQty);
        if (state.getHedgeFillQty().compareTo(state.getEntryQty()) >= 0) {
            Instant now = clock.instant();
            state.resolve(HedgeResolution.HEDGED, now);
            long lagMillis = Duration.between(state.getEntryFillAt(), now).toMillis();
            log.info("HEDGE: completed market={} filled={} entryQty={} attempts={} lagMs={}",
                    key, state.getHedgeFillQty(), state.getEntryQty(), state.getHedgeAttempts(), lagMillis);
            publish(HftEventTypes.HEDGE_COMPLETED, key, new HedgeCompletedEvent(key.marketId(), key.asset(),
                    state.getEntryQty(), state.getHedgeFillQty(), state.getHedgeAttempts(), lagMillis));
        }
    }

    public void recordEmergencyExit(MarketKey key) {
        HedgeState state = hedges.get(key);
        if (state == null) {
            return;
        }
        state.resolve(HedgeResolution.EXITED, clock.instant());
        log.warn("HEDGE: emergency exit market={} attempts={} filled={}/{}",
                key, state.getHedgeAttempts(), state.getHedgeFillQty(), state.getEntryQty());
        publish(HftEventTypes.HEDGE_EMERGENCY_EXIT, key, state.snapshot());
    }

    public void markHedgeExpired(MarketKey key) {
        HedgeState state = hedges.get(key);
        if (state == null || state.isResolved()) {
            return;
        }
        state.resolve(HedgeResolution.EXPIRED_UNHEDGED, clock.instant());
        log.warn("HEDGE: expired unhedged market={} filled={}/{}", key, state.getHedgeFillQty(), state.getEntryQty());
        publish(HftEventTypes.HEDGE_EXPIRED, key, state.snapshot());
    }

    public void clearHedgeState(MarketKey key) {
        hedges.remove(key);
    }

    public Optional<HedgeState> getHedgeState(MarketKey key) {
        return Optional.ofNullable(hedges.get(key));
    }

    public int activeHedgeCount() {
        return (int) hedges.values().stream().filter(h -> !h.isResolved()).count();
    }

    public List<HedgeState.Snapshot> snapshots() {
        return hedges.values().stream().map(HedgeState::snapshot).toList();
    }

    /**
     * Acting decisions (anything but WAIT) count one attempt and stamp {@code lastAttemptAt}, so repeated calls
     * inside the same reprice interval return WAIT.
     */
    public HedgeDecision getHedgeDecision(MarketKey key, long secondsToExpiry, boolean hasOpenHedgeOrder) {
        HedgeState state = hedges.get(key);
        if (state == null || state.isResolved()) {
            return HedgeDecision.waitFor("NO_ACTIVE_HEDGE", null);
        }
        Instant now = clock.instant();
        synchronized (state) {
            if (state.getHedgeAttempts() >= config.maxHedgeAttempts()) {
                return act(state, now, HedgeAction.EMERGENCY_EXIT, HedgeIntent.EMERGENCY_EXIT,
                        "MAX_ATTEMPTS_" + state.getHedgeAttempts(), true);
            }
            if (secondsToExpiry <= config.emergencyExitSeconds()) {
                return act(state, now, HedgeAction.EMERGENCY_EXIT, HedgeIntent.EMERGENCY_EXIT,
                        "EXPIRY_" + secondsToExpiry + "S", true);
            }

            double secsSinceEntry = Duration.between(state.getEntryFillAt(), now).toMillis() / 1000.0;
            HedgeIntent intent = secsSinceEntry > config.survivalSeconds()
                    ? HedgeIntent.SURVIVAL
                    : secsSinceEntry > config.urgentSeconds() ? HedgeIntent.HEDGE_URGENT : HedgeIntent.HEDGE;

            if (!hasOpenHedgeOrder) {
                return act(state, now, HedgeAction.PLACE_HEDGE, intent, "NO_OPEN_ORDER", false);
            }
            long sinceAttempt = state.getLastAttemptAt() == null
                    ? Long.MAX_VALUE
                    : Duration.between(state.getLastAttemptAt(), now).toMillis();
            if (sinceAttempt >= repriceIntervalMillis(intent)) {
                return act(state, now, HedgeAction.REPRICE_HEDGE, intent, "REPRICE_AFTER_" + sinceAttempt + "MS", false);
            }
            return HedgeDecision.waitFor("REPRICE_INTERVAL_NOT_ELAPSED", intent);
        }
    }

    /**
     * Hedge BUY price for the given urgency: maker price plus 0/1/2 ticks, never crossing; EMERGENCY_EXIT targets
     * a bounded cross and must go through the guard in emergency mode.
     */
    public HedgePrice calculateHedgePrice(HedgeIntent intent, BookSnapshot book) {
        BigDecimal tick = priceGuard.tickSize();
        if (intent == HedgeIntent.EMERGENCY_EXIT) {
            return new HedgePrice(book.bestAsk().add(tick.multiply(BigDecimal.valueOf(EMERGENCY_CROSS_TICKS))), true);
        }
        int extraTicks = switch (intent) {
            case HEDGE_URGENT -> 1;
            case SURVIVAL -> 2;
            default -> 0;
        };
        BigDecimal maker = priceGuard.selectMakerPrice(OrderSide.BUY, book);
        BigDecimal price = maker.add(tick.multiply(BigDecimal.valueOf(extraTicks)))
                .min(book.bestAsk().subtract(tick));
        return new HedgePrice(priceGuard.roundBuyPrice(price), false);
    }

    long repriceIntervalMillis(HedgeIntent intent) {
        return switch (intent) {
            case HEDGE_URGENT -> config.urgentRepriceMillis();
            case SURVIVAL -> config.survivalRepriceMillis();
            default -> config.normalRepriceMillis();
        };
    }

    private HedgeDecision act(HedgeState state, Instant now, HedgeAction action, HedgeIntent intent, String reason, boolean emergency) {
        state.recordAttempt(now, intent);
        log.debug("HEDGE: decision market={} action={} intent={} reason={} attempts={}",
                state.getKey(), action, intent, reason, state.getHedgeAttempts());
        return new HedgeDecision(true, action, intent, reason, emergency);
    }

    private void publish(String type, MarketKey key, Object data) {
        try {
            events.publish(type, key.toString(), data);
        } catch (RuntimeException e) {
            log.debug("HEDGE: event publish failed type={}: {}", type, e.toString());
        }
    }

    public record HedgeStartedEvent(String marketId, String asset, Outcome entrySide, BigDecimal entryQty) {}

    public record HedgeCompletedEvent(
            String marketId,
            String asset,
            BigDecimal entryQty,
            BigDecimal hedgeFillQty,
            int attempts,
            long lagMillis
    ) {}
}
