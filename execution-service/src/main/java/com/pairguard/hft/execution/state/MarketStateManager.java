package com.pairguard.hft.execution.state;

import com.pairguard.hft.events.HftEventPublisher;
import com.pairguard.hft.events.HftEventTypes;
import com.pairguard.hft.execution.config.MarketStateConfig;
import com.pairguard.hft.execution.model.MarketKey;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-market pairing lifecycle: FLAT, ONE_SIDED_*, PAIRING, PAIRED and UNWIND_ONLY.
 * <p>
 * State is a function of inventory and elapsed time only. A market is evaluated by one task at a time, so each
 * context has a single writer.
 */
@Slf4j
public class MarketStateManager {

    private final MarketStateConfig config;
    private final Clock clock;
    private final HftEventPublisher events;

    private final Map<MarketKey, MarketStateContext> contexts = new ConcurrentHashMap<>();

    public MarketStateManager(@NonNull MarketStateConfig config, @NonNull Clock clock, @NonNull HftEventPublisher events) {
        this.config = config;
        this.clock = clock;
        this.events = events;
    }

    public MarketStateContext getContext(MarketKey key) {
        return contexts.computeIfAbsent(key, k -> new MarketStateContext(k, clock.instant()));
    }

    public Optional<MarketStateContext> findContext(MarketKey key) {
        return Optional.ofNullable(contexts.get(key));
    }

    public PairingState getState(MarketKey key) {
        MarketStateContext ctx = contexts.get(key);
        return ctx == null ? PairingState.FLAT : ctx.getState();
    }

    public void clearMarket(MarketKey key) {
        if (contexts.remove(key) != null) {
            log.debug("PAIRING: cleared state for {}", key);
        }
    }

    public int trackedMarketCount() {
        return contexts.size();
    }

    public List<MarketStateContext.Snapshot> snapshots() {
        return contexts.values().stream().map(MarketStateContext::snapshot).toList();
    }

    /**
     * Pure state derivation. A market holding only one side is ONE_SIDED even mid-pairing; PAIRING is sticky
     * only once both legs hold shares, until the market pairs, reaches the unwind window or times out.
     */
    public PairingState determineState(MarketStateContext ctx, long secondsRemaining) {
        BigDecimal up = ctx.getUpShares();
        BigDecimal down = ctx.getDownShares();

        if (ctx.getState() == PairingState.UNWIND_ONLY || secondsRemaining <= config.unwindThresholdSeconds()) {
            return PairingState.UNWIND_ONLY;
        }
        if (up.signum() == 0 && down.signum() == 0) {
            return PairingState.FLAT;
        }
        BigDecimal paired = up.min(down);
        BigDecimal tolerance = paired.multiply(BigDecimal.valueOf(config.pairedImbalanceTolerance()));
        if (paired.compareTo(config.minPairedShares()) >= 0 && up.subtract(down).abs().compareTo(tolerance) <= 0) {
            return PairingState.PAIRED;
        }
        if (down.signum() == 0) {
            return PairingState.ONE_SIDED_UP;
        }
        if (up.signum() == 0) {
            return PairingState.ONE_SIDED_DOWN;
        }
        if (ctx.getState() == PairingState.PAIRING) {
            return PairingState.PAIRING;
        }
        return up.compareTo(down) > 0 ? PairingState.ONE_SIDED_UP : PairingState.ONE_SIDED_DOWN;
    }

    public void transitionState(MarketStateContext ctx, PairingState next, PairingReason reason, BookData bookData) {
        PairingState previous = ctx.getState();
        if (previous == next) {
            return;
        }
        Instant now = clock.instant();
        String why = reason == null ? "STATE_RECOMPUTE" : reason.name();
        ctx.setState(next, now, why);

        if (next == PairingState.PAIRING && previous.isOneSided()) {
            PairingReason pairingReason = reason == null ? PairingReason.PAIR_EDGE : reason;
            ctx.startPairing(now, pairingReason);
            BookData book = bookData == null ? BookData.empty() : bookData;
            log.info("PAIRING: started market={} reason={} up={} down={} askUp={} askDown={} pairCostCents={}",
                    ctx.getKey(), pairingReason, ctx.getUpShares(), ctx.getDownShares(),
                    book.bestAskUp(), book.bestAskDown(), book.impliedPairCostCents());
            publish(HftEventTypes.MARKET_STATE_PAIRING_STARTED, ctx, new PairingStartedEvent(
                    ctx.getKey().marketId(), ctx.getKey().asset(), pairingReason, ctx.getUpShares(), ctx.getDownShares(),
                    book.bestAskUp(), book.bestAskDown(), book.combinedAsk(), book.impliedPairCostCents()));
        } else if (previous == PairingState.PAIRING) {
            ctx.clearPairing();
        }

        log.debug("PAIRING: transition market={} {} -> {} reason={}", ctx.getKey(), previous, next, why);
        publish(HftEventTypes.MARKET_STATE_TRANSITION, ctx, new TransitionEvent(
                ctx.getKey().marketId(), ctx.getKey().asset(), previous, next, why, ctx.getUpShares(), ctx.getDownShares()));
    }

    /**
     * Moves a one-sided market into PAIRING before hedge orders are worked. No-op in any other state.
     */
    public boolean beginPairing(MarketKey key, PairingReason reason, BookData bookData) {
        MarketStateContext ctx = getContext(key);
        if (!ctx.getState().isOneSided()) {
            return false;
        }
        transitionState(ctx, PairingState.PAIRING, reason, bookData);
        return true;
    }

    /**
     * Hard deadline on PAIRING. On expiry reverts to the leading side and reports {@code timedOut} once.
     */
    public PairingTimeoutResult checkPairingTimeout(MarketStateContext ctx) {
        if (ctx.getState() != PairingState.PAIRING || ctx.getPairingStartedAt() == null) {
            return PairingTimeoutResult.notTimedOut(0.0);
        }
        double inPairing = Duration.between(ctx.getPairingStartedAt(), clock.instant()).toMillis() / 1000.0;
        if (inPairing <= config.pairingTimeoutSeconds()) {
            return PairingTimeoutResult.notTimedOut(inPairing);
        }

        PairingState revertTo = ctx.getUpShares().compareTo(ctx.getDownShares()) > 0
                ? PairingState.ONE_SIDED_UP
                : PairingState.ONE_SIDED_DOWN;
        log.warn("PAIRING: timeout market={} inPairingSec={} up={} down={} revertTo={}",
                ctx.getKey(), String.format("%.1f", inPairing), ctx.getUpShares(), ctx.getDownShares(), revertTo);
        publish(HftEventTypes.MARKET_STATE_PAIRING_TIMEOUT, ctx, new PairingTimeoutEvent(
                ctx.getKey().marketId(), ctx.getKey().asset(), inPairing, config.pairingTimeoutSeconds(),
                ctx.getUpShares(), ctx.getDownShares(), revertTo));
        transitionState(ctx, revertTo, null, null);
        return new PairingTimeoutResult(true, inPairing, revertTo);
    }

    public DynamicHedgeCap calculateDynamicHedgeCap(String asset, MarketStateContext ctx) {
        MarketStateConfig.SlippageCap cap = config.capFor(asset);
        Double vol = recentVolatility(ctx);
        double dynamic = cap.baseCents() + (vol == null ? 0.0 : vol * config.volatilityMultiplier() * 100.0);
        double finalCap = Math.min(dynamic, cap.maxCents());
        return new DynamicHedgeCap(cap.baseCents(), dynamic, finalCap, vol);
    }

    public boolean isHedgePriceAllowed(String asset, MarketStateContext ctx, BigDecimal impliedPairCostCents) {
        if (impliedPairCostCents == null) {
            return false;
        }
        DynamicHedgeCap cap = calculateDynamicHedgeCap(asset, ctx);
        boolean allowed = impliedPairCostCents.doubleValue() <= 100.0 + cap.finalCapCents();
        if (!allowed) {
            log.debug("PAIRING: hedge price rejected market={} pairCostCents={} capCents={} vol={}",
                    ctx.getKey(), impliedPairCostCents, cap.finalCapCents(), cap.recentVol());
            publish(HftEventTypes.MARKET_STATE_HEDGE_CAP, ctx, new HedgeCapEvent(
                    ctx.getKey().marketId(), asset, impliedPairCostCents, cap.baseCapCents(), cap.dynamicCapCents(),
                    cap.finalCapCents(), cap.recentVol()));
        }
        return allowed;
    }

    public HedgeChunk calculateBoundedHedgeChunk(BigDecimal oneSidedShares) {
        BigDecimal raw = oneSidedShares.multiply(BigDecimal.valueOf(config.minHedgeChunkPct()))
                .setScale(0, RoundingMode.FLOOR);
        BigDecimal bounded = config.minHedgeChunkAbs().max(raw.min(config.maxHedgeChunkAbs()));
        return new HedgeChunk(raw, bounded);
    }

    public boolean isHedgeSizeAllowed(BigDecimal chunk) {
        return chunk != null
                && chunk.compareTo(config.minHedgeChunkAbs()) >= 0
                && chunk.compareTo(config.maxHedgeChunkAbs()) <= 0;
    }

    /**
     * Single entry point per evaluation cycle.
     */
    public TickResult processTick(MarketKey key,
                                  BigDecimal upShares,
                                  BigDecimal downShares,
                                  long secondsRemaining,
                                  BigDecimal midPrice,
                                  BookData bookData) {
        MarketStateContext ctx = getContext(key);
        ctx.updateShares(upShares, downShares);
        if (midPrice != null && midPrice.signum() > 0) {
            ctx.recordPrice(clock.instant(), midPrice, Duration.ofSeconds(config.volatilityLookbackSeconds()));
        }

        PairingTimeoutResult timeout = checkPairingTimeout(ctx);
        if (!timeout.timedOut()) {
            PairingState next = determineState(ctx, secondsRemaining);
            if (next != ctx.getState()) {
                transitionState(ctx, next, null, bookData);
            }
        }
        return new TickResult(ctx.getState(), timeout.timedOut(), timeout.timeInPairingSeconds(), timeout.timedOut());
    }

    private static Double recentVolatility(MarketStateContext ctx) {
        List<PriceSample> history = ctx.priceHistorySnapshot();
        if (history.size() < 2) {
            return null;
        }
        BigDecimal oldest = history.get(0).price();
        BigDecimal newest = history.get(history.size() - 1).price();
        if (oldest.signum() == 0) {
            return null;
        }
        return newest.subtract(oldest).abs().doubleValue() / oldest.doubleValue();
    }

    private void publish(String type, MarketStateContext ctx, Object data) {
        try {
            events.publish(type, ctx.getKey().toString(), data);
        } catch (RuntimeException e) {
            log.debug("PAIRING: event publish failed type={}: {}", type, e.toString());
        }
    }

    public record TransitionEvent(
            String marketId,
            String asset,
            PairingState from,
            PairingState to,
            String reason,
            BigDecimal upShares,
            BigDecimal downShares
    ) {}

    public record PairingStartedEvent(
            String marketId,
            String asset,
            PairingReason reason,
            BigDecimal upShares,
            BigDecimal downShares,
            BigDecimal bestAskUp,
            BigDecimal bestAskDown,
            BigDecimal combinedAsk,
            BigDecimal impliedPairCostCents
    ) {}

    public record PairingTimeoutEvent(
            String marketId,
            String asset,
            double timeInPairingSeconds,
            long timeoutSeconds,
            BigDecimal upShares,
            BigDecimal downShares,
            PairingState revertedTo
    ) {}

    public record HedgeCapEvent(
            String marketId,
            String asset,
            BigDecimal impliedPairCostCents,
            double baseCapCents,
            double dynamicCapCents,
            double finalCapCents,
            Double recentVol
    ) {}
}
