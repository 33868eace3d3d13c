package com.pairguard.hft.execution.guard;

import com.pairguard.hft.domain.OrderSide;
import com.pairguard.hft.events.HftEventPublisher;
import com.pairguard.hft.events.HftEventTypes;
import com.pairguard.hft.execution.config.PriceGuardConfig;
import com.pairguard.hft.execution.model.MarketKey;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single authority on whether a price may be submitted.
 * <p>
 * A BUY must rest at or below {@code bestAsk - tick} and a SELL at or above {@code bestBid + tick}. Prices are
 * rounded toward the safe side first (BUY down, SELL up). In emergency mode a bounded cross of at most
 * {@code emergencyMaxCrossTicks} is allowed, at most once per market per cooldown window.
 */
@Slf4j
public class PriceGuard {

    private final PriceGuardConfig config;
    private final Clock clock;
    private final HftEventPublisher events;
    private final MeterRegistry meterRegistry;

    private final Map<MarketKey, Instant> lastEmergencyOrderAt = new ConcurrentHashMap<>();

    public PriceGuard(@NonNull PriceGuardConfig config,
                      @NonNull Clock clock,
                      @NonNull HftEventPublisher events,
                      @NonNull MeterRegistry meterRegistry) {
        this.config = config;
        this.clock = clock;
        this.events = events;
        this.meterRegistry = meterRegistry;
    }

    public BigDecimal tickSize() {
        return config.tickSize();
    }

    public BigDecimal roundBuyPrice(BigDecimal price) {
        return roundToTick(price, RoundingMode.FLOOR);
    }

    public BigDecimal roundSellPrice(BigDecimal price) {
        return roundToTick(price, RoundingMode.CEILING);
    }

    public BigDecimal roundForSide(OrderSide side, BigDecimal price) {
        return side == OrderSide.BUY ? roundBuyPrice(price) : roundSellPrice(price);
    }

    public BookFreshness checkBookFreshness(BookSnapshot book) {
        if (book == null || book.fetchedAt() == null) {
            return BookFreshness.stale(Long.MAX_VALUE);
        }
        long ageMillis = Duration.between(book.fetchedAt(), clock.instant()).toMillis();
        if (ageMillis > config.maxBookAgeMillis()) {
            log.debug("PRICE_GUARD: stale book ageMs={} maxMs={}", ageMillis, config.maxBookAgeMillis());
            return BookFreshness.stale(ageMillis);
        }
        return BookFreshness.fresh(ageMillis);
    }

    public PriceCheckResult checkPrice(OrderSide side,
                                       BigDecimal requestedPrice,
                                       BookSnapshot book,
                                       boolean emergencyMode,
                                       MarketKey market,
                                       String intent) {
        if (side == null || book == null || !isPositive(book.bestBid()) || !isPositive(book.bestAsk())
                || !isPositive(requestedPrice)) {
            return block(BlockReason.INVALID_BOOK, null,
                    "invalid book or price bid=%s ask=%s requested=%s".formatted(
                            book == null ? null : book.bestBid(), book == null ? null : book.bestAsk(), requestedPrice),
                    market, side);
        }
        BigDecimal bestBid = book.bestBid();
        BigDecimal bestAsk = book.bestAsk();
        if (bestBid.compareTo(bestAsk) >= 0) {
            return block(BlockReason.INVERTED_BOOK, null,
                    "inverted book bid=%s ask=%s".formatted(bestBid, bestAsk), market, side);
        }

        BigDecimal tick = config.tickSize();
        if (side == OrderSide.BUY) {
            BigDecimal rounded = roundBuyPrice(requestedPrice);
            BigDecimal maxMaker = bestAsk.subtract(tick);
            if (rounded.compareTo(maxMaker) <= 0) {
                return PriceCheckResult.allowed(rounded, ticksBetween(bestAsk, rounded));
            }
            if (!emergencyMode) {
                return block(BlockReason.CROSSING_BLOCKED, bestAsk,
                        "BUY %s would cross ask %s".formatted(rounded, bestAsk), market, side);
            }
            BigDecimal ceiling = bestAsk.add(tick.multiply(BigDecimal.valueOf(config.emergencyMaxCrossTicks())));
            BigDecimal price = rounded.min(ceiling);
            return emergencyCross(side, requestedPrice, price, -ticksBetween(price, bestAsk), book, market, intent);
        }

        BigDecimal rounded = roundSellPrice(requestedPrice);
        BigDecimal minMaker = bestBid.add(tick);
        if (rounded.compareTo(minMaker) >= 0) {
            return PriceCheckResult.allowed(rounded, ticksBetween(rounded, bestBid));
        }
        if (!emergencyMode) {
            return block(BlockReason.CROSSING_BLOCKED, bestBid,
                    "SELL %s would cross bid %s".formatted(rounded, bestBid), market, side);
        }
        BigDecimal floor = bestBid.subtract(tick.multiply(BigDecimal.valueOf(config.emergencyMaxCrossTicks())));
        BigDecimal price = rounded.max(floor);
        return emergencyCross(side, requestedPrice, price, -ticksBetween(bestBid, price), book, market, intent);
    }

    /**
     * One tick inside the caller's best quote, clipped so the result always passes {@link #checkPrice} without
     * emergency mode.
     */
    public BigDecimal selectMakerPrice(OrderSide side, BookSnapshot book) {
        BigDecimal tick = config.tickSize();
        if (side == OrderSide.BUY) {
            return roundBuyPrice(book.bestBid().add(tick).min(book.bestAsk().subtract(tick)));
        }
        return roundSellPrice(book.bestAsk().subtract(tick).max(book.bestBid().add(tick)));
    }

    public boolean isSpreadSufficient(BookSnapshot book) {
        BigDecimal spread = book == null ? null : book.spread();
        return spread != null && spread.compareTo(config.minSpreadForMaker()) >= 0;
    }

    public boolean isEmergencyWindow(long secondsRemaining) {
        return secondsRemaining <= config.maxSecondsRemainingForEmergency();
    }

    public Instant lastEmergencyOrderAt(MarketKey market) {
        return lastEmergencyOrderAt.get(market);
    }

    public void clearMarket(MarketKey market) {
        lastEmergencyOrderAt.remove(market);
    }

    private PriceCheckResult emergencyCross(OrderSide side,
                                            BigDecimal requestedPrice,
                                            BigDecimal price,
                                            int ticksFromEdge,
                                            BookSnapshot book,
                                            MarketKey market,
                                            String intent) {
        Instant now = clock.instant();
        if (!tryClaimEmergencySlot(market, now)) {
            Instant last = lastEmergencyOrderAt.get(market);
            long sinceMs = last == null ? 0 : Duration.between(last, now).toMillis();
            return block(BlockReason.EMERGENCY_RATE_LIMITED, side == OrderSide.BUY ? book.bestAsk() : book.bestBid(),
                    "emergency cooldown active sinceLastMs=%d minIntervalMs=%d".formatted(sinceMs, config.emergencyMinIntervalMillis()),
                    market, side);
        }

        log.info("PRICE_GUARD: emergency cross market={} side={} requested={} price={} ticksFromEdge={} bid={} ask={} intent={}",
                market, side, requestedPrice, price, ticksFromEdge, book.bestBid(), book.bestAsk(), intent);
        meterRegistry.counter("pairguard.price_guard.emergency_cross").increment();
        publishSafely(new EmergencyCrossEvent(
                market == null ? null : market.marketId(),
                market == null ? null : market.asset(),
                side,
                requestedPrice,
                price,
                book.bestBid(),
                book.bestAsk(),
                ticksFromEdge,
                intent
        ), market);
        return PriceCheckResult.allowed(price, ticksFromEdge);
    }

    private boolean tryClaimEmergencySlot(MarketKey market, Instant now) {
        if (market == null) {
            return false;
        }
        boolean[] claimed = new boolean[1];
        lastEmergencyOrderAt.compute(market, (k, last) -> {
            if (last != null && Duration.between(last, now).toMillis() < config.emergencyMinIntervalMillis()) {
                return last;
            }
            claimed[0] = true;
            return now;
        });
        return claimed[0];
    }

    private PriceCheckResult block(BlockReason reason, BigDecimal bestPrice, String message, MarketKey market, OrderSide side) {
        log.debug("PRICE_GUARD: blocked market={} side={} reason={} {}", market, side, reason, message);
        meterRegistry.counter("pairguard.price_guard.blocked", "reason", reason.name()).increment();
        return PriceCheckResult.blocked(reason, bestPrice, message);
    }

    private void publishSafely(EmergencyCrossEvent event, MarketKey market) {
        try {
            events.publish(HftEventTypes.PRICE_GUARD_EMERGENCY_CROSS, market == null ? null : market.toString(), event);
        } catch (RuntimeException e) {
            log.debug("PRICE_GUARD: event publish failed: {}", e.toString());
        }
    }

    private int ticksBetween(BigDecimal higher, BigDecimal lower) {
        return higher.subtract(lower).divide(config.tickSize(), 0, RoundingMode.HALF_UP).intValue();
    }

    private BigDecimal roundToTick(BigDecimal price, RoundingMode mode) {
        BigDecimal tick = config.tickSize();
        return price.divide(tick, 0, mode).multiply(tick).setScale(Math.max(tick.scale(), 0), RoundingMode.UNNECESSARY);
    }

    private static boolean isPositive(BigDecimal v) {
        return v != null && v.signum() > 0;
    }

    public record EmergencyCrossEvent(
            String marketId,
            String asset,
            OrderSide side,
            BigDecimal requestedPrice,
            BigDecimal safePrice,
            BigDecimal bestBid,
            BigDecimal bestAsk,
            int ticksFromEdge,
            String intent
    ) {}
}
