package com.pairguard.hft.execution.admission;

import com.pairguard.hft.execution.config.AdmissionConfig;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * One-minute sliding windows per market and globally. Tripping a limit pauses the market (or everything) for a
 * fixed period; {@code circuitBreakerFailures} consecutive failures on one market open a global breaker.
 */
@Slf4j
public class SlidingWindowOrderRateLimiter implements OrderRateLimiter {

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final AdmissionConfig config;
    private final Clock clock;

    private final Map<String, MarketWindow> markets = new HashMap<>();
    private final Deque<Event> globalEvents = new ArrayDeque<>();
    private Instant globalPausedUntil = Instant.EPOCH;
    private Instant breakerOpenedAt;

    public SlidingWindowOrderRateLimiter(@NonNull AdmissionConfig config, @NonNull Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    public synchronized RateLimitDecision checkAllowed(String marketId, OrderKind kind) {
        Instant now = clock.instant();

        if (breakerOpenedAt != null) {
            long openFor = Duration.between(breakerOpenedAt, now).toMillis();
            if (openFor > config.circuitBreakerResetMillis()) {
                log.info("RATE_LIMIT: circuit breaker reset after {}ms", openFor);
                breakerOpenedAt = null;
            } else {
                return RateLimitDecision.deny("CIRCUIT_BREAKER_OPEN", config.circuitBreakerResetMillis() - openFor);
            }
        }

        if (now.isBefore(globalPausedUntil)) {
            return RateLimitDecision.deny("GLOBAL_PAUSE", Duration.between(now, globalPausedUntil).toMillis());
        }

        prune(globalEvents, now);
        long globalCancels = globalEvents.stream().filter(e -> e.kind().isCancelOrReplace()).count();
        if (globalCancels >= config.maxCancelsGlobalPerMinute()) {
            globalPausedUntil = now.plusMillis(config.globalPauseMillis());
            log.warn("RATE_LIMIT: global cancel limit exceeded cancels={} pauseMs={}", globalCancels, config.globalPauseMillis());
            return RateLimitDecision.deny("GLOBAL_CANCEL_LIMIT", config.globalPauseMillis());
        }
        if (globalEvents.size() >= config.maxOrdersGlobalPerMinute()) {
            globalPausedUntil = now.plusMillis(config.globalPauseMillis());
            log.warn("RATE_LIMIT: global order limit exceeded events={} pauseMs={}", globalEvents.size(), config.globalPauseMillis());
            return RateLimitDecision.deny("GLOBAL_ORDER_LIMIT", config.globalPauseMillis());
        }

        MarketWindow market = markets.computeIfAbsent(marketId, k -> new MarketWindow());
        if (now.isBefore(market.pausedUntil)) {
            return RateLimitDecision.deny("MARKET_PAUSED", Duration.between(now, market.pausedUntil).toMillis());
        }
        prune(market.events, now);
        long marketCancels = market.events.stream().filter(e -> e.kind().isCancelOrReplace()).count();
        if (kind.isCancelOrReplace() && marketCancels >= config.maxCancelReplacePerMarketPerMinute()) {
            market.pausedUntil = now.plusMillis(config.marketPauseMillis());
            log.warn("RATE_LIMIT: market cancel limit exceeded market={} cancels={}", marketId, marketCancels);
            return RateLimitDecision.deny("MARKET_CANCEL_LIMIT", config.marketPauseMillis());
        }
        if (market.events.size() >= config.maxOrdersPerMarketPerMinute()) {
            market.pausedUntil = now.plusMillis(config.marketPauseMillis());
            log.warn("RATE_LIMIT: market order limit exceeded market={} events={}", marketId, market.events.size());
            return RateLimitDecision.deny("MARKET_ORDER_LIMIT", config.marketPauseMillis());
        }
        return RateLimitDecision.allow();
    }

    @Override
    public synchronized void recordEvent(String marketId, OrderKind kind) {
        Event event = new Event(kind, clock.instant());
        globalEvents.addLast(event);
        MarketWindow market = markets.computeIfAbsent(marketId, k -> new MarketWindow());
        market.events.addLast(event);
        market.consecutiveFailures = 0;
    }

    @Override
    public synchronized void recordFailure(String marketId) {
        MarketWindow market = markets.computeIfAbsent(marketId, k -> new MarketWindow());
        market.consecutiveFailures++;
        if (market.consecutiveFailures >= config.circuitBreakerFailures() && breakerOpenedAt == null) {
            breakerOpenedAt = clock.instant();
            log.warn("RATE_LIMIT: circuit breaker opened market={} consecutiveFailures={} resetMs={}",
                    marketId, market.consecutiveFailures, config.circuitBreakerResetMillis());
        }
    }

    public synchronized void forceResetCircuitBreaker() {
        breakerOpenedAt = null;
        markets.values().forEach(m -> m.consecutiveFailures = 0);
        log.info("RATE_LIMIT: circuit breaker force reset");
    }

    @Override
    public synchronized Status status() {
        Instant now = clock.instant();
        prune(globalEvents, now);
        int paused = (int) markets.values().stream().filter(m -> now.isBefore(m.pausedUntil)).count();
        int cancels = (int) globalEvents.stream().filter(e -> e.kind().isCancelOrReplace()).count();
        return new Status(breakerOpenedAt != null, now.isBefore(globalPausedUntil), paused, globalEvents.size(), cancels);
    }

    private static void prune(Deque<Event> events, Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!events.isEmpty() && !events.peekFirst().at().isAfter(cutoff)) {
            events.removeFirst();
        }
    }

    private record Event(OrderKind kind, Instant at) {}

    private static final class MarketWindow {
        private final Deque<Event> events = new ArrayDeque<>();
        private Instant pausedUntil = Instant.EPOCH;
        private int consecutiveFailures;
    }
}
