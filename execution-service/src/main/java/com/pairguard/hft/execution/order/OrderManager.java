package com.pairguard.hft.execution.order;

import com.pairguard.hft.domain.OrderSide;
import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.events.HftEventPublisher;
import com.pairguard.hft.events.HftEventTypes;
import com.pairguard.hft.execution.admission.FundsLedger;
import com.pairguard.hft.execution.guard.BookSnapshot;
import com.pairguard.hft.execution.model.MarketKey;
import com.pairguard.hft.execution.model.PairedMarket;
import com.pairguard.hft.venue.CancelResult;
import com.pairguard.hft.venue.OpenOrder;
import com.pairguard.hft.venue.OpenOrdersResult;
import com.pairguard.hft.venue.OrderType;
import com.pairguard.hft.venue.VenueClient;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the local view of resting orders per market and outcome, and converges it to the venue.
 * <p>
 * Quote sync and reconciliation of a market are serialized by the market's sync lock. Reconciliation only
 * try-locks and skips markets that are busy. Any order that leaves the local view also gives back its funds
 * reservation.
 */
@Slf4j
public class OrderManager implements AutoCloseable {

    public static final String QUOTE_INTENT = "QUOTE";

    private final VenueClient venue;
    private final GuardedOrderPlacer placer;
    private final FundsLedger fundsLedger;
    private final Clock clock;
    private final HftEventPublisher events;
    private final MeterRegistry meterRegistry;
    private final int maxConcurrentOrders;
    private final Duration reconcileInterval;
    private final ExecutorService pool;

    private final Map<MarketKey, TrackedMarket> markets = new ConcurrentHashMap<>();

    public OrderManager(@NonNull VenueClient venue,
                        @NonNull GuardedOrderPlacer placer,
                        @NonNull FundsLedger fundsLedger,
                        @NonNull Clock clock,
                        @NonNull HftEventPublisher events,
                        @NonNull MeterRegistry meterRegistry,
                        int maxConcurrentOrders,
                        long reconcileIntervalMillis) {
        if (maxConcurrentOrders < 1) {
            throw new IllegalArgumentException("maxConcurrentOrders must be >= 1");
        }
        this.venue = venue;
        this.placer = placer;
        this.fundsLedger = fundsLedger;
        this.clock = clock;
        this.events = events;
        this.meterRegistry = meterRegistry;
        this.maxConcurrentOrders = maxConcurrentOrders;
        this.reconcileInterval = Duration.ofMillis(Math.max(0, reconcileIntervalMillis));
        AtomicInteger threadIndex = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(maxConcurrentOrders, r -> {
            Thread t = new Thread(r, "order-io-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public TrackedMarket register(PairedMarket market) {
        return markets.computeIfAbsent(market.key(), k -> new TrackedMarket(market));
    }

    public Optional<TrackedMarket> find(MarketKey key) {
        return Optional.ofNullable(markets.get(key));
    }

    public void removeMarket(MarketKey key) {
        TrackedMarket tm = markets.remove(key);
        if (tm == null) {
            return;
        }
        tm.syncLock().lock();
        try {
            for (Outcome outcome : Outcome.values()) {
                Map<String, TrackedOrder> orders = tm.orders(outcome);
                orders.keySet().forEach(fundsLedger::release);
                orders.clear();
            }
        } finally {
            tm.syncLock().unlock();
        }
    }

    public void track(PairedMarket market, TrackedOrder order) {
        TrackedMarket tm = register(market);
        tm.syncLock().lock();
        try {
            tm.orders(order.outcome()).put(order.orderId(), order);
        } finally {
            tm.syncLock().unlock();
        }
    }

    public List<TrackedOrder> trackedOrders(MarketKey key, Outcome outcome) {
        TrackedMarket tm = markets.get(key);
        return tm == null ? List.of() : tm.snapshot(outcome);
    }

    public boolean hasOpenOrders(MarketKey key, Outcome outcome) {
        TrackedMarket tm = markets.get(key);
        return tm != null && !tm.orders(outcome).isEmpty();
    }

    public boolean hasOpenOrders(MarketKey key) {
        TrackedMarket tm = markets.get(key);
        return tm != null && tm.openOrderCount() > 0;
    }

    /**
     * Reduces a tracked order by a fill and drops it once fully matched.
     */
    public Optional<TrackedOrder> applyFill(MarketKey key, String orderId, BigDecimal filledShares) {
        TrackedMarket tm = markets.get(key);
        if (tm == null || orderId == null) {
            return Optional.empty();
        }
        for (Outcome outcome : Outcome.values()) {
            Map<String, TrackedOrder> orders = tm.orders(outcome);
            TrackedOrder order = orders.get(orderId);
            if (order == null) {
                continue;
            }
            BigDecimal remaining = order.size().subtract(filledShares);
            if (remaining.signum() <= 0) {
                orders.remove(orderId);
                fundsLedger.release(orderId);
            } else {
                orders.put(orderId, order.withSize(remaining));
            }
            return Optional.of(order);
        }
        return Optional.empty();
    }

    /**
     * Converges one side of a market to {@code targets}: cancels tracked orders at prices not targeted, then places
     * the missing levels through the guard against {@code book}.
     */
    public SyncResult syncOrders(PairedMarket market, Outcome outcome, List<Quote> targets, BookSnapshot book) {
        TrackedMarket tm = register(market);
        tm.syncLock().lock();
        try {
            Map<String, TrackedOrder> current = tm.orders(outcome);
            Set<BigDecimal> targetPrices = new HashSet<>();
            for (Quote q : targets) {
                targetPrices.add(q.priceKey());
            }

            List<String> toCancel = current.values().stream()
                    .filter(o -> !targetPrices.contains(o.priceKey()))
                    .map(TrackedOrder::orderId)
                    .toList();
            int cancelled = 0;
            for (String orderId : cancelInParallel(toCancel)) {
                current.remove(orderId);
                fundsLedger.release(orderId);
                cancelled++;
            }

            Set<BigDecimal> restingPrices = new HashSet<>();
            for (TrackedOrder o : current.values()) {
                restingPrices.add(o.priceKey());
            }
            List<Quote> toPlace = new ArrayList<>();
            for (Quote q : targets) {
                if (restingPrices.add(q.priceKey())) {
                    toPlace.add(q);
                }
            }

            int placed = 0;
            int blocked = 0;
            int failed = 0;
            String tokenId = market.tokenFor(outcome);
            for (int i = 0; i < toPlace.size(); i += maxConcurrentOrders) {
                List<Quote> batch = toPlace.subList(i, Math.min(toPlace.size(), i + maxConcurrentOrders));
                List<CompletableFuture<PlacementResult>> futures = batch.stream()
                        .map(q -> CompletableFuture.supplyAsync(() -> placer.place(new PlacementRequest(
                                market.key(), tokenId, OrderSide.BUY, q.price(), q.size(), OrderType.GTC, book, false,
                                QUOTE_INTENT)), pool))
                        .toList();
                for (int j = 0; j < futures.size(); j++) {
                    PlacementResult result = futures.get(j).join();
                    Quote quote = batch.get(j);
                    switch (result.status()) {
                        case SUBMITTED -> {
                            current.put(result.orderId(), new TrackedOrder(result.orderId(), tokenId, outcome,
                                    result.price(), quote.size().subtract(result.filledOrZero()), clock.instant()));
                            placed++;
                        }
                        case BLOCKED -> blocked++;
                        default -> failed++;
                    }
                }
            }

            SyncResult result = new SyncResult(placed, cancelled, blocked, failed);
            if (result.changed() || blocked > 0 || failed > 0) {
                log.debug("ORDERS: synced market={} outcome={} placed={} cancelled={} blocked={} failed={}",
                        market.key(), outcome, placed, cancelled, blocked, failed);
                publish(HftEventTypes.ORDERS_SYNCED, market.key(), new SyncedEvent(
                        market.marketId(), market.asset(), outcome, placed, cancelled, blocked, failed));
            }
            return result;
        } finally {
            tm.syncLock().unlock();
        }
    }

    public int cancelAllOrders(MarketKey key) {
        TrackedMarket tm = markets.get(key);
        if (tm == null) {
            return 0;
        }
        tm.syncLock().lock();
        try {
            int cancelled = 0;
            for (Outcome outcome : Outcome.values()) {
                Map<String, TrackedOrder> orders = tm.orders(outcome);
                for (String orderId : cancelInParallel(List.copyOf(orders.keySet()))) {
                    orders.remove(orderId);
                    fundsLedger.release(orderId);
                    cancelled++;
                }
            }
            if (cancelled > 0) {
                log.info("ORDERS: cancelled {} orders market={}", cancelled, key);
            }
            return cancelled;
        } finally {
            tm.syncLock().unlock();
        }
    }

    /**
     * Cancels every BUY on one outcome, including remote orders the local map does not know about. The local side
     * is cleared afterwards even if some cancels failed; reconciliation re-adopts whatever is still live.
     */
    public int cancelSideOrders(PairedMarket market, Outcome outcome) {
        TrackedMarket tm = register(market);
        String tokenId = market.tokenFor(outcome);
        tm.syncLock().lock();
        try {
            Map<String, TrackedOrder> orders = tm.orders(outcome);
            Set<String> ids = new LinkedHashSet<>(orders.keySet());
            try {
                OpenOrdersResult remote = venue.getOpenOrders();
                if (remote.isError()) {
                    log.warn("ORDERS: cancel side could not list open orders market={} error={}", market.key(), remote.error());
                } else {
                    for (OpenOrder o : remote.orders()) {
                        if (tokenId.equals(o.tokenId()) && o.side() == OrderSide.BUY) {
                            ids.add(o.orderId());
                        }
                    }
                }
            } catch (RuntimeException e) {
                log.warn("ORDERS: cancel side open-orders fetch failed market={} error={}", market.key(), e.toString());
            }

            int cancelled = cancelInParallel(List.copyOf(ids)).size();
            orders.clear();
            ids.forEach(fundsLedger::release);
            if (!ids.isEmpty()) {
                log.info("ORDERS: cancelled {}/{} {} orders market={}", cancelled, ids.size(), outcome, market.key());
            }
            return cancelled;
        } finally {
            tm.syncLock().unlock();
        }
    }

    public boolean needsReconciliation(MarketKey key) {
        TrackedMarket tm = markets.get(key);
        if (tm == null) {
            return false;
        }
        Instant last = tm.lastReconciledAt();
        return last == null || Duration.between(last, clock.instant()).compareTo(reconcileInterval) > 0;
    }

    public void markReconciled(MarketKey key) {
        TrackedMarket tm = markets.get(key);
        if (tm != null) {
            tm.markReconciled(clock.instant());
        }
    }

    /**
     * Makes the local order set of every due market equal the venue's BUY orders for its tokens. Due markets are
     * locked before the single venue listing is taken, so no sync can place an order the listing misses. Busy
     * markets are skipped; a failed listing leaves everything unchanged.
     */
    public ReconcileResult reconcileOrders(Collection<MarketKey> keys) {
        List<TrackedMarket> due = keys.stream()
                .filter(this::needsReconciliation)
                .map(markets::get)
                .filter(Objects::nonNull)
                .toList();
        if (due.isEmpty()) {
            return ReconcileResult.empty();
        }

        List<TrackedMarket> locked = new ArrayList<>();
        int skipped = 0;
        for (TrackedMarket tm : due) {
            if (tm.syncLock().tryLock()) {
                locked.add(tm);
            } else {
                skipped++;
            }
        }
        try {
            if (locked.isEmpty()) {
                return new ReconcileResult(0, 0, 0, skipped, null);
            }
            OpenOrdersResult remote;
            try {
                remote = venue.getOpenOrders();
            } catch (RuntimeException e) {
                remote = OpenOrdersResult.failed(e.toString());
            }
            if (remote.isError()) {
                log.warn("ORDERS: reconciliation failed error={}", remote.error());
                meterRegistry.counter("pairguard.orders.reconcile", "result", "error").increment();
                return ReconcileResult.failed(remote.error());
            }

            Map<String, List<OpenOrder>> buysByToken = new HashMap<>();
            for (OpenOrder o : remote.orders()) {
                if (o.side() == OrderSide.BUY && o.tokenId() != null) {
                    buysByToken.computeIfAbsent(o.tokenId(), t -> new ArrayList<>()).add(o);
                }
            }

            int cleaned = 0;
            int added = 0;
            for (TrackedMarket tm : locked) {
                int marketCleaned = 0;
                int marketAdded = 0;
                for (Outcome outcome : Outcome.values()) {
                    String tokenId = tm.getMarket().tokenFor(outcome);
                    Map<String, OpenOrder> remoteById = new HashMap<>();
                    for (OpenOrder o : buysByToken.getOrDefault(tokenId, List.of())) {
                        remoteById.put(o.orderId(), o);
                    }
                    Map<String, TrackedOrder> local = tm.orders(outcome);
                    for (String orderId : List.copyOf(local.keySet())) {
                        if (!remoteById.containsKey(orderId)) {
                            local.remove(orderId);
                            fundsLedger.release(orderId);
                            marketCleaned++;
                        }
                    }
                    for (OpenOrder o : remoteById.values()) {
                        if (!local.containsKey(o.orderId())) {
                            local.put(o.orderId(), new TrackedOrder(o.orderId(), tokenId, outcome, o.price(),
                                    o.remainingSize(), o.createdAt() == null ? clock.instant() : o.createdAt()));
                            marketAdded++;
                        }
                    }
                }
                tm.markReconciled(clock.instant());
                cleaned += marketCleaned;
                added += marketAdded;
                PairedMarket market = tm.getMarket();
                publish(HftEventTypes.ORDERS_RECONCILED, market.key(),
                        new ReconciledEvent(market.marketId(), market.asset(), marketCleaned, marketAdded));
            }

            ReconcileResult result = new ReconcileResult(cleaned, added, locked.size(), skipped, null);
            meterRegistry.counter("pairguard.orders.reconcile", "result", "ok").increment();
            if (cleaned > 0 || added > 0) {
                meterRegistry.counter("pairguard.orders.reconcile_cleaned").increment(cleaned);
                meterRegistry.counter("pairguard.orders.reconcile_added").increment(added);
                log.info("ORDERS: reconciled markets={} cleaned={} added={} skipped={}",
                        locked.size(), cleaned, added, skipped);
            }
            return result;
        } finally {
            locked.forEach(tm -> tm.syncLock().unlock());
        }
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(2, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    /**
     * @return ids whose cancel the venue confirmed
     */
    private List<String> cancelInParallel(List<String> orderIds) {
        if (orderIds.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<String>> futures = orderIds.stream()
                .map(id -> CompletableFuture.supplyAsync(() -> cancelSafely(id) ? id : null, pool))
                .toList();
        List<String> confirmed = new ArrayList<>();
        for (CompletableFuture<String> f : futures) {
            String id = f.join();
            if (id != null) {
                confirmed.add(id);
            }
        }
        return confirmed;
    }

    private boolean cancelSafely(String orderId) {
        try {
            CancelResult result = venue.cancelOrder(orderId);
            if (result != null && result.success()) {
                return true;
            }
            log.warn("ORDERS: cancel failed orderId={} error={}", orderId, result == null ? "empty response" : result.error());
        } catch (RuntimeException e) {
            log.warn("ORDERS: cancel failed orderId={} error={}", orderId, e.toString());
        }
        return false;
    }

    private void publish(String type, MarketKey key, Object data) {
        try {
            events.publish(type, key.toString(), data);
        } catch (RuntimeException e) {
            log.debug("ORDERS: event publish failed type={}: {}", type, e.toString());
        }
    }

    public record SyncedEvent(
            String marketId,
            String asset,
            Outcome outcome,
            int placed,
            int cancelled,
            int blocked,
            int failed
    ) {}

    public record ReconciledEvent(
            String marketId,
            String asset,
            int cleaned,
            int added
    ) {}
}
