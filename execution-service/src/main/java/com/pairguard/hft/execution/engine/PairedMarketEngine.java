package com.pairguard.hft.execution.engine;

import com.pairguard.hft.domain.OrderSide;
import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.events.HftEventTypes;
import com.pairguard.hft.execution.admission.OrderKind;
import com.pairguard.hft.execution.admission.RateLimitDecision;
import com.pairguard.hft.execution.cadence.CadenceMetrics;
import com.pairguard.hft.execution.config.EngineConfig;
import com.pairguard.hft.execution.guard.BookSnapshot;
import com.pairguard.hft.execution.hedge.HedgeAttemptResult;
import com.pairguard.hft.execution.hedge.HedgeErrorCode;
import com.pairguard.hft.execution.hedge.HedgeRequest;
import com.pairguard.hft.execution.hedge.PositionSnapshot;
import com.pairguard.hft.execution.hedge.RecoveryResult;
import com.pairguard.hft.execution.model.MarketInventory;
import com.pairguard.hft.execution.model.MarketKey;
import com.pairguard.hft.execution.model.PairedMarket;
import com.pairguard.hft.execution.order.OrderManager;
import com.pairguard.hft.execution.order.PlacementRequest;
import com.pairguard.hft.execution.order.PlacementResult;
import com.pairguard.hft.execution.order.Quote;
import com.pairguard.hft.execution.order.SyncResult;
import com.pairguard.hft.execution.order.TrackedOrder;
import com.pairguard.hft.execution.priority.HedgeAction;
import com.pairguard.hft.execution.priority.HedgeDecision;
import com.pairguard.hft.execution.priority.HedgeIntent;
import com.pairguard.hft.execution.priority.HedgePrice;
import com.pairguard.hft.execution.priority.HedgeState;
import com.pairguard.hft.execution.state.BookData;
import com.pairguard.hft.execution.state.MarketStateContext;
import com.pairguard.hft.execution.state.PairingReason;
import com.pairguard.hft.execution.state.PairingState;
import com.pairguard.hft.execution.state.TickResult;
import com.pairguard.hft.venue.OrderType;
import com.pairguard.hft.venue.OrderbookDepth;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scheduled decision loop over the registered up/down markets.
 * <p>
 * The scheduler thread only dispatches: a market is handed to the worker pool when its cadence says it is due
 * and no evaluation of it is in flight, so each market has at most one evaluation running at a time.
 */
@Slf4j
public class PairedMarketEngine {

    private static final Set<HedgeErrorCode> RECOVERABLE_BY_LOSS_MINIMIZER = EnumSet.of(
            HedgeErrorCode.MAX_RETRIES,
            HedgeErrorCode.NO_LIQUIDITY,
            HedgeErrorCode.INSUFFICIENT_FUNDS,
            HedgeErrorCode.PAIR_COST_WORSENING,
            HedgeErrorCode.PRICE_BLOCKED,
            HedgeErrorCode.API_ERROR
    );

    private final ExecutionEngineContext ctx;
    private final EngineConfig config;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "paired-market-engine");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService workers;
    private final ExecutorService bookFetchers;

    private final Map<MarketKey, PairedMarket> markets = new ConcurrentHashMap<>();
    private final Map<String, MarketKey> marketByToken = new ConcurrentHashMap<>();
    private final Map<MarketKey, AtomicBoolean> inFlight = new ConcurrentHashMap<>();
    private final Map<MarketKey, BigDecimal[]> lastMids = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> lastSpotPrice = new ConcurrentHashMap<>();
    private final AtomicBoolean reconcileInFlight = new AtomicBoolean();
    private final AtomicBoolean running = new AtomicBoolean();

    public PairedMarketEngine(@NonNull ExecutionEngineContext ctx) {
        this.ctx = ctx;
        this.config = ctx.getEngineConfig();
        this.workers = Executors.newFixedThreadPool(config.workerThreads(), namedDaemon("engine-worker"));
        this.bookFetchers = Executors.newFixedThreadPool(Math.max(2, config.workerThreads() * 2), namedDaemon("engine-book"));
    }

    @PostConstruct
    public void startIfEnabled() {
        ctx.getProperties().engine().markets().forEach(m -> {
            if (m.marketId() == null || m.asset() == null || m.upTokenId() == null || m.downTokenId() == null
                    || m.endTime() == null) {
                log.warn("ENGINE: skipping incomplete market config {}", m);
                return;
            }
            registerMarket(new PairedMarket(m.marketId(), m.asset(), m.upTokenId(), m.downTokenId(), m.endTime()));
        });

        if (!config.enabled()) {
            log.info("ENGINE: paired-market engine is disabled");
            return;
        }
        long periodMs = Math.max(10, config.tickMillis());
        scheduler.scheduleAtFixedRate(this::safeTick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        running.set(true);
        log.info("ENGINE: started mode={} tickMillis={} workers={} markets={}",
                ctx.getProperties().mode(), periodMs, config.workerThreads(), markets.size());
    }

    @PreDestroy
    public void shutdown() {
        log.info("ENGINE: shutting down");
        running.set(false);
        scheduler.shutdownNow();
        for (MarketKey key : markets.keySet()) {
            try {
                ctx.getOrderManager().cancelAllOrders(key);
            } catch (RuntimeException e) {
                log.warn("ENGINE: cancel on shutdown failed market={} error={}", key, e.toString());
            }
        }
        workers.shutdownNow();
        bookFetchers.shutdownNow();
        ctx.getOrderManager().close();
    }

    public boolean isRunning() {
        return running.get() && !scheduler.isShutdown();
    }

    public int activeMarketCount() {
        return markets.size();
    }

    public List<PairedMarket> markets() {
        return List.copyOf(markets.values());
    }

    public Optional<PairedMarket> market(String marketId) {
        return markets.values().stream().filter(m -> m.marketId().equals(marketId)).findFirst();
    }

    public void registerMarket(PairedMarket market) {
        MarketKey key = market.key();
        if (markets.putIfAbsent(key, market) != null) {
            return;
        }
        marketByToken.put(market.upTokenId(), key);
        marketByToken.put(market.downTokenId(), key);
        inFlight.put(key, new AtomicBoolean());
        ctx.getCadenceController().registerMarket(key);
        ctx.getOrderManager().register(market);
        log.info("ENGINE: registered market={} endTime={}", key, market.endTime());
    }

    public void unregisterMarket(MarketKey key) {
        PairedMarket market = markets.remove(key);
        if (market == null) {
            return;
        }
        marketByToken.remove(market.upTokenId());
        marketByToken.remove(market.downTokenId());
        inFlight.remove(key);
        lastMids.remove(key);
        ctx.getCadenceController().unregisterMarket(key);
        ctx.getOrderManager().removeMarket(key);
        ctx.getMarketStateManager().clearMarket(key);
        ctx.getHedgePriorityLane().clearHedgeState(key);
        ctx.getPriceGuard().clearMarket(key);
        ctx.getLossMinimizer().clearMarket(key);
        ctx.getInventoryTracker().clear(key);
        log.info("ENGINE: unregistered market={}", key);
    }

    /**
     * Underlying spot feed. A changed price counts as a spot move for cadence.
     */
    public void recordSpotPrice(String asset, BigDecimal price) {
        if (asset == null || price == null) {
            return;
        }
        BigDecimal previous = lastSpotPrice.put(asset.toUpperCase(Locale.ROOT), price);
        if (previous == null || previous.compareTo(price) != 0) {
            ctx.getCadenceController().recordSpotMove(asset);
        }
    }

    /**
     * Fill feed. Updates inventory, the tracked order, the reservation and the hedge lifecycle.
     */
    public void onFill(String tokenId, String orderId, BigDecimal shares, BigDecimal price) {
        MarketKey key = marketByToken.get(tokenId);
        if (key == null) {
            log.debug("ENGINE: fill for unknown token={} orderId={}", tokenId, orderId);
            return;
        }
        PairedMarket market = markets.get(key);
        if (market == null) {
            return;
        }
        Outcome outcome = market.outcomeOf(tokenId).orElseThrow();
        MarketInventory inv = ctx.getInventoryTracker().recordFill(key, outcome, shares, price);
        ctx.getOrderManager().applyFill(key, orderId, shares);
        if (orderId != null) {
            ctx.getFundsLedger().onFill(orderId, shares.multiply(price));
        }

        Optional<HedgeState> hedge = ctx.getHedgePriorityLane().getHedgeState(key).filter(h -> !h.isResolved());
        if (hedge.isPresent() && outcome == hedge.get().hedgeSide()) {
            ctx.getHedgePriorityLane().recordHedgeFill(key, shares);
        } else if (hedge.isEmpty() && inv.unpairedShares().signum() > 0) {
            ctx.getHedgePriorityLane().startHedgeTracking(key, inv.leadingOutcome(), inv.unpairedShares());
        }
    }

    public EngineStatus status() {
        return new EngineStatus(
                ctx.getProperties().mode().name(),
                config.enabled(),
                isRunning(),
                markets.size(),
                ctx.getHedgePriorityLane().activeHedgeCount(),
                ctx.getCadenceController().getStats(),
                ctx.getFundsLedger().totalReserved(),
                ctx.getRateLimiter().status(),
                ctx.getHedgeEscalator().stats()
        );
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            log.error("ENGINE: tick failed, continuing scheduler loop", e);
        }
    }

    void tick() {
        for (PairedMarket market : markets.values()) {
            MarketKey key = market.key();
            AtomicBoolean flag = inFlight.get(key);
            if (flag == null || !ctx.getCadenceController().shouldEvaluate(key) || !flag.compareAndSet(false, true)) {
                continue;
            }
            ctx.getCadenceController().markEvaluated(key);
            try {
                workers.execute(() -> {
                    try {
                        evaluateMarket(market);
                    } catch (Exception e) {
                        log.error("ENGINE: evaluation failed market={}: {}", key, e.toString(), e);
                    } finally {
                        flag.set(false);
                    }
                });
            } catch (RuntimeException e) {
                flag.set(false);
                throw e;
            }
        }

        if (reconcileInFlight.compareAndSet(false, true)) {
            try {
                workers.execute(() -> {
                    try {
                        ctx.getOrderManager().reconcileOrders(markets.keySet());
                    } catch (Exception e) {
                        log.warn("ENGINE: reconciliation failed: {}", e.toString());
                    } finally {
                        reconcileInFlight.set(false);
                    }
                });
            } catch (RuntimeException e) {
                reconcileInFlight.set(false);
                throw e;
            }
        }
    }

    public void evaluateMarket(PairedMarket market) {
        MarketKey key = market.key();
        Instant now = ctx.getClock().instant();
        long secondsRemaining = market.secondsRemaining(now);
        if (secondsRemaining <= 0) {
            ctx.getHedgePriorityLane().markHedgeExpired(key);
            ctx.getOrderManager().cancelAllOrders(key);
            unregisterMarket(key);
            return;
        }

        CompletableFuture<OrderbookDepth> upFuture = CompletableFuture.supplyAsync(
                () -> ctx.getVenue().getOrderbookDepth(market.upTokenId()), bookFetchers);
        CompletableFuture<OrderbookDepth> downFuture = CompletableFuture.supplyAsync(
                () -> ctx.getVenue().getOrderbookDepth(market.downTokenId()), bookFetchers);
        OrderbookDepth upDepth = upFuture.join();
        OrderbookDepth downDepth = downFuture.join();
        Instant fetchedAt = ctx.getClock().instant();
        BookSnapshot upBook = BookSnapshot.from(upDepth == null ? OrderbookDepth.empty() : upDepth, fetchedAt);
        BookSnapshot downBook = BookSnapshot.from(downDepth == null ? OrderbookDepth.empty() : downDepth, fetchedAt);

        if (!upBook.isTwoSided() || !downBook.isTwoSided()) {
            log.debug("ENGINE: one-sided book market={} up={}/{} down={}/{}", key,
                    upBook.bestBid(), upBook.bestAsk(), downBook.bestBid(), downBook.bestAsk());
            return;
        }
        if (!ctx.getPriceGuard().checkBookFreshness(upBook).fresh() || !ctx.getPriceGuard().checkBookFreshness(downBook).fresh()) {
            log.debug("ENGINE: stale books market={}", key);
            return;
        }

        updateCadence(key, upBook, downBook);

        MarketInventory inv = ctx.getInventoryTracker().get(key);
        BookData bookData = new BookData(upBook.bestAsk(), downBook.bestAsk());
        TickResult tick = ctx.getMarketStateManager().processTick(key, inv.upShares(), inv.downShares(),
                secondsRemaining, upBook.mid(), bookData);

        if (tick.shouldCancelUnfilledHedges()) {
            Outcome hedgeSide = ctx.getHedgePriorityLane().getHedgeState(key)
                    .map(HedgeState::hedgeSide)
                    .orElse(inv.leadingOutcome().opposite());
            int cancelled = ctx.getOrderManager().cancelSideOrders(market, hedgeSide);
            log.info("ENGINE: pairing timeout market={} cancelled {} {} orders", key, cancelled, hedgeSide);
        }

        PairingState state = tick.state();
        if (state == PairingState.UNWIND_ONLY && hasQuotes(key)) {
            ctx.getOrderManager().cancelAllOrders(key);
        }

        handleHedge(market, inv, upBook, downBook, secondsRemaining, state, bookData);

        if (config.quotingEnabled() && (state == PairingState.FLAT || state == PairingState.PAIRED)) {
            maybeQuote(market, inv, upBook, downBook);
        }

        if (ctx.getCadenceController().shouldLogFullSnapshot(key)) {
            logSnapshot(market, inv, upBook, downBook, secondsRemaining, state);
            ctx.getCadenceController().markFullSnapshot(key);
        }
    }

    private void updateCadence(MarketKey key, BookSnapshot upBook, BookSnapshot downBook) {
        BigDecimal[] mids = {upBook.mid(), downBook.mid()};
        BigDecimal[] previous = lastMids.put(key, mids);
        if (previous == null || previous[0].compareTo(mids[0]) != 0 || previous[1].compareTo(mids[1]) != 0) {
            ctx.getCadenceController().recordPolyMove(key);
        }
        double combinedAsk = upBook.bestAsk().add(downBook.bestAsk()).doubleValue();
        double mispricing = Math.max(0.0, 1.0 - combinedAsk);
        double thinnerAsk = upBook.askDepth().min(downBook.askDepth()).doubleValue();
        double fullDepth = config.sharesPerLevel().multiply(BigDecimal.valueOf(config.quoteLevels())).doubleValue();
        double stateScore = ctx.getCadenceController().stateScore(mispricing, thinnerAsk, fullDepth);
        CadenceMetrics metrics = ctx.getCadenceController().buildMetrics(key, mispricing, stateScore,
                upBook.spread().doubleValue(), downBook.spread().doubleValue());
        ctx.getCadenceController().updateState(key, metrics);
    }

    private void handleHedge(PairedMarket market,
                             MarketInventory inv,
                             BookSnapshot upBook,
                             BookSnapshot downBook,
                             long secondsRemaining,
                             PairingState state,
                             BookData bookData) {
        MarketKey key = market.key();
        Optional<HedgeState> tracked = ctx.getHedgePriorityLane().getHedgeState(key).filter(h -> !h.isResolved());
        if (tracked.isEmpty()) {
            return;
        }
        HedgeState hedge = tracked.get();
        Outcome hedgeSide = hedge.hedgeSide();
        BookSnapshot hedgeBook = hedgeSide == Outcome.UP ? upBook : downBook;
        boolean hasOpenHedgeOrder = ctx.getOrderManager().hasOpenOrders(key, hedgeSide);

        HedgeDecision decision = ctx.getHedgePriorityLane().getHedgeDecision(key, secondsRemaining, hasOpenHedgeOrder);
        if (!decision.shouldAct()) {
            return;
        }
        if (state.isOneSided()) {
            ctx.getMarketStateManager().beginPairing(key, PairingReason.HEDGE_CHUNK, bookData);
        }
        if (decision.action() == HedgeAction.REPRICE_HEDGE || decision.action() == HedgeAction.EMERGENCY_EXIT) {
            ctx.getOrderManager().cancelSideOrders(market, hedgeSide);
        }

        BigDecimal remaining = hedge.remainingQty().setScale(0, RoundingMode.FLOOR);
        if (remaining.signum() <= 0) {
            return;
        }

        if (decision.action() == HedgeAction.EMERGENCY_EXIT) {
            emergencyExit(market, inv, hedgeSide, hedgeBook, remaining, upBook, downBook);
            return;
        }

        HedgePrice price = ctx.getHedgePriorityLane().calculateHedgePrice(decision.intent(), hedgeBook);
        BigDecimal avgLeadingCost = inv.avgCost(hedgeSide.opposite());
        if (decision.intent() == HedgeIntent.HEDGE && avgLeadingCost != null) {
            MarketStateContext stateCtx = ctx.getMarketStateManager().getContext(key);
            BigDecimal pairCostCents = avgLeadingCost.add(price.price()).multiply(BigDecimal.valueOf(100));
            if (!ctx.getMarketStateManager().isHedgePriceAllowed(key.asset(), stateCtx, pairCostCents)) {
                return;
            }
        }

        BigDecimal chunk = ctx.getMarketStateManager().calculateBoundedHedgeChunk(remaining).boundedChunk().min(remaining);
        HedgeAttemptResult result = ctx.getHedgeEscalator().execute(new HedgeRequest(
                key, market.tokenFor(hedgeSide), hedgeSide, chunk, price.price(), avgLeadingCost, secondsRemaining,
                decision.intent()));

        if (result.ok()) {
            BigDecimal resting = result.finalShares().subtract(result.filledShares() == null ? BigDecimal.ZERO : result.filledShares());
            if (resting.signum() > 0) {
                ctx.getOrderManager().track(market, new TrackedOrder(result.orderId(), market.tokenFor(hedgeSide),
                        hedgeSide, result.finalPrice(), resting, ctx.getClock().instant()));
            }
            return;
        }
        if (RECOVERABLE_BY_LOSS_MINIMIZER.contains(result.errorCode())) {
            recover(market, inv, upBook, downBook);
        }
    }

    private void emergencyExit(PairedMarket market,
                               MarketInventory inv,
                               Outcome hedgeSide,
                               BookSnapshot hedgeBook,
                               BigDecimal qty,
                               BookSnapshot upBook,
                               BookSnapshot downBook) {
        MarketKey key = market.key();
        HedgePrice price = ctx.getHedgePriorityLane().calculateHedgePrice(HedgeIntent.EMERGENCY_EXIT, hedgeBook);
        PlacementResult placement = ctx.getOrderPlacer().place(new PlacementRequest(
                key, market.tokenFor(hedgeSide), OrderSide.BUY, price.price(), qty, OrderType.GTC, hedgeBook,
                price.emergencyMode(), HedgeIntent.EMERGENCY_EXIT.name()));
        if (placement.isSubmitted()) {
            ctx.getRateLimiter().recordEvent(key.marketId(), OrderKind.ORDER);
            BigDecimal resting = qty.subtract(placement.filledOrZero());
            if (resting.signum() > 0) {
                ctx.getOrderManager().track(market, new TrackedOrder(placement.orderId(), market.tokenFor(hedgeSide),
                        hedgeSide, placement.price(), resting, ctx.getClock().instant()));
            }
            ctx.getHedgePriorityLane().recordEmergencyExit(key);
            return;
        }
        log.warn("HEDGE: emergency exit not placed market={} status={} reason={}",
                key, placement.status(), placement.message());
        recover(market, inv, upBook, downBook);
    }

    private void recover(PairedMarket market, MarketInventory inv, BookSnapshot upBook, BookSnapshot downBook) {
        RecoveryResult recovery = ctx.getLossMinimizer().maybeRecover(new PositionSnapshot(market, inv, upBook, downBook));
        if (recovery.success()) {
            ctx.getHedgePriorityLane().recordEmergencyExit(market.key());
        }
    }

    private void maybeQuote(PairedMarket market, MarketInventory inv, BookSnapshot upBook, BookSnapshot downBook) {
        MarketKey key = market.key();
        List<Quote> upQuotes = ctx.getQuoteLadder().build(upBook);
        List<Quote> downQuotes = ctx.getQuoteLadder().build(downBook);
        BigDecimal upTop = ctx.getQuoteLadder().topPrice(upQuotes);
        BigDecimal downTop = ctx.getQuoteLadder().topPrice(downQuotes);

        if (upTop == null || downTop == null
                || upTop.add(downTop).compareTo(ctx.getAdmissionGate().maxPairCost()) > 0) {
            if (hasQuotes(key)) {
                ctx.getOrderManager().cancelAllOrders(key);
            }
            return;
        }

        syncSide(market, inv, Outcome.UP, upQuotes, upBook, upTop);
        syncSide(market, inv, Outcome.DOWN, downQuotes, downBook, downTop);
    }

    private void syncSide(PairedMarket market, MarketInventory inv, Outcome outcome, List<Quote> quotes,
                          BookSnapshot book, BigDecimal topPrice) {
        MarketKey key = market.key();
        BigDecimal otherAvg = inv.avgCost(outcome.opposite());
        BigDecimal projectedPairCost = otherAvg == null ? null : otherAvg.add(topPrice);
        RateLimitDecision admission = ctx.getAdmissionGate().admit(key.marketId(), OrderKind.REPLACE,
                OrderManager.QUOTE_INTENT, projectedPairCost);
        if (!admission.allowed()) {
            log.debug("ENGINE: quote sync skipped market={} outcome={} reason={}", key, outcome, admission.reason());
            return;
        }
        SyncResult sync = ctx.getOrderManager().syncOrders(market, outcome, quotes, book);
        for (int i = 0; i < sync.placed(); i++) {
            ctx.getRateLimiter().recordEvent(key.marketId(), OrderKind.ORDER);
        }
        for (int i = 0; i < sync.cancelled(); i++) {
            ctx.getRateLimiter().recordEvent(key.marketId(), OrderKind.CANCEL);
        }
        for (int i = 0; i < sync.failed(); i++) {
            ctx.getRateLimiter().recordFailure(key.marketId());
        }
    }

    private boolean hasQuotes(MarketKey key) {
        return ctx.getOrderManager().hasOpenOrders(key);
    }

    private void logSnapshot(PairedMarket market,
                             MarketInventory inv,
                             BookSnapshot upBook,
                             BookSnapshot downBook,
                             long secondsRemaining,
                             PairingState state) {
        MarketKey key = market.key();
        EngineSnapshot snapshot = new EngineSnapshot(key.marketId(), key.asset(), state,
                ctx.getCadenceController().getLevel(key).name(), secondsRemaining, inv.upShares(), inv.downShares(),
                inv.totalCost(), upBook.bestBid(), upBook.bestAsk(), downBook.bestBid(), downBook.bestAsk(),
                ctx.getOrderManager().trackedOrders(key, Outcome.UP).size(),
                ctx.getOrderManager().trackedOrders(key, Outcome.DOWN).size());
        log.info("ENGINE: snapshot {}", snapshot);
        try {
            ctx.getEvents().publish(HftEventTypes.ENGINE_SNAPSHOT, key.toString(), snapshot);
        } catch (RuntimeException e) {
            log.debug("ENGINE: event publish failed: {}", e.toString());
        }
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger index = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + index.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public record EngineSnapshot(
            String marketId,
            String asset,
            PairingState state,
            String cadence,
            long secondsRemaining,
            BigDecimal upShares,
            BigDecimal downShares,
            BigDecimal totalCost,
            BigDecimal upBid,
            BigDecimal upAsk,
            BigDecimal downBid,
            BigDecimal downAsk,
            int upOrders,
            int downOrders
    ) {}
}
