package com.pairguard.hft.execution.hedge;

import com.pairguard.hft.domain.OrderSide;
import com.pairguard.hft.events.HftEventPublisher;
import com.pairguard.hft.events.HftEventTypes;
import com.pairguard.hft.execution.admission.FundsCheck;
import com.pairguard.hft.execution.admission.FundsLedger;
import com.pairguard.hft.execution.admission.OrderKind;
import com.pairguard.hft.execution.admission.OrderRateLimiter;
import com.pairguard.hft.execution.admission.RateLimitDecision;
import com.pairguard.hft.execution.config.HedgeEscalatorConfig;
import com.pairguard.hft.execution.guard.BlockReason;
import com.pairguard.hft.execution.guard.BookSnapshot;
import com.pairguard.hft.execution.order.GuardedOrderPlacer;
import com.pairguard.hft.execution.order.PlacementRequest;
import com.pairguard.hft.execution.order.PlacementResult;
import com.pairguard.hft.venue.OrderType;
import com.pairguard.hft.venue.OrderbookDepth;
import com.pairguard.hft.venue.VenueClient;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Completes a hedge BUY under time pressure with a bounded number of steps.
 * <p>
 * Across steps the price never decreases and the size never increases. Every step either places, shrinks,
 * escalates or terminates, so a run ends after at most {@code maxRetries} steps.
 */
@Slf4j
public class HedgeEscalator {

    private final HedgeEscalatorConfig config;
    private final OrderRateLimiter rateLimiter;
    private final FundsLedger fundsLedger;
    private final GuardedOrderPlacer placer;
    private final VenueClient venue;
    private final Clock clock;
    private final Sleeper sleeper;
    private final HftEventPublisher events;
    private final MeterRegistry meterRegistry;
    private final HedgeEventLog eventLog;

    public HedgeEscalator(@NonNull HedgeEscalatorConfig config,
                          @NonNull OrderRateLimiter rateLimiter,
                          @NonNull FundsLedger fundsLedger,
                          @NonNull GuardedOrderPlacer placer,
                          @NonNull VenueClient venue,
                          @NonNull Clock clock,
                          @NonNull Sleeper sleeper,
                          @NonNull HftEventPublisher events,
                          @NonNull MeterRegistry meterRegistry) {
        if (config.maxRetries() < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1");
        }
        this.config = config;
        this.rateLimiter = rateLimiter;
        this.fundsLedger = fundsLedger;
        this.placer = placer;
        this.venue = venue;
        this.clock = clock;
        this.sleeper = sleeper;
        this.events = events;
        this.meterRegistry = meterRegistry;
        this.eventLog = new HedgeEventLog(config.eventBufferSize());
    }

    public HedgeMode modeFor(long secondsRemaining) {
        if (secondsRemaining < config.survivalModeThresholdSeconds()) return HedgeMode.SURVIVAL;
        if (secondsRemaining < config.panicModeThresholdSeconds()) return HedgeMode.PANIC;
        return HedgeMode.NORMAL;
    }

    public BigDecimal maxPriceFor(HedgeMode mode) {
        return mode == HedgeMode.SURVIVAL ? config.survivalMaxPrice() : config.maxHedgePrice();
    }

    public HedgeAttemptResult execute(@NonNull HedgeRequest request) {
        HedgeMode mode = modeFor(request.secondsRemaining());
        BigDecimal maxPrice = maxPriceFor(mode);
        Run run = new Run(request, mode, request.initialPrice().min(maxPrice), request.shares());

        log.info("HEDGE: escalation start market={} side={} shares={} price={} mode={} secsLeft={} intent={}",
                request.market(), request.hedgeSide(), run.shares, run.price, mode, request.secondsRemaining(), request.intent());

        try {
            for (int step = 1; step <= config.maxRetries(); step++) {
                run.step = step;
                boolean lastStep = step == config.maxRetries();
                record(run, HedgeEvent.Type.HEDGE_ATTEMPT, null, null);

                if (mode != HedgeMode.SURVIVAL && pairCostWorsening(request, run.price)) {
                    return abort(run, HedgeErrorCode.PAIR_COST_WORSENING, "avgOtherSideCost %s + price %s > 1 + %s"
                            .formatted(request.avgOtherSideCost(), run.price, config.allowOverpay()));
                }

                RateLimitDecision admission = rateLimiter.checkAllowed(request.market().marketId(), OrderKind.ORDER);
                if (!admission.allowed()) {
                    if (mode == HedgeMode.SURVIVAL && admission.waitMillis() <= config.survivalMaxRateLimitWaitMillis()) {
                        record(run, HedgeEvent.Type.HEDGE_ESCALATE_STEP, HedgeErrorCode.RATE_LIMITED,
                                "waiting %dms: %s".formatted(admission.waitMillis(), admission.reason()));
                        sleeper.sleep(admission.waitMillis());
                        continue;
                    }
                    return abort(run, HedgeErrorCode.RATE_LIMITED, admission.reason());
                }

                BigDecimal notional = run.shares.multiply(run.price);
                FundsCheck funds = fundsLedger.canPlaceOrder(request.market().marketId(), request.hedgeSide(), notional);
                if (!funds.canProceed()) {
                    HedgeAttemptResult terminal = shrinkForFunds(run, lastStep, funds.reason());
                    if (terminal != null) {
                        return terminal;
                    }
                    continue;
                }

                BookSnapshot book = fetchBook(request.tokenId());
                BigDecimal required = run.shares.multiply(BigDecimal.valueOf(config.minDepthCoverage()));
                if (book.askDepth().compareTo(required) < 0) {
                    BigDecimal shrunk = floor(book.askDepth().multiply(BigDecimal.valueOf(config.depthShrinkFactor())));
                    if (mode == HedgeMode.NORMAL
                            || book.askDepth().compareTo(config.minSharesForRetry()) < 0
                            || shrunk.compareTo(config.minSharesForRetry()) < 0) {
                        return abort(run, HedgeErrorCode.NO_LIQUIDITY, "askDepth %s < required %s"
                                .formatted(book.askDepth(), required));
                    }
                    record(run, HedgeEvent.Type.HEDGE_ESCALATE_STEP, HedgeErrorCode.NO_LIQUIDITY,
                            "shrinking to depth %s -> %s".formatted(book.askDepth(), shrunk));
                    run.shares = shrunk.min(run.shares);
                    notional = run.shares.multiply(run.price);
                }

                String tempId = "hedge-tmp-" + UUID.randomUUID();
                if (!fundsLedger.reserve(tempId, request.market().marketId(), notional, request.hedgeSide())) {
                    HedgeAttemptResult terminal = shrinkForFunds(run, lastStep, "reservation refused");
                    if (terminal != null) {
                        return terminal;
                    }
                    continue;
                }

                PlacementResult placement = placer.place(new PlacementRequest(
                        request.market(), request.tokenId(), OrderSide.BUY, run.price, run.shares, OrderType.GTC,
                        book, false, request.intent().name()));
                if (placement.status() != PlacementResult.Status.BLOCKED) {
                    rateLimiter.recordEvent(request.market().marketId(), OrderKind.ORDER);
                }

                switch (placement.status()) {
                    case SUBMITTED -> {
                        return succeed(run, tempId, placement);
                    }
                    case ERROR -> {
                        fundsLedger.release(tempId);
                        rateLimiter.recordFailure(request.market().marketId());
                        run.lastError = HedgeErrorCode.API_ERROR;
                        record(run, HedgeEvent.Type.HEDGE_FAILED, HedgeErrorCode.API_ERROR, placement.message());
                        if (!lastStep) {
                            sleeper.sleep(config.retryDelayMillis());
                        }
                    }
                    case BLOCKED -> {
                        fundsLedger.release(tempId);
                        if (placement.blockReason() == null) {
                            return abort(run, HedgeErrorCode.PRICE_BLOCKED, placement.message());
                        }
                        run.lastError = HedgeErrorCode.PRICE_BLOCKED;
                        record(run, HedgeEvent.Type.HEDGE_FAILED, HedgeErrorCode.PRICE_BLOCKED,
                                placement.blockReason() + ": " + placement.message());
                        // raising a crossing price only crosses further
                        boolean holdPrice = placement.blockReason() == BlockReason.CROSSING_BLOCKED;
                        HedgeAttemptResult terminal = escalate(run, maxPrice, lastStep, holdPrice);
                        if (terminal != null) {
                            return terminal;
                        }
                    }
                    case REJECTED -> {
                        fundsLedger.release(tempId);
                        rateLimiter.recordFailure(request.market().marketId());
                        run.lastError = HedgeErrorCode.API_ERROR;
                        record(run, HedgeEvent.Type.HEDGE_FAILED, HedgeErrorCode.API_ERROR, placement.message());
                        HedgeAttemptResult terminal = escalate(run, maxPrice, lastStep, false);
                        if (terminal != null) {
                            return terminal;
                        }
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return abort(run, HedgeErrorCode.ABORTED, "interrupted");
        }

        return abort(run, HedgeErrorCode.MAX_RETRIES, "exhausted %d steps, last error %s"
                .formatted(config.maxRetries(), run.lastError));
    }

    public HedgeEventLog.Stats stats() {
        return eventLog.stats();
    }

    public List<HedgeEvent> recentEvents(int limit) {
        return eventLog.recent(limit);
    }

    private boolean pairCostWorsening(HedgeRequest request, BigDecimal price) {
        BigDecimal other = request.avgOtherSideCost();
        if (other == null || other.signum() <= 0) {
            return false;
        }
        return other.add(price).compareTo(BigDecimal.ONE.add(config.allowOverpay())) > 0;
    }

    /**
     * Venue failures while reading the book are treated as an empty book, which fails the depth check.
     */
    private BookSnapshot fetchBook(String tokenId) {
        OrderbookDepth depth;
        try {
            depth = venue.getOrderbookDepth(tokenId);
        } catch (RuntimeException e) {
            log.warn("HEDGE: depth fetch failed token={} error={}", tokenId, e.toString());
            depth = null;
        }
        return BookSnapshot.from(depth == null ? OrderbookDepth.empty() : depth, clock.instant());
    }

    private HedgeAttemptResult shrinkForFunds(Run run, boolean lastStep, String reason) {
        run.lastError = HedgeErrorCode.INSUFFICIENT_FUNDS;
        if (lastStep) {
            return abort(run, HedgeErrorCode.INSUFFICIENT_FUNDS, reason);
        }
        BigDecimal reduced = floor(run.shares.multiply(BigDecimal.valueOf(config.sizeReductionFactor())));
        if (reduced.compareTo(config.minSharesForRetry()) < 0) {
            return abort(run, HedgeErrorCode.INSUFFICIENT_FUNDS, "%s; reduced size %s below minimum %s"
                    .formatted(reason, reduced, config.minSharesForRetry()));
        }
        record(run, HedgeEvent.Type.HEDGE_ESCALATE_STEP, HedgeErrorCode.INSUFFICIENT_FUNDS,
                "funds: %s, shares %s -> %s".formatted(reason, run.shares, reduced));
        run.shares = reduced;
        return null;
    }

    private HedgeAttemptResult escalate(Run run, BigDecimal maxPrice, boolean lastStep, boolean holdPrice)
            throws InterruptedException {
        if (lastStep) {
            return null;
        }
        if (!holdPrice) {
            run.price = run.price.add(config.priceIncrement()).min(maxPrice);
        }
        if (run.mode != HedgeMode.SURVIVAL) {
            run.shares = floor(run.shares.multiply(BigDecimal.valueOf(config.sizeReductionFactor())));
            if (run.shares.compareTo(config.minSharesForRetry()) < 0) {
                return abort(run, HedgeErrorCode.MAX_RETRIES, "size %s below minimum %s"
                        .formatted(run.shares, config.minSharesForRetry()));
            }
        }
        record(run, HedgeEvent.Type.HEDGE_ESCALATE_STEP, run.lastError,
                "next price %s shares %s".formatted(run.price, run.shares));
        sleeper.sleep(config.retryDelayMillis());
        return null;
    }

    private HedgeAttemptResult succeed(Run run, String tempId, PlacementResult placement) {
        HedgeRequest request = run.request;
        fundsLedger.release(tempId);
        BigDecimal filled = placement.filledOrZero();
        BigDecimal remaining = run.shares.subtract(filled);
        BigDecimal price = placement.price() == null ? run.price : placement.price();
        if (remaining.signum() > 0 && placement.orderId() != null) {
            boolean reserved = fundsLedger.reserve(placement.orderId(), request.market().marketId(),
                    remaining.multiply(price), request.hedgeSide());
            if (!reserved) {
                log.warn("FUNDS: could not re-reserve remainder orderId={} remaining={} price={}",
                        placement.orderId(), remaining, price);
            }
        }
        fundsLedger.invalidateBalanceCache();

        record(run, HedgeEvent.Type.HEDGE_SUCCESS, null, "orderId=" + placement.orderId());
        meterRegistry.counter("pairguard.hedge.result", "outcome", "SUCCESS", "mode", run.mode.name()).increment();
        log.info("HEDGE: placed market={} orderId={} price={} shares={} filled={} steps={} mode={}",
                request.market(), placement.orderId(), price, run.shares, filled, run.step, run.mode);
        return HedgeAttemptResult.success(placement.orderId(), filled, placement.avgPrice(), price, run.shares, run.step);
    }

    private HedgeAttemptResult abort(Run run, HedgeErrorCode code, String message) {
        record(run, HedgeEvent.Type.HEDGE_ABORTED, code, message);
        meterRegistry.counter("pairguard.hedge.result", "outcome", code.name(), "mode", run.mode.name()).increment();
        log.warn("HEDGE: aborted market={} code={} steps={} price={} shares={} mode={} reason={}",
                run.request.market(), code, run.step, run.price, run.shares, run.mode, message);
        return HedgeAttemptResult.failure(code, message, run.price, run.shares, run.step);
    }

    private void record(Run run, HedgeEvent.Type type, HedgeErrorCode code, String message) {
        HedgeEvent event = new HedgeEvent(type, clock.instant(), run.request.market().marketId(),
                run.request.market().asset(), run.step, run.price, run.shares, run.mode, code, message);
        eventLog.append(event);
        try {
            events.publish(HftEventTypes.HEDGE_ESCALATOR_EVENT, run.request.market().toString(), event);
        } catch (RuntimeException e) {
            log.debug("HEDGE: event publish failed: {}", e.toString());
        }
    }

    private static BigDecimal floor(BigDecimal v) {
        return v.setScale(0, RoundingMode.FLOOR);
    }

    private static final class Run {
        final HedgeRequest request;
        final HedgeMode mode;
        BigDecimal price;
        BigDecimal shares;
        int step;
        HedgeErrorCode lastError;

        Run(HedgeRequest request, HedgeMode mode, BigDecimal price, BigDecimal shares) {
            this.request = request;
            this.mode = mode;
            this.price = price;
            this.shares = shares;
        }
    }
}
