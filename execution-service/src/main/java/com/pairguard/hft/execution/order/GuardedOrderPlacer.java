package com.pairguard.hft.execution.order;

import com.pairguard.hft.config.HftProperties;
import com.pairguard.hft.execution.guard.BookFreshness;
import com.pairguard.hft.execution.guard.PriceCheckResult;
import com.pairguard.hft.execution.guard.PriceGuard;
import com.pairguard.hft.venue.PlaceOrderRequest;
import com.pairguard.hft.venue.PlaceOrderResult;
import com.pairguard.hft.venue.VenueClient;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * The only path from the engine to {@link VenueClient#placeOrder}: risk limits, book freshness and the price guard
 * run before every submission, and transport exceptions come back as {@code ERROR} results.
 */
@Slf4j
public class GuardedOrderPlacer {

    private final VenueClient venue;
    private final PriceGuard priceGuard;
    private final HftProperties.Risk risk;
    private final MeterRegistry meterRegistry;

    public GuardedOrderPlacer(@NonNull VenueClient venue,
                              @NonNull PriceGuard priceGuard,
                              @NonNull HftProperties.Risk risk,
                              @NonNull MeterRegistry meterRegistry) {
        this.venue = venue;
        this.priceGuard = priceGuard;
        this.risk = risk;
        this.meterRegistry = meterRegistry;
    }

    public PlacementResult place(PlacementRequest request) {
        if (risk.killSwitch()) {
            return PlacementResult.riskBlocked("kill switch engaged");
        }
        if (request.size().signum() <= 0) {
            return PlacementResult.riskBlocked("size must be positive: " + request.size());
        }
        if (isPositive(risk.maxOrderSize()) && request.size().compareTo(risk.maxOrderSize()) > 0) {
            return PlacementResult.riskBlocked("size %s exceeds maxOrderSize %s".formatted(request.size(), risk.maxOrderSize()));
        }

        BookFreshness freshness = priceGuard.checkBookFreshness(request.book());
        if (!freshness.fresh()) {
            return PlacementResult.blocked(freshness.reason(), "book age %dms".formatted(freshness.ageMillis()));
        }

        PriceCheckResult check = priceGuard.checkPrice(request.side(), request.price(), request.book(),
                request.emergencyMode(), request.market(), request.intent());
        if (check.isBlocked()) {
            return PlacementResult.blocked(check.reason(), check.message());
        }

        BigDecimal price = check.safePrice();
        if (isPositive(risk.maxOrderNotionalUsd())
                && price.multiply(request.size()).compareTo(risk.maxOrderNotionalUsd()) > 0) {
            return PlacementResult.riskBlocked("notional %s exceeds maxOrderNotionalUsd %s".formatted(
                    price.multiply(request.size()), risk.maxOrderNotionalUsd()));
        }

        PlaceOrderResult result;
        try {
            result = venue.placeOrder(new PlaceOrderRequest(request.tokenId(), request.side(), price, request.size(), request.orderType()));
        } catch (RuntimeException e) {
            log.warn("ORDER: place failed market={} token={} side={} price={} size={} error={}",
                    request.market(), request.tokenId(), request.side(), price, request.size(), e.toString());
            meterRegistry.counter("pairguard.orders.placed", "status", "error").increment();
            return PlacementResult.error(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        if (result == null || !result.success()) {
            String error = result == null ? "empty venue response" : result.error();
            log.debug("ORDER: rejected market={} token={} price={} size={} error={}",
                    request.market(), request.tokenId(), price, request.size(), error);
            meterRegistry.counter("pairguard.orders.placed", "status", "rejected").increment();
            return PlacementResult.rejected(error);
        }

        meterRegistry.counter("pairguard.orders.placed", "status", "submitted").increment();
        log.debug("ORDER: placed market={} token={} side={} price={} size={} orderId={} intent={}",
                request.market(), request.tokenId(), request.side(), price, request.size(), result.orderId(), request.intent());
        return PlacementResult.submitted(result.orderId(), price, result.filledSize(), result.avgPrice(), check.ticksFromEdge());
    }

    private static boolean isPositive(BigDecimal v) {
        return v != null && v.signum() > 0;
    }
}
