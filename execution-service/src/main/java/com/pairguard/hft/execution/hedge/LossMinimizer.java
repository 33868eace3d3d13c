package com.pairguard.hft.execution.hedge;

import com.pairguard.hft.domain.OrderSide;
import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.events.HftEventPublisher;
import com.pairguard.hft.events.HftEventTypes;
import com.pairguard.hft.execution.config.RecoveryConfig;
import com.pairguard.hft.execution.model.MarketInventory;
import com.pairguard.hft.execution.model.MarketKey;
import com.pairguard.hft.execution.order.GuardedOrderPlacer;
import com.pairguard.hft.execution.order.PlacementRequest;
import com.pairguard.hft.execution.order.PlacementResult;
import com.pairguard.hft.execution.priority.HedgeIntent;
import com.pairguard.hft.venue.OrderType;
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
 * Last resort after a failed hedge: buy the trailing side at the ask to lock in a smaller, known loss instead
 * of carrying the unpaired worst case into expiry.
 */
@Slf4j
public class LossMinimizer {

    private static final BigDecimal FALLBACK_PRICE = new BigDecimal("0.50");

    private final RecoveryConfig config;
    private final GuardedOrderPlacer placer;
    private final Clock clock;
    private final HftEventPublisher events;

    private final Map<MarketKey, Instant> lastAttemptAt = new ConcurrentHashMap<>();

    public LossMinimizer(@NonNull RecoveryConfig config,
                         @NonNull GuardedOrderPlacer placer,
                         @NonNull Clock clock,
                         @NonNull HftEventPublisher events) {
        this.config = config;
        this.placer = placer;
        this.clock = clock;
        this.events = events;
    }

    public RecoveryAnalysis analyze(PositionSnapshot position) {
        MarketInventory inv = position.inventory();
        BigDecimal up = inv.upShares();
        BigDecimal down = inv.downShares();
        BigDecimal totalCost = inv.totalCost();
        BigDecimal unpaired = inv.unpairedShares();
        Outcome leading = inv.leadingOutcome();
        Outcome trailing = leading.opposite();

        BigDecimal leadingPrice = valuation(position, leading);
        BigDecimal trailingPrice = valuation(position, trailing);

        BigDecimal pnlUp = up.subtract(totalCost);
        BigDecimal pnlDown = down.subtract(totalCost);
        BigDecimal maxLoss = pnlUp.min(pnlDown);
        BigDecimal maxGain = pnlUp.max(pnlDown);

        BigDecimal trailingAsk = position.bestAsk(trailing);
        BigDecimal buyPrice = isPositive(trailingAsk) ? trailingAsk : config.defaultTrailingAsk();
        BigDecimal recoveryCost = unpaired.multiply(buyPrice);
        BigDecimal locked = up.max(down).subtract(totalCost.add(recoveryCost));
        BigDecimal lossReduction = maxLoss.subtract(locked);
        BigDecimal gainSacrificed = maxGain.subtract(locked);

        BigDecimal avgLeadingCost = inv.avgCost(leading);
        BigDecimal combined = (avgLeadingCost == null ? BigDecimal.ZERO : avgLeadingCost).add(buyPrice);

        boolean recover = false;
        String reason;
        if (!config.enabled()) {
            reason = "recovery disabled";
        } else if (unpaired.compareTo(config.minUnpairedShares()) < 0) {
            reason = "unpaired %s < min %s".formatted(unpaired, config.minUnpairedShares());
        } else if (leadingPrice.doubleValue() < config.minWinProbability()) {
            reason = "leading probability %s < %s".formatted(leadingPrice, config.minWinProbability());
        } else if (combined.compareTo(config.maxCombinedCost()) > 0) {
            reason = "combined cost %s > max %s".formatted(combined.setScale(4, RoundingMode.HALF_UP), config.maxCombinedCost());
        } else if (lossReduction.signum() >= 0) {
            reason = "recovery does not reduce loss (reduction %s)".formatted(lossReduction);
        } else {
            recover = true;
            reason = "recovery reduces max loss by " + lossReduction.negate();
        }

        return new RecoveryAnalysis(recover, reason, up, down, totalCost, unpaired, leading, leadingPrice, trailingPrice,
                maxLoss, maxGain, unpaired, buyPrice, recoveryCost, locked, lossReduction, gainSacrificed, combined);
    }

    /**
     * Analyzes and, when worthwhile, places the recovery BUY in emergency mode. At most one attempt per market per
     * cooldown window, counting declined analyses.
     */
    public RecoveryResult maybeRecover(PositionSnapshot position) {
        MarketKey key = position.market().key();
        Instant now = clock.instant();
        boolean[] claimed = new boolean[1];
        lastAttemptAt.compute(key, (k, last) -> {
            if (last != null && Duration.between(last, now).toSeconds() < config.cooldownSeconds()) {
                return last;
            }
            claimed[0] = true;
            return now;
        });
        if (!claimed[0]) {
            return RecoveryResult.skipped("cooldown");
        }

        RecoveryAnalysis analysis = analyze(position);
        if (!analysis.shouldRecover()) {
            log.debug("HEDGE: recovery declined market={} reason={}", key, analysis.reason());
            return RecoveryResult.declined(analysis);
        }

        Outcome trailing = analysis.trailingSide();
        BigDecimal shares = analysis.sharesToBuy().setScale(0, RoundingMode.FLOOR);
        log.warn("HEDGE: recovery triggered market={} up={} down={} leading={}@{} buy {} {} @ {} maxLoss={} locked={}",
                key, analysis.upShares(), analysis.downShares(), analysis.leadingSide(), analysis.leadingPrice(),
                shares, trailing, analysis.buyPrice(), analysis.currentMaxLoss(), analysis.lockedLossAfterRecovery());

        PlacementResult placement = placer.place(new PlacementRequest(
                key, position.market().tokenFor(trailing), OrderSide.BUY, analysis.buyPrice(), shares, OrderType.GTC,
                position.book(trailing), true, HedgeIntent.EMERGENCY_EXIT.name()));

        RecoveryResult result = placement.isSubmitted()
                ? new RecoveryResult(true, true, analysis.reason(), analysis, placement.orderId(), placement.filledOrZero())
                : new RecoveryResult(true, false, placement.status() + ": " + placement.message(), analysis, null, BigDecimal.ZERO);
        if (!result.success()) {
            log.warn("HEDGE: recovery order failed market={} status={} reason={}", key, placement.status(), placement.message());
        }
        try {
            events.publish(HftEventTypes.HEDGE_RECOVERY, key.toString(), result);
        } catch (RuntimeException e) {
            log.debug("HEDGE: event publish failed type={}: {}", HftEventTypes.HEDGE_RECOVERY, e.toString());
        }
        return result;
    }

    public void clearMarket(MarketKey key) {
        lastAttemptAt.remove(key);
    }

    private static BigDecimal valuation(PositionSnapshot position, Outcome outcome) {
        BigDecimal bid = position.bestBid(outcome);
        if (isPositive(bid)) return bid;
        BigDecimal ask = position.bestAsk(outcome);
        if (isPositive(ask)) return ask;
        return FALLBACK_PRICE;
    }

    private static boolean isPositive(BigDecimal v) {
        return v != null && v.signum() > 0;
    }
}
