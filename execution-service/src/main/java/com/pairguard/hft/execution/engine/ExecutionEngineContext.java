package com.pairguard.hft.execution.engine;

import com.pairguard.hft.config.HftProperties;
import com.pairguard.hft.events.HftEventPublisher;
import com.pairguard.hft.execution.admission.AdmissionGate;
import com.pairguard.hft.execution.admission.BurstLimiter;
import com.pairguard.hft.execution.admission.OrderRateLimiter;
import com.pairguard.hft.execution.admission.ReservationLedger;
import com.pairguard.hft.execution.admission.SlidingWindowOrderRateLimiter;
import com.pairguard.hft.execution.cadence.CadenceController;
import com.pairguard.hft.execution.config.AdmissionConfig;
import com.pairguard.hft.execution.config.CadenceConfig;
import com.pairguard.hft.execution.config.EngineConfig;
import com.pairguard.hft.execution.config.HedgeEscalatorConfig;
import com.pairguard.hft.execution.config.HedgePriorityConfig;
import com.pairguard.hft.execution.config.MarketStateConfig;
import com.pairguard.hft.execution.config.PriceGuardConfig;
import com.pairguard.hft.execution.config.RecoveryConfig;
import com.pairguard.hft.execution.guard.PriceGuard;
import com.pairguard.hft.execution.hedge.HedgeEscalator;
import com.pairguard.hft.execution.hedge.LossMinimizer;
import com.pairguard.hft.execution.hedge.Sleeper;
import com.pairguard.hft.execution.order.GuardedOrderPlacer;
import com.pairguard.hft.execution.order.OrderManager;
import com.pairguard.hft.execution.priority.HedgePriorityLane;
import com.pairguard.hft.execution.state.MarketStateManager;
import com.pairguard.hft.venue.VenueClient;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import lombok.NonNull;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Every engine component, wired once and passed explicitly. Nothing here is a process-wide singleton, so tests
 * build as many independent contexts as they need.
 */
@Getter
public class ExecutionEngineContext {

    private final HftProperties properties;
    private final EngineConfig engineConfig;
    private final Clock clock;
    private final HftEventPublisher events;
    private final MeterRegistry meterRegistry;
    private final VenueClient venue;

    private final PriceGuard priceGuard;
    private final MarketStateManager marketStateManager;
    private final HedgePriorityLane hedgePriorityLane;
    private final OrderRateLimiter rateLimiter;
    private final BurstLimiter burstLimiter;
    private final ReservationLedger fundsLedger;
    private final AdmissionGate admissionGate;
    private final GuardedOrderPlacer orderPlacer;
    private final HedgeEscalator hedgeEscalator;
    private final LossMinimizer lossMinimizer;
    private final CadenceController cadenceController;
    private final OrderManager orderManager;
    private final InventoryTracker inventoryTracker;
    private final QuoteLadder quoteLadder;

    public ExecutionEngineContext(@NonNull HftProperties properties,
                                  @NonNull VenueClient venue,
                                  @NonNull Clock clock,
                                  @NonNull HftEventPublisher events,
                                  @NonNull MeterRegistry meterRegistry,
                                  @NonNull Sleeper sleeper) {
        HftProperties.Engine engine = properties.engine();
        this.properties = properties;
        this.engineConfig = EngineConfig.from(engine);
        this.clock = clock;
        this.events = events;
        this.meterRegistry = meterRegistry;
        this.venue = venue;

        PriceGuardConfig guardConfig = PriceGuardConfig.from(engine.priceGuard());
        AdmissionConfig admissionConfig = AdmissionConfig.from(engine.orderRateLimit(), engine.funding());

        this.priceGuard = new PriceGuard(guardConfig, clock, events, meterRegistry);
        this.marketStateManager = new MarketStateManager(MarketStateConfig.from(engine.marketState()), clock, events);
        this.hedgePriorityLane = new HedgePriorityLane(HedgePriorityConfig.from(engine.hedgePriority()), priceGuard, clock, events);
        this.rateLimiter = new SlidingWindowOrderRateLimiter(admissionConfig, clock);
        this.burstLimiter = new BurstLimiter(properties.rest().rateLimit(), clock);
        this.fundsLedger = new ReservationLedger(admissionConfig, venue, clock);
        this.admissionGate = new AdmissionGate(properties.risk(), burstLimiter, rateLimiter, hedgePriorityLane,
                BigDecimal.ONE.subtract(engineConfig.minPairEdge()));
        this.orderPlacer = new GuardedOrderPlacer(venue, priceGuard, properties.risk(), meterRegistry);
        this.hedgeEscalator = new HedgeEscalator(HedgeEscalatorConfig.from(engine.hedgeEscalator()), rateLimiter,
                fundsLedger, orderPlacer, venue, clock, sleeper, events, meterRegistry);
        this.lossMinimizer = new LossMinimizer(RecoveryConfig.from(engine.recovery()), orderPlacer, clock, events);
        this.cadenceController = new CadenceController(CadenceConfig.from(engine.cadence(), guardConfig.tickSize()),
                clock, events, meterRegistry);
        this.orderManager = new OrderManager(venue, orderPlacer, fundsLedger, clock, events, meterRegistry,
                engineConfig.maxConcurrentOrders(), engineConfig.reconcileIntervalMillis());
        this.inventoryTracker = new InventoryTracker(clock);
        this.quoteLadder = new QuoteLadder(priceGuard, engineConfig.quoteLevels(), engineConfig.sharesPerLevel());
    }
}
