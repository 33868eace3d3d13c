package com.pairguard.hft.execution.web;

import com.pairguard.hft.config.HftProperties;
import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.execution.cadence.CadenceState;
import com.pairguard.hft.execution.engine.EngineStatus;
import com.pairguard.hft.execution.engine.ExecutionEngineContext;
import com.pairguard.hft.execution.engine.PairedMarketEngine;
import com.pairguard.hft.execution.hedge.HedgeEvent;
import com.pairguard.hft.execution.model.MarketInventory;
import com.pairguard.hft.execution.model.MarketKey;
import com.pairguard.hft.execution.model.PairedMarket;
import com.pairguard.hft.execution.order.TrackedOrder;
import com.pairguard.hft.execution.priority.HedgeState;
import com.pairguard.hft.execution.state.PairingState;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
@Slf4j
public class EngineStatusController {

    private final @NonNull HftProperties properties;
    private final @NonNull Environment environment;
    private final @NonNull PairedMarketEngine engine;
    private final @NonNull ExecutionEngineContext context;

    @GetMapping("/status")
    public ResponseEntity<EngineStatusResponse> status() {
        return ResponseEntity.ok(new EngineStatusResponse(
                environment.getActiveProfiles(),
                properties.risk().killSwitch(),
                engine.status()
        ));
    }

    @GetMapping("/markets")
    public ResponseEntity<List<MarketStatusResponse>> markets() {
        return ResponseEntity.ok(engine.markets().stream().map(this::describe).toList());
    }

    @GetMapping("/markets/{marketId}")
    public ResponseEntity<MarketStatusResponse> market(@PathVariable String marketId) {
        return engine.market(marketId)
                .map(this::describe)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/hedge-events")
    public ResponseEntity<List<HedgeEvent>> hedgeEvents(@RequestParam(defaultValue = "50") int limit) {
        int bounded = Math.max(1, Math.min(limit, 500));
        return ResponseEntity.ok(context.getHedgeEscalator().recentEvents(bounded));
    }

    private MarketStatusResponse describe(PairedMarket market) {
        MarketKey key = market.key();
        MarketInventory inv = context.getInventoryTracker().get(key);
        HedgeState hedge = context.getHedgePriorityLane().getHedgeState(key).orElse(null);
        return new MarketStatusResponse(
                key.marketId(),
                key.asset(),
                market.endTime(),
                market.secondsRemaining(context.getClock().instant()),
                context.getMarketStateManager().getState(key),
                context.getCadenceController().snapshot(key).orElse(null),
                inv.upShares(),
                inv.downShares(),
                inv.totalCost(),
                hedge == null ? null : hedge.snapshot(),
                context.getOrderManager().trackedOrders(key, Outcome.UP),
                context.getOrderManager().trackedOrders(key, Outcome.DOWN)
        );
    }

    public record EngineStatusResponse(
            String[] activeProfiles,
            boolean killSwitch,
            EngineStatus engine
    ) {
    }

    public record MarketStatusResponse(
            String marketId,
            String asset,
            Instant endTime,
            long secondsRemaining,
            PairingState state,
            CadenceState.Snapshot cadence,
            BigDecimal upShares,
            BigDecimal downShares,
            BigDecimal totalCost,
            HedgeState.Snapshot hedge,
            List<TrackedOrder> upOrders,
            List<TrackedOrder> downOrders
    ) {
    }
}
