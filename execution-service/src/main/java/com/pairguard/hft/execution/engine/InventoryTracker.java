package com.pairguard.hft.execution.engine;

import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.execution.model.MarketInventory;
import com.pairguard.hft.execution.model.MarketKey;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fill-driven per-market inventory with cost basis.
 */
@Slf4j
public class InventoryTracker {

    private final Clock clock;
    private final Map<MarketKey, MarketInventory> inventoryByMarket = new ConcurrentHashMap<>();

    public InventoryTracker(Clock clock) {
        this.clock = clock;
    }

    public MarketInventory get(MarketKey key) {
        return inventoryByMarket.getOrDefault(key, MarketInventory.empty());
    }

    public MarketInventory recordFill(MarketKey key, Outcome outcome, BigDecimal shares, BigDecimal price) {
        if (shares == null || shares.signum() <= 0 || price == null || price.signum() <= 0) {
            return get(key);
        }
        MarketInventory updated = inventoryByMarket.compute(key, (k, inv) ->
                (inv == null ? MarketInventory.empty() : inv).addFill(outcome, shares, price, clock.instant()));
        log.debug("INVENTORY: {} +{} {} @ {} -> up={} down={}", key, shares, outcome, price,
                updated.upShares(), updated.downShares());
        return updated;
    }

    public void clear(MarketKey key) {
        inventoryByMarket.remove(key);
    }

    public Map<MarketKey, MarketInventory> snapshot() {
        return Map.copyOf(inventoryByMarket);
    }
}
