package com.pairguard.hft.execution.model;

import lombok.NonNull;

import java.util.Locale;

/**
 * Composite identity of a market on one underlying asset. Used as the key of every per-market map.
 */
public record MarketKey(@NonNull String marketId, @NonNull String asset) {

    public MarketKey {
        asset = asset.trim().toUpperCase(Locale.ROOT);
    }

    public static MarketKey of(String marketId, String asset) {
        return new MarketKey(marketId, asset);
    }

    @Override
    public String toString() {
        return marketId + "/" + asset;
    }
}
