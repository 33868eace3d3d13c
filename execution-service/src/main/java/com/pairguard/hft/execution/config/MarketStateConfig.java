package com.pairguard.hft.execution.config;

import com.pairguard.hft.config.HftProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Pairing lifecycle thresholds, hedge caps and chunk bounds.
 */
public record MarketStateConfig(
        long pairingTimeoutSeconds,
        long unwindThresholdSeconds,
        BigDecimal minPairedShares,
        double pairedImbalanceTolerance,
        double volatilityMultiplier,
        long volatilityLookbackSeconds,
        BigDecimal minHedgeChunkAbs,
        double minHedgeChunkPct,
        BigDecimal maxHedgeChunkAbs,
        Map<String, SlippageCap> hedgeSlippageCaps,
        SlippageCap defaultSlippageCap
) {
    public record SlippageCap(double baseCents, double maxCents) {}

    public MarketStateConfig {
        hedgeSlippageCaps = hedgeSlippageCaps == null ? Map.of() : Map.copyOf(hedgeSlippageCaps);
        if (defaultSlippageCap == null) defaultSlippageCap = new SlippageCap(2.0, 4.0);
    }

    public SlippageCap capFor(String asset) {
        if (asset == null) return defaultSlippageCap;
        return hedgeSlippageCaps.getOrDefault(asset.toUpperCase(Locale.ROOT), defaultSlippageCap);
    }

    public static MarketStateConfig defaults() {
        return new MarketStateConfig(
                45,
                45,
                BigDecimal.valueOf(20),
                0.2,
                50.0,
                300,
                BigDecimal.valueOf(25),
                0.25,
                BigDecimal.valueOf(100),
                Map.of(
                        "BTC", new SlippageCap(1.0, 2.0),
                        "ETH", new SlippageCap(1.5, 2.5),
                        "SOL", new SlippageCap(2.0, 3.0),
                        "XRP", new SlippageCap(2.0, 4.0)
                ),
                new SlippageCap(2.0, 4.0)
        );
    }

    public static MarketStateConfig from(HftProperties.MarketState p) {
        Map<String, SlippageCap> caps = new HashMap<>();
        p.hedgeSlippageCaps().forEach((asset, cap) -> caps.put(asset, new SlippageCap(cap.baseCents(), cap.maxCents())));
        return new MarketStateConfig(
                p.pairingTimeoutSeconds(),
                p.unwindThresholdSeconds(),
                p.minPairedShares(),
                p.pairedImbalanceTolerance(),
                p.volatilityMultiplier(),
                p.volatilityLookbackSeconds(),
                p.minHedgeChunkAbs(),
                p.minHedgeChunkPct(),
                p.maxHedgeChunkAbs(),
                caps,
                new SlippageCap(p.defaultSlippageCap().baseCents(), p.defaultSlippageCap().maxCents())
        );
    }
}
