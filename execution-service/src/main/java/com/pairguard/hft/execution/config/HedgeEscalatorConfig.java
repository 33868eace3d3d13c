package com.pairguard.hft.execution.config;

import com.pairguard.hft.config.HftProperties;

import java.math.BigDecimal;

/**
 * Bounded hedge retry ladder.
 */
public record HedgeEscalatorConfig(
        int maxRetries,
        long retryDelayMillis,
        BigDecimal priceIncrement,
        BigDecimal maxHedgePrice,
        BigDecimal survivalMaxPrice,
        long panicModeThresholdSeconds,
        long survivalModeThresholdSeconds,
        BigDecimal minSharesForRetry,
        double sizeReductionFactor,
        BigDecimal allowOverpay,
        double minDepthCoverage,
        double depthShrinkFactor,
        long survivalMaxRateLimitWaitMillis,
        int eventBufferSize
) {
    public static HedgeEscalatorConfig defaults() {
        return new HedgeEscalatorConfig(
                3,
                500,
                new BigDecimal("0.01"),
                new BigDecimal("0.85"),
                new BigDecimal("0.95"),
                120,
                60,
                BigDecimal.valueOf(5),
                0.8,
                new BigDecimal("0.01"),
                0.5,
                0.8,
                2_000,
                500
        );
    }

    public HedgeEscalatorConfig withMaxRetries(int retries) {
        return new HedgeEscalatorConfig(retries, retryDelayMillis, priceIncrement, maxHedgePrice, survivalMaxPrice,
                panicModeThresholdSeconds, survivalModeThresholdSeconds, minSharesForRetry, sizeReductionFactor,
                allowOverpay, minDepthCoverage, depthShrinkFactor, survivalMaxRateLimitWaitMillis, eventBufferSize);
    }

    public static HedgeEscalatorConfig from(HftProperties.HedgeEscalator p) {
        return new HedgeEscalatorConfig(
                p.maxRetries(),
                p.retryDelayMillis(),
                p.priceIncrement(),
                p.maxHedgePrice(),
                p.survivalMaxPrice(),
                p.panicModeThresholdSeconds(),
                p.survivalModeThresholdSeconds(),
                p.minSharesForRetry(),
                p.sizeReductionFactor(),
                p.allowOverpay(),
                p.minDepthCoverage(),
                p.depthShrinkFactor(),
                p.survivalMaxRateLimitWaitMillis(),
                p.eventBufferSize()
        );
    }
}
