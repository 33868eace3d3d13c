package com.pairguard.hft.execution.config;

import com.pairguard.hft.config.HftProperties;

import java.math.BigDecimal;

/**
 * Order-rate windows, circuit breaker and funds reservation limits.
 */
public record AdmissionConfig(
        int maxOrdersPerMarketPerMinute,
        int maxCancelReplacePerMarketPerMinute,
        int maxOrdersGlobalPerMinute,
        int maxCancelsGlobalPerMinute,
        long marketPauseMillis,
        long globalPauseMillis,
        int circuitBreakerFailures,
        long circuitBreakerResetMillis,
        BigDecimal safetyBufferUsd,
        BigDecimal minBalanceForTradingUsd,
        long staleBalanceMillis,
        BigDecimal maxReservedPerMarketUsd,
        BigDecimal maxTotalReservedUsd
) {
    public static AdmissionConfig defaults() {
        return new AdmissionConfig(
                15,
                10,
                100,
                50,
                30_000,
                60_000,
                5,
                120_000,
                BigDecimal.TEN,
                BigDecimal.valueOf(50),
                10_000,
                BigDecimal.valueOf(150),
                BigDecimal.valueOf(400)
        );
    }

    public static AdmissionConfig from(HftProperties.OrderRateLimit rate, HftProperties.Funding funding) {
        return new AdmissionConfig(
                rate.maxOrdersPerMarketPerMinute(),
                rate.maxCancelReplacePerMarketPerMinute(),
                rate.maxOrdersGlobalPerMinute(),
                rate.maxCancelsGlobalPerMinute(),
                rate.marketPauseMillis(),
                rate.globalPauseMillis(),
                rate.circuitBreakerFailures(),
                rate.circuitBreakerResetMillis(),
                funding.safetyBufferUsd(),
                funding.minBalanceForTradingUsd(),
                funding.staleBalanceMillis(),
                funding.maxReservedPerMarketUsd(),
                funding.maxTotalReservedUsd()
        );
    }
}
