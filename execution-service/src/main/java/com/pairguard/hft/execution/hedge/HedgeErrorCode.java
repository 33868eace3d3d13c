package com.pairguard.hft.execution.hedge;

public enum HedgeErrorCode {
    NO_LIQUIDITY,
    INSUFFICIENT_FUNDS,
    RATE_LIMITED,
    API_ERROR,
    /**
     * The price guard refused the escalated price (crossing, stale or invalid book).
     */
    PRICE_BLOCKED,
    MAX_RETRIES,
    ABORTED,
    PAIR_COST_WORSENING,
}
