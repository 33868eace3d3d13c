package com.pairguard.hft.execution.guard;

public enum BlockReason {
    /**
     * Missing, zero or negative price on the book or in the request.
     */
    INVALID_BOOK,
    INVERTED_BOOK,
    CROSSING_BLOCKED,
    EMERGENCY_RATE_LIMITED,
    STALE_BOOK,
}
