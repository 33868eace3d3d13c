package com.pairguard.hft.execution.guard;

public record BookFreshness(boolean fresh, long ageMillis, BlockReason reason) {

    public static BookFreshness fresh(long ageMillis) {
        return new BookFreshness(true, ageMillis, null);
    }

    public static BookFreshness stale(long ageMillis) {
        return new BookFreshness(false, ageMillis, BlockReason.STALE_BOOK);
    }
}
