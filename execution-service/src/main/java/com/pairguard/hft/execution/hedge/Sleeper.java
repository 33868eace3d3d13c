package com.pairguard.hft.execution.hedge;

/**
 * Retry backoff seam so escalation can be tested without real timers.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper system() {
        return millis -> {
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
}
