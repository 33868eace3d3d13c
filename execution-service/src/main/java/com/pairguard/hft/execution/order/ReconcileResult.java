package com.pairguard.hft.execution.order;

/**
 * {@code skipped} counts due markets left alone because a sync held their lock. {@code error} is set when the
 * venue listing failed; local state is then untouched.
 */
public record ReconcileResult(int cleaned, int added, int reconciledMarkets, int skipped, String error) {

    public static ReconcileResult empty() {
        return new ReconcileResult(0, 0, 0, 0, null);
    }

    public static ReconcileResult failed(String error) {
        return new ReconcileResult(0, 0, 0, 0, error);
    }

    public boolean isError() {
        return error != null;
    }
}
