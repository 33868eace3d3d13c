package com.pairguard.hft.execution.state;

public record PairingTimeoutResult(boolean timedOut, double timeInPairingSeconds, PairingState revertedTo) {

    public static PairingTimeoutResult notTimedOut(double timeInPairingSeconds) {
        return new PairingTimeoutResult(false, timeInPairingSeconds, null);
    }
}
