package com.pairguard.hft.execution.state;

public enum PairingState {
    FLAT,
    ONE_SIDED_UP,
    ONE_SIDED_DOWN,
    PAIRING,
    PAIRED,
    /**
     * Close to expiry; absorbing for the rest of the market's life.
     */
    UNWIND_ONLY;

    public boolean isOneSided() {
        return this == ONE_SIDED_UP || this == ONE_SIDED_DOWN;
    }
}
