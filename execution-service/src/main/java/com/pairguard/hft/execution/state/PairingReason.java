package com.pairguard.hft.execution.state;

/**
 * Why a market entered PAIRING.
 */
public enum PairingReason {
    PAIR_EDGE,
    HEDGE_CHUNK,
    MANUAL,
}
