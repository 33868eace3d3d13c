package com.pairguard.hft.domain;

/**
 * The two legs of an up/down market.
 */
public enum Outcome {
  UP,
  DOWN;

  public Outcome opposite() {
    return this == UP ? DOWN : UP;
  }
}
