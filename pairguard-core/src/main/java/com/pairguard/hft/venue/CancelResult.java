package com.pairguard.hft.venue;

public record CancelResult(boolean success, String error) {

  public static CancelResult ok() {
    return new CancelResult(true, null);
  }

  public static CancelResult failed(String error) {
    return new CancelResult(false, error);
  }
}
