package com.pairguard.hft.execution.cadence;

public record CadenceStats(int coldCount, int warmCount, int hotCount, int totalMarkets) {}
