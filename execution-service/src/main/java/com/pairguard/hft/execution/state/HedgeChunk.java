package com.pairguard.hft.execution.state;

import java.math.BigDecimal;

public record HedgeChunk(BigDecimal rawChunk, BigDecimal boundedChunk) {}
