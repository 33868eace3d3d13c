package com.pairguard.hft.execution.state;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceSample(Instant at, BigDecimal price) {}
