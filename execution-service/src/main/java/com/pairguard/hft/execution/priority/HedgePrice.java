package com.pairguard.hft.execution.priority;

import java.math.BigDecimal;

public record HedgePrice(BigDecimal price, boolean emergencyMode) {}
