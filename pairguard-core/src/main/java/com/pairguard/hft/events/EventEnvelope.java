package com.pairguard.hft.events;

import java.time.Instant;

public record EventEnvelope(
    Instant ts,
    String type,
    String key,
    Object data
) {
}
