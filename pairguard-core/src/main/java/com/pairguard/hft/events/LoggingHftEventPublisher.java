package com.pairguard.hft.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Writes each event as one JSON line to a dedicated logger so a log shipper can pick them up.
 */
public final class LoggingHftEventPublisher implements HftEventPublisher {

  private static final Logger log = LoggerFactory.getLogger(LoggingHftEventPublisher.class);

  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Logger sink;

  public LoggingHftEventPublisher(@NonNull ObjectMapper objectMapper, @NonNull Clock clock, @NonNull String loggerName) {
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.sink = LoggerFactory.getLogger(loggerName);
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  @Override
  public void publish(Instant ts, String type, String key, Object data) {
    if (type == null || type.isBlank()) {
      return;
    }
    EventEnvelope envelope = new EventEnvelope(ts == null ? clock.instant() : ts, type, key, data);
    try {
      sink.info(objectMapper.writeValueAsString(envelope));
    } catch (JsonProcessingException | RuntimeException e) {
      log.warn("event publish failed type={} key={} error={}", type, key, e.toString());
    }
  }
}
