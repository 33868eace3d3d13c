package com.pairguard.hft.events;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix="hft.events")
public record HftEventsProperties(
    @NotNull Boolean enabled,
    String loggerName
) {
  public HftEventsProperties {
    if (enabled == null) {
      enabled = false;
    }
    if (loggerName == null || loggerName.isBlank()) {
      loggerName = "pairguard.events";
    }
  }
}
