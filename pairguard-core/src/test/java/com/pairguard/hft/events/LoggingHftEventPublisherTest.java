package com.pairguard.hft.events;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class LoggingHftEventPublisherTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  private final LoggingHftEventPublisher publisher = new LoggingHftEventPublisher(
      new ObjectMapper().registerModule(new JavaTimeModule()),
      Clock.fixed(NOW, ZoneId.of("UTC")),
      "pairguard.events.test"
  );

  @Test
  void isEnabledAndAcceptsPlainPayloads() {
    assertThat(publisher.isEnabled()).isTrue();
    assertThatCode(() -> publisher.publish("hedge.started", "btc-1", Map.of("qty", 10)))
        .doesNotThrowAnyException();
  }

  @Test
  void serializationFailureNeverEscapes() {
    assertThatCode(() -> publisher.publish("hedge.started", new Unserializable()))
        .doesNotThrowAnyException();
  }

  @Test
  void noopPublisherIsDisabled() {
    NoopHftEventPublisher noop = new NoopHftEventPublisher();

    assertThat(noop.isEnabled()).isFalse();
    assertThatCode(() -> noop.publish("x", null)).doesNotThrowAnyException();
  }

  @JsonSerialize(using = FailingSerializer.class)
  static final class Unserializable {
  }

  static final class FailingSerializer extends JsonSerializer<Unserializable> {
    @Override
    public void serialize(Unserializable value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
      throw new IOException("boom");
    }
  }
}
