package com.pairguard.hft.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods=false)
@EnableConfigurationProperties(HftEventsProperties.class)
public class HftEventsConfiguration {

  @Bean
  @ConditionalOnProperty(prefix="hft.events", name="enabled", havingValue="true")
  @ConditionalOnMissingBean(HftEventPublisher.class)
  public HftEventPublisher loggingHftEventPublisher(ObjectMapper objectMapper, Clock clock, HftEventsProperties properties) {
    return new LoggingHftEventPublisher(objectMapper, clock, properties.loggerName());
  }

  @Bean
  @ConditionalOnMissingBean(HftEventPublisher.class)
  public HftEventPublisher noopHftEventPublisher() {
    return new NoopHftEventPublisher();
  }
}
