package com.pairguard.hft.execution.engine;

import com.pairguard.hft.config.HftProperties;
import com.pairguard.hft.events.HftEventPublisher;
import com.pairguard.hft.execution.hedge.Sleeper;
import com.pairguard.hft.execution.venue.paper.PaperVenueClient;
import com.pairguard.hft.venue.VenueClient;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Wires the paired-market engine.
 *
 * PAPER mode runs against the in-memory {@link PaperVenueClient} unless another {@link VenueClient} bean is
 * present. LIVE mode requires a real venue adapter bean and refuses to start without one.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(HftProperties.class)
public class ExecutionEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(VenueClient.class)
    public VenueClient paperVenueClient(HftProperties properties,
                                        Clock clock,
                                        @Value("${hft.paper.initial-balance-usd:1000}") BigDecimal initialBalance) {
        if (properties.mode() == HftProperties.TradingMode.LIVE) {
            throw new IllegalStateException("hft.mode=LIVE requires a VenueClient bean; refusing to trade on the paper venue");
        }
        log.info("PAPER: using in-memory venue with balance ${}", initialBalance);
        return new PaperVenueClient(clock, initialBalance);
    }

    @Bean
    public ExecutionEngineContext executionEngineContext(HftProperties properties,
                                                         VenueClient venue,
                                                         Clock clock,
                                                         HftEventPublisher events,
                                                         MeterRegistry meterRegistry) {
        return new ExecutionEngineContext(properties, venue, clock, events, meterRegistry, Sleeper.system());
    }

    @Bean
    public PairedMarketEngine pairedMarketEngine(ExecutionEngineContext context) {
        PairedMarketEngine engine = new PairedMarketEngine(context);
        if (context.getVenue() instanceof PaperVenueClient paper) {
            paper.onFill(fill -> engine.onFill(fill.tokenId(), fill.orderId(), fill.shares(), fill.price()));
        }
        return engine;
    }
}
