package com.pairguard.hft.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class HftPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class)
      .withPropertyValues(
          "hft.mode=LIVE",
          "hft.risk.kill-switch=true",
          "hft.engine.enabled=true",
          "hft.engine.tick-millis=25",
          "hft.engine.price-guard.max-book-age-millis=750",
          "hft.engine.market-state.pairing-timeout-seconds=30",
          "hft.engine.market-state.hedge-slippage-caps.doge.base-cents=3.0",
          "hft.engine.market-state.hedge-slippage-caps.doge.max-cents=5.0",
          "hft.engine.hedge-escalator.max-retries=5",
          "hft.engine.markets[0].market-id=btc-updown-15m-1700000000",
          "hft.engine.markets[0].asset=btc",
          "hft.engine.markets[0].up-token-id=111",
          "hft.engine.markets[0].down-token-id=222",
          "hft.engine.markets[0].end-time=2024-01-15T10:15:00Z"
      );

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.run(context -> {
      HftProperties properties = context.getBean(HftProperties.class);

      assertThat(properties.mode()).isEqualTo(HftProperties.TradingMode.LIVE);
      assertThat(properties.risk().killSwitch()).isTrue();

      HftProperties.Engine engine = properties.engine();
      assertThat(engine.enabled()).isTrue();
      assertThat(engine.tickMillis()).isEqualTo(25L);
      assertThat(engine.priceGuard().maxBookAgeMillis()).isEqualTo(750L);
      assertThat(engine.marketState().pairingTimeoutSeconds()).isEqualTo(30L);
      assertThat(engine.hedgeEscalator().maxRetries()).isEqualTo(5);

      HftProperties.Market market = engine.markets().get(0);
      assertThat(market.asset()).isEqualTo("BTC");
      assertThat(market.upTokenId()).isEqualTo("111");
      assertThat(market.endTime()).isEqualTo(Instant.parse("2024-01-15T10:15:00Z"));
    });
  }

  @Test
  void appliesDefaultsWhenNothingIsConfigured() {
    runner.run(context -> {
      HftProperties properties = context.getBean(HftProperties.class);

      assertThat(properties.mode()).isEqualTo(HftProperties.TradingMode.PAPER);
      HftProperties.Engine engine = properties.engine();
      assertThat(engine.enabled()).isFalse();
      assertThat(engine.markets()).isEmpty();
      assertThat(engine.priceGuard().tickSize()).isEqualByComparingTo("0.01");
      assertThat(engine.priceGuard().emergencyMinIntervalMillis()).isEqualTo(30_000L);
      assertThat(engine.hedgeEscalator().maxHedgePrice()).isEqualByComparingTo("0.85");
      assertThat(engine.hedgeEscalator().survivalMaxPrice()).isEqualByComparingTo("0.95");
      assertThat(engine.cadence().hotEvalMillis()).isEqualTo(250L);
      assertThat(properties.rest().rateLimit().burst()).isEqualTo(50);
    });
  }

  @Test
  void mergesPerAssetSlippageCapsOverBuiltInDefaults() {
    runner.run(context -> {
      HftProperties.MarketState marketState = context.getBean(HftProperties.class).engine().marketState();

      assertThat(marketState.hedgeSlippageCaps()).containsKeys("BTC", "ETH", "SOL", "XRP", "DOGE");
      assertThat(marketState.hedgeSlippageCaps().get("DOGE").maxCents()).isEqualTo(5.0);
      assertThat(marketState.hedgeSlippageCaps().get("BTC").baseCents()).isEqualTo(1.0);
      assertThat(marketState.minHedgeChunkAbs()).isEqualTo(BigDecimal.valueOf(25));
    });
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(HftProperties.class)
  static class TestConfig {
  }
}
