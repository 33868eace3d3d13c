package com.pairguard.hft.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix="hft")
public record HftProperties(
    TradingMode mode,
    @Valid Risk risk,
    @Valid Rest rest,
    @Valid Engine engine
) {

  public HftProperties {
    if (mode == null) {
      mode = TradingMode.PAPER;
    }
    if (risk == null) {
      risk = new Risk(false, null, null);
    }
    if (rest == null) {
      rest = new Rest(null);
    }
    if (engine == null) {
      engine = defaultEngine();
    }
  }

  private static Engine defaultEngine() {
    return new Engine(false, null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  public enum TradingMode {
    PAPER,
    LIVE,
  }

  public record Risk(
      boolean killSwitch,
      @NotNull @PositiveOrZero BigDecimal maxOrderNotionalUsd,
      @NotNull @PositiveOrZero BigDecimal maxOrderSize
  ) {
    public Risk {
      if (maxOrderNotionalUsd == null) {
        maxOrderNotionalUsd = BigDecimal.ZERO;
      }
      if (maxOrderSize == null) {
        maxOrderSize = BigDecimal.ZERO;
      }
    }
  }

  public record Rest(@Valid RateLimit rateLimit) {
    public Rest {
      if (rateLimit == null) {
        rateLimit = new RateLimit(null, null, null);
      }
    }
  }

  /**
   * Token bucket applied to every venue request that is not a hedge.
   */
  public record RateLimit(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero Double requestsPerSecond,
      @NotNull @PositiveOrZero Integer burst
  ) {
    public RateLimit {
      if (enabled == null) {
        enabled = true;
      }
      if (requestsPerSecond == null) {
        requestsPerSecond = 20.0;
      }
      if (burst == null) {
        burst = 50;
      }
    }
  }

  public record Engine(
      boolean enabled,
      /**
       * Base scheduler tick. Each market is still evaluated only as often as its cadence allows.
       */
      @NotNull @Min(10) Long tickMillis,
      @NotNull @Min(1) Integer workerThreads,
      List<Market> markets,
      @Valid PriceGuard priceGuard,
      @Valid MarketState marketState,
      @Valid HedgeEscalator hedgeEscalator,
      @Valid HedgePriority hedgePriority,
      @Valid Cadence cadence,
      @Valid Orders orders,
      @Valid Funding funding,
      @Valid OrderRateLimit orderRateLimit,
      @Valid Recovery recovery,
      @Valid Quoting quoting
  ) {
    public Engine {
      if (tickMillis == null) {
        tickMillis = 50L;
      }
      if (workerThreads == null) {
        workerThreads = 4;
      }
      markets = markets == null ? List.of() : markets.stream().filter(Objects::nonNull).toList();
      if (priceGuard == null) {
        priceGuard = new PriceGuard(null, null, null, null, null, null);
      }
      if (marketState == null) {
        marketState = new MarketState(null, null, null, null, null, null, null, null, null, null, null);
      }
      if (hedgeEscalator == null) {
        hedgeEscalator = new HedgeEscalator(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
      }
      if (hedgePriority == null) {
        hedgePriority = new HedgePriority(null, null, null, null, null, null, null, null);
      }
      if (cadence == null) {
        cadence = new Cadence(null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
      }
      if (orders == null) {
        orders = new Orders(null, null);
      }
      if (funding == null) {
        funding = new Funding(null, null, null, null, null);
      }
      if (orderRateLimit == null) {
        orderRateLimit = new OrderRateLimit(null, null, null, null, null, null, null, null);
      }
      if (recovery == null) {
        recovery = new Recovery(null, null, null, null, null, null);
      }
      if (quoting == null) {
        quoting = new Quoting(null, null, null, null);
      }
    }
  }

  /**
   * Statically configured market. Discovery is external; this list seeds the engine at startup.
   */
  public record Market(
      String marketId,
      String asset,
      String upTokenId,
      String downTokenId,
      Instant endTime
  ) {
    public Market {
      if (asset != null) {
        asset = asset.trim().toUpperCase(Locale.ROOT);
      }
    }
  }

  public record PriceGuard(
      @NotNull @Positive BigDecimal tickSize,
      @NotNull @PositiveOrZero Long maxBookAgeMillis,
      @NotNull @Min(0) Integer emergencyMaxCrossTicks,
      @NotNull @PositiveOrZero Long emergencyMinIntervalMillis,
      /**
       * Emergency crossing is only considered with at most this many seconds left to expiry.
       */
      @NotNull @PositiveOrZero Long maxSecondsRemainingForEmergency,
      @NotNull @PositiveOrZero BigDecimal minSpreadForMaker
  ) {
    public PriceGuard {
      if (tickSize == null) {
        tickSize = new BigDecimal("0.01");
      }
      if (maxBookAgeMillis == null) {
        maxBookAgeMillis = 500L;
      }
      if (emergencyMaxCrossTicks == null) {
        emergencyMaxCrossTicks = 2;
      }
      if (emergencyMinIntervalMillis == null) {
        emergencyMinIntervalMillis = 30_000L;
      }
      if (maxSecondsRemainingForEmergency == null) {
        maxSecondsRemainingForEmergency = 90L;
      }
      if (minSpreadForMaker == null) {
        minSpreadForMaker = new BigDecimal("0.02");
      }
    }
  }

  /**
   * Hedge slippage allowance over 100 cents of combined pair cost.
   */
  public record SlippageCap(
      @NotNull @PositiveOrZero Double baseCents,
      @NotNull @PositiveOrZero Double maxCents
  ) {
    public SlippageCap {
      if (baseCents == null) {
        baseCents = 2.0;
      }
      if (maxCents == null) {
        maxCents = 4.0;
      }
    }
  }

  public record MarketState(
      @NotNull @PositiveOrZero Long pairingTimeoutSeconds,
      @NotNull @PositiveOrZero Long unwindThresholdSeconds,
      @NotNull @PositiveOrZero BigDecimal minPairedShares,
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double pairedImbalanceTolerance,
      @NotNull @PositiveOrZero Double volatilityMultiplier,
      @NotNull @Min(1) Long volatilityLookbackSeconds,
      @NotNull @PositiveOrZero BigDecimal minHedgeChunkAbs,
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double minHedgeChunkPct,
      @NotNull @PositiveOrZero BigDecimal maxHedgeChunkAbs,
      Map<String, @Valid SlippageCap> hedgeSlippageCaps,
      @Valid SlippageCap defaultSlippageCap
  ) {
    public MarketState {
      if (pairingTimeoutSeconds == null) {
        pairingTimeoutSeconds = 45L;
      }
      if (unwindThresholdSeconds == null) {
        unwindThresholdSeconds = 45L;
      }
      if (minPairedShares == null) {
        minPairedShares = BigDecimal.valueOf(20);
      }
      if (pairedImbalanceTolerance == null) {
        pairedImbalanceTolerance = 0.2;
      }
      if (volatilityMultiplier == null) {
        volatilityMultiplier = 50.0;
      }
      if (volatilityLookbackSeconds == null) {
        volatilityLookbackSeconds = 300L;
      }
      if (minHedgeChunkAbs == null) {
        minHedgeChunkAbs = BigDecimal.valueOf(25);
      }
      if (minHedgeChunkPct == null) {
        minHedgeChunkPct = 0.25;
      }
      if (maxHedgeChunkAbs == null) {
        maxHedgeChunkAbs = BigDecimal.valueOf(100);
      }
      hedgeSlippageCaps = normalizeCaps(hedgeSlippageCaps);
      if (defaultSlippageCap == null) {
        defaultSlippageCap = new SlippageCap(2.0, 4.0);
      }
    }

    private static Map<String, SlippageCap> normalizeCaps(Map<String, SlippageCap> caps) {
      Map<String, SlippageCap> out = new LinkedHashMap<>();
      out.put("BTC", new SlippageCap(1.0, 2.0));
      out.put("ETH", new SlippageCap(1.5, 2.5));
      out.put("SOL", new SlippageCap(2.0, 3.0));
      out.put("XRP", new SlippageCap(2.0, 4.0));
      if (caps != null) {
        caps.forEach((asset, cap) -> {
          if (asset != null && cap != null) {
            out.put(asset.trim().toUpperCase(Locale.ROOT), cap);
          }
        });
      }
      return Map.copyOf(out);
    }
  }

  public record HedgeEscalator(
      @NotNull @Min(1) Integer maxRetries,
      @NotNull @PositiveOrZero Long retryDelayMillis,
      @NotNull @PositiveOrZero BigDecimal priceIncrement,
      @NotNull @Positive BigDecimal maxHedgePrice,
      @NotNull @Positive BigDecimal survivalMaxPrice,
      @NotNull @PositiveOrZero Long panicModeThresholdSeconds,
      @NotNull @PositiveOrZero Long survivalModeThresholdSeconds,
      @NotNull @PositiveOrZero BigDecimal minSharesForRetry,
      @NotNull @Positive @DecimalMax("1.0") Double sizeReductionFactor,
      @NotNull @PositiveOrZero BigDecimal allowOverpay,
      /**
       * Visible ask depth must cover at least this fraction of the intended hedge size.
       */
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double minDepthCoverage,
      @NotNull @Positive @DecimalMax("1.0") Double depthShrinkFactor,
      @NotNull @PositiveOrZero Long survivalMaxRateLimitWaitMillis,
      @NotNull @Min(1) Integer eventBufferSize
  ) {
    public HedgeEscalator {
      if (maxRetries == null) {
        maxRetries = 3;
      }
      if (retryDelayMillis == null) {
        retryDelayMillis = 500L;
      }
      if (priceIncrement == null) {
        priceIncrement = new BigDecimal("0.01");
      }
      if (maxHedgePrice == null) {
        maxHedgePrice = new BigDecimal("0.85");
      }
      if (survivalMaxPrice == null) {
        survivalMaxPrice = new BigDecimal("0.95");
      }
      if (panicModeThresholdSeconds == null) {
        panicModeThresholdSeconds = 120L;
      }
      if (survivalModeThresholdSeconds == null) {
        survivalModeThresholdSeconds = 60L;
      }
      if (minSharesForRetry == null) {
        minSharesForRetry = BigDecimal.valueOf(5);
      }
      if (sizeReductionFactor == null) {
        sizeReductionFactor = 0.8;
      }
      if (allowOverpay == null) {
        allowOverpay = new BigDecimal("0.01");
      }
      if (minDepthCoverage == null) {
        minDepthCoverage = 0.5;
      }
      if (depthShrinkFactor == null) {
        depthShrinkFactor = 0.8;
      }
      if (survivalMaxRateLimitWaitMillis == null) {
        survivalMaxRateLimitWaitMillis = 2_000L;
      }
      if (eventBufferSize == null) {
        eventBufferSize = 500;
      }
    }
  }

  public record HedgePriority(
      @NotNull @PositiveOrZero Long normalSeconds,
      @NotNull @PositiveOrZero Long urgentSeconds,
      @NotNull @PositiveOrZero Long survivalSeconds,
      @NotNull @PositiveOrZero Long emergencyExitSeconds,
      @NotNull @PositiveOrZero Long normalRepriceMillis,
      @NotNull @PositiveOrZero Long urgentRepriceMillis,
      @NotNull @PositiveOrZero Long survivalRepriceMillis,
      @NotNull @Min(1) Integer maxHedgeAttempts
  ) {
    public HedgePriority {
      if (normalSeconds == null) {
        normalSeconds = 10L;
      }
      if (urgentSeconds == null) {
        urgentSeconds = 30L;
      }
      if (survivalSeconds == null) {
        survivalSeconds = 60L;
      }
      if (emergencyExitSeconds == null) {
        emergencyExitSeconds = 90L;
      }
      if (normalRepriceMillis == null) {
        normalRepriceMillis = 5_000L;
      }
      if (urgentRepriceMillis == null) {
        urgentRepriceMillis = 3_000L;
      }
      if (survivalRepriceMillis == null) {
        survivalRepriceMillis = 10_000L;
      }
      if (maxHedgeAttempts == null) {
        maxHedgeAttempts = 10;
      }
    }
  }

  public record Cadence(
      @NotNull @Min(1) Long coldEvalMillis,
      @NotNull @Min(1) Long warmEvalMillis,
      @NotNull @Min(1) Long hotEvalMillis,
      @NotNull @Min(1) Long coldSnapshotMillis,
      @NotNull @Min(1) Long warmSnapshotMillis,
      @NotNull @PositiveOrZero Double nearMispricingRatio,
      @NotNull @PositiveOrZero Double hotMispricingRatio,
      @NotNull @PositiveOrZero @DecimalMax("100.0") Double nearPercentile,
      @NotNull @PositiveOrZero @DecimalMax("100.0") Double hotPercentile,
      @NotNull @PositiveOrZero Long moveWindowMillis,
      @NotNull @PositiveOrZero Long nearFalseCooldownMillis,
      @NotNull @PositiveOrZero Long hotFalseCooldownMillis,
      @NotNull @Min(1) Integer percentileWindow,
      @NotNull @PositiveOrZero Long spreadHistoryMillis,
      /**
       * Pair edge (1 - combined ask) at which the engine would enter; cadence thresholds scale from it.
       */
      @NotNull @PositiveOrZero Double entryThreshold
  ) {
    public Cadence {
      if (coldEvalMillis == null) {
        coldEvalMillis = 1_000L;
      }
      if (warmEvalMillis == null) {
        warmEvalMillis = 500L;
      }
      if (hotEvalMillis == null) {
        hotEvalMillis = 250L;
      }
      if (coldSnapshotMillis == null) {
        coldSnapshotMillis = 2_000L;
      }
      if (warmSnapshotMillis == null) {
        warmSnapshotMillis = 1_000L;
      }
      if (nearMispricingRatio == null) {
        nearMispricingRatio = 0.6;
      }
      if (hotMispricingRatio == null) {
        hotMispricingRatio = 0.85;
      }
      if (nearPercentile == null) {
        nearPercentile = 75.0;
      }
      if (hotPercentile == null) {
        hotPercentile = 90.0;
      }
      if (moveWindowMillis == null) {
        moveWindowMillis = 1_000L;
      }
      if (nearFalseCooldownMillis == null) {
        nearFalseCooldownMillis = 5_000L;
      }
      if (hotFalseCooldownMillis == null) {
        hotFalseCooldownMillis = 3_000L;
      }
      if (percentileWindow == null) {
        percentileWindow = 200;
      }
      if (spreadHistoryMillis == null) {
        spreadHistoryMillis = 2_000L;
      }
      if (entryThreshold == null) {
        entryThreshold = 0.02;
      }
    }
  }

  public record Orders(
      @NotNull @Min(1) Integer maxConcurrentOrders,
      @NotNull @PositiveOrZero Long reconcileIntervalMillis
  ) {
    public Orders {
      if (maxConcurrentOrders == null) {
        maxConcurrentOrders = 10;
      }
      if (reconcileIntervalMillis == null) {
        reconcileIntervalMillis = 30_000L;
      }
    }
  }

  public record Funding(
      @NotNull @PositiveOrZero BigDecimal safetyBufferUsd,
      @NotNull @PositiveOrZero BigDecimal minBalanceForTradingUsd,
      @NotNull @PositiveOrZero Long staleBalanceMillis,
      @NotNull @PositiveOrZero BigDecimal maxReservedPerMarketUsd,
      @NotNull @PositiveOrZero BigDecimal maxTotalReservedUsd
  ) {
    public Funding {
      if (safetyBufferUsd == null) {
        safetyBufferUsd = BigDecimal.TEN;
      }
      if (minBalanceForTradingUsd == null) {
        minBalanceForTradingUsd = BigDecimal.valueOf(50);
      }
      if (staleBalanceMillis == null) {
        staleBalanceMillis = 10_000L;
      }
      if (maxReservedPerMarketUsd == null) {
        maxReservedPerMarketUsd = BigDecimal.valueOf(150);
      }
      if (maxTotalReservedUsd == null) {
        maxTotalReservedUsd = BigDecimal.valueOf(400);
      }
    }
  }

  public record OrderRateLimit(
      @NotNull @Min(1) Integer maxOrdersPerMarketPerMinute,
      @NotNull @Min(1) Integer maxCancelReplacePerMarketPerMinute,
      @NotNull @Min(1) Integer maxOrdersGlobalPerMinute,
      @NotNull @Min(1) Integer maxCancelsGlobalPerMinute,
      @NotNull @PositiveOrZero Long marketPauseMillis,
      @NotNull @PositiveOrZero Long globalPauseMillis,
      @NotNull @Min(1) Integer circuitBreakerFailures,
      @NotNull @PositiveOrZero Long circuitBreakerResetMillis
  ) {
    public OrderRateLimit {
      if (maxOrdersPerMarketPerMinute == null) {
        maxOrdersPerMarketPerMinute = 15;
      }
      if (maxCancelReplacePerMarketPerMinute == null) {
        maxCancelReplacePerMarketPerMinute = 10;
      }
      if (maxOrdersGlobalPerMinute == null) {
        maxOrdersGlobalPerMinute = 100;
      }
      if (maxCancelsGlobalPerMinute == null) {
        maxCancelsGlobalPerMinute = 50;
      }
      if (marketPauseMillis == null) {
        marketPauseMillis = 30_000L;
      }
      if (globalPauseMillis == null) {
        globalPauseMillis = 60_000L;
      }
      if (circuitBreakerFailures == null) {
        circuitBreakerFailures = 5;
      }
      if (circuitBreakerResetMillis == null) {
        circuitBreakerResetMillis = 120_000L;
      }
    }
  }

  public record Recovery(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero BigDecimal minUnpairedShares,
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double minWinProbability,
      @NotNull @PositiveOrZero BigDecimal maxCombinedCost,
      @NotNull @PositiveOrZero Long cooldownSeconds,
      @NotNull @Positive BigDecimal defaultTrailingAsk
  ) {
    public Recovery {
      if (enabled == null) {
        enabled = true;
      }
      if (minUnpairedShares == null) {
        minUnpairedShares = BigDecimal.valueOf(25);
      }
      if (minWinProbability == null) {
        minWinProbability = 0.60;
      }
      if (maxCombinedCost == null) {
        maxCombinedCost = new BigDecimal("1.10");
      }
      if (cooldownSeconds == null) {
        cooldownSeconds = 10L;
      }
      if (defaultTrailingAsk == null) {
        defaultTrailingAsk = new BigDecimal("0.70");
      }
    }
  }

  /**
   * Resting maker ladder worked while a market is flat or paired.
   */
  public record Quoting(
      @NotNull Boolean enabled,
      @NotNull @Min(0) Integer levels,
      @NotNull @PositiveOrZero BigDecimal sharesPerLevel,
      @NotNull @PositiveOrZero BigDecimal minPairEdge
  ) {
    public Quoting {
      if (enabled == null) {
        enabled = true;
      }
      if (levels == null) {
        levels = 2;
      }
      if (sharesPerLevel == null) {
        sharesPerLevel = BigDecimal.TEN;
      }
      if (minPairEdge == null) {
        minPairEdge = new BigDecimal("0.02");
      }
    }
  }
}
