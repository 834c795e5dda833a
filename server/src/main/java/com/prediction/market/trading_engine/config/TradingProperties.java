package com.prediction.market.trading_engine.config;

import java.math.BigDecimal;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;

/**
 * Engine tunables. Every field has a default so an empty {@code trading:} block is a valid config.
 */
@Validated
@ConfigurationProperties(prefix = "trading")
public record TradingProperties(
    StoreType store,
    /**
     * Fee taken from every prediction buy (on the gross amount) and sell (on gross proceeds).
     */
    @DecimalMin("0.0") @DecimalMax("0.5") BigDecimal predictionFeeRate,
    /**
     * Fee taken on perp notional at open and again at close.
     */
    @DecimalMin("0.0") @DecimalMax("0.5") BigDecimal perpFeeRate,
    @Min(1) Integer defaultLeverage,
    @Min(1) Integer minLeverage,
    @Min(1) Integer maxLeverage,
    /**
     * Share of the margin a position may lose before liquidation (0.9 leaves 10% for the liquidation fee).
     */
    @DecimalMin("0.1") @DecimalMax("1.0") BigDecimal liquidationBuffer,
    /**
     * Weight of the index price in the mark price; the rest goes to the last trade price.
     */
    @DecimalMin("0.0") @DecimalMax("1.0") BigDecimal markIndexWeight,
    BigDecimal markFundingFactor,
    @Min(1) Integer fundingIntervalHours,
    @DecimalMin("0.0") BigDecimal minPredictionOrder,
    Duration lockTimeout,
    @Valid Scheduling scheduling
) {

  public enum StoreType {
    MONGO,
    MEMORY
  }

  public TradingProperties {
    if (store == null) {
      store = StoreType.MONGO;
    }
    if (predictionFeeRate == null) {
      predictionFeeRate = new BigDecimal("0.01");
    }
    if (perpFeeRate == null) {
      perpFeeRate = new BigDecimal("0.001");
    }
    if (defaultLeverage == null) {
      defaultLeverage = 5;
    }
    if (minLeverage == null) {
      minLeverage = 1;
    }
    if (maxLeverage == null) {
      maxLeverage = 100;
    }
    if (liquidationBuffer == null) {
      liquidationBuffer = new BigDecimal("0.9");
    }
    if (markIndexWeight == null) {
      markIndexWeight = new BigDecimal("0.7");
    }
    if (markFundingFactor == null) {
      markFundingFactor = new BigDecimal("0.01");
    }
    if (fundingIntervalHours == null) {
      fundingIntervalHours = 8;
    }
    if (minPredictionOrder == null) {
      minPredictionOrder = BigDecimal.ONE;
    }
    if (lockTimeout == null) {
      lockTimeout = Duration.ofSeconds(2);
    }
    if (scheduling == null) {
      scheduling = new Scheduling(null, null, null, null, null);
    }
  }

  public static TradingProperties defaults() {
    return new TradingProperties(null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  public record Scheduling(
      Boolean enabled,
      Duration fundingInterval,
      Duration liquidationInterval,
      Duration resolutionInterval,
      Duration reconciliationInterval
  ) {
    public Scheduling {
      if (enabled == null) {
        enabled = true;
      }
      if (fundingInterval == null) {
        fundingInterval = Duration.ofHours(1);
      }
      if (liquidationInterval == null) {
        liquidationInterval = Duration.ofSeconds(5);
      }
      if (resolutionInterval == null) {
        resolutionInterval = Duration.ofMinutes(1);
      }
      if (reconciliationInterval == null) {
        reconciliationInterval = Duration.ofMinutes(5);
      }
    }
  }
}
