package com.prediction.market.trading_engine.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the funding, liquidation, resolution and reconciliation sweeps.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "trading.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
