package com.fillbot.hft.service.sim;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "filler.sim")
public record SimulationProperties(
    @NotNull Boolean enabled,
    /**
     * Number of perpetual markets, indexed from 0.
     */
    @NotNull @Min(1) @Max(64) Integer marketCount,
    /**
     * Oracle price used for every market.
     */
    @NotNull @DecimalMin("0.0001") BigDecimal markPrice,
    /**
     * AMM quote half spread around the oracle, in basis points.
     */
    @NotNull @Min(0) Integer halfSpreadBps,
    /**
     * When enabled, fills against the AMM are rejected with a "cant fulfill" log line.
     */
    @NotNull Boolean ammRejects,
    /**
     * Public key reported as the fee payer of simulated transactions.
     */
    String feePayer,
    /**
     * Crossing orders placed at startup so that the first cycles have something to fill.
     */
    @NotNull @Min(0) Integer seedOrders
) {
  public SimulationProperties {
    if (enabled == null) {
      enabled = true;
    }
    if (marketCount == null) {
      marketCount = 3;
    }
    if (markPrice == null) {
      markPrice = BigDecimal.valueOf(100);
    }
    if (halfSpreadBps == null) {
      halfSpreadBps = 10;
    }
    if (ammRejects == null) {
      ammRejects = false;
    }
    if (feePayer == null || feePayer.isBlank()) {
      feePayer = "SimFeePayer11111111111111111111111111111111";
    }
    if (seedOrders == null) {
      seedOrders = 0;
    }
  }
}
