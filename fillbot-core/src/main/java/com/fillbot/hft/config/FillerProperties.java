package com.fillbot.hft.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "filler")
public record FillerProperties(
    /**
     * Bot name used in log lines and metric tags.
     */
    String name,
    /**
     * When true, candidates are resolved and packed but nothing is submitted.
     */
    @NotNull Boolean dryRun,
    FillMode mode,
    /**
     * Fixed-interval timer period for the periodic cycle.
     */
    @NotNull @Min(50) Long intervalMillis,
    /**
     * Minimum time between repeated fill attempts on the same order. 0 disables throttling.
     */
    @NotNull @PositiveOrZero Long fillBackoffMillis,
    /**
     * Bounded wait for the order-book snapshot lock.
     */
    @NotNull @Min(1) Long snapshotLockTimeoutMillis,
    /**
     * Ceiling raced against packing + submission of one cycle.
     */
    @NotNull @Min(1) Long cycleTimeoutMillis,
    /**
     * Per-transaction byte budget. The ledger rejects packets above 1232 bytes.
     */
    @NotNull @Min(256) @Max(1232) Integer maxTxBytes,
    @NotNull @PositiveOrZero Integer computeUnits,
    @NotNull @PositiveOrZero Integer computeUnitFee,
    @NotNull @Min(1) Integer outcomePollAttempts,
    @NotNull @PositiveOrZero Long outcomePollIntervalMillis,
    /**
     * Result log lines longer than this are counted as successful fills (raw event data).
     */
    @NotNull @PositiveOrZero Integer successLogMinLength
) {

  public FillerProperties {
    if (name == null || name.isBlank()) {
      name = "filler";
    }
    if (dryRun == null) {
      dryRun = false;
    }
    if (mode == null) {
      mode = FillMode.BULK;
    }
    if (intervalMillis == null) {
      intervalMillis = 1_000L;
    }
    if (fillBackoffMillis == null) {
      fillBackoffMillis = 0L;
    }
    if (snapshotLockTimeoutMillis == null) {
      snapshotLockTimeoutMillis = 10 * intervalMillis;
    }
    if (cycleTimeoutMillis == null) {
      cycleTimeoutMillis = 15_000L;
    }
    if (maxTxBytes == null) {
      maxTxBytes = 1_000;
    }
    if (computeUnits == null) {
      computeUnits = 4_000_000;
    }
    if (computeUnitFee == null) {
      computeUnitFee = 0;
    }
    if (outcomePollAttempts == null) {
      outcomePollAttempts = 10;
    }
    if (outcomePollIntervalMillis == null) {
      outcomePollIntervalMillis = 1_000L;
    }
    if (successLogMinLength == null) {
      successLogMinLength = 50;
    }
  }

  public static FillerProperties defaults() {
    return new FillerProperties(null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  public Duration fillBackoff() {
    return Duration.ofMillis(fillBackoffMillis);
  }

  public Duration snapshotLockTimeout() {
    return Duration.ofMillis(snapshotLockTimeoutMillis);
  }

  public Duration cycleTimeout() {
    return Duration.ofMillis(cycleTimeoutMillis);
  }

  public enum FillMode {
    /**
     * Pack as many candidates as fit into one transaction per cycle.
     */
    BULK,
    /**
     * Fill only the first eligible candidate per cycle, one operation per transaction.
     */
    SINGLE,
  }
}
