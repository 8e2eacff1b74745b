package com.fillbot.hft.service.metrics;

import com.fillbot.hft.filler.FillOutcome;
import com.fillbot.hft.filler.FillerObserver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.NonNull;

import java.time.Duration;
import java.util.Locale;

/**
 * Publishes filler activity as Micrometer meters tagged with the bot name.
 */
public class MicrometerFillerObserver implements FillerObserver {

  private final String bot;
  private final MeterRegistry meterRegistry;
  private final Counter cyclesStarted;
  private final Counter gateBusy;
  private final Counter filled;
  private final Timer cycleDuration;
  private final DistributionSummary candidatesOffered;

  public MicrometerFillerObserver(@NonNull String bot, @NonNull MeterRegistry meterRegistry) {
    this.bot = bot;
    this.meterRegistry = meterRegistry;
    this.cyclesStarted = Counter.builder("filler.cycles.started")
        .description("Fill cycles that acquired the cycle gate")
        .tag("bot", bot)
        .register(meterRegistry);
    this.gateBusy = Counter.builder("filler.cycles.busy")
        .description("Triggers dropped because a cycle was already running")
        .tag("bot", bot)
        .register(meterRegistry);
    this.filled = Counter.builder("filler.fills.succeeded")
        .description("Fills reported as succeeded")
        .tag("bot", bot)
        .register(meterRegistry);
    this.cycleDuration = Timer.builder("filler.cycle.duration")
        .description("Wall time of a fill cycle")
        .tag("bot", bot)
        .register(meterRegistry);
    this.candidatesOffered = DistributionSummary.builder("filler.candidates.offered")
        .description("Eligible candidates offered per cycle")
        .tag("bot", bot)
        .register(meterRegistry);
  }

  @Override
  public void onCycleStart() {
    cyclesStarted.increment();
  }

  @Override
  public void onCycleEnd(Duration duration) {
    cycleDuration.record(duration);
  }

  @Override
  public void onGateBusy() {
    gateBusy.increment();
  }

  @Override
  public void onCandidatesOffered(int count) {
    candidatesOffered.record(Math.max(0, count));
  }

  @Override
  public void onRpcDuration(String operation, Duration duration, boolean failed) {
    Timer.builder("filler.rpc.duration")
        .description("Ledger round-trip latency by operation")
        .tag("bot", bot)
        .tag("operation", safeValue(operation))
        .tag("outcome", failed ? "failure" : "success")
        .register(meterRegistry)
        .record(duration);
  }

  @Override
  public void onOutcome(FillOutcome outcome) {
    Counter.builder("filler.fill.outcomes")
        .description("Per-fill results read back from confirmed transactions")
        .tag("bot", bot)
        .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onFilled(int count) {
    if (count > 0) {
      filled.increment(count);
    }
  }

  @Override
  public void onFillError(String errorCode) {
    Counter.builder("filler.fill.errors")
        .description("Failed submissions by error code")
        .tag("bot", bot)
        .tag("error", safeValue(errorCode))
        .register(meterRegistry)
        .increment();
  }

  private static String safeValue(String value) {
    return value == null || value.isBlank() ? "unknown" : value;
  }
}
