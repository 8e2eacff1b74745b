package com.fillbot.hft.filler;

import java.time.Duration;

/**
 * Fire-and-forget hooks for metrics. Implementations must not throw and must not block.
 */
public interface FillerObserver {

  default void onCycleStart() {
  }

  default void onCycleEnd(Duration duration) {
  }

  default void onGateBusy() {
  }

  /**
   * Eligible candidates offered to the packer (or to the single fill path) this cycle.
   */
  default void onCandidatesOffered(int count) {
  }

  /**
   * @param operation {@code send}, {@code fillOrder}, {@code processLogs} or {@code tryFill}
   */
  default void onRpcDuration(String operation, Duration duration, boolean failed) {
  }

  default void onOutcome(FillOutcome outcome) {
  }

  default void onFilled(int count) {
  }

  default void onFillError(String errorCode) {
  }

  static FillerObserver noop() {
    return new FillerObserver() {
    };
  }
}
