package com.fillbot.hft.filler;

import com.fillbot.hft.filler.submit.SubmissionResult;

/**
 * Outcome of one call to the cycle entry point. {@code submission} is present only for
 * {@link CycleStatus#COMPLETED}.
 */
public record FillCycleResult(CycleStatus status, SubmissionResult submission) {

  public enum CycleStatus {
    COMPLETED,
    /**
     * Another cycle held the gate; this trigger was dropped.
     */
    BUSY,
    /**
     * The snapshot lock was not acquired in time; nothing was selected or submitted.
     */
    SNAPSHOT_TIMEOUT,
    /**
     * Packing and submission exceeded the cycle ceiling and were abandoned in place.
     */
    TIMED_OUT,
  }

  public static FillCycleResult completed(SubmissionResult submission) {
    return new FillCycleResult(CycleStatus.COMPLETED, submission);
  }

  public static FillCycleResult busy() {
    return new FillCycleResult(CycleStatus.BUSY, null);
  }

  public static FillCycleResult snapshotTimeout() {
    return new FillCycleResult(CycleStatus.SNAPSHOT_TIMEOUT, null);
  }

  public static FillCycleResult timedOut() {
    return new FillCycleResult(CycleStatus.TIMED_OUT, null);
  }

  public boolean ran() {
    return status == CycleStatus.COMPLETED || status == CycleStatus.TIMED_OUT;
  }
}
