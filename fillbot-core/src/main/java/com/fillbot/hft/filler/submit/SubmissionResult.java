package com.fillbot.hft.filler.submit;

/**
 * What happened to the operations of one cycle. {@code reconciliation} is only present for
 * {@link Status#CONFIRMED}.
 */
public record SubmissionResult(
    Status status,
    String submissionId,
    int operations,
    ReconciliationResult reconciliation,
    String errorCode
) {

  public enum Status {
    /**
     * Nothing was offered, or nothing fit.
     */
    EMPTY,
    DRY_RUN,
    /**
     * Sent and reconciled against the confirmed log.
     */
    CONFIRMED,
    /**
     * Sent without log reconciliation: the single fill path, or an outcome that never became visible.
     */
    SENT,
    FAILED,
  }

  public static SubmissionResult empty() {
    return new SubmissionResult(Status.EMPTY, null, 0, null, null);
  }

  public static SubmissionResult dryRun(int operations) {
    return new SubmissionResult(Status.DRY_RUN, null, operations, null, null);
  }

  public static SubmissionResult sent(String submissionId, int operations) {
    return new SubmissionResult(Status.SENT, submissionId, operations, null, null);
  }

  public static SubmissionResult confirmed(String submissionId, int operations, ReconciliationResult reconciliation) {
    return new SubmissionResult(Status.CONFIRMED, submissionId, operations, reconciliation, null);
  }

  public static SubmissionResult failed(int operations, String errorCode) {
    return new SubmissionResult(Status.FAILED, null, operations, null, errorCode);
  }
}
