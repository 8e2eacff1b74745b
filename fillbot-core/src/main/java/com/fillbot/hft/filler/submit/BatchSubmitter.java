package com.fillbot.hft.filler.submit;

import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.filler.FillerObserver;
import com.fillbot.hft.filler.ThrottleRegistry;
import com.fillbot.hft.filler.pack.PendingBatch;
import com.fillbot.hft.ledger.FillExecutionClient;
import com.fillbot.hft.ledger.OutcomeRecord;
import com.fillbot.hft.ledger.TransportException;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Sends a packed batch and feeds its outcome back into the throttle registry and the snapshot.
 * Failures are never retried here; the next cycle re-evaluates every candidate.
 */
@Slf4j
public class BatchSubmitter {

  private final String name;
  private final FillExecutionClient executionClient;
  private final OutcomeReconciler reconciler;
  private final ThrottleRegistry throttles;
  private final FillerObserver observer;
  private final boolean dryRun;
  private final int outcomePollAttempts;
  private final long outcomePollIntervalMillis;

  @Builder
  BatchSubmitter(
      @NonNull String name,
      @NonNull FillExecutionClient executionClient,
      @NonNull OutcomeReconciler reconciler,
      @NonNull ThrottleRegistry throttles,
      @NonNull FillerObserver observer,
      boolean dryRun,
      int outcomePollAttempts,
      long outcomePollIntervalMillis
  ) {
    this.name = name;
    this.executionClient = executionClient;
    this.reconciler = reconciler;
    this.throttles = throttles;
    this.observer = observer;
    this.dryRun = dryRun;
    this.outcomePollAttempts = Math.max(1, outcomePollAttempts);
    this.outcomePollIntervalMillis = Math.max(0L, outcomePollIntervalMillis);
  }

  public SubmissionResult submit(@NonNull PendingBatch batch) {
    if (batch.isEmpty()) {
      log.info("{} no ix: no fill operation fit or none offered ({} candidates offered)", name, batch.candidatesOffered());
      return SubmissionResult.empty();
    }

    log.info("{} sending tx, {} unique accounts, total ix: {}, calcd tx size: {}",
        name, batch.uniqueReferenceCount(), batch.size(), batch.sizeBytes());
    if (dryRun) {
      log.info("{} dry run, not sending {} fills", name, batch.size());
      return SubmissionResult.dryRun(batch.size());
    }

    long sendStart = System.currentTimeMillis();
    String submissionId;
    try {
      submissionId = executionClient.submit(batch.operations());
    } catch (TransportException e) {
      observer.onRpcDuration("send", Duration.ofMillis(System.currentTimeMillis() - sendStart), true);
      observer.onFillError(e.errorCode());
      handleSendFailure(batch, e);
      return SubmissionResult.failed(batch.size(), e.errorCode());
    }
    long sendMillis = System.currentTimeMillis() - sendStart;
    log.info("{} sent tx: {}, took: {}ms", name, submissionId, sendMillis);
    observer.onRpcDuration("send", Duration.ofMillis(sendMillis), false);

    long parseStart = System.currentTimeMillis();
    Optional<OutcomeRecord> outcome = awaitOutcome(submissionId);
    if (outcome.isEmpty()) {
      return SubmissionResult.sent(submissionId, batch.size());
    }
    ReconciliationResult reconciliation = reconciler.reconcile(batch.candidates(), outcome.get());
    long parseMillis = System.currentTimeMillis() - parseStart;
    log.info("{} parse logs took {}ms, {}/{} fills succeeded", name, parseMillis, reconciliation.succeeded(), batch.size());
    observer.onRpcDuration("processLogs", Duration.ofMillis(parseMillis), false);
    observer.onFilled(reconciliation.succeeded());
    return SubmissionResult.confirmed(submissionId, batch.size(), reconciliation);
  }

  /**
   * Polls for the confirmed outcome with a fixed delay between attempts. Gives up after the configured
   * number of attempts: the outcome is then unknown, which is not an error for the cycle.
   */
  Optional<OutcomeRecord> awaitOutcome(String submissionId) {
    for (int attempt = 1; attempt <= outcomePollAttempts; attempt++) {
      log.info("waiting for {} to be confirmed", submissionId);
      try {
        Optional<OutcomeRecord> outcome = executionClient.fetchOutcome(submissionId);
        if (outcome.isPresent()) {
          return outcome;
        }
      } catch (TransportException e) {
        log.warn("{} fetching tx {} failed (attempt {}/{}): {}", name, submissionId, attempt, outcomePollAttempts, e.getMessage());
      }
      if (attempt < outcomePollAttempts) {
        try {
          Thread.sleep(outcomePollIntervalMillis);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          log.warn("{} interrupted while waiting for tx {}", name, submissionId);
          return Optional.empty();
        }
      }
    }
    log.error("tx {} not found after {} attempts, outcome unknown", submissionId, outcomePollAttempts);
    return Optional.empty();
  }

  private void handleSendFailure(PendingBatch batch, TransportException e) {
    log.error("{} failed to send packed tx ({} fills, error: {}): {}", name, batch.size(), e.errorCode(), e.getMessage());
    for (String line : e.logs()) {
      log.error("{}", line);
    }
    for (FillCandidate candidate : batch.candidates()) {
      throttles.recordAttempt(candidate.signature());
    }
    int removed = reconciler.removeStaleOrders(batch.candidates(), e.logs());
    if (removed == 0 && e.indicatesMissingOrder() && batch.size() == 1) {
      reconciler.removeQuietly(batch.candidates().get(0));
    }
  }
}
