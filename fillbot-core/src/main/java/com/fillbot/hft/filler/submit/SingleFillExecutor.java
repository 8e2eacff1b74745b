package com.fillbot.hft.filler.submit;

import com.fillbot.hft.account.FillMetadata;
import com.fillbot.hft.account.FillMetadataResolver;
import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.filler.FillerObserver;
import com.fillbot.hft.filler.OrderBookHandle;
import com.fillbot.hft.filler.ThrottleRegistry;
import com.fillbot.hft.filler.gate.GateTimeoutException;
import com.fillbot.hft.ledger.FillExecutionClient;
import com.fillbot.hft.ledger.FillOperation;
import com.fillbot.hft.ledger.TransportException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Fills one candidate in its own transaction, outside the packer.
 */
@Slf4j
@RequiredArgsConstructor
public class SingleFillExecutor {

  private final @NonNull String name;
  private final @NonNull FillExecutionClient executionClient;
  private final @NonNull FillMetadataResolver metadataResolver;
  private final @NonNull ThrottleRegistry throttles;
  private final @NonNull OrderBookHandle orderBook;
  private final @NonNull FillerObserver observer;
  private final boolean dryRun;

  public SubmissionResult tryFill(@NonNull FillCandidate candidate) {
    log.info("{} trying to fill (account: {}) order {} on mktIdx: {}",
        name, candidate.accountRef(), candidate.order().orderId(), candidate.marketIndex());

    FillMetadata metadata = metadataResolver.resolve(candidate);
    FillOperation operation = executionClient.buildFillOperation(candidate, metadata);

    if (dryRun) {
      log.info("{} dry run, not filling", name);
      return SubmissionResult.dryRun(1);
    }

    long start = System.currentTimeMillis();
    boolean failed = false;
    try {
      String submissionId = executionClient.submit(List.of(operation));
      observer.onFilled(1);
      log.info("{} Filled user (account: {}) order: {}, Tx: {}",
          name, candidate.accountRef(), candidate.order().orderId(), submissionId);
      return SubmissionResult.sent(submissionId, 1);
    } catch (TransportException e) {
      failed = true;
      candidate.markUnfilled();
      throttles.recordAttempt(candidate.signature());
      observer.onFillError(e.errorCode());

      if (e.indicatesMissingOrder()) {
        try {
          orderBook.removeOrder(candidate);
        } catch (GateTimeoutException timeout) {
          log.error("{} could not remove stale order {}: {}", name, candidate.signature(), timeout.getMessage());
        }
      }
      log.error("Error ({}) filling user (account: {}) order: {}, mktIdx: {}",
          e.errorCode(), candidate.accountRef(), candidate.order().orderId(), candidate.marketIndex());
      return SubmissionResult.failed(1, e.errorCode());
    } finally {
      observer.onRpcDuration("fillOrder", Duration.ofMillis(System.currentTimeMillis() - start), failed);
    }
  }
}
