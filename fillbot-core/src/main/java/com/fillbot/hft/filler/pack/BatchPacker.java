package com.fillbot.hft.filler.pack;

import com.fillbot.hft.account.FillMetadataResolver;
import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.ledger.ComputeBudgetOperations;
import com.fillbot.hft.ledger.FillExecutionClient;
import com.fillbot.hft.ledger.FillOperation;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;

/**
 * Greedy single-pass packer: accepts candidates in the order offered and stops at the first one that
 * would reach the byte budget. Later, smaller candidates are not tried.
 */
@Slf4j
@RequiredArgsConstructor
public class BatchPacker {

  private final @NonNull FillExecutionClient executionClient;
  private final @NonNull FillMetadataResolver metadataResolver;
  private final int maxTxBytes;
  private final int computeUnits;
  private final int computeUnitFee;

  public PendingBatch pack(@NonNull Iterator<FillCandidate> candidates) {
    long start = System.currentTimeMillis();
    FillOperation preamble = ComputeBudgetOperations.requestUnits(computeUnits, computeUnitFee);
    PendingBatch batch = PendingBatch.open(executionClient.submitterIdentity(), preamble, maxTxBytes);

    while (candidates.hasNext()) {
      FillCandidate candidate = candidates.next();
      FillOperation operation = executionClient.buildFillOperation(candidate, metadataResolver.resolve(candidate));
      if (!batch.tryAccept(candidate, operation)) {
        log.info("tx full at {} bytes, {} does not fit (budget {})", batch.sizeBytes(), candidate.signature(), maxTxBytes);
        break;
      }
      log.info("including tx {}", candidate.signature());
    }

    log.info("txPacker took {}ms", System.currentTimeMillis() - start);
    return batch;
  }
}
