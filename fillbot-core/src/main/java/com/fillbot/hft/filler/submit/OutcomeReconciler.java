package com.fillbot.hft.filler.submit;

import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.filler.FillOutcome;
import com.fillbot.hft.filler.FillerObserver;
import com.fillbot.hft.filler.OrderBookHandle;
import com.fillbot.hft.filler.ThrottleRegistry;
import com.fillbot.hft.filler.gate.GateTimeoutException;
import com.fillbot.hft.ledger.OutcomeRecord;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a transaction log back into per-fill outcomes.
 * <p>
 * Every fill instruction logs {@value #FILL_ORDER_MARKER}; the line right after it is that fill's result.
 * The preamble logs no marker, so the n-th marker belongs to the n-th packed candidate.
 */
@Slf4j
@RequiredArgsConstructor
public class OutcomeReconciler {

  static final String FILL_ORDER_MARKER = "Program log: Instruction: FillOrder";
  static final String ORDER_DOES_NOT_EXIST = "does not exist";
  static final String AMM_CANT_FULFILL = "cant fulfill";
  static final String AMM_CANNOT_FULFILL = "cannot fulfill";

  private final @NonNull OrderBookHandle orderBook;
  private final @NonNull ThrottleRegistry throttles;
  private final @NonNull FillerObserver observer;
  private final int successLogMinLength;

  /**
   * Classifies the log and applies the outcomes: stale orders are removed from the snapshot, rejected
   * fills are throttled.
   */
  public ReconciliationResult reconcile(@NonNull List<FillCandidate> submitted, @NonNull OutcomeRecord record) {
    List<FillResultLine> lines = classify(submitted, record.logMessages(), record.submissionId());
    for (FillResultLine line : lines) {
      apply(line);
    }
    return new ReconciliationResult(record.submissionId(), lines);
  }

  /**
   * Removes the orders a failed submission's diagnostic log reports as missing.
   *
   * @return number of removals issued
   */
  public int removeStaleOrders(@NonNull List<FillCandidate> submitted, @NonNull List<String> diagnostics) {
    int removed = 0;
    for (FillResultLine line : classify(submitted, diagnostics, null)) {
      if (line.outcome() == FillOutcome.STALE_ORDER && line.candidate() != null) {
        removeQuietly(line.candidate());
        removed++;
      }
    }
    return removed;
  }

  List<FillResultLine> classify(List<FillCandidate> submitted, List<String> logs, String submissionId) {
    List<FillResultLine> lines = new ArrayList<>();
    boolean nextIsFillRecord = false;
    int index = -1;
    for (String line : logs) {
      if (line == null) {
        log.error("null log message on tx: {}", submissionId);
        continue;
      }

      if (nextIsFillRecord) {
        if (index < submitted.size()) {
          lines.add(new FillResultLine(index, submitted.get(index), classifyLine(line), line));
        } else {
          log.warn("result for ix {} but only {} fills were packed (tx: {}): {}", index, submitted.size(), submissionId, line);
          lines.add(new FillResultLine(index, null, FillOutcome.UNPARSED, line));
        }
        nextIsFillRecord = false;
      } else if (FILL_ORDER_MARKER.equals(line)) {
        nextIsFillRecord = true;
        index++;
      }
    }
    return lines;
  }

  FillOutcome classifyLine(String line) {
    if (line.contains(ORDER_DOES_NOT_EXIST)) {
      return FillOutcome.STALE_ORDER;
    }
    if (line.contains(AMM_CANT_FULFILL) || line.contains(AMM_CANNOT_FULFILL)) {
      return FillOutcome.COUNTERPARTY_REJECTED;
    }
    if (line.length() > successLogMinLength) {
      // raw fill event data
      return FillOutcome.SUCCEEDED;
    }
    return FillOutcome.UNPARSED;
  }

  private void apply(FillResultLine line) {
    observer.onOutcome(line.outcome());
    FillCandidate candidate = line.candidate();
    if (candidate == null) {
      return;
    }
    switch (line.outcome()) {
      case STALE_ORDER -> {
        log.error(" {}, ix: {}, mktIdx: {}", line.line(), line.index(), candidate.marketIndex());
        log.error("   assoc order: {}, {}", candidate.accountRef(), candidate.order().orderId());
        removeQuietly(candidate);
      }
      case COUNTERPARTY_REJECTED -> {
        log.error(" {}, ix: {}, mktIdx: {}", line.line(), line.index(), candidate.marketIndex());
        log.error("   assoc order: {}, {}", candidate.accountRef(), candidate.order().orderId());
        throttles.recordAttempt(candidate.signature());
      }
      case UNPARSED -> log.info(" unparsed fill result, ix: {}: {}", line.index(), line.line());
      case SUCCEEDED -> {
      }
    }
  }

  void removeQuietly(FillCandidate candidate) {
    try {
      orderBook.removeOrder(candidate);
    } catch (GateTimeoutException e) {
      log.error("could not remove stale order {} (mktIdx: {}): {}",
          candidate.signature(), candidate.marketIndex(), e.getMessage());
    }
  }
}
