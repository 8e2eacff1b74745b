package com.fillbot.hft.ledger;

import java.util.List;

/**
 * Confirmed transaction as returned by the ledger. {@code logMessages} may contain null entries when the
 * node truncated the log.
 */
public record OutcomeRecord(String submissionId, long slot, List<String> logMessages) {

  public OutcomeRecord {
    logMessages = logMessages == null ? List.of() : logMessages;
  }
}
