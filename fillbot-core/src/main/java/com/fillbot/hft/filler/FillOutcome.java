package com.fillbot.hft.filler;

/**
 * Per-operation result read back from a confirmed transaction's log.
 */
public enum FillOutcome {
  SUCCEEDED,
  /**
   * The order no longer exists on the ledger.
   */
  STALE_ORDER,
  /**
   * The automated market maker could not take the other side.
   */
  COUNTERPARTY_REJECTED,
  /**
   * The result line matched no known pattern.
   */
  UNPARSED,
}
