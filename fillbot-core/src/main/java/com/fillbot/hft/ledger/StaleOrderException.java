package com.fillbot.hft.ledger;

import java.util.List;

/**
 * The referenced order no longer exists on the ledger; the snapshot entry must be dropped.
 */
public class StaleOrderException extends TransportException {

  public StaleOrderException(String message, List<String> logs, String errorName, Throwable cause) {
    super(message, logs, errorName == null ? ORDER_DOES_NOT_EXIST : errorName, cause);
  }

  @Override
  public boolean indicatesMissingOrder() {
    return true;
  }
}
