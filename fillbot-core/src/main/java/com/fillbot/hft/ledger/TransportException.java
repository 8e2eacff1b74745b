package com.fillbot.hft.ledger;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Submission or retrieval failed at the network/protocol layer. Carries the raw diagnostic lines the
 * node returned (simulation logs) and, when known, the program error name.
 */
public class TransportException extends IOException {

  static final String ORDER_DOES_NOT_EXIST = "OrderDoesNotExist";
  static final String ORDER_DOES_NOT_EXIST_LOG = "Order does not exist";

  private final List<String> logs;
  private final String errorName;

  public TransportException(String message) {
    this(message, List.of(), null, null);
  }

  public TransportException(String message, List<String> logs, String errorName, Throwable cause) {
    super(message, cause);
    this.logs = logs == null ? List.of() : logs.stream().filter(Objects::nonNull).toList();
    this.errorName = errorName;
  }

  /**
   * Builds a {@link StaleOrderException} when the error name or diagnostic lines say the order is gone,
   * otherwise a plain transport error.
   */
  public static TransportException from(String message, List<String> logs, String errorName, Throwable cause) {
    boolean stale = ORDER_DOES_NOT_EXIST.equals(errorName)
        || (logs != null && logs.stream().anyMatch(l -> l != null && l.contains(ORDER_DOES_NOT_EXIST_LOG)));
    if (stale) {
      return new StaleOrderException(message, logs, errorName, cause);
    }
    return new TransportException(message, logs, errorName, cause);
  }

  public List<String> logs() {
    return logs;
  }

  public String errorName() {
    return errorName;
  }

  /**
   * Short code for metrics: the program error name when present, else the exception type.
   */
  public String errorCode() {
    return errorName == null || errorName.isBlank() ? getClass().getSimpleName() : errorName;
  }

  public boolean indicatesMissingOrder() {
    return false;
  }
}
