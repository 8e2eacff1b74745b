package com.fillbot.hft.filler.gate;

import java.time.Duration;

/**
 * The order-book snapshot lock could not be acquired within its bounded wait.
 */
public class GateTimeoutException extends RuntimeException {

  private final Duration timeout;

  public GateTimeoutException(Duration timeout) {
    this(timeout, null);
  }

  public GateTimeoutException(Duration timeout, Throwable cause) {
    super("snapshot lock not acquired within " + timeout.toMillis() + "ms", cause);
    this.timeout = timeout;
  }

  public Duration timeout() {
    return timeout;
  }
}
