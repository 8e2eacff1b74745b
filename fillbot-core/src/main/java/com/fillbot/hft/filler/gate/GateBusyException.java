package com.fillbot.hft.filler.gate;

/**
 * A fill cycle is already in flight; the new trigger is dropped.
 */
public class GateBusyException extends RuntimeException {

  public GateBusyException() {
    super("fill cycle already running");
  }
}
