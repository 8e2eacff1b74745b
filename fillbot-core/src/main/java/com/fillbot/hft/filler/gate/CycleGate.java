package com.fillbot.hft.filler.gate;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Non-blocking admission for fill cycles: at most one holder, no queueing. Not reentrant, a second
 * {@link #tryEnter()} from the holding thread is rejected like any other.
 */
public class CycleGate {

  private final AtomicBoolean running = new AtomicBoolean(false);

  /**
   * @throws GateBusyException when a cycle already holds the gate
   */
  public Lease tryEnter() {
    if (!running.compareAndSet(false, true)) {
      throw new GateBusyException();
    }
    return new Lease();
  }

  public boolean isRunning() {
    return running.get();
  }

  public final class Lease implements AutoCloseable {

    private final AtomicBoolean released = new AtomicBoolean(false);

    private Lease() {
    }

    @Override
    public void close() {
      if (released.compareAndSet(false, true)) {
        running.set(false);
      }
    }
  }
}
