package com.fillbot.hft.filler.gate;

import lombok.NonNull;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion around rebuilding, reading and mutating the order-book snapshot, acquired with a
 * bounded wait.
 */
public class SnapshotGate {

  private final ReentrantLock lock = new ReentrantLock();
  private final Duration timeout;

  public SnapshotGate(@NonNull Duration timeout) {
    this.timeout = timeout;
  }

  /**
   * @throws GateTimeoutException when the lock is not acquired within the timeout
   */
  public <T> T call(Supplier<T> action) {
    acquire();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public void run(Runnable action) {
    call(() -> {
      action.run();
      return null;
    });
  }

  public boolean isLocked() {
    return lock.isLocked();
  }

  public Duration timeout() {
    return timeout;
  }

  private void acquire() {
    boolean acquired;
    try {
      acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GateTimeoutException(timeout, e);
    }
    if (!acquired) {
      throw new GateTimeoutException(timeout);
    }
  }
}
