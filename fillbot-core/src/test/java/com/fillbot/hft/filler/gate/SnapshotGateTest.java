package com.fillbot.hft.filler.gate;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotGateTest {

  @Test
  void returnsTheActionResultAndReleases() {
    SnapshotGate gate = new SnapshotGate(Duration.ofMillis(100));

    assertThat(gate.call(() -> 42)).isEqualTo(42);
    assertThat(gate.isLocked()).isFalse();
  }

  @Test
  void releasesWhenTheActionThrows() {
    SnapshotGate gate = new SnapshotGate(Duration.ofMillis(100));

    assertThatThrownBy(() -> gate.run(() -> {
      throw new IllegalStateException("boom");
    })).isInstanceOf(IllegalStateException.class);

    assertThat(gate.isLocked()).isFalse();
  }

  @Test
  void timesOutWhileAnotherThreadHoldsTheSnapshot() throws Exception {
    SnapshotGate gate = new SnapshotGate(Duration.ofMillis(50));
    CountDownLatch held = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Thread holder = new Thread(() -> gate.run(() -> {
      held.countDown();
      awaitQuietly(release);
    }));
    holder.start();
    assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

    long start = System.nanoTime();
    assertThatThrownBy(() -> gate.call(() -> "never"))
        .isInstanceOf(GateTimeoutException.class)
        .satisfies(e -> assertThat(((GateTimeoutException) e).timeout()).isEqualTo(Duration.ofMillis(50)));
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(40));

    release.countDown();
    holder.join(5_000);
    assertThat(gate.call(() -> "after")).isEqualTo("after");
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
