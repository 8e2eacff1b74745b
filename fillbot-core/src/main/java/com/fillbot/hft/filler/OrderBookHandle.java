package com.fillbot.hft.filler;

import com.fillbot.hft.book.OrderBook;
import com.fillbot.hft.book.OrderBookLoader;
import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.filler.gate.SnapshotGate;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Function;

/**
 * Owns the current order-book snapshot. Every rebuild, query and removal goes through the snapshot gate.
 */
@Slf4j
public class OrderBookHandle {

  private final SnapshotGate gate;
  private volatile OrderBook current;

  public OrderBookHandle(@NonNull SnapshotGate gate) {
    this.gate = gate;
  }

  /**
   * Replaces the snapshot with a fresh one from {@code loader}.
   *
   * @throws com.fillbot.hft.filler.gate.GateTimeoutException when the gate is not acquired in time
   */
  public void rebuild(@NonNull OrderBookLoader loader) {
    gate.run(() -> {
      OrderBook loaded = loader.load();
      current = loaded;
    });
  }

  public <T> T read(@NonNull Function<OrderBook, T> query) {
    return gate.call(() -> query.apply(requireLoaded()));
  }

  public void removeOrder(@NonNull FillCandidate candidate) {
    gate.run(() -> {
      OrderBook book = current;
      if (book == null) {
        log.warn("no order book snapshot loaded, nothing to remove for {}", candidate.signature());
        return;
      }
      book.remove(candidate.order(), candidate.accountRef(),
          () -> log.error("Order {} not found when trying to fill. Removing from order list",
              candidate.order().orderId()));
    });
  }

  /**
   * Unguarded view for diagnostics. Callers must not mutate the returned book.
   */
  public Optional<OrderBook> view() {
    return Optional.ofNullable(current);
  }

  private OrderBook requireLoaded() {
    OrderBook book = current;
    if (book == null) {
      throw new IllegalStateException("order book snapshot not loaded");
    }
    return book;
  }
}
