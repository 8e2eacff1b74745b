package com.fillbot.hft.book;

import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.domain.Order;
import com.fillbot.hft.market.OraclePrice;

import java.math.BigDecimal;
import java.util.List;

/**
 * Snapshot of the decentralised order book. Implementations are not thread safe; every call must be
 * made while holding the filler's snapshot gate.
 */
public interface OrderBook {

  /**
   * Nodes eligible to fill in {@code marketIndex} given the automated market maker's current quote.
   *
   * @param oraclePrice the oracle price, or null when the oracle is not valid for this slot
   */
  List<FillCandidate> findNodesToFill(int marketIndex, BigDecimal bestBid, BigDecimal bestAsk, long slot,
                                      OraclePrice oraclePrice);

  /**
   * Removes the order from the snapshot. {@code onRemoved} runs only when the order was present.
   */
  void remove(Order order, String accountRef, Runnable onRemoved);

  /**
   * Number of open orders currently in the snapshot.
   */
  int size();
}
