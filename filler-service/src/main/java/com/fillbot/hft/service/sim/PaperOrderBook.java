package com.fillbot.hft.service.sim;

import com.fillbot.hft.book.OrderBook;
import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.domain.Order;
import com.fillbot.hft.domain.OrderDirection;
import com.fillbot.hft.domain.OrderNode;
import com.fillbot.hft.market.OraclePrice;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the simulator's open orders, oldest first per market. Not thread safe.
 */
final class PaperOrderBook implements OrderBook {

  private final Map<Integer, List<OrderNode>> nodesByMarket = new LinkedHashMap<>();

  PaperOrderBook(List<OrderNode> openOrders) {
    for (OrderNode node : openOrders) {
      nodesByMarket.computeIfAbsent(node.order().marketIndex(), k -> new ArrayList<>()).add(node);
    }
  }

  /**
   * Each order is paired with the oldest earlier resting order it crosses from another account; an
   * unpaired order is offered against the AMM when it crosses the AMM quote.
   */
  @Override
  public List<FillCandidate> findNodesToFill(int marketIndex, BigDecimal bestBid, BigDecimal bestAsk, long slot,
                                             OraclePrice oraclePrice) {
    List<OrderNode> nodes = nodesByMarket.getOrDefault(marketIndex, List.of());
    List<FillCandidate> candidates = new ArrayList<>();
    for (int i = 0; i < nodes.size(); i++) {
      OrderNode taker = nodes.get(i);
      OrderNode maker = findMaker(taker, nodes.subList(0, i));
      if (maker != null) {
        candidates.add(FillCandidate.againstMaker(taker, maker));
      } else if (crossesAmm(taker.order(), bestBid, bestAsk)) {
        candidates.add(FillCandidate.againstAmm(taker));
      }
    }
    return candidates;
  }

  @Override
  public void remove(Order order, String accountRef, Runnable onRemoved) {
    List<OrderNode> nodes = nodesByMarket.get(order.marketIndex());
    if (nodes == null) {
      return;
    }
    Iterator<OrderNode> it = nodes.iterator();
    while (it.hasNext()) {
      OrderNode node = it.next();
      if (node.order().orderId() == order.orderId() && node.accountRef().equals(accountRef)) {
        it.remove();
        onRemoved.run();
        return;
      }
    }
  }

  @Override
  public int size() {
    return nodesByMarket.values().stream().mapToInt(List::size).sum();
  }

  static boolean crossesAmm(Order order, BigDecimal bestBid, BigDecimal bestAsk) {
    if (order.isMarketOrder()) {
      return true;
    }
    return order.direction() == OrderDirection.LONG
        ? order.price().compareTo(bestAsk) >= 0
        : order.price().compareTo(bestBid) <= 0;
  }

  private static OrderNode findMaker(OrderNode taker, List<OrderNode> resting) {
    for (OrderNode maker : resting) {
      Order m = maker.order();
      if (m.isMarketOrder() || m.direction() == taker.order().direction() || maker.accountRef().equals(taker.accountRef())) {
        continue;
      }
      Order t = taker.order();
      if (t.isMarketOrder()) {
        return maker;
      }
      boolean crosses = t.direction() == OrderDirection.LONG
          ? t.price().compareTo(m.price()) >= 0
          : t.price().compareTo(m.price()) <= 0;
      if (crosses) {
        return maker;
      }
    }
    return null;
  }
}
