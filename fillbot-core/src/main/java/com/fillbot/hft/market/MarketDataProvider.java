package com.fillbot.hft.market;

import com.fillbot.hft.domain.Order;

import java.math.BigDecimal;
import java.util.List;

/**
 * Market state and pricing rules owned by the exchange client.
 */
public interface MarketDataProvider {

  List<Integer> marketIndexes();

  long currentSlot();

  OraclePrice oraclePrice(int marketIndex);

  boolean isOraclePriceValid(int marketIndex, OraclePrice oraclePrice, long slot);

  /**
   * Automated market maker bid for the market.
   */
  BigDecimal bestBid(int marketIndex, OraclePrice oraclePrice);

  /**
   * Automated market maker ask for the market.
   */
  BigDecimal bestAsk(int marketIndex, OraclePrice oraclePrice);

  /**
   * Whether the automated market maker can take the other side of {@code order} right now (auction
   * complete, price crossing the AMM quote).
   */
  boolean isFillableByAmm(Order order, OraclePrice oraclePrice, long slot);
}
