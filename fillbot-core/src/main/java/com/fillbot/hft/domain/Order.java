package com.fillbot.hft.domain;

import java.math.BigDecimal;

/**
 * An open exchange order as seen in the order-book snapshot. {@code price} is null for market orders.
 */
public record Order(
    long orderId,
    int marketIndex,
    OrderDirection direction,
    BigDecimal price,
    BigDecimal baseAssetAmount,
    long slot
) {

  public boolean isMarketOrder() {
    return price == null;
  }
}
