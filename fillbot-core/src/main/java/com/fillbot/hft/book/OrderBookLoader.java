package com.fillbot.hft.book;

/**
 * Builds a fresh order-book snapshot from the current account state.
 */
@FunctionalInterface
public interface OrderBookLoader {

  OrderBook load();
}
