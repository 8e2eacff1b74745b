package com.fillbot.hft.domain;

/**
 * An order together with the account that owns it. {@code accountRef} is null for orders that belong
 * to the automated market maker.
 */
public record OrderNode(String accountRef, Order order) {

  public boolean hasAccount() {
    return accountRef != null && !accountRef.isBlank();
  }
}
