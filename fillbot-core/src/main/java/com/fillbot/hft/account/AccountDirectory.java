package com.fillbot.hft.account;

import com.fillbot.hft.domain.OrderRecord;

/**
 * Resolves exchange accounts to their owners and stats records. {@code mustGet*} methods fetch from the
 * ledger when the entry is not cached and fail when it does not exist there either.
 */
public interface AccountDirectory {

  /**
   * Loads every user and user-stats account.
   */
  void loadAll();

  void updateWithOrder(OrderRecord record);

  UserAccount mustGetUser(String accountRef);

  /**
   * Loads the user account owned by {@code authority}, as needed when a new account appears on the ledger.
   */
  UserAccount mustGetUserByAuthority(String authority);

  UserStats mustGetStats(String authority);
}
