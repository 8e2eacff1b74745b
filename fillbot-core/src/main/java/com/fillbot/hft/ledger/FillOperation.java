package com.fillbot.hft.ledger;

import java.util.List;
import java.util.Objects;

/**
 * One ledger instruction: the program to invoke, the accounts it touches and its raw payload.
 */
public record FillOperation(String programId, List<String> accounts, byte[] data) {

  public FillOperation {
    Objects.requireNonNull(programId, "programId");
    Objects.requireNonNull(data, "data");
    accounts = accounts == null ? List.of() : List.copyOf(accounts);
  }
}
