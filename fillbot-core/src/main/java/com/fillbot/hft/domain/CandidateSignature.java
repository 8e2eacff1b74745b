package com.fillbot.hft.domain;

import lombok.NonNull;

/**
 * Stable key of a fill candidate: {@code <account>-<orderId>}, or {@code ~} when the candidate has no
 * owning account. The sentinel is never throttled.
 */
public record CandidateSignature(@NonNull String value) {

  public static final CandidateSignature SENTINEL = new CandidateSignature("~");

  public static CandidateSignature of(String accountRef, long orderId) {
    if (accountRef == null || accountRef.isBlank()) {
      return SENTINEL;
    }
    return new CandidateSignature(accountRef + "-" + orderId);
  }

  public boolean isSentinel() {
    return SENTINEL.value.equals(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
