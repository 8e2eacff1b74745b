package com.fillbot.hft.filler;

import com.fillbot.hft.domain.CandidateSignature;
import lombok.NonNull;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Last fill attempt per candidate signature. An entry at least one backoff window old is treated as
 * absent and evicted when looked up.
 */
public class ThrottleRegistry {

  private final Clock clock;
  private final ConcurrentMap<String, Instant> lastAttemptBySignature = new ConcurrentHashMap<>();

  public ThrottleRegistry(@NonNull Clock clock) {
    this.clock = clock;
  }

  public void recordAttempt(@NonNull CandidateSignature signature) {
    if (signature.isSentinel()) {
      return;
    }
    lastAttemptBySignature.put(signature.value(), clock.instant());
  }

  public boolean isThrottled(@NonNull CandidateSignature signature, @NonNull Instant now, @NonNull Duration backoff) {
    if (signature.isSentinel()) {
      return false;
    }
    Instant lastAttempt = lastAttemptBySignature.get(signature.value());
    if (lastAttempt == null) {
      return false;
    }
    if (Duration.between(lastAttempt, now).compareTo(backoff) < 0) {
      return true;
    }
    lastAttemptBySignature.remove(signature.value(), lastAttempt);
    return false;
  }

  public Optional<Instant> lastAttempt(@NonNull CandidateSignature signature) {
    return Optional.ofNullable(lastAttemptBySignature.get(signature.value()));
  }

  public int size() {
    return lastAttemptBySignature.size();
  }
}
