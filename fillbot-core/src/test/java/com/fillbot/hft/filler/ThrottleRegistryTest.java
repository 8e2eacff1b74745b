package com.fillbot.hft.filler;

import com.fillbot.hft.domain.CandidateSignature;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class ThrottleRegistryTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
  private static final Duration BACKOFF = Duration.ofSeconds(5);

  private final ThrottleRegistry registry = new ThrottleRegistry(Clock.fixed(NOW, ZoneId.of("UTC")));
  private final CandidateSignature signature = CandidateSignature.of("acct", 7L);

  @Test
  void throttlesForTheWholeBackoffWindow() {
    registry.recordAttempt(signature);

    assertThat(registry.isThrottled(signature, NOW, BACKOFF)).isTrue();
    assertThat(registry.isThrottled(signature, NOW.plusMillis(2_500), BACKOFF)).isTrue();
    assertThat(registry.isThrottled(signature, NOW.plus(BACKOFF).minusMillis(1), BACKOFF)).isTrue();
  }

  @Test
  void releasesAndEvictsOnceTheWindowHasPassed() {
    registry.recordAttempt(signature);

    assertThat(registry.isThrottled(signature, NOW.plus(BACKOFF), BACKOFF)).isFalse();
    assertThat(registry.lastAttempt(signature)).isEmpty();
    assertThat(registry.size()).isZero();
  }

  @Test
  void zeroBackoffNeverThrottles() {
    registry.recordAttempt(signature);

    assertThat(registry.isThrottled(signature, NOW, Duration.ZERO)).isFalse();
    assertThat(registry.size()).isZero();
  }

  @Test
  void unknownSignatureIsNotThrottled() {
    assertThat(registry.isThrottled(CandidateSignature.of("other", 1L), NOW, BACKOFF)).isFalse();
  }

  @Test
  void sentinelIsNeverRecordedNorThrottled() {
    registry.recordAttempt(CandidateSignature.SENTINEL);

    assertThat(registry.size()).isZero();
    assertThat(registry.isThrottled(CandidateSignature.of(null, 3L), NOW, BACKOFF)).isFalse();
  }

  @Test
  void signaturesAreTrackedIndependently() {
    registry.recordAttempt(signature);

    assertThat(registry.isThrottled(CandidateSignature.of("acct", 8L), NOW, BACKOFF)).isFalse();
    assertThat(registry.isThrottled(signature, NOW, BACKOFF)).isTrue();
  }
}
