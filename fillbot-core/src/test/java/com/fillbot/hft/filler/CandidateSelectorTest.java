package com.fillbot.hft.filler;

import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.domain.OrderNode;
import com.fillbot.hft.filler.gate.SnapshotGate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateSelectorTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
  private static final Duration BACKOFF = Duration.ofSeconds(2);

  private final Clock clock = Clock.fixed(NOW, ZoneId.of("UTC"));
  private final ThrottleRegistry throttles = new ThrottleRegistry(clock);
  private FakeOrderBook book;
  private OrderBookHandle handle;

  @BeforeEach
  void setUp() {
    book = new FakeOrderBook();
    handle = new OrderBookHandle(new SnapshotGate(Duration.ofSeconds(1)));
    handle.rebuild(() -> book);
  }

  @Test
  void shouldKeepOnlyEligibleCandidatesInBookOrder() {
    // Given
    FillCandidate plain = Candidates.againstAmm("a", 1);
    FillCandidate ammNode = new FillCandidate(new OrderNode("amm", Candidates.order(2, 0)), null, true, false);
    FillCandidate filled = new FillCandidate(new OrderNode("b", Candidates.order(3, 0)), null, false, true);
    FillCandidate throttled = Candidates.againstAmm("c", 4);
    FillCandidate withMaker = Candidates.againstMaker("d", 5, "m", 50);
    book.with(plain, ammNode, filled, throttled, withMaker);
    throttles.recordAttempt(throttled.signature());

    // When
    List<FillCandidate> selected = selector(new StubMarketData(0)).select().toList();

    // Then
    assertThat(selected).containsExactly(plain, withMaker);
  }

  @Test
  void shouldRequireAmmFillabilityOnlyWithoutMaker() {
    FillCandidate ammOnly = Candidates.againstAmm("a", 1);
    FillCandidate withMaker = Candidates.againstMaker("b", 2, "m", 20);
    book.with(ammOnly, withMaker);

    List<FillCandidate> selected = selector(new StubMarketData(0).fillableByAmm(false)).select().toList();

    assertThat(selected).containsExactly(withMaker);
  }

  @Test
  void shouldReadmitCandidateOnceBackoffHasElapsed() {
    FillCandidate candidate = Candidates.againstAmm("a", 1);
    book.with(candidate);
    ThrottleRegistry earlier = new ThrottleRegistry(Clock.fixed(NOW.minus(BACKOFF), ZoneId.of("UTC")));
    earlier.recordAttempt(candidate.signature());

    CandidateSelector selector = new CandidateSelector(new StubMarketData(0), handle, earlier, clock, BACKOFF);

    assertThat(selector.select().toList()).containsExactly(candidate);
    assertThat(earlier.size()).isZero();
  }

  @Test
  void shouldIterateMarketsInProviderOrder() {
    FillCandidate onTwo = Candidates.againstAmm("a", 1, 2);
    FillCandidate onZero = Candidates.againstAmm("b", 2, 0);
    book.with(onTwo, onZero);

    List<FillCandidate> selected = selector(new StubMarketData(2, 1, 0)).select().toList();

    assertThat(selected).containsExactly(onTwo, onZero);
    assertThat(book.queriedMarkets()).containsExactly(2, 1, 0);
  }

  @Test
  void shouldQueryLaterMarketsOnlyWhenConsumed() {
    book.with(Candidates.againstAmm("a", 1, 0), Candidates.againstAmm("b", 2, 1));

    Optional<FillCandidate> first = selector(new StubMarketData(0, 1, 2)).select().findFirst();

    assertThat(first).isPresent();
    assertThat(book.queriedMarkets()).containsExactly(0);
  }

  @Test
  void shouldMatchWithoutOracleWhenOracleIsInvalid() {
    book.with(Candidates.againstAmm("a", 1));

    List<FillCandidate> selected = selector(new StubMarketData(0).oracleValid(false)).select().toList();

    assertThat(selected).hasSize(1);
    assertThat(book.oraclePricesSeen()).singleElement().satisfies(p -> assertThat(p.slot()).isEqualTo(-1L));
  }

  private CandidateSelector selector(StubMarketData marketData) {
    return new CandidateSelector(marketData, handle, throttles, clock, BACKOFF);
  }
}
