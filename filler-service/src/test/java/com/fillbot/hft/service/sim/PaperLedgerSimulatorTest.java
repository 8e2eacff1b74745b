package com.fillbot.hft.service.sim;

import com.fillbot.hft.account.FillMetadata;
import com.fillbot.hft.account.UserAccount;
import com.fillbot.hft.config.FillerProperties;
import com.fillbot.hft.domain.CandidateSignature;
import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.domain.Order;
import com.fillbot.hft.domain.OrderDirection;
import com.fillbot.hft.domain.OrderNode;
import com.fillbot.hft.domain.OrderRecord;
import com.fillbot.hft.filler.FillCycleResult;
import com.fillbot.hft.filler.FillerBot;
import com.fillbot.hft.filler.FillerEvent;
import com.fillbot.hft.filler.FillerObserver;
import com.fillbot.hft.filler.submit.SubmissionResult;
import com.fillbot.hft.ledger.ComputeBudgetOperations;
import com.fillbot.hft.ledger.FillOperation;
import com.fillbot.hft.ledger.OutcomeRecord;
import com.fillbot.hft.ledger.StaleOrderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaperLedgerSimulatorTest {

  private final Clock clock = Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneId.of("UTC"));
  private FillerBot bot;

  @AfterEach
  void tearDown() {
    if (bot != null) {
      bot.close();
    }
  }

  @Test
  void shouldFillCrossingOrdersAgainstTheAmm() {
    // Given: ask 100.10, bid 99.90
    PaperLedgerSimulator sim = simulator(false);
    sim.placeOrder("alice", null, 0, OrderDirection.LONG, null, BigDecimal.ONE);
    sim.placeOrder("bob", null, 1, OrderDirection.SHORT, BigDecimal.valueOf(99), BigDecimal.TEN);
    sim.placeOrder("carol", null, 1, OrderDirection.LONG, BigDecimal.valueOf(50), BigDecimal.ONE);
    bot = bot(sim, FillerProperties.FillMode.BULK);
    bot.init();

    // When
    FillCycleResult result = bot.runCycle();

    // Then
    assertThat(result.status()).isEqualTo(FillCycleResult.CycleStatus.COMPLETED);
    assertThat(result.submission().status()).isEqualTo(SubmissionResult.Status.CONFIRMED);
    assertThat(result.submission().reconciliation().succeeded()).isEqualTo(2);
    assertThat(sim.fillCount()).isEqualTo(2);
    assertThat(sim.openOrderCount()).isEqualTo(1);

    FillCycleResult next = bot.runCycle();
    assertThat(next.submission().status()).isEqualTo(SubmissionResult.Status.EMPTY);
  }

  @Test
  void shouldPairTakerWithRestingMaker() {
    PaperLedgerSimulator sim = simulator(false);
    sim.placeOrder("maker", null, 0, OrderDirection.SHORT, BigDecimal.valueOf(100), BigDecimal.ONE);
    sim.placeOrder("taker", null, 0, OrderDirection.LONG, BigDecimal.valueOf(100.05), BigDecimal.ONE);
    bot = bot(sim, FillerProperties.FillMode.BULK);

    FillCycleResult result = bot.runCycle();

    assertThat(result.submission().reconciliation().succeeded()).isEqualTo(1);
    assertThat(sim.openOrderCount()).isZero();
  }

  @Test
  void shouldThrottleFillsTheAmmRejects() {
    PaperLedgerSimulator sim = simulator(true);
    OrderRecord record = sim.placeOrder("alice", null, 0, OrderDirection.LONG, null, BigDecimal.ONE);
    bot = bot(sim, FillerProperties.FillMode.BULK);

    FillCycleResult result = bot.runCycle();

    assertThat(result.submission().reconciliation().rejected()).isEqualTo(1);
    CandidateSignature signature = CandidateSignature.of("alice", record.order().orderId());
    assertThat(bot.throttles().lastAttempt(signature)).isPresent();
    assertThat(sim.isOpen(signature)).isTrue();
  }

  @Test
  void shouldFillNewOrderFromEvent() {
    PaperLedgerSimulator sim = simulator(false);
    bot = bot(sim, FillerProperties.FillMode.SINGLE);
    OrderRecord record = sim.placeOrder("dave", "dave-wallet", 2, OrderDirection.SHORT, null, BigDecimal.ONE);

    FillCycleResult result = bot.trigger(new FillerEvent.OrderCreated(record)).orElseThrow();

    assertThat(result.submission().status()).isEqualTo(SubmissionResult.Status.SENT);
    assertThat(sim.openOrderCount()).isZero();
    assertThat(sim.mustGetUser("dave").authority()).isEqualTo("dave-wallet");
  }

  @Test
  void shouldLoadUserAndStatsForNewAccountEvent() {
    PaperLedgerSimulator sim = simulator(false);
    sim.placeOrder("erin", "erin-wallet", 0, OrderDirection.LONG, null, BigDecimal.ONE);
    bot = bot(sim, FillerProperties.FillMode.BULK);

    assertThat(bot.trigger(new FillerEvent.AccountCreated("erin-wallet"))).isEmpty();
    assertThat(bot.trigger(new FillerEvent.AccountCreated("frank-wallet"))).isEmpty();

    assertThat(sim.mustGetUserByAuthority("erin-wallet").publicKey()).isEqualTo("erin");
    assertThat(sim.mustGetUser("user-frank-wallet").authority()).isEqualTo("frank-wallet");
    assertThat(sim.mustGetStats("frank-wallet").statsAccount()).isEqualTo("stats-frank-wallet");
  }

  @Test
  void shouldReportMissingOrderInBatchedLog() throws Exception {
    PaperLedgerSimulator sim = simulator(false);
    FillOperation ghost = sim.buildFillOperation(ghostCandidate(), ghostMetadata());

    String signature = sim.submit(List.of(ComputeBudgetOperations.requestUnits(4_000_000, 0), ghost));

    OutcomeRecord outcome = sim.fetchOutcome(signature).orElseThrow();
    assertThat(outcome.logMessages())
        .containsSubsequence(PaperLedgerSimulator.FILL_ORDER_LOG, PaperLedgerSimulator.ORDER_MISSING_LOG);
  }

  @Test
  void shouldFailPreflightForLoneFillOnMissingOrder() {
    PaperLedgerSimulator sim = simulator(false);
    FillOperation ghost = sim.buildFillOperation(ghostCandidate(), ghostMetadata());

    assertThatThrownBy(() -> sim.submit(List.of(ghost)))
        .isInstanceOf(StaleOrderException.class)
        .satisfies(e -> assertThat(((StaleOrderException) e).errorCode()).isEqualTo("OrderDoesNotExist"));
  }

  @Test
  void shouldSeedOrdersOnLoad() {
    PaperLedgerSimulator sim = new PaperLedgerSimulator(
        new SimulationProperties(true, 2, BigDecimal.valueOf(100), 10, false, null, 4), clock);

    sim.loadAll();
    sim.loadAll();

    assertThat(sim.openOrderCount()).isEqualTo(4);
  }

  @Test
  void shouldRejectUnknownMarket() {
    PaperLedgerSimulator sim = simulator(false);

    assertThatThrownBy(() -> sim.placeOrder("x", null, 7, OrderDirection.LONG, null, BigDecimal.ONE))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private PaperLedgerSimulator simulator(boolean ammRejects) {
    return new PaperLedgerSimulator(
        new SimulationProperties(true, 3, BigDecimal.valueOf(100), 10, ammRejects, null, 0), clock);
  }

  private FillerBot bot(PaperLedgerSimulator sim, FillerProperties.FillMode mode) {
    FillerProperties properties = new FillerProperties("paper", false, mode, 1_000L, 5_000L, 1_000L, 5_000L,
        1_000, 4_000_000, 0, 3, 0L, 50);
    return new FillerBot(properties, sim, sim, sim, sim, FillerObserver.noop(), clock);
  }

  private static FillCandidate ghostCandidate() {
    return FillCandidate.againstAmm(new OrderNode("ghost",
        new Order(999L, 0, OrderDirection.LONG, null, BigDecimal.ONE, 1L)));
  }

  private static FillMetadata ghostMetadata() {
    return new FillMetadata(null, new UserAccount("ghost", "auth-ghost"), null);
  }
}
