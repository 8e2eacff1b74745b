package com.fillbot.hft.filler;

import com.fillbot.hft.account.AccountDirectory;
import com.fillbot.hft.account.FillMetadataResolver;
import com.fillbot.hft.account.UserAccount;
import com.fillbot.hft.book.OrderBook;
import com.fillbot.hft.book.OrderBookLoader;
import com.fillbot.hft.config.FillerProperties;
import com.fillbot.hft.domain.CandidateSignature;
import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.filler.gate.CycleGate;
import com.fillbot.hft.filler.gate.GateBusyException;
import com.fillbot.hft.filler.gate.GateTimeoutException;
import com.fillbot.hft.filler.gate.SnapshotGate;
import com.fillbot.hft.filler.pack.BatchPacker;
import com.fillbot.hft.filler.pack.PendingBatch;
import com.fillbot.hft.filler.submit.BatchSubmitter;
import com.fillbot.hft.filler.submit.OutcomeReconciler;
import com.fillbot.hft.filler.submit.SingleFillExecutor;
import com.fillbot.hft.filler.submit.SubmissionResult;
import com.fillbot.hft.ledger.FillExecutionClient;
import com.fillbot.hft.market.MarketDataProvider;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Owns all filler state (gates, snapshot, throttles) and runs the fill cycle:
 * rebuild snapshot, select candidates, pack one transaction, submit, reconcile.
 * <p>
 * Timer ticks and ledger events funnel into {@link #runCycle()}; a trigger arriving while a cycle is in
 * flight is dropped, never queued.
 */
@Slf4j
public class FillerBot implements AutoCloseable {

  private final FillerProperties properties;
  private final OrderBookLoader orderBookLoader;
  private final AccountDirectory accounts;
  private final FillerObserver observer;

  private final CycleGate cycleGate = new CycleGate();
  private final OrderBookHandle orderBook;
  private final ThrottleRegistry throttles;
  private final CandidateSelector selector;
  private final BatchPacker packer;
  private final BatchSubmitter submitter;
  private final SingleFillExecutor singleFill;
  private final ExecutorService cycleExecutor;

  public FillerBot(
      @NonNull FillerProperties properties,
      @NonNull OrderBookLoader orderBookLoader,
      @NonNull MarketDataProvider marketData,
      @NonNull AccountDirectory accounts,
      @NonNull FillExecutionClient executionClient,
      @NonNull FillerObserver observer,
      @NonNull Clock clock
  ) {
    this.properties = properties;
    this.orderBookLoader = orderBookLoader;
    this.accounts = accounts;
    this.observer = observer;

    String name = properties.name();
    FillMetadataResolver metadataResolver = new FillMetadataResolver(accounts);
    this.orderBook = new OrderBookHandle(new SnapshotGate(properties.snapshotLockTimeout()));
    this.throttles = new ThrottleRegistry(clock);
    this.selector = new CandidateSelector(marketData, orderBook, throttles, clock, properties.fillBackoff());
    this.packer = new BatchPacker(executionClient, metadataResolver,
        properties.maxTxBytes(), properties.computeUnits(), properties.computeUnitFee());
    OutcomeReconciler reconciler = new OutcomeReconciler(orderBook, throttles, observer, properties.successLogMinLength());
    this.submitter = BatchSubmitter.builder()
        .name(name)
        .executionClient(executionClient)
        .reconciler(reconciler)
        .throttles(throttles)
        .observer(observer)
        .dryRun(properties.dryRun())
        .outcomePollAttempts(properties.outcomePollAttempts())
        .outcomePollIntervalMillis(properties.outcomePollIntervalMillis())
        .build();
    this.singleFill = new SingleFillExecutor(name, executionClient, metadataResolver, throttles, orderBook,
        observer, properties.dryRun());

    AtomicInteger threadCount = new AtomicInteger();
    this.cycleExecutor = Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, name + "-cycle-" + threadCount.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  public String name() {
    return properties.name();
  }

  public void init() {
    log.info("{} initing", name());
    accounts.loadAll();
    log.info("{} init done", name());
  }

  /**
   * Periodic entry point. Safe to call from any thread at any rate.
   *
   * @throws RuntimeException for failures outside the filler's error taxonomy
   */
  public FillCycleResult runCycle() {
    long startMillis = System.currentTimeMillis();
    boolean ran = false;
    try (CycleGate.Lease ignored = cycleGate.tryEnter()) {
      observer.onCycleStart();
      orderBook.rebuild(orderBookLoader);
      FillCycleResult result = fillWithTimeout(selector.select(), startMillis);
      ran = true;
      return result;
    } catch (GateBusyException e) {
      observer.onGateBusy();
      log.debug("{} fill cycle already running, trigger dropped", name());
      return FillCycleResult.busy();
    } catch (GateTimeoutException e) {
      log.error("{} order book lock timeout ({}ms), cycle aborted", name(), e.timeout().toMillis());
      return FillCycleResult.snapshotTimeout();
    } finally {
      if (ran) {
        Duration duration = Duration.ofMillis(System.currentTimeMillis() - startMillis);
        observer.onRpcDuration("tryFill", duration, false);
        observer.onCycleEnd(duration);
        log.info("{} tryFill done, took {}ms", name(), duration.toMillis());
      }
    }
  }

  /**
   * Event entry point. Order events refresh the account directory and run a cycle; account events load
   * the new account.
   *
   * @return the cycle result when the event ran a cycle
   */
  public Optional<FillCycleResult> trigger(@NonNull FillerEvent event) {
    if (event instanceof FillerEvent.OrderCreated created) {
      accounts.updateWithOrder(created.record());
      return Optional.of(runCycle());
    }
    if (event instanceof FillerEvent.AccountCreated created) {
      UserAccount user = accounts.mustGetUserByAuthority(created.authority());
      accounts.mustGetStats(created.authority());
      log.debug("{} loaded new account {} (authority: {})", name(), user.publicKey(), created.authority());
    }
    return Optional.empty();
  }

  /**
   * Fills one externally chosen candidate through the single-operation path.
   */
  public SubmissionResult fillSingle(@NonNull FillCandidate candidate) {
    return singleFill.tryFill(candidate);
  }

  /**
   * First eligible candidate in the current snapshot with the given signature.
   */
  public Optional<FillCandidate> findCandidate(@NonNull CandidateSignature signature) {
    if (orderBook.view().isEmpty()) {
      return Optional.empty();
    }
    return selector.select()
        .filter(c -> c.signature().equals(signature))
        .findFirst();
  }

  /**
   * Read-only view of the latest snapshot, for diagnostics.
   */
  public Optional<OrderBook> viewSnapshot() {
    return orderBook.view();
  }

  public ThrottleRegistry throttles() {
    return throttles;
  }

  public boolean isCycleRunning() {
    return cycleGate.isRunning();
  }

  @Override
  public void close() {
    cycleExecutor.shutdownNow();
  }

  private FillCycleResult fillWithTimeout(Stream<FillCandidate> candidates, long startMillis) {
    Future<FillCycleResult> future = cycleExecutor.submit(() -> fill(candidates));
    try {
      return future.get(properties.cycleTimeoutMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      // the transport may not support cancellation; stop waiting and let it finish on its own
      log.error("{} Timeout tryFill, took {}ms", name(), System.currentTimeMillis() - startMillis);
      return FillCycleResult.timedOut();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      log.warn("{} interrupted while waiting for fill", name());
      return FillCycleResult.timedOut();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("fill cycle failed", cause);
    }
  }

  private FillCycleResult fill(Stream<FillCandidate> candidates) {
    if (properties.mode() == FillerProperties.FillMode.SINGLE) {
      Optional<FillCandidate> first = candidates.findFirst();
      observer.onCandidatesOffered(first.isPresent() ? 1 : 0);
      if (first.isEmpty()) {
        log.info("{} no fillable nodes", name());
        return FillCycleResult.completed(SubmissionResult.empty());
      }
      return FillCycleResult.completed(singleFill.tryFill(first.get()));
    }

    PendingBatch batch = packer.pack(candidates.iterator());
    observer.onCandidatesOffered(batch.candidatesOffered());
    return FillCycleResult.completed(submitter.submit(batch));
  }
}
