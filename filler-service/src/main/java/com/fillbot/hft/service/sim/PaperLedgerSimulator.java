package com.fillbot.hft.service.sim;

import com.fillbot.hft.account.AccountDirectory;
import com.fillbot.hft.account.FillMetadata;
import com.fillbot.hft.account.UserAccount;
import com.fillbot.hft.account.UserStats;
import com.fillbot.hft.book.OrderBook;
import com.fillbot.hft.book.OrderBookLoader;
import com.fillbot.hft.domain.CandidateSignature;
import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.domain.Order;
import com.fillbot.hft.domain.OrderDirection;
import com.fillbot.hft.domain.OrderNode;
import com.fillbot.hft.domain.OrderRecord;
import com.fillbot.hft.ledger.ComputeBudgetOperations;
import com.fillbot.hft.ledger.FillExecutionClient;
import com.fillbot.hft.ledger.FillOperation;
import com.fillbot.hft.ledger.OutcomeRecord;
import com.fillbot.hft.ledger.TransportException;
import com.fillbot.hft.market.MarketDataProvider;
import com.fillbot.hft.market.OraclePrice;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.IntStream;

/**
 * A paper ledger for local runs: plays the exchange (order book, AMM quotes, accounts) and the node
 * (submission, confirmed logs) in memory.
 * <p>
 * Confirmed logs follow the exchange program's format, so the filler's log reconciliation runs
 * unchanged: one {@code Instruction: FillOrder} line per fill followed by its result line. A lone fill
 * on a missing order fails preflight the way a live node reports it.
 */
@Component
@ConditionalOnProperty(prefix = "filler.sim", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PaperLedgerSimulator implements OrderBookLoader, MarketDataProvider, AccountDirectory, FillExecutionClient {

  public static final String EXCHANGE_PROGRAM_ID = "SimExchange1111111111111111111111111111111111";
  static final String STATE_ACCOUNT = "SimState111111111111111111111111111111111111";
  static final String FILL_ORDER_LOG = "Program log: Instruction: FillOrder";
  static final String ORDER_MISSING_LOG = "Program log: Order does not exist";
  static final String AMM_REJECT_LOG = "Program log: Amm cant fulfill order";

  private static final long FILL_ORDER_DISCRIMINATOR = 0x7b4e1d2a9c3f5e61L;
  private static final int FILL_EVENT_BYTES = 48;

  private final @NonNull SimulationProperties sim;
  private final @NonNull Clock clock;

  private final Map<String, OrderNode> openOrders = new LinkedHashMap<>();
  private final ConcurrentMap<String, UserAccount> users = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, UserStats> stats = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, OutcomeRecord> outcomes = new ConcurrentHashMap<>();
  private final AtomicLong nextOrderId = new AtomicLong(1);
  private final AtomicLong slot = new AtomicLong(1);
  private final AtomicLong txCounter = new AtomicLong();
  private final AtomicLong fills = new AtomicLong();
  private volatile boolean seeded;

  // ---- account directory ----

  @Override
  public void loadAll() {
    if (!seeded) {
      seeded = true;
      for (int i = 0; i < sim.seedOrders(); i++) {
        placeOrder("seed-" + i, null, i % sim.marketCount(), i % 2 == 0 ? OrderDirection.LONG : OrderDirection.SHORT,
            null, BigDecimal.ONE);
      }
    }
    log.info("paper ledger loaded (users={}, stats={}, openOrders={}, markets={}, ammRejects={})",
        users.size(), stats.size(), openOrderCount(), sim.marketCount(), sim.ammRejects());
  }

  @Override
  public synchronized void updateWithOrder(OrderRecord record) {
    users.putIfAbsent(record.accountRef(), new UserAccount(record.accountRef(), record.authority()));
    openOrders.putIfAbsent(CandidateSignature.of(record.accountRef(), record.order().orderId()).value(),
        new OrderNode(record.accountRef(), record.order()));
  }

  @Override
  public UserAccount mustGetUser(String accountRef) {
    UserAccount user = users.get(accountRef);
    if (user == null) {
      throw new IllegalStateException("user account " + accountRef + " does not exist");
    }
    return user;
  }

  @Override
  public UserAccount mustGetUserByAuthority(String authority) {
    return users.values().stream()
        .filter(user -> user.authority().equals(authority))
        .findFirst()
        .orElseGet(() -> users.computeIfAbsent("user-" + authority, ref -> new UserAccount(ref, authority)));
  }

  @Override
  public UserStats mustGetStats(String authority) {
    return stats.computeIfAbsent(authority, a -> new UserStats("stats-" + a, null));
  }

  /**
   * Places an order as a user would. {@code price} null places a market order.
   *
   * @return the order record a ledger subscriber would receive
   */
  public synchronized OrderRecord placeOrder(@NonNull String accountRef, String authority, int marketIndex,
                                             @NonNull OrderDirection direction, BigDecimal price,
                                             @NonNull BigDecimal baseAssetAmount) {
    if (marketIndex < 0 || marketIndex >= sim.marketCount()) {
      throw new IllegalArgumentException("unknown market " + marketIndex);
    }
    if (baseAssetAmount.signum() <= 0) {
      throw new IllegalArgumentException("baseAssetAmount must be > 0");
    }
    String owner = authority == null || authority.isBlank() ? "auth-" + accountRef : authority;
    Order order = new Order(nextOrderId.getAndIncrement(), marketIndex, direction, price, baseAssetAmount, slot.get());
    OrderRecord record = new OrderRecord(accountRef, owner, order);
    updateWithOrder(record);
    mustGetStats(owner);
    log.info("paper order placed (account={}, orderId={}, mktIdx={}, dir={}, price={}, size={})",
        accountRef, order.orderId(), marketIndex, direction, price == null ? "market" : price, baseAssetAmount);
    return record;
  }

  public synchronized int openOrderCount() {
    return openOrders.size();
  }

  public synchronized boolean isOpen(CandidateSignature signature) {
    return openOrders.containsKey(signature.value());
  }

  public long fillCount() {
    return fills.get();
  }

  // ---- order book ----

  @Override
  public synchronized OrderBook load() {
    return new PaperOrderBook(new ArrayList<>(openOrders.values()));
  }

  // ---- market data ----

  @Override
  public List<Integer> marketIndexes() {
    return IntStream.range(0, sim.marketCount()).boxed().toList();
  }

  @Override
  public long currentSlot() {
    return slot.get();
  }

  @Override
  public OraclePrice oraclePrice(int marketIndex) {
    BigDecimal confidence = sim.markPrice().movePointLeft(4);
    return new OraclePrice(sim.markPrice(), confidence, slot.get());
  }

  @Override
  public boolean isOraclePriceValid(int marketIndex, OraclePrice oraclePrice, long slot) {
    return oraclePrice != null && oraclePrice.slot() <= slot;
  }

  @Override
  public BigDecimal bestBid(int marketIndex, OraclePrice oraclePrice) {
    return sim.markPrice().subtract(halfSpread());
  }

  @Override
  public BigDecimal bestAsk(int marketIndex, OraclePrice oraclePrice) {
    return sim.markPrice().add(halfSpread());
  }

  @Override
  public boolean isFillableByAmm(Order order, OraclePrice oraclePrice, long slot) {
    return PaperOrderBook.crossesAmm(order, bestBid(order.marketIndex(), oraclePrice), bestAsk(order.marketIndex(), oraclePrice));
  }

  // ---- execution ----

  @Override
  public String submitterIdentity() {
    return sim.feePayer();
  }

  /**
   * Accounts: state, filler, taker, taker stats, then maker and maker stats, then referrer and
   * referrer stats when present. Data: discriminator, taker order id, maker flag, maker order id.
   */
  @Override
  public FillOperation buildFillOperation(FillCandidate candidate, FillMetadata metadata) {
    List<String> accounts = new ArrayList<>();
    accounts.add(STATE_ACCOUNT);
    accounts.add(sim.feePayer());
    accounts.add(metadata.taker().publicKey());
    accounts.add(mustGetStats(metadata.taker().authority()).statsAccount());
    if (metadata.makerInfo() != null) {
      accounts.add(metadata.makerInfo().maker());
      accounts.add(metadata.makerInfo().makerStats());
    }
    if (metadata.referrerInfo() != null) {
      accounts.add(metadata.referrerInfo().referrer());
      accounts.add(metadata.referrerInfo().referrerStats());
    }

    ByteBuffer data = ByteBuffer.allocate(17).order(ByteOrder.LITTLE_ENDIAN);
    data.putLong(FILL_ORDER_DISCRIMINATOR);
    data.putInt((int) candidate.order().orderId());
    data.put((byte) (metadata.makerInfo() == null ? 0 : 1));
    data.putInt(metadata.makerInfo() == null ? 0 : (int) metadata.makerInfo().order().orderId());
    return new FillOperation(EXCHANGE_PROGRAM_ID, accounts, data.array());
  }

  @Override
  public synchronized String submit(List<FillOperation> operations) throws TransportException {
    List<String> logs = new ArrayList<>();
    List<FillOperation> fillOps = new ArrayList<>();
    for (FillOperation op : operations) {
      if (ComputeBudgetOperations.PROGRAM_ID.equals(op.programId())) {
        logs.add("Program " + op.programId() + " invoke [1]");
        logs.add("Program " + op.programId() + " success");
      } else if (EXCHANGE_PROGRAM_ID.equals(op.programId())) {
        fillOps.add(op);
      } else {
        throw new TransportException("unknown program " + op.programId());
      }
    }

    if (fillOps.size() == 1 && operations.size() == 1 && !openOrders.containsKey(takerSignature(fillOps.get(0)).value())) {
      List<String> preflight = List.of(
          "Program " + EXCHANGE_PROGRAM_ID + " invoke [1]",
          FILL_ORDER_LOG,
          ORDER_MISSING_LOG,
          "Program " + EXCHANGE_PROGRAM_ID + " failed: custom program error: 0x1773");
      throw TransportException.from("Transaction simulation failed: Error processing Instruction 0", preflight,
          "OrderDoesNotExist", null);
    }

    for (FillOperation op : fillOps) {
      logs.add("Program " + EXCHANGE_PROGRAM_ID + " invoke [1]");
      logs.add(FILL_ORDER_LOG);
      logs.add(execute(op));
      logs.add("Program " + EXCHANGE_PROGRAM_ID + " success");
    }

    long txSlot = slot.incrementAndGet();
    String signature = "simtx" + Long.toString(txCounter.incrementAndGet(), 36) + Long.toString(clock.millis(), 36);
    outcomes.put(signature, new OutcomeRecord(signature, txSlot, logs));
    return signature;
  }

  @Override
  public Optional<OutcomeRecord> fetchOutcome(String submissionId) {
    return Optional.ofNullable(outcomes.get(submissionId));
  }

  private String execute(FillOperation op) {
    CandidateSignature taker = takerSignature(op);
    OrderNode takerNode = openOrders.get(taker.value());
    if (takerNode == null) {
      return ORDER_MISSING_LOG;
    }
    ByteBuffer data = ByteBuffer.wrap(op.data()).order(ByteOrder.LITTLE_ENDIAN);
    data.position(12);
    boolean hasMaker = data.get() == 1;
    if (hasMaker) {
      CandidateSignature maker = CandidateSignature.of(op.accounts().get(4), Integer.toUnsignedLong(data.getInt()));
      if (openOrders.remove(maker.value()) == null) {
        return ORDER_MISSING_LOG;
      }
    } else if (sim.ammRejects()) {
      return AMM_REJECT_LOG;
    }
    openOrders.remove(taker.value());
    fills.incrementAndGet();
    return "Program data: " + Base64.getEncoder().encodeToString(fillEvent(takerNode.order()));
  }

  private static CandidateSignature takerSignature(FillOperation op) {
    ByteBuffer data = ByteBuffer.wrap(op.data()).order(ByteOrder.LITTLE_ENDIAN);
    data.position(8);
    return CandidateSignature.of(op.accounts().get(2), Integer.toUnsignedLong(data.getInt()));
  }

  private byte[] fillEvent(Order order) {
    ByteBuffer event = ByteBuffer.allocate(FILL_EVENT_BYTES).order(ByteOrder.LITTLE_ENDIAN);
    event.putLong(slot.get());
    event.putLong(order.orderId());
    event.putInt(order.marketIndex());
    event.putInt(order.direction().ordinal());
    event.putLong(order.baseAssetAmount().movePointRight(9).longValue());
    event.putLong(sim.markPrice().movePointRight(6).longValue());
    event.putLong(clock.millis());
    return event.array();
  }

  private BigDecimal halfSpread() {
    return sim.markPrice().multiply(BigDecimal.valueOf(sim.halfSpreadBps()))
        .divide(BigDecimal.valueOf(10_000), 8, RoundingMode.HALF_UP);
  }
}
