package com.fillbot.hft.filler;

import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.market.MarketDataProvider;
import com.fillbot.hft.market.OraclePrice;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

/**
 * Builds the per-cycle sequence of fillable candidates across all markets.
 */
@Slf4j
@RequiredArgsConstructor
public class CandidateSelector {

  private final @NonNull MarketDataProvider marketData;
  private final @NonNull OrderBookHandle orderBook;
  private final @NonNull ThrottleRegistry throttles;
  private final @NonNull Clock clock;
  private final @NonNull Duration fillBackoff;

  /**
   * Lazy and single-use: markets are queried only as the stream is consumed, so a caller that stops
   * early never touches the remaining markets.
   */
  public Stream<FillCandidate> select() {
    return marketData.marketIndexes().stream()
        .flatMap(marketIndex -> fillableNodes(marketIndex).stream())
        .filter(this::isEligible);
  }

  List<FillCandidate> fillableNodes(int marketIndex) {
    OraclePrice oraclePrice = marketData.oraclePrice(marketIndex);
    long slot = marketData.currentSlot();
    boolean oracleValid = marketData.isOraclePriceValid(marketIndex, oraclePrice, slot);
    BigDecimal bid = marketData.bestBid(marketIndex, oraclePrice);
    BigDecimal ask = marketData.bestAsk(marketIndex, oraclePrice);

    List<FillCandidate> nodes = orderBook.read(book ->
        book.findNodesToFill(marketIndex, bid, ask, slot, oracleValid ? oraclePrice : null));
    if (!oracleValid) {
      log.debug("oracle invalid for mktIdx {} at slot {}, matching without oracle price", marketIndex, slot);
    }
    return nodes;
  }

  boolean isEligible(FillCandidate candidate) {
    if (candidate.isAmmNode()) {
      return false;
    }
    if (candidate.isFilled()) {
      return false;
    }
    if (throttles.isThrottled(candidate.signature(), clock.instant(), fillBackoff)) {
      return false;
    }
    if (!candidate.hasMaker()) {
      OraclePrice oraclePrice = marketData.oraclePrice(candidate.marketIndex());
      return marketData.isFillableByAmm(candidate.order(), oraclePrice, marketData.currentSlot());
    }
    return true;
  }
}
