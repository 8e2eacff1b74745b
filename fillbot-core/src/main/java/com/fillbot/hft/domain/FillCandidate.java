package com.fillbot.hft.domain;

import lombok.NonNull;

import java.util.Optional;

/**
 * A taker order the order book judged matchable, optionally paired with a resting maker order.
 * <p>
 * The {@code filled} flag belongs to the order book; the filler only clears it again after a failed
 * single fill so the order becomes eligible on the next cycle.
 */
public final class FillCandidate {

  private final OrderNode node;
  private final OrderNode makerNode;
  private final boolean ammNode;
  private volatile boolean filled;

  public FillCandidate(@NonNull OrderNode node, OrderNode makerNode, boolean ammNode, boolean filled) {
    this.node = node;
    this.makerNode = makerNode;
    this.ammNode = ammNode;
    this.filled = filled;
  }

  public static FillCandidate againstAmm(OrderNode node) {
    return new FillCandidate(node, null, false, false);
  }

  public static FillCandidate againstMaker(OrderNode node, OrderNode makerNode) {
    return new FillCandidate(node, makerNode, false, false);
  }

  public OrderNode node() {
    return node;
  }

  public Optional<OrderNode> makerNode() {
    return Optional.ofNullable(makerNode);
  }

  public boolean hasMaker() {
    return makerNode != null;
  }

  /**
   * True when the taker side itself is the automated market maker's synthetic node.
   */
  public boolean isAmmNode() {
    return ammNode;
  }

  public boolean isFilled() {
    return filled;
  }

  public void markUnfilled() {
    this.filled = false;
  }

  public String accountRef() {
    return node.accountRef();
  }

  public Order order() {
    return node.order();
  }

  public int marketIndex() {
    return node.order().marketIndex();
  }

  public CandidateSignature signature() {
    return CandidateSignature.of(node.accountRef(), node.order().orderId());
  }

  @Override
  public String toString() {
    return "FillCandidate{" + signature() + ", market=" + marketIndex() + ", maker=" +
        (makerNode == null ? "amm" : CandidateSignature.of(makerNode.accountRef(), makerNode.order().orderId())) + "}";
  }
}
