package com.fillbot.hft.filler.submit;

import com.fillbot.hft.filler.FillOutcome;

import java.util.List;
import java.util.Optional;

public record ReconciliationResult(String submissionId, List<FillResultLine> lines) {

  public ReconciliationResult {
    lines = lines == null ? List.of() : List.copyOf(lines);
  }

  public int succeeded() {
    return count(FillOutcome.SUCCEEDED);
  }

  public int staleOrders() {
    return count(FillOutcome.STALE_ORDER);
  }

  public int rejected() {
    return count(FillOutcome.COUNTERPARTY_REJECTED);
  }

  public int unparsed() {
    return count(FillOutcome.UNPARSED);
  }

  /**
   * Outcome attributed to the packed fill at {@code index}, in packing order.
   */
  public Optional<FillOutcome> outcomeAt(int index) {
    return lines.stream()
        .filter(l -> l.index() == index && l.candidate() != null)
        .map(FillResultLine::outcome)
        .findFirst();
  }

  private int count(FillOutcome outcome) {
    return (int) lines.stream().filter(l -> l.outcome() == outcome).count();
  }
}
