package com.fillbot.hft.filler.pack;

import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.ledger.FillOperation;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Candidates accepted into one transaction, in acceptance order, with the running size estimate.
 * {@link #sizeBytes()} stays strictly below {@link #maxBytes()} after every accepted candidate.
 */
public final class PendingBatch {

  private final int maxBytes;
  private final FillOperation preamble;
  private final List<FillCandidate> candidates = new ArrayList<>();
  private final List<FillOperation> fillOperations = new ArrayList<>();
  private final Set<String> references = new LinkedHashSet<>();
  private int sizeBytes;
  private int candidatesOffered;

  private PendingBatch(String feePayer, FillOperation preamble, int maxBytes) {
    this.maxBytes = maxBytes;
    this.preamble = preamble;
    references.add(feePayer);
    references.addAll(preamble.accounts());
    references.add(preamble.programId());
    this.sizeBytes = TransactionSizeEstimator.envelopeSize(references.size(), preamble);
  }

  /**
   * Empty batch holding only the envelope: fee payer signature, header, account table and preamble.
   */
  public static PendingBatch open(@NonNull String feePayer, @NonNull FillOperation preamble, int maxBytes) {
    return new PendingBatch(feePayer, preamble, maxBytes);
  }

  /**
   * Adds the operation when it fits, i.e. when the resulting size stays strictly below the budget.
   *
   * @return false, leaving the batch unchanged, when it does not fit
   */
  boolean tryAccept(@NonNull FillCandidate candidate, @NonNull FillOperation operation) {
    candidatesOffered++;
    Set<String> newReferences = new LinkedHashSet<>();
    for (String account : operation.accounts()) {
      if (!references.contains(account)) {
        newReferences.add(account);
      }
    }
    if (!references.contains(operation.programId())) {
      newReferences.add(operation.programId());
    }

    int operationCost = TransactionSizeEstimator.operationSize(operation);
    int referencesCost = TransactionSizeEstimator.additionalAccountsSize(newReferences.size());
    if (sizeBytes + operationCost + referencesCost >= maxBytes) {
      return false;
    }

    candidates.add(candidate);
    fillOperations.add(operation);
    references.addAll(newReferences);
    sizeBytes += operationCost + referencesCost;
    return true;
  }

  /**
   * Preamble followed by the fill operations in acceptance order.
   */
  public List<FillOperation> operations() {
    List<FillOperation> all = new ArrayList<>(fillOperations.size() + 1);
    all.add(preamble);
    all.addAll(fillOperations);
    return Collections.unmodifiableList(all);
  }

  public List<FillCandidate> candidates() {
    return Collections.unmodifiableList(candidates);
  }

  public boolean isEmpty() {
    return candidates.isEmpty();
  }

  public int size() {
    return candidates.size();
  }

  public int sizeBytes() {
    return sizeBytes;
  }

  public int maxBytes() {
    return maxBytes;
  }

  public int uniqueReferenceCount() {
    return references.size();
  }

  /**
   * Candidates offered to the batch, including the one that did not fit.
   */
  public int candidatesOffered() {
    return candidatesOffered;
  }
}
