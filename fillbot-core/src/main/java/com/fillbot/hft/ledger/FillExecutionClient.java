package com.fillbot.hft.ledger;

import com.fillbot.hft.account.FillMetadata;
import com.fillbot.hft.domain.FillCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Exchange client that turns candidates into ledger operations and submits them.
 */
public interface FillExecutionClient {

  /**
   * Public key of the fee payer signing every submission.
   */
  String submitterIdentity();

  FillOperation buildFillOperation(FillCandidate candidate, FillMetadata metadata);

  /**
   * Sends all operations in one atomic transaction.
   *
   * @return the submission id (transaction signature)
   */
  String submit(List<FillOperation> operations) throws TransportException;

  /**
   * @return the confirmed outcome, or empty while the submission is not yet visible
   */
  Optional<OutcomeRecord> fetchOutcome(String submissionId) throws TransportException;
}
