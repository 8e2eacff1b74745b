package com.fillbot.hft.service.rpc;

import com.fillbot.hft.account.FillMetadata;
import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.ledger.FillOperation;

/**
 * Exchange SDK hook that encodes the fill instruction for a candidate.
 */
@FunctionalInterface
public interface FillInstructionFactory {

  FillOperation fillOrder(FillCandidate candidate, FillMetadata metadata);
}
