package com.fillbot.hft.service.rpc;

import com.fillbot.hft.account.FillMetadata;
import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.ledger.FillExecutionClient;
import com.fillbot.hft.ledger.FillOperation;
import com.fillbot.hft.ledger.OutcomeRecord;
import com.fillbot.hft.ledger.TransportException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class RpcFillExecutionClient implements FillExecutionClient {

  private final @NonNull LedgerRpcClient rpcClient;
  private final @NonNull FillInstructionFactory instructionFactory;
  private final @NonNull TransactionAssembler assembler;

  @Override
  public String submitterIdentity() {
    return assembler.feePayer();
  }

  @Override
  public FillOperation buildFillOperation(FillCandidate candidate, FillMetadata metadata) {
    return instructionFactory.fillOrder(candidate, metadata);
  }

  @Override
  public String submit(List<FillOperation> operations) throws TransportException {
    String signed = assembler.assembleAndSign(operations);
    String signature = rpcClient.sendTransaction(signed);
    log.debug("submitted {} operations as {}", operations.size(), signature);
    return signature;
  }

  @Override
  public Optional<OutcomeRecord> fetchOutcome(String submissionId) throws TransportException {
    return rpcClient.getTransaction(submissionId);
  }
}
