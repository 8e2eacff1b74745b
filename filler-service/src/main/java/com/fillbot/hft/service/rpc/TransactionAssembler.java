package com.fillbot.hft.service.rpc;

import com.fillbot.hft.ledger.FillOperation;
import com.fillbot.hft.ledger.TransportException;

import java.util.List;

/**
 * Wallet hook: compiles operations into a message with a recent block hash and signs it with the fee
 * payer.
 */
public interface TransactionAssembler {

  String feePayer();

  /**
   * @return base64 wire encoding of the signed transaction
   */
  String assembleAndSign(List<FillOperation> operations) throws TransportException;
}
