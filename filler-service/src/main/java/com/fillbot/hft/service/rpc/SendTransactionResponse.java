package com.fillbot.hft.service.rpc;

import org.web3j.protocol.core.Response;

/**
 * {@code sendTransaction} result: the transaction signature.
 */
public class SendTransactionResponse extends Response<String> {

  public String getSignature() {
    return getResult();
  }
}
