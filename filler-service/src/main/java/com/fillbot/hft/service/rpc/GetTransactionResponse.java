package com.fillbot.hft.service.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.web3j.protocol.core.Response;

import java.util.List;

/**
 * {@code getTransaction} result; {@code null} while the transaction is not visible at the requested
 * commitment.
 */
public class GetTransactionResponse extends Response<GetTransactionResponse.ConfirmedTransaction> {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ConfirmedTransaction(Long slot, Meta meta) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Meta(Object err, List<String> logMessages) {
  }
}
