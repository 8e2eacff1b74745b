package com.fillbot.hft.service.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fillbot.hft.ledger.OutcomeRecord;
import com.fillbot.hft.ledger.TransportException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal ledger JSON-RPC client over web3j's transport. Only the two calls the filler needs are
 * exposed.
 */
@Slf4j
public class LedgerRpcClient {

  static final String SEND_TRANSACTION = "sendTransaction";
  static final String GET_TRANSACTION = "getTransaction";

  private final Web3jService service;
  private final LedgerRpcProperties properties;
  private final ObjectMapper objectMapper;

  public LedgerRpcClient(@NonNull Web3jService service, @NonNull LedgerRpcProperties properties,
                         @NonNull ObjectMapper objectMapper) {
    this.service = service;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  /**
   * @param signedTransaction base64 wire encoding of a signed transaction
   * @return the transaction signature
   * @throws TransportException when the node rejects the transaction, with its simulation logs when
   *                            preflight ran
   */
  public String sendTransaction(@NonNull String signedTransaction) throws TransportException {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("encoding", "base64");
    config.put("skipPreflight", properties.skipPreflight());
    config.put("preflightCommitment", properties.commitment());

    SendTransactionResponse response = send(SEND_TRANSACTION, List.of(signedTransaction, config),
        SendTransactionResponse.class);
    if (response.hasError()) {
      throw toTransportException(SEND_TRANSACTION, response.getError());
    }
    if (response.getSignature() == null) {
      throw new TransportException(SEND_TRANSACTION + " returned no signature");
    }
    return response.getSignature();
  }

  /**
   * @return the confirmed transaction's log, or empty when the node does not know it yet
   */
  public Optional<OutcomeRecord> getTransaction(@NonNull String signature) throws TransportException {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("commitment", properties.commitment());
    config.put("encoding", "json");
    config.put("maxSupportedTransactionVersion", 0);

    GetTransactionResponse response = send(GET_TRANSACTION, List.of(signature, config), GetTransactionResponse.class);
    if (response.hasError()) {
      throw toTransportException(GET_TRANSACTION, response.getError());
    }
    GetTransactionResponse.ConfirmedTransaction tx = response.getResult();
    if (tx == null) {
      return Optional.empty();
    }
    List<String> logs = tx.meta() == null ? null : tx.meta().logMessages();
    long slot = tx.slot() == null ? 0L : tx.slot();
    return Optional.of(new OutcomeRecord(signature, slot, logs));
  }

  private <T extends Response<?>> T send(String method, List<Object> params, Class<T> type) throws TransportException {
    Request<Object, T> request = new Request<>(method, params, service, type);
    try {
      return request.send();
    } catch (IOException e) {
      throw new TransportException(method + " failed: " + e.getMessage(), List.of(), null, e);
    }
  }

  /**
   * Preflight failures carry {@code data.logs} (program log lines) and {@code data.err}, either a plain
   * string or {@code {"InstructionError":[ix, {"Custom":code}]}}.
   */
  TransportException toTransportException(String method, Response.Error error) {
    List<String> logs = new ArrayList<>();
    String errorName = null;
    String data = error.getData();
    if (data != null && !data.isBlank()) {
      try {
        JsonNode root = objectMapper.readTree(data);
        JsonNode logsNode = root.path("logs");
        if (logsNode.isArray()) {
          logsNode.forEach(l -> logs.add(l.isNull() ? null : l.asText()));
        }
        errorName = errorName(root.path("err"));
      } catch (IOException e) {
        log.warn("{} error data is not JSON: {}", method, data);
      }
    }
    String message = method + " error " + error.getCode() + ": " + error.getMessage();
    return TransportException.from(message, logs, errorName, null);
  }

  private static String errorName(JsonNode err) {
    if (err.isTextual()) {
      return err.asText();
    }
    JsonNode instructionError = err.path("InstructionError");
    if (instructionError.isArray() && instructionError.size() == 2) {
      JsonNode detail = instructionError.get(1);
      if (detail.isTextual()) {
        return detail.asText();
      }
      if (detail.has("Custom")) {
        return "Custom:" + detail.get("Custom").asText();
      }
    }
    return null;
  }
}
