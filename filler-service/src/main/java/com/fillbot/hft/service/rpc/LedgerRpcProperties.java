package com.fillbot.hft.service.rpc;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;

@Validated
@ConfigurationProperties(prefix = "filler.rpc")
public record LedgerRpcProperties(
    @NotNull Boolean enabled,
    /**
     * JSON-RPC endpoint of the ledger node used to send fills and read their outcome.
     */
    URI url,
    /**
     * Commitment level used when reading confirmed transactions.
     */
    String commitment,
    /**
     * When true the node does not simulate the transaction before forwarding it.
     */
    @NotNull Boolean skipPreflight
) {
  public LedgerRpcProperties {
    if (enabled == null) {
      enabled = false;
    }
    if (url == null) {
      url = URI.create("http://127.0.0.1:8899");
    }
    if (commitment == null || commitment.isBlank()) {
      commitment = "confirmed";
    }
    if (skipPreflight == null) {
      skipPreflight = false;
    }
  }
}
