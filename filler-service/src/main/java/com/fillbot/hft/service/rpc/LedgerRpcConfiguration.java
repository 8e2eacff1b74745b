package com.fillbot.hft.service.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.http.HttpService;

/**
 * Live ledger adapter. The exchange SDK must contribute the {@link FillInstructionFactory},
 * {@link TransactionAssembler}, order book loader, market data and account directory beans.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "filler.rpc", name = "enabled", havingValue = "true")
public class LedgerRpcConfiguration {

  @Bean(destroyMethod = "close")
  public Web3jService ledgerRpcService(LedgerRpcProperties properties) {
    log.info("ledger rpc at {} (commitment={}, skipPreflight={})",
        properties.url(), properties.commitment(), properties.skipPreflight());
    return new HttpService(properties.url().toString());
  }

  @Bean
  public LedgerRpcClient ledgerRpcClient(Web3jService ledgerRpcService, LedgerRpcProperties properties,
                                         ObjectMapper objectMapper) {
    return new LedgerRpcClient(ledgerRpcService, properties, objectMapper);
  }

  @Bean
  public RpcFillExecutionClient rpcFillExecutionClient(LedgerRpcClient ledgerRpcClient,
                                                       FillInstructionFactory instructionFactory,
                                                       TransactionAssembler assembler) {
    return new RpcFillExecutionClient(ledgerRpcClient, instructionFactory, assembler);
  }
}
