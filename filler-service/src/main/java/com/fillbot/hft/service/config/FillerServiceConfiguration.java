package com.fillbot.hft.service.config;

import com.fillbot.hft.account.AccountDirectory;
import com.fillbot.hft.book.OrderBookLoader;
import com.fillbot.hft.config.FillerProperties;
import com.fillbot.hft.filler.FillerBot;
import com.fillbot.hft.filler.FillerObserver;
import com.fillbot.hft.ledger.FillExecutionClient;
import com.fillbot.hft.market.MarketDataProvider;
import com.fillbot.hft.service.metrics.MicrometerFillerObserver;
import com.fillbot.hft.service.rpc.LedgerRpcProperties;
import com.fillbot.hft.service.sim.SimulationProperties;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Wires the filler engine to whichever ledger adapter is active: the paper simulator (default) or the
 * JSON-RPC client plus the exchange SDK beans.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties({FillerProperties.class, LedgerRpcProperties.class, SimulationProperties.class})
public class FillerServiceConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public FillerObserver fillerObserver(FillerProperties properties, MeterRegistry meterRegistry) {
    return new MicrometerFillerObserver(properties.name(), meterRegistry);
  }

  @Bean(initMethod = "init", destroyMethod = "close")
  public FillerBot fillerBot(
      FillerProperties properties,
      OrderBookLoader orderBookLoader,
      MarketDataProvider marketData,
      AccountDirectory accounts,
      FillExecutionClient executionClient,
      FillerObserver observer,
      Clock clock
  ) {
    log.info("filler configured (name={}, mode={}, dryRun={}, intervalMs={}, backoffMs={}, maxTxBytes={}, executor={})",
        properties.name(), properties.mode(), properties.dryRun(), properties.intervalMillis(),
        properties.fillBackoffMillis(), properties.maxTxBytes(), executionClient.getClass().getSimpleName());
    return new FillerBot(properties, orderBookLoader, marketData, accounts, executionClient, observer, clock);
  }
}
