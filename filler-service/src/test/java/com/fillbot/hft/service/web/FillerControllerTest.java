package com.fillbot.hft.service.web;

import com.fillbot.hft.book.OrderBook;
import com.fillbot.hft.config.FillerProperties;
import com.fillbot.hft.domain.CandidateSignature;
import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.domain.Order;
import com.fillbot.hft.domain.OrderDirection;
import com.fillbot.hft.domain.OrderNode;
import com.fillbot.hft.domain.OrderRecord;
import com.fillbot.hft.filler.FillCycleResult;
import com.fillbot.hft.filler.FillerBot;
import com.fillbot.hft.filler.FillerEvent;
import com.fillbot.hft.filler.ThrottleRegistry;
import com.fillbot.hft.filler.gate.GateTimeoutException;
import com.fillbot.hft.filler.submit.SubmissionResult;
import com.fillbot.hft.service.sim.PaperLedgerSimulator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FillerController.class)
class FillerControllerTest {

  @Autowired
  private MockMvc mockMvc;
  @MockBean
  private FillerBot fillerBot;
  @MockBean
  private PaperLedgerSimulator simulator;

  @TestConfiguration
  static class PropertiesConfig {
    @Bean
    FillerProperties fillerProperties() {
      return FillerProperties.defaults();
    }
  }

  @Test
  void statusReportsModeAndThrottles() throws Exception {
    when(fillerBot.name()).thenReturn("filler");
    when(fillerBot.throttles()).thenReturn(new ThrottleRegistry(Clock.systemUTC()));

    mockMvc.perform(get("/api/filler/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("filler"))
        .andExpect(jsonPath("$.mode").value("BULK"))
        .andExpect(jsonPath("$.dryRun").value(false))
        .andExpect(jsonPath("$.throttledOrders").value(0))
        .andExpect(jsonPath("$.paperLedger").value(true));
  }

  @Test
  void snapshotReportsNotLoadedBeforeFirstCycle() throws Exception {
    when(fillerBot.viewSnapshot()).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/filler/snapshot"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.loaded").value(false));
  }

  @Test
  void snapshotReportsOpenOrders() throws Exception {
    OrderBook book = org.mockito.Mockito.mock(OrderBook.class);
    when(book.size()).thenReturn(7);
    when(fillerBot.viewSnapshot()).thenReturn(Optional.of(book));

    mockMvc.perform(get("/api/filler/snapshot"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.loaded").value(true))
        .andExpect(jsonPath("$.openOrders").value(7));
  }

  @Test
  void runReturnsCycleOutcome() throws Exception {
    when(fillerBot.runCycle()).thenReturn(FillCycleResult.completed(SubmissionResult.sent("sig-9", 4)));

    mockMvc.perform(post("/api/filler/run"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.submission.status").value("SENT"))
        .andExpect(jsonPath("$.submission.submissionId").value("sig-9"))
        .andExpect(jsonPath("$.submission.operations").value(4));
  }

  @Test
  void fillUsesSingleOperationPath() throws Exception {
    FillCandidate candidate = FillCandidate.againstAmm(new OrderNode("acct",
        new Order(3L, 0, OrderDirection.LONG, null, BigDecimal.ONE, 1L)));
    when(fillerBot.findCandidate(CandidateSignature.of("acct", 3L))).thenReturn(Optional.of(candidate));
    when(fillerBot.fillSingle(candidate)).thenReturn(SubmissionResult.failed(1, "OrderDoesNotExist"));

    mockMvc.perform(post("/api/filler/fill").param("account", "acct").param("orderId", "3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("FAILED"))
        .andExpect(jsonPath("$.errorCode").value("OrderDoesNotExist"));
  }

  @Test
  void fillReturnsNotFoundForUnknownOrder() throws Exception {
    when(fillerBot.findCandidate(any())).thenReturn(Optional.empty());

    mockMvc.perform(post("/api/filler/fill").param("account", "acct").param("orderId", "3"))
        .andExpect(status().isNotFound());
  }

  @Test
  void fillReturnsServiceUnavailableWhenOrderBookIsLocked() throws Exception {
    when(fillerBot.findCandidate(any())).thenThrow(new GateTimeoutException(Duration.ofMillis(10_000)));

    mockMvc.perform(post("/api/filler/fill").param("account", "acct").param("orderId", "3"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.title").value("Order Book Busy"))
        .andExpect(jsonPath("$.detail").value("snapshot lock not acquired within 10000ms"));
  }

  @Test
  void simOrderTriggersCycle() throws Exception {
    OrderRecord record = new OrderRecord("alice", "auth-alice",
        new Order(1L, 0, OrderDirection.LONG, null, BigDecimal.ONE, 1L));
    when(simulator.placeOrder(eq("alice"), isNull(), eq(0), eq(OrderDirection.LONG), isNull(), any()))
        .thenReturn(record);
    when(fillerBot.trigger(new FillerEvent.OrderCreated(record)))
        .thenReturn(Optional.of(FillCycleResult.completed(SubmissionResult.dryRun(1))));

    mockMvc.perform(post("/api/filler/sim/orders")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"account\":\"alice\",\"marketIndex\":0,\"direction\":\"LONG\",\"size\":1}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.submission.status").value("DRY_RUN"));
  }

  @Test
  void simOrderRejectsInvalidRequest() throws Exception {
    mockMvc.perform(post("/api/filler/sim/orders")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"account\":\"alice\",\"marketIndex\":0,\"direction\":\"LONG\",\"size\":0}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void simOrderMapsUnknownMarketToBadRequest() throws Exception {
    when(simulator.placeOrder(any(), any(), eq(9), any(), any(), any()))
        .thenThrow(new IllegalArgumentException("unknown market 9"));

    mockMvc.perform(post("/api/filler/sim/orders")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"account\":\"alice\",\"marketIndex\":9,\"direction\":\"SHORT\",\"size\":1}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid Request"));
  }
}
