package com.fillbot.hft.service.web;

import com.fillbot.hft.config.FillerProperties;
import com.fillbot.hft.domain.CandidateSignature;
import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.domain.OrderDirection;
import com.fillbot.hft.domain.OrderRecord;
import com.fillbot.hft.filler.FillCycleResult;
import com.fillbot.hft.filler.FillerBot;
import com.fillbot.hft.filler.FillerEvent;
import com.fillbot.hft.filler.submit.ReconciliationResult;
import com.fillbot.hft.filler.submit.SubmissionResult;
import com.fillbot.hft.service.sim.PaperLedgerSimulator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.Optional;

@RestController
@RequestMapping("/api/filler")
@Validated
@RequiredArgsConstructor
public class FillerController {

  private final @NonNull FillerBot fillerBot;
  private final @NonNull FillerProperties properties;
  private final @NonNull ObjectProvider<PaperLedgerSimulator> simulator;

  @GetMapping("/status")
  public ResponseEntity<StatusResponse> status() {
    return ResponseEntity.ok(new StatusResponse(
        fillerBot.name(),
        properties.mode(),
        properties.dryRun(),
        fillerBot.isCycleRunning(),
        fillerBot.throttles().size(),
        simulator.getIfAvailable() != null
    ));
  }

  @GetMapping("/snapshot")
  public ResponseEntity<SnapshotResponse> snapshot() {
    return ResponseEntity.ok(fillerBot.viewSnapshot()
        .map(book -> new SnapshotResponse(true, book.size()))
        .orElse(new SnapshotResponse(false, 0)));
  }

  @PostMapping("/run")
  public ResponseEntity<CycleResponse> run() {
    return ResponseEntity.ok(CycleResponse.of(fillerBot.runCycle()));
  }

  /**
   * Fills one order of the current snapshot through the single-operation path.
   */
  @PostMapping("/fill")
  public ResponseEntity<SubmissionResponse> fill(
      @RequestParam(name = "account") @NotBlank String account,
      @RequestParam(name = "orderId") @Min(0) long orderId
  ) {
    Optional<FillCandidate> candidate = fillerBot.findCandidate(CandidateSignature.of(account, orderId));
    return candidate
        .map(c -> ResponseEntity.ok(SubmissionResponse.of(fillerBot.fillSingle(c))))
        .orElse(ResponseEntity.notFound().build());
  }

  @PostMapping("/sim/orders")
  public ResponseEntity<CycleResponse> placeSimOrder(@Valid @RequestBody PlaceOrderRequest request) {
    PaperLedgerSimulator sim = simulator.getIfAvailable();
    if (sim == null) {
      return ResponseEntity.notFound().build();
    }
    OrderRecord record = sim.placeOrder(request.account(), request.authority(), request.marketIndex(),
        request.direction(), request.price(), request.size());
    FillCycleResult result = fillerBot.trigger(new FillerEvent.OrderCreated(record)).orElseThrow();
    return ResponseEntity.ok(CycleResponse.of(result));
  }

  public record PlaceOrderRequest(
      @NotBlank String account,
      String authority,
      @NotNull @Min(0) Integer marketIndex,
      @NotNull OrderDirection direction,
      BigDecimal price,
      @NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal size
  ) {
  }

  public record StatusResponse(
      String name,
      FillerProperties.FillMode mode,
      boolean dryRun,
      boolean cycleRunning,
      int throttledOrders,
      boolean paperLedger
  ) {
  }

  public record SnapshotResponse(boolean loaded, int openOrders) {
  }

  public record SubmissionResponse(
      SubmissionResult.Status status,
      String submissionId,
      int operations,
      Integer succeeded,
      Integer staleOrders,
      Integer rejected,
      Integer unparsed,
      String errorCode
  ) {
    static SubmissionResponse of(SubmissionResult result) {
      ReconciliationResult r = result.reconciliation();
      return new SubmissionResponse(
          result.status(),
          result.submissionId(),
          result.operations(),
          r == null ? null : r.succeeded(),
          r == null ? null : r.staleOrders(),
          r == null ? null : r.rejected(),
          r == null ? null : r.unparsed(),
          result.errorCode()
      );
    }
  }

  public record CycleResponse(FillCycleResult.CycleStatus status, SubmissionResponse submission) {
    static CycleResponse of(FillCycleResult result) {
      return new CycleResponse(result.status(),
          result.submission() == null ? null : SubmissionResponse.of(result.submission()));
    }
  }
}
