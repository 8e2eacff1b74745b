package com.fillbot.hft.service.web;

import com.fillbot.hft.filler.gate.GateTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

@Slf4j
@RestControllerAdvice(assignableTypes = FillerController.class)
public class FillerExceptionHandler {

  private static final String TYPE_PREFIX = "/problems/";

  @ExceptionHandler(IllegalArgumentException.class)
  public ProblemDetail handleBadRequest(IllegalArgumentException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "invalid-request"));
    problem.setTitle("Invalid Request");
    return problem;
  }

  @ExceptionHandler(IllegalStateException.class)
  public ProblemDetail handleConflict(IllegalStateException ex) {
    log.warn("filler request failed: {}", ex.getMessage());
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "filler-state"));
    problem.setTitle("Filler State Conflict");
    return problem;
  }

  @ExceptionHandler(GateTimeoutException.class)
  public ProblemDetail handleSnapshotBusy(GateTimeoutException ex) {
    log.warn("filler request timed out on the order book: {}", ex.getMessage());
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "snapshot-busy"));
    problem.setTitle("Order Book Busy");
    return problem;
  }
}
