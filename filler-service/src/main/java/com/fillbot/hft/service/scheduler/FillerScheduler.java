package com.fillbot.hft.service.scheduler;

import com.fillbot.hft.filler.FillCycleResult;
import com.fillbot.hft.filler.FillerBot;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class FillerScheduler {

  private final @NonNull FillerBot fillerBot;

  @Scheduled(fixedDelayString = "${filler.interval-millis:1000}")
  public void tick() {
    try {
      FillCycleResult result = fillerBot.runCycle();
      if (result.status() == FillCycleResult.CycleStatus.TIMED_OUT
          || result.status() == FillCycleResult.CycleStatus.SNAPSHOT_TIMEOUT) {
        log.warn("{} fill cycle status={}", fillerBot.name(), result.status());
      }
    } catch (Exception e) {
      log.warn("{} fill tick failed: {}", fillerBot.name(), e.toString());
    }
  }
}
