package com.fillbot.hft.filler;

import com.fillbot.hft.domain.OrderRecord;
import lombok.NonNull;

/**
 * Ledger events that can trigger the filler outside its timer.
 */
public interface FillerEvent {

  record OrderCreated(@NonNull OrderRecord record) implements FillerEvent {
  }

  record AccountCreated(@NonNull String authority) implements FillerEvent {
  }
}
