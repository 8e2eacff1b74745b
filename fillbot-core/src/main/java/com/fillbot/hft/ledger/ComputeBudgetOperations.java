package com.fillbot.hft.ledger;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * Builds the compute-budget preamble that opens every packed fill transaction.
 */
public final class ComputeBudgetOperations {

  public static final String PROGRAM_ID = "ComputeBudget111111111111111111111111111111";

  private static final byte REQUEST_UNITS_TAG = 0;

  private ComputeBudgetOperations() {
  }

  /**
   * {@code RequestUnits { units: u32, additional_fee: u32 }}, little endian, 9 bytes total.
   */
  public static FillOperation requestUnits(int units, int additionalFee) {
    ByteBuffer data = ByteBuffer.allocate(9).order(ByteOrder.LITTLE_ENDIAN);
    data.put(REQUEST_UNITS_TAG);
    data.putInt(units);
    data.putInt(additionalFee);
    return new FillOperation(PROGRAM_ID, List.of(), data.array());
  }
}
