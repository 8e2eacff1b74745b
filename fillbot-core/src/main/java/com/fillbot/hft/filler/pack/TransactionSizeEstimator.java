package com.fillbot.hft.filler.pack;

import com.fillbot.hft.ledger.FillOperation;

/**
 * Serialized-size arithmetic for ledger transactions.
 * <p>
 * Arrays are prefixed with a compact-u16 length:
 * <pre>
 *  length  | prefix
 *  --------+-------
 *  0..127  | 1 byte
 *  ..16383 | 2 bytes
 *  16384.. | 3 bytes
 * </pre>
 * A transaction is: signatures (64 bytes each), message header (3 bytes), account table (32 bytes each),
 * recent block hash (32 bytes), then the instructions.
 */
public final class TransactionSizeEstimator {

  public static final int SIGNATURE_BYTES = 64;
  public static final int PUBLIC_KEY_BYTES = 32;
  public static final int MESSAGE_HEADER_BYTES = 3;
  public static final int BLOCK_HASH_BYTES = 32;

  private TransactionSizeEstimator() {
  }

  /**
   * Size of an array of {@code length} elements of {@code elementSize} bytes with its length prefix.
   * An empty array is charged one byte of payload on top of its prefix.
   */
  public static int compactArraySize(int length, int elementSize) {
    if (length < 0 || elementSize < 0) {
      throw new IllegalArgumentException("length and elementSize must be >= 0");
    }
    if (length > 0x3fff) {
      return 3 + length * elementSize;
    } else if (length > 0x7f) {
      return 2 + length * elementSize;
    }
    return 1 + Math.max(length * elementSize, 1);
  }

  /**
   * Program id index (1 byte) + account index array + data array.
   */
  public static int operationSize(FillOperation operation) {
    return 1
        + compactArraySize(operation.accounts().size(), 1)
        + compactArraySize(operation.data().length, 1);
  }

  /**
   * Extra account-table bytes for {@code newAccounts} keys not referenced before. The table prefix is
   * already counted in the envelope.
   */
  public static int additionalAccountsSize(int newAccounts) {
    return newAccounts > 0 ? compactArraySize(newAccounts, PUBLIC_KEY_BYTES) - 1 : 0;
  }

  /**
   * Fixed framing of a single-signer transaction with {@code uniqueAccounts} table entries and the given
   * preamble operation.
   */
  public static int envelopeSize(int uniqueAccounts, FillOperation preamble) {
    return compactArraySize(1, SIGNATURE_BYTES)
        + MESSAGE_HEADER_BYTES
        + compactArraySize(uniqueAccounts, PUBLIC_KEY_BYTES)
        + BLOCK_HASH_BYTES
        + operationSize(preamble);
  }
}
