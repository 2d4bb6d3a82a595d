package com.example.accounttransfer.model;

/**
 * Identifier a decision refers to.
 *
 * <p>A real id comes from the store. A pending id numbers the records a dry run would create, so
 * metadata planning can point at "this new record" without inventing a store id.
 */
public record RecordId(long value, boolean pending) {

  public static RecordId real(long id) {
    return new RecordId(id, false);
  }

  public static RecordId pending(long sequence) {
    if (sequence < 1) {
      throw new IllegalArgumentException("pending sequence starts at 1");
    }
    return new RecordId(sequence, true);
  }

  @Override
  public String toString() {
    return pending ? "pending-" + value : Long.toString(value);
  }
}
