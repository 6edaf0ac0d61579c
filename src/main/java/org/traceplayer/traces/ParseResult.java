package org.traceplayer.traces;

import org.traceplayer.model.ChromatogramRecord;

/**
 * Outcome of decoding a trace file: either a record or the error that prevented it.
 */
public final class ParseResult {

  private final ChromatogramRecord record;
  private final TraceFormatException error;

  private ParseResult(ChromatogramRecord record, TraceFormatException error) {
    this.record = record;
    this.error = error;
  }

  public static ParseResult success(ChromatogramRecord record) {
    if (record == null) throw new IllegalArgumentException("Record is required");
    return new ParseResult(record, null);
  }

  public static ParseResult failure(TraceFormatException error) {
    if (error == null) throw new IllegalArgumentException("Error is required");
    return new ParseResult(null, error);
  }

  public boolean isSuccess() { return record != null; }

  public ChromatogramRecord getRecord() {
    if (record == null) throw new IllegalStateException("Parse failed: " + error.getMessage(), error);
    return record;
  }

  public TraceFormatException getError() {
    if (error == null) throw new IllegalStateException("Parse succeeded");
    return error;
  }

  /** The record, or rethrows the failure. */
  public ChromatogramRecord orElseThrow() throws TraceFormatException {
    if (error != null) throw error;
    return record;
  }

  @Override
  public String toString() {
    return isSuccess() ? "ParseResult[success " + record + "]"
        : "ParseResult[failure " + error.getReason() + ": " + error.getMessage() + "]";
  }
}
