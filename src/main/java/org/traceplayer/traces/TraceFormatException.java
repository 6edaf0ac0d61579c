package org.traceplayer.traces;

import java.io.IOException;

/**
 * Thrown when a byte buffer cannot be decoded as a chromatogram.
 */
public class TraceFormatException extends IOException {

  public enum Reason {
    TOO_SMALL,
    UNKNOWN_FORMAT,
    MALFORMED_CONTAINER,
    NO_TRACE_DATA,
    NO_BASE_CALLS,
    UNSUPPORTED_SAMPLE_SIZE,
    INVALID_HEADER
  }

  private final Reason reason;

  public TraceFormatException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TraceFormatException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() { return reason; }
}
