package org.traceplayer.io;

/**
 * What the loader does when a trace file cannot be decoded.
 */
public enum FallbackPolicy {
  /** Log the failure and show a synthetic chromatogram instead. */
  MOCK_ON_ERROR,
  /** Hand the failure to the caller. */
  PROPAGATE
}
