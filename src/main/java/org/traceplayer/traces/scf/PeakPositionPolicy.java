package org.traceplayer.traces.scf;

/**
 * Where SCF base peak positions come from.
 */
public enum PeakPositionPolicy {
  /**
   * Spread bases evenly: {@code floor(i / bases * samples)}. Some encoders write unusable
   * peak indices, so this is the default.
   */
  ESTIMATED,
  /** Use the stored peak index, falling back to the estimate when it lies outside the trace. */
  NATIVE
}
