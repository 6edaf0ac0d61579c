package org.traceplayer.model;

/**
 * Origin of a chromatogram record.
 */
public enum FileFormat {
  AB1,
  SCF,
  /** Synthesised when no real trace could be decoded. */
  MOCK
}
