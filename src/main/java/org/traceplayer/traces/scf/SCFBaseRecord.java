package org.traceplayer.traces.scf;

/**
 * One 12-byte SCF base entry.
 *
 * Layout: bytes 0-3 peak index (uint32), bytes 4-7 confidence for A, C, G, T,
 * byte 8 the base letter, bytes 9-11 spare.
 */
public record SCFBaseRecord(byte[] bytes) {

  public static final int SIZE = 12;
  static final int CONFIDENCE_OFFSET = 4;
  static final int BASE_OFFSET = 8;
  static final char[] CONFIDENCE_ORDER = { 'A', 'C', 'G', 'T' };

  public SCFBaseRecord {
    if (bytes == null || bytes.length != SIZE) {
      throw new IllegalArgumentException("SCF base record must be " + SIZE + " bytes");
    }
  }

  /** Peak index as stored by the encoder. */
  public long nativePeakIndex() {
    return ((long) (bytes[0] & 0xFF) << 24) | ((bytes[1] & 0xFF) << 16) | ((bytes[2] & 0xFF) << 8) | (bytes[3] & 0xFF);
  }

  /** Confidence for A, C, G, T by position 0..3. */
  public int confidence(int channel) {
    return bytes[CONFIDENCE_OFFSET + channel] & 0xFF;
  }

  public int maxConfidence() {
    int max = 0;
    for (int k = 0; k < 4; k++) max = Math.max(max, confidence(k));
    return max;
  }

  public int unsignedByte(int position) {
    return bytes[position] & 0xFF;
  }
}
