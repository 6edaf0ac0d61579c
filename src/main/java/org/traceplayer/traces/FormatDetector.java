package org.traceplayer.traces;

import java.nio.charset.StandardCharsets;

import org.traceplayer.model.FileFormat;

/**
 * Identifies a trace file from its leading magic bytes.
 */
public final class FormatDetector {

  /** ".scf" */
  static final byte[] SCF_MAGIC = { 0x2E, 0x73, 0x63, 0x66 };
  static final String ABIF_SIGNATURE = "ABIF";

  private FormatDetector() {}

  public static FileFormat detect(byte[] data) throws TraceFormatException {
    if (data == null || data.length < 4) {
      throw new TraceFormatException(TraceFormatException.Reason.TOO_SMALL,
          "File too small to determine type: " + (data == null ? 0 : data.length) + " bytes");
    }
    if (isScf(data)) return FileFormat.SCF;
    if (isAbif(data)) return FileFormat.AB1;
    throw new TraceFormatException(TraceFormatException.Reason.UNKNOWN_FORMAT,
        "Unknown file format - not AB1 or SCF");
  }

  static boolean isScf(byte[] data) {
    if (data.length < SCF_MAGIC.length) return false;
    for (int i = 0; i < SCF_MAGIC.length; i++) {
      if (data[i] != SCF_MAGIC[i]) return false;
    }
    return true;
  }

  static boolean isAbif(byte[] data) {
    return data.length >= 4 && ABIF_SIGNATURE.equals(new String(data, 0, 4, StandardCharsets.US_ASCII));
  }
}
