package org.traceplayer.traces;

import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.FileFormat;

/**
 * Common interface for trace file decoders (AB1, SCF).
 * Implementations are stateless with respect to the input and never retain the buffer.
 */
public interface TraceFileReader {

  /**
   * Decode a complete trace file held in memory.
   * @param data     raw file bytes
   * @param fileName name used for display and export only
   */
  ChromatogramRecord read(byte[] data, String fileName) throws TraceFormatException;

  /** Format this reader decodes. */
  FileFormat getFormat();

  /** Decode into a tagged result instead of throwing. */
  default ParseResult tryRead(byte[] data, String fileName) {
    try {
      return ParseResult.success(read(data, fileName));
    } catch (TraceFormatException e) {
      return ParseResult.failure(e);
    } catch (RuntimeException e) {
      return ParseResult.failure(new TraceFormatException(TraceFormatException.Reason.MALFORMED_CONTAINER,
          "Corrupt " + getFormat() + " file: " + e.getMessage(), e));
    }
  }
}
