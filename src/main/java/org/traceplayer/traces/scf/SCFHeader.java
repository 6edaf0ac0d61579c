package org.traceplayer.traces.scf;

import java.nio.ByteBuffer;

import org.traceplayer.traces.TraceFormatException;
import org.traceplayer.traces.TraceFormatException.Reason;
import org.traceplayer.utils.BigEndian;

/**
 * The fixed 128-byte SCF header. Only the first 56 bytes carry fields.
 */
public record SCFHeader(
    long samples,
    long samplesOffset,
    long bases,
    long basesLeftClip,
    long basesRightClip,
    long basesOffset,
    long commentsSize,
    long commentsOffset,
    String version,
    long sampleSize,
    long codeSet,
    long privateSize,
    long privateOffset
) {

  public static final int FIELDS_SIZE = 56;

  public static SCFHeader read(byte[] data) throws TraceFormatException {
    if (data.length < FIELDS_SIZE) {
      throw new TraceFormatException(Reason.INVALID_HEADER,
          "SCF header needs " + FIELDS_SIZE + " bytes, file has " + data.length);
    }
    ByteBuffer buf = BigEndian.wrap(data);
    return new SCFHeader(
        BigEndian.readUInt(buf, 4),
        BigEndian.readUInt(buf, 8),
        BigEndian.readUInt(buf, 12),
        BigEndian.readUInt(buf, 16),
        BigEndian.readUInt(buf, 20),
        BigEndian.readUInt(buf, 24),
        BigEndian.readUInt(buf, 28),
        BigEndian.readUInt(buf, 32),
        BigEndian.readAscii(data, 36, 4).replace("\0", ""),
        BigEndian.readUInt(buf, 40),
        BigEndian.readUInt(buf, 44),
        BigEndian.readUInt(buf, 48),
        BigEndian.readUInt(buf, 52));
  }
}
