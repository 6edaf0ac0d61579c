package org.traceplayer.utils;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Absolute big-endian reads over an in-memory file. Both AB1 and SCF are big-endian.
 */
public final class BigEndian {

  private BigEndian() {}

  public static ByteBuffer wrap(byte[] data) {
    return ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN);
  }

  /** True if {@code length} bytes starting at {@code offset} lie inside the buffer. */
  public static boolean fits(byte[] data, long offset, long length) {
    return offset >= 0 && length >= 0 && offset + length <= data.length;
  }

  public static int readUByte(byte[] data, int offset) {
    return data[offset] & 0xFF;
  }

  public static int readUShort(ByteBuffer buf, int offset) {
    return buf.getShort(offset) & 0xFFFF;
  }

  public static int readInt(ByteBuffer buf, int offset) {
    return buf.getInt(offset);
  }

  /** Read a uint32 as long. */
  public static long readUInt(ByteBuffer buf, int offset) {
    return buf.getInt(offset) & 0xFFFFFFFFL;
  }

  public static String readAscii(byte[] data, int offset, int length) {
    return new String(data, offset, length, StandardCharsets.US_ASCII);
  }
}
