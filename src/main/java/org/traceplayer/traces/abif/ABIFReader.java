package org.traceplayer.traces.abif;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.traceplayer.model.Channel;
import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.FileFormat;
import org.traceplayer.traces.TraceFileReader;
import org.traceplayer.traces.TraceFormatException;
import org.traceplayer.traces.TraceFormatException.Reason;
import org.traceplayer.utils.BigEndian;

/**
 * Decoder for Applied Biosystems ABIF (.ab1) trace files.
 *
 * An ABIF file is a fixed header followed by a directory of typed, offset-addressed
 * tags. The header holds the directory's entry count at byte 18 and its offset at
 * byte 26. Only the tags needed for display are read:
 * <ul>
 *   <li>FWO_1 - channel order as four letters, e.g. "GATC"</li>
 *   <li>DATA9..DATA12 - analysed trace samples, one tag per channel</li>
 *   <li>PBAS1 (PBAS2) - base calls</li>
 *   <li>PCON1 (PCON2) - per-base quality</li>
 *   <li>PLOC1 (PLOC2) - per-base peak sample index</li>
 * </ul>
 */
public class ABIFReader implements TraceFileReader {

  private static final Logger log = LoggerFactory.getLogger(ABIFReader.class);

  static final int VERSION_OFFSET = 4;
  static final int ENTRY_COUNT_OFFSET = 18;
  static final int DIRECTORY_OFFSET_OFFSET = 26;
  static final int MIN_HEADER_SIZE = 30;
  static final int FIRST_TRACE_TAG = 9;
  static final Channel[] DEFAULT_CHANNEL_ORDER = { Channel.G, Channel.A, Channel.T, Channel.C };
  static final int MISSING_QUALITY = 20;

  private final boolean inlineSmallData;
  private final Random random;

  public ABIFReader() {
    this(false, new Random());
  }

  /**
   * @param inlineSmallData read tags of four bytes or less from the entry's offset field,
   *                        as the ABIF format defines, instead of treating the field as an
   *                        absolute offset
   * @param random          source for placeholder quality when PCON is missing
   */
  public ABIFReader(boolean inlineSmallData, Random random) {
    this.inlineSmallData = inlineSmallData;
    this.random = random;
  }

  @Override
  public FileFormat getFormat() { return FileFormat.AB1; }

  @Override
  public ChromatogramRecord read(byte[] data, String fileName) throws TraceFormatException {
    if (data == null || data.length < MIN_HEADER_SIZE || !"ABIF".equals(BigEndian.readAscii(data, 0, 4))) {
      throw new TraceFormatException(Reason.MALFORMED_CONTAINER, "Not a valid AB1 file - missing ABIF signature");
    }
    ByteBuffer buf = BigEndian.wrap(data);
    Map<String, ABIFDirectoryEntry> entries = readDirectory(data, buf);
    log.debug("AB1 file {} version {} has {} directory entries", fileName,
        BigEndian.readUShort(buf, VERSION_OFFSET), entries.size());

    Channel[] channelOrder = readChannelOrder(data, entries);

    Map<Channel, double[]> traces = new EnumMap<>(Channel.class);
    for (Channel channel : Channel.values()) traces.put(channel, new double[0]);
    for (int i = 0; i < channelOrder.length; i++) {
      ABIFDirectoryEntry entry = entries.get(ABIFDirectoryEntry.key("DATA", FIRST_TRACE_TAG + i));
      if (entry == null) continue;
      traces.put(channelOrder[i], readUShorts(data, buf, entry, Integer.MAX_VALUE));
    }
    int maxTraceLength = 0;
    for (double[] trace : traces.values()) maxTraceLength = Math.max(maxTraceLength, trace.length);

    char[] baseCalls = readBaseCalls(data, first(entries, "PBAS"));
    if (maxTraceLength == 0) {
      throw new TraceFormatException(Reason.NO_TRACE_DATA, "No trace data found in AB1 file");
    }
    if (baseCalls.length == 0) {
      throw new TraceFormatException(Reason.NO_BASE_CALLS, "No base calls found in AB1 file");
    }

    int[] quality = readQuality(data, first(entries, "PCON"), baseCalls.length);
    int[] peakLocations = readPeakLocations(data, buf, first(entries, "PLOC"), baseCalls.length, maxTraceLength);

    log.debug("Parsed AB1 {}: {} bases, {} trace points", fileName, baseCalls.length, maxTraceLength);
    return new ChromatogramRecord(fileName == null ? "parsed.ab1" : fileName, FileFormat.AB1, traces,
        baseCalls, quality, peakLocations);
  }

  /**
   * Read every directory entry, keyed by name and number.
   */
  Map<String, ABIFDirectoryEntry> readDirectory(byte[] data, ByteBuffer buf) throws TraceFormatException {
    long entryCount = BigEndian.readUInt(buf, ENTRY_COUNT_OFFSET);
    long directoryOffset = BigEndian.readUInt(buf, DIRECTORY_OFFSET_OFFSET);
    if (!BigEndian.fits(data, directoryOffset, entryCount * ABIFDirectoryEntry.SIZE)) {
      throw new TraceFormatException(Reason.MALFORMED_CONTAINER, "AB1 directory of " + entryCount
          + " entries at offset " + directoryOffset + " exceeds file length " + data.length);
    }

    Map<String, ABIFDirectoryEntry> entries = new LinkedHashMap<>();
    for (int i = 0; i < entryCount; i++) {
      int offset = (int) directoryOffset + i * ABIFDirectoryEntry.SIZE;
      ABIFDirectoryEntry entry = new ABIFDirectoryEntry(
          BigEndian.readAscii(data, offset, 4),
          BigEndian.readInt(buf, offset + 4),
          BigEndian.readUShort(buf, offset + 8),
          BigEndian.readUShort(buf, offset + 10),
          BigEndian.readUInt(buf, offset + 12),
          BigEndian.readUInt(buf, offset + 16),
          BigEndian.readUInt(buf, offset + ABIFDirectoryEntry.DATA_OFFSET_FIELD),
          offset);
      entries.put(entry.key(), entry);
    }
    return entries;
  }

  private Channel[] readChannelOrder(byte[] data, Map<String, ABIFDirectoryEntry> entries) {
    ABIFDirectoryEntry entry = entries.get("FWO_1");
    if (entry == null) return DEFAULT_CHANNEL_ORDER;

    List<Channel> order = new ArrayList<>();
    for (byte b : tagBytes(data, entry)) {
      char c = (char) (b & 0xFF);
      if (c != 'N' && Channel.isBaseCall(c)) order.add(Channel.fromSymbol(c));
    }
    if (order.size() < 4) {
      log.debug("Incomplete FWO_1 channel order {}, using default G,A,T,C", order);
      return DEFAULT_CHANNEL_ORDER;
    }
    return order.subList(0, 4).toArray(new Channel[0]);
  }

  private char[] readBaseCalls(byte[] data, ABIFDirectoryEntry entry) {
    if (entry == null) return new char[0];
    StringBuilder calls = new StringBuilder();
    for (byte b : tagBytes(data, entry)) {
      char c = (char) (b & 0xFF);
      if (Channel.isBaseCall(c)) calls.append(c);
    }
    return calls.toString().toCharArray();
  }

  private int[] readQuality(byte[] data, ABIFDirectoryEntry entry, int baseCount) {
    int[] quality = new int[baseCount];
    if (entry == null) {
      // Placeholder until missing quality is modelled as unknown
      for (int i = 0; i < baseCount; i++) quality[i] = 20 + random.nextInt(40);
      log.debug("No PCON tag, generated placeholder quality");
      return quality;
    }
    byte[] bytes = tagBytes(data, entry);
    int available = (int) Math.min(Math.min(entry.elementCount(), baseCount), bytes.length);
    Arrays.fill(quality, MISSING_QUALITY);
    for (int i = 0; i < available; i++) {
      quality[i] = Math.min(ChromatogramRecord.MAX_QUALITY, bytes[i] & 0xFF);
    }
    return quality;
  }

  private int[] readPeakLocations(byte[] data, ByteBuffer buf, ABIFDirectoryEntry entry, int baseCount,
                                  int maxTraceLength) {
    int[] peaks = new int[baseCount];
    int stored = 0;
    if (entry != null) {
      double[] values = readUShorts(data, buf, entry, baseCount);
      stored = values.length;
      for (int i = 0; i < stored; i++) peaks[i] = (int) Math.min(values[i], maxTraceLength);
    }
    if (stored < baseCount) {
      double spacing = (double) maxTraceLength / baseCount;
      for (int i = stored; i < baseCount; i++) peaks[i] = (int) Math.round(i * spacing);
      if (entry == null) log.debug("No PLOC tag, estimated peak locations");
    }
    return peaks;
  }

  /**
   * Big-endian uint16 elements of a tag, stopping at the buffer's end.
   */
  private double[] readUShorts(byte[] data, ByteBuffer buf, ABIFDirectoryEntry entry, int limit) {
    long offset = dataOffset(entry);
    // a corrupt element count must not size the array beyond the bytes present
    long available = Math.max(0, (data.length - offset) / 2);
    int count = (int) Math.min(Math.min(entry.elementCount(), limit), available);
    double[] values = new double[count];
    int read = 0;
    for (int j = 0; j < count; j++) {
      long position = offset + j * 2L;
      if (!BigEndian.fits(data, position, 2)) break;
      values[read++] = BigEndian.readUShort(buf, (int) position);
    }
    return read == count ? values : Arrays.copyOf(values, read);
  }

  /** Raw data bytes of a tag, clipped to the buffer. */
  byte[] tagBytes(byte[] data, ABIFDirectoryEntry entry) {
    long offset = dataOffset(entry);
    if (offset < 0 || offset >= data.length) return new byte[0];
    long end = Math.min(data.length, offset + entry.dataSize());
    return Arrays.copyOfRange(data, (int) offset, (int) end);
  }

  long dataOffset(ABIFDirectoryEntry entry) {
    if (inlineSmallData && entry.dataSize() <= 4) {
      return entry.entryOffset() + ABIFDirectoryEntry.DATA_OFFSET_FIELD;
    }
    return entry.dataOffset();
  }

  /** Tag number 1 when present, otherwise number 2. */
  private static ABIFDirectoryEntry first(Map<String, ABIFDirectoryEntry> entries, String name) {
    ABIFDirectoryEntry entry = entries.get(ABIFDirectoryEntry.key(name, 1));
    return entry != null ? entry : entries.get(ABIFDirectoryEntry.key(name, 2));
  }
}
