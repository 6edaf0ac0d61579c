package org.traceplayer.traces;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds small AB1 and SCF files in memory for reader tests.
 */
public final class TraceFixtures {

  private TraceFixtures() {}

  public static AbifBuilder abif() { return new AbifBuilder(); }

  public static ScfBuilder scf() { return new ScfBuilder(); }

  /** AB1 with four 40-sample channels, "GATC" order and ACGT calls with quality and peaks. */
  public static byte[] minimalAbif() {
    return abif()
        .ascii("FWO_", 1, "GATC")
        .shorts("DATA", 9, ramp(40, 0))
        .shorts("DATA", 10, ramp(40, 100))
        .shorts("DATA", 11, ramp(40, 200))
        .shorts("DATA", 12, ramp(40, 300))
        .ascii("PBAS", 1, "ACGT")
        .bytes("PCON", 1, 10, 20, 30, 40)
        .shorts("PLOC", 1, 0, 10, 20, 30)
        .build();
  }

  public static int[] ramp(int length, int base) {
    int[] values = new int[length];
    for (int i = 0; i < length; i++) values[i] = base + i;
    return values;
  }

  public static int[] constant(int length, int value) {
    int[] values = new int[length];
    Arrays.fill(values, value);
    return values;
  }

  // ── ABIF ──────────────────────────────────────────────────────────────

  public static final class AbifBuilder {

    private record Tag(String name, int number, int type, int elementSize, int count, byte[] data, boolean inline) {}

    private final List<Tag> tags = new ArrayList<>();
    private final Map<String, Long> declaredCounts = new HashMap<>();
    private String signature = "ABIF";
    private int directoryOffsetShift = 0;

    public AbifBuilder signature(String value) { signature = value; return this; }

    /** Move the recorded directory offset away from where the directory really is. */
    public AbifBuilder shiftDirectoryOffset(int delta) { directoryOffsetShift = delta; return this; }

    /** Record {@code count} as the element count of a tag, whatever data it carries. */
    public AbifBuilder declaredCount(String name, int number, long count) {
      declaredCounts.put(name + number, count);
      return this;
    }

    public AbifBuilder ascii(String name, int number, String value) {
      byte[] data = value.getBytes(StandardCharsets.US_ASCII);
      tags.add(new Tag(name, number, 2, 1, data.length, data, false));
      return this;
    }

    public AbifBuilder bytes(String name, int number, int... values) {
      byte[] data = new byte[values.length];
      for (int i = 0; i < values.length; i++) data[i] = (byte) values[i];
      tags.add(new Tag(name, number, 2, 1, data.length, data, false));
      return this;
    }

    public AbifBuilder shorts(String name, int number, int... values) {
      ByteBuffer buf = ByteBuffer.allocate(values.length * 2).order(ByteOrder.BIG_ENDIAN);
      for (int v : values) buf.putShort((short) v);
      tags.add(new Tag(name, number, 4, 2, values.length, buf.array(), false));
      return this;
    }

    /** A tag of at most four bytes packed into the entry's offset field. */
    public AbifBuilder inlineAscii(String name, int number, String value) {
      byte[] data = value.getBytes(StandardCharsets.US_ASCII);
      if (data.length > 4) throw new IllegalArgumentException("Inline data holds at most 4 bytes");
      tags.add(new Tag(name, number, 2, 1, data.length, data, true));
      return this;
    }

    public byte[] build() {
      int headerSize = 128;
      int dataSize = 0;
      for (Tag tag : tags) if (!tag.inline()) dataSize += tag.data().length;
      int directoryOffset = headerSize + dataSize;
      ByteBuffer buf = ByteBuffer.allocate(directoryOffset + tags.size() * 28).order(ByteOrder.BIG_ENDIAN);

      buf.put(0, signature.getBytes(StandardCharsets.US_ASCII));
      buf.putShort(4, (short) 101);
      buf.put(6, "tdir".getBytes(StandardCharsets.US_ASCII));
      buf.putInt(10, 1);
      buf.putShort(14, (short) 1023);
      buf.putShort(16, (short) 28);
      buf.putInt(18, tags.size());
      buf.putInt(22, tags.size() * 28);
      buf.putInt(26, directoryOffset + directoryOffsetShift);

      int dataPosition = headerSize;
      for (int i = 0; i < tags.size(); i++) {
        Tag tag = tags.get(i);
        int entry = directoryOffset + i * 28;
        buf.put(entry, tag.name().getBytes(StandardCharsets.US_ASCII));
        buf.putInt(entry + 4, tag.number());
        buf.putShort(entry + 8, (short) tag.type());
        buf.putShort(entry + 10, (short) tag.elementSize());
        buf.putInt(entry + 12, (int) (long) declaredCounts.getOrDefault(tag.name() + tag.number(), (long) tag.count()));
        buf.putInt(entry + 16, tag.data().length);
        if (tag.inline()) {
          buf.put(entry + 20, tag.data());
        } else {
          buf.putInt(entry + 20, dataPosition);
          buf.put(dataPosition, tag.data());
          dataPosition += tag.data().length;
        }
      }
      return buf.array();
    }
  }

  // ── SCF ───────────────────────────────────────────────────────────────

  public static final class ScfBuilder {

    private int sampleSize = 2;
    private int[][] samples = new int[4][0];
    private final List<byte[]> bases = new ArrayList<>();
    private Long declaredBases;
    private Long declaredSamples;
    private int truncateBy = 0;

    /** Channels in file order A, C, G, T. */
    public ScfBuilder samples(int sampleSize, int[] a, int[] c, int[] g, int[] t) {
      this.sampleSize = sampleSize;
      this.samples = new int[][] { a, c, g, t };
      return this;
    }

    public ScfBuilder sampleSize(int size) { sampleSize = size; return this; }

    /** Base record with peak index, A/C/G/T confidences and a letter in byte 8 (0 for none). */
    public ScfBuilder base(long peak, int probA, int probC, int probG, int probT, int letter) {
      return base(peak, probA, probC, probG, probT, letter, 0, 0, 0);
    }

    public ScfBuilder base(long peak, int probA, int probC, int probG, int probT, int letter,
                           int spare1, int spare2, int spare3) {
      ByteBuffer record = ByteBuffer.allocate(12).order(ByteOrder.BIG_ENDIAN);
      record.putInt((int) peak);
      record.put((byte) probA).put((byte) probC).put((byte) probG).put((byte) probT);
      record.put((byte) letter).put((byte) spare1).put((byte) spare2).put((byte) spare3);
      bases.add(record.array());
      return this;
    }

    public ScfBuilder declaredBases(long count) { declaredBases = count; return this; }

    public ScfBuilder declaredSamples(long count) { declaredSamples = count; return this; }

    /** Cut bytes off the end of the built file. */
    public ScfBuilder truncateBy(int count) { truncateBy = count; return this; }

    public byte[] build() {
      int sampleCount = samples[0].length;
      int headerSize = 128;
      int samplesBytes = 4 * sampleCount * sampleSize;
      int basesOffset = headerSize + samplesBytes;
      ByteBuffer buf = ByteBuffer.allocate(basesOffset + bases.size() * 12).order(ByteOrder.BIG_ENDIAN);

      buf.put(0, new byte[] { 0x2E, 0x73, 0x63, 0x66 });
      buf.putInt(4, (int) (declaredSamples != null ? declaredSamples : sampleCount));
      buf.putInt(8, headerSize);
      buf.putInt(12, (int) (declaredBases != null ? declaredBases : bases.size()));
      buf.putInt(24, basesOffset);
      buf.put(36, "3.00".getBytes(StandardCharsets.US_ASCII));
      buf.putInt(40, sampleSize);

      int position = headerSize;
      for (int[] channel : samples) {
        for (int v : channel) {
          if (sampleSize == 1) buf.put(position, (byte) v);
          else buf.putShort(position, (short) v);
          position += sampleSize;
        }
      }
      for (int i = 0; i < bases.size(); i++) buf.put(basesOffset + i * 12, bases.get(i));

      byte[] out = buf.array();
      return truncateBy == 0 ? out : Arrays.copyOf(out, out.length - truncateBy);
    }
  }
}
