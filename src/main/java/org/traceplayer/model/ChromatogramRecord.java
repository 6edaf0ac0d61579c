package org.traceplayer.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decoded chromatogram: four channel traces plus per-base calls, quality scores
 * and peak locations.
 *
 * Instances are immutable. The only edit, {@link #withBaseCall(int, char)}, returns
 * a copy with one base call replaced; a newly loaded file replaces the record wholesale.
 *
 * Per-base arrays always have the same length and every peak location lies within
 * {@code [0, maxTraceLength]}. Channel arrays are independent in length.
 */
public final class ChromatogramRecord {

  public static final int MAX_QUALITY = 60;

  private final String fileName;
  private final FileFormat fileFormat;
  private final Map<Channel, double[]> traces;
  private final char[] baseCalls;
  private final int[] quality;
  private final int[] peakLocations;
  private final String sequence;
  private final int maxTraceLength;

  public ChromatogramRecord(String fileName, FileFormat fileFormat, Map<Channel, double[]> traces,
                            char[] baseCalls, int[] quality, int[] peakLocations) {
    if (fileFormat == null) throw new IllegalArgumentException("File format is required");
    if (traces == null || baseCalls == null || quality == null || peakLocations == null) {
      throw new IllegalArgumentException("Traces and per-base arrays are required");
    }
    if (quality.length != baseCalls.length || peakLocations.length != baseCalls.length) {
      throw new IllegalArgumentException("Per-base arrays differ in length: baseCalls=" + baseCalls.length
          + ", quality=" + quality.length + ", peakLocations=" + peakLocations.length);
    }

    EnumMap<Channel, double[]> copy = new EnumMap<>(Channel.class);
    int longest = 0;
    for (Channel channel : Channel.values()) {
      double[] samples = traces.get(channel);
      double[] channelCopy = samples == null ? new double[0] : samples.clone();
      copy.put(channel, channelCopy);
      longest = Math.max(longest, channelCopy.length);
    }

    for (int i = 0; i < baseCalls.length; i++) {
      if (!Channel.isBaseCall(baseCalls[i])) {
        throw new IllegalArgumentException("Invalid base call '" + baseCalls[i] + "' at index " + i);
      }
      if (peakLocations[i] < 0 || peakLocations[i] > longest) {
        throw new IllegalArgumentException("Peak location " + peakLocations[i] + " at index " + i
            + " outside [0, " + longest + "]");
      }
    }

    this.fileName = fileName == null ? "" : fileName;
    this.fileFormat = fileFormat;
    this.traces = Collections.unmodifiableMap(copy);
    this.baseCalls = baseCalls.clone();
    this.quality = quality.clone();
    this.peakLocations = peakLocations.clone();
    this.sequence = new String(this.baseCalls);
    this.maxTraceLength = longest;
  }

  /**
   * Copy of this record with the base call at {@code index} replaced and the
   * sequence rebuilt. Quality and peak location of the base are kept.
   */
  public ChromatogramRecord withBaseCall(int index, char symbol) {
    checkIndex(index);
    char upper = Character.toUpperCase(symbol);
    if (!Channel.isBaseCall(upper)) {
      throw new IllegalArgumentException("Invalid base call '" + symbol + "'");
    }
    char[] edited = baseCalls.clone();
    edited[index] = upper;
    return new ChromatogramRecord(fileName, fileFormat, traces, edited, quality, peakLocations);
  }

  public String getFileName() { return fileName; }
  public FileFormat getFileFormat() { return fileFormat; }
  public String getSequence() { return sequence; }
  public int getSequenceLength() { return baseCalls.length; }

  /** Length of the longest channel. */
  public int getMaxTraceLength() { return maxTraceLength; }

  /** Samples of one channel; an empty array when the file carried none. */
  public double[] getTrace(Channel channel) { return traces.get(channel).clone(); }

  /** Read-only view of all channels. Callers must not modify the arrays. */
  public Map<Channel, double[]> getTraces() { return traces; }

  public char getBaseCall(int index) { checkIndex(index); return baseCalls[index]; }
  public int getQuality(int index) { checkIndex(index); return quality[index]; }
  public int getPeakLocation(int index) { checkIndex(index); return peakLocations[index]; }

  public char[] getBaseCalls() { return baseCalls.clone(); }
  public int[] getQuality() { return quality.clone(); }
  public int[] getPeakLocations() { return peakLocations.clone(); }

  public double getAverageQuality() {
    if (quality.length == 0) return 0;
    long sum = 0;
    for (int q : quality) sum += q;
    return (double) sum / quality.length;
  }

  /** Number of bases whose quality is at least {@code threshold}. */
  public int countHighQuality(int threshold) {
    int count = 0;
    for (int q : quality) {
      if (q >= threshold) count++;
    }
    return count;
  }

  /** Occurrences of each base call symbol, in A, T, G, C, N order. */
  public Map<Character, Integer> getBaseComposition() {
    Map<Character, Integer> counts = new LinkedHashMap<>();
    for (char symbol : new char[] { 'A', 'T', 'G', 'C', 'N' }) counts.put(symbol, 0);
    for (char call : baseCalls) counts.merge(call, 1, Integer::sum);
    return counts;
  }

  private void checkIndex(int index) {
    if (index < 0 || index >= baseCalls.length) {
      throw new IndexOutOfBoundsException("Base index " + index + " outside [0, " + baseCalls.length + ")");
    }
  }

  @Override
  public String toString() {
    return "ChromatogramRecord[" + fileName + ", " + fileFormat + ", " + baseCalls.length + " bases, "
        + maxTraceLength + " samples]";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ChromatogramRecord other)) return false;
    if (!fileName.equals(other.fileName) || fileFormat != other.fileFormat) return false;
    if (!Arrays.equals(baseCalls, other.baseCalls) || !Arrays.equals(quality, other.quality)
        || !Arrays.equals(peakLocations, other.peakLocations)) return false;
    for (Channel channel : Channel.values()) {
      if (!Arrays.equals(traces.get(channel), other.traces.get(channel))) return false;
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = fileName.hashCode();
    result = 31 * result + fileFormat.hashCode();
    result = 31 * result + Arrays.hashCode(baseCalls);
    result = 31 * result + Arrays.hashCode(quality);
    result = 31 * result + Arrays.hashCode(peakLocations);
    return result;
  }
}
