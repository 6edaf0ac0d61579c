package org.traceplayer.traces.scf;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.traceplayer.model.Channel;
import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.FileFormat;
import org.traceplayer.signal.TraceSmoother;
import org.traceplayer.traces.TraceFileReader;
import org.traceplayer.traces.TraceFormatException;
import org.traceplayer.traces.TraceFormatException.Reason;
import org.traceplayer.utils.BigEndian;

/**
 * Decoder for Standard Chromatogram Format (.scf) files.
 *
 * Layout: a fixed header, then the four channels of samples stored one after another
 * in A, C, G, T order, then one 12-byte record per base. Samples are smoothed with a
 * window of {@link TraceSmoother#SCF_WINDOW} after reading.
 */
public class SCFReader implements TraceFileReader {

  private static final Logger log = LoggerFactory.getLogger(SCFReader.class);

  static final Channel[] SAMPLE_ORDER = { Channel.A, Channel.C, Channel.G, Channel.T };
  static final int SENTINEL_QUALITY = 20;

  private final PeakPositionPolicy peakPolicy;
  private final SCFBaseCallDecoder baseCallDecoder;

  public SCFReader() {
    this(PeakPositionPolicy.ESTIMATED, new SCFBaseCallDecoder());
  }

  public SCFReader(PeakPositionPolicy peakPolicy) {
    this(peakPolicy, new SCFBaseCallDecoder());
  }

  public SCFReader(PeakPositionPolicy peakPolicy, SCFBaseCallDecoder baseCallDecoder) {
    this.peakPolicy = peakPolicy;
    this.baseCallDecoder = baseCallDecoder;
  }

  @Override
  public FileFormat getFormat() { return FileFormat.SCF; }

  public PeakPositionPolicy getPeakPolicy() { return peakPolicy; }

  @Override
  public ChromatogramRecord read(byte[] data, String fileName) throws TraceFormatException {
    if (data == null || data.length < 4 || data[0] != 0x2E || data[1] != 0x73 || data[2] != 0x63 || data[3] != 0x66) {
      throw new TraceFormatException(Reason.MALFORMED_CONTAINER, "Not a valid SCF file - missing .scf signature");
    }
    SCFHeader header = SCFHeader.read(data);
    log.debug("SCF file {}: {} samples, {} bases, version {}, sample size {}", fileName,
        header.samples(), header.bases(), header.version(), header.sampleSize());
    if (header.samples() == 0 || header.bases() == 0) {
      throw new TraceFormatException(Reason.INVALID_HEADER, "Invalid SCF file - no samples or bases found");
    }
    if (header.sampleSize() != 1 && header.sampleSize() != 2) {
      throw new TraceFormatException(Reason.UNSUPPORTED_SAMPLE_SIZE,
          "Unsupported sample size: " + header.sampleSize());
    }

    Map<Channel, double[]> traces = TraceSmoother.smoothAll(readSamples(data, header), TraceSmoother.SCF_WINDOW);

    int samples = (int) header.samples();
    int bases = (int) Math.min(header.bases(), Integer.MAX_VALUE);
    // records that fit in the buffer; estimates still divide by the declared count
    int capacity = (int) Math.max(0, Math.min(bases, (data.length - header.basesOffset()) / SCFBaseRecord.SIZE));
    char[] baseCalls = new char[capacity];
    int[] quality = new int[capacity];
    int[] peakLocations = new int[capacity];

    int read = 0;
    for (int i = 0; i < bases; i++) {
      long offset = header.basesOffset() + (long) i * SCFBaseRecord.SIZE;
      if (!BigEndian.fits(data, offset, SCFBaseRecord.SIZE)) {
        log.warn("Base {} extends beyond file length, stopping at {} bases", i, read);
        break;
      }
      int estimatedPeak = (int) ((long) i * samples / bases);
      try {
        SCFBaseRecord record = new SCFBaseRecord(
            Arrays.copyOfRange(data, (int) offset, (int) offset + SCFBaseRecord.SIZE));
        baseCalls[i] = baseCallDecoder.decode(record);
        quality[i] = SCFBaseCallDecoder.quality(record);
        peakLocations[i] = peakPosition(record, estimatedPeak, samples);
      } catch (RuntimeException e) {
        log.warn("Error reading base {}: {}", i, e.getMessage());
        baseCalls[i] = 'N';
        quality[i] = SENTINEL_QUALITY;
        peakLocations[i] = estimatedPeak;
      }
      read++;
    }

    boolean noTraces = traces.values().stream().allMatch(trace -> trace.length == 0);
    if (noTraces) {
      throw new TraceFormatException(Reason.NO_TRACE_DATA, "No trace data found in SCF file");
    }
    if (read == 0) {
      throw new TraceFormatException(Reason.NO_BASE_CALLS, "No base calls found in SCF file");
    }

    log.debug("Parsed SCF {}: {} bases, {} trace points", fileName, read, samples);
    return new ChromatogramRecord(fileName == null ? "parsed.scf" : fileName, FileFormat.SCF, traces,
        Arrays.copyOf(baseCalls, read), Arrays.copyOf(quality, read), Arrays.copyOf(peakLocations, read));
  }

  private Map<Channel, double[]> readSamples(byte[] data, SCFHeader header) throws TraceFormatException {
    int sampleSize = (int) header.sampleSize();
    long channelBytes = header.samples() * sampleSize;
    if (!BigEndian.fits(data, header.samplesOffset(), channelBytes * SAMPLE_ORDER.length)) {
      throw new TraceFormatException(Reason.MALFORMED_CONTAINER, "SCF sample block of " + channelBytes * 4
          + " bytes at offset " + header.samplesOffset() + " exceeds file length " + data.length);
    }

    ByteBuffer buf = BigEndian.wrap(data);
    int samples = (int) header.samples();
    Map<Channel, double[]> traces = new EnumMap<>(Channel.class);
    for (int k = 0; k < SAMPLE_ORDER.length; k++) {
      int channelOffset = (int) (header.samplesOffset() + k * channelBytes);
      double[] trace = new double[samples];
      for (int i = 0; i < samples; i++) {
        int sampleOffset = channelOffset + i * sampleSize;
        trace[i] = sampleSize == 1 ? BigEndian.readUByte(data, sampleOffset) : BigEndian.readUShort(buf, sampleOffset);
      }
      traces.put(SAMPLE_ORDER[k], trace);
    }
    return traces;
  }

  private int peakPosition(SCFBaseRecord record, int estimatedPeak, int samples) {
    if (peakPolicy == PeakPositionPolicy.NATIVE) {
      long stored = record.nativePeakIndex();
      if (stored <= samples) return (int) stored;
    }
    return estimatedPeak;
  }
}
