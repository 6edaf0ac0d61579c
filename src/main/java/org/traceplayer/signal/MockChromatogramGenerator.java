package org.traceplayer.signal;

import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

import org.traceplayer.model.Channel;
import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.FileFormat;

/**
 * Synthesises a displayable chromatogram for when no real trace can be decoded.
 *
 * Each base occupies four samples with its peak at the window centre. The channel
 * matching the base gets a Gaussian peak, every other sample gets low background
 * noise, and all channels share a per-sample jitter. Quality drifts downward along
 * the read the way instrument quality does.
 */
public class MockChromatogramGenerator {

  public static final int SEQUENCE_LENGTH = 800;
  public static final int SAMPLES_PER_BASE = 4;
  static final double PEAK_WIDTH = 2;
  static final double BACKGROUND_NOISE = 15;
  static final double JITTER = 25;

  private static final Channel[] BASES = { Channel.A, Channel.T, Channel.G, Channel.C };
  private static final Map<Channel, Double> PEAK_HEIGHTS = Map.of(
      Channel.A, 100.0,
      Channel.T, 80.0,
      Channel.G, 120.0,
      Channel.C, 90.0);

  private final Random random;

  public MockChromatogramGenerator() {
    this(new Random());
  }

  public MockChromatogramGenerator(Random random) {
    this.random = random;
  }

  public ChromatogramRecord generate(String fileName) {
    char[] baseCalls = new char[SEQUENCE_LENGTH];
    for (int i = 0; i < SEQUENCE_LENGTH; i++) {
      baseCalls[i] = BASES[random.nextInt(BASES.length)].symbol();
    }

    int sampleCount = SEQUENCE_LENGTH * SAMPLES_PER_BASE;
    Map<Channel, double[]> traces = new EnumMap<>(Channel.class);
    for (Channel channel : Channel.values()) traces.put(channel, new double[sampleCount]);

    int[] quality = new int[SEQUENCE_LENGTH];
    int[] peakLocations = new int[SEQUENCE_LENGTH];

    for (int x = 0; x < sampleCount; x++) {
      int baseIndex = x / SAMPLES_PER_BASE;
      Channel base = Channel.fromSymbol(baseCalls[baseIndex]);
      double jitter = (random.nextDouble() - 0.5) * 2 * JITTER;
      for (Channel channel : BASES) {
        traces.get(channel)[x] = peak(x, baseIndex, channel == base, PEAK_HEIGHTS.get(channel)) + jitter;
      }

      if (x % SAMPLES_PER_BASE == 0) {
        peakLocations[baseIndex] = peakCenter(baseIndex);
        double q = 40 + (random.nextDouble() * 20 - 10) - 0.05 * baseIndex;
        quality[baseIndex] = (int) Math.round(Math.max(10, Math.min(ChromatogramRecord.MAX_QUALITY, q)));
      }
    }

    return new ChromatogramRecord(fileName == null || fileName.isEmpty() ? "unknown.ab1" : fileName, FileFormat.MOCK,
        TraceSmoother.smoothAll(traces, TraceSmoother.MOCK_WINDOW), baseCalls, quality, peakLocations);
  }

  static int peakCenter(int baseIndex) {
    return baseIndex * SAMPLES_PER_BASE + SAMPLES_PER_BASE / 2;
  }

  private double peak(int x, int baseIndex, boolean isPeak, double maxHeight) {
    double distance = Math.abs(x - peakCenter(baseIndex));
    if (isPeak && distance < PEAK_WIDTH * 2) {
      return maxHeight * Math.exp(-(distance * distance) / (2 * PEAK_WIDTH * PEAK_WIDTH));
    }
    return random.nextDouble() * BACKGROUND_NOISE;
  }
}
