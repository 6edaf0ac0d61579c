package org.traceplayer.signal;

import java.util.EnumMap;
import java.util.Map;

import org.traceplayer.model.Channel;

/**
 * Gaussian-weighted moving average over trace samples.
 *
 * For a window of {@code w} samples, {@code half = w / 2} and each interior sample
 * becomes the weighted mean of its {@code 2 * half + 1} neighbours with weights
 * {@code exp(-j^2 / (2 * (half / 2)^2))}. The first and last {@code half} samples are
 * copied unchanged, so the output always has the input's length.
 */
public final class TraceSmoother {

  /** SCF traces carry more noise than AB1 ones. */
  public static final int SCF_WINDOW = 3;
  public static final int MOCK_WINDOW = 9;

  private TraceSmoother() {}

  public static double[] smooth(double[] samples, int windowSize) {
    double[] smoothed = samples.clone();
    int half = windowSize / 2;
    if (half <= 0) return smoothed;

    double[] weights = weights(half);
    double weightSum = 0;
    for (double w : weights) weightSum += w;

    for (int i = half; i < samples.length - half; i++) {
      double sum = 0;
      for (int j = -half; j <= half; j++) {
        sum += samples[i + j] * weights[j + half];
      }
      smoothed[i] = sum / weightSum;
    }
    return smoothed;
  }

  /** Smooth every channel with the same window. */
  public static Map<Channel, double[]> smoothAll(Map<Channel, double[]> traces, int windowSize) {
    Map<Channel, double[]> smoothed = new EnumMap<>(Channel.class);
    for (Map.Entry<Channel, double[]> entry : traces.entrySet()) {
      smoothed.put(entry.getKey(), smooth(entry.getValue(), windowSize));
    }
    return smoothed;
  }

  static double[] weights(int half) {
    double sigma = half / 2.0;
    double[] weights = new double[2 * half + 1];
    for (int j = -half; j <= half; j++) {
      weights[j + half] = Math.exp(-(j * j) / (2 * sigma * sigma));
    }
    return weights;
  }
}
