package org.traceplayer.view;

import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.ViewState;

/**
 * Maps zoom and scroll onto the visible window of trace samples and converts between
 * sample indices and canvas x coordinates.
 *
 * The zoom level is pixels per sample: a canvas of width {@code W} at zoom {@code Z}
 * shows {@code floor(W / Z)} samples. The scroll fraction
 * positions that window between the first and the last sample.
 */
public final class ViewportMapper {

  public static final double DEFAULT_CANVAS_WIDTH = 1200;

  private final double zoomLevel;
  private final double canvasWidth;
  private final int totalSamples;
  private final int visibleSamples;
  private final int startIndex;
  private final int endIndex;

  public ViewportMapper(double zoomLevel, double scrollFraction, int totalSamples, double canvasWidth) {
    if (canvasWidth <= 0) throw new IllegalArgumentException("Canvas width must be positive: " + canvasWidth);
    if (totalSamples < 0) throw new IllegalArgumentException("Negative sample count: " + totalSamples);
    this.zoomLevel = zoomLevel;
    this.canvasWidth = canvasWidth;
    this.totalSamples = totalSamples;
    this.visibleSamples = (int) Math.floor(canvasWidth / zoomLevel);

    int start = (int) Math.floor(scrollFraction * Math.max(0, totalSamples - visibleSamples));
    start = clamp(start, 0, totalSamples);
    this.startIndex = start;
    this.endIndex = clamp((int) Math.min((long) start + visibleSamples, totalSamples), start, totalSamples);
  }

  public static ViewportMapper of(ViewState state, ChromatogramRecord record, double canvasWidth) {
    return new ViewportMapper(state.zoomLevel(), state.scrollFraction(), record.getMaxTraceLength(), canvasWidth);
  }

  public static ViewportMapper of(ViewState state, ChromatogramRecord record) {
    return of(state, record, DEFAULT_CANVAS_WIDTH);
  }

  public int getStartIndex() { return startIndex; }
  public int getEndIndex() { return endIndex; }
  public int getVisibleSamples() { return visibleSamples; }
  public int getTotalSamples() { return totalSamples; }
  public double getCanvasWidth() { return canvasWidth; }
  public double getZoomLevel() { return zoomLevel; }

  /** True when no sample is visible and pixel transforms are undefined. */
  public boolean isEmpty() { return endIndex == startIndex; }

  /** True if the sample index lies in the closed window {@code [start, end]}. */
  public boolean contains(double sampleIndex) {
    return sampleIndex >= startIndex && sampleIndex <= endIndex;
  }

  public double toPixelX(double sampleIndex) {
    if (isEmpty()) throw new IllegalStateException("Empty viewport: no samples visible");
    return (sampleIndex - startIndex) * canvasWidth / (endIndex - startIndex);
  }

  public double toSampleIndex(double pixelX) {
    if (isEmpty()) throw new IllegalStateException("Empty viewport: no samples visible");
    return startIndex + pixelX * (endIndex - startIndex) / canvasWidth;
  }

  /**
   * Scroll fraction that centres navigation on a clicked x position: the click's
   * share of the canvas width, clamped to [0, 1].
   */
  public double navigationScroll(double pixelX) {
    return Math.max(0, Math.min(1, pixelX / canvasWidth));
  }

  /**
   * 1-based first and last base positions shown, derived from the sample window.
   * Returns {0, 0} for an empty record.
   */
  public int[] visibleBaseRange(ChromatogramRecord record) {
    int bases = record.getSequenceLength();
    if (totalSamples == 0 || bases == 0) return new int[] { 0, 0 };
    int first = (int) ((long) startIndex * bases / totalSamples);
    int last = (int) ((long) endIndex * bases / totalSamples);
    return new int[] { first + 1, Math.min(last, bases) };
  }

  /** Bases between position labels: denser labels when zoomed in. */
  public int positionMarkerInterval() {
    if (zoomLevel > 10) return 10;
    if (zoomLevel > 5) return 25;
    return 50;
  }

  private static int clamp(int value, int min, int max) {
    return Math.max(min, Math.min(max, value));
  }
}
