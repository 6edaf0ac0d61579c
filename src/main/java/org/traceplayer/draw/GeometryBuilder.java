package org.traceplayer.draw;

import java.util.ArrayList;
import java.util.List;

import org.traceplayer.draw.ChromatogramGeometry.BaseLabel;
import org.traceplayer.draw.ChromatogramGeometry.Line;
import org.traceplayer.draw.ChromatogramGeometry.MarkerBox;
import org.traceplayer.draw.ChromatogramGeometry.MarkerKind;
import org.traceplayer.draw.ChromatogramGeometry.PositionMarker;
import org.traceplayer.draw.ChromatogramGeometry.QualityBar;
import org.traceplayer.draw.ChromatogramGeometry.Rect;
import org.traceplayer.draw.ChromatogramGeometry.TracePolyline;
import org.traceplayer.model.Channel;
import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.HighlightRange;
import org.traceplayer.model.ViewState;
import org.traceplayer.view.ViewportMapper;

/**
 * Lays out a record under a view state as pixel geometry.
 *
 * Vertical layout of the 200 px band, top to bottom: base labels and marker boxes
 * (10..35), traces (50..170, normalised to the tallest visible sample), quality
 * bars (175..187), threshold line (190..202) and position labels at the bottom.
 */
public final class GeometryBuilder {

  public static final double HEIGHT = 200;
  public static final double BASELINE_Y = 170;
  public static final double TRACE_HEIGHT = 120;
  public static final double LABEL_Y = 25;
  public static final double BOX_TOP = 10;
  public static final double BOX_HALF_WIDTH = 12;
  public static final double BOX_HEIGHT = 25;
  public static final double QUALITY_BAR_WIDTH = 4;
  public static final double QUALITY_BAR_HEIGHT = 12;
  static final double LABEL_MARGIN = 20;

  private GeometryBuilder() {}

  public static ChromatogramGeometry build(ChromatogramRecord record, ViewState state, ViewportMapper mapper) {
    double width = mapper.getCanvasWidth();
    List<TracePolyline> traces = new ArrayList<>();
    List<MarkerBox> markers = new ArrayList<>();
    List<BaseLabel> labels = new ArrayList<>();
    List<QualityBar> bars = new ArrayList<>();
    List<PositionMarker> positions = new ArrayList<>();
    Line selectionLine = null;
    Rect hoverColumn = null;
    Rect highlight = null;
    String positionsText = "No trace data";

    if (!mapper.isEmpty()) {
      addTraces(record, state, mapper, traces);

      for (int i = 0; i < record.getSequenceLength(); i++) {
        int peak = record.getPeakLocation(i);
        if (!mapper.contains(peak)) continue;
        double x = mapper.toPixelX(peak);
        if (x < -LABEL_MARGIN || x > width + LABEL_MARGIN) continue;

        char call = record.getBaseCall(i);
        Rect box = new Rect(x - BOX_HALF_WIDTH, BOX_TOP, 2 * BOX_HALF_WIDTH, BOX_HEIGHT);
        if (state.selectedIndex() == i) markers.add(new MarkerBox(i, MarkerKind.SELECTED, box));
        if (call == 'N') markers.add(new MarkerBox(i, MarkerKind.UNCALLED, box));
        if (state.isEdited(i)) markers.add(new MarkerBox(i, MarkerKind.EDITED, box));

        labels.add(new BaseLabel(i, call, x, LABEL_Y));

        int q = record.getQuality(i);
        double barHeight = q * QUALITY_BAR_HEIGHT / ChromatogramRecord.MAX_QUALITY;
        bars.add(new QualityBar(i, call, new Rect(x - QUALITY_BAR_WIDTH / 2, BASELINE_Y + 5, QUALITY_BAR_WIDTH, barHeight),
            q < state.qualityThreshold()));
      }

      int interval = mapper.positionMarkerInterval();
      for (int pos = 0; pos < record.getSequenceLength(); pos += interval) {
        int peak = record.getPeakLocation(pos);
        if (!mapper.contains(peak)) continue;
        double x = mapper.toPixelX(peak);
        if (x < 0 || x > width) continue;
        positions.add(new PositionMarker(pos + 1, x, new Line(x, BASELINE_Y + 20, x, HEIGHT - 15)));
      }

      if (state.hasSelection()) {
        double x = peakX(record, mapper, state.selectedIndex());
        if (x >= 0 && x <= width) selectionLine = new Line(x, 30, x, BASELINE_Y + 25);
      }

      if (state.hasHover() && state.hoveredIndex() != state.selectedIndex()) {
        double x = peakX(record, mapper, state.hoveredIndex());
        if (x >= 0 && x <= width) hoverColumn = new Rect(x - BOX_HALF_WIDTH, BOX_TOP, 2 * BOX_HALF_WIDTH, BASELINE_Y + 35);
      }

      if (state.hasHighlight()) highlight = highlightRect(record, mapper, state.highlightRange());

      int[] range = mapper.visibleBaseRange(record);
      positionsText = "Showing positions " + range[0] + " - " + range[1] + " of " + record.getSequenceLength();
    }

    double thresholdY = BASELINE_Y + 20 + state.qualityThreshold() * QUALITY_BAR_HEIGHT / ChromatogramRecord.MAX_QUALITY;
    Line thresholdLine = new Line(0, thresholdY, width, thresholdY);

    return new ChromatogramGeometry(width, HEIGHT, traces, markers, labels, bars, positions,
        selectionLine, hoverColumn, highlight, thresholdLine, positionsText);
  }

  private static void addTraces(ChromatogramRecord record, ViewState state, ViewportMapper mapper,
                                List<TracePolyline> traces) {
    int start = mapper.getStartIndex();
    int end = mapper.getEndIndex();

    double maxValue = 0;
    for (double[] data : record.getTraces().values()) {
      for (int i = start; i < end && i < data.length; i++) maxValue = Math.max(maxValue, data[i]);
    }
    if (maxValue == 0) maxValue = 1;

    for (Channel channel : Channel.values()) {
      double[] data = record.getTraces().get(channel);
      if (!state.isChannelVisible(channel) || data.length == 0) continue;
      int stop = Math.min(end, data.length);
      if (stop <= start) continue;

      double[] xs = new double[stop - start];
      double[] ys = new double[stop - start];
      for (int i = start; i < stop; i++) {
        xs[i - start] = mapper.toPixelX(i);
        ys[i - start] = BASELINE_Y - data[i] / maxValue * TRACE_HEIGHT;
      }
      traces.add(new TracePolyline(channel, xs, ys));
    }
  }

  private static Rect highlightRect(ChromatogramRecord record, ViewportMapper mapper, HighlightRange range) {
    if (range.lastIndex() >= record.getSequenceLength()) return null;
    int startPeak = record.getPeakLocation(range.firstIndex());
    int endPeak = record.getPeakLocation(range.lastIndex());
    if (endPeak < mapper.getStartIndex() || startPeak > mapper.getEndIndex()) return null;

    double startX = Math.max(0, mapper.toPixelX(startPeak));
    double endX = Math.min(mapper.getCanvasWidth(), mapper.toPixelX(endPeak));
    return new Rect(startX - BOX_HALF_WIDTH, BOX_TOP, endX - startX + 2 * BOX_HALF_WIDTH, BASELINE_Y + 35);
  }

  private static double peakX(ChromatogramRecord record, ViewportMapper mapper, int index) {
    if (index >= record.getSequenceLength()) return Double.NaN;
    return mapper.toPixelX(record.getPeakLocation(index));
  }
}
