package org.traceplayer.draw;

import java.util.List;

import org.traceplayer.model.Channel;

/**
 * Everything needed to paint one frame of a chromatogram, in canvas pixels.
 * Produced by {@link GeometryBuilder}, consumed by a {@link RenderSink}.
 *
 * Optional elements (selection line, hover column, highlight) are null when absent.
 */
public record ChromatogramGeometry(
    double width,
    double height,
    List<TracePolyline> traces,
    List<MarkerBox> markers,
    List<BaseLabel> labels,
    List<QualityBar> qualityBars,
    List<PositionMarker> positionMarkers,
    Line selectionLine,
    Rect hoverColumn,
    Rect highlight,
    Line thresholdLine,
    String positionsText
) {

  public ChromatogramGeometry {
    traces = List.copyOf(traces);
    markers = List.copyOf(markers);
    labels = List.copyOf(labels);
    qualityBars = List.copyOf(qualityBars);
    positionMarkers = List.copyOf(positionMarkers);
  }

  public record Line(double x1, double y1, double x2, double y2) {}

  public record Rect(double x, double y, double width, double height) {}

  /** One channel's visible samples as a connected line. */
  public record TracePolyline(Channel channel, double[] xs, double[] ys) {
    public int size() { return xs.length; }
  }

  /** Base letter anchored at its peak x. */
  public record BaseLabel(int baseIndex, char symbol, double x, double y) {}

  public record QualityBar(int baseIndex, char symbol, Rect bounds, boolean belowThreshold) {}

  public enum MarkerKind { SELECTED, UNCALLED, EDITED }

  /** Box behind a base label. A base can carry several, drawn in enum order. */
  public record MarkerBox(int baseIndex, MarkerKind kind, Rect bounds) {}

  /** 1-based position label with its tick. */
  public record PositionMarker(int position, double x, Line tick) {}

  public boolean isEmpty() {
    return traces.isEmpty() && labels.isEmpty();
  }
}
