package org.traceplayer.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Zoom, scroll, selection and display state of one chromatogram view.
 * Immutable: every transition returns a new state.
 *
 * @param zoomLevel        pixels per trace sample, within [MIN_ZOOM, MAX_ZOOM]
 * @param scrollFraction   position of the visible window, 0 = start of trace, 1 = end
 * @param selectedIndex    selected base index or {@link #NO_BASE}
 * @param hoveredIndex     base under the pointer or {@link #NO_BASE}
 * @param editedIndices    bases whose call was changed by hand
 * @param highlightRange   bases marked for copy, or null
 * @param qualityThreshold quality below which bars are drawn muted
 * @param visibleChannels  channels whose trace is drawn
 */
public record ViewState(
    double zoomLevel,
    double scrollFraction,
    int selectedIndex,
    int hoveredIndex,
    Set<Integer> editedIndices,
    HighlightRange highlightRange,
    int qualityThreshold,
    Set<Channel> visibleChannels
) {

  public static final int NO_BASE = -1;
  public static final double MIN_ZOOM = 0.5;
  public static final double MAX_ZOOM = 20;
  public static final double DEFAULT_ZOOM = 2.5;
  public static final int DEFAULT_QUALITY_THRESHOLD = 20;

  public ViewState {
    zoomLevel = clamp(zoomLevel, MIN_ZOOM, MAX_ZOOM);
    scrollFraction = clamp(scrollFraction, 0, 1);
    if (selectedIndex < 0) selectedIndex = NO_BASE;
    if (hoveredIndex < 0) hoveredIndex = NO_BASE;
    editedIndices = editedIndices == null ? Collections.emptySet()
        : Collections.unmodifiableSet(new TreeSet<>(editedIndices));
    qualityThreshold = Math.max(0, Math.min(ChromatogramRecord.MAX_QUALITY, qualityThreshold));
    visibleChannels = visibleChannels == null || visibleChannels.isEmpty()
        ? Collections.unmodifiableSet(EnumSet.noneOf(Channel.class))
        : Collections.unmodifiableSet(EnumSet.copyOf(visibleChannels));
  }

  /** Start of trace, default zoom, all channels, nothing selected. */
  public static ViewState initial() {
    return initial(DEFAULT_ZOOM, DEFAULT_QUALITY_THRESHOLD);
  }

  public static ViewState initial(double zoomLevel, int qualityThreshold) {
    return new ViewState(zoomLevel, 0, NO_BASE, NO_BASE, null, null, qualityThreshold,
        EnumSet.allOf(Channel.class));
  }

  public boolean hasSelection() { return selectedIndex != NO_BASE; }
  public boolean hasHover() { return hoveredIndex != NO_BASE; }
  public boolean hasHighlight() { return highlightRange != null; }
  public boolean isEdited(int baseIndex) { return editedIndices.contains(baseIndex); }
  public boolean isChannelVisible(Channel channel) { return visibleChannels.contains(channel); }

  public ViewState withZoomLevel(double zoom) {
    return new ViewState(zoom, scrollFraction, selectedIndex, hoveredIndex, editedIndices, highlightRange,
        qualityThreshold, visibleChannels);
  }

  /** Zoom update, clamped to [MIN_ZOOM, MAX_ZOOM]. */
  public ViewState zoomBy(double delta) { return withZoomLevel(zoomLevel + delta); }

  public ViewState withScrollFraction(double scroll) {
    return new ViewState(zoomLevel, scroll, selectedIndex, hoveredIndex, editedIndices, highlightRange,
        qualityThreshold, visibleChannels);
  }

  /** Scroll update, clamped to [0, 1]. */
  public ViewState scrollBy(double delta) { return withScrollFraction(scrollFraction + delta); }

  public ViewState withSelectedIndex(int index) {
    return new ViewState(zoomLevel, scrollFraction, index, hoveredIndex, editedIndices, highlightRange,
        qualityThreshold, visibleChannels);
  }

  public ViewState withHoveredIndex(int index) {
    return new ViewState(zoomLevel, scrollFraction, selectedIndex, index, editedIndices, highlightRange,
        qualityThreshold, visibleChannels);
  }

  public ViewState withEdited(int baseIndex) {
    Set<Integer> edited = new TreeSet<>(editedIndices);
    edited.add(baseIndex);
    return new ViewState(zoomLevel, scrollFraction, selectedIndex, hoveredIndex, edited, highlightRange,
        qualityThreshold, visibleChannels);
  }

  public ViewState withHighlightRange(HighlightRange range) {
    return new ViewState(zoomLevel, scrollFraction, selectedIndex, hoveredIndex, editedIndices, range,
        qualityThreshold, visibleChannels);
  }

  public ViewState withQualityThreshold(int threshold) {
    return new ViewState(zoomLevel, scrollFraction, selectedIndex, hoveredIndex, editedIndices, highlightRange,
        threshold, visibleChannels);
  }

  public ViewState withChannelVisible(Channel channel, boolean visible) {
    Set<Channel> channels = visibleChannels.isEmpty() ? EnumSet.noneOf(Channel.class) : EnumSet.copyOf(visibleChannels);
    if (visible) channels.add(channel);
    else channels.remove(channel);
    return new ViewState(zoomLevel, scrollFraction, selectedIndex, hoveredIndex, editedIndices, highlightRange,
        qualityThreshold, channels);
  }

  private static double clamp(double value, double min, double max) {
    if (Double.isNaN(value)) return min;
    return Math.max(min, Math.min(max, value));
  }
}
