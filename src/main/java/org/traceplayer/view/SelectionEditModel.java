package org.traceplayer.view;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.traceplayer.io.FastaExporter;
import org.traceplayer.model.Channel;
import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.HighlightRange;
import org.traceplayer.model.ViewState;

/**
 * Selection, hover, edit and highlight state of one viewer session.
 *
 * Holds the current record and ViewState and replaces them on every transition;
 * neither is ever modified in place. At most one base is selected, and only the
 * selected base can be edited.
 */
public class SelectionEditModel {

  private static final Logger log = LoggerFactory.getLogger(SelectionEditModel.class);

  private final double canvasWidth;
  private final double defaultZoom;
  private final int defaultQualityThreshold;
  private ChromatogramRecord record;
  private ViewState state;

  public SelectionEditModel(ChromatogramRecord record) {
    this(record, ViewportMapper.DEFAULT_CANVAS_WIDTH, ViewState.DEFAULT_ZOOM, ViewState.DEFAULT_QUALITY_THRESHOLD);
  }

  public SelectionEditModel(ChromatogramRecord record, double canvasWidth, double defaultZoom,
                            int defaultQualityThreshold) {
    if (record == null) throw new IllegalArgumentException("Record is required");
    this.canvasWidth = canvasWidth;
    this.defaultZoom = defaultZoom;
    this.defaultQualityThreshold = defaultQualityThreshold;
    this.record = record;
    this.state = ViewState.initial(defaultZoom, defaultQualityThreshold);
  }

  public ChromatogramRecord getRecord() { return record; }
  public ViewState getState() { return state; }
  public double getCanvasWidth() { return canvasWidth; }

  /** Viewport for the current record and state. */
  public ViewportMapper viewport() {
    return ViewportMapper.of(state, record, canvasWidth);
  }

  public HitTester hitTester() {
    return new HitTester(record, viewport());
  }

  /** Replace the record wholesale, as when a new file is opened. */
  public void loadRecord(ChromatogramRecord newRecord) {
    if (newRecord == null) throw new IllegalArgumentException("Record is required");
    record = newRecord;
    state = ViewState.initial(defaultZoom, defaultQualityThreshold);
  }

  // ── Selection and hover ───────────────────────────────────────────────

  public void select(int index) {
    checkIndex(index);
    state = state.withSelectedIndex(index);
  }

  /** Select the base nearest to a click; clears the selection when none is close. */
  public int clickAt(double pixelX) {
    state = hitTester().select(state, pixelX);
    return state.selectedIndex();
  }

  public void hover(int index) {
    checkIndex(index);
    state = state.withHoveredIndex(index);
  }

  public int hoverAt(double pixelX) {
    state = hitTester().hover(state, pixelX);
    return state.hoveredIndex();
  }

  public void clearHover() {
    state = state.withHoveredIndex(ViewState.NO_BASE);
  }

  /** Drop the selection and hover. Edited marks stay with the record. */
  public void clearSelection() {
    state = state.withSelectedIndex(ViewState.NO_BASE).withHoveredIndex(ViewState.NO_BASE);
  }

  /** Base call at the selection, or 0 when nothing is selected. */
  public char selectedBaseCall() {
    return state.hasSelection() ? record.getBaseCall(state.selectedIndex()) : 0;
  }

  // ── Editing ───────────────────────────────────────────────────────────

  /**
   * Replace the call of the selected base. The index must be the current selection.
   */
  public void edit(int index, char symbol) {
    checkIndex(index);
    if (state.selectedIndex() != index) {
      throw new IllegalStateException("Base " + (index + 1) + " is not selected");
    }
    char previous = record.getBaseCall(index);
    record = record.withBaseCall(index, symbol);
    state = state.withEdited(index);
    log.info("Edited position {} from {} to {}", index + 1, previous, record.getBaseCall(index));
  }

  // ── Highlight ─────────────────────────────────────────────────────────

  /** Mark 1-based positions {@code start..end} inclusive. */
  public void highlight(int start, int end) {
    state = state.withHighlightRange(HighlightRange.of(start, end, record.getSequenceLength()));
  }

  public void clearHighlight() {
    state = state.withHighlightRange(null);
  }

  /** The highlighted bases as a contiguous sequence, or an empty string. */
  public String highlightedSequence() {
    HighlightRange range = state.highlightRange();
    if (range == null) return "";
    return record.getSequence().substring(range.firstIndex(), range.end());
  }

  // ── View controls ─────────────────────────────────────────────────────

  public void zoom(double delta) { state = state.zoomBy(delta); }
  public void scroll(double delta) { state = state.scrollBy(delta); }
  public void scrollToStart() { state = state.withScrollFraction(0); }
  public void scrollToEnd() { state = state.withScrollFraction(1); }

  /** Jump so the clicked share of the canvas becomes the scroll fraction. */
  public void navigateTo(double pixelX) {
    state = state.withScrollFraction(viewport().navigationScroll(pixelX));
  }

  public void toggleChannel(Channel channel) {
    state = state.withChannelVisible(channel, !state.isChannelVisible(channel));
  }

  public void setQualityThreshold(int threshold) {
    state = state.withQualityThreshold(threshold);
  }

  /** Default zoom, start of trace, nothing selected. */
  public void resetView() {
    state = state.withZoomLevel(defaultZoom).withScrollFraction(0).withSelectedIndex(ViewState.NO_BASE);
  }

  // ── Export ────────────────────────────────────────────────────────────

  public String exportFasta() {
    return FastaExporter.toFasta(record);
  }

  private void checkIndex(int index) {
    if (index < 0 || index >= record.getSequenceLength()) {
      throw new IllegalArgumentException("Base index " + index + " outside [0, " + record.getSequenceLength() + ")");
    }
  }
}
