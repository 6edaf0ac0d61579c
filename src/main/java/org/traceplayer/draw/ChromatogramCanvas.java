package org.traceplayer.draw;

import org.traceplayer.draw.ChromatogramGeometry.BaseLabel;
import org.traceplayer.draw.ChromatogramGeometry.Line;
import org.traceplayer.draw.ChromatogramGeometry.MarkerBox;
import org.traceplayer.draw.ChromatogramGeometry.PositionMarker;
import org.traceplayer.draw.ChromatogramGeometry.QualityBar;
import org.traceplayer.draw.ChromatogramGeometry.Rect;
import org.traceplayer.draw.ChromatogramGeometry.TracePolyline;
import org.traceplayer.model.Channel;
import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.utils.BaseColors;
import org.traceplayer.view.SelectionEditModel;

import javafx.beans.property.BooleanProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.input.KeyCode;
import javafx.scene.input.KeyEvent;
import javafx.scene.input.MouseButton;
import javafx.scene.input.MouseEvent;
import javafx.scene.input.ScrollEvent;
import javafx.scene.paint.Color;
import javafx.scene.shape.StrokeLineCap;
import javafx.scene.shape.StrokeLineJoin;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;

public class ChromatogramCanvas extends Canvas implements RenderSink {

  public static final double WHEEL_SCROLL_STEP = 0.0007;
  public static final double WHEEL_ZOOM_STEP = 0.5;

  static final Color SELECTED_FILL = Color.web("#FFD700");
  static final Color SELECTED_STROKE = Color.web("#FF6600");
  static final Color UNCALLED_FILL = Color.rgb(255, 0, 0, 0.3);
  static final Color EDITED_FILL = Color.rgb(128, 0, 255, 0.3);
  static final Color EDITED_STROKE = Color.web("#8000FF");
  static final Color HOVER_FILL = Color.rgb(173, 216, 230, 0.4);
  static final Color HIGHLIGHT_FILL = Color.rgb(255, 255, 0, 0.3);
  static final Color THRESHOLD_STROKE = Color.web("#FF6B6B");
  static final Color TEXT_COLOR = Color.web("#666666");

  /** Toggled after every state change so surrounding controls can refresh. */
  public final BooleanProperty update = new SimpleBooleanProperty(false);

  private final GraphicsContext gc;
  private final SelectionEditModel model;
  private ChromatogramGeometry geometry;

  public ChromatogramCanvas(SelectionEditModel model) {
    super(model.getCanvasWidth(), GeometryBuilder.HEIGHT);
    this.model = model;
    gc = getGraphicsContext2D();
    setFocusTraversable(true);

    setOnMouseClicked(this::handleClick);
    setOnMouseMoved(event -> { model.hoverAt(event.getX()); redraw(); });
    setOnMouseExited(event -> { model.clearHover(); redraw(); });
    setOnScroll(this::handleScroll);
    setOnKeyPressed(this::handleKey);
    redraw();
  }

  public SelectionEditModel getModel() { return model; }

  /** Geometry of the last redraw. */
  public ChromatogramGeometry getGeometry() { return geometry; }

  /** Rebuild geometry from the model and paint it. */
  public void redraw() {
    geometry = GeometryBuilder.build(model.getRecord(), model.getState(), model.viewport());
    render(geometry);
    update.set(!update.get());
  }

  @Override
  public void render(ChromatogramGeometry geometry) {
    gc.setFill(Color.WHITE);
    gc.fillRect(0, 0, getWidth(), getHeight());

    if (geometry.isEmpty()) {
      gc.setFill(Color.RED);
      gc.setFont(Font.font("SansSerif", 16));
      gc.fillText("No trace data available", 50, 50);
      return;
    }

    gc.setLineWidth(2);
    gc.setLineCap(StrokeLineCap.ROUND);
    gc.setLineJoin(StrokeLineJoin.ROUND);
    for (TracePolyline trace : geometry.traces()) {
      gc.setStroke(BaseColors.getChannelColor(trace.channel()));
      gc.strokePolyline(trace.xs(), trace.ys(), trace.size());
    }

    for (MarkerBox marker : geometry.markers()) drawMarker(marker);

    gc.setFont(Font.font("Monospaced", FontWeight.BOLD, 16));
    for (BaseLabel label : geometry.labels()) {
      gc.setFill(BaseColors.getBaseColor(label.symbol()));
      gc.fillText(String.valueOf(label.symbol()), label.x() - 6, label.y());
    }

    for (QualityBar bar : geometry.qualityBars()) {
      gc.setFill(bar.belowThreshold() ? BaseColors.LOW_QUALITY : BaseColors.getBaseColor(bar.symbol()));
      fillRect(bar.bounds());
    }

    gc.setFont(Font.font("Monospaced", 12));
    gc.setLineWidth(1);
    for (PositionMarker marker : geometry.positionMarkers()) {
      gc.setFill(TEXT_COLOR);
      gc.fillText(Integer.toString(marker.position()), marker.x() - 10, geometry.height() - 5);
      gc.setStroke(BaseColors.LOW_QUALITY);
      strokeLine(marker.tick());
    }

    if (geometry.selectionLine() != null) {
      gc.setStroke(SELECTED_STROKE);
      gc.setLineWidth(2);
      gc.setLineDashes(5, 5);
      strokeLine(geometry.selectionLine());
      gc.setLineDashes();
    }

    if (geometry.hoverColumn() != null) {
      gc.setFill(HOVER_FILL);
      fillRect(geometry.hoverColumn());
    }

    gc.setStroke(THRESHOLD_STROKE);
    gc.setLineWidth(1);
    gc.setLineDashes(5, 5);
    strokeLine(geometry.thresholdLine());
    gc.setLineDashes();

    Rect highlight = geometry.highlight();
    if (highlight != null) {
      gc.setFill(HIGHLIGHT_FILL);
      fillRect(highlight);
      gc.setStroke(SELECTED_FILL);
      gc.setLineWidth(2);
      double left = highlight.x() + GeometryBuilder.BOX_HALF_WIDTH;
      double right = highlight.x() + highlight.width() - GeometryBuilder.BOX_HALF_WIDTH;
      gc.strokeLine(left, highlight.y(), left, highlight.y() + highlight.height() + 10);
      gc.strokeLine(right, highlight.y(), right, highlight.y() + highlight.height() + 10);
    }
  }

  private void drawMarker(MarkerBox marker) {
    switch (marker.kind()) {
      case SELECTED -> { gc.setFill(SELECTED_FILL); gc.setStroke(SELECTED_STROKE); gc.setLineWidth(2); }
      case UNCALLED -> { gc.setFill(UNCALLED_FILL); gc.setStroke(Color.RED); gc.setLineWidth(1); }
      case EDITED -> { gc.setFill(EDITED_FILL); gc.setStroke(EDITED_STROKE); gc.setLineWidth(1); }
    }
    fillRect(marker.bounds());
    Rect r = marker.bounds();
    gc.strokeRect(r.x(), r.y(), r.width(), r.height());
  }

  private void fillRect(Rect r) { gc.fillRect(r.x(), r.y(), r.width(), r.height()); }
  private void strokeLine(Line l) { gc.strokeLine(l.x1(), l.y1(), l.x2(), l.y2()); }

  // ── Input ─────────────────────────────────────────────────────────────

  void handleClick(MouseEvent event) {
    if (event.getButton() != MouseButton.PRIMARY) return;
    requestFocus();
    if (event.getClickCount() == 2) model.navigateTo(event.getX());
    else model.clickAt(event.getX());
    redraw();
  }

  void handleScroll(ScrollEvent event) {
    event.consume();
    double delta = event.getDeltaX() != 0 ? event.getDeltaX() : event.getDeltaY();
    if (delta == 0) return;
    if (event.isControlDown()) model.zoom(delta > 0 ? WHEEL_ZOOM_STEP : -WHEEL_ZOOM_STEP);
    else model.scroll(delta > 0 ? -WHEEL_SCROLL_STEP : WHEEL_SCROLL_STEP);
    redraw();
  }

  /** Base letters rewrite the selected call, arrows step the selection. */
  void handleKey(KeyEvent event) {
    ChromatogramRecord record = model.getRecord();
    int selected = model.getState().selectedIndex();
    KeyCode code = event.getCode();

    if (code == KeyCode.ESCAPE) {
      model.clearSelection();
    } else if (code == KeyCode.HOME) {
      model.scrollToStart();
    } else if (code == KeyCode.END) {
      model.scrollToEnd();
    } else if (selected >= 0 && code == KeyCode.LEFT && selected > 0) {
      model.select(selected - 1);
    } else if (selected >= 0 && code == KeyCode.RIGHT && selected < record.getSequenceLength() - 1) {
      model.select(selected + 1);
    } else if (selected >= 0 && code.isLetterKey() && isCallKey(code)) {
      model.edit(selected, code.getName().charAt(0));
    } else {
      return;
    }
    event.consume();
    redraw();
  }

  private static boolean isCallKey(KeyCode code) {
    char c = code.getName().charAt(0);
    return c == 'N' || Channel.fromSymbol(c) != null;
  }
}
