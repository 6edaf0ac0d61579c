package org.traceplayer;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.kordamp.ikonli.fontawesome5.FontAwesomeSolid;
import org.kordamp.ikonli.javafx.FontIcon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.traceplayer.draw.ChromatogramCanvas;
import org.traceplayer.io.ChromatogramJson;
import org.traceplayer.io.ChromatogramLoader;
import org.traceplayer.io.FastaExporter;
import org.traceplayer.io.UserPreferences;
import org.traceplayer.io.ViewerSettings;
import org.traceplayer.model.Channel;
import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.ViewState;
import org.traceplayer.signal.MockChromatogramGenerator;
import org.traceplayer.view.SelectionEditModel;

import javafx.application.Application;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.scene.Scene;
import javafx.scene.control.Alert;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.Slider;
import javafx.scene.control.TextField;
import javafx.scene.control.ToggleButton;
import javafx.scene.control.ToolBar;
import javafx.scene.input.Clipboard;
import javafx.scene.input.ClipboardContent;
import javafx.scene.layout.HBox;
import javafx.scene.layout.VBox;
import javafx.stage.DirectoryChooser;
import javafx.stage.FileChooser;
import javafx.stage.Stage;

/**
 * Desktop viewer: open an AB1 or SCF file, inspect and correct its base calls,
 * export the corrected read.
 */
public class TracePlayerApp extends Application {

  private static final Logger log = LoggerFactory.getLogger(TracePlayerApp.class);

  public static Stage stage;

  private final ViewerSettings settings = ViewerSettings.get();
  private final ChromatogramLoader loader = new ChromatogramLoader(settings);
  private SelectionEditModel model;
  private ChromatogramCanvas canvas;

  private final Label fileLabel = new Label();
  private final Label statsLabel = new Label();
  private final Label positionsLabel = new Label();
  private final Label selectionLabel = new Label();
  private final Slider scrollSlider = new Slider(0, 1, 0);
  private final Slider thresholdSlider = new Slider(0, ChromatogramRecord.MAX_QUALITY, 0);
  private final List<ToggleButton> channelToggles = new ArrayList<>();
  private boolean syncingSlider = false;

  @Override
  public void start(Stage primaryStage) {
    stage = primaryStage;
    model = new SelectionEditModel(new MockChromatogramGenerator().generate(null),
        settings.getCanvasWidth(), settings.getDefaultZoom(), settings.getQualityThreshold());
    canvas = new ChromatogramCanvas(model);
    canvas.update.addListener((obs, oldVal, newVal) -> refreshLabels());

    scrollSlider.setPrefWidth(settings.getCanvasWidth());
    scrollSlider.valueProperty().addListener((obs, oldVal, newVal) -> {
      if (syncingSlider) return;
      model.scroll(newVal.doubleValue() - model.getState().scrollFraction());
      canvas.redraw();
    });

    VBox root = new VBox(6, buildToolBar(), buildViewToolBar(), canvas, scrollSlider,
        new HBox(16, positionsLabel, selectionLabel), buildHighlightBar(), new HBox(16, fileLabel, statsLabel));
    root.setPadding(new Insets(8));

    stage.setScene(new Scene(root));
    stage.setTitle("TracePlayer");
    stage.show();
    refreshLabels();
    canvas.requestFocus();
  }

  private ToolBar buildToolBar() {
    Button open = new Button("Open…");
    open.setOnAction(e -> openFile());
    Button fasta = new Button("Export FASTA");
    fasta.setOnAction(e -> exportFasta());
    Button json = new Button("Export JSON");
    json.setOnAction(e -> exportJson());
    return new ToolBar(open, fasta, json);
  }

  private static Button iconButton(FontAwesomeSolid icon) {
    FontIcon graphic = new FontIcon(icon);
    graphic.setIconSize(14);
    Button button = new Button();
    button.setGraphic(graphic);
    return button;
  }

  private ToolBar buildViewToolBar() {
    Button zoomOut = iconButton(FontAwesomeSolid.SEARCH_MINUS);
    zoomOut.setOnAction(e -> { model.zoom(-ChromatogramCanvas.WHEEL_ZOOM_STEP); canvas.redraw(); });
    Button zoomIn = iconButton(FontAwesomeSolid.SEARCH_PLUS);
    zoomIn.setOnAction(e -> { model.zoom(ChromatogramCanvas.WHEEL_ZOOM_STEP); canvas.redraw(); });
    Button reset = new Button("Reset");
    reset.setOnAction(e -> { model.resetView(); canvas.redraw(); });
    Button start = new Button("Start");
    start.setOnAction(e -> { model.scrollToStart(); canvas.redraw(); });
    Button end = new Button("End");
    end.setOnAction(e -> { model.scrollToEnd(); canvas.redraw(); });

    ToolBar bar = new ToolBar(new Label("Zoom:"), zoomOut, zoomIn, reset, new Label("Navigate:"), start, end,
        new Label("Channels:"));
    for (Channel channel : Channel.values()) {
      ToggleButton toggle = new ToggleButton(String.valueOf(channel.symbol()));
      toggle.setSelected(true);
      toggle.setOnAction(e -> { model.toggleChannel(channel); canvas.redraw(); });
      channelToggles.add(toggle);
      bar.getItems().add(toggle);
    }

    thresholdSlider.setValue(model.getState().qualityThreshold());
    Label thresholdLabel = new Label("Q" + model.getState().qualityThreshold());
    thresholdSlider.valueProperty().addListener((obs, oldVal, newVal) -> {
      model.setQualityThreshold(newVal.intValue());
      thresholdLabel.setText("Q" + newVal.intValue());
      canvas.redraw();
    });
    bar.getItems().addAll(new Label("Quality:"), thresholdSlider, thresholdLabel);
    return bar;
  }

  private HBox buildHighlightBar() {
    TextField startField = new TextField();
    startField.setPromptText("Start");
    startField.setPrefColumnCount(5);
    TextField endField = new TextField();
    endField.setPromptText("End");
    endField.setPrefColumnCount(5);

    Button highlight = new Button("Highlight");
    highlight.setOnAction(e -> {
      try {
        model.highlight(Integer.parseInt(startField.getText().trim()), Integer.parseInt(endField.getText().trim()));
        canvas.redraw();
      } catch (IllegalArgumentException ex) {
        showError("Invalid range", ex.getMessage());
      }
    });
    Button copy = new Button("Copy");
    copy.setOnAction(e -> {
      ClipboardContent content = new ClipboardContent();
      content.putString(model.highlightedSequence());
      Clipboard.getSystemClipboard().setContent(content);
    });
    Button clear = new Button("Clear");
    clear.setOnAction(e -> { model.clearHighlight(); canvas.redraw(); });

    return new HBox(6, new Label("Highlight:"), startField, endField, highlight, copy, clear);
  }

  // ── File actions ──────────────────────────────────────────────────────

  private void openFile() {
    FileChooser chooser = new FileChooser();
    chooser.setTitle("Open Trace File");
    File lastDir = UserPreferences.getLastTraceDirectory();
    if (lastDir != null) {
      try {
        chooser.setInitialDirectory(lastDir);
      } catch (IllegalArgumentException e) {
        log.debug("Last directory not accessible: {}", lastDir);
      }
    }
    chooser.getExtensionFilters().addAll(
        new FileChooser.ExtensionFilter("Trace files", "*.ab1", "*.abi", "*.scf", "*.AB1", "*.SCF"),
        new FileChooser.ExtensionFilter("All files", "*.*"));

    File file = chooser.showOpenDialog(stage);
    if (file == null) return;
    UserPreferences.setLastTraceDirectory(file);

    Thread loadThread = new Thread(() -> {
      try {
        ChromatogramRecord record = loader.load(file.toPath());
        Platform.runLater(() -> {
          model.loadRecord(record);
          channelToggles.forEach(toggle -> toggle.setSelected(true));
          thresholdSlider.setValue(model.getState().qualityThreshold());
          canvas.redraw();
        });
      } catch (IOException | RuntimeException e) {
        log.error("Could not load {}", file, e);
        Platform.runLater(() -> showError("Could not load " + file.getName(), e.getMessage()));
      }
    }, "trace-loader");
    loadThread.setDaemon(true);
    loadThread.start();
  }

  private void exportFasta() {
    File dir = chooseExportDirectory();
    if (dir == null) return;
    try {
      Path written = FastaExporter.write(model.getRecord(), dir.toPath());
      log.info("Exported FASTA to {}", written);
    } catch (IOException e) {
      log.error("FASTA export failed", e);
      showError("FASTA export failed", e.getMessage());
    }
  }

  private void exportJson() {
    File dir = chooseExportDirectory();
    if (dir == null) return;
    ChromatogramRecord record = model.getRecord();
    String name = FastaExporter.exportFileName(record.getFileName()).replaceAll("\\.fasta$", ".json");
    try {
      Path target = dir.toPath().resolve(name);
      Files.writeString(target, ChromatogramJson.toJson(record, model.getState().editedIndices()), StandardCharsets.UTF_8);
      log.info("Exported JSON to {}", target);
    } catch (IOException e) {
      log.error("JSON export failed", e);
      showError("JSON export failed", e.getMessage());
    }
  }

  private File chooseExportDirectory() {
    DirectoryChooser chooser = new DirectoryChooser();
    chooser.setTitle("Export To");
    File lastDir = UserPreferences.getLastExportDirectory();
    if (lastDir != null) chooser.setInitialDirectory(lastDir);
    File dir = chooser.showDialog(stage);
    if (dir != null) UserPreferences.setLastExportDirectory(dir);
    return dir;
  }

  // ── Labels ────────────────────────────────────────────────────────────

  private void refreshLabels() {
    ChromatogramRecord record = model.getRecord();
    ViewState state = model.getState();
    fileLabel.setText(record.getFileName() + " (" + record.getFileFormat() + ")");
    statsLabel.setText(String.format("Length: %d bp   Avg quality: %.1f   Q%d+: %d   Edited: %d",
        record.getSequenceLength(), record.getAverageQuality(), state.qualityThreshold(),
        record.countHighQuality(state.qualityThreshold()), state.editedIndices().size()));
    positionsLabel.setText(canvas.getGeometry().positionsText());
    selectionLabel.setText(state.hasSelection()
        ? "Selected: " + model.selectedBaseCall() + (state.selectedIndex() + 1)
            + "  Q" + record.getQuality(state.selectedIndex()) + (state.isEdited(state.selectedIndex()) ? "  (edited)" : "")
        : "");
    syncScrollSlider();
  }

  private void syncScrollSlider() {
    syncingSlider = true;
    scrollSlider.setValue(model.getState().scrollFraction());
    syncingSlider = false;
  }

  private void showError(String header, String message) {
    Alert alert = new Alert(Alert.AlertType.ERROR);
    alert.setHeaderText(header);
    alert.setContentText(message);
    alert.showAndWait();
  }

  public static void main(String[] args) { launch(args); }
}
