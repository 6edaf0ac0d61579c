package org.traceplayer.io;

import java.util.prefs.Preferences;

import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.ViewState;
import org.traceplayer.traces.scf.PeakPositionPolicy;
import org.traceplayer.view.ViewportMapper;

/**
 * Viewer and decoder settings with persistence via java.util.prefs.
 * The shared instance is available via ViewerSettings.get(); {@link #defaults()} gives
 * an unpersisted copy holding the built-in values.
 *
 * Changes made through a persisted instance are written to prefs immediately and
 * take effect on the next load or draw.
 */
public class ViewerSettings {

  private static ViewerSettings instance;

  // ── Keys ──────────────────────────────────────────────────────────────

  static final String KEY_CANVAS_WIDTH       = "canvasWidth";
  static final String KEY_DEFAULT_ZOOM       = "defaultZoom";
  static final String KEY_QUALITY_THRESHOLD  = "qualityThreshold";
  static final String KEY_SCF_PEAK_POLICY    = "scf.peakPolicy";
  static final String KEY_ABIF_INLINE_DATA   = "abif.inlineSmallData";
  static final String KEY_FALLBACK_POLICY    = "fallbackPolicy";

  // ── Defaults ──────────────────────────────────────────────────────────

  public static final double DEF_CANVAS_WIDTH                 = ViewportMapper.DEFAULT_CANVAS_WIDTH;
  public static final double DEF_DEFAULT_ZOOM                 = ViewState.DEFAULT_ZOOM;
  public static final int    DEF_QUALITY_THRESHOLD            = ViewState.DEFAULT_QUALITY_THRESHOLD;
  public static final PeakPositionPolicy DEF_SCF_PEAK_POLICY  = PeakPositionPolicy.ESTIMATED;
  public static final boolean DEF_ABIF_INLINE_DATA            = false;
  public static final FallbackPolicy DEF_FALLBACK_POLICY      = FallbackPolicy.MOCK_ON_ERROR;

  private final Preferences prefs;

  private double canvasWidth;
  private double defaultZoom;
  private int qualityThreshold;
  private PeakPositionPolicy scfPeakPolicy;
  private boolean abifInlineSmallData;
  private FallbackPolicy fallbackPolicy;

  ViewerSettings(Preferences prefs) {
    this.prefs = prefs;
    load();
  }

  public static synchronized ViewerSettings get() {
    if (instance == null) instance = new ViewerSettings(Preferences.userNodeForPackage(ViewerSettings.class));
    return instance;
  }

  /** Built-in values, not backed by prefs. */
  public static ViewerSettings defaults() {
    return new ViewerSettings(null);
  }

  /** Reload all values from persistent storage. */
  public void load() {
    if (prefs == null) {
      canvasWidth = DEF_CANVAS_WIDTH;
      defaultZoom = DEF_DEFAULT_ZOOM;
      qualityThreshold = DEF_QUALITY_THRESHOLD;
      scfPeakPolicy = DEF_SCF_PEAK_POLICY;
      abifInlineSmallData = DEF_ABIF_INLINE_DATA;
      fallbackPolicy = DEF_FALLBACK_POLICY;
      return;
    }
    canvasWidth         = prefs.getDouble(KEY_CANVAS_WIDTH, DEF_CANVAS_WIDTH);
    defaultZoom         = prefs.getDouble(KEY_DEFAULT_ZOOM, DEF_DEFAULT_ZOOM);
    qualityThreshold    = prefs.getInt(KEY_QUALITY_THRESHOLD, DEF_QUALITY_THRESHOLD);
    scfPeakPolicy       = enumValue(PeakPositionPolicy.class, prefs.get(KEY_SCF_PEAK_POLICY, null), DEF_SCF_PEAK_POLICY);
    abifInlineSmallData = prefs.getBoolean(KEY_ABIF_INLINE_DATA, DEF_ABIF_INLINE_DATA);
    fallbackPolicy      = enumValue(FallbackPolicy.class, prefs.get(KEY_FALLBACK_POLICY, null), DEF_FALLBACK_POLICY);
  }

  // ── Getters ───────────────────────────────────────────────────────────

  /** Width in pixels of the geometry the viewer lays out. */
  public double getCanvasWidth() { return canvasWidth; }

  /** Zoom level of a freshly opened or reset view. */
  public double getDefaultZoom() { return defaultZoom; }

  /** Quality threshold of a freshly opened view (0–60). */
  public int getQualityThreshold() { return qualityThreshold; }

  /** Source of SCF base peak positions. */
  public PeakPositionPolicy getScfPeakPolicy() { return scfPeakPolicy; }

  /** Whether AB1 tags of four bytes or less are read from the directory entry itself. */
  public boolean isAbifInlineSmallData() { return abifInlineSmallData; }

  /** What happens when a file cannot be decoded. */
  public FallbackPolicy getFallbackPolicy() { return fallbackPolicy; }

  // ── Setters (persist immediately) ─────────────────────────────────────

  public void setCanvasWidth(double px) {
    if (px <= 0) throw new IllegalArgumentException("Canvas width must be positive: " + px);
    this.canvasWidth = px;
    if (prefs != null) prefs.putDouble(KEY_CANVAS_WIDTH, px);
  }

  public void setDefaultZoom(double zoom) {
    this.defaultZoom = Math.max(ViewState.MIN_ZOOM, Math.min(ViewState.MAX_ZOOM, zoom));
    if (prefs != null) prefs.putDouble(KEY_DEFAULT_ZOOM, defaultZoom);
  }

  public void setQualityThreshold(int q) {
    this.qualityThreshold = Math.max(0, Math.min(ChromatogramRecord.MAX_QUALITY, q));
    if (prefs != null) prefs.putInt(KEY_QUALITY_THRESHOLD, qualityThreshold);
  }

  public void setScfPeakPolicy(PeakPositionPolicy policy) {
    this.scfPeakPolicy = policy;
    if (prefs != null) prefs.put(KEY_SCF_PEAK_POLICY, policy.name());
  }

  public void setAbifInlineSmallData(boolean inline) {
    this.abifInlineSmallData = inline;
    if (prefs != null) prefs.putBoolean(KEY_ABIF_INLINE_DATA, inline);
  }

  public void setFallbackPolicy(FallbackPolicy policy) {
    this.fallbackPolicy = policy;
    if (prefs != null) prefs.put(KEY_FALLBACK_POLICY, policy.name());
  }

  /** Reset all settings to defaults. */
  public void resetDefaults() {
    setCanvasWidth(DEF_CANVAS_WIDTH);
    setDefaultZoom(DEF_DEFAULT_ZOOM);
    setQualityThreshold(DEF_QUALITY_THRESHOLD);
    setScfPeakPolicy(DEF_SCF_PEAK_POLICY);
    setAbifInlineSmallData(DEF_ABIF_INLINE_DATA);
    setFallbackPolicy(DEF_FALLBACK_POLICY);
  }

  private static <E extends Enum<E>> E enumValue(Class<E> type, String name, E fallback) {
    if (name == null) return fallback;
    try {
      return Enum.valueOf(type, name);
    } catch (IllegalArgumentException e) {
      return fallback;
    }
  }
}
