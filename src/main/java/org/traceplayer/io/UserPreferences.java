package org.traceplayer.io;

import java.io.File;
import java.util.prefs.Preferences;

/**
 * Remembers the directories trace files were last opened from and FASTA files
 * last exported to, across sessions.
 */
public class UserPreferences {

  private static final Preferences prefs = Preferences.userNodeForPackage(UserPreferences.class);

  private static final String KEY_TRACE_DIR  = "lastDir.trace";
  private static final String KEY_EXPORT_DIR = "lastDir.export";

  public static File getLastTraceDirectory() { return readDirectory(KEY_TRACE_DIR); }
  public static File getLastExportDirectory() { return readDirectory(KEY_EXPORT_DIR); }

  /** Save the directory of an opened trace file. A file argument saves its parent. */
  public static void setLastTraceDirectory(File fileOrDir) { writeDirectory(KEY_TRACE_DIR, fileOrDir); }

  public static void setLastExportDirectory(File fileOrDir) { writeDirectory(KEY_EXPORT_DIR, fileOrDir); }

  /**
   * The saved directory, or null when none was saved or it is no longer readable
   * (an unmounted drive still shows up as a mount point).
   */
  private static File readDirectory(String key) {
    String path = prefs.get(key, null);
    if (path == null) return null;
    File dir = new File(path);
    if (!dir.isDirectory() || !dir.canRead()) return null;
    try {
      return dir.list() != null ? dir : null;
    } catch (SecurityException e) {
      return null;
    }
  }

  private static void writeDirectory(String key, File fileOrDir) {
    if (fileOrDir == null) return;
    File dir = fileOrDir.isDirectory() ? fileOrDir : fileOrDir.getParentFile();
    if (dir != null && dir.exists()) prefs.put(key, dir.getAbsolutePath());
  }
}
