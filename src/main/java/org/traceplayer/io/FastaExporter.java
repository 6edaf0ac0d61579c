package org.traceplayer.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.traceplayer.model.ChromatogramRecord;

/**
 * FASTA export of a record's current sequence, edits included.
 */
public final class FastaExporter {

  private FastaExporter() {}

  /** {@code ">" + fileName + "\n" + sequence}. */
  public static String toFasta(ChromatogramRecord record) {
    return ">" + record.getFileName() + "\n" + record.getSequence();
  }

  /** Trace file name with its .ab1 or .scf extension replaced by .fasta. */
  public static String exportFileName(String fileName) {
    if (fileName == null || fileName.isEmpty()) return "sequence.fasta";
    String lower = fileName.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".ab1") || lower.endsWith(".scf")) {
      return fileName.substring(0, fileName.length() - 4) + ".fasta";
    }
    return fileName + ".fasta";
  }

  /**
   * Write the FASTA text into {@code directory} under {@link #exportFileName(String)}.
   * @return the written file
   */
  public static Path write(ChromatogramRecord record, Path directory) throws IOException {
    Path target = directory.resolve(exportFileName(record.getFileName()));
    Files.writeString(target, toFasta(record) + "\n", StandardCharsets.UTF_8);
    return target;
  }
}
