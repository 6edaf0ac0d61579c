package org.traceplayer.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.FileFormat;
import org.traceplayer.signal.MockChromatogramGenerator;
import org.traceplayer.traces.FormatDetector;
import org.traceplayer.traces.ParseResult;
import org.traceplayer.traces.TraceFileReader;
import org.traceplayer.traces.TraceFormatException;
import org.traceplayer.traces.abif.ABIFReader;
import org.traceplayer.traces.scf.SCFReader;

/**
 * Turns raw trace file bytes into a chromatogram record.
 *
 * Detects the format, runs the matching reader and applies the fallback policy:
 * under {@link FallbackPolicy#MOCK_ON_ERROR} a failed parse is logged and replaced by
 * a synthetic record so the viewer always has something to show; under
 * {@link FallbackPolicy#PROPAGATE} the failure reaches the caller.
 * Inputs shorter than {@link #MIN_FILE_SIZE} bytes are never parsed.
 */
public class ChromatogramLoader {

  private static final Logger log = LoggerFactory.getLogger(ChromatogramLoader.class);

  public static final int MIN_FILE_SIZE = 100;

  private final TraceFileReader abifReader;
  private final TraceFileReader scfReader;
  private final MockChromatogramGenerator mockGenerator;
  private final FallbackPolicy fallbackPolicy;

  public ChromatogramLoader() {
    this(ViewerSettings.get());
  }

  public ChromatogramLoader(ViewerSettings settings) {
    this(new ABIFReader(settings.isAbifInlineSmallData(), new Random()),
        new SCFReader(settings.getScfPeakPolicy()),
        new MockChromatogramGenerator(),
        settings.getFallbackPolicy());
  }

  public ChromatogramLoader(TraceFileReader abifReader, TraceFileReader scfReader,
                            MockChromatogramGenerator mockGenerator, FallbackPolicy fallbackPolicy) {
    this.abifReader = abifReader;
    this.scfReader = scfReader;
    this.mockGenerator = mockGenerator;
    this.fallbackPolicy = fallbackPolicy;
  }

  public FallbackPolicy getFallbackPolicy() { return fallbackPolicy; }

  /**
   * Decode {@code data}, applying the fallback policy.
   * @throws TraceFormatException only under {@link FallbackPolicy#PROPAGATE}
   */
  public ChromatogramRecord load(byte[] data, String fileName) throws TraceFormatException {
    if (data == null || data.length < MIN_FILE_SIZE) {
      int size = data == null ? 0 : data.length;
      if (fallbackPolicy == FallbackPolicy.PROPAGATE) {
        throw new TraceFormatException(TraceFormatException.Reason.TOO_SMALL, "Trace file too small: " + size + " bytes");
      }
      log.info("No usable trace data for {} ({} bytes), using mock chromatogram", fileName, size);
      return mockGenerator.generate(fileName);
    }

    ParseResult result = parse(data, fileName);
    if (result.isSuccess()) return result.getRecord();

    if (fallbackPolicy == FallbackPolicy.PROPAGATE) throw result.getError();
    log.warn("Failed to parse {} ({}), falling back to mock chromatogram: {}", fileName,
        result.getError().getReason(), result.getError().getMessage());
    return mockGenerator.generate(fileName);
  }

  /**
   * Read a trace file from disk.
   */
  public ChromatogramRecord load(Path path) throws IOException {
    return load(Files.readAllBytes(path), path.getFileName().toString());
  }

  /**
   * Detect and decode without any fallback.
   */
  public ParseResult parse(byte[] data, String fileName) {
    FileFormat format;
    try {
      format = FormatDetector.detect(data);
    } catch (TraceFormatException e) {
      return ParseResult.failure(e);
    }
    log.debug("Detected {} for {}", format, fileName);
    TraceFileReader reader = format == FileFormat.SCF ? scfReader : abifReader;
    try {
      return reader.tryRead(data, fileName);
    } catch (RuntimeException e) {
      return ParseResult.failure(new TraceFormatException(TraceFormatException.Reason.MALFORMED_CONTAINER,
          "Reader failed on " + fileName + ": " + e.getMessage(), e));
    }
  }
}
