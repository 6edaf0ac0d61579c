package org.traceplayer.traces.scf;

import java.util.List;
import java.util.Optional;

import org.traceplayer.model.Channel;

/**
 * Derives the base symbol of an SCF base record from a ranked list of strategies.
 * The first strategy that yields a symbol wins; a symbol outside A, T, G, C, N,
 * or no symbol at all, becomes N.
 */
public class SCFBaseCallDecoder {

  /** One way of reading a base symbol out of a record. */
  @FunctionalInterface
  public interface Strategy {
    Optional<Character> decode(SCFBaseRecord record);
  }

  /** Byte 8 as an ASCII letter, uppercased. */
  public static final Strategy ASCII_BASE_BYTE = record -> letterAt(record, SCFBaseRecord.BASE_OFFSET);

  /** Highest confidence; ties resolve in A, C, G, T order. Nothing when all are zero. */
  public static final Strategy MAX_CONFIDENCE = record -> {
    int best = -1;
    int bestValue = 0;
    for (int k = 0; k < 4; k++) {
      if (record.confidence(k) > bestValue) {
        bestValue = record.confidence(k);
        best = k;
      }
    }
    return best < 0 ? Optional.empty() : Optional.of(SCFBaseRecord.CONFIDENCE_ORDER[best]);
  };

  /** First ASCII letter among the spare bytes 9-11. */
  public static final Strategy SPARE_BYTES = record -> {
    for (int position = SCFBaseRecord.BASE_OFFSET + 1; position < SCFBaseRecord.SIZE; position++) {
      Optional<Character> letter = letterAt(record, position);
      if (letter.isPresent()) return letter;
    }
    return Optional.empty();
  };

  public static final List<Strategy> DEFAULT_STRATEGIES = List.of(ASCII_BASE_BYTE, MAX_CONFIDENCE, SPARE_BYTES);

  private final List<Strategy> strategies;

  public SCFBaseCallDecoder() {
    this(DEFAULT_STRATEGIES);
  }

  public SCFBaseCallDecoder(List<Strategy> strategies) {
    this.strategies = List.copyOf(strategies);
  }

  public char decode(SCFBaseRecord record) {
    for (Strategy strategy : strategies) {
      Optional<Character> symbol = strategy.decode(record);
      if (symbol.isPresent()) {
        char call = symbol.get();
        return Channel.isBaseCall(call) ? call : 'N';
      }
    }
    return 'N';
  }

  /** {@code round(max / 255 * 60)}, or 20 when every confidence is zero. */
  public static int quality(SCFBaseRecord record) {
    int max = record.maxConfidence();
    return max > 0 ? (int) Math.round(max / 255.0 * 60) : SCFReader.SENTINEL_QUALITY;
  }

  private static Optional<Character> letterAt(SCFBaseRecord record, int position) {
    int value = record.unsignedByte(position);
    if (value >= 'A' && value <= 'Z') return Optional.of((char) value);
    if (value >= 'a' && value <= 'z') return Optional.of(Character.toUpperCase((char) value));
    return Optional.empty();
  }
}
