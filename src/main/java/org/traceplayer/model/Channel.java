package org.traceplayer.model;

/**
 * The four dye channels of a sequencing trace, one per nucleotide.
 */
public enum Channel {
  A('A'),
  T('T'),
  G('G'),
  C('C');

  private final char symbol;

  Channel(char symbol) {
    this.symbol = symbol;
  }

  public char symbol() { return symbol; }

  /**
   * Channel for a nucleotide letter (case-insensitive), or null for anything else,
   * including the ambiguity symbol N.
   */
  public static Channel fromSymbol(char symbol) {
    return switch (Character.toUpperCase(symbol)) {
      case 'A' -> A;
      case 'T' -> T;
      case 'G' -> G;
      case 'C' -> C;
      default -> null;
    };
  }

  /** True for the symbols a base call may hold: A, T, G, C and N. */
  public static boolean isBaseCall(char symbol) {
    return symbol == 'N' || fromSymbol(symbol) != null && Character.isUpperCase(symbol);
  }
}
