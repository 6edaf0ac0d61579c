package org.traceplayer.model;

/**
 * A 1-based, inclusive range of base positions marked for copy or export.
 */
public record HighlightRange(int start, int end) {

  public HighlightRange {
    if (start < 1 || start > end) {
      throw new IllegalArgumentException("Invalid highlight range " + start + "-" + end);
    }
  }

  /** Checks the range against a sequence of {@code sequenceLength} bases. */
  public static HighlightRange of(int start, int end, int sequenceLength) {
    if (start < 1 || start > end || end > sequenceLength) {
      throw new IllegalArgumentException("Highlight range " + start + "-" + end
          + " must satisfy 1 <= start <= end <= " + sequenceLength);
    }
    return new HighlightRange(start, end);
  }

  public int length() { return end - start + 1; }

  /** 0-based index of the first base. */
  public int firstIndex() { return start - 1; }

  /** 0-based index of the last base. */
  public int lastIndex() { return end - 1; }

  public boolean contains(int baseIndex) {
    return baseIndex >= firstIndex() && baseIndex <= lastIndex();
  }
}
