package org.traceplayer.traces.abif;

/**
 * One 28-byte entry of an ABIF directory.
 *
 * @param name         four-character tag name, e.g. "DATA" or "PBAS"
 * @param number       tag number; name and number together identify the item
 * @param elementType  ABIF element type code (2 = char, 4 = short, ...)
 * @param elementSize  size of one element in bytes
 * @param elementCount number of elements
 * @param dataSize     total data size in bytes
 * @param dataOffset   absolute data offset, or the data itself when small and inlined
 * @param entryOffset  position of this entry in the file
 */
public record ABIFDirectoryEntry(
    String name,
    int number,
    int elementType,
    int elementSize,
    long elementCount,
    long dataSize,
    long dataOffset,
    int entryOffset
) {

  public static final int SIZE = 28;
  /** Position of the data offset field within an entry. */
  public static final int DATA_OFFSET_FIELD = 20;

  /** Lookup key: name followed by number, e.g. "PBAS1". */
  public String key() { return key(name, number); }

  public static String key(String name, int number) { return name + number; }
}
