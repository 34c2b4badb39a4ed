package atn.util;

import java.util.stream.IntStream;

/**
 * Inclusive (and therefore non-empty) range of symbols.
 *
 * @param lowerBound smallest symbol in the range
 * @param upperBound largest symbol in the range
 */
public record IntRange(
  int lowerBound,
  int upperBound
) implements Comparable<IntRange> {

  public static final IntRange FULL =
    IntRange.between(Integer.MIN_VALUE, Integer.MAX_VALUE);

  /**
   * Make a range (equivalent to the constructor, but more informatively named).
   *
   * @param lowerBound smallest symbol in the range
   * @param upperBound largest symbol in the range
   */
  public static IntRange between(int lowerBound, int upperBound) {
    return new IntRange(lowerBound, upperBound);
  }

  /**
   * Make a range containing only a single symbol.
   *
   * @param symbol symbol in the range
   */
  public static IntRange single(int symbol) {
    return new IntRange(symbol, symbol);
  }

  public IntRange {
    if (lowerBound > upperBound) {
      throw new IllegalArgumentException(
        "Range lower bound " + lowerBound + " exceeds upper bound " + upperBound
      );
    }
  }

  @Override
  public String toString() {
    return "IntRange(" + compactString() + ")";
  }

  public String compactString() {
    return (lowerBound == upperBound) ? "" + lowerBound : "" + lowerBound + ".." + upperBound;
  }

  public IntStream stream() {
    return IntStream.rangeClosed(lowerBound, upperBound);
  }

  /**
   * Number of symbols in the range, saturating at {@code Integer.MAX_VALUE}.
   */
  public int size() {
    final long size = (long) upperBound - (long) lowerBound + 1;
    return size > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) size;
  }

  /**
   * Does this range contain the symbol?
   *
   * @param symbol symbol
   * @return whether the symbol is in this range
   */
  public boolean contains(int symbol) {
    return lowerBound <= symbol && symbol <= upperBound;
  }

  @Override
  public int compareTo(IntRange other) {
    int lowCompare = Integer.compare(lowerBound, other.lowerBound);
    return lowCompare != 0 ? lowCompare : Integer.compare(upperBound, other.upperBound);
  }
}
