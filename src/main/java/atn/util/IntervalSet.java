package atn.util;

import atn.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Growable set of token types.
 *
 * Every update replaces the underlying canonical {@link IntRangeSet}, so
 * the ranges handed out by {@link #toRangeSet} are snapshots and never change
 * under the caller. Once {@link #setReadOnly} has been called the set is
 * frozen: further updates throw {@code IllegalStateException}, and the set
 * may be shared between threads without locking.
 */
public final class IntervalSet {

  private IntRangeSet ranges;

  private volatile boolean readOnly = false;

  public IntervalSet() {
    this.ranges = IntRangeSet.EMPTY;
  }

  private IntervalSet(IntRangeSet ranges) {
    this.ranges = ranges;
  }

  /**
   * Set containing exactly the given symbols.
   *
   * @param symbols symbols (in any order, duplicates allowed)
   */
  public static IntervalSet of(int... symbols) {
    final var set = new IntervalSet();
    for (int symbol : symbols) {
      set.add(symbol);
    }
    return set;
  }

  /**
   * Set containing the inclusive range of symbols.
   *
   * @param lowerBound smallest symbol
   * @param upperBound largest symbol
   */
  public static IntervalSet ofRange(int lowerBound, int upperBound) {
    return new IntervalSet(IntRangeSet.of(IntRange.between(lowerBound, upperBound)));
  }

  public static IntervalSet copyOf(IntervalSet other) {
    return new IntervalSet(other.ranges);
  }

  public IntervalSet add(int symbol) {
    return addRange(symbol, symbol);
  }

  public IntervalSet addRange(int lowerBound, int upperBound) {
    checkWritable();
    ranges = ranges.union(IntRangeSet.of(IntRange.between(lowerBound, upperBound)));
    return this;
  }

  /**
   * Union another set into this one.
   *
   * @param other set to add (may be {@code null}, meaning nothing is added)
   * @return this set
   */
  public IntervalSet addAll(IntervalSet other) {
    checkWritable();
    if (other != null) {
      ranges = ranges.union(other.ranges);
    }
    return this;
  }

  public IntervalSet remove(int symbol) {
    checkWritable();
    ranges = ranges.difference(IntRangeSet.of(IntRange.single(symbol)));
    return this;
  }

  /**
   * Symbols of the vocabulary that are not in this set.
   *
   * @param minSymbol smallest symbol of the vocabulary
   * @param maxSymbol largest symbol of the vocabulary
   * @return new (writable) set
   */
  public IntervalSet complement(int minSymbol, int maxSymbol) {
    return new IntervalSet(ranges.complement(IntRange.between(minSymbol, maxSymbol)));
  }

  public boolean contains(int symbol) {
    return ranges.contains(symbol);
  }

  public boolean isEmpty() {
    return ranges.isEmpty();
  }

  public int size() {
    return ranges.size();
  }

  public List<Integer> toList() {
    return ranges.stream().boxed().toList();
  }

  public IntRangeSet toRangeSet() {
    return ranges;
  }

  public boolean isReadOnly() {
    return readOnly;
  }

  /**
   * Freeze the set.
   *
   * @param readOnly must be {@code true}; a frozen set cannot be thawed
   */
  public void setReadOnly(boolean readOnly) {
    if (this.readOnly && !readOnly) {
      throw new IllegalStateException("can't alter readonly IntervalSet");
    }
    this.readOnly = readOnly;
  }

  private void checkWritable() {
    if (readOnly) {
      throw new IllegalStateException("can't alter readonly IntervalSet");
    }
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof IntervalSet set && ranges.equals(set.ranges);
  }

  @Override
  public int hashCode() {
    return ranges.hashCode();
  }

  /**
   * Render the set, naming the reserved {@code EOF} and {@code EPSILON} symbols.
   */
  @Override
  public String toString() {
    final var parts = new ArrayList<String>();
    for (IntRange range : ranges.ranges()) {
      int lower = range.lowerBound();
      final int upper = range.upperBound();

      if (lower < Token.EPSILON) {
        final int end = Math.min(upper, Token.EPSILON - 1);
        parts.add(rangeString(lower, end));
        lower = end + 1;
      }

      // Reserved symbols are listed one at a time
      while (lower <= upper && lower < 0) {
        parts.add(symbolName(lower));
        lower++;
      }

      if (lower <= upper) {
        parts.add(rangeString(lower, upper));
      }
    }
    return parts.stream().collect(Collectors.joining(", ", "{", "}"));
  }

  private static String rangeString(int lower, int upper) {
    return lower == upper ? symbolName(lower) : symbolName(lower) + ".." + symbolName(upper);
  }

  private static String symbolName(int symbol) {
    switch (symbol) {
      case Token.EOF:
        return "<EOF>";
      case Token.EPSILON:
        return "<EPSILON>";
      default:
        return Integer.toString(symbol);
    }
  }
}
