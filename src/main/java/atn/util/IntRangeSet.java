package atn.util;

import java.util.Arrays;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.ListIterator;
import java.util.PriorityQueue;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Immutable set of symbols, tracked using ranges.
 *
 * The constraint on ranges being non-overlapping, non-contiguous, and sorted
 * ensures that there is always exactly one canonical instance for any logical
 * set of symbols. If the input ranges are not already in this format,
 * construct the set using {@link #unionOf}.
 *
 * @param ranges non-overlapping, non-contiguous, and sorted ranges
 */
public record IntRangeSet(
  List<IntRange> ranges
) {

  public IntRangeSet(List<IntRange> ranges) {

    // Check that the ranges really are sorted
    IntRange previousRange = null;
    for (IntRange range : ranges) {
      if (previousRange != null && previousRange.upperBound() + 1 >= range.lowerBound()) {
        throw new IllegalArgumentException(
          "Ranges are overlapping or not sorted: " + previousRange + " and " + range
        );
      }
      previousRange = range;
    }

    this.ranges = List.<IntRange>copyOf(ranges);
  }

  /**
   * Construct a set with the following non-overlapping, non-contiguous, and
   * sorted ranges.
   *
   * @param ranges input ranges
   * @return set containing the ranges
   */
  public static IntRangeSet of(IntRange... ranges) {
    return new IntRangeSet(Arrays.asList(ranges));
  }

  /**
   * Construct a set that is the union of the following ranges, in any order.
   *
   * @param ranges input ranges
   * @return set containing the ranges
   */
  public static IntRangeSet unionOf(IntRange... ranges) {
    return union(Arrays.stream(ranges).map(range -> IntRangeSet.of(range)).toList());
  }

  /**
   * Empty set.
   */
  public static final IntRangeSet EMPTY = new IntRangeSet(List.<IntRange>of());

  @Override
  public String toString() {
    return ranges.stream().map(IntRange::compactString).collect(Collectors.joining(", ", "{", "}"));
  }

  public IntStream stream() {
    return ranges.stream().flatMapToInt(IntRange::stream);
  }

  /**
   * Whether this set contains the symbol.
   *
   * The complexity is {@code O(log(M))} for {@code M} ranges in the set.
   *
   * @param symbol symbol
   * @return whether the symbol is in this set
   */
  public boolean contains(int symbol) {
    int rangeIndex = Collections.binarySearch(
      ranges,
      IntRange.single(symbol),
      RANGE_BY_LOWER
    );
    if (rangeIndex == -1) {
      return false;
    } else if (rangeIndex < 0) {
      rangeIndex = -rangeIndex - 2;
    }
    return ranges.get(rangeIndex).contains(symbol);
  }

  private static final Comparator<IntRange> RANGE_BY_LOWER = new Comparator<>() {
    public int compare(IntRange r1, IntRange r2) {
      return Integer.compare(r1.lowerBound(), r2.lowerBound());
    }
  };

  public boolean isEmpty() {
    return ranges.isEmpty();
  }

  /**
   * Number of symbols in the set, saturating at {@code Integer.MAX_VALUE}.
   */
  public int size() {
    long total = 0;
    for (IntRange range : ranges) {
      total += range.size();
    }
    return total > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) total;
  }

  /**
   * Compute the union of a collection of sets.
   *
   * The compexity is {@code O(N * M * log(N))} for {@code N} input sets with
   * {@code M} ranges in them.
   *
   * @param sets collections of symbol sets
   * @return union of sets
   */
  public static IntRangeSet union(Collection<IntRangeSet> sets) {
    return aggregateSets((int n) -> n >= 1, sets);
  }

  public IntRangeSet union(IntRangeSet other) {
    return IntRangeSet.union(List.of(this, other));
  }

  /**
   * Compute the intersection of a collection of sets.
   *
   * @param sets collections of symbol sets
   * @return intersection of sets
   */
  public static IntRangeSet intersection(Collection<IntRangeSet> sets) {
    final int inputSetCount = sets.size();
    return aggregateSets((int n) -> n == inputSetCount, sets);
  }

  public IntRangeSet intersection(IntRangeSet other) {
    return IntRangeSet.intersection(List.of(this, other));
  }

  /**
   * Take the complement of a set over all integers.
   *
   * @return complement of set
   */
  public IntRangeSet complement() {
    return aggregateSets((int n) -> n == 0, List.of(this));
  }

  /**
   * Take the complement of a set, restricted to a vocabulary.
   *
   * @param vocabulary symbols that may appear in the output
   * @return symbols in the vocabulary but not in this set
   */
  public IntRangeSet complement(IntRange vocabulary) {
    return IntRangeSet.of(vocabulary).difference(this);
  }

  /**
   * Take the difference with another set.
   *
   * @param other set to subtract from {@code this}
   * @return set difference
   */
  public IntRangeSet difference(IntRangeSet other) {
    return this.intersection(other.complement());
  }

  /**
   * Aggregate a collection of sets into one set.
   *
   * A symbol is in the output set if the number of input sets containing it
   * satisfies {@code pointInOutput}:
   *
   *  - Union with {@code (int n) -> n >= 1}
   *  - Intersection with {@code (int n) -> n == N} (for {@code N} input sets)
   *  - Complement with {@code (int n) -> n == 0} (with one input)
   *
   * <h1>Algorithm</h1>
   *
   * Scan from left-to-right all the lower and upper endpoints of ranges in the
   * sets, keeping a running counter of how many ranges are open. Whenever the
   * counter changes, the predicate decides whether an output range has just
   * started or ended.
   *
   * Ranges are already sorted within a set, so a priority queue holding
   * {@code 2 * N} iterators is enough: each set contributes an iterator over
   * the lower bounds of its ranges and one over the upper bounds.
   *
   * @param pointInOutput if this many input sets contain the point, does the
   *                      output set contain it?
   * @param inputSets input sets
   */
  private static IntRangeSet aggregateSets(
    IntPredicate pointInOutput,
    Iterable<IntRangeSet> inputSets
  ) {

    final var endpoints = new PriorityQueue<EndpointIterator>(RANGE_ITERATOR_COMPARATOR);
    for (IntRangeSet set : inputSets) {
      final var ranges = set.ranges;
      if (!ranges.isEmpty()) {
        endpoints.add(new EndpointIterator(true, ranges.listIterator()));
        endpoints.add(new EndpointIterator(false, ranges.listIterator()));
      }
    }

    final var outputRanges = new ArrayList<IntRange>();
    int activeLower = Integer.MIN_VALUE;
    int previousActiveUpper = Integer.MIN_VALUE;

    int openRanges = 0;
    boolean inActiveRange = pointInOutput.test(openRanges);

    boolean firstRange = inActiveRange;
    boolean lastRange = false;

    while (!endpoints.isEmpty()) {

      final EndpointIterator nextEndpointsIter = endpoints.poll();
      final boolean isUpperEndpoint = nextEndpointsIter.isUpper();
      final int endpoint = nextEndpointsIter.nextEndpoint();

      openRanges += isUpperEndpoint ? -1 : 1;

      if (inActiveRange != pointInOutput.test(openRanges)) {
        inActiveRange = !inActiveRange;
        if (inActiveRange) {

          // After an upper endpoint, the first point satisfying the condition is the next one
          activeLower = isUpperEndpoint ? endpoint + 1 : endpoint;
          if (isUpperEndpoint && endpoint == Integer.MAX_VALUE) {
            lastRange = true;
          }

          // Merge contiguous ranges
          if (previousActiveUpper + 1 == activeLower && !outputRanges.isEmpty()) {
            activeLower = outputRanges.remove(outputRanges.size() - 1).lowerBound();
          }
        } else {
          // After a lower endpoint, the last point satisfying the condition is the previous one
          previousActiveUpper = isUpperEndpoint ? endpoint : endpoint - 1;

          if (!(firstRange && endpoint == Integer.MIN_VALUE) && previousActiveUpper >= activeLower) {
            outputRanges.add(IntRange.between(activeLower, previousActiveUpper));
          }
        }
        firstRange = false;
      }

      if (nextEndpointsIter.ranges().hasNext()) {
        endpoints.add(nextEndpointsIter);
      }
    }

    // Close out a trailing active range
    if (!lastRange && inActiveRange) {
      outputRanges.add(IntRange.between(activeLower, Integer.MAX_VALUE));
    }

    return new IntRangeSet(outputRanges);
  }

  /**
   * Orders (non-empty) iterators by the next endpoint they will produce.
   *
   * Lower bounds take priority over upper bounds if there is a tie.
   */
  private static final Comparator<EndpointIterator> RANGE_ITERATOR_COMPARATOR =
    Comparator
      .comparingInt(EndpointIterator::peekEndpoint)
      .thenComparing(EndpointIterator::isUpper);

  private record EndpointIterator(boolean isUpper, ListIterator<IntRange> ranges) {

    int nextEndpoint() {
      final IntRange next = ranges.next();
      return isUpper ? next.upperBound() : next.lowerBound();
    }

    int peekEndpoint() {
      final int next = nextEndpoint();
      ranges.previous(); // roll iterator back
      return next;
    }
  }
}
