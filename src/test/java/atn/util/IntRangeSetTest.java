package atn.util;

import java.util.List;
import org.junit.Assert;
import org.junit.Test;

public class IntRangeSetTest {

  @Test
  public void unionMergesContiguousRanges() {
    final var set = IntRangeSet.unionOf(
      IntRange.single(5),
      IntRange.between(1, 3),
      IntRange.single(4),
      IntRange.between(8, 9)
    );
    Assert.assertEquals(IntRangeSet.of(IntRange.between(1, 5), IntRange.between(8, 9)), set);
  }

  @Test(expected = IllegalArgumentException.class)
  public void unsortedRangesAreRejected() {
    IntRangeSet.of(IntRange.between(4, 6), IntRange.between(1, 2));
  }

  @Test(expected = IllegalArgumentException.class)
  public void contiguousRangesAreRejected() {
    IntRangeSet.of(IntRange.between(1, 2), IntRange.between(3, 6));
  }

  @Test
  public void containsUsesRangeBounds() {
    final var set = IntRangeSet.of(IntRange.between(-2, -1), IntRange.between(3, 7));
    Assert.assertTrue(set.contains(-2));
    Assert.assertTrue(set.contains(-1));
    Assert.assertFalse(set.contains(0));
    Assert.assertTrue(set.contains(3));
    Assert.assertTrue(set.contains(7));
    Assert.assertFalse(set.contains(8));
    Assert.assertFalse(IntRangeSet.EMPTY.contains(0));
  }

  @Test
  public void differenceSplitsRanges() {
    final var set = IntRangeSet.of(IntRange.between(1, 10));
    final var difference = set.difference(IntRangeSet.of(IntRange.single(4), IntRange.between(9, 12)));
    Assert.assertEquals(IntRangeSet.of(IntRange.between(1, 3), IntRange.between(5, 8)), difference);
  }

  @Test
  public void complementWithinVocabulary() {
    final var set = IntRangeSet.of(IntRange.single(2), IntRange.between(4, 5));
    Assert.assertEquals(
      IntRangeSet.of(IntRange.single(1), IntRange.single(3), IntRange.between(6, 7)),
      set.complement(IntRange.between(1, 7))
    );
    Assert.assertEquals(IntRangeSet.of(IntRange.between(1, 7)), IntRangeSet.EMPTY.complement(IntRange.between(1, 7)));
  }

  @Test
  public void complementOfEmptyIsEverything() {
    Assert.assertEquals(IntRangeSet.of(IntRange.FULL), IntRangeSet.EMPTY.complement());
    Assert.assertEquals(IntRangeSet.EMPTY, IntRangeSet.of(IntRange.FULL).complement());
  }

  @Test
  public void intersectionOfSeveralSets() {
    final var intersection = IntRangeSet.intersection(List.of(
      IntRangeSet.of(IntRange.between(0, 10)),
      IntRangeSet.of(IntRange.between(5, 20)),
      IntRangeSet.of(IntRange.between(-5, 7), IntRange.single(9))
    ));
    Assert.assertEquals(IntRangeSet.of(IntRange.between(5, 7), IntRange.single(9)), intersection);
  }

  @Test
  public void sizeCountsSymbols() {
    Assert.assertEquals(0, IntRangeSet.EMPTY.size());
    Assert.assertEquals(5, IntRangeSet.of(IntRange.between(-1, 1), IntRange.between(5, 6)).size());
    Assert.assertEquals(Integer.MAX_VALUE, IntRangeSet.of(IntRange.FULL).size());
  }

  @Test
  public void rendersCompactly() {
    Assert.assertEquals("{1..3, 7}", IntRangeSet.of(IntRange.between(1, 3), IntRange.single(7)).toString());
  }
}
