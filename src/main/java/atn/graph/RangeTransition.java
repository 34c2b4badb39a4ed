package atn.graph;

import atn.util.IntervalSet;
import java.util.Optional;

/**
 * Match of any symbol in an inclusive range.
 *
 * @param target state the transition leads to
 * @param from smallest symbol consumed
 * @param to largest symbol consumed
 */
public record RangeTransition(ATNState target, int from, int to) implements Transition {

  @Override
  public boolean isEpsilon() {
    return false;
  }

  @Override
  public Optional<IntervalSet> label() {
    return Optional.of(IntervalSet.ofRange(from, to));
  }

  @Override
  public boolean matches(int symbol, int minVocabSymbol, int maxVocabSymbol) {
    return from <= symbol && symbol <= to;
  }

  @Override
  public String dotLabel() {
    return from + "-" + to;
  }
}
