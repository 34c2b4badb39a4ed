package atn.graph;

import atn.util.IntervalSet;
import java.util.Optional;

/**
 * Match of a single symbol.
 *
 * @param target state the transition leads to
 * @param symbol symbol consumed
 */
public record AtomTransition(ATNState target, int symbol) implements Transition {

  @Override
  public boolean isEpsilon() {
    return false;
  }

  @Override
  public Optional<IntervalSet> label() {
    return Optional.of(IntervalSet.of(symbol));
  }

  @Override
  public boolean matches(int symbol, int minVocabSymbol, int maxVocabSymbol) {
    return this.symbol == symbol;
  }

  @Override
  public String dotLabel() {
    return Integer.toString(symbol);
  }
}
