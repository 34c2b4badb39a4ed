package atn.graph;

import atn.util.IntervalSet;
import java.util.Optional;

/**
 * Match of any vocabulary symbol outside a set.
 *
 * @param target state the transition leads to
 * @param set symbols excluded (frozen when the transition is created)
 */
public record NotSetTransition(ATNState target, IntervalSet set) implements Transition {

  public NotSetTransition {
    set = IntervalSet.copyOf(set);
    set.setReadOnly(true);
  }

  @Override
  public boolean isEpsilon() {
    return false;
  }

  @Override
  public Optional<IntervalSet> label() {
    return Optional.of(set);
  }

  @Override
  public boolean matches(int symbol, int minVocabSymbol, int maxVocabSymbol) {
    return symbol >= minVocabSymbol && symbol <= maxVocabSymbol && !set.contains(symbol);
  }

  @Override
  public String dotLabel() {
    return "~" + set;
  }
}
