package atn.graph;

import atn.util.IntervalSet;
import java.util.Optional;

/**
 * Edge in the ATN.
 *
 * Epsilon transitions (rule calls, predicates, actions, and plain epsilon
 * edges) are followed without consuming input. Every other transition
 * consumes exactly one symbol, drawn from its label.
 */
public interface Transition {

  /**
   * State the transition leads to.
   */
  ATNState target();

  /**
   * Is the transition followed without consuming a symbol?
   */
  boolean isEpsilon();

  /**
   * Symbols that this transition consumes, if the transition has an explicit
   * label.
   *
   * Wildcard and epsilon transitions have none; not-set transitions report
   * the set that they exclude.
   */
  default Optional<IntervalSet> label() {
    return Optional.empty();
  }

  /**
   * Does the transition consume the symbol?
   *
   * @param symbol input symbol
   * @param minVocabSymbol smallest symbol of the vocabulary
   * @param maxVocabSymbol largest symbol of the vocabulary
   */
  boolean matches(int symbol, int minVocabSymbol, int maxVocabSymbol);

  /**
   * Label for a DOT graph transition.
   */
  String dotLabel();
}
