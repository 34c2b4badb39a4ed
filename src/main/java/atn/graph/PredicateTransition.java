package atn.graph;

/**
 * Semantic predicate guarding the target state.
 *
 * @param target state the transition leads to
 * @param ruleIndex rule containing the predicate
 * @param predIndex index of the predicate within the rule
 * @param contextDependent does the predicate read the rule context?
 */
public record PredicateTransition(
  ATNState target,
  int ruleIndex,
  int predIndex,
  boolean contextDependent
) implements Transition {

  @Override
  public boolean isEpsilon() {
    return true;
  }

  @Override
  public boolean matches(int symbol, int minVocabSymbol, int maxVocabSymbol) {
    return false;
  }

  @Override
  public String dotLabel() {
    return "<i>pred " + ruleIndex + ":" + predIndex + "</i>";
  }
}
