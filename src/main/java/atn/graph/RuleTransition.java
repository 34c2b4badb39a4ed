package atn.graph;

/**
 * Call of another rule.
 *
 * @param target start state of the called rule
 * @param ruleIndex index of the called rule
 * @param precedence precedence of the call (for left-recursive rules)
 * @param followState state in the caller where matching resumes once the
 *                    called rule completes
 */
public record RuleTransition(
  RuleStartState target,
  int ruleIndex,
  int precedence,
  ATNState followState
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
    return "<i>call " + ruleIndex + "</i>";
  }

  @Override
  public String toString() {
    return "rule " + ruleIndex + " -> " + target + " (follow " + followState + ")";
  }
}
