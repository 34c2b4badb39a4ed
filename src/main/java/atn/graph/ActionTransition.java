package atn.graph;

/**
 * Embedded action. Reachability ignores actions.
 *
 * @param target state the transition leads to
 * @param ruleIndex rule containing the action
 * @param actionIndex index of the action (a lexer action index in lexer ATNs)
 * @param contextDependent does the action read the rule context?
 */
public record ActionTransition(
  ATNState target,
  int ruleIndex,
  int actionIndex,
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
    return "<i>action " + ruleIndex + ":" + actionIndex + "</i>";
  }
}
