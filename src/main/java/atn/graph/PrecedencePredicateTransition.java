package atn.graph;

/**
 * Precedence check inserted by left-recursion elimination.
 *
 * @param target state the transition leads to
 * @param precedence minimum precedence level for the path to be viable
 */
public record PrecedencePredicateTransition(
  ATNState target,
  int precedence
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
    return "<i>" + precedence + " &gt;= _p</i>";
  }
}
