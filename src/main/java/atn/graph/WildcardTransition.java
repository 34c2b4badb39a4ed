package atn.graph;

/**
 * Match of any vocabulary symbol.
 *
 * @param target state the transition leads to
 */
public record WildcardTransition(ATNState target) implements Transition {

  @Override
  public boolean isEpsilon() {
    return false;
  }

  @Override
  public boolean matches(int symbol, int minVocabSymbol, int maxVocabSymbol) {
    return symbol >= minVocabSymbol && symbol <= maxVocabSymbol;
  }

  @Override
  public String dotLabel() {
    return ".";
  }
}
