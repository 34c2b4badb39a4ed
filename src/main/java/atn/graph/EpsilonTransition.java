package atn.graph;

/**
 * @param target state the transition leads to
 * @param outermostPrecedenceReturn rule index of the left-recursive rule
 *                                  whose outermost invocation this edge
 *                                  returns from, or {@code -1}
 */
public record EpsilonTransition(
  ATNState target,
  int outermostPrecedenceReturn
) implements Transition {

  public EpsilonTransition(ATNState target) {
    this(target, -1);
  }

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
    return "&epsilon;";
  }

  @Override
  public String toString() {
    return "epsilon -> " + target;
  }
}
