package atn.graph;

/**
 * State where more than one outgoing path exists and the parser must predict
 * which one to take.
 */
public abstract class DecisionState extends ATNState {

  int decision = -1;

  boolean nonGreedy;

  protected DecisionState(int ruleIndex) {
    super(ruleIndex);
  }

  /**
   * Index of this decision in {@link ATN#getDecisionState}, or {@code -1} if
   * the state has not been defined as a decision.
   */
  public int decision() {
    return decision;
  }

  public boolean isNonGreedy() {
    return nonGreedy;
  }

  public void setNonGreedy(boolean nonGreedy) {
    this.nonGreedy = nonGreedy;
  }
}
