package atn.graph;

/**
 * Entry state of a rule.
 */
public final class RuleStartState extends ATNState {

  RuleStopState stopState;

  boolean leftRecursiveRule;

  public RuleStartState(int ruleIndex, boolean leftRecursiveRule) {
    super(ruleIndex);
    this.leftRecursiveRule = leftRecursiveRule;
  }

  public RuleStopState stopState() {
    return stopState;
  }

  public boolean isLeftRecursiveRule() {
    return leftRecursiveRule;
  }

  @Override
  public ATNStateType stateType() {
    return ATNStateType.RULE_START;
  }
}
