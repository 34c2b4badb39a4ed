package atn.graph;

/**
 * Exit state of a rule.
 *
 * A stop state has no outgoing transitions: where parsing continues after it
 * depends on the invocation context, and the follow state of the rule
 * transition that entered the rule says where that is.
 */
public final class RuleStopState extends ATNState {

  public RuleStopState(int ruleIndex) {
    super(ruleIndex);
  }

  @Override
  public ATNStateType stateType() {
    return ATNStateType.RULE_STOP;
  }
}
