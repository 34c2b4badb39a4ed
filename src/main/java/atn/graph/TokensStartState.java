package atn.graph;

/**
 * Start state of a lexer mode: the decision between all the token rules that
 * are active in the mode.
 */
public final class TokensStartState extends DecisionState {

  public TokensStartState(int ruleIndex) {
    super(ruleIndex);
  }

  @Override
  public ATNStateType stateType() {
    return ATNStateType.TOKEN_START;
  }
}
