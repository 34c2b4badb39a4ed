package atn.graph;

public final class BasicState extends ATNState {

  public BasicState(int ruleIndex) {
    super(ruleIndex);
  }

  @Override
  public ATNStateType stateType() {
    return ATNStateType.BASIC;
  }
}
