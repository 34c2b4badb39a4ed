package atn.graph;

/** Decision to go round a {@code (...)+} loop again or leave it. */
public final class PlusLoopbackState extends DecisionState {

  public PlusLoopbackState(int ruleIndex) {
    super(ruleIndex);
  }

  @Override
  public ATNStateType stateType() {
    return ATNStateType.PLUS_LOOP_BACK;
  }
}
