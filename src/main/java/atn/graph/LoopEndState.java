package atn.graph;

/** Exit of a {@code (...)*} or {@code (...)+} loop. */
public final class LoopEndState extends ATNState {

  ATNState loopBackState;

  public LoopEndState(int ruleIndex) {
    super(ruleIndex);
  }

  public ATNState loopBackState() {
    return loopBackState;
  }

  @Override
  public ATNStateType stateType() {
    return ATNStateType.LOOP_END;
  }
}
