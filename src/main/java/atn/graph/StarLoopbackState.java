package atn.graph;

public final class StarLoopbackState extends ATNState {

  public StarLoopbackState(int ruleIndex) {
    super(ruleIndex);
  }

  /**
   * Entry of the loop this state jumps back to.
   */
  public StarLoopEntryState loopEntryState() {
    return (StarLoopEntryState) transition(0).target();
  }

  @Override
  public ATNStateType stateType() {
    return ATNStateType.STAR_LOOP_BACK;
  }
}
