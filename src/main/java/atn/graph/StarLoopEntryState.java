package atn.graph;

/** Decision to enter (or go round again) a {@code (...)*} loop or skip it. */
public final class StarLoopEntryState extends DecisionState {

  StarLoopbackState loopBackState;

  public StarLoopEntryState(int ruleIndex) {
    super(ruleIndex);
  }

  public StarLoopbackState loopBackState() {
    return loopBackState;
  }

  @Override
  public ATNStateType stateType() {
    return ATNStateType.STAR_LOOP_ENTRY;
  }
}
