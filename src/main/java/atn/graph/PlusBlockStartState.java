package atn.graph;

/**
 * Start of the block of a {@code (...)+} loop.
 *
 * The decision made here is which alternative to match first; whether to go
 * round again is decided at {@link #loopBackState}.
 */
public final class PlusBlockStartState extends BlockStartState {

  PlusLoopbackState loopBackState;

  public PlusBlockStartState(int ruleIndex) {
    super(ruleIndex);
  }

  public PlusLoopbackState loopBackState() {
    return loopBackState;
  }

  @Override
  public ATNStateType stateType() {
    return ATNStateType.PLUS_BLOCK_START;
  }
}
