package atn.graph;

/** Terminal state of a block, where every alternative meets again. */
public final class BlockEndState extends ATNState {

  BlockStartState startState;

  public BlockEndState(int ruleIndex) {
    super(ruleIndex);
  }

  public BlockStartState startState() {
    return startState;
  }

  @Override
  public ATNStateType stateType() {
    return ATNStateType.BLOCK_END;
  }
}
