package atn.graph;

/** Start of a {@code (...)} or {@code (...)?} block. */
public final class BasicBlockStartState extends BlockStartState {

  public BasicBlockStartState(int ruleIndex) {
    super(ruleIndex);
  }

  @Override
  public ATNStateType stateType() {
    return ATNStateType.BLOCK_START;
  }
}
