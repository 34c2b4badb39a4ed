package atn.graph;

/** Start of the block inside a {@code (...)*} loop. */
public final class StarBlockStartState extends BlockStartState {

  public StarBlockStartState(int ruleIndex) {
    super(ruleIndex);
  }

  @Override
  public ATNStateType stateType() {
    return ATNStateType.STAR_BLOCK_START;
  }
}
