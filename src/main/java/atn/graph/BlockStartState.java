package atn.graph;

/**
 * Start of a block of alternatives, paired with the block's end state.
 */
public abstract class BlockStartState extends DecisionState {

  BlockEndState endState;

  protected BlockStartState(int ruleIndex) {
    super(ruleIndex);
  }

  public BlockEndState endState() {
    return endState;
  }
}
