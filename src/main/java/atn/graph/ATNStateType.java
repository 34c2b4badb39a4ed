package atn.graph;

/**
 * Kind of an ATN state.
 *
 * The ordinals are the state type codes of serialized ATNs, with {@code 0}
 * reserved for invalid states.
 */
public enum ATNStateType {
  INVALID_TYPE,
  BASIC,
  RULE_START,
  BLOCK_START,
  PLUS_BLOCK_START,
  STAR_BLOCK_START,
  TOKEN_START,
  RULE_STOP,
  BLOCK_END,
  STAR_LOOP_BACK,
  STAR_LOOP_ENTRY,
  PLUS_LOOP_BACK,
  LOOP_END
}
