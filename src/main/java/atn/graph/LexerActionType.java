package atn.graph;

/**
 * Kind of a lexer action, in serialized order.
 */
public enum LexerActionType {
  CHANNEL,
  CUSTOM,
  MODE,
  MORE,
  POP_MODE,
  PUSH_MODE,
  SKIP,
  TYPE
}
