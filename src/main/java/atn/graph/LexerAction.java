package atn.graph;

/**
 * Side effect attached to a lexer rule, referenced by index from
 * {@link ActionTransition}s of lexer ATNs.
 *
 * The ATN only stores these: running them is up to the lexer interpreter.
 */
public interface LexerAction {

  LexerActionType actionType();

  /**
   * Does running the action depend on the input position at which it is
   * reached (as opposed to the end of the token)?
   */
  default boolean isPositionDependent() {
    return false;
  }

  /** Send the token to another channel. */
  record Channel(int channel) implements LexerAction {
    @Override
    public LexerActionType actionType() {
      return LexerActionType.CHANNEL;
    }
  }

  /** Grammar-supplied action code. */
  record Custom(int ruleIndex, int actionIndex) implements LexerAction {
    @Override
    public LexerActionType actionType() {
      return LexerActionType.CUSTOM;
    }

    @Override
    public boolean isPositionDependent() {
      return true;
    }
  }

  /** Switch to another mode. */
  record Mode(int mode) implements LexerAction {
    @Override
    public LexerActionType actionType() {
      return LexerActionType.MODE;
    }
  }

  /** Keep matching into the same token. */
  record More() implements LexerAction {
    @Override
    public LexerActionType actionType() {
      return LexerActionType.MORE;
    }
  }

  record PopMode() implements LexerAction {
    @Override
    public LexerActionType actionType() {
      return LexerActionType.POP_MODE;
    }
  }

  record PushMode(int mode) implements LexerAction {
    @Override
    public LexerActionType actionType() {
      return LexerActionType.PUSH_MODE;
    }
  }

  /** Discard the token. */
  record Skip() implements LexerAction {
    @Override
    public LexerActionType actionType() {
      return LexerActionType.SKIP;
    }
  }

  /** Override the token type. */
  record Type(int type) implements LexerAction {
    @Override
    public LexerActionType actionType() {
      return LexerActionType.TYPE;
    }
  }
}
