package atn;

/**
 * Reserved token types.
 */
public final class Token {

  private Token() { }

  /** Smallest token type a grammar may assign. */
  public static final int MIN_USER_TOKEN_TYPE = 1;

  /** Marks a missing or unassigned token type. */
  public static final int INVALID_TYPE = 0;

  /** End of input. */
  public static final int EOF = -1;

  /**
   * Reached the end of a rule without consuming input.
   *
   * Only appears in lookahead sets computed without a full invocation
   * context; it never labels a transition.
   */
  public static final int EPSILON = -2;
}
