package atn;

/**
 * Invocation chain of the rules being matched.
 *
 * Each link records the state in the calling rule from which the rule at this
 * link was entered. Links are immutable and only ever point at their parent,
 * so a chain can be extended with {@link #push} and shared between threads
 * without copying.
 *
 * @param parent calling context, or {@code null} at the root
 * @param invokingState state number of the rule transition in the caller, or
 *                      {@code -1} at the root
 */
public record RuleContext(
  RuleContext parent,
  int invokingState
) {

  /**
   * Root of every invocation chain: the start rule, not called from anywhere.
   */
  public static final RuleContext EMPTY = new RuleContext(null, -1);

  public RuleContext {
    if (parent == null && invokingState != -1) {
      throw new IllegalArgumentException("root context must have invoking state -1, not " + invokingState);
    }
  }

  /**
   * Enter a rule from the given state of the rule at this link.
   *
   * @param invokingState state number of the rule transition being followed
   * @return new innermost link
   */
  public RuleContext push(int invokingState) {
    return new RuleContext(this, invokingState);
  }

  public boolean isEmpty() {
    return invokingState == -1;
  }

  /**
   * Number of rule invocations between this link and the root.
   */
  public int depth() {
    int depth = 0;
    for (RuleContext ctx = this; ctx.parent != null; ctx = ctx.parent) {
      depth++;
    }
    return depth;
  }

  @Override
  public String toString() {
    final var builder = new StringBuilder("[");
    for (RuleContext ctx = this; ctx != null && !ctx.isEmpty(); ctx = ctx.parent) {
      if (builder.length() > 1) {
        builder.append(' ');
      }
      builder.append(ctx.invokingState);
    }
    return builder.append(']').toString();
  }
}
