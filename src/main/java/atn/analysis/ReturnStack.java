package atn.analysis;

import atn.RuleContext;
import atn.graph.ATN;
import java.util.ArrayList;
import java.util.Objects;

/**
 * Persistent stack of the states to return to once the rules being searched
 * through have completed.
 *
 * A {@code null} stack means "no context": nothing is known about what
 * follows the rule. A stack whose parent is {@code null} knows where to
 * return to next, but nothing beyond that. {@link #EMPTY} is the context of
 * the outermost rule, after which only the end of input can follow.
 *
 * Stacks are hashed once, when pushed, so that hashing a configuration does
 * not depend on how deep its context is.
 */
public final class ReturnStack {

  public static final int EMPTY_RETURN_STATE = Integer.MAX_VALUE;

  public static final ReturnStack EMPTY = new ReturnStack(null, EMPTY_RETURN_STATE);

  private final ReturnStack parent;
  private final int returnState;
  private final int cachedHashCode;

  /**
   * @param parent rest of the stack
   * @param returnState number of the state on top of the stack
   */
  public ReturnStack(ReturnStack parent, int returnState) {
    this.parent = parent;
    this.returnState = returnState;
    this.cachedHashCode = 31 * Objects.hashCode(parent) + returnState;
  }

  public ReturnStack parent() {
    return parent;
  }

  public int returnState() {
    return returnState;
  }

  public boolean isEmpty() {
    return returnState == EMPTY_RETURN_STATE;
  }

  /**
   * Push a return state.
   *
   * @param stack stack to push onto (may be {@code null})
   * @param returnState state number to return to
   * @return new stack
   */
  public static ReturnStack push(ReturnStack stack, int returnState) {
    return new ReturnStack(stack, returnState);
  }

  /**
   * Convert a rule invocation chain into the stack of states to return to.
   *
   * Each invoking state is replaced with the follow state of the rule call
   * leaving it.
   *
   * @param atn ATN the invoking states belong to
   * @param ctx invocation chain
   * @return return stack, {@link #EMPTY} for the root context
   * @throws IllegalStateException if an invoking state does not call a rule
   */
  public static ReturnStack fromRuleContext(ATN atn, RuleContext ctx) {
    final var invokingStates = new ArrayList<Integer>();
    for (RuleContext link = ctx; link != null && !link.isEmpty(); link = link.parent()) {
      invokingStates.add(link.invokingState());
    }

    // Outermost call ends up at the bottom of the stack
    ReturnStack stack = EMPTY;
    for (int i = invokingStates.size() - 1; i >= 0; i--) {
      final int followState = atn.invokingTransition(invokingStates.get(i)).followState().stateNumber();
      stack = push(stack, followState);
    }
    return stack;
  }

  @Override
  public int hashCode() {
    return cachedHashCode;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof ReturnStack)) {
      return false;
    }

    // Walk both stacks together until they meet at a shared tail
    ReturnStack left = this;
    ReturnStack right = (ReturnStack) other;
    while (left != right) {
      if (left == null || right == null) {
        return false;
      } else if (left.cachedHashCode != right.cachedHashCode || left.returnState != right.returnState) {
        return false;
      }
      left = left.parent;
      right = right.parent;
    }
    return true;
  }

  @Override
  public String toString() {
    final var builder = new StringBuilder();
    for (ReturnStack stack = this; ; stack = stack.parent) {
      if (stack == null) {
        return builder.append('?').toString();
      } else if (stack.isEmpty()) {
        return builder.append('$').toString();
      }
      builder.append(stack.returnState).append(' ');
    }
  }
}
