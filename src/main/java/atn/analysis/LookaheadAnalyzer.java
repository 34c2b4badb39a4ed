package atn.analysis;

import atn.RuleContext;
import atn.graph.ATNState;
import atn.util.IntervalSet;

/**
 * Closure search computing which symbols can be matched next.
 */
public interface LookaheadAnalyzer {

  /**
   * Compute the set of symbols that can follow a state.
   *
   * <p>Without a context ({@code ctx == null}), the search does not leave the
   * rule containing {@code s}: reaching the end of that rule (or
   * {@code stopState}) adds {@link atn.Token#EPSILON} to the result.
   *
   * <p>With a context, the search returns from rules into the callers
   * recorded in the context. Reaching the end of the outermost rule adds
   * {@link atn.Token#EOF}.
   *
   * @param s state to start from
   * @param stopState state at which to stop the search (or {@code null})
   * @param ctx invocation context (or {@code null})
   * @return fresh set of symbols
   */
  IntervalSet look(ATNState s, ATNState stopState, RuleContext ctx);
}
