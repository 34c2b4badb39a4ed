package atn.analysis;

import atn.RuleContext;
import atn.Token;
import atn.graph.ATN;
import atn.graph.ATNState;
import atn.graph.NotSetTransition;
import atn.graph.PrecedencePredicateTransition;
import atn.graph.PredicateTransition;
import atn.graph.RuleStopState;
import atn.graph.RuleTransition;
import atn.graph.Transition;
import atn.graph.WildcardTransition;
import atn.util.IntervalSet;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Stack;

/**
 * LL(1) lookahead computed by a depth-first search over epsilon transitions.
 */
public final class LL1Analyzer implements LookaheadAnalyzer {

  /**
   * Added to a lookahead set when the search was blocked by a semantic
   * predicate it was told not to see through.
   */
  public static final int HIT_PRED = Token.INVALID_TYPE;

  private final ATN atn;

  private final boolean printDebugInfo;

  public LL1Analyzer(ATN atn) {
    this(atn, false);
  }

  /**
   * @param atn ATN to search
   * @param printDebugInfo print to STDERR a trace of what is happening
   */
  public LL1Analyzer(ATN atn, boolean printDebugInfo) {
    this.atn = atn;
    this.printDebugInfo = printDebugInfo;
  }

  @Override
  public IntervalSet look(ATNState s, ATNState stopState, RuleContext ctx) {
    final ReturnStack stack = ctx == null ? null : ReturnStack.fromRuleContext(atn, ctx);
    return look(s, stopState, stack, true, true);
  }

  /**
   * Compute the set of symbols that can follow a state.
   *
   * @param s state to start from
   * @param stopState state at which to stop the search (or {@code null})
   * @param stack states to return to at the end of rules ({@code null} to stay in the rule)
   * @param seeThruPreds treat predicates as epsilon transitions instead of
   *                     adding {@link #HIT_PRED}
   * @param addEOF add {@link Token#EOF} when the outermost rule ends
   * @return fresh set of symbols
   */
  public IntervalSet look(
    ATNState s,
    ATNState stopState,
    ReturnStack stack,
    boolean seeThruPreds,
    boolean addEOF
  ) {
    record Config(int state, ReturnStack stack) { }
    record ToVisit(ATNState state, ReturnStack stack, BitSet calledRules) { }

    final var look = new IntervalSet();
    final var busy = new HashSet<Config>();
    final var toVisit = new Stack<ToVisit>();

    if (printDebugInfo) {
      System.err.println("[LL1] starting search at " + s + " in context " + stack);
    }

    toVisit.push(new ToVisit(s, stack, new BitSet()));

    // DFS loop
    while (!toVisit.isEmpty()) {
      final var next = toVisit.pop();
      final ATNState state = next.state();
      final ReturnStack ctx = next.stack();

      // Skip configurations we've already seen
      if (!busy.add(new Config(state.stateNumber(), ctx))) {
        continue;
      }

      if (printDebugInfo) {
        System.err.println("[LL1] entering " + state + " in context " + ctx);
      }

      if (state == stopState || state instanceof RuleStopState) {
        if (ctx == null) {
          look.add(Token.EPSILON);
          continue;
        } else if (ctx.isEmpty() && addEOF) {
          look.add(Token.EOF);
          continue;
        }
      }

      // Return into the caller on top of the stack
      if (state instanceof RuleStopState && !ctx.isEmpty()) {
        final var calledRules = (BitSet) next.calledRules().clone();
        calledRules.clear(state.ruleIndex());
        final ATNState returnState = atn.getState(ctx.returnState());
        if (returnState == null) {
          throw new IllegalStateException("Return state " + ctx.returnState() + " has been removed from the ATN");
        }
        toVisit.push(new ToVisit(returnState, ctx.parent(), calledRules));
        continue;
      }

      for (Transition transition : state.transitions()) {
        if (transition instanceof RuleTransition call) {

          // Left recursion: the rule is already being searched on this path
          if (next.calledRules().get(call.ruleIndex())) {
            continue;
          }
          final var calledRules = (BitSet) next.calledRules().clone();
          calledRules.set(call.ruleIndex());
          final var pushed = ReturnStack.push(ctx, call.followState().stateNumber());
          toVisit.push(new ToVisit(call.target(), pushed, calledRules));

        } else if (transition instanceof PredicateTransition
            || transition instanceof PrecedencePredicateTransition) {
          if (seeThruPreds) {
            toVisit.push(new ToVisit(transition.target(), ctx, next.calledRules()));
          } else {
            look.add(HIT_PRED);
          }

        } else if (transition.isEpsilon()) {
          toVisit.push(new ToVisit(transition.target(), ctx, next.calledRules()));

        } else if (transition instanceof WildcardTransition) {
          addSymbols(look, IntervalSet.ofRange(Token.MIN_USER_TOKEN_TYPE, atn.getMaxTokenType()));

        } else if (transition instanceof NotSetTransition notSet) {
          addSymbols(look, notSet.set().complement(Token.MIN_USER_TOKEN_TYPE, atn.getMaxTokenType()));

        } else {
          final Optional<IntervalSet> label = transition.label();
          if (label.isPresent()) {
            addSymbols(look, label.get());
          }
        }
      }
    }

    return look;
  }

  private void addSymbols(IntervalSet look, IntervalSet symbols) {
    if (printDebugInfo) {
      System.err.println("[LL1] adding " + symbols);
    }
    look.addAll(symbols);
  }

  /**
   * Compute the lookahead of each alternative of a decision.
   *
   * Predicates are not seen through, and the end of the rule does not add
   * {@link Token#EOF}.
   *
   * @param s decision state
   * @return lookahead of each alternative, in transition order, which is
   *         absent if the alternative has no lookahead or hit a predicate
   */
  public List<Optional<IntervalSet>> getDecisionLookahead(ATNState s) {
    final var lookahead = new ArrayList<Optional<IntervalSet>>(s.numberOfTransitions());
    for (Transition alternative : s.transitions()) {
      final IntervalSet set = look(alternative.target(), null, ReturnStack.EMPTY, false, false);
      if (set.isEmpty() || set.contains(HIT_PRED)) {
        lookahead.add(Optional.empty());
      } else {
        lookahead.add(Optional.of(set));
      }
    }
    return lookahead;
  }
}
