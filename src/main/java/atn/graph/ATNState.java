package atn.graph;

import atn.util.IntervalSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node in the ATN.
 *
 * <p>A state either has only epsilon transitions leaving it, or only
 * transitions that consume a symbol. Block start, block end, and loop states
 * are always epsilon-only; basic states may be either.
 *
 * <p>All fields except {@link #nextTokenWithinRule} are written while the ATN
 * is being built and only read afterwards.
 */
public abstract class ATNState {

  public static final int INVALID_STATE_NUMBER = -1;

  /** Owning ATN, set when the state is added to it. */
  ATN atn = null;

  int stateNumber = INVALID_STATE_NUMBER;

  int ruleIndex;

  boolean epsilonOnlyTransitions = false;

  private final List<Transition> transitions = new ArrayList<>(4);

  /**
   * Tokens reachable from this state without leaving the rule, computed on
   * demand by {@link ATN#nextTokensNoContext}. Read-only once published.
   */
  volatile IntervalSet nextTokenWithinRule;

  /** Guards the first computation of {@link #nextTokenWithinRule}. */
  final Object nextTokenLock = new Object();

  protected ATNState(int ruleIndex) {
    this.ruleIndex = ruleIndex;
  }

  public abstract ATNStateType stateType();

  public ATN atn() {
    return atn;
  }

  public int stateNumber() {
    return stateNumber;
  }

  public int ruleIndex() {
    return ruleIndex;
  }

  public boolean onlyHasEpsilonTransitions() {
    return epsilonOnlyTransitions;
  }

  public List<Transition> transitions() {
    return Collections.unmodifiableList(transitions);
  }

  public int numberOfTransitions() {
    return transitions.size();
  }

  public Transition transition(int i) {
    return transitions.get(i);
  }

  public IntervalSet nextTokenWithinRule() {
    return nextTokenWithinRule;
  }

  /**
   * Append an outgoing transition.
   *
   * @param transition transition leaving this state
   * @throws IllegalStateException if this mixes epsilon and non-epsilon transitions
   */
  public void addTransition(Transition transition) {
    addTransition(transitions.size(), transition);
  }

  public void addTransition(int index, Transition transition) {
    if (transitions.isEmpty()) {
      epsilonOnlyTransitions = transition.isEpsilon();
    } else if (epsilonOnlyTransitions != transition.isEpsilon()) {
      throw new IllegalStateException(
        "ATN state " + stateNumber + " has both epsilon and non-epsilon transitions"
      );
    }
    transitions.add(index, transition);
  }

  public Transition removeTransition(int index) {
    return transitions.remove(index);
  }

  @Override
  public String toString() {
    return String.valueOf(stateNumber);
  }
}
