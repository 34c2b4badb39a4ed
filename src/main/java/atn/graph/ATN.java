package atn.graph;

import atn.RuleContext;
import atn.Token;
import atn.analysis.LL1Analyzer;
import atn.analysis.LookaheadAnalyzer;
import atn.util.IntervalSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Augmented transition network.
 *
 * <p>Every rule of the grammar is a sub-graph running from its
 * {@link RuleStartState} to its {@link RuleStopState}. Calls between rules
 * are {@link RuleTransition}s, which record the state in the caller where
 * matching resumes once the called rule has completed. Lexer ATNs also have
 * one {@link TokensStartState} per mode, choosing between the token rules.
 *
 * <p>The graph is built once (by a single thread, typically through
 * {@link Builder}) and then shared between any number of concurrent parsers.
 * The only state that changes afterwards is the per-state cache behind
 * {@link #nextTokensNoContext}.
 *
 * <p>States are identified by their state number, which is their index in the
 * state list. Removing a state leaves a {@code null} hole in the list rather
 * than renumbering the states after it.
 */
public final class ATN implements DotGraph<Integer, Transition> {

  /**
   * Alternative number of a context whose alternative is not known.
   */
  public static final int INVALID_ALT_NUMBER = 0;

  /**
   * All states, indexed by state number.
   */
  private final List<ATNState> states = new ArrayList<>();

  /**
   * Decision points for all rules, sub-rules, optional blocks, loops, and
   * lexer modes, indexed by decision number.
   */
  private final List<DecisionState> decisionToState = new ArrayList<>();

  private RuleStartState[] ruleToStartState = new RuleStartState[0];

  private RuleStopState[] ruleToStopState = new RuleStopState[0];

  /**
   * Token type produced by each rule of a lexer ATN. For parser ATNs, the
   * bypass token type of each rule if bypass transitions were generated and
   * {@code null} otherwise.
   */
  private int[] ruleToTokenType = null;

  private final List<TokensStartState> modeToStartState = new ArrayList<>();

  private final Map<String, TokensStartState> modeNameToStartState = new LinkedHashMap<>();

  /**
   * Actions referenced by the action transitions of a lexer ATN.
   */
  private final List<LexerAction> lexerActions = new ArrayList<>();

  private final ATNType grammarType;

  /**
   * Largest symbol recognized by any transition of the ATN.
   */
  private final int maxTokenType;

  private final LookaheadAnalyzer analyzer;

  public ATN(ATNType grammarType, int maxTokenType) {
    this(grammarType, maxTokenType, LL1Analyzer::new);
  }

  /**
   * Construct an empty ATN.
   *
   * @param grammarType flavor of grammar
   * @param maxTokenType largest symbol recognized by any transition
   * @param analyzerFactory creates the closure search used by the lookahead queries
   */
  public ATN(
    ATNType grammarType,
    int maxTokenType,
    Function<ATN, ? extends LookaheadAnalyzer> analyzerFactory
  ) {
    this.grammarType = Objects.requireNonNull(grammarType, "grammarType");
    this.maxTokenType = maxTokenType;
    this.analyzer = analyzerFactory.apply(this);
  }

  /**
   * Compute the set of valid tokens that can occur starting in a state.
   *
   * If {@code ctx} is {@code null}, the set is restricted to tokens reachable
   * without leaving the rule of {@code s} and contains {@link Token#EPSILON}
   * if the end of the rule can be reached. Otherwise, the search continues
   * into the callers recorded in {@code ctx}, and {@link Token#EOF} is added
   * if the end of the outermost rule can be reached.
   *
   * @param s state to start from
   * @param ctx invocation context, or {@code null}
   * @return fresh (writable) set of tokens
   */
  public IntervalSet nextTokensInContext(ATNState s, RuleContext ctx) {
    return analyzer.look(s, null, ctx);
  }

  /**
   * Compute the set of valid tokens that can occur starting in a state and
   * staying in the same rule. {@link Token#EPSILON} is in the set if the end
   * of the rule can be reached.
   *
   * The set is computed at most once per state, even under concurrent first
   * access, and then cached on the state.
   *
   * @param s state to start from
   * @return shared read-only set of tokens
   */
  public IntervalSet nextTokensNoContext(ATNState s) {
    final IntervalSet cached = s.nextTokenWithinRule;
    if (cached != null) {
      return cached;
    }

    synchronized (s.nextTokenLock) {
      IntervalSet next = s.nextTokenWithinRule;
      if (next == null) {
        next = nextTokensInContext(s, null);
        next.setReadOnly(true);
        s.nextTokenWithinRule = next;
      }
      return next;
    }
  }

  /**
   * Compute the set of valid tokens that can occur starting in a state.
   *
   * Dispatches to {@link #nextTokensNoContext} when there is no context (a
   * {@code null} or empty one), and to {@link #nextTokensInContext} otherwise.
   *
   * @param s state to start from
   * @param ctx invocation context
   * @return set of tokens, which is read-only when there was no context
   */
  public IntervalSet nextTokens(ATNState s, RuleContext ctx) {
    if (ctx == null || ctx.isEmpty()) {
      return nextTokensNoContext(s);
    }
    return nextTokensInContext(s, ctx);
  }

  public IntervalSet nextTokens(ATNState s) {
    return nextTokensNoContext(s);
  }

  /**
   * Compute the set of input symbols which could follow a state in the given
   * full parse context.
   *
   * All semantic predicates are assumed true. If a path exists from the state
   * to the stop state of the outermost rule without matching any symbol,
   * {@link Token#EOF} is in the set.
   *
   * @param stateNumber state the parser is in
   * @param ctx full invocation context ({@code null} means the empty context)
   * @return potentially valid symbols (the cached read-only set when the
   *         state's own rule decides them)
   * @throws IllegalArgumentException if the ATN has no such state number
   * @throws IllegalStateException if the context refers to states which are
   *                               not rule calls of this ATN
   */
  public IntervalSet getExpectedTokens(int stateNumber, RuleContext ctx) {
    if (stateNumber < 0 || stateNumber >= states.size()) {
      throw new IllegalArgumentException("Invalid state number.");
    }

    IntervalSet following = nextTokens(presentState(stateNumber));
    if (!following.contains(Token.EPSILON)) {
      return following;
    }

    final var expected = IntervalSet.copyOf(following);
    expected.remove(Token.EPSILON);

    RuleContext context = ctx == null ? RuleContext.EMPTY : ctx;
    while (context != null && context.invokingState() >= 0 && following.contains(Token.EPSILON)) {
      final RuleTransition call = invokingTransition(context.invokingState());
      following = nextTokens(call.followState());
      expected.addAll(following);
      expected.remove(Token.EPSILON);
      context = context.parent();
    }

    if (following.contains(Token.EPSILON)) {
      expected.add(Token.EOF);
    }

    return expected;
  }

  /**
   * Rule transition leaving the state from which a rule was invoked.
   *
   * @param invokingState state number recorded in a rule context
   * @throws IllegalStateException if the state is not the source of a rule call
   */
  public RuleTransition invokingTransition(int invokingState) {
    if (invokingState < 0 || invokingState >= states.size()) {
      throw new IllegalStateException("Invoking state " + invokingState + " is not in the ATN");
    }
    final ATNState state = presentState(invokingState);
    if (state.numberOfTransitions() == 0 || !(state.transition(0) instanceof RuleTransition call)) {
      throw new IllegalStateException("Invoking state " + invokingState + " does not call a rule");
    }
    return call;
  }

  private ATNState presentState(int stateNumber) {
    final ATNState state = states.get(stateNumber);
    if (state == null) {
      throw new IllegalStateException("State " + stateNumber + " has been removed from the ATN");
    }
    return state;
  }

  /**
   * Append a state, assigning it the next state number.
   *
   * @param state state to add, or {@code null} to reserve an empty slot
   */
  public void addState(ATNState state) {
    if (state != null) {
      state.atn = this;
      state.stateNumber = states.size();
    }
    states.add(state);
  }

  /**
   * Clear the slot of a state. The numbers of other states do not change.
   *
   * @param stateNumber number of the state to remove
   */
  public void removeState(int stateNumber) {
    states.set(stateNumber, null);
  }

  /**
   * Register a decision state, assigning it the next decision number.
   *
   * @param s decision state
   * @return decision number of {@code s}
   */
  public int defineDecisionState(DecisionState s) {
    decisionToState.add(s);
    s.decision = decisionToState.size() - 1;
    return s.decision;
  }

  /**
   * Look up a decision state.
   *
   * @param decision decision number
   * @return decision state, or {@code null} if no decision has been defined yet
   */
  public DecisionState getDecisionState(int decision) {
    if (decisionToState.isEmpty()) {
      return null;
    }
    return decisionToState.get(decision);
  }

  public int getNumberOfDecisions() {
    return decisionToState.size();
  }

  /**
   * Register the start state of a lexer mode.
   *
   * @param name mode name
   * @param start decision between the token rules of the mode
   * @return mode number
   */
  public int defineMode(String name, TokensStartState start) {
    if (modeNameToStartState.putIfAbsent(name, start) != null) {
      throw new IllegalStateException("Mode " + name + " is already defined");
    }
    modeToStartState.add(start);
    return modeToStartState.size() - 1;
  }

  public ATNState getState(int stateNumber) {
    return states.get(stateNumber);
  }

  /**
   * Number of state slots, removed states included.
   */
  public int getNumberOfStates() {
    return states.size();
  }

  public List<ATNState> getStates() {
    return Collections.unmodifiableList(states);
  }

  public RuleStartState getRuleToStartState(int ruleIndex) {
    return ruleToStartState[ruleIndex];
  }

  public RuleStopState getRuleToStopState(int ruleIndex) {
    return ruleToStopState[ruleIndex];
  }

  public int getNumberOfRules() {
    return ruleToStartState.length;
  }

  /**
   * Token type of a rule, or {@link Token#INVALID_TYPE} if the ATN does not
   * map rules to token types.
   */
  public int getRuleToTokenType(int ruleIndex) {
    return ruleToTokenType == null ? Token.INVALID_TYPE : ruleToTokenType[ruleIndex];
  }

  public TokensStartState getModeToStartState(int mode) {
    return modeToStartState.get(mode);
  }

  public TokensStartState getModeStartState(String modeName) {
    return modeNameToStartState.get(modeName);
  }

  public int getNumberOfModes() {
    return modeToStartState.size();
  }

  public List<LexerAction> getLexerActions() {
    return Collections.unmodifiableList(lexerActions);
  }

  public ATNType getGrammarType() {
    return grammarType;
  }

  public int getMaxTokenType() {
    return maxTokenType;
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    return states
      .stream()
      .filter(Objects::nonNull)
      .map(state -> new DotGraph.Vertex<>(
        state.stateNumber,
        state.ruleIndex >= 0 ? state.ruleIndex : DotGraph.NO_CLUSTER,
        state instanceof RuleStopState
      ));
  }

  @Override
  public Stream<DotGraph.Edge<Integer, Transition>> edges() {
    final var entryEdges = Stream
      .of(ruleToStartState)
      .map(start -> new DotGraph.Edge<Integer, Transition>(null, start.stateNumber, null));
    final var transitionEdges = states
      .stream()
      .filter(Objects::nonNull)
      .flatMap(state -> state
        .transitions()
        .stream()
        .map(t -> new DotGraph.Edge<Integer, Transition>(state.stateNumber, t.target().stateNumber, t)));
    return Stream.concat(entryEdges, transitionEdges);
  }

  @Override
  public String renderEdgeLabel(DotGraph.Edge<Integer, Transition> edge) {
    final Transition label = edge.label();
    return label == null ? "" : label.dotLabel();
  }

  @Override
  public String renderVertexLabel(DotGraph.Vertex<Integer> vertex) {
    final ATNState state = states.get(vertex.id());
    switch (state.stateType()) {
      case RULE_START:
        return vertex.id() + "<br/><i>start</i>";
      case RULE_STOP:
        return vertex.id() + "<br/><i>stop</i>";
      case TOKEN_START:
        return vertex.id() + "<br/><i>tokens</i>";
      default:
        return vertex.id().toString();
    }
  }

  @Override
  public String renderClusterLabel(int cluster) {
    return "rule " + cluster;
  }

  /**
   * Single-use builder for a fully populated ATN.
   *
   * Rules must be declared (with {@link #rule}) before they are called (with
   * {@link #ruleCall}).
   */
  public static final class Builder {

    private final ATN atn;
    private boolean used = false;
    private final List<RuleStartState> ruleStarts = new ArrayList<>();
    private final Map<Integer, Integer> ruleTokenTypes = new LinkedHashMap<>();

    public Builder(ATNType grammarType, int maxTokenType) {
      this(new ATN(grammarType, maxTokenType));
    }

    /**
     * Populate an existing empty ATN.
     *
     * @param atn ATN with no states
     */
    public Builder(ATN atn) {
      if (!atn.states.isEmpty()) {
        throw new IllegalArgumentException("ATN is already populated");
      }
      this.atn = atn;
    }

    /**
     * Add a state to the ATN.
     *
     * @param state new state
     * @return {@code state}, now numbered
     */
    public <S extends ATNState> S state(S state) {
      checkUnused();
      atn.addState(state);
      return state;
    }

    public BasicState basic(int ruleIndex) {
      return state(new BasicState(ruleIndex));
    }

    public RuleStartState rule(int ruleIndex) {
      return rule(ruleIndex, false);
    }

    /**
     * Declare a rule, adding its start and stop states.
     *
     * @param ruleIndex index of the rule
     * @param leftRecursive was the rule rewritten from a left-recursive one?
     * @return start state of the rule
     */
    public RuleStartState rule(int ruleIndex, boolean leftRecursive) {
      while (ruleStarts.size() <= ruleIndex) {
        ruleStarts.add(null);
      }
      if (ruleStarts.get(ruleIndex) != null) {
        throw new IllegalStateException("Rule " + ruleIndex + " is already declared");
      }
      final RuleStartState start = state(new RuleStartState(ruleIndex, leftRecursive));
      start.stopState = state(new RuleStopState(ruleIndex));
      ruleStarts.set(ruleIndex, start);
      return start;
    }

    /**
     * Add a block start and end state, linked to each other.
     *
     * @return the block start state
     */
    public <S extends BlockStartState> S block(S start, BlockEndState end) {
      state(start);
      state(end);
      start.endState = end;
      end.startState = start;
      return start;
    }

    /**
     * Link the states of a {@code (...)+} loop (already added).
     */
    public Builder plusLoop(PlusBlockStartState start, PlusLoopbackState loopBack, LoopEndState end) {
      checkUnused();
      start.loopBackState = loopBack;
      end.loopBackState = loopBack;
      return this;
    }

    /**
     * Link the states of a {@code (...)*} loop (already added).
     */
    public Builder starLoop(StarLoopEntryState entry, StarLoopbackState loopBack, LoopEndState end) {
      checkUnused();
      entry.loopBackState = loopBack;
      end.loopBackState = loopBack;
      return this;
    }

    public Builder transition(ATNState from, Transition transition) {
      checkUnused();
      from.addTransition(transition);
      return this;
    }

    public Builder epsilon(ATNState from, ATNState to) {
      return transition(from, new EpsilonTransition(to));
    }

    public Builder atom(ATNState from, ATNState to, int symbol) {
      return transition(from, new AtomTransition(to, symbol));
    }

    public Builder range(ATNState from, ATNState to, int lowerBound, int upperBound) {
      return transition(from, new RangeTransition(to, lowerBound, upperBound));
    }

    public Builder set(ATNState from, ATNState to, IntervalSet set) {
      return transition(from, new SetTransition(to, set));
    }

    public Builder notSet(ATNState from, ATNState to, IntervalSet set) {
      return transition(from, new NotSetTransition(to, set));
    }

    public Builder wildcard(ATNState from, ATNState to) {
      return transition(from, new WildcardTransition(to));
    }

    public Builder predicate(ATNState from, ATNState to, int predIndex) {
      return transition(from, new PredicateTransition(to, from.ruleIndex, predIndex, false));
    }

    public Builder action(ATNState from, ATNState to, int actionIndex) {
      return transition(from, new ActionTransition(to, from.ruleIndex, actionIndex, false));
    }

    /**
     * Call a declared rule from {@code from}, resuming at {@code followState}.
     *
     * @param from state in the caller (the invoking state)
     * @param ruleIndex index of the called rule
     * @param followState state in the caller after the call
     */
    public Builder ruleCall(ATNState from, int ruleIndex, ATNState followState) {
      if (ruleIndex >= ruleStarts.size() || ruleStarts.get(ruleIndex) == null) {
        throw new IllegalStateException("Rule " + ruleIndex + " is called before being declared");
      }
      return transition(from, new RuleTransition(ruleStarts.get(ruleIndex), ruleIndex, 0, followState));
    }

    /**
     * Register a decision state (already added).
     *
     * @return decision number
     */
    public int decision(DecisionState state) {
      checkUnused();
      return atn.defineDecisionState(state);
    }

    /**
     * Add and register the start state of a lexer mode.
     *
     * @return the mode start state
     */
    public TokensStartState mode(String name) {
      final TokensStartState start = state(new TokensStartState(-1));
      atn.defineDecisionState(start);
      atn.defineMode(name, start);
      return start;
    }

    /**
     * Register a lexer action.
     *
     * @return action index, for use in {@link #action}
     */
    public int lexerAction(LexerAction action) {
      checkUnused();
      atn.lexerActions.add(action);
      return atn.lexerActions.size() - 1;
    }

    public Builder ruleTokenType(int ruleIndex, int tokenType) {
      checkUnused();
      ruleTokenTypes.put(ruleIndex, tokenType);
      return this;
    }

    /**
     * Finalize the construction of the ATN.
     *
     * @return ATN ready to be shared
     * @throws IllegalStateException if a rule index has no start or stop state
     */
    public ATN build() {
      checkUnused();
      used = true;

      final int ruleCount = ruleStarts.size();
      final var starts = new RuleStartState[ruleCount];
      final var stops = new RuleStopState[ruleCount];
      for (int ruleIndex = 0; ruleIndex < ruleCount; ruleIndex++) {
        final RuleStartState start = ruleStarts.get(ruleIndex);
        if (start == null) {
          throw new IllegalStateException("Rule " + ruleIndex + " has no start state");
        } else if (start.stopState == null) {
          throw new IllegalStateException("Rule " + ruleIndex + " has no stop state");
        }
        starts[ruleIndex] = start;
        stops[ruleIndex] = start.stopState;
      }
      atn.ruleToStartState = starts;
      atn.ruleToStopState = stops;

      if (atn.grammarType == ATNType.LEXER || !ruleTokenTypes.isEmpty()) {
        final var tokenTypes = new int[ruleCount];
        for (var entry : ruleTokenTypes.entrySet()) {
          if (entry.getKey() >= ruleCount) {
            throw new IllegalStateException("Token type given for undeclared rule " + entry.getKey());
          }
          tokenTypes[entry.getKey()] = entry.getValue();
        }
        atn.ruleToTokenType = tokenTypes;
      }

      return atn;
    }

    private void checkUnused() {
      if (used) {
        throw new IllegalStateException("build may only be called once on an ATN builder");
      }
    }
  }
}
