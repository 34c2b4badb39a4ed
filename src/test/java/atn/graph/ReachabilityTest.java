package atn.graph;

import atn.RuleContext;
import atn.Token;
import atn.analysis.LL1Analyzer;
import atn.analysis.LookaheadAnalyzer;
import atn.util.IntervalSet;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Assert;
import org.junit.Test;

public class ReachabilityTest {

  @Test
  public void optionalTokenWithinRule() {
    final var grammar = Grammars.optionalToken();
    final IntervalSet next = grammar.atn().nextTokensNoContext(grammar.start());
    Assert.assertEquals(IntervalSet.of(Grammars.T, Token.EPSILON), next);
  }

  @Test
  public void optionalTokenExpectedAtRoot() {
    final var grammar = Grammars.optionalToken();
    final int stateNumber = grammar.start().stateNumber();

    Assert.assertEquals(
      IntervalSet.of(Grammars.T, Token.EOF),
      grammar.atn().getExpectedTokens(stateNumber, RuleContext.EMPTY)
    );
    Assert.assertEquals(
      IntervalSet.of(Grammars.T, Token.EOF),
      grammar.atn().getExpectedTokens(stateNumber, null)
    );
  }

  @Test
  public void expectedTokensWithoutEpsilonAreTheLocalSet() {
    final var grammar = Grammars.callsEmptyRule();
    final IntervalSet expected = grammar.atn().getExpectedTokens(grammar.follow().stateNumber(), RuleContext.EMPTY);
    Assert.assertEquals(IntervalSet.of(Grammars.X), expected);
    Assert.assertSame(grammar.atn().nextTokensNoContext(grammar.follow()), expected);
  }

  @Test
  public void emptyRuleContinuesInCaller() {
    final var grammar = Grammars.callsEmptyRule();
    final ATN atn = grammar.atn();

    Assert.assertEquals(IntervalSet.of(Token.EPSILON), atn.nextTokensNoContext(grammar.b()));

    final var ctx = RuleContext.EMPTY.push(grammar.invoking().stateNumber());
    Assert.assertEquals(IntervalSet.of(Grammars.X), atn.getExpectedTokens(grammar.b().stateNumber(), ctx));
  }

  @Test
  public void emptyRuleAtRootExpectsEof() {
    final var grammar = Grammars.callsEmptyRule();
    Assert.assertEquals(
      IntervalSet.of(Token.EOF),
      grammar.atn().getExpectedTokens(grammar.b().stateNumber(), RuleContext.EMPTY)
    );
  }

  @Test
  public void exhaustedCallersAreSkipped() {
    final var grammar = Grammars.nested();
    final ATN atn = grammar.atn();
    final int inB = grammar.b().stateNumber();

    final var fromS = RuleContext.EMPTY
      .push(grammar.callsA().stateNumber())
      .push(grammar.callsB().stateNumber());
    Assert.assertEquals(IntervalSet.of(Grammars.Z), atn.getExpectedTokens(inB, fromS));

    // Without the outermost call, the end of rule a is the end of input
    final var fromA = RuleContext.EMPTY.push(grammar.callsB().stateNumber());
    Assert.assertEquals(IntervalSet.of(Token.EOF), atn.getExpectedTokens(inB, fromA));
  }

  @Test
  public void expectedTokensDoNotAlterCachedSets() {
    final var grammar = Grammars.nested();
    final ATN atn = grammar.atn();
    final var ctx = RuleContext.EMPTY
      .push(grammar.callsA().stateNumber())
      .push(grammar.callsB().stateNumber());

    final IntervalSet expected = atn.getExpectedTokens(grammar.b().stateNumber(), ctx);
    expected.add(Grammars.MAX_TOKEN_TYPE);

    Assert.assertEquals(IntervalSet.of(Token.EPSILON), atn.nextTokensNoContext(grammar.b()));
    Assert.assertEquals(IntervalSet.of(Grammars.Z), atn.getExpectedTokens(grammar.b().stateNumber(), ctx));
  }

  @Test
  public void invalidStateNumbersAreFatal() {
    final ATN atn = Grammars.optionalToken().atn();
    Assert.assertThrows(IllegalArgumentException.class, () -> atn.getExpectedTokens(-1, RuleContext.EMPTY));
    Assert.assertThrows(
      IllegalArgumentException.class,
      () -> atn.getExpectedTokens(atn.getNumberOfStates(), RuleContext.EMPTY)
    );
  }

  @Test
  public void removedStatesAreFatal() {
    final var grammar = Grammars.optionalToken();
    final int afterToken = grammar.afterToken().stateNumber();
    grammar.atn().removeState(afterToken);
    Assert.assertThrows(
      IllegalStateException.class,
      () -> grammar.atn().getExpectedTokens(afterToken, RuleContext.EMPTY)
    );
  }

  @Test
  public void invokingStateMustCallARule() {
    final var grammar = Grammars.callsEmptyRule();
    final var bogus = RuleContext.EMPTY.push(grammar.follow().stateNumber());
    Assert.assertThrows(
      IllegalStateException.class,
      () -> grammar.atn().getExpectedTokens(grammar.b().stateNumber(), bogus)
    );
  }

  @Test
  public void nextTokensDispatchesOnContext() {
    final var grammar = Grammars.callsEmptyRule();
    final ATN atn = grammar.atn();
    final ATNState b = grammar.b();

    final IntervalSet cached = atn.nextTokens(b);
    Assert.assertTrue(cached.isReadOnly());
    Assert.assertSame(cached, atn.nextTokens(b, null));
    Assert.assertSame(cached, atn.nextTokens(b, RuleContext.EMPTY));

    final var ctx = RuleContext.EMPTY.push(grammar.invoking().stateNumber());
    final IntervalSet inContext = atn.nextTokens(b, ctx);
    Assert.assertFalse(inContext.isReadOnly());
    Assert.assertEquals(IntervalSet.of(Grammars.X), inContext);
  }

  @Test
  public void inContextSearchReachesEndOfInput() {
    final var grammar = Grammars.nested();
    final var ctx = RuleContext.EMPTY.push(grammar.callsB().stateNumber());
    Assert.assertEquals(
      IntervalSet.of(Token.EOF),
      grammar.atn().nextTokensInContext(grammar.b(), ctx)
    );
    Assert.assertEquals(
      IntervalSet.of(Token.EPSILON),
      grammar.atn().nextTokensInContext(grammar.b(), null)
    );
  }

  @Test
  public void nextTokensAreDeterministic() {
    final var grammar = Grammars.nested();
    final ATN atn = grammar.atn();
    final var ctx = RuleContext.EMPTY
      .push(grammar.callsA().stateNumber())
      .push(grammar.callsB().stateNumber());

    final IntervalSet first = atn.nextTokens(grammar.b(), ctx);
    for (int i = 0; i < 10; i++) {
      Assert.assertEquals(first, atn.nextTokens(grammar.b(), ctx));
    }
    Assert.assertEquals(IntervalSet.of(Grammars.Z), first);
  }

  @Test
  public void deadEndStateHasNoNextTokens() {
    final var builder = new ATN.Builder(ATNType.PARSER, 3);
    builder.rule(0);
    final BasicState deadEnd = builder.basic(0);
    final ATN atn = builder.build();

    Assert.assertTrue(atn.nextTokensNoContext(deadEnd).isEmpty());
    Assert.assertTrue(atn.getExpectedTokens(deadEnd.stateNumber(), RuleContext.EMPTY).isEmpty());
  }

  /**
   * {@code a : a ;} entered through a long chain of self-calls.
   */
  @Test(timeout = 10_000)
  public void deepContextsUnwindInLinearTime() {
    final var builder = new ATN.Builder(ATNType.PARSER, Grammars.MAX_TOKEN_TYPE);
    final RuleStartState a = builder.rule(0);
    final BasicState invoking = builder.basic(0);
    final BasicState follow = builder.basic(0);
    builder
      .epsilon(a, invoking)
      .ruleCall(invoking, 0, follow)
      .epsilon(follow, a.stopState());
    final ATN atn = builder.build();

    RuleContext ctx = RuleContext.EMPTY;
    for (int i = 0; i < 50_000; i++) {
      ctx = ctx.push(invoking.stateNumber());
    }

    Assert.assertEquals(IntervalSet.of(Token.EOF), atn.nextTokensInContext(follow, ctx));
    Assert.assertEquals(IntervalSet.of(Token.EOF), atn.getExpectedTokens(follow.stateNumber(), ctx));
  }

  @Test
  public void memoizedSetIsComputedOnceUnderContention() throws Exception {
    final var computations = new AtomicInteger();
    final var release = new CountDownLatch(1);
    final var atn = new ATN(ATNType.PARSER, Grammars.MAX_TOKEN_TYPE, a -> new CountingAnalyzer(a, computations, release));
    final var builder = new ATN.Builder(atn);
    final RuleStartState start = builder.rule(0);
    final BasicState afterToken = builder.basic(0);
    builder
      .atom(start, afterToken, Grammars.T)
      .epsilon(afterToken, start.stopState());
    builder.build();

    final int threads = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final var ready = new CountDownLatch(threads);
      final var results = new ArrayList<Future<IntervalSet>>();
      for (int i = 0; i < threads; i++) {
        results.add(executor.submit(() -> {
          ready.countDown();
          return atn.nextTokensNoContext(start);
        }));
      }

      Assert.assertTrue(ready.await(10, TimeUnit.SECONDS));
      release.countDown();

      final List<IntervalSet> sets = new ArrayList<>();
      for (Future<IntervalSet> result : results) {
        sets.add(result.get(10, TimeUnit.SECONDS));
      }

      Assert.assertEquals(1, computations.get());
      for (IntervalSet set : sets) {
        Assert.assertSame(sets.get(0), set);
      }
      Assert.assertTrue(sets.get(0).isReadOnly());
      Assert.assertEquals(IntervalSet.of(Grammars.T), sets.get(0));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void memoizedSetIsNotRecomputed() {
    final var computations = new AtomicInteger();
    final var released = new CountDownLatch(0);
    final var atn = new ATN(ATNType.PARSER, Grammars.MAX_TOKEN_TYPE, a -> new CountingAnalyzer(a, computations, released));
    final var builder = new ATN.Builder(atn);
    final RuleStartState start = builder.rule(0);
    builder.epsilon(start, start.stopState());
    builder.build();

    final IntervalSet first = atn.nextTokensNoContext(start);
    Assert.assertSame(first, atn.nextTokensNoContext(start));
    Assert.assertSame(first, start.nextTokenWithinRule());
    Assert.assertEquals(1, computations.get());
    Assert.assertThrows(IllegalStateException.class, () -> first.add(Grammars.X));
  }

  /**
   * Counts searches, holding each one until released.
   */
  private static final class CountingAnalyzer implements LookaheadAnalyzer {

    private final LL1Analyzer delegate;
    private final AtomicInteger computations;
    private final CountDownLatch release;

    CountingAnalyzer(ATN atn, AtomicInteger computations, CountDownLatch release) {
      this.delegate = new LL1Analyzer(atn);
      this.computations = computations;
      this.release = release;
    }

    @Override
    public IntervalSet look(ATNState s, ATNState stopState, RuleContext ctx) {
      computations.incrementAndGet();
      try {
        release.await(10, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException(e);
      }
      return delegate.look(s, stopState, ctx);
    }
  }
}
