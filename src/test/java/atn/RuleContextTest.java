package atn;

import org.junit.Assert;
import org.junit.Test;

public class RuleContextTest {

  @Test
  public void pushLeavesParentUntouched() {
    final RuleContext outer = RuleContext.EMPTY.push(4);
    final RuleContext inner = outer.push(9);

    Assert.assertSame(outer, inner.parent());
    Assert.assertSame(RuleContext.EMPTY, outer.parent());
    Assert.assertEquals(9, inner.invokingState());
    Assert.assertEquals(4, outer.invokingState());
    Assert.assertEquals(2, inner.depth());
    Assert.assertEquals(1, outer.depth());
    Assert.assertEquals(0, RuleContext.EMPTY.depth());
  }

  @Test
  public void sharedParentsCanBeExtendedIndependently() {
    final RuleContext common = RuleContext.EMPTY.push(1);
    final RuleContext left = common.push(2);
    final RuleContext right = common.push(3);

    Assert.assertSame(left.parent(), right.parent());
    Assert.assertEquals("[2 1]", left.toString());
    Assert.assertEquals("[3 1]", right.toString());
  }

  @Test
  public void rootIsEmpty() {
    Assert.assertTrue(RuleContext.EMPTY.isEmpty());
    Assert.assertFalse(RuleContext.EMPTY.push(0).isEmpty());
    Assert.assertEquals("[]", RuleContext.EMPTY.toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void rootMustNotHaveInvokingState() {
    new RuleContext(null, 5);
  }
}
