package exm.lgc.ir.ranges;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class IntervalTest {

  private static final long MAX = Long.MAX_VALUE - 1;

  @Test
  public void testArithmetic() {
    Interval a = Interval.of(1, 3);
    Interval b = Interval.of(-2, 5);
    assertEquals(Interval.of(-1, 8), a.add(b));
    assertEquals(Interval.of(-4, 5), a.sub(b));
    assertEquals("Cross products", Interval.of(-6, 15), a.mul(b));
    assertEquals(Interval.of(-5, 2), b.negate());
  }

  @Test
  public void testDivisionByPossibleZero() {
    Interval num = Interval.of(10, 20);
    assertTrue(num.div(Interval.of(-1, 1)).isTop());
    assertTrue(num.div(Interval.constant(0)).isTop());
    assertTrue(num.mod(Interval.of(0, 3)).isTop());
    assertEquals(Interval.of(5, 10), num.div(Interval.constant(2)));
    assertEquals(Interval.of(-20, -5), num.div(Interval.of(-2, -1)));
  }

  @Test
  public void testModulo() {
    assertEquals(Interval.of(0, 2), Interval.of(0, 100).mod(
                                                  Interval.constant(3)));
    assertEquals(Interval.of(-2, 0), Interval.of(-100, -1).mod(
                                                  Interval.constant(3)));
    assertEquals(Interval.of(0, 1), Interval.of(0, 1).mod(
                                                  Interval.constant(7)));
  }

  @Test
  public void testOverflowGoesToTop() {
    Interval big = Interval.constant(MAX);
    assertTrue("Sum past the representable range",
               big.add(Interval.constant(2)).isTop());
    assertTrue("Product past the representable range",
               big.mul(Interval.constant(3)).isTop());
    assertEquals(Interval.constant(MAX - 1),
                 big.add(Interval.constant(-1)));
  }

  @Test
  public void testUnboundedOperands() {
    Interval up = Interval.atLeast(0);
    assertEquals(Interval.atLeast(1), up.add(Interval.constant(1)));
    assertTrue(up.mul(Interval.constant(2)).isTop());
    assertEquals(Interval.constant(0), up.mul(Interval.constant(0)));
  }

  @Test
  public void testJoinMeet() {
    Interval a = Interval.of(0, 5);
    Interval b = Interval.of(3, 9);
    assertEquals(Interval.of(0, 9), a.join(b));
    assertEquals(Interval.of(3, 5), a.meet(b));
    assertTrue(a.meet(Interval.of(6, 7)).isBottom());
    assertEquals(a, a.join(Interval.BOTTOM));
    assertEquals(a, Interval.BOTTOM.join(a));
  }

  @Test
  public void testWidenOnlyGrowingBounds() {
    Interval prev = Interval.of(0, 1);
    assertEquals(Interval.atLeast(0), prev.widen(Interval.of(0, 2)));
    assertEquals(Interval.atMost(1), prev.widen(Interval.of(-1, 1)));
    assertEquals("No growth, no change", prev,
                 prev.widen(Interval.of(0, 1)));
  }

  @Test
  public void testNarrowKeepsFiniteBounds() {
    Interval widened = Interval.atLeast(0);
    assertEquals(Interval.of(0, 10), widened.narrow(Interval.of(-5, 10)));
    Interval finite = Interval.of(0, 10);
    assertEquals("Finite bounds are never replaced", finite,
                 finite.narrow(Interval.of(2, 3)));
  }

  @Test
  public void testWithin() {
    assertTrue(Interval.of(1, 2).within(Interval.of(0, 3)));
    assertFalse(Interval.of(1, 4).within(Interval.of(0, 3)));
    assertTrue(Interval.BOTTOM.within(Interval.constant(0)));
  }
}
