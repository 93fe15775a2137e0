package exm.lgc.ir.ranges;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ProvenBoundTest {

  @Test
  public void testInRange() {
    assertTrue(ProvenBound.check(Interval.of(1, 3), Interval.of(3, 10), 1)
                          .isSafe());
  }

  @Test
  public void testLowerBoundEdges() {
    assertTrue(ProvenBound.check(Interval.of(1, 1), Interval.constant(1), 1)
                          .isSafe());
    assertFalse("One below minimum index",
        ProvenBound.check(Interval.of(0, 1), Interval.constant(5), 1)
                   .isSafe());
    assertFalse(ProvenBound.check(Interval.atMost(3), Interval.constant(5), 1)
                           .isSafe());
  }

  @Test
  public void testUpperBoundUsesMinimumLength() {
    assertTrue(ProvenBound.check(Interval.of(1, 4), Interval.of(4, 9), 1)
                          .isSafe());
    assertFalse("One past the guaranteed length",
        ProvenBound.check(Interval.of(1, 5), Interval.of(4, 9), 1).isSafe());
    assertFalse("Upper bound of length isn't guaranteed",
        ProvenBound.check(Interval.of(1, 9), Interval.of(4, 9), 1).isSafe());
    assertFalse(ProvenBound.check(Interval.atLeast(1),
                                  Interval.NON_NEGATIVE, 1).isSafe());
  }

  @Test
  public void testRelationalFact() {
    ProvenBound b = ProvenBound.check(Interval.atLeast(1),
                                      Interval.NON_NEGATIVE, 1, true);
    assertTrue(b.isSafe());
    assertTrue(b.byFact);
    assertFalse("Fact doesn't help the lower bound",
        ProvenBound.check(Interval.atLeast(0), Interval.NON_NEGATIVE, 1, true)
                   .isSafe());
  }

  @Test
  public void testUnreachableIsNotSafe() {
    assertFalse(ProvenBound.check(Interval.BOTTOM, Interval.constant(3), 1)
                           .isSafe());
    assertFalse(ProvenBound.unresolved().isSafe());
  }

  @Test
  public void testMinIndexZero() {
    assertTrue(ProvenBound.check(Interval.of(0, 2), Interval.constant(3), 0)
                          .isSafe());
    assertFalse(ProvenBound.check(Interval.of(0, 3), Interval.constant(3), 0)
                           .isSafe());
  }
}
