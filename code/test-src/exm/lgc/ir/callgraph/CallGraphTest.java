package exm.lgc.ir.callgraph;

import static exm.lgc.ir.tree.AstBuilder.callStmt;
import static exm.lgc.ir.tree.AstBuilder.fn;
import static exm.lgc.ir.tree.AstBuilder.main;
import static exm.lgc.ir.tree.AstBuilder.program;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Function;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts.Stmt;

public class CallGraphTest {

  private static Function proc(String name, Stmt ...body) {
    return fn(name, Collections.<Var>emptyList(), Types.NOTHING, body);
  }

  /**
   * main -> a -> b <-> c, main -> b, d -> d, e -> missing
   */
  private static Program sample() {
    return program(
        main(callStmt("a"), callStmt("b")),
        proc("a", callStmt("b")),
        proc("b", callStmt("c")),
        proc("c", callStmt("b")),
        proc("d", callStmt("d")),
        proc("e", callStmt("missing")));
  }

  @Test
  public void testLeavesFirst() {
    CallGraph cg = CallGraph.build(sample());
    List<List<String>> sccs = cg.sccs();
    assertEquals(5, sccs.size());
    assertEquals(new HashSet<String>(Arrays.asList("b", "c")),
                 new HashSet<String>(sccs.get(cg.sccOf("b"))));
    assertTrue(cg.sameScc("b", "c"));
    assertTrue(cg.sccOf("b") < cg.sccOf("a"));
    assertTrue(cg.sccOf("a") < cg.sccOf("main"));

    List<Set<Integer>> deps = cg.sccDependencies();
    for (int i = 0; i < deps.size(); i++) {
      for (int dep: deps.get(i)) {
        assertTrue("SCC " + i + " depends on later SCC " + dep, dep < i);
      }
    }
  }

  @Test
  public void testRecursion() {
    CallGraph cg = CallGraph.build(sample());
    assertTrue(cg.isRecursive("b"));
    assertTrue(cg.isRecursive("c"));
    assertTrue("Self call", cg.isRecursive("d"));
    assertFalse(cg.isRecursive("a"));
    assertFalse(cg.isRecursive("main"));
  }

  @Test
  public void testUnknownCallee() {
    CallGraph cg = CallGraph.build(sample());
    assertTrue(cg.callees("e").contains("missing"));
    assertFalse(cg.isKnown("missing"));
    assertEquals(-1, cg.sccOf("missing"));
    assertTrue(cg.reachableFrom("e").isEmpty());
  }

  @Test
  public void testReachable() {
    CallGraph cg = CallGraph.build(sample());
    assertEquals(new HashSet<String>(Arrays.asList("a", "b", "c")),
                 cg.reachableFrom("main"));
    assertTrue("Reaches itself through c", cg.reachableFrom("b")
                                             .contains("b"));
  }

  @Test
  public void testNative() {
    Function ext = new Function("ext", Collections.<Var>emptyList(),
                                Types.INT, Block.EMPTY, true);
    CallGraph cg = CallGraph.build(program(main(callStmt("ext")), ext));
    assertTrue(cg.isNative("ext"));
    assertTrue(cg.isKnown("ext"));
    assertTrue(cg.callees("ext").isEmpty());
    assertTrue(cg.sccOf("ext") < cg.sccOf("main"));
  }

  /**
   * f0 -> f1 -> ... -> f(n-1), optionally closed into a ring
   */
  private static Program chain(int n, boolean ring) {
    List<Function> fns = new ArrayList<Function>(n);
    for (int i = 0; i < n - 1; i++) {
      fns.add(proc("f" + i, callStmt("f" + (i + 1))));
    }
    fns.add(ring ? proc("f" + (n - 1), callStmt("f0")) : proc("f" + (n - 1)));
    return new Program(Collections.<Var>emptyList(), fns);
  }

  @Test
  public void testLongChain() {
    int n = 100000;
    CallGraph cg = CallGraph.build(chain(n, false));
    assertEquals(n, cg.sccs().size());
    assertEquals(Arrays.asList("f" + (n - 1)), cg.sccs().get(0));
    assertEquals(Arrays.asList("f0"), cg.sccs().get(n - 1));
    assertFalse(cg.isRecursive("f0"));
  }

  @Test
  public void testLongRing() {
    int n = 100000;
    CallGraph cg = CallGraph.build(chain(n, true));
    assertEquals(1, cg.sccs().size());
    assertEquals(n, cg.sccs().get(0).size());
    assertEquals("f0", cg.sccs().get(0).get(0));
    assertTrue(cg.isRecursive("f" + (n / 2)));
  }
}
