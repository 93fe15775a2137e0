package exm.lgc.ir.opt;

import static exm.lgc.ir.opt.OptTesting.assertSameBehavior;
import static exm.lgc.ir.opt.OptTesting.hasDiagnostic;
import static exm.lgc.ir.opt.OptTesting.letsWithPrefix;
import static exm.lgc.ir.opt.OptTesting.runPass;
import static exm.lgc.ir.tree.AstBuilder.INT_LIST;
import static exm.lgc.ir.tree.AstBuilder.INT_MAP;
import static exm.lgc.ir.tree.AstBuilder.add;
import static exm.lgc.ir.tree.AstBuilder.call;
import static exm.lgc.ir.tree.AstBuilder.div;
import static exm.lgc.ir.tree.AstBuilder.escape;
import static exm.lgc.ir.tree.AstBuilder.fn;
import static exm.lgc.ir.tree.AstBuilder.id;
import static exm.lgc.ir.tree.AstBuilder.idx;
import static exm.lgc.ir.tree.AstBuilder.ifThen;
import static exm.lgc.ir.tree.AstBuilder.intVar;
import static exm.lgc.ir.tree.AstBuilder.le;
import static exm.lgc.ir.tree.AstBuilder.len;
import static exm.lgc.ir.tree.AstBuilder.let;
import static exm.lgc.ir.tree.AstBuilder.list;
import static exm.lgc.ir.tree.AstBuilder.listVar;
import static exm.lgc.ir.tree.AstBuilder.lit;
import static exm.lgc.ir.tree.AstBuilder.loop;
import static exm.lgc.ir.tree.AstBuilder.lt;
import static exm.lgc.ir.tree.AstBuilder.main;
import static exm.lgc.ir.tree.AstBuilder.mul;
import static exm.lgc.ir.tree.AstBuilder.program;
import static exm.lgc.ir.tree.AstBuilder.range;
import static exm.lgc.ir.tree.AstBuilder.repeat;
import static exm.lgc.ir.tree.AstBuilder.ret;
import static exm.lgc.ir.tree.AstBuilder.set;
import static exm.lgc.ir.tree.AstBuilder.show;
import static exm.lgc.ir.tree.ReferenceInterpreter.mapValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.Logging;
import exm.lgc.common.Settings;
import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Exprs.BinaryOp;
import exm.lgc.ir.tree.Exprs.Identifier;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.ReferenceInterpreter;
import exm.lgc.ir.tree.Stmts;
import exm.lgc.ir.tree.Stmts.Let;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.Stmts.While;

public class HoistLoopsTest {

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("HoistLoopsTest.lgc.log", true);
  }

  @Test
  public void testNothingInvariant() {
    Var i = intVar("i");
    Var j = intVar("j");
    Var coll = listVar("coll");
    Program p = program(main(let(i, lit(0)), let(coll, list(10, 20, 30)),
        loop(lt(id(i), len(id(coll))),
             let(j, mul(id(i), id(i))),
             set(i, add(id(i), lit(1))))));
    Program result = runPass(new HoistLoops(), logger, p);
    assertSame(p, result);
    assertTrue(letsWithPrefix(result.lookupFunction("main").body(), "licm_")
                                                               .isEmpty());
  }

  @Test
  public void testHoistProduct() {
    Var a = intVar("a");
    Var b = intVar("b");
    Var i = intVar("i");
    Var s = intVar("s");
    Program p = program(main(let(a, lit(3)), let(b, lit(4)),
        let(i, lit(0)), let(s, lit(0)),
        loop(lt(id(i), lit(10)),
             set(s, add(id(s), mul(id(a), id(b)))),
             set(i, add(id(i), lit(1)))),
        show(id(s))));
    Program result = runPass(new HoistLoops(), logger, p);

    Block body = result.lookupFunction("main").body();
    List<Let> temps = letsWithPrefix(body, "licm_");
    assertEquals(1, temps.size());
    Let temp = temps.get(0);
    assertSame("Bound just before the loop", temp, body.get(4));
    assertEquals(Types.INT, temp.var.type());
    While w = (While)body.get(5);
    BinaryOp sum = (BinaryOp)((Stmts.Set)w.body.get(0)).value;
    assertEquals(temp.var, ((Identifier)sum.right).var);
    assertSameBehavior(p, result, "main");
  }

  @Test
  public void testHoistFromRepeat() {
    Var a = intVar("a");
    Var k = intVar("k");
    Var s = intVar("s");
    Program p = program(main(let(a, lit(7)), let(s, lit(0)),
        repeat(k, range(lit(1), lit(5)),
               set(s, add(id(s), mul(id(a), id(a))))),
        show(id(s))));
    Program result = runPass(new HoistLoops(), logger, p);
    assertEquals(1, letsWithPrefix(result.lookupFunction("main").body(),
                                   "licm_").size());
    assertSameBehavior(p, result, "main");
  }

  private static Program divideInLoop(Var n, Var d, boolean boundedByN,
                                      boolean showFirst) {
    Var i = intVar("i");
    Var s = intVar("s");
    List<Stmt> body = new ArrayList<Stmt>();
    if (showFirst) {
      body.add(show(id(i)));
    }
    body.add(set(s, add(id(s), div(lit(100), id(d)))));
    body.add(set(i, add(id(i), lit(1))));
    While w = new While(lt(id(i), boundedByN ? id(n) : lit(10)),
                        new Block(body), null);
    return program(fn("f", Arrays.asList(n, d), Types.INT,
        let(s, lit(0)), let(i, lit(0)), w, ret(id(s))));
  }

  @Test
  public void testFaultingCandidateInZeroTripLoop() {
    Var n = Var.param("n", Types.INT);
    Var d = Var.param("d", Types.INT);
    Program p = divideInLoop(n, d, true, false);
    List<Diagnostic> diags = new ArrayList<Diagnostic>();
    Program result = runPass(new HoistLoops(), logger, p, diags);

    assertSame(p, result);
    assertTrue(hasDiagnostic(diags,
                             Diagnostic.Kind.UNSOUND_HOIST_REJECTED));
    // Loop doesn't run, so the division by zero never happens
    assertSameBehavior(p, result, "f", 0L, 0L);
  }

  @Test
  public void testFaultingCandidateInLoopThatRuns() {
    Var n = Var.param("n", Types.INT);
    Var d = Var.param("d", Types.INT);
    Program p = divideInLoop(n, d, false, false);
    Program result = runPass(new HoistLoops(), logger, p);

    assertEquals(1, letsWithPrefix(result.lookupFunction("f").body(),
                                   "licm_").size());
    assertSameBehavior(p, result, "f", 0L, 5L);
    assertSameBehavior(p, result, "f", 0L, 0L);
    assertTrue(ReferenceInterpreter.run(result, "f", 0L, 0L).faulted());
  }

  @Test
  public void testFaultingCandidateAfterOutput() {
    Var n = Var.param("n", Types.INT);
    Var d = Var.param("d", Types.INT);
    Program p = divideInLoop(n, d, false, true);
    List<Diagnostic> diags = new ArrayList<Diagnostic>();
    Program result = runPass(new HoistLoops(), logger, p, diags);

    assertTrue("Hoisting would fault before the first show",
               letsWithPrefix(result.lookupFunction("f").body(), "licm_")
                                                              .isEmpty());
    assertTrue(hasDiagnostic(diags,
                             Diagnostic.Kind.UNSOUND_HOIST_REJECTED));
    assertSameBehavior(p, result, "f", 0L, 0L);
  }

  /**
   * A map with at least five entries can still miss key 3, so the lookup
   * has to stay behind the loop condition
   */
  @Test
  public void testMapLookupInLoopThatMayNotRun() {
    Var m = Var.param("m", INT_MAP);
    Var n = Var.param("n", Types.INT);
    Var i = intVar("i");
    Program p = program(fn("f", Arrays.asList(m, n), Types.NOTHING,
        let(i, lit(0)),
        ifThen(le(lit(5), len(id(m))),
          loop(lt(id(i), id(n)),
               show(lit(7)),
               show(add(idx(id(m), lit(3)), lit(1))),
               set(i, add(id(i), lit(1)))))));
    List<Diagnostic> diags = new ArrayList<Diagnostic>();
    Program result = runPass(new HoistLoops(), logger, p, diags);

    assertTrue(letsWithPrefix(result.lookupFunction("f").body(), "licm_")
                                                               .isEmpty());
    assertTrue(hasDiagnostic(diags,
                             Diagnostic.Kind.UNSOUND_HOIST_REJECTED));
    Map<Object, Object> noKey3 = mapValue(1, 1, 2, 2, 4, 4, 5, 5, 6, 6);
    assertSameBehavior(p, result, "f", noKey3, 0L);
    assertSameBehavior(p, result, "f", noKey3, 2L);
    assertTrue(ReferenceInterpreter.run(p, "f", noKey3, 2L).faulted());
  }

  @Test
  public void testListIndexInLoopThatMayNotRun() {
    Var xs = Var.param("xs", INT_LIST);
    Var n = Var.param("n", Types.INT);
    Var i = intVar("i");
    Program p = program(fn("f", Arrays.asList(xs, n), Types.NOTHING,
        let(i, lit(0)),
        ifThen(le(lit(5), len(id(xs))),
          loop(lt(id(i), id(n)),
               show(lit(7)),
               show(add(idx(id(xs), lit(3)), lit(1))),
               set(i, add(id(i), lit(1)))))));
    Program result = runPass(new HoistLoops(), logger, p);

    assertEquals("Position 3 exists in a list of five",
        1, letsWithPrefix(result.lookupFunction("f").body(), "licm_").size());
    List<Object> five = ReferenceInterpreter.listValue(1, 2, 3, 4, 5);
    assertSameBehavior(p, result, "f", five, 0L);
    assertSameBehavior(p, result, "f", five, 2L);
  }

  /**
   * x may come from foreign code returning 99, so c[x] can't move above a
   * loop that may not run
   */
  @Test
  public void testIndexFromForeignResult() {
    Var b = Var.param("b", Types.BOOL);
    Var n = Var.param("n", Types.INT);
    Var c = listVar("c");
    Var x = intVar("x");
    Var i = intVar("i");
    Var s = intVar("s");
    Program p = program(
        fn("g", Collections.<Var>emptyList(), Types.INT,
           escape("return 99;")),
        fn("f", Arrays.asList(b, n), Types.NOTHING,
           let(c, list(10, 20, 30)), let(x, lit(1)),
           ifThen(id(b), set(x, call("g", Types.INT))),
           let(i, lit(0)), let(s, lit(0)),
           loop(lt(id(i), id(n)),
                set(s, add(id(s), idx(id(c), id(x)))),
                set(i, add(id(i), lit(1)))),
           show(id(s))));
    List<Diagnostic> diags = new ArrayList<Diagnostic>();
    Program result = runPass(new HoistLoops(), logger, p, diags);

    assertTrue(letsWithPrefix(result.lookupFunction("f").body(), "licm_")
                                                               .isEmpty());
    assertTrue(hasDiagnostic(diags,
                             Diagnostic.Kind.UNSOUND_HOIST_REJECTED));
    assertSameBehavior(p, result, "f", true, 0L);
    assertSameBehavior(p, result, "f", false, 3L);
    assertTrue(ReferenceInterpreter.run(p, "f", true, 1L).faulted());
  }

  @Test
  public void testDisabled() throws Exception {
    Settings.set(Settings.OPT_HOIST, "false");
    try {
      OptimizerPipeline pipe = new OptimizerPipeline(null, null, null,
                                                     false);
      assertFalse(pipe.passEnabled(new HoistLoops()));
    } finally {
      Settings.reset(Settings.OPT_HOIST);
    }
  }
}
