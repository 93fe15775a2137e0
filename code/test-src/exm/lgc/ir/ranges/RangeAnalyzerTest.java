package exm.lgc.ir.ranges;

import static exm.lgc.ir.tree.AstBuilder.INT_LIST;
import static exm.lgc.ir.tree.AstBuilder.INT_MAP;
import static exm.lgc.ir.tree.AstBuilder.add;
import static exm.lgc.ir.tree.AstBuilder.and;
import static exm.lgc.ir.tree.AstBuilder.block;
import static exm.lgc.ir.tree.AstBuilder.call;
import static exm.lgc.ir.tree.AstBuilder.div;
import static exm.lgc.ir.tree.AstBuilder.escape;
import static exm.lgc.ir.tree.AstBuilder.fn;
import static exm.lgc.ir.tree.AstBuilder.id;
import static exm.lgc.ir.tree.AstBuilder.idx;
import static exm.lgc.ir.tree.AstBuilder.ifElse;
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
import static exm.lgc.ir.tree.AstBuilder.mapVar;
import static exm.lgc.ir.tree.AstBuilder.mul;
import static exm.lgc.ir.tree.AstBuilder.newMap;
import static exm.lgc.ir.tree.AstBuilder.program;
import static exm.lgc.ir.tree.AstBuilder.range;
import static exm.lgc.ir.tree.AstBuilder.repeat;
import static exm.lgc.ir.tree.AstBuilder.ret;
import static exm.lgc.ir.tree.AstBuilder.set;
import static exm.lgc.ir.tree.AstBuilder.setIndex;
import static exm.lgc.ir.tree.AstBuilder.show;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.Logging;
import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.common.util.TernaryLogic.Ternary;
import exm.lgc.ir.callgraph.CallGraph;
import exm.lgc.ir.effects.EffectAnalyzer;
import exm.lgc.ir.effects.EffectEnv;
import exm.lgc.ir.effects.TypeOwnership;
import exm.lgc.ir.tree.Exprs.Index;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts.Let;
import exm.lgc.ir.tree.Stmts.Repeat;
import exm.lgc.ir.tree.Stmts.SetIndex;
import exm.lgc.ir.tree.Stmts.Show;
import exm.lgc.ir.tree.Stmts.While;

public class RangeAnalyzerTest {

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("RangeAnalyzerTest.lgc.log", true);
  }

  private static RangeResults analyze(Program p, int maxIterations) {
    EffectAnalyzer effects = new EffectAnalyzer(logger, new TypeOwnership(),
                                                100, 1);
    CallGraph cg = CallGraph.build(p);
    EffectEnv env = effects.analyzeProgram(p, cg);
    RangeAnalyzer ranges = new RangeAnalyzer(logger, effects, 2,
                                             maxIterations, 1);
    return ranges.analyzeProgram(p, cg, env);
  }

  private static RangeResults analyze(Program p) {
    return analyze(p, 64);
  }

  /**
   * i = 0; coll = [10, 20, 30]; while i < length(coll) { j = i * i; i++ }
   */
  @Test
  public void testCountingLoop() {
    Var i = intVar("i");
    Var j = intVar("j");
    Var coll = listVar("coll");
    Let letJ = let(j, mul(id(i), id(i)));
    Show after = show(id(i));
    While w = loop(lt(id(i), len(id(coll))),
                   letJ,
                   set(i, add(id(i), lit(1))));
    Program p = program(main(let(i, lit(0)), let(coll, list(10, 20, 30)),
                             w, after));
    RangeResults r = analyze(p);

    assertEquals(Interval.of(0, 2), r.intervalBefore(letJ, i));
    assertEquals(Interval.of(0, 4), r.intervalBefore(w.body.get(1), j));
    assertEquals("Loop exits once i reaches the length",
                 Interval.constant(3), r.intervalBefore(after, i));
    assertEquals(Ternary.TRUE, r.runsAtLeastOnce(w));
  }

  @Test
  public void testAccessProvenByInterval() {
    Var i = intVar("i");
    Var coll = listVar("coll");
    Index access = idx(id(coll), id(i));
    Index beyond = idx(id(coll), add(id(i), lit(1)));
    Program p = program(main(let(i, lit(1)), let(coll, list(10, 20, 30)),
        loop(le(id(i), len(id(coll))),
             show(access),
             show(beyond),
             set(i, add(id(i), lit(1))))));
    RangeResults r = analyze(p);

    assertTrue(r.isProvenSafe(access));
    assertFalse("i + 1 reaches 4 on the last iteration",
                r.isProvenSafe(beyond));
  }

  @Test
  public void testAccessProvenByLengthFact() {
    Var xs = Var.param("xs", Types.listOf(Types.INT));
    Var i = intVar("i");
    Index access = idx(id(xs), id(i));
    Program p = program(fn("sum", Arrays.asList(xs), Types.NOTHING,
        let(i, lit(1)),
        loop(le(id(i), len(id(xs))),
             show(access),
             set(i, add(id(i), lit(1))))));
    RangeResults r = analyze(p);

    ProvenBound b = r.boundOf(access);
    assertTrue(b.isSafe());
    assertTrue("Length of xs is unknown, needs the relational fact",
               b.byFact);
  }

  @Test
  public void testFactKilledByWrite() {
    Var xs = Var.param("xs", Types.listOf(Types.INT));
    Var i = intVar("i");
    Index access = idx(id(xs), id(i));
    Program p = program(fn("sum", Arrays.asList(xs), Types.NOTHING,
        let(i, lit(1)),
        loop(le(id(i), len(id(xs))),
             set(i, add(id(i), lit(1))),
             show(access))));
    RangeResults r = analyze(p);
    assertFalse(r.isProvenSafe(access));
  }

  @Test
  public void testUnboundedLoopWidens() {
    Var b = Var.param("b", Types.BOOL);
    Var i = intVar("i");
    Show after = show(id(i));
    Program p = program(fn("count", Arrays.asList(b), Types.NOTHING,
        let(i, lit(0)),
        loop(id(b), set(i, add(id(i), lit(1)))),
        after));
    RangeResults r = analyze(p);
    assertEquals(Interval.atLeast(0), r.intervalBefore(after, i));
  }

  @Test
  public void testDivisionByRangeContainingZero() {
    Var b = Var.param("b", Types.BOOL);
    Var y = intVar("y");
    Var z = intVar("z");
    Var w = intVar("w");
    Show end = show(id(z));
    Program p = program(fn("f", Arrays.asList(b), Types.NOTHING,
        let(y, lit(0)),
        ifElse(id(b), block(set(y, lit(1))), block(set(y, lit(-1)))),
        let(z, div(lit(10), id(y))),
        let(w, div(lit(10), lit(5))),
        end));
    RangeResults r = analyze(p);
    assertEquals(Interval.of(-1, 1), r.intervalBefore(end, y));
    assertTrue(r.intervalBefore(end, z).isTop());
    assertEquals(Interval.constant(2), r.intervalBefore(end, w));
  }

  @Test
  public void testOverflowGivesTop() {
    Var a = intVar("a");
    Var c = intVar("c");
    Show end = show(id(c));
    Program p = program(main(let(a, lit(Long.MAX_VALUE - 1)),
                             let(c, add(id(a), lit(2))),
                             end));
    RangeResults r = analyze(p);
    assertTrue(r.intervalBefore(end, c).isTop());
  }

  @Test
  public void testRepeatOverRange() {
    Var k = intVar("k");
    Var n = Var.param("n", Types.INT);
    Show inner = show(id(k));
    Repeat fixed = repeat(k, range(lit(1), lit(10)), inner);
    Repeat open = repeat(k, range(lit(1), id(n)), show(id(k)));
    Program p = program(fn("f", Arrays.asList(n), Types.NOTHING,
                           fixed, open));
    RangeResults r = analyze(p);
    assertEquals(Interval.of(1, 10), r.intervalBefore(inner, k));
    assertEquals(Ternary.TRUE, r.runsAtLeastOnce(fixed));
    assertEquals(Ternary.MAYBE, r.runsAtLeastOnce(open));
  }

  @Test
  public void testZeroTripWhile() {
    Var i = intVar("i");
    While w = loop(lt(id(i), lit(0)), set(i, add(id(i), lit(1))));
    Program p = program(main(let(i, lit(5)), w));
    RangeResults r = analyze(p);
    assertEquals(Ternary.FALSE, r.runsAtLeastOnce(w));
    assertFalse("Body is unreachable", r.isReachable(w.body.get(0)));
  }

  @Test
  public void testReturnIntervalAtCallSite() {
    Var x = intVar("x");
    Show end = show(id(x));
    Program p = program(
        fn("three", Collections.<Var>emptyList(), Types.INT, ret(lit(3))),
        main(let(x, call("three", Types.INT)), end));
    RangeResults r = analyze(p);
    assertEquals(Interval.constant(3), r.returnInterval("three"));
    assertEquals(Interval.constant(3), r.intervalBefore(end, x));
  }

  @Test
  public void testIterationCap() {
    Var b = Var.param("b", Types.BOOL);
    Var i = intVar("i");
    Show after = show(id(i));
    Program p = program(fn("count", Arrays.asList(b), Types.NOTHING,
        let(i, lit(0)),
        loop(id(b), set(i, add(id(i), lit(1)))),
        after));
    RangeResults r = analyze(p, 1);
    assertTrue(r.intervalBefore(after, i).isTop());
    assertEquals(1, r.diagnostics().size());
    assertEquals(Diagnostic.Kind.ITERATION_CAP, r.diagnostics().get(0).kind);
  }

  @Test
  public void testMapLookupNeverProven() {
    Var m = Var.param("m", INT_MAP);
    Var xs = Var.param("xs", INT_LIST);
    Index lookup = idx(id(m), lit(3));
    Index positional = idx(id(xs), lit(3));
    SetIndex store = setIndex(id(m), lit(3), lit(1));
    Show first = show(lookup);
    Program p = program(fn("f", Arrays.asList(m, xs), Types.NOTHING,
        ifThen(and(le(lit(5), len(id(m))), le(lit(5), len(id(xs)))),
               first, show(positional), store)));
    RangeResults r = analyze(p);

    assertEquals("Length is still tracked", Interval.atLeast(5),
                 r.stateBefore(first).lengthOf(m));
    assertFalse("Key 3 may be missing whatever the size",
                r.isProvenSafe(lookup));
    assertFalse(r.boundOf(store).isSafe());
    assertTrue(r.isProvenSafe(positional));
  }

  @Test
  public void testNewMapIsEmpty() {
    Var m = mapVar("m");
    Show end = show(len(id(m)));
    Program p = program(main(let(m, newMap()), end));
    assertEquals(Interval.constant(0),
                 analyze(p).stateBefore(end).lengthOf(m));
  }

  /**
   * g(): Int is foreign code returning 99, so c[x] can't be proven after
   * x = g() on one branch
   */
  @Test
  public void testForeignReturnIsUnbounded() {
    Var b = Var.param("b", Types.BOOL);
    Var c = listVar("c");
    Var x = intVar("x");
    Index access = idx(id(c), id(x));
    Program p = program(
        fn("g", Collections.<Var>emptyList(), Types.INT,
           escape("return 99;")),
        fn("f", Arrays.asList(b), Types.NOTHING,
           let(c, list(10, 20, 30)), let(x, lit(1)),
           ifThen(id(b), set(x, call("g", Types.INT))),
           show(access)));
    RangeResults r = analyze(p);

    assertTrue(r.returnInterval("g").isTop());
    assertFalse(r.isProvenSafe(access));
  }

  @Test
  public void testForeignBlockOnOneBranch() {
    Var b = Var.param("b", Types.BOOL);
    Program p = program(fn("h", Arrays.asList(b), Types.INT,
        ifThen(id(b), escape("return 99;")),
        ret(lit(1))));
    assertTrue(analyze(p).returnInterval("h").isTop());
  }

  @Test
  public void testConditionBefore() {
    Var i = intVar("i");
    Var n = Var.param("n", Types.INT);
    Show end = show(id(i));
    Program p = program(fn("f", Arrays.asList(n), Types.NOTHING,
                           let(i, lit(5)), end));
    RangeResults r = analyze(p);

    assertEquals(Ternary.TRUE, r.conditionBefore(end, lt(id(i), lit(10))));
    assertEquals(Ternary.FALSE, r.conditionBefore(end, lt(id(i), lit(3))));
    assertEquals(Ternary.MAYBE, r.conditionBefore(end, lt(id(i), id(n))));
    assertNull("Not part of the analyzed program",
               r.stateBefore(show(lit(0))));
  }

  @Test
  public void testIdempotent() {
    Var i = intVar("i");
    Var coll = listVar("coll");
    Program p = program(main(let(i, lit(1)), let(coll, list(1, 2)),
        loop(le(id(i), len(id(coll))),
             show(idx(id(coll), id(i))),
             set(i, add(id(i), lit(1))))));
    assertTrue(analyze(p).sameAs(analyze(p)));
  }
}
