package exm.lgc.ir.effects;

import static exm.lgc.ir.tree.AstBuilder.INT_LIST;
import static exm.lgc.ir.tree.AstBuilder.callStmt;
import static exm.lgc.ir.tree.AstBuilder.check;
import static exm.lgc.ir.tree.AstBuilder.fn;
import static exm.lgc.ir.tree.AstBuilder.id;
import static exm.lgc.ir.tree.AstBuilder.ifThen;
import static exm.lgc.ir.tree.AstBuilder.intVar;
import static exm.lgc.ir.tree.AstBuilder.let;
import static exm.lgc.ir.tree.AstBuilder.list;
import static exm.lgc.ir.tree.AstBuilder.listVar;
import static exm.lgc.ir.tree.AstBuilder.lit;
import static exm.lgc.ir.tree.AstBuilder.loop;
import static exm.lgc.ir.tree.AstBuilder.lt;
import static exm.lgc.ir.tree.AstBuilder.main;
import static exm.lgc.ir.tree.AstBuilder.program;
import static exm.lgc.ir.tree.AstBuilder.push;
import static exm.lgc.ir.tree.AstBuilder.set;
import static exm.lgc.ir.tree.AstBuilder.show;
import static exm.lgc.ir.tree.AstBuilder.sub;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.Logging;
import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.ir.callgraph.CallGraph;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Function;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts;
import exm.lgc.ir.tree.Stmts.CallStmt;
import exm.lgc.ir.tree.Stmts.IncreaseCrdt;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.Stmts.While;

public class EffectAnalyzerTest {

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("EffectAnalyzerTest.lgc.log", true);
  }

  private static EffectAnalyzer analyzer(int maxIterations, int threads) {
    return new EffectAnalyzer(logger, new TypeOwnership(), maxIterations,
                              threads);
  }

  private static EffectEnv analyze(Program p) {
    return analyzer(100, 1).analyzeProgram(p, CallGraph.build(p));
  }

  private static Function proc(String name, List<Var> params,
                               Stmt ...body) {
    return fn(name, params, Types.NOTHING, body);
  }

  private static boolean hasDiagnostic(EffectEnv env, Diagnostic.Kind kind) {
    for (Diagnostic d: env.diagnostics()) {
      if (d.kind == kind) {
        return true;
      }
    }
    return false;
  }

  @Test
  public void testAssignment() {
    Var x = intVar("x");
    Var y = intVar("y");
    Stmt assign = set(y, id(x));
    Program p = program(main(let(x, lit(1)), let(y, lit(0)), assign));
    EffectEnv env = analyze(p);
    EffectSet e = analyzer(100, 1).classifyStmt(assign, env);
    assertEquals(EffectSet.read(x).join(EffectSet.write(y)), e);
    assertEquals(EffectKind.WRITE, e.kind());
  }

  @Test
  public void testLocalsProjectedOut() {
    Var t = intVar("t");
    Program p = program(main(let(t, lit(1)), set(t, lit(2))));
    assertEquals(EffectSet.PURE, analyze(p).get("main"));
  }

  @Test
  public void testSecurityCheckPropagates() {
    Var user = Var.param("user", Types.TEXT);
    Var u = Var.param("u", Types.TEXT);
    CallStmt guarded = callStmt("guard", id(u));
    Program p = program(
        proc("guard", Arrays.asList(user), check(user, "admin")),
        proc("caller", Arrays.asList(u), guarded));
    EffectEnv env = analyze(p);
    EffectSet guard = env.get("guard");
    assertTrue(guard.hasSecurityCheck());
    assertTrue(guard.reads().contains(user));
    assertEquals(EffectKind.SECURITY_CHECK, guard.kind());

    EffectSet site = analyzer(100, 1).classifyStmt(guarded, env);
    assertTrue(site.hasSecurityCheck());
    assertTrue("Parameter read maps to the argument",
               site.reads().contains(u));
    assertTrue(env.get("caller").hasSecurityCheck());
  }

  @Test
  public void testParameterWriteMapsToArgument() {
    Var p = Var.param("p", INT_LIST);
    Var xs = listVar("xs");
    CallStmt site = callStmt("append", id(xs));
    Program prog = program(
        proc("append", Arrays.asList(p), push(lit(1), id(p))),
        main(let(xs, list(1, 2)), site));
    EffectEnv env = analyze(prog);
    assertTrue(env.get("append").writes().contains(p));
    EffectSet e = analyzer(100, 1).classifyStmt(site, env);
    assertTrue(e.mayWrite(xs));
    assertFalse(e.isUnknown());
  }

  @Test
  public void testEscapeIsUnknown() {
    Program p = program(
        proc("raw", Collections.<Var>emptyList(),
             new Stmts.Escape("c", "abort();")),
        main(callStmt("raw")));
    EffectEnv env = analyze(p);
    assertTrue(env.get("raw").isUnknown());
    assertTrue("Callers inherit unknown", env.get("main").isUnknown());
    assertTrue(hasDiagnostic(env, Diagnostic.Kind.ANALYSIS_INCOMPLETE));
    assertFalse("Warned once already",
        Logging.addEmitted(Level.WARN,
                           "Effects approximated as unknown: embedded c block"));
  }

  @Test
  public void testNativeIsUnknown() {
    Function ext = new Function("ext", Collections.<Var>emptyList(),
                                Types.INT, Block.EMPTY, true);
    EffectEnv env = analyze(program(ext, main(callStmt("ext"))));
    assertEquals(EffectSet.UNKNOWN, env.get("ext"));
    assertTrue(env.get("main").isUnknown());
    assertTrue(hasDiagnostic(env, Diagnostic.Kind.ANALYSIS_INCOMPLETE));
  }

  @Test
  public void testUnknownCallee() {
    EffectEnv env = analyze(program(main(callStmt("nowhere"))));
    assertTrue(env.get("main").isUnknown());
    assertTrue(hasDiagnostic(env, Diagnostic.Kind.ANALYSIS_INCOMPLETE));
  }

  @Test
  public void testRecursionMayDiverge() {
    Var n = Var.param("n", Types.INT);
    Program p = program(proc("countdown", Arrays.asList(n),
        ifThen(lt(lit(0), id(n)), callStmt("countdown", sub(id(n), lit(1))))));
    EffectSet e = analyze(p).get("countdown");
    assertTrue(e.mayDiverge());
    assertEquals(EffectKind.DIVERGE, e.kind());
    assertTrue(e.reads().contains(n));
  }

  @Test
  public void testLoopWithoutMeasureMayDiverge() {
    Var i = intVar("i");
    While open = loop(lt(id(i), lit(10)), set(i, lit(1)));
    While measured = new While(lt(id(i), lit(10)),
                               Block.of(set(i, lit(1))), sub(lit(10), id(i)));
    Program p = program(main(let(i, lit(0)), open),
                        fn("other", Collections.<Var>emptyList(),
                           Types.NOTHING, let(i, lit(0)), measured));
    EffectEnv env = analyze(p);
    assertTrue(env.get("main").mayDiverge());
    assertFalse(env.get("other").mayDiverge());
  }

  @Test
  public void testGive() {
    Var items = Var.param("items", INT_LIST);
    Var count = Var.param("count", Types.INT);
    Var xs = listVar("xs");
    Var n = intVar("n");
    Stmt giveList = new Stmts.Give(id(xs), "takeList");
    Stmt giveInt = new Stmts.Give(id(n), "takeInt");
    Program p = program(
        proc("takeList", Arrays.asList(items)),
        proc("takeInt", Arrays.asList(count)),
        main(let(xs, list(1)), let(n, lit(3)), giveList, giveInt));
    EffectAnalyzer a = analyzer(100, 1);
    EffectEnv env = a.analyzeProgram(p, CallGraph.build(p));

    EffectSet moved = a.classifyStmt(giveList, env);
    assertTrue(moved.consumes().contains(xs));
    assertEquals(EffectKind.CONSUME, moved.kind());

    EffectSet copied = a.classifyStmt(giveInt, env);
    assertTrue(copied.consumes().isEmpty());
    assertEquals(EffectSet.read(n), copied);
  }

  @Test
  public void testCrdtUpdateCommutes() {
    Var hits = Var.global("hits", Types.struct("Counter"));
    Stmt inc = new IncreaseCrdt(id(hits), "count", lit(1));
    Program p = program(Arrays.asList(hits),
        proc("record", Collections.<Var>emptyList(), inc));
    EffectSet e = analyze(p).get("record");
    assertTrue(e.writes().contains(hits));
    assertTrue(e.commutativeWrites().contains(hits));
  }

  @Test
  public void testGlobalWriteVisible() {
    Var g = Var.global("g", Types.INT);
    Program p = program(Arrays.asList(g),
        proc("setg", Collections.<Var>emptyList(), set(g, lit(1))),
        main(callStmt("setg"), show(id(g))));
    EffectEnv env = analyze(p);
    assertEquals(EffectSet.write(g), env.get("setg"));
    EffectSet m = env.get("main");
    assertTrue(m.writes().contains(g));
    assertTrue(m.reads().contains(g));
    assertTrue(m.hasIO());
  }

  @Test
  public void testIterationCap() {
    Var g = Var.global("g", Types.INT);
    Program p = program(Arrays.asList(g),
        proc("setg", Collections.<Var>emptyList(), set(g, lit(1))));
    EffectEnv env = analyzer(1, 1).analyzeProgram(p, CallGraph.build(p));
    assertTrue(env.get("setg").isUnknown());
    assertTrue(hasDiagnostic(env, Diagnostic.Kind.ITERATION_CAP));
  }

  @Test
  public void testParallelMatchesSequential() {
    Var g = Var.global("g", Types.INT);
    Var n = Var.param("n", Types.INT);
    Program p = program(Arrays.asList(g),
        proc("leaf1", Collections.<Var>emptyList(), set(g, lit(1))),
        proc("leaf2", Collections.<Var>emptyList(), show(lit(2))),
        proc("rec", Arrays.asList(n),
             ifThen(lt(lit(0), id(n)), callStmt("rec", sub(id(n), lit(1))),
                    callStmt("leaf1"))),
        proc("mid", Collections.<Var>emptyList(), callStmt("leaf2"),
             callStmt("rec", lit(3))),
        main(callStmt("mid"), callStmt("leaf1")));
    CallGraph cg = CallGraph.build(p);
    EffectEnv seq = analyzer(100, 1).analyzeProgram(p, cg);
    EffectEnv par = analyzer(100, 4).analyzeProgram(p, cg);
    assertEquals(seq, par);
    for (Function f: p.functions()) {
      assertEquals(f.name(), seq.get(f.name()), par.get(f.name()));
    }
  }

  @Test
  public void testIdempotent() {
    Var g = Var.global("g", Types.INT);
    Program p = program(Arrays.asList(g),
        proc("setg", Collections.<Var>emptyList(), set(g, lit(1))),
        main(callStmt("setg"), show(id(g))));
    assertEquals(analyze(p), analyze(p));
    assertTrue(analyze(p).isFrozen());
  }
}
