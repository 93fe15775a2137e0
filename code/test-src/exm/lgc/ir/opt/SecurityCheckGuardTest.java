package exm.lgc.ir.opt;

import static exm.lgc.ir.tree.AstBuilder.boolVar;
import static exm.lgc.ir.tree.AstBuilder.callStmt;
import static exm.lgc.ir.tree.AstBuilder.check;
import static exm.lgc.ir.tree.AstBuilder.fn;
import static exm.lgc.ir.tree.AstBuilder.id;
import static exm.lgc.ir.tree.AstBuilder.ifThen;
import static exm.lgc.ir.tree.AstBuilder.let;
import static exm.lgc.ir.tree.AstBuilder.lit;
import static exm.lgc.ir.tree.AstBuilder.main;
import static exm.lgc.ir.tree.AstBuilder.program;
import static exm.lgc.ir.tree.AstBuilder.show;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.Logging;
import exm.lgc.common.Settings;
import exm.lgc.common.exceptions.SecurityCheckViolation;
import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts.Check;
import exm.lgc.ir.tree.TreeWalk;

public class SecurityCheckGuardTest {

  private static Logger logger;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("SecurityCheckGuardTest.lgc.log", true);
  }

  private static final Var OK = boolVar("ok");

  private static Check admin() {
    return check(OK, "admin");
  }

  private static Check owner() {
    return check(OK, "owner");
  }

  @Test
  public void testUnreachableCheckSurvivesPipeline() throws Exception {
    Program p = program(main(let(OK, lit(true)),
                             ifThen(lit(false), admin()),
                             show(lit(1))));
    Settings.set(Settings.COMPILER_DEBUG, "true");
    try {
      List<Diagnostic> diags = new ArrayList<Diagnostic>();
      Program result = CoreOptimizer.optimize(logger, null, p, diags);
      assertEquals(1, TreeWalk.findChecks(result).size());
    } finally {
      Settings.reset(Settings.COMPILER_DEBUG);
    }
  }

  @Test
  public void testUnchanged() {
    Program p = program(main(let(OK, lit(true)), admin(), owner()));
    AnalysisResults a = OptTesting.analyze(logger, p,
                                           new ArrayList<Diagnostic>());
    SecurityCheckGuard.verify("identity", a, p, p);
  }

  @Test
  public void testRemovedCheck() {
    Program before = program(main(let(OK, lit(true)), admin(),
                                  show(lit(1))));
    Program after = program(main(let(OK, lit(true)), show(lit(1))));
    AnalysisResults a = OptTesting.analyze(logger, before,
                                           new ArrayList<Diagnostic>());
    exception.expect(SecurityCheckViolation.class);
    SecurityCheckGuard.verify("broken", a, before, after);
  }

  @Test
  public void testReorderedChecks() {
    Program before = program(main(let(OK, lit(true)), admin(), owner()));
    Program after = program(main(let(OK, lit(true)), owner(), admin()));
    AnalysisResults a = OptTesting.analyze(logger, before,
                                           new ArrayList<Diagnostic>());
    exception.expect(SecurityCheckViolation.class);
    SecurityCheckGuard.verify("broken", a, before, after);
  }

  @Test
  public void testRemovedCallToCheckingFunction() {
    Var user = Var.param("user", Types.BOOL);
    Program before = program(
        fn("guard", Arrays.asList(user), Types.NOTHING, check(user, "admin")),
        main(let(OK, lit(true)), callStmt("guard", id(OK)), show(lit(1))));
    Program after = program(
        fn("guard", Arrays.asList(user), Types.NOTHING, check(user, "admin")),
        main(let(OK, lit(true)), show(lit(1))));
    AnalysisResults a = OptTesting.analyze(logger, before,
                                           new ArrayList<Diagnostic>());
    List<String> trace = SecurityCheckGuard.securityTrace(before,
                                                          a.effects());
    assertEquals(2, trace.size());
    assertTrue(trace.contains("main: call guard"));
    exception.expect(SecurityCheckViolation.class);
    SecurityCheckGuard.verify("broken", a, before, after);
  }

  @Test
  public void testPureCallsNotTraced() {
    Program p = program(
        fn("helper", Collections.<Var>emptyList(), Types.NOTHING,
           show(lit(2))),
        main(callStmt("helper")));
    AnalysisResults a = OptTesting.analyze(logger, p,
                                           new ArrayList<Diagnostic>());
    assertTrue(SecurityCheckGuard.securityTrace(p, a.effects()).isEmpty());
  }
}
