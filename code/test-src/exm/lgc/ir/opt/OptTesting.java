package exm.lgc.ir.opt;

import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.lgc.common.Diagnostic;
import exm.lgc.ir.effects.EffectAnalyzer;
import exm.lgc.ir.effects.TypeOwnership;
import exm.lgc.ir.ranges.RangeAnalyzer;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.ReferenceInterpreter;
import exm.lgc.ir.tree.ReferenceInterpreter.Outcome;
import exm.lgc.ir.tree.Stmts.Let;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.TreeWalk;
import exm.lgc.ir.tree.TreeWalk.TreeWalker;

/**
 * Helpers for running single passes in tests
 */
public class OptTesting {

  public static AnalysisResults analyze(Logger logger, Program program,
                                        List<Diagnostic> diagnostics) {
    EffectAnalyzer effects = new EffectAnalyzer(logger, new TypeOwnership(),
                                                100, 1);
    RangeAnalyzer ranges = new RangeAnalyzer(logger, effects, 2, 64, 1);
    return AnalysisResults.derive(logger, program, effects, ranges,
                                  diagnostics);
  }

  /**
   * Run one pass, checking that no security check was lost
   */
  public static Program runPass(OptimizerPass pass, Logger logger,
                    Program program, List<Diagnostic> diagnostics) {
    AnalysisResults analyses = analyze(logger, program, diagnostics);
    Program result = pass.optimize(logger, program, analyses);
    SecurityCheckGuard.verify(pass.getPassName(), analyses, program, result);
    return result;
  }

  public static Program runPass(OptimizerPass pass, Logger logger,
                                Program program) {
    return runPass(pass, logger, program, new ArrayList<Diagnostic>());
  }

  public static boolean hasDiagnostic(List<Diagnostic> diagnostics,
                                      Diagnostic.Kind kind) {
    for (Diagnostic d: diagnostics) {
      if (d.kind == kind) {
        return true;
      }
    }
    return false;
  }

  /**
   * All let statements binding a name with the prefix, at any depth
   */
  public static List<Let> letsWithPrefix(Block body, final String prefix) {
    final List<Let> res = new ArrayList<Let>();
    TreeWalk.walk(body, new TreeWalker() {
      @Override
      protected void visit(Stmt stmt) {
        if (stmt instanceof Let &&
            ((Let)stmt).var.name().startsWith(prefix)) {
          res.add((Let)stmt);
        }
      }
    }, true);
    return res;
  }

  public static void assertSameBehavior(Program before, Program after,
                                        String function, Object ...args) {
    Outcome expected = ReferenceInterpreter.run(before, function, args);
    Outcome actual = ReferenceInterpreter.run(after, function, args);
    assertTrue("Expected " + expected + " but got " + actual,
               expected.sameBehavior(actual));
  }
}
