/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.lgc.ir.opt;

import java.util.ArrayList;
import java.util.List;

import exm.lgc.common.exceptions.SecurityCheckViolation;
import exm.lgc.ir.effects.EffectEnv;
import exm.lgc.ir.effects.EffectSet;
import exm.lgc.ir.tree.Exprs.Call;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Function;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts;
import exm.lgc.ir.tree.Stmts.CallStmt;
import exm.lgc.ir.tree.Stmts.Check;
import exm.lgc.ir.tree.Stmts.LaunchTask;
import exm.lgc.ir.tree.Stmts.LaunchTaskWithHandle;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.TreeWalk;
import exm.lgc.ir.tree.TreeWalk.TreeWalker;

/**
 * Verify that a pass kept every security check, in the same order.
 * A difference is a bug in the pass, never a recoverable condition.
 */
public class SecurityCheckGuard {

  /**
   * @throws SecurityCheckViolation if checks differ between the programs
   */
  public static void verify(String passName, AnalysisResults analyses,
                            Program before, Program after) {
    List<String> expected = securityTrace(before, analyses.effects());
    List<String> actual = securityTrace(after, analyses.effects());
    if (!expected.equals(actual)) {
      throw new SecurityCheckViolation(passName, "security checks changed: " +
                 "expected " + expected + " but got " + actual);
    }
  }

  /**
   * Ordered list of security checks: guard statements, and calls into
   * functions that perform checks
   */
  public static List<String> securityTrace(Program program,
                                           final EffectEnv effects) {
    final List<String> trace = new ArrayList<String>();
    for (final Function f: program.functions()) {
      TreeWalk.walk(f.body(), new TreeWalker() {
        @Override
        protected void visit(Stmt stmt) {
          if (stmt instanceof Check) {
            trace.add(f.name() + ": " + stmt);
          } else if (stmt instanceof CallStmt) {
            checkCall(((CallStmt)stmt).function);
          } else if (stmt instanceof LaunchTask) {
            checkCall(((LaunchTask)stmt).function);
          } else if (stmt instanceof LaunchTaskWithHandle) {
            checkCall(((LaunchTaskWithHandle)stmt).function);
          } else if (stmt instanceof Stmts.Give) {
            checkCall(((Stmts.Give)stmt).recipient);
          }
        }

        @Override
        protected void visit(Expr expr) {
          if (expr instanceof Call) {
            checkCall(((Call)expr).function);
          }
        }

        private void checkCall(String callee) {
          EffectSet summary = effects.get(callee);
          if (summary != null && summary.hasSecurityCheck()) {
            trace.add(f.name() + ": call " + callee);
          }
        }
      }, true);
    }
    return trace;
  }
}
