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
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.Settings;
import exm.lgc.common.exceptions.InvalidOptionException;
import exm.lgc.common.exceptions.LGCRuntimeError;
import exm.lgc.common.lang.Var;
import exm.lgc.ir.tree.AstRewriter;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Function;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts.If;
import exm.lgc.ir.tree.Stmts.Repeat;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.Stmts.While;
import exm.lgc.ir.tree.TreeWalk;

/**
 * Loop unswitching: move a loop invariant conditional out of the loop,
 * with a specialized copy of the loop in each branch.
 */
public class LoopUnswitch implements OptimizerPass {

  @Override
  public String getPassName() {
    return "Loop unswitching";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_UNSWITCH;
  }

  @Override
  public Program optimize(Logger logger, Program program,
                          AnalysisResults analyses) {
    long expansion;
    long maxNodes;
    try {
      expansion = Settings.getLong(Settings.OPT_UNSWITCH_EXPANSION);
      maxNodes = Settings.getLong(Settings.OPT_UNSWITCH_MAX_NODES);
    } catch (InvalidOptionException e) {
      throw new LGCRuntimeError(e.getMessage());
    }

    Program result = program;
    for (Function f: program.functions()) {
      if (f.isNative()) {
        continue;
      }
      Unswitcher u = new Unswitcher(logger, analyses, new VarNames(program, f),
                                    expansion, maxNodes);
      Function newF = u.rewrite(f);
      if (u.unswitched > 0) {
        logger.debug("Unswitched " + u.unswitched + " loops in " + f.name());
        result = result.replaceFunction(newF);
      }
    }
    return result;
  }

  private static class Unswitcher extends AstRewriter {
    private final Logger logger;
    private final AnalysisResults analyses;
    private final VarNames names;
    private final long expansion;
    private final long maxNodes;
    int unswitched = 0;

    Unswitcher(Logger logger, AnalysisResults analyses, VarNames names,
               long expansion, long maxNodes) {
      this.logger = logger;
      this.analyses = analyses;
      this.names = names;
      this.expansion = expansion;
      this.maxNodes = maxNodes;
    }

    @Override
    public List<Stmt> visitWhile(While s) {
      If branch = findInvariantIf(s, s.body);
      if (branch == null) {
        return super.visitWhile(s);
      }
      Block thenBody = rewrite(splice(s.body, branch, branch.thenBlock));
      Block elseBody = rewrite(splice(s.body, branch, branch.elseBlock));
      Map<Var, Var> renames = names.renameDeclared(elseBody);
      While thenLoop = new While(rewrite(s.cond), thenBody,
                                 rewriteDecreasing(s));
      Stmt elseLoop = new Renamer(renames).rewrite(
          new While(rewrite(s.cond), elseBody, rewriteDecreasing(s))).get(0);
      return checkBudget(s, branch, thenLoop, elseLoop);
    }

    @Override
    public List<Stmt> visitRepeat(Repeat s) {
      If branch = findInvariantIf(s, s.body);
      if (branch == null) {
        return super.visitRepeat(s);
      }
      Block thenBody = rewrite(splice(s.body, branch, branch.thenBlock));
      Block elseBody = rewrite(splice(s.body, branch, branch.elseBlock));
      Repeat thenLoop = new Repeat(s.var, rewrite(s.iterable), thenBody);
      Repeat elseLoop = new Repeat(s.var, rewrite(s.iterable), elseBody);
      // Loop variable is declared by the loop, so renamed with the body
      Map<Var, Var> renames = names.renameDeclared(Block.of(elseLoop));
      Stmt renamedElse = new Renamer(renames).rewrite(elseLoop).get(0);
      return checkBudget(s, branch, thenLoop, renamedElse);
    }

    private Expr rewriteDecreasing(While s) {
      return s.decreasing == null ? null : rewrite(s.decreasing);
    }

    /**
     * @return first top level conditional of the body that can be moved
     *         out of the loop, or null
     */
    private If findInvariantIf(Stmt loop, Block body) {
      LoopInvariance inv = new LoopInvariance(analyses, loop);
      if (inv.loopHasSecurityCheck() || TreeWalk.containsCheck(body)) {
        // Never duplicate security checks
        return null;
      }
      for (Stmt s: body) {
        if (s instanceof If) {
          If branch = (If)s;
          if (inv.isInvariant(branch.cond)) {
            // Now evaluated even if the loop doesn't run
            if (!inv.mayFault(branch.cond)) {
              return branch;
            }
            analyses.report(Diagnostic.Kind.UNSOUND_HOIST_REJECTED,
                "unswitching condition may fault: " + branch.cond);
          }
        }
      }
      return null;
    }

    /**
     * Apply the size limits to the unswitched result, falling back to
     * a plain copy of the loop if it's too large
     */
    private List<Stmt> checkBudget(Stmt loop, If branch, Stmt thenLoop,
                                   Stmt elseLoop) {
      If result = new If(rewrite(branch.cond), Block.of(thenLoop),
                         Block.of(elseLoop));
      int origSize = TreeWalk.countNodes(Block.of(loop));
      int bodySize = TreeWalk.countNodes(loop.blocks().get(0));
      int newSize = TreeWalk.countNodes(Block.of(result));
      if (bodySize > maxNodes || newSize > expansion * origSize) {
        logger.debug("Not unswitching loop: size " + origSize + " would " +
                     "become " + newSize);
        return copyLoop(loop);
      }
      unswitched++;
      if (logger.isTraceEnabled()) {
        logger.trace("Unswitched on " + branch.cond);
      }
      return ImmutableList.<Stmt>of(result);
    }

    private List<Stmt> copyLoop(Stmt loop) {
      if (loop instanceof While) {
        return super.visitWhile((While)loop);
      } else {
        return super.visitRepeat((Repeat)loop);
      }
    }
  }

  /**
   * @return body with the conditional replaced by the statements of one
   *         of its branches
   */
  static Block splice(Block body, Stmt branch, Block replacement) {
    List<Stmt> stmts = new ArrayList<Stmt>(body.size() +
                                           replacement.size());
    for (Stmt s: body) {
      if (s == branch) {
        stmts.addAll(replacement.statements());
      } else {
        stmts.add(s);
      }
    }
    return new Block(stmts);
  }
}
