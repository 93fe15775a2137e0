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

import exm.lgc.common.Settings;
import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.common.util.TernaryLogic.Ternary;
import exm.lgc.ir.ranges.Interval;
import exm.lgc.ir.tree.AstRewriter;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Exprs.BinOp;
import exm.lgc.ir.tree.Exprs.BinaryOp;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Exprs.Identifier;
import exm.lgc.ir.tree.Exprs.Literal;
import exm.lgc.ir.tree.Exprs.Range;
import exm.lgc.ir.tree.Function;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts.If;
import exm.lgc.ir.tree.Stmts.Let;
import exm.lgc.ir.tree.Stmts.Repeat;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.TreeWalk;

/**
 * Loop peeling: where the body of a loop over a range tests whether it's
 * on the first or last iteration, run that iteration separately so the
 * remaining loop has no test.
 */
public class LoopPeel implements OptimizerPass {

  @Override
  public String getPassName() {
    return "Loop peeling";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_PEEL;
  }

  @Override
  public Program optimize(Logger logger, Program program,
                          AnalysisResults analyses) {
    Program result = program;
    for (Function f: program.functions()) {
      if (f.isNative()) {
        continue;
      }
      Peeler peeler = new Peeler(logger, analyses, new VarNames(program, f));
      Function newF = peeler.rewrite(f);
      if (peeler.peeled > 0) {
        logger.debug("Peeled " + peeler.peeled + " loops in " + f.name());
        result = result.replaceFunction(newF);
      }
    }
    return result;
  }

  private static class Peeler extends AstRewriter {
    private final Logger logger;
    private final AnalysisResults analyses;
    private final VarNames names;
    int peeled = 0;

    Peeler(Logger logger, AnalysisResults analyses, VarNames names) {
      this.logger = logger;
      this.analyses = analyses;
      this.names = names;
    }

    @Override
    public List<Stmt> visitRepeat(Repeat s) {
      if (!(s.iterable instanceof Range) || !canPeel(s)) {
        return super.visitRepeat(s);
      }
      Range range = (Range)s.iterable;
      Interval start = analyses.ranges().intervalOf(s, range.start);
      Interval end = analyses.ranges().intervalOf(s, range.end);
      for (Stmt stmt: s.body) {
        if (!(stmt instanceof If)) {
          continue;
        }
        If branch = (If)stmt;
        // First value + 1 and last value - 1 mustn't wrap around
        if (start.hi < Interval.POS_INF &&
            testsBound(branch.cond, s.var, range.start)) {
          return peelFirst(s, range, branch);
        }
        if (end.lo > Interval.NEG_INF &&
            testsBound(branch.cond, s.var, range.end)) {
          return peelLast(s, range, branch);
        }
      }
      return super.visitRepeat(s);
    }

    private boolean canPeel(Repeat s) {
      Range range = (Range)s.iterable;
      LoopInvariance inv = new LoopInvariance(analyses, s);
      if (inv.loopHasSecurityCheck() || TreeWalk.containsCheck(s.body)) {
        return false;
      }
      // Bounds are evaluated at different points after peeling
      if (!inv.isInvariant(range.start) || !inv.isInvariant(range.end) ||
          inv.mayFault(range.start) || inv.mayFault(range.end)) {
        return false;
      }
      if (analyses.effectOf(s.body).mayWrite(s.var)) {
        return false;
      }
      return analyses.ranges().runsAtLeastOnce(s) == Ternary.TRUE;
    }

    private List<Stmt> peelFirst(Repeat s, Range range, If branch) {
      Var first = names.freshTemp("peel_", Types.INT);
      List<Stmt> res = new ArrayList<Stmt>();
      res.add(new Let(first, rewrite(range.start)));
      res.addAll(peeledIteration(s, branch, first).statements());
      Expr rest = BinaryOp.create(BinOp.ADD, new Identifier(first),
                                  Literal.intLit(1));
      res.add(new Repeat(s.var, new Range(rest, rewrite(range.end)),
              rewrite(LoopUnswitch.splice(s.body, branch, branch.elseBlock))));
      peeled++;
      logger.trace("Peeled first iteration of loop over " + s.var);
      return res;
    }

    private List<Stmt> peelLast(Repeat s, Range range, If branch) {
      Var last = names.freshTemp("peel_", Types.INT);
      List<Stmt> res = new ArrayList<Stmt>();
      res.add(new Let(last, rewrite(range.end)));
      Expr rest = BinaryOp.create(BinOp.SUB, new Identifier(last),
                                  Literal.intLit(1));
      res.add(new Repeat(s.var, new Range(rewrite(range.start), rest),
              rewrite(LoopUnswitch.splice(s.body, branch, branch.elseBlock))));
      res.addAll(peeledIteration(s, branch, last).statements());
      peeled++;
      logger.trace("Peeled last iteration of loop over " + s.var);
      return res;
    }

    /**
     * Body of one iteration with the test taken, and the loop variable
     * replaced by the binding holding its value
     */
    private Block peeledIteration(Repeat s, If branch, Var value) {
      Block body = rewrite(LoopUnswitch.splice(s.body, branch,
                                               branch.thenBlock));
      Map<Var, Var> renames = names.renameDeclared(body);
      renames.put(s.var, value);
      return new Renamer(renames).rewrite(body);
    }
  }

  /**
   * @return true if cond is var == bound, with bound a literal or binding
   */
  private static boolean testsBound(Expr cond, Var var, Expr bound) {
    if (!(cond instanceof BinaryOp) || ((BinaryOp)cond).op != BinOp.EQ) {
      return false;
    }
    BinaryOp eq = (BinaryOp)cond;
    return (isVar(eq.left, var) && sameBound(eq.right, bound)) ||
           (isVar(eq.right, var) && sameBound(eq.left, bound));
  }

  private static boolean isVar(Expr e, Var var) {
    return e instanceof Identifier && ((Identifier)e).var.equals(var);
  }

  private static boolean sameBound(Expr e, Expr bound) {
    if (e instanceof Literal && bound instanceof Literal) {
      Literal a = (Literal)e;
      Literal b = (Literal)bound;
      return a.isInt() && b.isInt() && a.intValue() == b.intValue();
    } else if (e instanceof Identifier && bound instanceof Identifier) {
      return ((Identifier)e).var.equals(((Identifier)bound).var);
    }
    return false;
  }
}
