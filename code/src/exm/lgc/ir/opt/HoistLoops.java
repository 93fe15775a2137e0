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
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.Settings;
import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.common.util.TernaryLogic.Ternary;
import exm.lgc.ir.effects.EffectKind;
import exm.lgc.ir.tree.AstRewriter;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Exprs.Identifier;
import exm.lgc.ir.tree.Exprs.Length;
import exm.lgc.ir.tree.Exprs.Literal;
import exm.lgc.ir.tree.Exprs.OptionNone;
import exm.lgc.ir.tree.Function;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts.Let;
import exm.lgc.ir.tree.Stmts.Repeat;
import exm.lgc.ir.tree.Stmts.Return;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.Stmts.While;
import exm.lgc.ir.tree.TreeWalk;

/**
 * Loop invariant code motion: compute invariant expressions once, in a
 * temporary bound just before the loop.
 *
 * An expression that can't fault is hoisted from anywhere in the loop.
 * One that may fault is only hoisted if the loop is known to run at least
 * once, and the expression would be evaluated on the first iteration
 * before anything observable happens.
 */
public class HoistLoops implements OptimizerPass {

  @Override
  public String getPassName() {
    return "Hoist loop invariants";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_HOIST;
  }

  @Override
  public Program optimize(Logger logger, Program program,
                          AnalysisResults analyses) {
    Program result = program;
    for (Function f: program.functions()) {
      if (f.isNative()) {
        continue;
      }
      Hoister hoister = new Hoister(logger, analyses,
                                    new VarNames(program, f));
      Function newF = hoister.rewrite(f);
      if (hoister.hoisted > 0) {
        logger.debug("Hoisted " + hoister.hoisted + " expressions from " +
                     "loops in " + f.name());
        result = result.replaceFunction(newF);
      }
    }
    return result;
  }

  private static class Hoister extends AstRewriter {
    private final Logger logger;
    private final AnalysisResults analyses;
    private final VarNames names;

    /** Hoisted expressions to the temporaries that replace them */
    private final Map<Expr, Var> replacements =
                            new IdentityHashMap<Expr, Var>();
    int hoisted = 0;

    Hoister(Logger logger, AnalysisResults analyses, VarNames names) {
      this.logger = logger;
      this.analyses = analyses;
      this.names = names;
    }

    @Override
    public Expr rewrite(Expr e) {
      Var temp = replacements.get(e);
      if (temp != null) {
        return new Identifier(temp);
      }
      return super.rewrite(e);
    }

    @Override
    public List<Stmt> visitWhile(While s) {
      LoopInvariance inv = new LoopInvariance(analyses, s);
      List<Expr> found = new ArrayList<Expr>();
      // Condition is evaluated every iteration: only non-faulting parts
      collect(s.cond, inv, false, found);
      collectBody(s, s.cond, s.body, inv, found);
      List<Stmt> res = hoist(found);
      res.addAll(super.visitWhile(s));
      return res;
    }

    @Override
    public List<Stmt> visitRepeat(Repeat s) {
      // Iterable is evaluated once anyway
      LoopInvariance inv = new LoopInvariance(analyses, s);
      List<Expr> found = new ArrayList<Expr>();
      collectBody(s, s.iterable, s.body, inv, found);
      List<Stmt> res = hoist(found);
      res.addAll(super.visitRepeat(s));
      return res;
    }

    private void collectBody(Stmt loop, Expr header, Block body,
                     LoopInvariance inv, List<Expr> found) {
      boolean prefix = faultingHoistAllowed(loop, header, inv);
      for (Stmt stmt: body) {
        collectStmt(stmt, inv, prefix, found);
        if (prefix && isBarrier(stmt)) {
          prefix = false;
        }
      }
    }

    private void collectStmt(Stmt stmt, LoopInvariance inv, boolean prefix,
                             List<Expr> found) {
      boolean allowFault = prefix && operandsBeforeIO(stmt);
      for (Expr e: stmt.exprs()) {
        collect(e, inv, allowFault, found);
      }
      for (Block b: stmt.blocks()) {
        for (Stmt nested: b) {
          collectStmt(nested, inv, false, found);
        }
      }
    }

    /**
     * Find maximal candidates in an expression tree
     * @param allowFault if a candidate that may fault can be hoisted
     */
    private void collect(Expr e, LoopInvariance inv, boolean allowFault,
                         List<Expr> found) {
      if (replacements.containsKey(e)) {
        // Already hoisted out of an enclosing loop
        return;
      }
      if (isCandidate(e) && inv.isInvariant(e)) {
        if (allowFault || !inv.mayFault(e)) {
          found.add(e);
          return;
        }
        analyses.report(Diagnostic.Kind.UNSOUND_HOIST_REJECTED,
            "may fault if loop doesn't run: " + e);
      }
      boolean first = true;
      for (Expr child: e.children()) {
        boolean childFault = allowFault &&
                          (first || !LoopInvariance.isShortCircuit(e));
        collect(child, inv, childFault, found);
        first = false;
      }
    }

    private List<Stmt> hoist(List<Expr> found) {
      List<Stmt> lets = new ArrayList<Stmt>();
      for (Expr e: found) {
        Var temp = names.freshTemp("licm_", e.type());
        // Visit directly: rewrite(e) would replace e with temp
        Expr value = e.accept(this);
        replacements.put(e, temp);
        lets.add(new Let(temp, value));
        hoisted++;
        if (logger.isTraceEnabled()) {
          logger.trace("Hoisting " + e + " as " + temp);
        }
      }
      return lets;
    }

    /**
     * Whether the first iteration certainly reaches the body
     * without faulting or doing anything observable first
     */
    private boolean faultingHoistAllowed(Stmt loop, Expr header,
                                         LoopInvariance inv) {
      if (analyses.ranges().runsAtLeastOnce(loop) != Ternary.TRUE) {
        return false;
      }
      if (analyses.effectOf(header).kind().isAtLeast(EffectKind.IO)) {
        return false;
      }
      return !inv.mayFault(header);
    }

    private boolean operandsBeforeIO(Stmt stmt) {
      for (Expr e: stmt.targets()) {
        if (analyses.effectOf(e).kind().isAtLeast(EffectKind.IO)) {
          return false;
        }
      }
      for (Expr e: stmt.exprs()) {
        if (analyses.effectOf(e).kind().isAtLeast(EffectKind.IO)) {
          return false;
        }
      }
      return true;
    }

    /**
     * @return true if later statements of the iteration might not run,
     *         or something observable happened
     */
    private boolean isBarrier(Stmt stmt) {
      return stmt instanceof Return ||
             TreeWalk.containsReturn(Block.of(stmt)) ||
             analyses.effectOf(stmt).kind().isAtLeast(EffectKind.IO);
    }
  }

  /**
   * Trivial expressions aren't worth a temporary.  Only copy types are
   * hoisted, since binding a move-only value would transfer ownership.
   */
  private static boolean isCandidate(Expr e) {
    if (e instanceof Literal || e instanceof Identifier ||
        e instanceof OptionNone) {
      return false;
    }
    if (e instanceof Length &&
        ((Length)e).collection instanceof Identifier) {
      // Kept in place so range facts about the loop bound survive
      return false;
    }
    return Types.isCopy(e.type());
  }
}
