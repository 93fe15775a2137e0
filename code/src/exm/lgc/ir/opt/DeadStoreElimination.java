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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.lgc.common.Settings;
import exm.lgc.common.lang.Var;
import exm.lgc.ir.effects.EffectKind;
import exm.lgc.ir.effects.EffectSet;
import exm.lgc.ir.opt.Liveness.LiveSet;
import exm.lgc.ir.tree.AstRewriter;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Exprs.Closure;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Function;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts;
import exm.lgc.ir.tree.Stmts.Return;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.TreeWalk;

/**
 * Remove reassignments that are overwritten before anything reads them.
 * Candidates are checked against liveness before removal.
 */
public class DeadStoreElimination implements OptimizerPass {

  @Override
  public String getPassName() {
    return "Dead store elimination";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_DEAD_STORE_ELIM;
  }

  @Override
  public Program optimize(Logger logger, Program program,
                          AnalysisResults analyses) {
    Program result = program;
    for (Function f: program.functions()) {
      if (f.isNative()) {
        continue;
      }
      StoreEliminator elim = new StoreEliminator(logger, analyses, f.body());
      Function newF = elim.rewrite(f);
      if (elim.removed > 0) {
        logger.debug("Removed " + elim.removed + " dead stores from " +
                     f.name());
        result = result.replaceFunction(newF);
      }
    }
    return result;
  }

  private static class StoreEliminator extends AstRewriter {
    private final Logger logger;
    private final AnalysisResults analyses;
    private final Block functionBody;
    /** Depth of closure bodies we're in */
    private int closureDepth = 0;
    int removed = 0;

    StoreEliminator(Logger logger, AnalysisResults analyses,
                    Block functionBody) {
      this.logger = logger;
      this.analyses = analyses;
      this.functionBody = functionBody;
    }

    @Override
    public Block rewrite(Block b) {
      Set<Stmt> dead = closureDepth > 0 ? Collections.<Stmt>emptySet() :
                                          findDeadStores(b);
      List<Stmt> out = new ArrayList<Stmt>(b.size());
      for (Stmt s: b) {
        if (dead.contains(s)) {
          removed++;
          if (logger.isTraceEnabled()) {
            logger.trace("Dead store: " + s);
          }
        } else {
          out.addAll(rewrite(s));
        }
      }
      return new Block(out);
    }

    @Override
    public Expr visitClosure(Closure e) {
      closureDepth++;
      try {
        return super.visitClosure(e);
      } finally {
        closureDepth--;
      }
    }

    private Set<Stmt> findDeadStores(Block b) {
      Set<Stmt> dead = Collections.newSetFromMap(
                                new IdentityHashMap<Stmt, Boolean>());
      for (int i = 0; i < b.size(); i++) {
        Stmt s = b.get(i);
        if (!(s instanceof Stmts.Set)) {
          continue;
        }
        // Statements performing security checks are never touched,
        // whatever the rest of the analysis says
        if (analyses.effectOf(s).hasSecurityCheck()) {
          continue;
        }
        Stmts.Set store = (Stmts.Set)s;
        if (!removableValue(store.value) ||
            !overwrittenBeforeUse(b, i, store.target)) {
          continue;
        }
        LiveSet live = Liveness.liveAfter(analyses, b, i, b == functionBody);
        if (live.isLive(store.target)) {
          logger.warn("Liveness disagrees with dead store " + s +
                      ": keeping it");
          continue;
        }
        dead.add(s);
      }
      return dead;
    }

    /**
     * Removing the store must not remove an effect or a fault
     */
    private boolean removableValue(Expr value) {
      EffectSet eff = analyses.effectOf(value);
      return !eff.isUnknown() && eff.kind().isAtMost(EffectKind.READ) &&
             !LoopInvariance.mayFaultSyntactic(value);
    }

    /**
     * Scan forward for another plain store to target with nothing in
     * between that could observe it
     */
    private boolean overwrittenBeforeUse(Block b, int i, Var target) {
      for (int j = i + 1; j < b.size(); j++) {
        Stmt next = b.get(j);
        if (next instanceof Stmts.Set &&
            ((Stmts.Set)next).target.equals(target)) {
          return !analyses.effectOf(((Stmts.Set)next).value).mayRead(target);
        }
        if (next instanceof Return ||
            TreeWalk.containsReturn(Block.of(next))) {
          return false;
        }
        EffectSet eff = analyses.effectOf(next);
        if (eff.mayRead(target) || eff.mayWrite(target) ||
            eff.kind().isAtLeast(EffectKind.IO)) {
          return false;
        }
      }
      return false;
    }
  }
}
