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

import exm.lgc.common.lang.Types;
import exm.lgc.ir.effects.EffectKind;
import exm.lgc.ir.effects.EffectSet;
import exm.lgc.ir.ranges.Interval;
import exm.lgc.ir.ranges.RangeResults;
import exm.lgc.ir.tree.Exprs.BinOp;
import exm.lgc.ir.tree.Exprs.BinaryOp;
import exm.lgc.ir.tree.Exprs.Call;
import exm.lgc.ir.tree.Exprs.Closure;
import exm.lgc.ir.tree.Exprs.Escape;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Exprs.Index;
import exm.lgc.ir.tree.Exprs.Literal;
import exm.lgc.ir.tree.Exprs.Slice;
import exm.lgc.ir.tree.Stmts.Stmt;

/**
 * Invariance and fault tests shared by the loop passes.
 *
 * An expression is invariant in a loop if evaluating it has no effect
 * beyond reading bindings, and the loop writes none of those bindings.
 * Since it has no effects, an invariant expression evaluated before the
 * loop yields the same value as any evaluation inside the loop.
 */
public class LoopInvariance {
  private final AnalysisResults analyses;
  private final Stmt loop;
  private final EffectSet loopEffect;

  public LoopInvariance(AnalysisResults analyses, Stmt loop) {
    this.analyses = analyses;
    this.loop = loop;
    this.loopEffect = analyses.effectOf(loop);
  }

  public EffectSet loopEffect() {
    return loopEffect;
  }

  public boolean loopHasSecurityCheck() {
    return loopEffect.hasSecurityCheck();
  }

  public boolean isInvariant(Expr e) {
    if (loopEffect.isUnknown()) {
      return false;
    }
    EffectSet eff = analyses.effectOf(e);
    if (eff.isUnknown() || !eff.kind().isAtMost(EffectKind.READ)) {
      return false;
    }
    return !loopEffect.mayWriteAny(eff.reads());
  }

  /**
   * Check whether evaluating an invariant expression just before the loop
   * could fault, using the range analysis state at the loop entry
   */
  public boolean mayFault(Expr e) {
    return mayFault(e, analyses.ranges(), loop);
  }

  private static boolean mayFault(Expr e, RangeResults ranges, Stmt at) {
    if (e instanceof Index) {
      Index ix = (Index)e;
      if (!Types.isPositional(ix.collection.type()) ||
          !ranges.proveAccessBefore(at, ix.collection, ix.index).isSafe()) {
        return true;
      }
    } else if (e instanceof BinaryOp) {
      BinaryOp bin = (BinaryOp)e;
      if (bin.op.canFault()) {
        if (!Types.isInt(bin.right.type())) {
          return true;
        }
        Interval divisor = ranges.intervalOf(at, bin.right);
        if (divisor.isBottom() || divisor.contains(0)) {
          return true;
        }
      }
    } else if (e instanceof Slice || e instanceof Call ||
               e instanceof Escape) {
      // Callee bodies and slice bounds aren't checked
      return true;
    } else if (e instanceof Closure) {
      // Body not evaluated on creation
      return false;
    }
    for (Expr child: e.children()) {
      if (mayFault(child, ranges, at)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Conservative fault test needing no range information
   */
  public static boolean mayFaultSyntactic(Expr e) {
    if (e instanceof Index || e instanceof Slice || e instanceof Call ||
        e instanceof Escape) {
      return true;
    } else if (e instanceof BinaryOp) {
      BinaryOp bin = (BinaryOp)e;
      if (bin.op.canFault() && !isNonZeroIntLiteral(bin.right)) {
        return true;
      }
    } else if (e instanceof Closure) {
      return false;
    }
    for (Expr child: e.children()) {
      if (mayFaultSyntactic(child)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isNonZeroIntLiteral(Expr e) {
    if (e instanceof Literal) {
      Literal lit = (Literal)e;
      return lit.isInt() && lit.intValue() != 0;
    }
    return false;
  }

  /**
   * @return true if e is the conjunction or disjunction whose right operand
   *         is only evaluated depending on the left
   */
  public static boolean isShortCircuit(Expr e) {
    if (e instanceof BinaryOp) {
      BinOp op = ((BinaryOp)e).op;
      return op == BinOp.AND || op == BinOp.OR;
    }
    return false;
  }
}
