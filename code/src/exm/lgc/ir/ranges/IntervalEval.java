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
package exm.lgc.ir.ranges;

import java.util.Map;

import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.common.util.Pair;
import exm.lgc.common.util.TernaryLogic.Ternary;
import exm.lgc.ir.tree.Exprs.BinOp;
import exm.lgc.ir.tree.Exprs.BinaryOp;
import exm.lgc.ir.tree.Exprs.Call;
import exm.lgc.ir.tree.Exprs.Copy;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Exprs.Identifier;
import exm.lgc.ir.tree.Exprs.Length;
import exm.lgc.ir.tree.Exprs.ListLiteral;
import exm.lgc.ir.tree.Exprs.Literal;
import exm.lgc.ir.tree.Exprs.New;
import exm.lgc.ir.tree.Exprs.Not;
import exm.lgc.ir.tree.Exprs.Range;
import exm.lgc.ir.tree.Exprs.Slice;
import exm.lgc.ir.tree.Exprs.WithCapacity;

/**
 * Interval semantics of expressions and conditions in an abstract state.
 * Expressions don't change the state, so evaluation never modifies it.
 */
public class IntervalEval {
  /** Return intervals of already analyzed functions */
  private final Map<String, Interval> returnSummaries;
  private final long minIndex;

  public IntervalEval(Map<String, Interval> returnSummaries, long minIndex) {
    this.returnSummaries = returnSummaries;
    this.minIndex = minIndex;
  }

  /**
   * @return interval of an integer expression, TOP for anything else
   */
  public Interval eval(Expr e, AbstractState st) {
    if (st.isUnreachable()) {
      return Interval.BOTTOM;
    }
    if (e instanceof Literal) {
      Literal lit = (Literal)e;
      return lit.isInt() ? Interval.constant(lit.intValue()) : Interval.TOP;
    } else if (e instanceof Identifier) {
      Var v = ((Identifier)e).var;
      return Types.isInt(v.type()) ? st.get(v) : Interval.TOP;
    } else if (e instanceof BinaryOp) {
      return evalBinary((BinaryOp)e, st);
    } else if (e instanceof Length) {
      return lengthOf(((Length)e).collection, st);
    } else if (e instanceof Call) {
      Call call = (Call)e;
      Interval summary = returnSummaries.get(call.function);
      return (summary != null && Types.isInt(call.type())) ?
              summary : Interval.TOP;
    } else if (e instanceof Copy) {
      return eval(((Copy)e).value, st);
    }
    return Interval.TOP;
  }

  private Interval evalBinary(BinaryOp e, AbstractState st) {
    if (!Types.isInt(e.type())) {
      return Interval.TOP;
    }
    Interval l = eval(e.left, st);
    Interval r = eval(e.right, st);
    switch (e.op) {
      case ADD:
        return l.add(r);
      case SUB:
        return l.sub(r);
      case MUL:
        return l.mul(r);
      case DIV:
        return l.div(r);
      case MOD:
        return l.mod(r);
      default:
        return Interval.TOP;
    }
  }

  /**
   * @return interval of the length of a collection-valued expression
   */
  public Interval lengthOf(Expr coll, AbstractState st) {
    if (st.isUnreachable()) {
      return Interval.BOTTOM;
    }
    if (coll instanceof Identifier) {
      Var v = ((Identifier)coll).var;
      return Types.hasLength(v.type()) ? st.lengthOf(v) :
                                         Interval.NON_NEGATIVE;
    } else if (coll instanceof ListLiteral) {
      return Interval.constant(((ListLiteral)coll).items.size());
    } else if (coll instanceof WithCapacity) {
      return Interval.constant(0);
    } else if (coll instanceof New && Types.hasLength(coll.type())) {
      // Constructed empty
      return Interval.constant(0);
    } else if (coll instanceof Copy) {
      return lengthOf(((Copy)coll).value, st);
    } else if (coll instanceof Range) {
      Range r = (Range)coll;
      Interval count = eval(r.end, st).sub(eval(r.start, st))
                                      .add(Interval.constant(1));
      return clampLength(count);
    } else if (coll instanceof Slice) {
      Interval whole = lengthOf(((Slice)coll).collection, st);
      return Interval.of(0, whole.hi);
    }
    return Interval.NON_NEGATIVE;
  }

  private static Interval clampLength(Interval count) {
    if (count.isBottom()) {
      return Interval.BOTTOM;
    }
    long lo = count.lo == Interval.NEG_INF ? 0 : Math.max(0, count.lo);
    long hi = count.hi == Interval.POS_INF ? Interval.POS_INF :
                                             Math.max(0, count.hi);
    return Interval.of(lo, hi);
  }

  /**
   * Decompose an index expression as binding + constant offset.
   * @return null if not of that form
   */
  public static Pair<Var, Long> linearIndex(Expr e) {
    if (e instanceof Identifier) {
      return Pair.create(((Identifier)e).var, 0L);
    }
    if (e instanceof BinaryOp) {
      BinaryOp b = (BinaryOp)e;
      if (b.op == BinOp.ADD && b.left instanceof Identifier &&
          b.right instanceof Literal && ((Literal)b.right).isInt()) {
        return Pair.create(((Identifier)b.left).var,
                           ((Literal)b.right).intValue());
      } else if (b.op == BinOp.ADD && b.right instanceof Identifier &&
          b.left instanceof Literal && ((Literal)b.left).isInt()) {
        return Pair.create(((Identifier)b.right).var,
                           ((Literal)b.left).intValue());
      } else if (b.op == BinOp.SUB && b.left instanceof Identifier &&
          b.right instanceof Literal && ((Literal)b.right).isInt() &&
          ((Literal)b.right).intValue() != Long.MIN_VALUE) {
        return Pair.create(((Identifier)b.left).var,
                           -((Literal)b.right).intValue());
      }
    }
    return null;
  }

  /**
   * Check whether collection[index] is provably in range.  Only positional
   * collections can be proven, a key lookup is never resolved.
   */
  public ProvenBound proveAccess(Expr collection, Expr index,
                                 AbstractState st) {
    if (st.isUnreachable() || !Types.isPositional(collection.type())) {
      return ProvenBound.unresolved();
    }
    Interval idx = eval(index, st);
    Interval len = lengthOf(collection, st);
    boolean byFact = false;
    Pair<Var, Long> linear = linearIndex(index);
    if (linear != null && collection instanceof Identifier) {
      Long slack = st.factSlack(linear.val1, ((Identifier)collection).var);
      byFact = slack != null && linear.val2 <= slack;
    }
    return ProvenBound.check(idx, len, minIndex, byFact);
  }

  /**
   * @return the state restricted to executions where cond has the given
   *         truth value.  May be unreachable.
   */
  public AbstractState refine(Expr cond, AbstractState st, boolean truth) {
    if (st.isUnreachable()) {
      return st.copy();
    }
    if (cond instanceof Literal && ((Literal)cond).isBool()) {
      AbstractState res = st.copy();
      if (((Literal)cond).boolValue() != truth) {
        res.markUnreachable();
      }
      return res;
    } else if (cond instanceof Not) {
      return refine(((Not)cond).operand, st, !truth);
    } else if (cond instanceof BinaryOp) {
      BinaryOp b = (BinaryOp)cond;
      if (b.op == BinOp.AND) {
        AbstractState leftTrue = refine(b.left, st, true);
        if (truth) {
          return refine(b.right, leftTrue, true);
        }
        return refine(b.left, st, false).join(refine(b.right, leftTrue, false));
      } else if (b.op == BinOp.OR) {
        AbstractState leftFalse = refine(b.left, st, false);
        if (!truth) {
          return refine(b.right, leftFalse, false);
        }
        return refine(b.left, st, true).join(refine(b.right, leftFalse, true));
      } else if (b.op.isComparison() && Types.isInt(b.left.type()) &&
                 Types.isInt(b.right.type())) {
        BinOp op = truth ? b.op : b.op.negate();
        return refineCompare(b.left, op, b.right, st);
      }
    }
    return st.copy();
  }

  private AbstractState refineCompare(Expr left, BinOp op, Expr right,
                                      AbstractState st) {
    if (left instanceof Length && !(right instanceof Length)) {
      // Normalize so that a length is on the right
      return refineCompare(right, op.swapOperands(), left, st);
    }
    AbstractState res = st.copy();
    Interval l = eval(left, st);
    Interval r = eval(right, st);
    switch (op) {
      case LT:
        restrict(left, Interval.atMost(dec(r.hi)), res);
        restrict(right, Interval.atLeast(inc(l.lo)), res);
        break;
      case LE:
        restrict(left, Interval.atMost(r.hi), res);
        restrict(right, Interval.atLeast(l.lo), res);
        break;
      case GT:
        restrict(left, Interval.atLeast(inc(r.lo)), res);
        restrict(right, Interval.atMost(dec(l.hi)), res);
        break;
      case GE:
        restrict(left, Interval.atLeast(r.lo), res);
        restrict(right, Interval.atMost(l.hi), res);
        break;
      case EQ:
        restrict(left, r, res);
        restrict(right, l, res);
        break;
      case NE:
        if (r.isConstant()) {
          excludeEndpoint(left, l, r.lo, res);
        }
        if (l.isConstant()) {
          excludeEndpoint(right, r, l.lo, res);
        }
        break;
      default:
        throw new IllegalArgumentException("Not a comparison: " + op);
    }

    if ((op == BinOp.LT || op == BinOp.LE) && right instanceof Length &&
        ((Length)right).collection instanceof Identifier) {
      Pair<Var, Long> linear = linearIndex(left);
      if (linear != null) {
        Var coll = ((Identifier)((Length)right).collection).var;
        long slack = linear.val2 + (op == BinOp.LT ? 1 : 0);
        res.addFact(linear.val1, coll, slack);
      }
    }
    return res;
  }

  private void excludeEndpoint(Expr e, Interval current, long c,
                               AbstractState res) {
    if (current.lo == c) {
      restrict(e, Interval.atLeast(inc(c)), res);
    } else if (current.hi == c) {
      restrict(e, Interval.atMost(dec(c)), res);
    }
  }

  /**
   * Restrict the binding or length behind e.  Other expressions can't be
   * refined, but can still show the branch is unreachable.
   */
  private void restrict(Expr e, Interval bound, AbstractState res) {
    if (res.isUnreachable()) {
      return;
    }
    if (eval(e, res).meet(bound).isBottom()) {
      res.markUnreachable();
    } else if (e instanceof Identifier &&
               Types.isInt(((Identifier)e).var.type())) {
      res.refine(((Identifier)e).var, bound);
    } else if (e instanceof Length &&
               ((Length)e).collection instanceof Identifier) {
      res.refineLength(((Identifier)((Length)e).collection).var, bound);
    }
  }

  private static long inc(long x) {
    if (x == Interval.NEG_INF || x == Interval.POS_INF) {
      return x;
    }
    return x + 1;
  }

  private static long dec(long x) {
    if (x == Interval.NEG_INF || x == Interval.POS_INF) {
      return x;
    }
    return x - 1;
  }

  /**
   * @return whether cond is always true, always false, or unknown
   */
  public Ternary truth(Expr cond, AbstractState st) {
    if (st.isUnreachable()) {
      return Ternary.MAYBE;
    }
    if (cond instanceof Literal && ((Literal)cond).isBool()) {
      return Ternary.fromBool(((Literal)cond).boolValue());
    } else if (cond instanceof Not) {
      return Ternary.not(truth(((Not)cond).operand, st));
    } else if (cond instanceof BinaryOp) {
      BinaryOp b = (BinaryOp)cond;
      if (b.op == BinOp.AND) {
        return Ternary.and(truth(b.left, st), truth(b.right, st));
      } else if (b.op == BinOp.OR) {
        return Ternary.or(truth(b.left, st), truth(b.right, st));
      } else if (b.op.isComparison() && Types.isInt(b.left.type()) &&
                 Types.isInt(b.right.type())) {
        return compare(b.op, eval(b.left, st), eval(b.right, st));
      }
    }
    return Ternary.MAYBE;
  }

  public static Ternary compare(BinOp op, Interval l, Interval r) {
    if (l.isBottom() || r.isBottom()) {
      return Ternary.MAYBE;
    }
    switch (op) {
      case LT:
        if (l.hi < r.lo) return Ternary.TRUE;
        if (l.lo >= r.hi) return Ternary.FALSE;
        return Ternary.MAYBE;
      case LE:
        if (l.hi <= r.lo) return Ternary.TRUE;
        if (l.lo > r.hi) return Ternary.FALSE;
        return Ternary.MAYBE;
      case GT:
        return compare(BinOp.LT, r, l);
      case GE:
        return compare(BinOp.LE, r, l);
      case EQ:
        if (l.isConstant() && l.equals(r)) return Ternary.TRUE;
        if (l.meet(r).isBottom()) return Ternary.FALSE;
        return Ternary.MAYBE;
      case NE:
        return Ternary.not(compare(BinOp.EQ, l, r));
      default:
        throw new IllegalArgumentException("Not a comparison: " + op);
    }
  }
}
