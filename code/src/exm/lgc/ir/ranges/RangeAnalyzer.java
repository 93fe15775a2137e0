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

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.Settings;
import exm.lgc.common.exceptions.InvalidOptionException;
import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.common.util.TernaryLogic.Ternary;
import exm.lgc.ir.callgraph.CallGraph;
import exm.lgc.ir.effects.EffectAnalyzer;
import exm.lgc.ir.effects.EffectEnv;
import exm.lgc.ir.effects.EffectSet;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Exprs;
import exm.lgc.ir.tree.Exprs.BinOp;
import exm.lgc.ir.tree.Exprs.BinaryOp;
import exm.lgc.ir.tree.Exprs.Closure;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Exprs.Identifier;
import exm.lgc.ir.tree.Exprs.Index;
import exm.lgc.ir.tree.Exprs.Length;
import exm.lgc.ir.tree.Exprs.Literal;
import exm.lgc.ir.tree.Exprs.Range;
import exm.lgc.ir.tree.Function;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts;
import exm.lgc.ir.tree.Stmts.Add;
import exm.lgc.ir.tree.Stmts.Concurrent;
import exm.lgc.ir.tree.Stmts.If;
import exm.lgc.ir.tree.Stmts.Let;
import exm.lgc.ir.tree.Stmts.Parallel;
import exm.lgc.ir.tree.Stmts.Pop;
import exm.lgc.ir.tree.Stmts.Push;
import exm.lgc.ir.tree.Stmts.Remove;
import exm.lgc.ir.tree.Stmts.Repeat;
import exm.lgc.ir.tree.Stmts.Return;
import exm.lgc.ir.tree.Stmts.RuntimeAssert;
import exm.lgc.ir.tree.Stmts.SetIndex;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.Stmts.While;

/**
 * Value range analysis: forward abstract interpretation over intervals.
 *
 * Loop headers iterate with plain joins for the first few growth
 * observations, then widen the bindings the loop writes, then apply one
 * narrowing pass.  A last pass over each loop body records the states that
 * queries see.
 */
public class RangeAnalyzer {
  private final Logger logger;
  private final EffectAnalyzer effects;
  private final int wideningDelay;
  private final int maxIterations;
  private final long minIndex;

  public RangeAnalyzer(Logger logger, EffectAnalyzer effects,
                       int wideningDelay, int maxIterations, long minIndex) {
    this.logger = logger;
    this.effects = effects;
    this.wideningDelay = wideningDelay;
    this.maxIterations = maxIterations;
    this.minIndex = minIndex;
  }

  public static RangeAnalyzer fromSettings(Logger logger,
        EffectAnalyzer effects) throws InvalidOptionException {
    return new RangeAnalyzer(logger, effects,
                  Settings.getInt(Settings.RANGE_WIDENING_DELAY),
                  Settings.getInt(Settings.RANGE_MAX_ITERATIONS),
                  Settings.getLong(Settings.LANG_MIN_INDEX));
  }

  /**
   * Analyze all functions, callees before callers so that return
   * intervals are available at call sites.
   */
  public RangeResults analyzeProgram(Program program, CallGraph callGraph,
                                     EffectEnv env) {
    Map<String, Interval> returns = new LinkedHashMap<String, Interval>();
    IntervalEval eval = new IntervalEval(returns, minIndex);
    RangeResults results = new RangeResults(eval, returns);

    for (List<String> scc: callGraph.sccs()) {
      Map<String, Interval> sccReturns = new LinkedHashMap<String, Interval>();
      for (String name: scc) {
        Function f = program.lookupFunction(name);
        if (f == null || f.isNative()) {
          continue;
        }
        Transfer transfer = new Transfer(env, results, eval);
        AbstractState exit = transfer.analyzeBlock(f.body(),
                                           new AbstractState(), true);
        Interval ret = transfer.returned;
        if (callGraph.isRecursive(name) || !Types.isInt(f.returnType())) {
          ret = Interval.TOP;
        }
        sccReturns.put(name, ret);
        if (logger.isTraceEnabled()) {
          logger.trace("Range analysis of " + name + ": exit " + exit +
                       " returns " + ret);
        }
      }
      // Publish once the whole SCC is done
      returns.putAll(sccReturns);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Return intervals: " + returns);
    }
    return results;
  }

  /**
   * Transfer functions for one function body
   */
  private class Transfer {
    private final EffectEnv env;
    private final RangeResults results;
    private final IntervalEval eval;
    /** Join of all returned values */
    Interval returned = Interval.BOTTOM;

    Transfer(EffectEnv env, RangeResults results, IntervalEval eval) {
      this.env = env;
      this.results = results;
      this.eval = eval;
    }

    AbstractState analyzeBlock(Block block, AbstractState in, boolean record) {
      AbstractState st = in.copy();
      for (Stmt s: block) {
        if (record) {
          results.recordState(s, st.copy());
          recordBounds(s, st);
        }
        st = transfer(s, st, record);
      }
      return st;
    }

    private void recordBounds(Stmt s, AbstractState st) {
      if (s instanceof SetIndex) {
        SetIndex si = (SetIndex)s;
        results.recordBound(si, eval.proveAccess(si.collection, si.index, st));
      }
      if (s instanceof While) {
        // Condition is evaluated at the loop header, recorded there
        return;
      }
      for (Expr e: s.targets()) {
        recordBounds(e, st);
      }
      for (Expr e: s.exprs()) {
        recordBounds(e, st);
      }
    }

    private void recordBounds(Expr e, AbstractState st) {
      if (e instanceof Closure) {
        return;
      }
      if (e instanceof Index) {
        Index ix = (Index)e;
        results.recordBound(ix, eval.proveAccess(ix.collection, ix.index, st));
      }
      for (Expr child: e.children()) {
        recordBounds(child, st);
      }
    }

    private AbstractState transfer(Stmt s, AbstractState st, boolean record) {
      if (s instanceof Let) {
        Let let = (Let)s;
        assign(let.var, let.value, st);
        return st;
      } else if (s instanceof Stmts.Set) {
        Stmts.Set set = (Stmts.Set)s;
        assign(set.target, set.value, st);
        return st;
      } else if (s instanceof Push) {
        Push push = (Push)s;
        return resize(st, push.collection, push.value, Interval.constant(1),
                      true);
      } else if (s instanceof Add) {
        Add add = (Add)s;
        // Adding to a set may not change its size
        return resize(st, add.collection, add.value, Interval.of(0, 1), true);
      } else if (s instanceof Pop) {
        Pop pop = (Pop)s;
        st = resize(st, pop.collection, null, Interval.of(-1, 0), false);
        if (pop.into != null) {
          st.havoc(pop.into);
        }
        return st;
      } else if (s instanceof Remove) {
        Remove remove = (Remove)s;
        return resize(st, remove.collection, remove.value, Interval.of(-1, 0),
                      false);
      } else if (s instanceof If) {
        If ifStmt = (If)s;
        AbstractState thenOut = analyzeBlock(ifStmt.thenBlock,
                            condState(ifStmt.cond, st, true), record);
        AbstractState elseOut = analyzeBlock(ifStmt.elseBlock,
                            condState(ifStmt.cond, st, false), record);
        return thenOut.join(elseOut);
      } else if (s instanceof While) {
        return analyzeWhile((While)s, st, record);
      } else if (s instanceof Repeat) {
        return analyzeRepeat((Repeat)s, st, record);
      } else if (s instanceof Return) {
        Return ret = (Return)s;
        if (ret.value != null && !st.isUnreachable()) {
          returned = returned.join(eval.eval(ret.value, st));
        }
        st.markUnreachable();
        return st;
      } else if (s instanceof RuntimeAssert) {
        // Execution only continues if the assertion held
        return condState(((RuntimeAssert)s).cond, st, true);
      } else {
        return transferOther(s, st, record);
      }
    }

    /**
     * Statements without a dedicated rule: forget whatever they may write.
     * Nested blocks are analyzed from that state so their statements get
     * sound results too.
     */
    private AbstractState transferOther(Stmt s, AbstractState st,
                                        boolean record) {
      AbstractState after = st.copy();
      if (s instanceof Stmts.Escape && !st.isUnreachable()) {
        // Foreign code may return any value from the function
        returned = Interval.TOP;
      }
      havoc(after, effects.classifyStmt(s, env));
      boolean concurrent = s instanceof Concurrent || s instanceof Parallel;
      for (Block b: s.blocks()) {
        if (concurrent) {
          // Tasks interleave, so each starts from the havocked state
          for (Stmt task: b) {
            analyzeBlock(Block.of(task), after, record);
          }
        } else {
          analyzeBlock(b, after, record);
        }
      }
      return after;
    }

    private void havoc(AbstractState st, EffectSet eff) {
      if (eff.isUnknown()) {
        st.havocEverything();
      } else {
        st.havocAll(eff.writesAndConsumes());
      }
    }

    private void assign(Var v, Expr value, AbstractState st) {
      Interval val = Interval.TOP;
      Interval len = Interval.NON_NEGATIVE;
      if (Types.isInt(v.type())) {
        val = eval.eval(value, st);
      } else if (Types.hasLength(v.type())) {
        len = eval.lengthOf(value, st);
      }
      havoc(st, effects.classifyExpr(value, env));
      if (Types.isInt(v.type())) {
        st.set(v, val);
      } else if (Types.hasLength(v.type())) {
        st.setLength(v, len, false);
      } else {
        st.havoc(v);
      }
    }

    /**
     * Change the length of a collection by delta
     * @param grows true if the length can't decrease
     */
    private AbstractState resize(AbstractState st, Expr collection,
                                 Expr value, Interval delta, boolean grows) {
      if (value != null) {
        havoc(st, effects.classifyExpr(value, env));
      }
      if (collection instanceof Identifier) {
        Var coll = ((Identifier)collection).var;
        Interval len = st.lengthOf(coll).add(delta);
        st.setLength(coll, len.meet(Interval.NON_NEGATIVE), grows);
      } else {
        havoc(st, effects.classifyExpr(collection, env));
        Var root = Exprs.rootVar(collection);
        if (root != null) {
          st.havoc(root);
        }
      }
      return st;
    }

    /**
     * State in which cond has the given value.  Conditions that write
     * can't be used for refinement.
     */
    private AbstractState condState(Expr cond, AbstractState st,
                                    boolean truth) {
      EffectSet eff = effects.classifyExpr(cond, env);
      if (eff.isUnknown() || !eff.writesAndConsumes().isEmpty()) {
        AbstractState res = st.copy();
        havoc(res, eff);
        return res;
      }
      return eval.refine(cond, st, truth);
    }

    /**
     * @return bindings that take part in widening, null for all of them
     */
    private Set<Var> widenable(EffectSet loopEffect) {
      if (loopEffect.isUnknown()) {
        return null;
      }
      return new HashSet<Var>(loopEffect.writesAndConsumes());
    }

    private AbstractState widen(AbstractState head, AbstractState next,
                                Set<Var> widenable) {
      if (widenable == null) {
        // Unknown loop effects: after the body nothing is known anyway
        AbstractState res = head.join(next);
        res.havocEverything();
        return res;
      }
      return head.widen(next, widenable);
    }

    private AbstractState analyzeWhile(While loop, AbstractState entry,
                                       boolean record) {
      EffectSet loopEffect = effects.classifyExpr(loop.cond, env)
                      .join(effects.classifyBlock(loop.body, env));
      Set<Var> widenable = widenable(loopEffect);
      if (record) {
        results.recordRunsAtLeastOnce(loop, eval.truth(loop.cond, entry));
      }

      AbstractState head = entry.copy();
      boolean converged = false;
      int growth = 0;
      while (!converged) {
        AbstractState bodyOut = analyzeBlock(loop.body,
                                  condState(loop.cond, head, true), false);
        AbstractState next = entry.join(bodyOut);
        if (next.leq(head)) {
          converged = true;
        } else {
          growth++;
          if (growth > maxIterations) {
            head = capIterations(loop, head, next, widenable);
            break;
          }
          head = growth >= wideningDelay ? widen(head, next, widenable) :
                                           head.join(next);
        }
      }

      if (converged) {
        AbstractState bodyOut = analyzeBlock(loop.body,
                                  condState(loop.cond, head, true), false);
        head = head.narrow(entry.join(bodyOut));
      }

      if (record) {
        recordBounds(loop.cond, head);
        if (loop.decreasing != null) {
          recordBounds(loop.decreasing, head);
        }
        analyzeBlock(loop.body, condState(loop.cond, head, true), true);
      }
      return condState(loop.cond, head, false);
    }

    private AbstractState analyzeRepeat(Repeat loop, AbstractState st,
                                        boolean record) {
      final Interval varRange;
      Ternary runs;
      if (loop.iterable instanceof Range) {
        Range r = (Range)loop.iterable;
        Interval start = eval.eval(r.start, st);
        Interval end = eval.eval(r.end, st);
        varRange = Interval.of(start.lo, end.hi);
        runs = IntervalEval.compare(BinOp.LE, start, end);
      } else {
        varRange = Interval.TOP;
        Interval len = eval.lengthOf(loop.iterable, st);
        if (len.isBottom()) {
          runs = Ternary.MAYBE;
        } else if (len.lo >= 1) {
          runs = Ternary.TRUE;
        } else if (len.hi == 0) {
          runs = Ternary.FALSE;
        } else {
          runs = Ternary.MAYBE;
        }
      }
      if (record) {
        results.recordRunsAtLeastOnce(loop, runs);
      }

      AbstractState entry = st.copy();
      havoc(entry, effects.classifyExpr(loop.iterable, env));
      EffectSet bodyEffect = effects.classifyBlock(loop.body, env);
      Set<Var> widenable = widenable(bodyEffect);
      if (widenable != null) {
        widenable.add(loop.var);
      }
      LoopVarBinding binding = new LoopVarBinding(loop, varRange, bodyEffect);

      AbstractState head = entry.copy();
      boolean converged = false;
      int growth = 0;
      while (!converged) {
        AbstractState bodyOut = analyzeBlock(loop.body, binding.bind(head),
                                             false);
        AbstractState next = entry.join(bodyOut);
        if (next.leq(head)) {
          converged = true;
        } else {
          growth++;
          if (growth > maxIterations) {
            head = capIterations(loop, head, next, widenable);
            break;
          }
          head = growth >= wideningDelay ? widen(head, next, widenable) :
                                           head.join(next);
        }
      }

      if (converged) {
        AbstractState bodyOut = analyzeBlock(loop.body, binding.bind(head),
                                             false);
        head = head.narrow(entry.join(bodyOut));
      }

      if (record) {
        analyzeBlock(loop.body, binding.bind(head), true);
      }
      AbstractState exit = head.copy();
      exit.havoc(loop.var);
      return exit;
    }

    /**
     * Give up on a loop that didn't converge: forget everything it writes
     */
    private AbstractState capIterations(Stmt loop, AbstractState head,
                        AbstractState next, Set<Var> widenable) {
      String msg = "Range analysis of loop did not converge after " +
                    maxIterations + " iterations: " + loop;
      logger.warn(msg);
      results.addDiagnostic(new Diagnostic(
                      Diagnostic.Kind.ITERATION_CAP, msg));
      AbstractState res = head.join(next);
      if (widenable == null) {
        res.havocEverything();
      } else {
        res.havocAll(widenable);
      }
      return res;
    }
  }

  /**
   * Binds the loop variable of a repeat loop at the start of each iteration
   */
  private static class LoopVarBinding {
    private final Repeat loop;
    private final Interval range;
    /** Collection whose length bounds the loop variable, or null */
    private final Var boundingColl;
    private final long slack;

    LoopVarBinding(Repeat loop, Interval range, EffectSet bodyEffect) {
      this.loop = loop;
      this.range = range;
      Var coll = null;
      long k = 0;
      if (loop.iterable instanceof Range) {
        Expr end = ((Range)loop.iterable).end;
        if (end instanceof BinaryOp && ((BinaryOp)end).op == BinOp.SUB &&
            ((BinaryOp)end).right instanceof Literal &&
            ((Literal)((BinaryOp)end).right).isInt() &&
            ((Literal)((BinaryOp)end).right).intValue() >= 0) {
          k = ((Literal)((BinaryOp)end).right).intValue();
          end = ((BinaryOp)end).left;
        }
        if (end instanceof Length &&
            ((Length)end).collection instanceof Identifier) {
          coll = ((Identifier)((Length)end).collection).var;
        }
      }
      // The length at range evaluation only holds if the body can't change it
      if (coll != null && !bodyEffect.mayWrite(coll)) {
        this.boundingColl = coll;
        this.slack = k;
      } else {
        this.boundingColl = null;
        this.slack = 0;
      }
    }

    AbstractState bind(AbstractState head) {
      AbstractState in = head.copy();
      if (range.isBottom()) {
        // Empty range: the body never runs
        in.markUnreachable();
        return in;
      }
      if (Types.isInt(loop.var.type())) {
        in.set(loop.var, range);
      } else {
        in.havoc(loop.var);
      }
      if (boundingColl != null) {
        in.addFact(loop.var, boundingColl, slack);
      }
      return in;
    }
  }
}
