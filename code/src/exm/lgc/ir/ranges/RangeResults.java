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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.lang.Var;
import exm.lgc.common.util.TernaryLogic.Ternary;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Exprs.Index;
import exm.lgc.ir.tree.Stmts.SetIndex;
import exm.lgc.ir.tree.Stmts.Stmt;

/**
 * Results of range analysis over one version of the AST, keyed by node
 * identity.  Results describe the nodes they were computed on: a rewritten
 * tree needs a fresh analysis.
 */
public class RangeResults {
  private final IntervalEval eval;
  private final Map<Stmt, AbstractState> before =
      new IdentityHashMap<Stmt, AbstractState>();
  private final Map<Object, ProvenBound> bounds =
      new IdentityHashMap<Object, ProvenBound>();
  private final Map<Stmt, Ternary> runsAtLeastOnce =
      new IdentityHashMap<Stmt, Ternary>();
  private final Map<String, Interval> returns;
  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

  RangeResults(IntervalEval eval, Map<String, Interval> returns) {
    this.eval = eval;
    this.returns = returns;
  }

  void recordState(Stmt s, AbstractState st) {
    AbstractState prev = before.get(s);
    before.put(s, prev == null ? st : prev.join(st));
  }

  void recordBound(Object access, ProvenBound bound) {
    ProvenBound prev = bounds.get(access);
    // Safe only if safe on every visit
    if (prev == null || (prev.isSafe() && !bound.isSafe())) {
      bounds.put(access, bound);
    }
  }

  void recordRunsAtLeastOnce(Stmt loop, Ternary runs) {
    Ternary prev = runsAtLeastOnce.get(loop);
    runsAtLeastOnce.put(loop, prev == null ? runs :
                              Ternary.consensus(prev, runs));
  }

  void addDiagnostic(Diagnostic d) {
    diagnostics.add(d);
  }

  /**
   * @return copy of the state before the statement, or null if the
   *         statement wasn't analyzed (e.g. inside a closure body)
   */
  public AbstractState stateBefore(Stmt s) {
    AbstractState st = before.get(s);
    return st == null ? null : st.copy();
  }

  public boolean isReachable(Stmt s) {
    AbstractState st = before.get(s);
    return st == null || !st.isUnreachable();
  }

  /**
   * @return interval of an integer binding before the statement
   */
  public Interval intervalBefore(Stmt s, Var v) {
    AbstractState st = before.get(s);
    return st == null ? Interval.TOP : st.get(v);
  }

  public ProvenBound boundOf(Index access) {
    return lookupBound(access);
  }

  public ProvenBound boundOf(SetIndex access) {
    return lookupBound(access);
  }

  private ProvenBound lookupBound(Object access) {
    ProvenBound b = bounds.get(access);
    return b == null ? ProvenBound.unresolved() : b;
  }

  public boolean isProvenSafe(Index access) {
    return boundOf(access).isSafe();
  }

  /**
   * @return TRUE if the loop body is known to execute at least once
   */
  public Ternary runsAtLeastOnce(Stmt loop) {
    Ternary t = runsAtLeastOnce.get(loop);
    return t == null ? Ternary.MAYBE : t;
  }

  /**
   * Evaluate a condition in the state before a statement
   */
  public Ternary conditionBefore(Stmt s, Expr cond) {
    AbstractState st = before.get(s);
    if (st == null) {
      return Ternary.MAYBE;
    }
    return eval.truth(cond, st);
  }

  /**
   * Check collection[index] as if evaluated just before the statement
   */
  public ProvenBound proveAccessBefore(Stmt s, Expr collection, Expr index) {
    AbstractState st = before.get(s);
    if (st == null) {
      return ProvenBound.unresolved();
    }
    return eval.proveAccess(collection, index, st);
  }

  public Interval intervalOf(Stmt s, Expr e) {
    AbstractState st = before.get(s);
    if (st == null) {
      return Interval.TOP;
    }
    return eval.eval(e, st);
  }

  /**
   * @return interval of the values a function may return, TOP if unknown
   */
  public Interval returnInterval(String function) {
    Interval i = returns.get(function);
    return i == null ? Interval.TOP : i;
  }

  public List<Diagnostic> diagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }

  /**
   * Compare two analyses of the same tree
   */
  public boolean sameAs(RangeResults other) {
    return sameEntries(before, other.before) &&
           returns.equals(other.returns) &&
           sameEntries(runsAtLeastOnce, other.runsAtLeastOnce) &&
           boundsEqual(other);
  }

  /**
   * Identity maps compare values by reference, so compare by hand
   */
  private static <K, V> boolean sameEntries(Map<K, V> a, Map<K, V> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (Map.Entry<K, V> e: a.entrySet()) {
      V o = b.get(e.getKey());
      if (o == null || !o.equals(e.getValue())) {
        return false;
      }
    }
    return true;
  }

  private boolean boundsEqual(RangeResults other) {
    if (bounds.size() != other.bounds.size()) {
      return false;
    }
    for (Map.Entry<Object, ProvenBound> e: bounds.entrySet()) {
      ProvenBound o = other.bounds.get(e.getKey());
      if (o == null || o.isSafe() != e.getValue().isSafe() ||
          !o.index.equals(e.getValue().index) ||
          !o.length.equals(e.getValue().length)) {
        return false;
      }
    }
    return true;
  }
}
