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

import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;

import exm.lgc.common.lang.Var;

/**
 * Abstract state at a program point: intervals of integer bindings, length
 * intervals of collections, and relational facts of the form
 * {@code index + slack <= length(collection)}.
 *
 * A binding without an entry is unconstrained.  States are mutable while a
 * block is being analyzed; recorded states are copies.
 */
public class AbstractState {

  /**
   * Relational fact: index + slack <= length(collection)
   */
  public static class LengthFact {
    public final Var index;
    public final Var collection;

    public LengthFact(Var index, Var collection) {
      this.index = index;
      this.collection = collection;
    }

    @Override
    public int hashCode() {
      return index.hashCode() * 31 + collection.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof LengthFact)) {
        return false;
      }
      LengthFact o = (LengthFact)obj;
      return index.equals(o.index) && collection.equals(o.collection);
    }

    @Override
    public String toString() {
      return index + " <= length(" + collection + ")";
    }
  }

  private boolean unreachable;
  private final Map<Var, Interval> ints;
  private final Map<Var, Interval> lengths;
  /** Fact to its slack */
  private final Map<LengthFact, Long> facts;

  public AbstractState() {
    this(false);
  }

  private AbstractState(boolean unreachable) {
    this.unreachable = unreachable;
    this.ints = new HashMap<Var, Interval>();
    this.lengths = new HashMap<Var, Interval>();
    this.facts = new HashMap<LengthFact, Long>();
  }

  public static AbstractState unreachable() {
    return new AbstractState(true);
  }

  public AbstractState copy() {
    AbstractState res = new AbstractState(unreachable);
    res.ints.putAll(ints);
    res.lengths.putAll(lengths);
    res.facts.putAll(facts);
    return res;
  }

  public boolean isUnreachable() {
    return unreachable;
  }

  public void markUnreachable() {
    unreachable = true;
    ints.clear();
    lengths.clear();
    facts.clear();
  }

  public Interval get(Var v) {
    if (unreachable) {
      return Interval.BOTTOM;
    }
    Interval i = ints.get(v);
    return i == null ? Interval.TOP : i;
  }

  /**
   * Bind a new value.  Facts about the old value die.
   */
  public void set(Var v, Interval value) {
    if (unreachable) {
      return;
    }
    killFacts(v);
    if (value.isBottom()) {
      markUnreachable();
    } else if (value.isTop()) {
      ints.remove(v);
    } else {
      ints.put(v, value);
    }
  }

  /**
   * Restrict a binding without changing its value.  Facts remain valid.
   */
  public void refine(Var v, Interval bound) {
    if (unreachable) {
      return;
    }
    Interval refined = get(v).meet(bound);
    if (refined.isBottom()) {
      markUnreachable();
    } else if (!refined.isTop()) {
      ints.put(v, refined);
    }
  }

  public Interval lengthOf(Var collection) {
    if (unreachable) {
      return Interval.BOTTOM;
    }
    Interval i = lengths.get(collection);
    return i == null ? Interval.NON_NEGATIVE : i;
  }

  /**
   * @param keepFacts true if the length can only have grown
   */
  public void setLength(Var collection, Interval length, boolean keepFacts) {
    if (unreachable) {
      return;
    }
    if (!keepFacts) {
      killFacts(collection);
    }
    Interval clamped = length.meet(Interval.NON_NEGATIVE);
    if (clamped.isBottom()) {
      markUnreachable();
    } else if (clamped.equals(Interval.NON_NEGATIVE)) {
      lengths.remove(collection);
    } else {
      lengths.put(collection, clamped);
    }
  }

  public void refineLength(Var collection, Interval bound) {
    if (unreachable) {
      return;
    }
    setLength(collection, lengthOf(collection).meet(bound), true);
  }

  /**
   * Record index + slack <= length(collection).  Keeps the stronger fact.
   */
  public void addFact(Var index, Var collection, long slack) {
    if (unreachable || slack < 0) {
      return;
    }
    LengthFact fact = new LengthFact(index, collection);
    Long prev = facts.get(fact);
    if (prev == null || prev < slack) {
      facts.put(fact, slack);
    }
  }

  /**
   * @return slack of the fact, or null if no such fact holds
   */
  public Long factSlack(Var index, Var collection) {
    if (unreachable) {
      return null;
    }
    return facts.get(new LengthFact(index, collection));
  }

  /**
   * Forget everything about a binding
   */
  public void havoc(Var v) {
    if (unreachable) {
      return;
    }
    ints.remove(v);
    lengths.remove(v);
    killFacts(v);
  }

  public void havocAll(Collection<Var> vars) {
    for (Var v: vars) {
      havoc(v);
    }
  }

  /**
   * Forget everything, e.g. after foreign code
   */
  public void havocEverything() {
    if (unreachable) {
      return;
    }
    ints.clear();
    lengths.clear();
    facts.clear();
  }

  private void killFacts(Var v) {
    Iterator<LengthFact> it = facts.keySet().iterator();
    while (it.hasNext()) {
      LengthFact f = it.next();
      if (f.index.equals(v) || f.collection.equals(v)) {
        it.remove();
      }
    }
  }

  /**
   * Least upper bound of two states
   */
  public AbstractState join(AbstractState other) {
    if (unreachable) {
      return other.copy();
    } else if (other.unreachable) {
      return copy();
    }
    AbstractState res = new AbstractState();
    joinMap(ints, other.ints, res.ints);
    joinMap(lengths, other.lengths, res.lengths);
    for (Entry<LengthFact, Long> e: facts.entrySet()) {
      Long otherSlack = other.facts.get(e.getKey());
      if (otherSlack != null) {
        res.facts.put(e.getKey(), Math.min(e.getValue(), otherSlack));
      }
    }
    return res;
  }

  /**
   * Widen this (previous loop header state) with next.  Only the given
   * bindings are widened; the rest are joined.
   */
  public AbstractState widen(AbstractState next, Set<Var> widenable) {
    if (unreachable) {
      return next.copy();
    } else if (next.unreachable) {
      return copy();
    }
    AbstractState res = join(next);
    widenMap(ints, next.ints, res.ints, widenable);
    widenMap(lengths, next.lengths, res.lengths, widenable);
    for (Var v: widenable) {
      Interval len = res.lengths.get(v);
      if (len != null) {
        // Lengths never go below zero
        res.lengths.remove(v);
        res.setLength(v, len, true);
      }
    }
    return res;
  }

  /**
   * Narrow this (widened loop header state) with next.  Only unbounded
   * bounds are replaced.
   */
  public AbstractState narrow(AbstractState next) {
    if (unreachable || next.unreachable) {
      return copy();
    }
    AbstractState res = copy();
    for (Var v: ints.keySet()) {
      res.set(v, get(v).narrow(next.get(v)));
    }
    for (Var v: lengths.keySet()) {
      res.setLength(v, lengthOf(v).narrow(next.lengthOf(v)), true);
    }
    // Unconstrained bindings have nothing but unbounded bounds to replace
    for (Var v: next.ints.keySet()) {
      if (!ints.containsKey(v)) {
        res.refine(v, next.get(v));
      }
    }
    for (Var v: next.lengths.keySet()) {
      if (!lengths.containsKey(v)) {
        res.refineLength(v, next.lengthOf(v));
      }
    }
    res.facts.putAll(facts);
    return res;
  }

  private static void joinMap(Map<Var, Interval> a, Map<Var, Interval> b,
                              Map<Var, Interval> out) {
    // Missing entries are unconstrained, so only keys in both survive
    for (Entry<Var, Interval> e: a.entrySet()) {
      Interval other = b.get(e.getKey());
      if (other != null) {
        out.put(e.getKey(), e.getValue().join(other));
      }
    }
  }

  private static void widenMap(Map<Var, Interval> prev, Map<Var, Interval> next,
                               Map<Var, Interval> out, Set<Var> widenable) {
    for (Var v: widenable) {
      Interval p = prev.get(v);
      Interval n = next.get(v);
      if (p == null || n == null) {
        // Already unconstrained in one of them
        out.remove(v);
        continue;
      }
      out.put(v, p.widen(n));
    }
  }

  /**
   * @return true if this state is at least as precise as other
   */
  public boolean leq(AbstractState other) {
    if (unreachable) {
      return true;
    } else if (other.unreachable) {
      return false;
    }
    for (Entry<Var, Interval> e: other.ints.entrySet()) {
      if (!get(e.getKey()).within(e.getValue())) {
        return false;
      }
    }
    for (Entry<Var, Interval> e: other.lengths.entrySet()) {
      if (!lengthOf(e.getKey()).within(e.getValue())) {
        return false;
      }
    }
    for (Entry<LengthFact, Long> e: other.facts.entrySet()) {
      Long slack = facts.get(e.getKey());
      if (slack == null || slack < e.getValue()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return ints.hashCode() * 31 + lengths.hashCode() + facts.hashCode() +
           (unreachable ? 1 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof AbstractState)) {
      return false;
    }
    AbstractState o = (AbstractState)obj;
    return unreachable == o.unreachable && ints.equals(o.ints) &&
           lengths.equals(o.lengths) && facts.equals(o.facts);
  }

  @Override
  public String toString() {
    if (unreachable) {
      return "<unreachable>";
    }
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (Entry<Var, Interval> e: new TreeMap<Var, Interval>(ints).entrySet()) {
      sb.append(first ? " " : ", ").append(e.getKey()).append(": ")
        .append(e.getValue());
      first = false;
    }
    for (Entry<Var, Interval> e:
                        new TreeMap<Var, Interval>(lengths).entrySet()) {
      sb.append(first ? " " : ", ").append("length(").append(e.getKey())
        .append("): ").append(e.getValue());
      first = false;
    }
    for (Entry<LengthFact, Long> e: facts.entrySet()) {
      sb.append(first ? " " : ", ").append(e.getKey().index).append(" + ")
        .append(e.getValue()).append(" <= length(")
        .append(e.getKey().collection).append(")");
      first = false;
    }
    sb.append(" }");
    return sb.toString();
  }
}
