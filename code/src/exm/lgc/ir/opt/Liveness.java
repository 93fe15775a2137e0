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

import java.util.HashSet;
import java.util.Set;

import exm.lgc.common.lang.Var;
import exm.lgc.ir.effects.EffectSet;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Stmts;
import exm.lgc.ir.tree.Stmts.Return;
import exm.lgc.ir.tree.Stmts.Stmt;

/**
 * Backward liveness over the statements of one block.
 *
 * Only a plain reassignment kills a binding: other writes such as
 * collection updates keep the old value live.
 */
public class Liveness {

  /**
   * @param endVisibleOnly if true, the block ends the function, so only
   *        parameters and globals are live at its end.  Otherwise all
   *        bindings are assumed live there
   * @return bindings live just after statement i of the block
   */
  public static LiveSet liveAfter(AnalysisResults analyses, Block block,
                                  int i, boolean endVisibleOnly) {
    LiveSet live = endVisibleOnly ? LiveSet.callerVisible() : LiveSet.all();
    for (int j = block.size() - 1; j > i; j--) {
      live = transfer(analyses, block.get(j), live);
    }
    return live;
  }

  private static LiveSet transfer(AnalysisResults analyses, Stmt stmt,
                                  LiveSet liveOut) {
    EffectSet eff = analyses.effectOf(stmt);
    if (eff.isUnknown()) {
      return LiveSet.all();
    }
    if (stmt instanceof Return) {
      // Nothing after a return matters, except what the caller can see
      LiveSet live = LiveSet.callerVisible();
      live.addAll(eff.reads());
      return live;
    }
    LiveSet live = liveOut.copy();
    if (stmt instanceof Stmts.Set) {
      Stmts.Set set = (Stmts.Set)stmt;
      live.remove(set.target);
      live.addAll(analyses.effectOf(set.value).reads());
      return live;
    }
    live.addAll(eff.reads());
    live.addAll(eff.writes());
    live.addAll(eff.consumes());
    return live;
  }

  public static class LiveSet {
    private final boolean all;
    private final boolean callerVisible;
    private final Set<Var> vars = new HashSet<Var>();
    private final Set<Var> killed = new HashSet<Var>();

    private LiveSet(boolean all, boolean callerVisible) {
      this.all = all;
      this.callerVisible = callerVisible;
    }

    static LiveSet all() {
      return new LiveSet(true, true);
    }

    static LiveSet callerVisible() {
      return new LiveSet(false, true);
    }

    LiveSet copy() {
      LiveSet res = new LiveSet(all, callerVisible);
      res.vars.addAll(vars);
      res.killed.addAll(killed);
      return res;
    }

    void addAll(Set<Var> vs) {
      vars.addAll(vs);
      killed.removeAll(vs);
    }

    void remove(Var v) {
      vars.remove(v);
      killed.add(v);
    }

    public boolean isLive(Var v) {
      if (vars.contains(v)) {
        return true;
      } else if (killed.contains(v)) {
        return false;
      }
      return all || (callerVisible && v.visibleToCaller());
    }

    @Override
    public String toString() {
      return (all ? "ALL" : callerVisible ? "VISIBLE" : "") + vars +
             " - " + killed;
    }
  }
}
