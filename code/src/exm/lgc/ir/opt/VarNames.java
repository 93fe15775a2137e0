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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.lgc.common.lang.Types.Type;
import exm.lgc.common.lang.Var;
import exm.lgc.common.lang.Var.VarKind;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Exprs.Closure;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Exprs.Identifier;
import exm.lgc.ir.tree.Function;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts.Inspect;
import exm.lgc.ir.tree.Stmts.InspectArm;
import exm.lgc.ir.tree.Stmts.Let;
import exm.lgc.ir.tree.Stmts.Repeat;
import exm.lgc.ir.tree.Stmts.Select;
import exm.lgc.ir.tree.Stmts.SelectBranch;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.TreeWalk;
import exm.lgc.ir.tree.TreeWalk.TreeWalker;

/**
 * Binding names in use in a function, for passes that introduce new
 * bindings or duplicate code.  Names must stay unique within a function.
 */
public class VarNames {
  private final Set<String> used = new HashSet<String>();
  private final Map<String, Integer> counters = new HashMap<String, Integer>();

  public VarNames(Program program, Function f) {
    for (Var g: program.globals()) {
      used.add(g.name());
    }
    for (Var p: f.params()) {
      used.add(p.name());
    }
    TreeWalk.walk(f.body(), new TreeWalker() {
      @Override
      protected void visit(Stmt stmt) {
        for (Var v: declaredBy(stmt)) {
          used.add(v.name());
        }
      }

      @Override
      protected void visit(Expr expr) {
        if (expr instanceof Identifier) {
          used.add(((Identifier)expr).var.name());
        } else if (expr instanceof Closure) {
          for (Var p: ((Closure)expr).params) {
            used.add(p.name());
          }
        }
      }
    }, true);
  }

  /**
   * @return a name starting with prefix not used elsewhere in the function
   */
  public String fresh(String prefix) {
    Integer next = counters.get(prefix);
    int n = next == null ? 0 : next;
    String name;
    do {
      name = prefix + n;
      n++;
    } while (used.contains(name));
    counters.put(prefix, n);
    used.add(name);
    return name;
  }

  /**
   * Immutable binding for a value computed by the optimizer
   */
  public Var freshTemp(String prefix, Type type) {
    return new Var(fresh(prefix), type, false, VarKind.TEMPORARY);
  }

  /**
   * @return copy of v with a fresh name derived from it
   */
  public Var freshCopy(Var v) {
    return new Var(fresh(v.name() + "_"), v.type(), v.isMutable(), v.kind());
  }

  /**
   * New names for every binding declared in a block, so that a copy of the
   * block can live in the same function as the original
   */
  public Map<Var, Var> renameDeclared(Block block) {
    final Map<Var, Var> renames = new HashMap<Var, Var>();
    TreeWalk.walk(block, new TreeWalker() {
      @Override
      protected void visit(Stmt stmt) {
        for (Var v: declaredBy(stmt)) {
          if (!renames.containsKey(v)) {
            renames.put(v, freshCopy(v));
          }
        }
      }
    }, true);
    return renames;
  }

  /**
   * @return bindings introduced by a statement, as opposed to bindings it
   *         assigns
   */
  public static List<Var> declaredBy(Stmt stmt) {
    List<Var> res = new ArrayList<Var>();
    if (stmt instanceof Let) {
      res.add(((Let)stmt).var);
    } else if (stmt instanceof Repeat) {
      res.add(((Repeat)stmt).var);
    } else if (stmt instanceof Inspect) {
      for (InspectArm arm: ((Inspect)stmt).arms) {
        res.addAll(arm.bindings);
      }
    } else if (stmt instanceof Select) {
      for (SelectBranch b: ((Select)stmt).branches) {
        if (b.var != null) {
          res.add(b.var);
        }
      }
    }
    return res;
  }
}
