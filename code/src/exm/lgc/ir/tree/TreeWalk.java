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
package exm.lgc.ir.tree;

import java.util.ArrayList;
import java.util.List;

import exm.lgc.ir.tree.Exprs.Closure;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Stmts.Check;
import exm.lgc.ir.tree.Stmts.Return;
import exm.lgc.ir.tree.Stmts.Stmt;

/**
 * Generic pre-order traversal of the AST, independent of node kind.
 */
public class TreeWalk {

  /**
   * Top-down tree walk
   * @param prog
   * @param walker
   */
  public static void walk(Program prog, TreeWalker walker) {
    for (Function f: prog.functions()) {
      walk(f.body(), walker, true);
    }
  }

  /**
   * Walk pre-order
   * @param block
   * @param walker
   * @param recursive if false, don't visit nested blocks or closure bodies
   */
  public static void walk(Block block, TreeWalker walker, boolean recursive) {
    for (Stmt s: block) {
      walk(s, walker, recursive);
    }
  }

  public static void walk(Stmt stmt, TreeWalker walker, boolean recursive) {
    walker.visit(stmt);
    for (Expr e: stmt.targets()) {
      walk(e, walker, recursive);
    }
    for (Expr e: stmt.exprs()) {
      walk(e, walker, recursive);
    }
    if (recursive) {
      for (Block b: stmt.blocks()) {
        walk(b, walker, recursive);
      }
    }
  }

  public static void walk(Expr expr, TreeWalker walker, boolean recursive) {
    walker.visit(expr);
    for (Expr child: expr.children()) {
      walk(child, walker, recursive);
    }
    if (recursive && expr instanceof Closure) {
      walk(((Closure)expr).body, walker, recursive);
    }
  }

  /**
   * @return number of statement and expression nodes, used as a size metric
   */
  public static int countNodes(Block block) {
    NodeCounter counter = new NodeCounter();
    walk(block, counter, true);
    return counter.count;
  }

  /**
   * @return all security checks in pre-order
   */
  public static List<Check> findChecks(Program prog) {
    CheckFinder finder = new CheckFinder();
    walk(prog, finder);
    return finder.checks;
  }

  public static List<Check> findChecks(Block block) {
    CheckFinder finder = new CheckFinder();
    walk(block, finder, true);
    return finder.checks;
  }

  public static boolean containsCheck(Block block) {
    return !findChecks(block).isEmpty();
  }

  /**
   * @return true if the block can return from the enclosing function.
   *         Returns inside closure bodies don't count
   */
  public static boolean containsReturn(Block block) {
    for (Stmt s: block) {
      if (s instanceof Return) {
        return true;
      }
      for (Block b: s.blocks()) {
        if (containsReturn(b)) {
          return true;
        }
      }
    }
    return false;
  }

  public static abstract class TreeWalker {
    protected void visit(Stmt stmt) {
      // Nothing
    }

    protected void visit(Expr expr) {
      // Nothing
    }
  }

  private static class NodeCounter extends TreeWalker {
    int count = 0;

    @Override
    protected void visit(Stmt stmt) {
      count++;
    }

    @Override
    protected void visit(Expr expr) {
      count++;
    }
  }

  private static class CheckFinder extends TreeWalker {
    final List<Check> checks = new ArrayList<Check>();

    @Override
    protected void visit(Stmt stmt) {
      if (stmt instanceof Check) {
        checks.add((Check)stmt);
      }
    }
  }
}
