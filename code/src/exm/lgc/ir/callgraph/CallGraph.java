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
package exm.lgc.ir.callgraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import exm.lgc.common.exceptions.LGCRuntimeError;
import exm.lgc.common.util.StackLite;
import exm.lgc.ir.tree.Exprs.Call;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Function;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts;
import exm.lgc.ir.tree.Stmts.CallStmt;
import exm.lgc.ir.tree.Stmts.LaunchTask;
import exm.lgc.ir.tree.Stmts.LaunchTaskWithHandle;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.TreeWalk;
import exm.lgc.ir.tree.TreeWalk.TreeWalker;

/**
 * Call graph of a program with its strongly connected components.
 *
 * SCCs are ordered leaves-first: every SCC comes after all SCCs it calls
 * into.  The same decomposition drives the effect fixed point and the
 * order in which range summaries are computed.
 */
public class CallGraph {
  private final List<String> functions;
  private final SetMultimap<String, String> edges;
  private final Set<String> natives;
  private final List<List<String>> sccs;
  private final Map<String, Integer> sccIndex;

  /**
   * Construct from an externally computed decomposition
   * @param functions all functions, in program order
   * @param edges caller to callee.  Callees may include unknown functions
   * @param natives functions without a body
   * @param sccs components, leaves first
   */
  public CallGraph(List<String> functions, SetMultimap<String, String> edges,
                   Set<String> natives, List<List<String>> sccs) {
    this.functions = ImmutableList.copyOf(functions);
    this.edges = LinkedHashMultimap.create(edges);
    this.natives = Collections.unmodifiableSet(new HashSet<String>(natives));
    List<List<String>> sccCopy = new ArrayList<List<String>>();
    this.sccIndex = new HashMap<String, Integer>();
    for (List<String> scc: sccs) {
      for (String member: scc) {
        if (sccIndex.put(member, sccCopy.size()) != null) {
          throw new LGCRuntimeError("Function " + member +
                                    " in more than one SCC");
        }
      }
      sccCopy.add(ImmutableList.copyOf(scc));
    }
    for (String f: functions) {
      if (!sccIndex.containsKey(f)) {
        throw new LGCRuntimeError("Function " + f + " not in any SCC");
      }
    }
    this.sccs = Collections.unmodifiableList(sccCopy);
  }

  /**
   * Build the call graph from direct calls in the program: call expressions
   * and statements, task launches and give recipients, including those in
   * closure bodies.
   */
  public static CallGraph build(Program program) {
    List<String> functions = new ArrayList<String>();
    final SetMultimap<String, String> edges = LinkedHashMultimap.create();
    Set<String> natives = new HashSet<String>();
    for (final Function f: program.functions()) {
      functions.add(f.name());
      if (f.isNative()) {
        natives.add(f.name());
        continue;
      }
      TreeWalk.walk(f.body(), new TreeWalker() {
        @Override
        protected void visit(Stmt stmt) {
          if (stmt instanceof CallStmt) {
            edges.put(f.name(), ((CallStmt)stmt).function);
          } else if (stmt instanceof LaunchTask) {
            edges.put(f.name(), ((LaunchTask)stmt).function);
          } else if (stmt instanceof LaunchTaskWithHandle) {
            edges.put(f.name(), ((LaunchTaskWithHandle)stmt).function);
          } else if (stmt instanceof Stmts.Give) {
            edges.put(f.name(), ((Stmts.Give)stmt).recipient);
          }
        }

        @Override
        protected void visit(Expr expr) {
          if (expr instanceof Call) {
            edges.put(f.name(), ((Call)expr).function);
          }
        }
      }, true);
    }
    return new CallGraph(functions, edges, natives,
                         tarjan(functions, edges));
  }

  /**
   * Tarjan's algorithm.  It emits each SCC only after all SCCs reachable
   * from it, which is exactly leaves-first order.
   */
  private static List<List<String>> tarjan(List<String> functions,
                                           SetMultimap<String, String> edges) {
    TarjanState state = new TarjanState(new HashSet<String>(functions), edges);
    for (String f: functions) {
      if (!state.index.containsKey(f)) {
        state.strongConnect(f);
      }
    }
    return state.result;
  }

  private static class TarjanState {
    final Set<String> known;
    final SetMultimap<String, String> edges;
    final Map<String, Integer> index = new HashMap<String, Integer>();
    final Map<String, Integer> lowLink = new HashMap<String, Integer>();
    final StackLite<String> stack = new StackLite<String>();
    final Set<String> onStack = new HashSet<String>();
    final List<List<String>> result = new ArrayList<List<String>>();
    int nextIndex = 0;

    TarjanState(Set<String> known, SetMultimap<String, String> edges) {
      this.known = known;
      this.edges = edges;
    }

    /**
     * Visit everything reachable from root.  Uses an explicit stack of
     * frames since generated programs can have very long call chains.
     */
    void strongConnect(String root) {
      StackLite<Frame> work = new StackLite<Frame>();
      enter(root, work);
      while (!work.isEmpty()) {
        Frame top = work.peek();
        if (top.callees.hasNext()) {
          String w = top.callees.next();
          if (!known.contains(w)) {
            // Unknown callee, not part of the program
            continue;
          }
          if (!index.containsKey(w)) {
            enter(w, work);
          } else if (onStack.contains(w)) {
            lowLink.put(top.node, Math.min(lowLink.get(top.node),
                                           index.get(w)));
          }
        } else {
          work.pop();
          String v = top.node;
          if (lowLink.get(v).equals(index.get(v))) {
            popComponent(v);
          }
          if (!work.isEmpty()) {
            String caller = work.peek().node;
            lowLink.put(caller, Math.min(lowLink.get(caller),
                                         lowLink.get(v)));
          }
        }
      }
    }

    private void enter(String v, StackLite<Frame> work) {
      index.put(v, nextIndex);
      lowLink.put(v, nextIndex);
      nextIndex++;
      stack.push(v);
      onStack.add(v);
      work.push(new Frame(v, edges.get(v).iterator()));
    }

    private void popComponent(String v) {
      List<String> scc = new ArrayList<String>();
      String w;
      do {
        w = stack.pop();
        onStack.remove(w);
        scc.add(w);
      } while (!w.equals(v));
      Collections.reverse(scc);
      result.add(scc);
    }
  }

  private static class Frame {
    final String node;
    final Iterator<String> callees;

    Frame(String node, Iterator<String> callees) {
      this.node = node;
      this.callees = callees;
    }
  }

  public List<String> functions() {
    return functions;
  }

  /**
   * @return SCCs, leaves first
   */
  public List<List<String>> sccs() {
    return sccs;
  }

  /**
   * @return index into {@link #sccs()}, or -1 if not a program function
   */
  public int sccOf(String function) {
    Integer i = sccIndex.get(function);
    return i == null ? -1 : i;
  }

  public Set<String> callees(String function) {
    return Collections.unmodifiableSet(edges.get(function));
  }

  public boolean isNative(String function) {
    return natives.contains(function);
  }

  public boolean isKnown(String function) {
    return sccIndex.containsKey(function);
  }

  /**
   * @return true if the function can call itself, directly or indirectly
   */
  public boolean isRecursive(String function) {
    int i = sccOf(function);
    if (i < 0) {
      return false;
    }
    return sccs.get(i).size() > 1 || edges.containsEntry(function, function);
  }

  /**
   * @return all known functions reachable through one or more calls
   */
  public Set<String> reachableFrom(String function) {
    Set<String> visited = new LinkedHashSet<String>();
    Deque<String> work = new ArrayDeque<String>();
    work.add(function);
    while (!work.isEmpty()) {
      String curr = work.remove();
      for (String callee: edges.get(curr)) {
        if (isKnown(callee) && visited.add(callee)) {
          work.add(callee);
        }
      }
    }
    return visited;
  }

  /**
   * @return for each SCC, the indices of the other SCCs it calls into.
   *         All of them are lower than the SCC's own index
   */
  public List<Set<Integer>> sccDependencies() {
    List<Set<Integer>> deps = new ArrayList<Set<Integer>>(sccs.size());
    for (int i = 0; i < sccs.size(); i++) {
      Set<Integer> d = new LinkedHashSet<Integer>();
      for (String member: sccs.get(i)) {
        for (String callee: edges.get(member)) {
          int j = sccOf(callee);
          if (j >= 0 && j != i) {
            d.add(j);
          }
        }
      }
      deps.add(Collections.unmodifiableSet(d));
    }
    return deps;
  }

  /**
   * @return true if both functions belong to the same SCC
   */
  public boolean sameScc(String f1, String f2) {
    int i = sccOf(f1);
    return i >= 0 && i == sccOf(f2);
  }

  @Override
  public String toString() {
    return "CallGraph" + sccs;
  }
}
