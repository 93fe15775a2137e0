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
package exm.lgc.ir.effects;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.Logging;
import exm.lgc.common.Settings;
import exm.lgc.common.exceptions.InvalidOptionException;
import exm.lgc.common.exceptions.LGCRuntimeError;
import exm.lgc.common.lang.Var;
import exm.lgc.common.lang.Var.VarKind;
import exm.lgc.ir.callgraph.CallGraph;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.ExprVisitor;
import exm.lgc.ir.tree.Exprs;
import exm.lgc.ir.tree.Exprs.BinaryOp;
import exm.lgc.ir.tree.Exprs.Call;
import exm.lgc.ir.tree.Exprs.Closure;
import exm.lgc.ir.tree.Exprs.Contains;
import exm.lgc.ir.tree.Exprs.Copy;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Exprs.FieldAccess;
import exm.lgc.ir.tree.Exprs.Identifier;
import exm.lgc.ir.tree.Exprs.Index;
import exm.lgc.ir.tree.Exprs.InterpolatedString;
import exm.lgc.ir.tree.Exprs.Length;
import exm.lgc.ir.tree.Exprs.ListLiteral;
import exm.lgc.ir.tree.Exprs.Literal;
import exm.lgc.ir.tree.Exprs.New;
import exm.lgc.ir.tree.Exprs.Not;
import exm.lgc.ir.tree.Exprs.OptionNone;
import exm.lgc.ir.tree.Exprs.OptionSome;
import exm.lgc.ir.tree.Exprs.Range;
import exm.lgc.ir.tree.Exprs.SetOperation;
import exm.lgc.ir.tree.Exprs.Slice;
import exm.lgc.ir.tree.Exprs.TupleLiteral;
import exm.lgc.ir.tree.Exprs.WithCapacity;
import exm.lgc.ir.tree.Function;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.StmtVisitor;
import exm.lgc.ir.tree.Stmts;
import exm.lgc.ir.tree.Stmts.Add;
import exm.lgc.ir.tree.Stmts.AppendToSequence;
import exm.lgc.ir.tree.Stmts.AwaitMessage;
import exm.lgc.ir.tree.Stmts.CallStmt;
import exm.lgc.ir.tree.Stmts.Check;
import exm.lgc.ir.tree.Stmts.Concurrent;
import exm.lgc.ir.tree.Stmts.ConnectTo;
import exm.lgc.ir.tree.Stmts.CreatePipe;
import exm.lgc.ir.tree.Stmts.DecreaseCrdt;
import exm.lgc.ir.tree.Stmts.If;
import exm.lgc.ir.tree.Stmts.IncreaseCrdt;
import exm.lgc.ir.tree.Stmts.Inspect;
import exm.lgc.ir.tree.Stmts.InspectArm;
import exm.lgc.ir.tree.Stmts.LaunchTask;
import exm.lgc.ir.tree.Stmts.LaunchTaskWithHandle;
import exm.lgc.ir.tree.Stmts.Let;
import exm.lgc.ir.tree.Stmts.Listen;
import exm.lgc.ir.tree.Stmts.MergeCrdt;
import exm.lgc.ir.tree.Stmts.Mount;
import exm.lgc.ir.tree.Stmts.Parallel;
import exm.lgc.ir.tree.Stmts.Pop;
import exm.lgc.ir.tree.Stmts.Push;
import exm.lgc.ir.tree.Stmts.ReadFrom;
import exm.lgc.ir.tree.Stmts.ReceivePipe;
import exm.lgc.ir.tree.Stmts.Remove;
import exm.lgc.ir.tree.Stmts.Repeat;
import exm.lgc.ir.tree.Stmts.Return;
import exm.lgc.ir.tree.Stmts.RuntimeAssert;
import exm.lgc.ir.tree.Stmts.Select;
import exm.lgc.ir.tree.Stmts.SelectBranch;
import exm.lgc.ir.tree.Stmts.SendMessage;
import exm.lgc.ir.tree.Stmts.SendPipe;
import exm.lgc.ir.tree.Stmts.SetField;
import exm.lgc.ir.tree.Stmts.SetIndex;
import exm.lgc.ir.tree.Stmts.Show;
import exm.lgc.ir.tree.Stmts.Sleep;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.Stmts.StopTask;
import exm.lgc.ir.tree.Stmts.Sync;
import exm.lgc.ir.tree.Stmts.TryReceivePipe;
import exm.lgc.ir.tree.Stmts.TrySendPipe;
import exm.lgc.ir.tree.Stmts.While;
import exm.lgc.ir.tree.Stmts.WriteFile;
import exm.lgc.ir.tree.Stmts.Zone;

/**
 * Effect inference.
 *
 * Classifies every statement and expression kind and computes a summary per
 * function by fixed point iteration over the call graph SCCs, leaves first.
 * Summaries only grow, and the lattice has finite height, so each SCC
 * converges.
 */
public class EffectAnalyzer {

  private final Logger logger;
  private final OwnershipOracle ownership;
  private final int maxIterations;
  private final int threads;

  public EffectAnalyzer(Logger logger, OwnershipOracle ownership,
                        int maxIterations, int threads) {
    this.logger = logger;
    this.ownership = ownership;
    this.maxIterations = maxIterations;
    this.threads = threads;
  }

  public static EffectAnalyzer fromSettings(Logger logger)
      throws InvalidOptionException {
    return new EffectAnalyzer(logger, new TypeOwnership(),
        Settings.getInt(Settings.EFFECTS_MAX_ITERATIONS),
        Settings.getInt(Settings.ANALYSIS_THREADS));
  }

  /**
   * Classify an expression against a finished environment
   */
  public EffectSet classifyExpr(Expr e, EffectEnv env) {
    return new Classifier(env).classify(e);
  }

  public EffectSet classifyStmt(Stmt s, EffectEnv env) {
    return new Classifier(env).classify(s);
  }

  public EffectSet classifyBlock(Block b, EffectEnv env) {
    return new Classifier(env).classify(b);
  }

  /**
   * Compute effect summaries for all functions in the program.
   * @return frozen environment
   */
  public EffectEnv analyzeProgram(Program program, CallGraph callGraph) {
    EffectEnv env = new EffectEnv();
    for (Function f: program.functions()) {
      env.declare(f.name(), f.params());
    }

    List<List<String>> sccs = callGraph.sccs();
    if (threads <= 1 || sccs.size() <= 1) {
      for (List<String> scc: sccs) {
        analyzeScc(program, scc, env);
      }
    } else {
      analyzeParallel(program, callGraph, env);
    }
    env.freeze();

    if (logger.isDebugEnabled()) {
      for (Function f: program.functions()) {
        logger.debug("Effect summary " + f.name() + ": " + env.get(f.name()));
      }
    }
    return env;
  }

  /**
   * Analyze SCCs in waves: an SCC is ready once every SCC it calls into is
   * published.  SCCs in the same wave are independent of each other.
   */
  private void analyzeParallel(final Program program, CallGraph callGraph,
                               final EffectEnv env) {
    List<List<String>> sccs = callGraph.sccs();
    List<Set<Integer>> deps = callGraph.sccDependencies();
    int[] levels = new int[sccs.size()];
    ListMultimap<Integer, Integer> waves = ArrayListMultimap.create();
    int maxLevel = 0;
    for (int i = 0; i < sccs.size(); i++) {
      int level = 0;
      for (int dep: deps.get(i)) {
        // Dependencies always precede dependents in leaves-first order
        level = Math.max(level, levels[dep] + 1);
      }
      levels[i] = level;
      maxLevel = Math.max(maxLevel, level);
      waves.put(level, i);
    }

    ExecutorService executor = Executors.newFixedThreadPool(threads,
        new ThreadFactoryBuilder().setNameFormat("lgc-effects-%d")
                                  .setDaemon(true).build());
    try {
      for (int level = 0; level <= maxLevel; level++) {
        List<Callable<Void>> tasks = new ArrayList<Callable<Void>>();
        for (int i: waves.get(level)) {
          final List<String> scc = sccs.get(i);
          tasks.add(new Callable<Void>() {
            @Override
            public Void call() {
              analyzeScc(program, scc, env);
              return null;
            }
          });
        }
        logger.trace("Effect analysis wave " + level + ": " + tasks.size() +
                     " SCCs");
        for (Future<Void> result: executor.invokeAll(tasks)) {
          result.get();
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LGCRuntimeError("Interrupted during effect analysis", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException)e.getCause();
      }
      throw new LGCRuntimeError("Effect analysis failed", e.getCause());
    } finally {
      executor.shutdown();
    }
  }

  /**
   * Iterate one SCC to its fixed point and publish the results.  In-progress
   * summaries stay private to this method until then.
   */
  private void analyzeScc(Program program, List<String> members,
                          EffectEnv env) {
    Map<String, EffectSet> current = new LinkedHashMap<String, EffectSet>();
    List<Function> bodies = new ArrayList<Function>();
    Set<Diagnostic> diags = new LinkedHashSet<Diagnostic>();
    for (String m: members) {
      Function f = program.lookupFunction(m);
      if (f == null || f.isNative()) {
        current.put(m, EffectSet.UNKNOWN);
        Logging.uniqueWarn("Effects approximated as unknown: native function "
                           + m);
        diags.add(new Diagnostic(Diagnostic.Kind.ANALYSIS_INCOMPLETE,
                                 "native function " + m));
      } else {
        current.put(m, EffectSet.PURE);
        bodies.add(f);
      }
    }

    Classifier classifier = new Classifier(env, current,
                              new HashSet<String>(members), diags);
    int iteration = 0;
    boolean changed;
    do {
      changed = false;
      iteration++;
      if (iteration > maxIterations) {
        String msg = "Effect fixed point for " + members + " did not " +
            "converge after " + maxIterations + " iterations: this is a " +
            "bug in the effect classification";
        logger.error(msg);
        diags.add(new Diagnostic(Diagnostic.Kind.ITERATION_CAP, msg));
        for (String m: members) {
          current.put(m, EffectSet.UNKNOWN);
        }
        break;
      }

      for (Function f: bodies) {
        EffectSet old = current.get(f.name());
        EffectSet updated = old.join(summarize(classifier.classify(f.body())));
        if (!updated.equals(old)) {
          if (logger.isTraceEnabled()) {
            logger.trace("Iteration " + iteration + " " + f.name() + ": " +
                         old + " => " + updated);
          }
          current.put(f.name(), updated);
          changed = true;
        }
      }
    } while (changed);

    env.publish(current);
    env.addDiagnostics(diags);
  }

  /**
   * Project a function body's effects onto what callers can observe:
   * parameters and globals.  Locals are dropped.
   */
  public static EffectSet summarize(EffectSet body) {
    EffectSet.Builder b = EffectSet.builder();
    for (Var v: body.reads()) {
      if (v.visibleToCaller()) {
        b.read(v);
      }
    }
    for (Var v: body.writes()) {
      if (v.visibleToCaller()) {
        if (body.commutativeWrites().contains(v)) {
          b.commutativeWrite(v);
        } else {
          b.write(v);
        }
      }
    }
    for (Var v: body.consumes()) {
      if (v.visibleToCaller()) {
        b.consume(v);
      }
    }
    if (body.allocates()) b.alloc();
    if (body.hasIO()) b.io();
    if (body.hasSecurityCheck()) b.securityCheck();
    if (body.mayDiverge()) b.diverge();
    if (body.isUnknown()) b.unknown();
    return b.build();
  }

  /**
   * The classification table.  One rule per node kind, no default.
   */
  private class Classifier implements ExprVisitor<EffectSet>,
                                      StmtVisitor<EffectSet> {
    private final EffectEnv env;
    /** Summaries of the SCC being iterated, null outside fixed point */
    private final Map<String, EffectSet> inProgress;
    private final Set<String> scc;
    private final Set<Diagnostic> diags;

    Classifier(EffectEnv env) {
      this(env, null, Collections.<String>emptySet(), null);
    }

    Classifier(EffectEnv env, Map<String, EffectSet> inProgress,
               Set<String> scc, Set<Diagnostic> diags) {
      this.env = env;
      this.inProgress = inProgress;
      this.scc = scc;
      this.diags = diags;
    }

    EffectSet classify(Expr e) {
      return e.accept(this);
    }

    EffectSet classify(Stmt s) {
      return s.accept(this);
    }

    EffectSet classify(Block b) {
      EffectSet.Builder res = EffectSet.builder();
      for (Stmt s: b) {
        res.join(classify(s));
      }
      return res.build();
    }

    private void incomplete(String msg) {
      // Analyses are rederived before every pass
      Logging.uniqueWarn("Effects approximated as unknown: " + msg);
      if (diags != null) {
        diags.add(new Diagnostic(Diagnostic.Kind.ANALYSIS_INCOMPLETE, msg));
      }
    }

    private EffectSet.Builder exprs(List<Expr> es) {
      EffectSet.Builder b = EffectSet.builder();
      for (Expr e: es) {
        b.join(classify(e));
      }
      return b;
    }

    private EffectSet.Builder exprs(Expr ...es) {
      EffectSet.Builder b = EffectSet.builder();
      for (Expr e: es) {
        if (e != null) {
          b.join(classify(e));
        }
      }
      return b;
    }

    /**
     * Write through an access path: evaluates the path and modifies its
     * root binding
     */
    private EffectSet.Builder target(EffectSet.Builder b, Expr path,
                                     boolean commutative) {
      b.join(classify(path));
      Var root = Exprs.rootVar(path);
      if (root != null) {
        if (commutative) {
          b.commutativeWrite(root);
        } else {
          b.write(root);
        }
      }
      return b;
    }

    private EffectSet.Builder writeOpt(EffectSet.Builder b, Var v) {
      if (v != null) {
        b.write(v);
      }
      return b;
    }

    /**
     * Apply a callee summary at a call site, mapping parameter effects onto
     * the bindings passed as arguments
     */
    private EffectSet.Builder callSummary(EffectSet.Builder b, String function,
                                          List<Expr> args) {
      EffectSet summary;
      if (scc.contains(function)) {
        // Recursion may not terminate
        b.diverge();
        summary = inProgress.get(function);
      } else {
        summary = env.get(function);
      }
      List<Var> params = env.params(function);
      if (summary == null || params == null) {
        incomplete("call to unknown function " + function);
        return b.unknown();
      }

      Map<Var, Var> bound = new LinkedHashMap<Var, Var>();
      for (int i = 0; i < params.size() && i < args.size(); i++) {
        Var root = Exprs.rootVar(args.get(i));
        if (root != null) {
          bound.put(params.get(i), root);
        }
      }

      for (Var v: summary.reads()) {
        Var mapped = mapToCaller(v, bound);
        if (mapped != null) b.read(mapped);
      }
      for (Var v: summary.writes()) {
        Var mapped = mapToCaller(v, bound);
        if (mapped != null) {
          if (summary.commutativeWrites().contains(v)) {
            b.commutativeWrite(mapped);
          } else {
            b.write(mapped);
          }
        }
      }
      for (Var v: summary.consumes()) {
        Var mapped = mapToCaller(v, bound);
        if (mapped != null) b.consume(mapped);
      }
      if (summary.allocates()) b.alloc();
      if (summary.hasIO()) b.io();
      if (summary.hasSecurityCheck()) b.securityCheck();
      if (summary.mayDiverge()) b.diverge();
      if (summary.isUnknown()) b.unknown();
      return b;
    }

    /**
     * @return caller binding for a callee parameter or global, null if the
     *         effect isn't visible at the call site
     */
    private Var mapToCaller(Var calleeVar, Map<Var, Var> bound) {
      if (calleeVar.kind() == VarKind.PARAMETER) {
        return bound.get(calleeVar);
      } else if (calleeVar.kind() == VarKind.GLOBAL) {
        return calleeVar;
      }
      return null;
    }

    /**
     * Ownership transfer of a binding consumes it, unless it's copied
     */
    private EffectSet.Builder give(EffectSet.Builder b, Var v) {
      b.read(v);
      if (ownership.isMoveOnly(v)) {
        b.consume(v);
      }
      return b;
    }

    @Override
    public EffectSet visitLiteral(Literal e) {
      return EffectSet.PURE;
    }

    @Override
    public EffectSet visitIdentifier(Identifier e) {
      return EffectSet.read(e.var);
    }

    @Override
    public EffectSet visitBinaryOp(BinaryOp e) {
      return exprs(e.left, e.right).build();
    }

    @Override
    public EffectSet visitNot(Not e) {
      return classify(e.operand);
    }

    @Override
    public EffectSet visitCall(Call e) {
      return callSummary(exprs(e.args), e.function, e.args).build();
    }

    @Override
    public EffectSet visitIndex(Index e) {
      return exprs(e.collection, e.index).build();
    }

    @Override
    public EffectSet visitSlice(Slice e) {
      return exprs(e.collection, e.start, e.end).alloc().build();
    }

    @Override
    public EffectSet visitLength(Length e) {
      return classify(e.collection);
    }

    @Override
    public EffectSet visitContains(Contains e) {
      return exprs(e.collection, e.value).build();
    }

    @Override
    public EffectSet visitFieldAccess(FieldAccess e) {
      return classify(e.object);
    }

    @Override
    public EffectSet visitListLiteral(ListLiteral e) {
      return exprs(e.items).alloc().build();
    }

    @Override
    public EffectSet visitTupleLiteral(TupleLiteral e) {
      return exprs(e.items).alloc().build();
    }

    @Override
    public EffectSet visitRange(Range e) {
      return exprs(e.start, e.end).build();
    }

    @Override
    public EffectSet visitCopy(Copy e) {
      return exprs(e.value).alloc().build();
    }

    @Override
    public EffectSet visitGive(Exprs.Give e) {
      return give(EffectSet.builder(), e.var).build();
    }

    @Override
    public EffectSet visitNew(New e) {
      return exprs(ImmutableList.copyOf(e.fields.values())).alloc().build();
    }

    @Override
    public EffectSet visitWithCapacity(WithCapacity e) {
      return exprs(e.capacity).alloc().build();
    }

    @Override
    public EffectSet visitOptionSome(OptionSome e) {
      return classify(e.value);
    }

    @Override
    public EffectSet visitOptionNone(OptionNone e) {
      return EffectSet.PURE;
    }

    @Override
    public EffectSet visitClosure(Closure e) {
      // Creating the closure captures bindings, the body runs later
      EffectSet.Builder b = EffectSet.builder().alloc();
      for (Var capture: e.captures) {
        b.read(capture);
      }
      return b.build();
    }

    @Override
    public EffectSet visitInterpolatedString(InterpolatedString e) {
      return exprs(e.parts).alloc().build();
    }

    @Override
    public EffectSet visitSetOperation(SetOperation e) {
      return exprs(e.left, e.right).alloc().build();
    }

    @Override
    public EffectSet visitEscape(Exprs.Escape e) {
      incomplete("embedded " + e.language + " expression");
      return EffectSet.UNKNOWN;
    }

    @Override
    public EffectSet visitLet(Let s) {
      return exprs(s.value).write(s.var).build();
    }

    @Override
    public EffectSet visitSet(Stmts.Set s) {
      return exprs(s.value).write(s.target).build();
    }

    @Override
    public EffectSet visitSetIndex(SetIndex s) {
      return target(exprs(s.index, s.value), s.collection, false).build();
    }

    @Override
    public EffectSet visitSetField(SetField s) {
      return target(exprs(s.value), s.object, false).build();
    }

    @Override
    public EffectSet visitPush(Push s) {
      return target(exprs(s.value), s.collection, false).build();
    }

    @Override
    public EffectSet visitPop(Pop s) {
      return writeOpt(target(EffectSet.builder(), s.collection, false),
                      s.into).build();
    }

    @Override
    public EffectSet visitAdd(Add s) {
      return target(exprs(s.value), s.collection, false).build();
    }

    @Override
    public EffectSet visitRemove(Remove s) {
      return target(exprs(s.value), s.collection, false).build();
    }

    @Override
    public EffectSet visitIf(If s) {
      return exprs(s.cond).join(classify(s.thenBlock))
                          .join(classify(s.elseBlock)).build();
    }

    @Override
    public EffectSet visitWhile(While s) {
      EffectSet.Builder b = exprs(s.cond).join(classify(s.body));
      if (s.decreasing == null) {
        // No termination measure
        b.diverge();
      } else {
        b.join(classify(s.decreasing));
      }
      return b.build();
    }

    @Override
    public EffectSet visitRepeat(Repeat s) {
      return exprs(s.iterable).write(s.var).join(classify(s.body)).build();
    }

    @Override
    public EffectSet visitReturn(Return s) {
      return exprs(s.value).build();
    }

    @Override
    public EffectSet visitCall(CallStmt s) {
      return callSummary(exprs(s.args), s.function, s.args).build();
    }

    @Override
    public EffectSet visitShow(Show s) {
      return exprs(s.value).io().build();
    }

    @Override
    public EffectSet visitReadFrom(ReadFrom s) {
      return exprs(s.path).write(s.into).io().build();
    }

    @Override
    public EffectSet visitWriteFile(WriteFile s) {
      return exprs(s.path, s.content).io().build();
    }

    @Override
    public EffectSet visitGive(Stmts.Give s) {
      EffectSet.Builder b;
      if (s.object instanceof Identifier) {
        b = give(EffectSet.builder(), ((Identifier)s.object).var);
      } else {
        b = exprs(s.object);
      }
      return callSummary(b, s.recipient,
                         ImmutableList.of(s.object)).build();
    }

    @Override
    public EffectSet visitZone(Zone s) {
      return exprs(s.capacity).alloc().join(classify(s.body)).build();
    }

    @Override
    public EffectSet visitConcurrent(Concurrent s) {
      return EffectSet.builder().join(classify(s.tasks)).io().build();
    }

    @Override
    public EffectSet visitParallel(Parallel s) {
      return EffectSet.builder().join(classify(s.tasks)).io().build();
    }

    @Override
    public EffectSet visitLaunchTask(LaunchTask s) {
      return callSummary(exprs(s.args), s.function, s.args).io().build();
    }

    @Override
    public EffectSet visitLaunchTaskWithHandle(LaunchTaskWithHandle s) {
      return callSummary(exprs(s.args), s.function, s.args)
                .write(s.handle).io().build();
    }

    @Override
    public EffectSet visitStopTask(StopTask s) {
      return exprs(s.handle).io().build();
    }

    @Override
    public EffectSet visitCreatePipe(CreatePipe s) {
      return exprs(s.capacity).alloc().write(s.var).build();
    }

    @Override
    public EffectSet visitSendPipe(SendPipe s) {
      return exprs(s.value, s.pipe).io().build();
    }

    @Override
    public EffectSet visitTrySendPipe(TrySendPipe s) {
      return writeOpt(exprs(s.value, s.pipe).io(), s.result).build();
    }

    @Override
    public EffectSet visitReceivePipe(ReceivePipe s) {
      return exprs(s.pipe).write(s.var).io().build();
    }

    @Override
    public EffectSet visitTryReceivePipe(TryReceivePipe s) {
      return exprs(s.pipe).write(s.var).io().build();
    }

    @Override
    public EffectSet visitSelect(Select s) {
      EffectSet.Builder b = EffectSet.builder().io();
      for (SelectBranch branch: s.branches) {
        if (branch.isTimeout()) {
          b.join(classify(branch.timeout));
        } else {
          b.join(classify(branch.pipe)).write(branch.var);
        }
        b.join(classify(branch.body));
      }
      return b.build();
    }

    @Override
    public EffectSet visitSleep(Sleep s) {
      return exprs(s.millis).io().build();
    }

    @Override
    public EffectSet visitMount(Mount s) {
      return exprs(s.path).write(s.var).io().build();
    }

    @Override
    public EffectSet visitListen(Listen s) {
      return exprs(s.address).io().build();
    }

    @Override
    public EffectSet visitConnectTo(ConnectTo s) {
      return exprs(s.address).io().build();
    }

    @Override
    public EffectSet visitSendMessage(SendMessage s) {
      return exprs(s.message, s.destination).io().build();
    }

    @Override
    public EffectSet visitAwaitMessage(AwaitMessage s) {
      return exprs(s.source).write(s.into).io().build();
    }

    @Override
    public EffectSet visitSync(Sync s) {
      return exprs(s.topic).write(s.var).io().build();
    }

    @Override
    public EffectSet visitMergeCrdt(MergeCrdt s) {
      return target(exprs(s.source), s.target, true).build();
    }

    @Override
    public EffectSet visitIncreaseCrdt(IncreaseCrdt s) {
      return target(exprs(s.amount), s.object, true).build();
    }

    @Override
    public EffectSet visitDecreaseCrdt(DecreaseCrdt s) {
      return target(exprs(s.amount), s.object, true).build();
    }

    @Override
    public EffectSet visitAppendToSequence(AppendToSequence s) {
      return target(exprs(s.value), s.sequence, true).build();
    }

    @Override
    public EffectSet visitCheck(Check s) {
      // Always a security check, whatever else the guard touches
      EffectSet.Builder b = EffectSet.builder().securityCheck();
      b.read(s.subject);
      if (s.object != null) {
        b.read(s.object);
      }
      return b.build();
    }

    @Override
    public EffectSet visitRuntimeAssert(RuntimeAssert s) {
      // May abort instead of completing
      return exprs(s.cond).diverge().build();
    }

    @Override
    public EffectSet visitInspect(Inspect s) {
      EffectSet.Builder b = exprs(s.target);
      for (InspectArm arm: s.arms) {
        for (Var binding: arm.bindings) {
          b.write(binding);
        }
        b.join(classify(arm.body));
      }
      return b.build();
    }

    @Override
    public EffectSet visitEscape(Stmts.Escape s) {
      incomplete("embedded " + s.language + " block");
      return EffectSet.UNKNOWN;
    }
  }
}
