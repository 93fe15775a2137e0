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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.google.common.collect.ImmutableList;

import exm.lgc.common.lang.Var;
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
 * Copying tree rewriter.
 *
 * The default behavior builds a fresh copy of every node it visits.  Passes
 * subclass it and override {@link #rewrite(Stmt)}, {@link #rewrite(Expr)} or
 * {@link #rewriteVar(Var)} to change parts of the tree.  A statement may be
 * rewritten to any number of statements, which are spliced into the
 * enclosing block.
 *
 * Input nodes are never modified: analysis results computed over them stay
 * valid until the caller discards them.
 */
public class AstRewriter implements ExprVisitor<Expr>, StmtVisitor<List<Stmt>> {

  public Function rewrite(Function f) {
    if (f.isNative()) {
      return f;
    }
    return f.withBody(rewrite(f.body()));
  }

  public Block rewrite(Block b) {
    List<Stmt> out = new ArrayList<Stmt>(b.size());
    for (Stmt s: b) {
      out.addAll(rewrite(s));
    }
    return new Block(out);
  }

  public List<Stmt> rewrite(Stmt s) {
    return s.accept(this);
  }

  public Expr rewrite(Expr e) {
    return e.accept(this);
  }

  /**
   * Hook to rename bindings, both where they're defined and used
   */
  protected Var rewriteVar(Var v) {
    return v;
  }

  private Expr rewriteOpt(Expr e) {
    return e == null ? null : rewrite(e);
  }

  private Var rewriteOptVar(Var v) {
    return v == null ? null : rewriteVar(v);
  }

  private List<Expr> rewriteAll(List<Expr> es) {
    List<Expr> res = new ArrayList<Expr>(es.size());
    for (Expr e: es) {
      res.add(rewrite(e));
    }
    return res;
  }

  private List<Var> rewriteVars(List<Var> vs) {
    List<Var> res = new ArrayList<Var>(vs.size());
    for (Var v: vs) {
      res.add(rewriteVar(v));
    }
    return res;
  }

  protected static List<Stmt> one(Stmt s) {
    return ImmutableList.of(s);
  }

  @Override
  public Expr visitLiteral(Literal e) {
    // Literals have no children or bindings, so sharing is safe
    return e;
  }

  @Override
  public Expr visitIdentifier(Identifier e) {
    return new Identifier(rewriteVar(e.var));
  }

  @Override
  public Expr visitBinaryOp(BinaryOp e) {
    return new BinaryOp(e.op, rewrite(e.left), rewrite(e.right), e.type());
  }

  @Override
  public Expr visitNot(Not e) {
    return new Not(rewrite(e.operand));
  }

  @Override
  public Expr visitCall(Call e) {
    return new Call(e.function, rewriteAll(e.args), e.type());
  }

  @Override
  public Expr visitIndex(Index e) {
    return new Index(rewrite(e.collection), rewrite(e.index), e.type());
  }

  @Override
  public Expr visitSlice(Slice e) {
    return new Slice(rewrite(e.collection), rewrite(e.start), rewrite(e.end));
  }

  @Override
  public Expr visitLength(Length e) {
    return new Length(rewrite(e.collection));
  }

  @Override
  public Expr visitContains(Contains e) {
    return new Contains(rewrite(e.collection), rewrite(e.value));
  }

  @Override
  public Expr visitFieldAccess(FieldAccess e) {
    return new FieldAccess(rewrite(e.object), e.field, e.type());
  }

  @Override
  public Expr visitListLiteral(ListLiteral e) {
    return new ListLiteral(rewriteAll(e.items), e.type());
  }

  @Override
  public Expr visitTupleLiteral(TupleLiteral e) {
    return new TupleLiteral(rewriteAll(e.items));
  }

  @Override
  public Expr visitRange(Range e) {
    return new Range(rewrite(e.start), rewrite(e.end));
  }

  @Override
  public Expr visitCopy(Copy e) {
    return new Copy(rewrite(e.value));
  }

  @Override
  public Expr visitGive(Exprs.Give e) {
    return new Exprs.Give(rewriteVar(e.var));
  }

  @Override
  public Expr visitNew(New e) {
    Map<String, Expr> fields = new LinkedHashMap<String, Expr>();
    for (Entry<String, Expr> f: e.fields.entrySet()) {
      fields.put(f.getKey(), rewrite(f.getValue()));
    }
    return new New(e.type(), fields);
  }

  @Override
  public Expr visitWithCapacity(WithCapacity e) {
    return new WithCapacity(e.type(), rewrite(e.capacity));
  }

  @Override
  public Expr visitOptionSome(OptionSome e) {
    return new OptionSome(rewrite(e.value));
  }

  @Override
  public Expr visitOptionNone(OptionNone e) {
    return new OptionNone(e.type());
  }

  @Override
  public Expr visitClosure(Closure e) {
    return new Closure(rewriteVars(e.params), rewriteVars(e.captures),
                       rewrite(e.body));
  }

  @Override
  public Expr visitInterpolatedString(InterpolatedString e) {
    return new InterpolatedString(rewriteAll(e.parts));
  }

  @Override
  public Expr visitSetOperation(SetOperation e) {
    return new SetOperation(e.op, rewrite(e.left), rewrite(e.right));
  }

  @Override
  public Expr visitEscape(Exprs.Escape e) {
    return new Exprs.Escape(e.language, e.code, e.type());
  }

  @Override
  public List<Stmt> visitLet(Let s) {
    return one(new Let(rewriteVar(s.var), rewrite(s.value)));
  }

  @Override
  public List<Stmt> visitSet(Stmts.Set s) {
    return one(new Stmts.Set(rewriteVar(s.target), rewrite(s.value)));
  }

  @Override
  public List<Stmt> visitSetIndex(SetIndex s) {
    return one(new SetIndex(rewrite(s.collection), rewrite(s.index),
                            rewrite(s.value)));
  }

  @Override
  public List<Stmt> visitSetField(SetField s) {
    return one(new SetField(rewrite(s.object), s.field, rewrite(s.value)));
  }

  @Override
  public List<Stmt> visitPush(Push s) {
    return one(new Push(rewrite(s.value), rewrite(s.collection)));
  }

  @Override
  public List<Stmt> visitPop(Pop s) {
    return one(new Pop(rewrite(s.collection), rewriteOptVar(s.into)));
  }

  @Override
  public List<Stmt> visitAdd(Add s) {
    return one(new Add(rewrite(s.value), rewrite(s.collection)));
  }

  @Override
  public List<Stmt> visitRemove(Remove s) {
    return one(new Remove(rewrite(s.value), rewrite(s.collection)));
  }

  @Override
  public List<Stmt> visitIf(If s) {
    return one(new If(rewrite(s.cond), rewrite(s.thenBlock),
                      rewrite(s.elseBlock)));
  }

  @Override
  public List<Stmt> visitWhile(While s) {
    return one(new While(rewrite(s.cond), rewrite(s.body),
                         rewriteOpt(s.decreasing)));
  }

  @Override
  public List<Stmt> visitRepeat(Repeat s) {
    return one(new Repeat(rewriteVar(s.var), rewrite(s.iterable),
                          rewrite(s.body)));
  }

  @Override
  public List<Stmt> visitReturn(Return s) {
    return one(new Return(rewriteOpt(s.value)));
  }

  @Override
  public List<Stmt> visitCall(CallStmt s) {
    return one(new CallStmt(s.function, rewriteAll(s.args)));
  }

  @Override
  public List<Stmt> visitShow(Show s) {
    return one(new Show(rewrite(s.value)));
  }

  @Override
  public List<Stmt> visitReadFrom(ReadFrom s) {
    return one(new ReadFrom(rewriteVar(s.into), s.source,
                            rewriteOpt(s.path)));
  }

  @Override
  public List<Stmt> visitWriteFile(WriteFile s) {
    return one(new WriteFile(rewrite(s.path), rewrite(s.content)));
  }

  @Override
  public List<Stmt> visitGive(Stmts.Give s) {
    return one(new Stmts.Give(rewrite(s.object), s.recipient));
  }

  @Override
  public List<Stmt> visitZone(Zone s) {
    return one(new Zone(s.name, rewriteOpt(s.capacity), rewrite(s.body)));
  }

  @Override
  public List<Stmt> visitConcurrent(Concurrent s) {
    return one(new Concurrent(rewrite(s.tasks)));
  }

  @Override
  public List<Stmt> visitParallel(Parallel s) {
    return one(new Parallel(rewrite(s.tasks)));
  }

  @Override
  public List<Stmt> visitLaunchTask(LaunchTask s) {
    return one(new LaunchTask(s.function, rewriteAll(s.args)));
  }

  @Override
  public List<Stmt> visitLaunchTaskWithHandle(LaunchTaskWithHandle s) {
    return one(new LaunchTaskWithHandle(rewriteVar(s.handle), s.function,
                                        rewriteAll(s.args)));
  }

  @Override
  public List<Stmt> visitStopTask(StopTask s) {
    return one(new StopTask(rewrite(s.handle)));
  }

  @Override
  public List<Stmt> visitCreatePipe(CreatePipe s) {
    return one(new CreatePipe(rewriteVar(s.var), s.elemType,
                              rewriteOpt(s.capacity)));
  }

  @Override
  public List<Stmt> visitSendPipe(SendPipe s) {
    return one(new SendPipe(rewrite(s.value), rewrite(s.pipe)));
  }

  @Override
  public List<Stmt> visitTrySendPipe(TrySendPipe s) {
    return one(new TrySendPipe(rewrite(s.value), rewrite(s.pipe),
                               rewriteOptVar(s.result)));
  }

  @Override
  public List<Stmt> visitReceivePipe(ReceivePipe s) {
    return one(new ReceivePipe(rewriteVar(s.var), rewrite(s.pipe)));
  }

  @Override
  public List<Stmt> visitTryReceivePipe(TryReceivePipe s) {
    return one(new TryReceivePipe(rewriteVar(s.var), rewrite(s.pipe)));
  }

  @Override
  public List<Stmt> visitSelect(Select s) {
    List<SelectBranch> branches = new ArrayList<SelectBranch>();
    for (SelectBranch b: s.branches) {
      if (b.isTimeout()) {
        branches.add(SelectBranch.timeout(rewrite(b.timeout),
                                          rewrite(b.body)));
      } else {
        branches.add(SelectBranch.receive(rewriteVar(b.var), rewrite(b.pipe),
                                          rewrite(b.body)));
      }
    }
    return one(new Select(branches));
  }

  @Override
  public List<Stmt> visitSleep(Sleep s) {
    return one(new Sleep(rewrite(s.millis)));
  }

  @Override
  public List<Stmt> visitMount(Mount s) {
    return one(new Mount(rewriteVar(s.var), rewrite(s.path)));
  }

  @Override
  public List<Stmt> visitListen(Listen s) {
    return one(new Listen(rewrite(s.address)));
  }

  @Override
  public List<Stmt> visitConnectTo(ConnectTo s) {
    return one(new ConnectTo(rewrite(s.address)));
  }

  @Override
  public List<Stmt> visitSendMessage(SendMessage s) {
    return one(new SendMessage(rewrite(s.message), rewrite(s.destination)));
  }

  @Override
  public List<Stmt> visitAwaitMessage(AwaitMessage s) {
    return one(new AwaitMessage(rewrite(s.source), rewriteVar(s.into)));
  }

  @Override
  public List<Stmt> visitSync(Sync s) {
    return one(new Sync(rewriteVar(s.var), rewrite(s.topic)));
  }

  @Override
  public List<Stmt> visitMergeCrdt(MergeCrdt s) {
    return one(new MergeCrdt(rewrite(s.source), rewrite(s.target)));
  }

  @Override
  public List<Stmt> visitIncreaseCrdt(IncreaseCrdt s) {
    return one(new IncreaseCrdt(rewrite(s.object), s.field,
                                rewrite(s.amount)));
  }

  @Override
  public List<Stmt> visitDecreaseCrdt(DecreaseCrdt s) {
    return one(new DecreaseCrdt(rewrite(s.object), s.field,
                                rewrite(s.amount)));
  }

  @Override
  public List<Stmt> visitAppendToSequence(AppendToSequence s) {
    return one(new AppendToSequence(rewrite(s.sequence), rewrite(s.value)));
  }

  @Override
  public List<Stmt> visitCheck(Check s) {
    return one(new Check(rewriteVar(s.subject), s.predicate,
                  rewriteOptVar(s.object), s.capability, s.sourceText));
  }

  @Override
  public List<Stmt> visitRuntimeAssert(RuntimeAssert s) {
    return one(new RuntimeAssert(rewrite(s.cond)));
  }

  @Override
  public List<Stmt> visitInspect(Inspect s) {
    List<InspectArm> arms = new ArrayList<InspectArm>();
    for (InspectArm arm: s.arms) {
      arms.add(new InspectArm(arm.variant, rewriteVars(arm.bindings),
                              rewrite(arm.body)));
    }
    return one(new Inspect(rewrite(s.target), arms));
  }

  @Override
  public List<Stmt> visitEscape(Stmts.Escape s) {
    return one(new Stmts.Escape(s.language, s.code));
  }

  /**
   * Rewriter that renames bindings according to a map
   */
  public static class Renamer extends AstRewriter {
    private final Map<Var, Var> renames;

    public Renamer(Map<Var, Var> renames) {
      this.renames = renames;
    }

    @Override
    protected Var rewriteVar(Var v) {
      Var renamed = renames.get(v);
      return renamed == null ? v : renamed;
    }
  }
}
