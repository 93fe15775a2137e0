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
import java.util.Map.Entry;

import org.apache.commons.lang3.StringEscapeUtils;
import org.apache.commons.lang3.StringUtils;

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
 * Render the AST as indented pseudo-code for logs and test failures
 */
public class AstPrinter implements ExprVisitor<String>, StmtVisitor<Void> {
  private static final String INDENT = "  ";

  private final StringBuilder sb = new StringBuilder();
  private String indent = "";

  public static String print(Program prog) {
    AstPrinter p = new AstPrinter();
    for (Var g: prog.globals()) {
      p.sb.append("global " + g.name() + ": " + g.type() + "\n");
    }
    for (Function f: prog.functions()) {
      p.printFunction(f);
    }
    return p.sb.toString();
  }

  public static String print(Function f) {
    AstPrinter p = new AstPrinter();
    p.printFunction(f);
    return p.sb.toString();
  }

  public static String print(Block b) {
    AstPrinter p = new AstPrinter();
    p.printStmts(b);
    return p.sb.toString();
  }

  public static String print(Stmt s) {
    AstPrinter p = new AstPrinter();
    s.accept(p);
    return p.sb.toString().trim();
  }

  public static String print(Expr e) {
    return e.accept(new AstPrinter());
  }

  private void printFunction(Function f) {
    List<String> params = new ArrayList<String>();
    for (Var p: f.params()) {
      params.add(p.name() + ": " + p.type());
    }
    sb.append(f.isNative() ? "native " : "")
      .append("function " + f.name() + "(" + StringUtils.join(params, ", ") +
              ") -> " + f.returnType());
    if (f.isNative()) {
      sb.append("\n");
      return;
    }
    sb.append(" {\n");
    indented(f.body());
    sb.append("}\n");
  }

  private void printStmts(Block b) {
    for (Stmt s: b) {
      s.accept(this);
    }
  }

  private void indented(Block b) {
    String old = indent;
    indent = indent + INDENT;
    printStmts(b);
    indent = old;
  }

  private void line(String text) {
    sb.append(indent).append(text).append("\n");
  }

  private void open(String header, Block body) {
    line(header + " {");
    indented(body);
    line("}");
  }

  private String exprs(List<Expr> es) {
    List<String> strs = new ArrayList<String>(es.size());
    for (Expr e: es) {
      strs.add(e.accept(this));
    }
    return StringUtils.join(strs, ", ");
  }

  private String operand(Expr e) {
    String s = e.accept(this);
    if (e instanceof BinaryOp) {
      return "(" + s + ")";
    }
    return s;
  }

  @Override
  public String visitLiteral(Literal e) {
    if (e.value == null) {
      return "nothing";
    } else if (e.value instanceof String) {
      return "\"" + StringEscapeUtils.escapeJava((String)e.value) + "\"";
    }
    return e.value.toString();
  }

  @Override
  public String visitIdentifier(Identifier e) {
    return e.var.name();
  }

  @Override
  public String visitBinaryOp(BinaryOp e) {
    return operand(e.left) + " " + e.op.symbol + " " + operand(e.right);
  }

  @Override
  public String visitNot(Not e) {
    return "not " + operand(e.operand);
  }

  @Override
  public String visitCall(Call e) {
    return e.function + "(" + exprs(e.args) + ")";
  }

  @Override
  public String visitIndex(Index e) {
    return operand(e.collection) + "[" + e.index.accept(this) + "]";
  }

  @Override
  public String visitSlice(Slice e) {
    return operand(e.collection) + "[" + e.start.accept(this) + ".." +
                e.end.accept(this) + "]";
  }

  @Override
  public String visitLength(Length e) {
    return "length(" + e.collection.accept(this) + ")";
  }

  @Override
  public String visitContains(Contains e) {
    return "contains(" + e.collection.accept(this) + ", " +
                        e.value.accept(this) + ")";
  }

  @Override
  public String visitFieldAccess(FieldAccess e) {
    return operand(e.object) + "." + e.field;
  }

  @Override
  public String visitListLiteral(ListLiteral e) {
    return "[" + exprs(e.items) + "]";
  }

  @Override
  public String visitTupleLiteral(TupleLiteral e) {
    return "(" + exprs(e.items) + ")";
  }

  @Override
  public String visitRange(Range e) {
    return "range(" + e.start.accept(this) + ", " + e.end.accept(this) + ")";
  }

  @Override
  public String visitCopy(Copy e) {
    return "copy(" + e.value.accept(this) + ")";
  }

  @Override
  public String visitGive(Exprs.Give e) {
    return "give " + e.var.name();
  }

  @Override
  public String visitNew(New e) {
    List<String> fields = new ArrayList<String>();
    for (Entry<String, Expr> f: e.fields.entrySet()) {
      fields.add(f.getKey() + ": " + f.getValue().accept(this));
    }
    return "new " + e.type() + "{" + StringUtils.join(fields, ", ") + "}";
  }

  @Override
  public String visitWithCapacity(WithCapacity e) {
    return "new " + e.type() + " with capacity " + e.capacity.accept(this);
  }

  @Override
  public String visitOptionSome(OptionSome e) {
    return "some(" + e.value.accept(this) + ")";
  }

  @Override
  public String visitOptionNone(OptionNone e) {
    return "none";
  }

  @Override
  public String visitClosure(Closure e) {
    AstPrinter bodyPrinter = new AstPrinter();
    bodyPrinter.indent = indent + INDENT;
    bodyPrinter.printStmts(e.body);
    return "closure(" + StringUtils.join(e.params, ", ") + ") captures " +
        e.captures + " {\n" + bodyPrinter.sb + indent + "}";
  }

  @Override
  public String visitInterpolatedString(InterpolatedString e) {
    return "interpolate(" + exprs(e.parts) + ")";
  }

  @Override
  public String visitSetOperation(SetOperation e) {
    return operand(e.left) + " " + e.op.name().toLowerCase() + " " +
           operand(e.right);
  }

  @Override
  public String visitEscape(Exprs.Escape e) {
    return "escape " + e.language + " \"" +
           StringEscapeUtils.escapeJava(e.code) + "\"";
  }

  @Override
  public Void visitLet(Let s) {
    line("let " + s.var.name() + " = " + s.value.accept(this));
    return null;
  }

  @Override
  public Void visitSet(Stmts.Set s) {
    line("set " + s.target.name() + " = " + s.value.accept(this));
    return null;
  }

  @Override
  public Void visitSetIndex(SetIndex s) {
    line("set " + operand(s.collection) + "[" + s.index.accept(this) +
         "] = " + s.value.accept(this));
    return null;
  }

  @Override
  public Void visitSetField(SetField s) {
    line("set " + operand(s.object) + "." + s.field + " = " +
         s.value.accept(this));
    return null;
  }

  @Override
  public Void visitPush(Push s) {
    line("push " + s.value.accept(this) + " to " + s.collection.accept(this));
    return null;
  }

  @Override
  public Void visitPop(Pop s) {
    line("pop from " + s.collection.accept(this) +
         (s.into == null ? "" : " into " + s.into.name()));
    return null;
  }

  @Override
  public Void visitAdd(Add s) {
    line("add " + s.value.accept(this) + " to " + s.collection.accept(this));
    return null;
  }

  @Override
  public Void visitRemove(Remove s) {
    line("remove " + s.value.accept(this) + " from " +
         s.collection.accept(this));
    return null;
  }

  @Override
  public Void visitIf(If s) {
    line("if " + s.cond.accept(this) + " {");
    indented(s.thenBlock);
    if (!s.elseBlock.isEmpty()) {
      line("} else {");
      indented(s.elseBlock);
    }
    line("}");
    return null;
  }

  @Override
  public Void visitWhile(While s) {
    String header = "while " + s.cond.accept(this);
    if (s.decreasing != null) {
      header += " decreasing " + s.decreasing.accept(this);
    }
    open(header, s.body);
    return null;
  }

  @Override
  public Void visitRepeat(Repeat s) {
    open("repeat " + s.var.name() + " in " + s.iterable.accept(this), s.body);
    return null;
  }

  @Override
  public Void visitReturn(Return s) {
    line(s.value == null ? "return" : "return " + s.value.accept(this));
    return null;
  }

  @Override
  public Void visitCall(CallStmt s) {
    line("call " + s.function + "(" + exprs(s.args) + ")");
    return null;
  }

  @Override
  public Void visitShow(Show s) {
    line("show " + s.value.accept(this));
    return null;
  }

  @Override
  public Void visitReadFrom(ReadFrom s) {
    line("read " + s.into.name() + " from " +
        (s.path == null ? "console" : "file " + s.path.accept(this)));
    return null;
  }

  @Override
  public Void visitWriteFile(WriteFile s) {
    line("write " + s.content.accept(this) + " to file " +
         s.path.accept(this));
    return null;
  }

  @Override
  public Void visitGive(Stmts.Give s) {
    line("give " + s.object.accept(this) + " to " + s.recipient);
    return null;
  }

  @Override
  public Void visitZone(Zone s) {
    open("zone " + s.name + (s.capacity == null ? "" :
                    " of size " + s.capacity.accept(this)), s.body);
    return null;
  }

  @Override
  public Void visitConcurrent(Concurrent s) {
    open("concurrent", s.tasks);
    return null;
  }

  @Override
  public Void visitParallel(Parallel s) {
    open("parallel", s.tasks);
    return null;
  }

  @Override
  public Void visitLaunchTask(LaunchTask s) {
    line("launch " + s.function + "(" + exprs(s.args) + ")");
    return null;
  }

  @Override
  public Void visitLaunchTaskWithHandle(LaunchTaskWithHandle s) {
    line("let " + s.handle.name() + " = launch " + s.function + "(" +
         exprs(s.args) + ")");
    return null;
  }

  @Override
  public Void visitStopTask(StopTask s) {
    line("stop " + s.handle.accept(this));
    return null;
  }

  @Override
  public Void visitCreatePipe(CreatePipe s) {
    line("pipe " + s.var.name() + " of " + s.elemType +
        (s.capacity == null ? "" : " capacity " + s.capacity.accept(this)));
    return null;
  }

  @Override
  public Void visitSendPipe(SendPipe s) {
    line("send " + s.value.accept(this) + " into " + s.pipe.accept(this));
    return null;
  }

  @Override
  public Void visitTrySendPipe(TrySendPipe s) {
    line("try send " + s.value.accept(this) + " into " + s.pipe.accept(this) +
        (s.result == null ? "" : " -> " + s.result.name()));
    return null;
  }

  @Override
  public Void visitReceivePipe(ReceivePipe s) {
    line("receive " + s.var.name() + " from " + s.pipe.accept(this));
    return null;
  }

  @Override
  public Void visitTryReceivePipe(TryReceivePipe s) {
    line("try receive " + s.var.name() + " from " + s.pipe.accept(this));
    return null;
  }

  @Override
  public Void visitSelect(Select s) {
    line("select {");
    String old = indent;
    indent += INDENT;
    for (SelectBranch b: s.branches) {
      if (b.isTimeout()) {
        open("after " + b.timeout.accept(this), b.body);
      } else {
        open("receive " + b.var.name() + " from " + b.pipe.accept(this),
             b.body);
      }
    }
    indent = old;
    line("}");
    return null;
  }

  @Override
  public Void visitSleep(Sleep s) {
    line("sleep " + s.millis.accept(this));
    return null;
  }

  @Override
  public Void visitMount(Mount s) {
    line("mount " + s.var.name() + " at " + s.path.accept(this));
    return null;
  }

  @Override
  public Void visitListen(Listen s) {
    line("listen on " + s.address.accept(this));
    return null;
  }

  @Override
  public Void visitConnectTo(ConnectTo s) {
    line("connect to " + s.address.accept(this));
    return null;
  }

  @Override
  public Void visitSendMessage(SendMessage s) {
    line("send message " + s.message.accept(this) + " to " +
         s.destination.accept(this));
    return null;
  }

  @Override
  public Void visitAwaitMessage(AwaitMessage s) {
    line("await message from " + s.source.accept(this) + " into " +
         s.into.name());
    return null;
  }

  @Override
  public Void visitSync(Sync s) {
    line("sync " + s.var.name() + " on " + s.topic.accept(this));
    return null;
  }

  @Override
  public Void visitMergeCrdt(MergeCrdt s) {
    line("merge " + s.source.accept(this) + " into " + s.target.accept(this));
    return null;
  }

  @Override
  public Void visitIncreaseCrdt(IncreaseCrdt s) {
    line("increase " + operand(s.object) + "." + s.field + " by " +
         s.amount.accept(this));
    return null;
  }

  @Override
  public Void visitDecreaseCrdt(DecreaseCrdt s) {
    line("decrease " + operand(s.object) + "." + s.field + " by " +
         s.amount.accept(this));
    return null;
  }

  @Override
  public Void visitAppendToSequence(AppendToSequence s) {
    line("append " + s.value.accept(this) + " to " + s.sequence.accept(this));
    return null;
  }

  @Override
  public Void visitCheck(Check s) {
    if (s.capability) {
      line("check " + s.subject.name() + " can " + s.predicate +
           (s.object == null ? "" : " " + s.object.name()));
    } else {
      line("check " + s.subject.name() + " is " + s.predicate);
    }
    return null;
  }

  @Override
  public Void visitRuntimeAssert(RuntimeAssert s) {
    line("assert " + s.cond.accept(this));
    return null;
  }

  @Override
  public Void visitInspect(Inspect s) {
    line("inspect " + s.target.accept(this) + " {");
    String old = indent;
    indent += INDENT;
    for (InspectArm arm: s.arms) {
      if (arm.variant == null) {
        open("otherwise", arm.body);
      } else {
        open("when " + arm.variant + "(" +
             StringUtils.join(arm.bindings, ", ") + ")", arm.body);
      }
    }
    indent = old;
    line("}");
    return null;
  }

  @Override
  public Void visitEscape(Stmts.Escape s) {
    line("escape " + s.language + " \"" +
         StringEscapeUtils.escapeJava(s.code) + "\"");
    return null;
  }
}
