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
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.lgc.common.lang.Types.Type;
import exm.lgc.common.lang.Var;
import exm.lgc.ir.tree.Exprs.Expr;

/**
 * Statement nodes of the type-resolved AST.
 *
 * Like expressions, statements are immutable and compared by identity.
 */
public class Stmts {

  public static abstract class Stmt {
    public abstract <R> R accept(StmtVisitor<R> visitor);

    /**
     * @return expressions evaluated directly by this statement, in
     *         evaluation order.  Doesn't include expressions in nested blocks
     */
    public abstract List<Expr> exprs();

    /**
     * @return nested blocks, empty for simple statements
     */
    public List<Block> blocks() {
      return Collections.emptyList();
    }

    /**
     * @return access paths written by this statement, e.g. the collection
     *         of a SetIndex.  Subexpressions of these are evaluated too
     */
    public List<Expr> targets() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  /**
   * Helper for statements that evaluate a fixed list of expressions, some of
   * which may be absent
   */
  private static List<Expr> exprList(Expr ...exprs) {
    List<Expr> res = new ArrayList<Expr>(exprs.length);
    for (Expr e: exprs) {
      if (e != null) {
        res.add(e);
      }
    }
    return Collections.unmodifiableList(res);
  }

  /** Declare a new binding */
  public static class Let extends Stmt {
    public final Var var;
    public final Expr value;

    public Let(Var var, Expr value) {
      this.var = var;
      this.value = value;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitLet(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(value);
    }
  }

  /** Reassign an existing binding */
  public static class Set extends Stmt {
    public final Var target;
    public final Expr value;

    public Set(Var target, Expr value) {
      this.target = target;
      this.value = value;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitSet(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(value);
    }
  }

  public static class SetIndex extends Stmt {
    public final Expr collection;
    public final Expr index;
    public final Expr value;

    public SetIndex(Expr collection, Expr index, Expr value) {
      this.collection = collection;
      this.index = index;
      this.value = value;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitSetIndex(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(index, value);
    }

    @Override
    public List<Expr> targets() {
      return ImmutableList.of(collection);
    }
  }

  public static class SetField extends Stmt {
    public final Expr object;
    public final String field;
    public final Expr value;

    public SetField(Expr object, String field, Expr value) {
      this.object = object;
      this.field = field;
      this.value = value;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitSetField(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(value);
    }

    @Override
    public List<Expr> targets() {
      return ImmutableList.of(object);
    }
  }

  /** Append to a list */
  public static class Push extends Stmt {
    public final Expr value;
    public final Expr collection;

    public Push(Expr value, Expr collection) {
      this.value = value;
      this.collection = collection;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitPush(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(value);
    }

    @Override
    public List<Expr> targets() {
      return ImmutableList.of(collection);
    }
  }

  /** Remove the last element of a list, optionally binding it */
  public static class Pop extends Stmt {
    public final Expr collection;
    /** May be null */
    public final Var into;

    public Pop(Expr collection, Var into) {
      this.collection = collection;
      this.into = into;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitPop(this);
    }

    @Override
    public List<Expr> exprs() {
      return Collections.emptyList();
    }

    @Override
    public List<Expr> targets() {
      return ImmutableList.of(collection);
    }
  }

  /** Insert into a set */
  public static class Add extends Stmt {
    public final Expr value;
    public final Expr collection;

    public Add(Expr value, Expr collection) {
      this.value = value;
      this.collection = collection;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitAdd(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(value);
    }

    @Override
    public List<Expr> targets() {
      return ImmutableList.of(collection);
    }
  }

  /** Remove from a set */
  public static class Remove extends Stmt {
    public final Expr value;
    public final Expr collection;

    public Remove(Expr value, Expr collection) {
      this.value = value;
      this.collection = collection;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitRemove(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(value);
    }

    @Override
    public List<Expr> targets() {
      return ImmutableList.of(collection);
    }
  }

  public static class If extends Stmt {
    public final Expr cond;
    public final Block thenBlock;
    /** Empty if there was no else */
    public final Block elseBlock;

    public If(Expr cond, Block thenBlock, Block elseBlock) {
      this.cond = cond;
      this.thenBlock = thenBlock;
      this.elseBlock = elseBlock == null ? Block.EMPTY : elseBlock;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(cond);
    }

    @Override
    public List<Block> blocks() {
      return ImmutableList.of(thenBlock, elseBlock);
    }
  }

  public static class While extends Stmt {
    public final Expr cond;
    public final Block body;
    /** Termination measure, null if none was given */
    public final Expr decreasing;

    public While(Expr cond, Block body, Expr decreasing) {
      this.cond = cond;
      this.body = body;
      this.decreasing = decreasing;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitWhile(this);
    }

    @Override
    public List<Expr> exprs() {
      return exprList(cond, decreasing);
    }

    @Override
    public List<Block> blocks() {
      return ImmutableList.of(body);
    }
  }

  /** Iterate over the elements of a collection or a range */
  public static class Repeat extends Stmt {
    public final Var var;
    public final Expr iterable;
    public final Block body;

    public Repeat(Var var, Expr iterable, Block body) {
      this.var = var;
      this.iterable = iterable;
      this.body = body;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitRepeat(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(iterable);
    }

    @Override
    public List<Block> blocks() {
      return ImmutableList.of(body);
    }
  }

  public static class Return extends Stmt {
    /** May be null */
    public final Expr value;

    public Return(Expr value) {
      this.value = value;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitReturn(this);
    }

    @Override
    public List<Expr> exprs() {
      return exprList(value);
    }
  }

  /** Call for side effects only */
  public static class CallStmt extends Stmt {
    public final String function;
    public final List<Expr> args;

    public CallStmt(String function, List<Expr> args) {
      this.function = function;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitCall(this);
    }

    @Override
    public List<Expr> exprs() {
      return args;
    }
  }

  /** Print to the console */
  public static class Show extends Stmt {
    public final Expr value;

    public Show(Expr value) {
      this.value = value;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitShow(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(value);
    }
  }

  public static enum ReadSource {
    CONSOLE,
    FILE,
  }

  public static class ReadFrom extends Stmt {
    public final Var into;
    public final ReadSource source;
    /** File path, null when reading the console */
    public final Expr path;

    public ReadFrom(Var into, ReadSource source, Expr path) {
      this.into = into;
      this.source = source;
      this.path = path;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitReadFrom(this);
    }

    @Override
    public List<Expr> exprs() {
      return exprList(path);
    }
  }

  public static class WriteFile extends Stmt {
    public final Expr path;
    public final Expr content;

    public WriteFile(Expr path, Expr content) {
      this.path = path;
      this.content = content;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitWriteFile(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(path, content);
    }
  }

  /** Hand an object over to a recipient function, which takes ownership */
  public static class Give extends Stmt {
    public final Expr object;
    public final String recipient;

    public Give(Expr object, String recipient) {
      this.object = object;
      this.recipient = recipient;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitGive(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(object);
    }
  }

  /** Region-allocated block */
  public static class Zone extends Stmt {
    public final String name;
    /** May be null */
    public final Expr capacity;
    public final Block body;

    public Zone(String name, Expr capacity, Block body) {
      this.name = name;
      this.capacity = capacity;
      this.body = body;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitZone(this);
    }

    @Override
    public List<Expr> exprs() {
      return exprList(capacity);
    }

    @Override
    public List<Block> blocks() {
      return ImmutableList.of(body);
    }
  }

  /** Run statements as concurrent tasks and wait for all of them */
  public static class Concurrent extends Stmt {
    public final Block tasks;

    public Concurrent(Block tasks) {
      this.tasks = tasks;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitConcurrent(this);
    }

    @Override
    public List<Expr> exprs() {
      return Collections.emptyList();
    }

    @Override
    public List<Block> blocks() {
      return ImmutableList.of(tasks);
    }
  }

  /** Run statements in parallel on worker threads and wait for all */
  public static class Parallel extends Stmt {
    public final Block tasks;

    public Parallel(Block tasks) {
      this.tasks = tasks;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitParallel(this);
    }

    @Override
    public List<Expr> exprs() {
      return Collections.emptyList();
    }

    @Override
    public List<Block> blocks() {
      return ImmutableList.of(tasks);
    }
  }

  public static class LaunchTask extends Stmt {
    public final String function;
    public final List<Expr> args;

    public LaunchTask(String function, List<Expr> args) {
      this.function = function;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitLaunchTask(this);
    }

    @Override
    public List<Expr> exprs() {
      return args;
    }
  }

  public static class LaunchTaskWithHandle extends Stmt {
    public final Var handle;
    public final String function;
    public final List<Expr> args;

    public LaunchTaskWithHandle(Var handle, String function, List<Expr> args) {
      this.handle = handle;
      this.function = function;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitLaunchTaskWithHandle(this);
    }

    @Override
    public List<Expr> exprs() {
      return args;
    }
  }

  public static class StopTask extends Stmt {
    public final Expr handle;

    public StopTask(Expr handle) {
      this.handle = handle;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitStopTask(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(handle);
    }
  }

  public static class CreatePipe extends Stmt {
    public final Var var;
    public final Type elemType;
    /** May be null for unbounded */
    public final Expr capacity;

    public CreatePipe(Var var, Type elemType, Expr capacity) {
      this.var = var;
      this.elemType = elemType;
      this.capacity = capacity;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitCreatePipe(this);
    }

    @Override
    public List<Expr> exprs() {
      return exprList(capacity);
    }
  }

  public static class SendPipe extends Stmt {
    public final Expr value;
    public final Expr pipe;

    public SendPipe(Expr value, Expr pipe) {
      this.value = value;
      this.pipe = pipe;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitSendPipe(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(value, pipe);
    }
  }

  public static class TrySendPipe extends Stmt {
    public final Expr value;
    public final Expr pipe;
    /** Receives whether the send succeeded.  May be null */
    public final Var result;

    public TrySendPipe(Expr value, Expr pipe, Var result) {
      this.value = value;
      this.pipe = pipe;
      this.result = result;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitTrySendPipe(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(value, pipe);
    }
  }

  public static class ReceivePipe extends Stmt {
    public final Var var;
    public final Expr pipe;

    public ReceivePipe(Var var, Expr pipe) {
      this.var = var;
      this.pipe = pipe;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitReceivePipe(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(pipe);
    }
  }

  public static class TryReceivePipe extends Stmt {
    public final Var var;
    public final Expr pipe;

    public TryReceivePipe(Var var, Expr pipe) {
      this.var = var;
      this.pipe = pipe;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitTryReceivePipe(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(pipe);
    }
  }

  public static class SelectBranch {
    /** Receive branch: variable bound to the received value, else null */
    public final Var var;
    /** Receive branch: pipe to receive from, else null */
    public final Expr pipe;
    /** Timeout branch: milliseconds to wait, else null */
    public final Expr timeout;
    public final Block body;

    private SelectBranch(Var var, Expr pipe, Expr timeout, Block body) {
      this.var = var;
      this.pipe = pipe;
      this.timeout = timeout;
      this.body = body;
    }

    public static SelectBranch receive(Var var, Expr pipe, Block body) {
      return new SelectBranch(var, pipe, null, body);
    }

    public static SelectBranch timeout(Expr millis, Block body) {
      return new SelectBranch(null, null, millis, body);
    }

    public boolean isTimeout() {
      return timeout != null;
    }
  }

  /** Wait on the first of several pipes or a timeout */
  public static class Select extends Stmt {
    public final List<SelectBranch> branches;

    public Select(List<SelectBranch> branches) {
      this.branches = ImmutableList.copyOf(branches);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitSelect(this);
    }

    @Override
    public List<Expr> exprs() {
      List<Expr> res = new ArrayList<Expr>();
      for (SelectBranch b: branches) {
        res.add(b.isTimeout() ? b.timeout : b.pipe);
      }
      return res;
    }

    @Override
    public List<Block> blocks() {
      List<Block> res = new ArrayList<Block>();
      for (SelectBranch b: branches) {
        res.add(b.body);
      }
      return res;
    }
  }

  public static class Sleep extends Stmt {
    public final Expr millis;

    public Sleep(Expr millis) {
      this.millis = millis;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitSleep(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(millis);
    }
  }

  /** Mount persistent storage at a path and bind it */
  public static class Mount extends Stmt {
    public final Var var;
    public final Expr path;

    public Mount(Var var, Expr path) {
      this.var = var;
      this.path = path;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitMount(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(path);
    }
  }

  public static class Listen extends Stmt {
    public final Expr address;

    public Listen(Expr address) {
      this.address = address;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitListen(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(address);
    }
  }

  public static class ConnectTo extends Stmt {
    public final Expr address;

    public ConnectTo(Expr address) {
      this.address = address;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitConnectTo(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(address);
    }
  }

  public static class SendMessage extends Stmt {
    public final Expr message;
    public final Expr destination;

    public SendMessage(Expr message, Expr destination) {
      this.message = message;
      this.destination = destination;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitSendMessage(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(message, destination);
    }
  }

  public static class AwaitMessage extends Stmt {
    public final Expr source;
    public final Var into;

    public AwaitMessage(Expr source, Var into) {
      this.source = source;
      this.into = into;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitAwaitMessage(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(source);
    }
  }

  /** Subscribe a replicated binding to a topic */
  public static class Sync extends Stmt {
    public final Var var;
    public final Expr topic;

    public Sync(Var var, Expr topic) {
      this.var = var;
      this.topic = topic;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitSync(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(topic);
    }
  }

  /** Merge one replicated value into another */
  public static class MergeCrdt extends Stmt {
    public final Expr source;
    public final Expr target;

    public MergeCrdt(Expr source, Expr target) {
      this.source = source;
      this.target = target;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitMergeCrdt(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(source);
    }

    @Override
    public List<Expr> targets() {
      return ImmutableList.of(target);
    }
  }

  public static class IncreaseCrdt extends Stmt {
    public final Expr object;
    public final String field;
    public final Expr amount;

    public IncreaseCrdt(Expr object, String field, Expr amount) {
      this.object = object;
      this.field = field;
      this.amount = amount;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitIncreaseCrdt(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(amount);
    }

    @Override
    public List<Expr> targets() {
      return ImmutableList.of(object);
    }
  }

  public static class DecreaseCrdt extends Stmt {
    public final Expr object;
    public final String field;
    public final Expr amount;

    public DecreaseCrdt(Expr object, String field, Expr amount) {
      this.object = object;
      this.field = field;
      this.amount = amount;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitDecreaseCrdt(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(amount);
    }

    @Override
    public List<Expr> targets() {
      return ImmutableList.of(object);
    }
  }

  public static class AppendToSequence extends Stmt {
    public final Expr sequence;
    public final Expr value;

    public AppendToSequence(Expr sequence, Expr value) {
      this.sequence = sequence;
      this.value = value;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitAppendToSequence(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(value);
    }

    @Override
    public List<Expr> targets() {
      return ImmutableList.of(sequence);
    }
  }

  /**
   * Security guard: fails unless the subject satisfies a policy predicate
   * or holds a capability on an object.
   */
  public static class Check extends Stmt {
    public final Var subject;
    public final String predicate;
    /** Object of a capability check, null otherwise */
    public final Var object;
    public final boolean capability;
    public final String sourceText;

    public Check(Var subject, String predicate, Var object,
                 boolean capability, String sourceText) {
      this.subject = subject;
      this.predicate = predicate;
      this.object = object;
      this.capability = capability;
      this.sourceText = sourceText;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitCheck(this);
    }

    @Override
    public List<Expr> exprs() {
      return Collections.emptyList();
    }
  }

  public static class RuntimeAssert extends Stmt {
    public final Expr cond;

    public RuntimeAssert(Expr cond) {
      this.cond = cond;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitRuntimeAssert(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(cond);
    }
  }

  public static class InspectArm {
    /** Variant name, null for the otherwise arm */
    public final String variant;
    public final List<Var> bindings;
    public final Block body;

    public InspectArm(String variant, List<Var> bindings, Block body) {
      this.variant = variant;
      this.bindings = ImmutableList.copyOf(bindings);
      this.body = body;
    }
  }

  /** Pattern match over the variants of a value */
  public static class Inspect extends Stmt {
    public final Expr target;
    public final List<InspectArm> arms;

    public Inspect(Expr target, List<InspectArm> arms) {
      this.target = target;
      this.arms = ImmutableList.copyOf(arms);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitInspect(this);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(target);
    }

    @Override
    public List<Block> blocks() {
      List<Block> res = new ArrayList<Block>();
      for (InspectArm arm: arms) {
        res.add(arm.body);
      }
      return res;
    }
  }

  /** Embedded foreign code */
  public static class Escape extends Stmt {
    public final String language;
    public final String code;

    public Escape(String language, String code) {
      this.language = language;
      this.code = code;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visitEscape(this);
    }

    @Override
    public List<Expr> exprs() {
      return Collections.emptyList();
    }
  }
}
