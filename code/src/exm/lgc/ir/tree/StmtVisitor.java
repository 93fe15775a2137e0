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

import exm.lgc.ir.tree.Stmts.*;

/**
 * One method per statement kind.  Like {@link ExprVisitor}, analyses
 * implement this directly so that every statement kind has an explicit rule.
 */
public interface StmtVisitor<R> {
  R visitLet(Let s);
  R visitSet(Set s);
  R visitSetIndex(SetIndex s);
  R visitSetField(SetField s);
  R visitPush(Push s);
  R visitPop(Pop s);
  R visitAdd(Add s);
  R visitRemove(Remove s);
  R visitIf(If s);
  R visitWhile(While s);
  R visitRepeat(Repeat s);
  R visitReturn(Return s);
  R visitCall(CallStmt s);
  R visitShow(Show s);
  R visitReadFrom(ReadFrom s);
  R visitWriteFile(WriteFile s);
  R visitGive(Give s);
  R visitZone(Zone s);
  R visitConcurrent(Concurrent s);
  R visitParallel(Parallel s);
  R visitLaunchTask(LaunchTask s);
  R visitLaunchTaskWithHandle(LaunchTaskWithHandle s);
  R visitStopTask(StopTask s);
  R visitCreatePipe(CreatePipe s);
  R visitSendPipe(SendPipe s);
  R visitTrySendPipe(TrySendPipe s);
  R visitReceivePipe(ReceivePipe s);
  R visitTryReceivePipe(TryReceivePipe s);
  R visitSelect(Select s);
  R visitSleep(Sleep s);
  R visitMount(Mount s);
  R visitListen(Listen s);
  R visitConnectTo(ConnectTo s);
  R visitSendMessage(SendMessage s);
  R visitAwaitMessage(AwaitMessage s);
  R visitSync(Sync s);
  R visitMergeCrdt(MergeCrdt s);
  R visitIncreaseCrdt(IncreaseCrdt s);
  R visitDecreaseCrdt(DecreaseCrdt s);
  R visitAppendToSequence(AppendToSequence s);
  R visitCheck(Check s);
  R visitRuntimeAssert(RuntimeAssert s);
  R visitInspect(Inspect s);
  R visitEscape(Escape s);
}
