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

import exm.lgc.ir.tree.Exprs.BinaryOp;
import exm.lgc.ir.tree.Exprs.Call;
import exm.lgc.ir.tree.Exprs.Closure;
import exm.lgc.ir.tree.Exprs.Contains;
import exm.lgc.ir.tree.Exprs.Copy;
import exm.lgc.ir.tree.Exprs.Escape;
import exm.lgc.ir.tree.Exprs.FieldAccess;
import exm.lgc.ir.tree.Exprs.Give;
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

/**
 * One method per expression kind.  Analyses implement this directly so that
 * a new expression kind can't be added without giving every analysis a rule
 * for it.
 */
public interface ExprVisitor<R> {
  R visitLiteral(Literal e);
  R visitIdentifier(Identifier e);
  R visitBinaryOp(BinaryOp e);
  R visitNot(Not e);
  R visitCall(Call e);
  R visitIndex(Index e);
  R visitSlice(Slice e);
  R visitLength(Length e);
  R visitContains(Contains e);
  R visitFieldAccess(FieldAccess e);
  R visitListLiteral(ListLiteral e);
  R visitTupleLiteral(TupleLiteral e);
  R visitRange(Range e);
  R visitCopy(Copy e);
  R visitGive(Give e);
  R visitNew(New e);
  R visitWithCapacity(WithCapacity e);
  R visitOptionSome(OptionSome e);
  R visitOptionNone(OptionNone e);
  R visitClosure(Closure e);
  R visitInterpolatedString(InterpolatedString e);
  R visitSetOperation(SetOperation e);
  R visitEscape(Escape e);
}
