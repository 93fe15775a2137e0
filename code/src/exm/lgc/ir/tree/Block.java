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

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.lgc.ir.tree.Stmts.Stmt;

/**
 * Immutable sequence of statements
 */
public class Block implements Iterable<Stmt> {
  public static final Block EMPTY = new Block(ImmutableList.<Stmt>of());

  private final List<Stmt> statements;

  public Block(List<? extends Stmt> statements) {
    this.statements = ImmutableList.copyOf(statements);
  }

  public static Block of(Stmt ...statements) {
    return new Block(ImmutableList.copyOf(statements));
  }

  public List<Stmt> statements() {
    return statements;
  }

  public Stmt get(int i) {
    return statements.get(i);
  }

  public int size() {
    return statements.size();
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  @Override
  public Iterator<Stmt> iterator() {
    return statements.iterator();
  }

  @Override
  public String toString() {
    return AstPrinter.print(this);
  }
}
