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
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Types.Type;
import exm.lgc.common.lang.Var;

/**
 * Expression nodes of the type-resolved AST.
 *
 * Nodes are immutable and compared by identity, so a node can be used as a
 * key for analysis results.  Passes that change the tree build new nodes.
 */
public class Exprs {

  public static abstract class Expr {
    public abstract <R> R accept(ExprVisitor<R> visitor);

    /** Static type resolved by the type checker */
    public abstract Type type();

    /**
     * @return subexpressions evaluated when this expression is evaluated,
     *         left to right
     */
    public abstract List<Expr> children();

    @Override
    public String toString() {
      return AstPrinter.print(this);
    }
  }

  public static enum BinOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    EQ("=="),
    NE("!="),
    AND("and"),
    OR("or"),
    CONCAT("++");

    public final String symbol;

    private BinOp(String symbol) {
      this.symbol = symbol;
    }

    public boolean isComparison() {
      switch (this) {
        case LT:
        case LE:
        case GT:
        case GE:
        case EQ:
        case NE:
          return true;
        default:
          return false;
      }
    }

    /**
     * @return true if the operation can fault at runtime regardless
     *          of operand types
     */
    public boolean canFault() {
      return this == DIV || this == MOD;
    }

    /**
     * @return the comparison with operands swapped, e.g. a < b <=> b > a
     */
    public BinOp swapOperands() {
      switch (this) {
        case LT: return GT;
        case LE: return GE;
        case GT: return LT;
        case GE: return LE;
        case EQ: return EQ;
        case NE: return NE;
        default:
          throw new IllegalArgumentException(this + " is not a comparison");
      }
    }

    /**
     * @return the comparison that holds exactly when this one doesn't
     */
    public BinOp negate() {
      switch (this) {
        case LT: return GE;
        case LE: return GT;
        case GT: return LE;
        case GE: return LT;
        case EQ: return NE;
        case NE: return EQ;
        default:
          throw new IllegalArgumentException(this + " is not a comparison");
      }
    }
  }

  public static class Literal extends Expr {
    /** Long, Double, Boolean, String, or null for nothing */
    public final Object value;
    private final Type type;

    private Literal(Object value, Type type) {
      this.value = value;
      this.type = type;
    }

    public static Literal intLit(long value) {
      return new Literal(value, Types.INT);
    }

    public static Literal floatLit(double value) {
      return new Literal(value, Types.FLOAT);
    }

    public static Literal boolLit(boolean value) {
      return new Literal(value, Types.BOOL);
    }

    public static Literal textLit(String value) {
      return new Literal(value, Types.TEXT);
    }

    public static Literal nothing() {
      return new Literal(null, Types.NOTHING);
    }

    public boolean isInt() {
      return value instanceof Long;
    }

    public long intValue() {
      return (Long)value;
    }

    public boolean isBool() {
      return value instanceof Boolean;
    }

    public boolean boolValue() {
      return (Boolean)value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitLiteral(this);
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public List<Expr> children() {
      return Collections.emptyList();
    }
  }

  public static class Identifier extends Expr {
    public final Var var;

    public Identifier(Var var) {
      this.var = var;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitIdentifier(this);
    }

    @Override
    public Type type() {
      return var.type();
    }

    @Override
    public List<Expr> children() {
      return Collections.emptyList();
    }
  }

  public static class BinaryOp extends Expr {
    public final BinOp op;
    public final Expr left;
    public final Expr right;
    private final Type type;

    public BinaryOp(BinOp op, Expr left, Expr right, Type type) {
      this.op = op;
      this.left = left;
      this.right = right;
      this.type = type;
    }

    /**
     * Build with the usual result type: bool for comparisons and logic,
     * the left operand's type otherwise
     */
    public static BinaryOp create(BinOp op, Expr left, Expr right) {
      Type t;
      if (op.isComparison() || op == BinOp.AND || op == BinOp.OR) {
        t = Types.BOOL;
      } else {
        t = left.type();
      }
      return new BinaryOp(op, left, right, t);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitBinaryOp(this);
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(left, right);
    }
  }

  public static class Not extends Expr {
    public final Expr operand;

    public Not(Expr operand) {
      this.operand = operand;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitNot(this);
    }

    @Override
    public Type type() {
      return Types.BOOL;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(operand);
    }
  }

  public static class Call extends Expr {
    public final String function;
    public final List<Expr> args;
    private final Type type;

    public Call(String function, List<Expr> args, Type type) {
      this.function = function;
      this.args = ImmutableList.copyOf(args);
      this.type = type;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitCall(this);
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public List<Expr> children() {
      return args;
    }
  }

  /**
   * Indexed read from a collection.  Indices start at the language's minimum
   * index (1).
   */
  public static class Index extends Expr {
    public final Expr collection;
    public final Expr index;
    private final Type type;

    public Index(Expr collection, Expr index, Type type) {
      this.collection = collection;
      this.index = index;
      this.type = type;
    }

    public static Index create(Expr collection, Expr index) {
      return new Index(collection, index, collection.type().elemType());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitIndex(this);
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(collection, index);
    }
  }

  public static class Slice extends Expr {
    public final Expr collection;
    public final Expr start;
    public final Expr end;

    public Slice(Expr collection, Expr start, Expr end) {
      this.collection = collection;
      this.start = start;
      this.end = end;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitSlice(this);
    }

    @Override
    public Type type() {
      return collection.type();
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(collection, start, end);
    }
  }

  public static class Length extends Expr {
    public final Expr collection;

    public Length(Expr collection) {
      this.collection = collection;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitLength(this);
    }

    @Override
    public Type type() {
      return Types.INT;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(collection);
    }
  }

  public static class Contains extends Expr {
    public final Expr collection;
    public final Expr value;

    public Contains(Expr collection, Expr value) {
      this.collection = collection;
      this.value = value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitContains(this);
    }

    @Override
    public Type type() {
      return Types.BOOL;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(collection, value);
    }
  }

  public static class FieldAccess extends Expr {
    public final Expr object;
    public final String field;
    private final Type type;

    public FieldAccess(Expr object, String field, Type type) {
      this.object = object;
      this.field = field;
      this.type = type;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitFieldAccess(this);
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(object);
    }
  }

  public static class ListLiteral extends Expr {
    public final List<Expr> items;
    private final Type type;

    public ListLiteral(List<Expr> items, Type type) {
      this.items = ImmutableList.copyOf(items);
      this.type = type;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitListLiteral(this);
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public List<Expr> children() {
      return items;
    }
  }

  public static class TupleLiteral extends Expr {
    public final List<Expr> items;

    public TupleLiteral(List<Expr> items) {
      this.items = ImmutableList.copyOf(items);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitTupleLiteral(this);
    }

    @Override
    public Type type() {
      List<Type> elemTypes = new ArrayList<Type>(items.size());
      for (Expr item: items) {
        elemTypes.add(item.type());
      }
      return Types.tupleOf(elemTypes);
    }

    @Override
    public List<Expr> children() {
      return items;
    }
  }

  /**
   * Inclusive integer range start..end
   */
  public static class Range extends Expr {
    public final Expr start;
    public final Expr end;

    public Range(Expr start, Expr end) {
      this.start = start;
      this.end = end;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitRange(this);
    }

    @Override
    public Type type() {
      return Types.listOf(Types.INT);
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(start, end);
    }
  }

  /**
   * Deep copy of a value
   */
  public static class Copy extends Expr {
    public final Expr value;

    public Copy(Expr value) {
      this.value = value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitCopy(this);
    }

    @Override
    public Type type() {
      return value.type();
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(value);
    }
  }

  /**
   * Transfer ownership of the value bound to var.  The binding can't be used
   * afterwards unless its type is a copy type.
   */
  public static class Give extends Expr {
    public final Var var;

    public Give(Var var) {
      this.var = var;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitGive(this);
    }

    @Override
    public Type type() {
      return var.type();
    }

    @Override
    public List<Expr> children() {
      return Collections.emptyList();
    }
  }

  /**
   * Construct a struct or empty collection
   */
  public static class New extends Expr {
    private final Type type;
    public final Map<String, Expr> fields;

    public New(Type type, Map<String, Expr> fields) {
      this.type = type;
      this.fields = ImmutableMap.copyOf(fields);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitNew(this);
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.copyOf(fields.values());
    }
  }

  /**
   * Empty collection with preallocated capacity
   */
  public static class WithCapacity extends Expr {
    private final Type type;
    public final Expr capacity;

    public WithCapacity(Type type, Expr capacity) {
      this.type = type;
      this.capacity = capacity;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitWithCapacity(this);
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(capacity);
    }
  }

  public static class OptionSome extends Expr {
    public final Expr value;

    public OptionSome(Expr value) {
      this.value = value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitOptionSome(this);
    }

    @Override
    public Type type() {
      return Types.optionOf(value.type());
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(value);
    }
  }

  public static class OptionNone extends Expr {
    private final Type type;

    public OptionNone(Type type) {
      this.type = type;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitOptionNone(this);
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public List<Expr> children() {
      return Collections.emptyList();
    }
  }

  /**
   * Closure creation.  The body is not evaluated when the closure is
   * created, so it is not a child expression.
   */
  public static class Closure extends Expr {
    public final List<Var> params;
    /** Bindings from the enclosing scope used by the body */
    public final List<Var> captures;
    public final Block body;

    public Closure(List<Var> params, List<Var> captures, Block body) {
      this.params = ImmutableList.copyOf(params);
      this.captures = ImmutableList.copyOf(captures);
      this.body = body;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitClosure(this);
    }

    @Override
    public Type type() {
      return Types.FUNCTION;
    }

    @Override
    public List<Expr> children() {
      return Collections.emptyList();
    }
  }

  public static class InterpolatedString extends Expr {
    public final List<Expr> parts;

    public InterpolatedString(List<Expr> parts) {
      this.parts = ImmutableList.copyOf(parts);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitInterpolatedString(this);
    }

    @Override
    public Type type() {
      return Types.TEXT;
    }

    @Override
    public List<Expr> children() {
      return parts;
    }
  }

  public static enum SetOp {
    UNION,
    INTERSECTION,
  }

  public static class SetOperation extends Expr {
    public final SetOp op;
    public final Expr left;
    public final Expr right;

    public SetOperation(SetOp op, Expr left, Expr right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitSetOperation(this);
    }

    @Override
    public Type type() {
      return left.type();
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(left, right);
    }
  }

  /**
   * Embedded foreign code.  Nothing is known about what it does.
   */
  public static class Escape extends Expr {
    public final String language;
    public final String code;
    private final Type type;

    public Escape(String language, String code, Type type) {
      this.language = language;
      this.code = code;
      this.type = type;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitEscape(this);
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public List<Expr> children() {
      return Collections.emptyList();
    }
  }

  /**
   * @return the binding at the root of an access path such as a.b[i],
   *         or null if the expression isn't rooted at a binding
   */
  public static Var rootVar(Expr e) {
    while (true) {
      if (e instanceof Identifier) {
        return ((Identifier)e).var;
      } else if (e instanceof FieldAccess) {
        e = ((FieldAccess)e).object;
      } else if (e instanceof Index) {
        e = ((Index)e).collection;
      } else {
        return null;
      }
    }
  }

  public static Identifier ident(Var v) {
    return new Identifier(v);
  }
}
