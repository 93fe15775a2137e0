package exm.lgc.ir.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Types.Type;
import exm.lgc.common.lang.Var;
import exm.lgc.ir.tree.Exprs.BinOp;
import exm.lgc.ir.tree.Exprs.BinaryOp;
import exm.lgc.ir.tree.Exprs.Call;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Exprs.Identifier;
import exm.lgc.ir.tree.Exprs.Index;
import exm.lgc.ir.tree.Exprs.Length;
import exm.lgc.ir.tree.Exprs.ListLiteral;
import exm.lgc.ir.tree.Exprs.Literal;
import exm.lgc.ir.tree.Exprs.New;
import exm.lgc.ir.tree.Exprs.Not;
import exm.lgc.ir.tree.Exprs.Range;
import exm.lgc.ir.tree.Stmts.CallStmt;
import exm.lgc.ir.tree.Stmts.Check;
import exm.lgc.ir.tree.Stmts.If;
import exm.lgc.ir.tree.Stmts.Let;
import exm.lgc.ir.tree.Stmts.Push;
import exm.lgc.ir.tree.Stmts.Repeat;
import exm.lgc.ir.tree.Stmts.Return;
import exm.lgc.ir.tree.Stmts.SetIndex;
import exm.lgc.ir.tree.Stmts.Show;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.Stmts.While;

/**
 * Shorthand for building test programs
 */
public class AstBuilder {
  public static final Type INT_LIST = Types.listOf(Types.INT);
  public static final Type INT_MAP = Types.mapOf(Types.INT, Types.INT);

  public static Var intVar(String name) {
    return Var.local(name, Types.INT);
  }

  public static Var boolVar(String name) {
    return Var.local(name, Types.BOOL);
  }

  public static Var listVar(String name) {
    return Var.local(name, INT_LIST);
  }

  public static Var mapVar(String name) {
    return Var.local(name, INT_MAP);
  }

  public static Literal lit(long v) {
    return Literal.intLit(v);
  }

  public static Literal lit(boolean v) {
    return Literal.boolLit(v);
  }

  public static Identifier id(Var v) {
    return new Identifier(v);
  }

  public static BinaryOp bin(BinOp op, Expr l, Expr r) {
    return BinaryOp.create(op, l, r);
  }

  public static BinaryOp add(Expr l, Expr r) {
    return bin(BinOp.ADD, l, r);
  }

  public static BinaryOp sub(Expr l, Expr r) {
    return bin(BinOp.SUB, l, r);
  }

  public static BinaryOp mul(Expr l, Expr r) {
    return bin(BinOp.MUL, l, r);
  }

  public static BinaryOp div(Expr l, Expr r) {
    return bin(BinOp.DIV, l, r);
  }

  public static BinaryOp lt(Expr l, Expr r) {
    return bin(BinOp.LT, l, r);
  }

  public static BinaryOp le(Expr l, Expr r) {
    return bin(BinOp.LE, l, r);
  }

  public static BinaryOp eq(Expr l, Expr r) {
    return bin(BinOp.EQ, l, r);
  }

  public static BinaryOp and(Expr l, Expr r) {
    return bin(BinOp.AND, l, r);
  }

  public static Not not(Expr e) {
    return new Not(e);
  }

  public static Length len(Expr coll) {
    return new Length(coll);
  }

  public static Index idx(Expr coll, Expr i) {
    return Index.create(coll, i);
  }

  public static ListLiteral list(long ...items) {
    List<Expr> exprs = new ArrayList<Expr>();
    for (long i: items) {
      exprs.add(lit(i));
    }
    return new ListLiteral(exprs, INT_LIST);
  }

  /**
   * Empty map from Int to Int
   */
  public static New newMap() {
    return new New(INT_MAP, Collections.<String, Expr>emptyMap());
  }

  public static Range range(Expr start, Expr end) {
    return new Range(start, end);
  }

  public static Call call(String fn, Type type, Expr ...args) {
    return new Call(fn, Arrays.asList(args), type);
  }

  public static Block block(Stmt ...stmts) {
    return Block.of(stmts);
  }

  public static Let let(Var v, Expr value) {
    return new Let(v, value);
  }

  public static Stmts.Set set(Var v, Expr value) {
    return new Stmts.Set(v, value);
  }

  public static SetIndex setIndex(Expr coll, Expr i, Expr value) {
    return new SetIndex(coll, i, value);
  }

  public static Push push(Expr value, Expr coll) {
    return new Push(value, coll);
  }

  public static If ifElse(Expr cond, Block thenBlock, Block elseBlock) {
    return new If(cond, thenBlock, elseBlock);
  }

  public static If ifThen(Expr cond, Stmt ...thenStmts) {
    return new If(cond, Block.of(thenStmts), Block.EMPTY);
  }

  public static While loop(Expr cond, Stmt ...body) {
    return new While(cond, Block.of(body), null);
  }

  public static Repeat repeat(Var v, Expr iterable, Stmt ...body) {
    return new Repeat(v, iterable, Block.of(body));
  }

  public static Return ret(Expr value) {
    return new Return(value);
  }

  public static Show show(Expr value) {
    return new Show(value);
  }

  public static CallStmt callStmt(String fn, Expr ...args) {
    return new CallStmt(fn, Arrays.asList(args));
  }

  public static Stmts.Escape escape(String code) {
    return new Stmts.Escape("Rust", code);
  }

  public static Check check(Var subject, String predicate) {
    return new Check(subject, predicate, null, false,
                     "check that " + subject + " is " + predicate);
  }

  public static Function fn(String name, List<Var> params, Type returnType,
                            Stmt ...body) {
    return new Function(name, params, returnType, Block.of(body), false);
  }

  public static Function main(Stmt ...body) {
    return fn("main", Collections.<Var>emptyList(), Types.NOTHING, body);
  }

  public static Program program(Function ...functions) {
    return new Program(Collections.<Var>emptyList(), Arrays.asList(functions));
  }

  public static Program program(List<Var> globals, Function ...functions) {
    return new Program(globals, Arrays.asList(functions));
  }
}
