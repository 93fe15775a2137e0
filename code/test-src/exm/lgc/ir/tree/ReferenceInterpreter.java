package exm.lgc.ir.tree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.lgc.common.lang.Types.Type;
import exm.lgc.common.lang.Types.TypeKind;
import exm.lgc.common.lang.Var;
import exm.lgc.ir.tree.Exprs.BinaryOp;
import exm.lgc.ir.tree.Exprs.Call;
import exm.lgc.ir.tree.Exprs.Contains;
import exm.lgc.ir.tree.Exprs.Copy;
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
import exm.lgc.ir.tree.Stmts.Pop;
import exm.lgc.ir.tree.Stmts.Push;
import exm.lgc.ir.tree.Stmts.Repeat;
import exm.lgc.ir.tree.Stmts.Return;
import exm.lgc.ir.tree.Stmts.RuntimeAssert;
import exm.lgc.ir.tree.Stmts.SetIndex;
import exm.lgc.ir.tree.Stmts.Show;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.Stmts.While;

/**
 * Executes the subset of the AST used in tests, so that optimized and
 * original programs can be compared.
 *
 * Integers are 64 bit and wrap.  Lists are 1-indexed, maps are indexed by
 * key and fault on a missing key.  Binding a collection copies it; passing
 * one to a function passes a reference.  The only foreign code understood
 * is a block of the form "return N;".
 */
public class ReferenceInterpreter {

  public static class Fault extends RuntimeException {
    public Fault(String msg) {
      super(msg);
    }

    private static final long serialVersionUID = 1L;
  }

  /**
   * Observable result of a run
   */
  public static class Outcome {
    public final List<String> output;
    /** Null if the run completed */
    public final String fault;
    public final Object returned;

    Outcome(List<String> output, String fault, Object returned) {
      this.output = output;
      this.fault = fault;
      this.returned = returned;
    }

    public boolean faulted() {
      return fault != null;
    }

    /**
     * Same output, same return value, and both fault or neither does
     */
    public boolean sameBehavior(Outcome other) {
      return output.equals(other.output) && faulted() == other.faulted() &&
          (returned == null ? other.returned == null :
                              returned.equals(other.returned));
    }

    @Override
    public String toString() {
      return "output=" + output + " fault=" + fault + " returned=" + returned;
    }
  }

  private static class Frame {
    final Map<Var, Object> vars = new HashMap<Var, Object>();
    Object returned = null;
    boolean hasReturned = false;
  }

  private static final Pattern FOREIGN_RETURN =
                      Pattern.compile("\\s*return\\s+(-?\\d+)\\s*;\\s*");

  private final Program program;
  private final Map<Var, Object> globals = new HashMap<Var, Object>();
  private final List<String> output = new ArrayList<String>();
  private final long stepLimit;
  private long steps = 0;

  private ReferenceInterpreter(Program program, long stepLimit) {
    this.program = program;
    this.stepLimit = stepLimit;
    for (Var g: program.globals()) {
      globals.put(g, defaultValue(g.type()));
    }
  }

  public static Outcome run(Program program, String function,
                            Object ...args) {
    ReferenceInterpreter interp = new ReferenceInterpreter(program, 1000000);
    List<Object> argList = new ArrayList<Object>();
    for (Object a: args) {
      argList.add(a);
    }
    try {
      Object result = interp.call(function, argList);
      return new Outcome(interp.output, null, result);
    } catch (Fault f) {
      return new Outcome(interp.output, f.getMessage(), null);
    }
  }

  private static Object defaultValue(Type t) {
    switch (t.kind) {
      case INT:
        return 0L;
      case BOOL:
        return false;
      case TEXT:
        return "";
      case LIST:
        return new ArrayList<Object>();
      case MAP:
        return new LinkedHashMap<Object, Object>();
      default:
        return null;
    }
  }

  private Object call(String name, List<Object> args) {
    Function f = program.lookupFunction(name);
    if (f == null || f.isNative()) {
      throw new UnsupportedOperationException("Can't call " + name);
    }
    Frame frame = new Frame();
    for (int i = 0; i < f.params().size(); i++) {
      frame.vars.put(f.params().get(i), args.get(i));
    }
    exec(f.body(), frame);
    return frame.returned;
  }

  private void exec(Block block, Frame frame) {
    for (Stmt s: block) {
      if (frame.hasReturned) {
        return;
      }
      if (++steps > stepLimit) {
        throw new Fault("step limit");
      }
      exec(s, frame);
    }
  }

  @SuppressWarnings("unchecked")
  private void exec(Stmt s, Frame frame) {
    if (s instanceof Let) {
      Let let = (Let)s;
      frame.vars.put(let.var, copyValue(eval(let.value, frame)));
    } else if (s instanceof Stmts.Set) {
      Stmts.Set set = (Stmts.Set)s;
      assign(set.target, copyValue(eval(set.value, frame)), frame);
    } else if (s instanceof SetIndex) {
      SetIndex si = (SetIndex)s;
      Object coll = eval(si.collection, frame);
      Object index = eval(si.index, frame);
      Object value = copyValue(eval(si.value, frame));
      if (coll instanceof Map) {
        ((Map<Object, Object>)coll).put(index, value);
      } else {
        List<Object> list = (List<Object>)coll;
        list.set(checkIndex(list, index), value);
      }
    } else if (s instanceof Push) {
      Push push = (Push)s;
      Object value = copyValue(eval(push.value, frame));
      ((List<Object>)eval(push.collection, frame)).add(value);
    } else if (s instanceof Pop) {
      Pop pop = (Pop)s;
      List<Object> coll = (List<Object>)eval(pop.collection, frame);
      if (coll.isEmpty()) {
        throw new Fault("pop from empty list");
      }
      Object value = coll.remove(coll.size() - 1);
      if (pop.into != null) {
        frame.vars.put(pop.into, value);
      }
    } else if (s instanceof If) {
      If ifStmt = (If)s;
      if ((Boolean)eval(ifStmt.cond, frame)) {
        exec(ifStmt.thenBlock, frame);
      } else {
        exec(ifStmt.elseBlock, frame);
      }
    } else if (s instanceof While) {
      While loop = (While)s;
      while (!frame.hasReturned && (Boolean)eval(loop.cond, frame)) {
        exec(loop.body, frame);
        if (++steps > stepLimit) {
          throw new Fault("step limit");
        }
      }
    } else if (s instanceof Repeat) {
      Repeat loop = (Repeat)s;
      List<Object> items = new ArrayList<Object>(
                                (List<Object>)eval(loop.iterable, frame));
      for (Object item: items) {
        if (frame.hasReturned) {
          break;
        }
        frame.vars.put(loop.var, copyValue(item));
        exec(loop.body, frame);
      }
    } else if (s instanceof Return) {
      Return ret = (Return)s;
      frame.returned = ret.value == null ? null : eval(ret.value, frame);
      frame.hasReturned = true;
    } else if (s instanceof CallStmt) {
      CallStmt c = (CallStmt)s;
      call(c.function, evalAll(c.args, frame));
    } else if (s instanceof Show) {
      output.add(render(eval(((Show)s).value, frame)));
    } else if (s instanceof Check) {
      Check check = (Check)s;
      output.add("check " + check.predicate + " " + check.subject);
      if (Boolean.FALSE.equals(lookup(check.subject, frame))) {
        throw new Fault("security check failed: " + check.sourceText);
      }
    } else if (s instanceof Stmts.Escape) {
      Matcher m = FOREIGN_RETURN.matcher(((Stmts.Escape)s).code);
      if (!m.matches()) {
        throw new UnsupportedOperationException("Can't execute " + s);
      }
      frame.returned = Long.parseLong(m.group(1));
      frame.hasReturned = true;
    } else if (s instanceof RuntimeAssert) {
      if (!(Boolean)eval(((RuntimeAssert)s).cond, frame)) {
        throw new Fault("assertion failed");
      }
    } else {
      throw new UnsupportedOperationException("Can't execute " + s);
    }
  }

  private void assign(Var v, Object value, Frame frame) {
    if (frame.vars.containsKey(v)) {
      frame.vars.put(v, value);
    } else if (globals.containsKey(v)) {
      globals.put(v, value);
    } else {
      throw new IllegalStateException("Unbound " + v);
    }
  }

  private Object lookup(Var v, Frame frame) {
    if (frame.vars.containsKey(v)) {
      return frame.vars.get(v);
    } else if (globals.containsKey(v)) {
      return globals.get(v);
    }
    throw new IllegalStateException("Unbound " + v);
  }

  private List<Object> evalAll(List<Expr> exprs, Frame frame) {
    List<Object> res = new ArrayList<Object>();
    for (Expr e: exprs) {
      res.add(eval(e, frame));
    }
    return res;
  }

  @SuppressWarnings("unchecked")
  private Object eval(Expr e, Frame frame) {
    if (e instanceof Literal) {
      return ((Literal)e).value;
    } else if (e instanceof Identifier) {
      return lookup(((Identifier)e).var, frame);
    } else if (e instanceof BinaryOp) {
      return evalBinary((BinaryOp)e, frame);
    } else if (e instanceof Not) {
      return !(Boolean)eval(((Not)e).operand, frame);
    } else if (e instanceof Call) {
      Call c = (Call)e;
      return call(c.function, evalAll(c.args, frame));
    } else if (e instanceof Index) {
      Index ix = (Index)e;
      Object coll = eval(ix.collection, frame);
      Object index = eval(ix.index, frame);
      if (coll instanceof Map) {
        Map<Object, Object> map = (Map<Object, Object>)coll;
        if (!map.containsKey(index)) {
          throw new Fault("key " + index + " not in map");
        }
        return map.get(index);
      }
      List<Object> list = (List<Object>)coll;
      return list.get(checkIndex(list, index));
    } else if (e instanceof Length) {
      Object coll = eval(((Length)e).collection, frame);
      if (coll instanceof String) {
        return (long)((String)coll).length();
      } else if (coll instanceof Map) {
        return (long)((Map<Object, Object>)coll).size();
      }
      return (long)((List<Object>)coll).size();
    } else if (e instanceof Contains) {
      Contains c = (Contains)e;
      Object coll = eval(c.collection, frame);
      if (coll instanceof Map) {
        return ((Map<Object, Object>)coll).containsKey(eval(c.value, frame));
      }
      return ((List<Object>)coll).contains(eval(c.value, frame));
    } else if (e instanceof New && e.type().kind == TypeKind.MAP) {
      return new LinkedHashMap<Object, Object>();
    } else if (e instanceof ListLiteral) {
      return new ArrayList<Object>(evalAll(((ListLiteral)e).items, frame));
    } else if (e instanceof Range) {
      Range r = (Range)e;
      long start = (Long)eval(r.start, frame);
      long end = (Long)eval(r.end, frame);
      List<Object> res = new ArrayList<Object>();
      for (long i = start; i <= end; i++) {
        res.add(i);
        if (i == Long.MAX_VALUE) {
          break;
        }
      }
      return res;
    } else if (e instanceof Copy) {
      return copyValue(eval(((Copy)e).value, frame));
    }
    throw new UnsupportedOperationException("Can't evaluate " + e);
  }

  private Object evalBinary(BinaryOp e, Frame frame) {
    switch (e.op) {
      case AND:
        return (Boolean)eval(e.left, frame) && (Boolean)eval(e.right, frame);
      case OR:
        return (Boolean)eval(e.left, frame) || (Boolean)eval(e.right, frame);
      default:
        break;
    }
    Object l = eval(e.left, frame);
    Object r = eval(e.right, frame);
    switch (e.op) {
      case EQ:
        return l.equals(r);
      case NE:
        return !l.equals(r);
      case CONCAT:
        return (String)l + (String)r;
      default:
        break;
    }
    long a = (Long)l;
    long b = (Long)r;
    switch (e.op) {
      case ADD:
        return a + b;
      case SUB:
        return a - b;
      case MUL:
        return a * b;
      case DIV:
        if (b == 0) {
          throw new Fault("division by zero");
        }
        return a / b;
      case MOD:
        if (b == 0) {
          throw new Fault("modulo by zero");
        }
        return a % b;
      case LT:
        return a < b;
      case LE:
        return a <= b;
      case GT:
        return a > b;
      case GE:
        return a >= b;
      default:
        throw new UnsupportedOperationException(e.op.toString());
    }
  }

  private static int checkIndex(List<Object> coll, Object index) {
    long i = (Long)index;
    if (i < 1 || i > coll.size()) {
      throw new Fault("index " + i + " out of range for length " +
                      coll.size());
    }
    return (int)(i - 1);
  }

  @SuppressWarnings("unchecked")
  private static Object copyValue(Object value) {
    if (value instanceof List) {
      List<Object> copy = new ArrayList<Object>();
      for (Object item: (List<Object>)value) {
        copy.add(copyValue(item));
      }
      return copy;
    } else if (value instanceof Map) {
      Map<Object, Object> copy = new LinkedHashMap<Object, Object>();
      for (Map.Entry<Object, Object> entry:
                        ((Map<Object, Object>)value).entrySet()) {
        copy.put(entry.getKey(), copyValue(entry.getValue()));
      }
      return copy;
    }
    return value;
  }

  private static String render(Object value) {
    return String.valueOf(value);
  }

  /**
   * Convenience for building list arguments
   */
  public static List<Object> listValue(long ...items) {
    List<Object> res = new ArrayList<Object>();
    for (long i: items) {
      res.add(i);
    }
    return res;
  }

  /**
   * Convenience for building map arguments from alternating keys and values
   */
  public static Map<Object, Object> mapValue(long ...keysAndValues) {
    Map<Object, Object> res = new LinkedHashMap<Object, Object>();
    for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
      res.put(keysAndValues[i], keysAndValues[i + 1]);
    }
    return res;
  }
}
