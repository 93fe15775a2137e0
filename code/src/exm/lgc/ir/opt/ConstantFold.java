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
package exm.lgc.ir.opt;

import org.apache.log4j.Logger;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.Settings;
import exm.lgc.common.exceptions.InvalidOptionException;
import exm.lgc.common.exceptions.LGCRuntimeError;
import exm.lgc.ir.tree.AstRewriter;
import exm.lgc.ir.tree.Exprs.BinaryOp;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Exprs.Literal;
import exm.lgc.ir.tree.Exprs.Not;
import exm.lgc.ir.tree.Function;
import exm.lgc.ir.tree.Program;

/**
 * Fold operations on literals.  Integer arithmetic wraps, as at runtime.
 * Operations that would fault, such as division by zero, are left for
 * runtime.  Statements are never removed.
 *
 * Folding of a function stops after a fixed number of steps, in which
 * case the function is left unchanged.
 */
public class ConstantFold implements OptimizerPass {

  @Override
  public String getPassName() {
    return "Constant folding";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_CONSTANT_FOLD;
  }

  @Override
  public Program optimize(Logger logger, Program program,
                          AnalysisResults analyses) {
    long budget;
    try {
      budget = Settings.getLong(Settings.OPT_FOLD_STEP_BUDGET);
    } catch (InvalidOptionException e) {
      throw new LGCRuntimeError(e.getMessage());
    }

    Program result = program;
    for (Function f: program.functions()) {
      if (f.isNative()) {
        continue;
      }
      Folder folder = new Folder(budget);
      Function newF = folder.rewrite(f);
      if (folder.steps > budget) {
        analyses.report(Diagnostic.Kind.STEP_BUDGET_EXHAUSTED,
            "constant folding gave up on " + f.name() + " after " +
            budget + " steps");
      } else if (folder.folded > 0) {
        logger.debug("Folded " + folder.folded + " expressions in " +
                     f.name());
        result = result.replaceFunction(newF);
      }
    }
    return result;
  }

  private static class Folder extends AstRewriter {
    private final long budget;
    long steps = 0;
    int folded = 0;

    Folder(long budget) {
      this.budget = budget;
    }

    @Override
    public Expr rewrite(Expr e) {
      steps++;
      return super.rewrite(e);
    }

    @Override
    public Expr visitBinaryOp(BinaryOp e) {
      Expr left = rewrite(e.left);
      Expr right = rewrite(e.right);
      if (steps <= budget && left instanceof Literal &&
          right instanceof Literal) {
        Literal res = fold(e, (Literal)left, (Literal)right);
        if (res != null) {
          folded++;
          return res;
        }
      }
      return new BinaryOp(e.op, left, right, e.type());
    }

    @Override
    public Expr visitNot(Not e) {
      Expr operand = rewrite(e.operand);
      if (steps <= budget && operand instanceof Literal &&
          ((Literal)operand).isBool()) {
        folded++;
        return Literal.boolLit(!((Literal)operand).boolValue());
      }
      return new Not(operand);
    }
  }

  /**
   * @return folded value, or null if it can't or shouldn't be folded
   */
  private static Literal fold(BinaryOp e, Literal l, Literal r) {
    if (l.isInt() && r.isInt()) {
      return foldInt(e, l.intValue(), r.intValue());
    } else if (l.isBool() && r.isBool()) {
      boolean a = l.boolValue();
      boolean b = r.boolValue();
      switch (e.op) {
        case AND:
          return Literal.boolLit(a && b);
        case OR:
          return Literal.boolLit(a || b);
        case EQ:
          return Literal.boolLit(a == b);
        case NE:
          return Literal.boolLit(a != b);
        default:
          return null;
      }
    } else if (l.value instanceof String && r.value instanceof String) {
      String a = (String)l.value;
      String b = (String)r.value;
      switch (e.op) {
        case CONCAT:
          return Literal.textLit(a + b);
        case EQ:
          return Literal.boolLit(a.equals(b));
        case NE:
          return Literal.boolLit(!a.equals(b));
        default:
          return null;
      }
    }
    return null;
  }

  private static Literal foldInt(BinaryOp e, long a, long b) {
    switch (e.op) {
      case ADD:
        return Literal.intLit(a + b);
      case SUB:
        return Literal.intLit(a - b);
      case MUL:
        return Literal.intLit(a * b);
      case DIV:
        // Faults at runtime
        return b == 0 ? null : Literal.intLit(a / b);
      case MOD:
        return b == 0 ? null : Literal.intLit(a % b);
      case LT:
        return Literal.boolLit(a < b);
      case LE:
        return Literal.boolLit(a <= b);
      case GT:
        return Literal.boolLit(a > b);
      case GE:
        return Literal.boolLit(a >= b);
      case EQ:
        return Literal.boolLit(a == b);
      case NE:
        return Literal.boolLit(a != b);
      default:
        return null;
    }
  }
}
