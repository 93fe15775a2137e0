package exm.lgc.ir.opt;

import static exm.lgc.ir.opt.OptTesting.assertSameBehavior;
import static exm.lgc.ir.opt.OptTesting.runPass;
import static exm.lgc.ir.tree.AstBuilder.add;
import static exm.lgc.ir.tree.AstBuilder.block;
import static exm.lgc.ir.tree.AstBuilder.check;
import static exm.lgc.ir.tree.AstBuilder.fn;
import static exm.lgc.ir.tree.AstBuilder.id;
import static exm.lgc.ir.tree.AstBuilder.ifElse;
import static exm.lgc.ir.tree.AstBuilder.intVar;
import static exm.lgc.ir.tree.AstBuilder.let;
import static exm.lgc.ir.tree.AstBuilder.lit;
import static exm.lgc.ir.tree.AstBuilder.loop;
import static exm.lgc.ir.tree.AstBuilder.lt;
import static exm.lgc.ir.tree.AstBuilder.program;
import static exm.lgc.ir.tree.AstBuilder.range;
import static exm.lgc.ir.tree.AstBuilder.repeat;
import static exm.lgc.ir.tree.AstBuilder.ret;
import static exm.lgc.ir.tree.AstBuilder.set;
import static exm.lgc.ir.tree.AstBuilder.show;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.lgc.common.Logging;
import exm.lgc.common.Settings;
import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Exprs.Identifier;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts.If;
import exm.lgc.ir.tree.Stmts.Let;
import exm.lgc.ir.tree.Stmts.Repeat;
import exm.lgc.ir.tree.Stmts.Stmt;
import exm.lgc.ir.tree.Stmts.While;

public class LoopUnswitchTest {

  private static Logger logger;

  private static final Var FLAG = Var.param("flag", Types.BOOL);
  private static final Var N = Var.param("n", Types.INT);

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("LoopUnswitchTest.lgc.log", true);
  }

  /**
   * while i < n { if flag { s += 1 } else { s += 2 }; i += 1 }
   */
  private static Program flagLoop(Stmt ...extra) {
    Var i = intVar("i");
    Var s = intVar("s");
    Stmt[] body = new Stmt[extra.length + 2];
    body[0] = ifElse(id(FLAG), block(set(s, add(id(s), lit(1)))),
                               block(set(s, add(id(s), lit(2)))));
    System.arraycopy(extra, 0, body, 1, extra.length);
    body[body.length - 1] = set(i, add(id(i), lit(1)));
    return program(fn("f", Arrays.asList(FLAG, N), Types.INT,
        let(i, lit(0)), let(s, lit(0)),
        loop(lt(id(i), id(N)), body),
        ret(id(s))));
  }

  private static void assertNoIf(Block b) {
    for (Stmt s: b) {
      assertFalse("Branch left in loop: " + s, s instanceof If);
    }
  }

  @Test
  public void testUnswitchWhile() {
    Program p = flagLoop();
    Program result = runPass(new LoopUnswitch(), logger, p);

    Block body = result.lookupFunction("f").body();
    assertEquals(4, body.size());
    If outer = (If)body.get(2);
    assertEquals(FLAG, ((Identifier)outer.cond).var);
    While thenLoop = (While)outer.thenBlock.get(0);
    While elseLoop = (While)outer.elseBlock.get(0);
    assertNoIf(thenLoop.body);
    assertNoIf(elseLoop.body);

    for (boolean flag: new boolean[] {true, false}) {
      for (long n: new long[] {0, 1, 3}) {
        assertSameBehavior(p, result, "f", flag, n);
      }
    }
  }

  @Test
  public void testElseCopyRenamed() {
    Var t = intVar("t");
    Var k = intVar("k");
    Program p = program(fn("g", Arrays.asList(FLAG), Types.NOTHING,
        repeat(k, range(lit(1), lit(3)),
               ifElse(id(FLAG), block(let(t, id(k)), show(id(t))),
                                block(let(t, lit(0)), show(id(t)))))));
    Program result = runPass(new LoopUnswitch(), logger, p);

    If outer = (If)result.lookupFunction("g").body().get(0);
    Repeat thenLoop = (Repeat)outer.thenBlock.get(0);
    Repeat elseLoop = (Repeat)outer.elseBlock.get(0);
    assertEquals(k, thenLoop.var);
    assertFalse("Loop variable renamed in the copy",
                elseLoop.var.equals(k));
    Let elseLet = (Let)elseLoop.body.get(0);
    assertFalse(elseLet.var.equals(t));
    assertEquals(((Let)thenLoop.body.get(0)).var, t);

    assertSameBehavior(p, result, "g", true);
    assertSameBehavior(p, result, "g", false);
  }

  @Test
  public void testLoopWithCheckKept() {
    Var user = intVar("user");
    Program p = flagLoop(check(user, "valid"));
    assertSame(p, runPass(new LoopUnswitch(), logger, p));
  }

  @Test
  public void testVariantConditionKept() {
    Var i = intVar("i");
    Var s = intVar("s");
    Program p = program(fn("f", Arrays.asList(N), Types.INT,
        let(i, lit(0)), let(s, lit(0)),
        loop(lt(id(i), id(N)),
             ifElse(lt(id(i), lit(2)), block(set(s, add(id(s), lit(1)))),
                                       block()),
             set(i, add(id(i), lit(1)))),
        ret(id(s))));
    assertSame(p, runPass(new LoopUnswitch(), logger, p));
  }

  @Test
  public void testSizeLimit() {
    Settings.set(Settings.OPT_UNSWITCH_MAX_NODES, "3");
    try {
      Program p = flagLoop();
      assertSame(p, runPass(new LoopUnswitch(), logger, p));
    } finally {
      Settings.reset(Settings.OPT_UNSWITCH_MAX_NODES);
    }
  }
}
