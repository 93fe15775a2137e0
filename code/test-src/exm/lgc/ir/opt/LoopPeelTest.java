package exm.lgc.ir.opt;

import static exm.lgc.ir.opt.OptTesting.assertSameBehavior;
import static exm.lgc.ir.opt.OptTesting.letsWithPrefix;
import static exm.lgc.ir.opt.OptTesting.runPass;
import static exm.lgc.ir.tree.AstBuilder.add;
import static exm.lgc.ir.tree.AstBuilder.block;
import static exm.lgc.ir.tree.AstBuilder.eq;
import static exm.lgc.ir.tree.AstBuilder.fn;
import static exm.lgc.ir.tree.AstBuilder.id;
import static exm.lgc.ir.tree.AstBuilder.ifElse;
import static exm.lgc.ir.tree.AstBuilder.intVar;
import static exm.lgc.ir.tree.AstBuilder.let;
import static exm.lgc.ir.tree.AstBuilder.lit;
import static exm.lgc.ir.tree.AstBuilder.main;
import static exm.lgc.ir.tree.AstBuilder.mul;
import static exm.lgc.ir.tree.AstBuilder.program;
import static exm.lgc.ir.tree.AstBuilder.range;
import static exm.lgc.ir.tree.AstBuilder.repeat;
import static exm.lgc.ir.tree.AstBuilder.set;
import static exm.lgc.ir.tree.AstBuilder.show;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.lgc.common.Logging;
import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts.If;
import exm.lgc.ir.tree.Stmts.Repeat;
import exm.lgc.ir.tree.Stmts.Show;
import exm.lgc.ir.tree.Stmts.Stmt;

public class LoopPeelTest {

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("LoopPeelTest.lgc.log", true);
  }

  private static Repeat onlyLoop(Block b) {
    Repeat found = null;
    for (Stmt s: b) {
      if (s instanceof Repeat) {
        assertEquals("More than one loop", null, found);
        found = (Repeat)s;
      }
    }
    return found;
  }

  private static Program boundTest(Expr start, Expr end, Expr bound,
                                   Stmt ...prefix) {
    Var k = intVar("k");
    Var s = intVar("s");
    Stmt[] body = new Stmt[prefix.length + 3];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    body[prefix.length] = let(s, lit(0));
    body[prefix.length + 1] = repeat(k, range(start, end),
        ifElse(eq(id(k), bound), block(show(mul(id(k), lit(100)))),
                                 block(set(s, add(id(s), id(k))))));
    body[prefix.length + 2] = show(id(s));
    return program(main(body));
  }

  @Test
  public void testPeelFirst() {
    Program p = boundTest(lit(1), lit(5), lit(1));
    Program result = runPass(new LoopPeel(), logger, p);

    Block body = result.lookupFunction("main").body();
    assertEquals(1, letsWithPrefix(body, "peel_").size());
    Repeat rest = onlyLoop(body);
    for (Stmt s: rest.body) {
      assertTrue("Test left in loop", !(s instanceof If));
    }
    int at = body.statements().indexOf(rest);
    assertTrue("Peeled iteration comes before the loop",
               body.get(at - 1) instanceof Show);
    assertSameBehavior(p, result, "main");
  }

  @Test
  public void testPeelLast() {
    Var n = intVar("n");
    Program p = boundTest(lit(1), id(n), id(n), let(n, lit(4)));
    Program result = runPass(new LoopPeel(), logger, p);

    Block body = result.lookupFunction("main").body();
    Repeat rest = onlyLoop(body);
    assertEquals(1, rest.body.size());
    int at = body.statements().indexOf(rest);
    assertTrue("Peeled iteration comes after the loop",
               body.get(at + 1) instanceof Show);
    assertEquals(at + 3, body.size());
    assertSameBehavior(p, result, "main");
  }

  @Test
  public void testMaybeEmptyRangeKept() {
    Var n = Var.param("n", Types.INT);
    Var k = intVar("k");
    Program p = program(fn("f", Arrays.asList(n), Types.NOTHING,
        repeat(k, range(lit(1), id(n)),
               ifElse(eq(id(k), lit(1)), block(show(lit(0))),
                                         block(show(id(k)))))));
    Program result = runPass(new LoopPeel(), logger, p);
    assertSame(p, result);
    assertSameBehavior(p, result, "f", 0L);
  }

  @Test
  public void testOtherTestKept() {
    Program p = boundTest(lit(1), lit(5), lit(3));
    assertSame(p, runPass(new LoopPeel(), logger, p));
  }
}
