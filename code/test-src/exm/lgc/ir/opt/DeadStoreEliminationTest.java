package exm.lgc.ir.opt;

import static exm.lgc.ir.opt.OptTesting.assertSameBehavior;
import static exm.lgc.ir.opt.OptTesting.runPass;
import static exm.lgc.ir.tree.AstBuilder.add;
import static exm.lgc.ir.tree.AstBuilder.boolVar;
import static exm.lgc.ir.tree.AstBuilder.call;
import static exm.lgc.ir.tree.AstBuilder.callStmt;
import static exm.lgc.ir.tree.AstBuilder.check;
import static exm.lgc.ir.tree.AstBuilder.div;
import static exm.lgc.ir.tree.AstBuilder.fn;
import static exm.lgc.ir.tree.AstBuilder.id;
import static exm.lgc.ir.tree.AstBuilder.intVar;
import static exm.lgc.ir.tree.AstBuilder.let;
import static exm.lgc.ir.tree.AstBuilder.lit;
import static exm.lgc.ir.tree.AstBuilder.loop;
import static exm.lgc.ir.tree.AstBuilder.lt;
import static exm.lgc.ir.tree.AstBuilder.main;
import static exm.lgc.ir.tree.AstBuilder.program;
import static exm.lgc.ir.tree.AstBuilder.ret;
import static exm.lgc.ir.tree.AstBuilder.set;
import static exm.lgc.ir.tree.AstBuilder.show;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.lgc.common.Logging;
import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Exprs.Literal;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.ReferenceInterpreter;
import exm.lgc.ir.tree.Stmts;
import exm.lgc.ir.tree.Stmts.While;
import exm.lgc.ir.tree.TreeWalk;

public class DeadStoreEliminationTest {

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("DeadStoreEliminationTest.lgc.log", true);
  }

  @Test
  public void testOverwrittenStore() {
    Var x = intVar("x");
    Program p = program(main(let(x, lit(0)), show(id(x)),
                             set(x, lit(1)), set(x, lit(2)), show(id(x))));
    Program result = runPass(new DeadStoreElimination(), logger, p);

    Block body = result.lookupFunction("main").body();
    assertEquals(4, body.size());
    Stmts.Set remaining = (Stmts.Set)body.get(2);
    assertEquals(2L, ((Literal)remaining.value).intValue());
    assertSameBehavior(p, result, "main");
  }

  @Test
  public void testReadBetweenStores() {
    Var x = intVar("x");
    Program p = program(main(let(x, lit(0)), set(x, lit(1)), show(id(x)),
                             set(x, lit(2)), show(id(x))));
    assertSame(p, runPass(new DeadStoreElimination(), logger, p));
  }

  @Test
  public void testSelfReadingOverwrite() {
    Var x = intVar("x");
    Program p = program(main(let(x, lit(0)), set(x, lit(1)),
                             set(x, add(id(x), lit(1))), show(id(x))));
    assertSame(p, runPass(new DeadStoreElimination(), logger, p));
  }

  @Test
  public void testGlobalStore() {
    Var g = Var.global("g", Types.INT);
    Program p = program(Arrays.asList(g),
        fn("setg", Collections.<Var>emptyList(), Types.NOTHING,
           set(g, lit(1)), set(g, lit(2))),
        main(callStmt("setg"), show(id(g))));
    Program result = runPass(new DeadStoreElimination(), logger, p);
    assertEquals(1, result.lookupFunction("setg").body().size());
    assertSameBehavior(p, result, "main");
  }

  @Test
  public void testFaultingValueKept() {
    Var x = intVar("x");
    Var d = Var.param("d", Types.INT);
    Program p = program(fn("f", Arrays.asList(d), Types.INT,
        let(x, lit(0)), set(x, div(lit(1), id(d))), set(x, lit(2)),
        ret(id(x))));
    Program result = runPass(new DeadStoreElimination(), logger, p);
    assertSame(p, result);
    assertTrue(ReferenceInterpreter.run(result, "f", 0L).faulted());
  }

  @Test
  public void testCallValueKept() {
    Var x = intVar("x");
    Program p = program(
        fn("noisy", Collections.<Var>emptyList(), Types.INT,
           show(lit(5)), ret(lit(1))),
        main(let(x, lit(0)), set(x, call("noisy", Types.INT)),
             set(x, lit(2)), show(id(x))));
    Program result = runPass(new DeadStoreElimination(), logger, p);
    assertSame(p, result);
  }

  @Test
  public void testCheckIsBarrier() {
    Var x = intVar("x");
    Var ok = boolVar("ok");
    Program p = program(main(let(ok, lit(true)), let(x, lit(0)),
                             set(x, lit(1)), check(ok, "admin"),
                             set(x, lit(2)), show(id(x))));
    Program result = runPass(new DeadStoreElimination(), logger, p);
    assertSame(p, result);
    assertEquals(1, TreeWalk.findChecks(result).size());
  }

  @Test
  public void testInLoopBody() {
    Var i = intVar("i");
    Var x = intVar("x");
    Program p = program(main(let(i, lit(0)), let(x, lit(0)),
        loop(lt(id(i), lit(3)),
             set(x, id(i)), set(x, add(id(i), lit(10))), show(id(x)),
             set(i, add(id(i), lit(1))))));
    Program result = runPass(new DeadStoreElimination(), logger, p);
    While w = (While)result.lookupFunction("main").body().get(2);
    assertEquals(3, w.body.size());
    assertSameBehavior(p, result, "main");
  }
}
