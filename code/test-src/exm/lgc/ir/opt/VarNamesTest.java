package exm.lgc.ir.opt;

import static exm.lgc.ir.tree.AstBuilder.block;
import static exm.lgc.ir.tree.AstBuilder.id;
import static exm.lgc.ir.tree.AstBuilder.intVar;
import static exm.lgc.ir.tree.AstBuilder.let;
import static exm.lgc.ir.tree.AstBuilder.lit;
import static exm.lgc.ir.tree.AstBuilder.main;
import static exm.lgc.ir.tree.AstBuilder.program;
import static exm.lgc.ir.tree.AstBuilder.range;
import static exm.lgc.ir.tree.AstBuilder.repeat;
import static exm.lgc.ir.tree.AstBuilder.set;
import static exm.lgc.ir.tree.AstBuilder.show;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Map;

import org.junit.Test;

import exm.lgc.common.lang.Types;
import exm.lgc.common.lang.Var;
import exm.lgc.common.lang.Var.VarKind;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Program;

public class VarNamesTest {

  @Test
  public void testFreshAvoidsExisting() {
    Var taken = intVar("licm_0");
    Var g = Var.global("licm_1", Types.INT);
    Program p = program(Arrays.asList(g),
                        main(let(taken, lit(1)), show(id(taken))));
    VarNames names = new VarNames(p, p.lookupFunction("main"));
    assertEquals("licm_2", names.fresh("licm_"));
    assertEquals("licm_3", names.fresh("licm_"));
    assertEquals("peel_0", names.fresh("peel_"));
  }

  @Test
  public void testFreshTemp() {
    Program p = program(main());
    Var t = new VarNames(p, p.lookupFunction("main"))
                          .freshTemp("licm_", Types.INT);
    assertEquals(VarKind.TEMPORARY, t.kind());
    assertFalse(t.isMutable());
    assertEquals(Types.INT, t.type());
  }

  @Test
  public void testRenameDeclared() {
    Var k = intVar("k");
    Var t = intVar("t");
    Var s = intVar("s");
    Block loop = block(repeat(k, range(lit(1), lit(2)),
                              let(t, id(k)), set(s, id(t))));
    Program p = program(main(let(s, lit(0)), loop.get(0)));
    VarNames names = new VarNames(p, p.lookupFunction("main"));
    Map<Var, Var> renames = names.renameDeclared(loop);

    assertEquals(2, renames.size());
    assertTrue(renames.containsKey(k));
    assertTrue(renames.containsKey(t));
    assertFalse("Assigned, not declared", renames.containsKey(s));
    assertEquals("k_0", renames.get(k).name());
    assertEquals(t.type(), renames.get(t).type());
  }

  @Test
  public void testDeclaredBy() {
    Var k = intVar("k");
    Var s = intVar("s");
    assertEquals(Arrays.asList(k),
        VarNames.declaredBy(repeat(k, range(lit(1), lit(2)))));
    assertEquals(Arrays.asList(s), VarNames.declaredBy(let(s, lit(0))));
    assertTrue(VarNames.declaredBy(set(s, lit(1))).isEmpty());
  }
}
