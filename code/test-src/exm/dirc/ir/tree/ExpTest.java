package exm.dirc.ir.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Test;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.lang.Types;
import exm.dirc.common.lang.Types.Type;
import exm.dirc.ir.tree.RefExp.Def;
import exm.dirc.signature.Platform;

public class ExpTest {

  private static Exp r(int n) {
    return Location.regOf(n);
  }

  private static Exp k(int n) {
    return Const.get(n);
  }

  @Test
  public void testStructuralEquality() {
    Exp a = Location.memOf(Binary.plus(r(28), k(4)));
    Exp b = Location.memOf(Binary.plus(r(28), k(4)));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertFalse(a.equals(Location.memOf(Binary.plus(r(28), k(8)))));
    assertFalse(a.equals(Location.memOf(Binary.minus(r(28), k(4)))));
    assertFalse(r(24).equals(r(25)));
  }

  @Test
  public void testConstEquality() {
    assertEquals(Const.get("hello"), Const.get("hello"));
    assertFalse(Const.get(1).equals(Const.getLong(1)));
    assertEquals(Const.getFlt(2.5), Const.getFlt(2.5));
    // Constants with different conscripts are different uses
    assertFalse(Const.get(5).equals(Const.get(5).withConscript(2)));
  }

  @Test
  public void testWildcards() {
    Exp e = Binary.plus(r(24), k(1));
    assertTrue("WILD matches anything", Terminal.wild().equals(e));
    assertTrue("WILD as argument", e.equals(Terminal.wild()));

    Exp wildReg = Terminal.get(Oper.WILD_REG_OF);
    assertTrue(wildReg.equals(r(24)));
    assertTrue(r(24).equals(wildReg));
    assertFalse(wildReg.equals(Location.memOf(r(24))));

    Exp wildInt = Terminal.get(Oper.WILD_INT_CONST);
    assertTrue(wildInt.equals(k(7)));
    assertTrue(k(5).equals(wildInt));
    assertFalse(wildInt.equals(Const.get("x")));
    assertFalse(Const.get("x").equals(wildInt));

    Exp wildStr = Terminal.get(Oper.WILD_STR_CONST);
    assertTrue(wildStr.equals(Const.get("x")));
    assertTrue(Const.get("x").equals(wildStr));
    assertFalse(wildStr.equals(k(5)));
    assertFalse(k(5).equals(wildStr));

    Exp wildMem = Terminal.get(Oper.WILD_MEM_OF);
    Exp mem = Location.memOf(r(28));
    assertTrue(wildMem.equals(mem));
    assertTrue(mem.equals(wildMem));
    assertFalse(wildMem.equals(r(28)));
    assertFalse(r(28).equals(wildMem));

    Exp wildAddr = Terminal.get(Oper.WILD_ADDR_OF);
    Exp addr = Unary.addrOf(mem);
    assertTrue(wildAddr.equals(addr));
    assertTrue(addr.equals(wildAddr));
    assertFalse(wildAddr.equals(mem));
    assertFalse(mem.equals(wildAddr));

    Exp pattern = Location.memOf(Binary.plus(r(28), Terminal.wild()));
    assertTrue(pattern.equals(Location.memOf(Binary.plus(r(28), k(12)))));
    assertFalse(pattern.equals(Location.memOf(Binary.plus(r(29), k(12)))));
  }

  @Test
  public void testSubscriptEquality() {
    Statement s1 = StubStatement.assign(1, r(24));
    Statement s2 = StubStatement.assign(2, r(24));
    Exp ref1 = RefExp.get(r(24), s1);
    assertEquals(ref1, RefExp.get(r(24), s1));
    assertFalse(ref1.equals(RefExp.get(r(24), s2)));
    assertTrue("wild def matches", RefExp.wild(r(24)).equals(ref1));
    assertFalse(ref1.equals(r(24)));

    assertTrue(r(24).equalsNoSubscript(ref1));
    assertTrue(Binary.plus(r(24), k(1)).equalsNoSubscript(
               Binary.plus(ref1, k(1))));
  }

  @Test
  public void testImplicitDefs() {
    Statement implicit = new StubStatement(3, r(28), true);
    RefExp a = RefExp.get(r(28), Def.IMPLICIT);
    RefExp b = RefExp.get(r(28), implicit);
    assertTrue(a.isImplicitDef());
    assertTrue(b.isImplicitDef());
    assertEquals("implicit statement matches no statement", a, b);
    assertFalse(RefExp.get(r(28), StubStatement.assign(4, r(28)))
                .isImplicitDef());
  }

  @Test
  public void testImmutableRewrites() {
    Exp sub = Binary.plus(r(28), k(4));
    Location mem = Location.memOf(sub);
    assertSame(mem, mem.withSubExp1(sub));

    Exp changed = mem.withSubExp1(Binary.plus(r(28), k(8)));
    assertNotSame(mem, changed);
    assertTrue(changed instanceof Location);
    assertEquals(Location.memOf(Binary.plus(r(28), k(8))), changed);
    // Original unchanged
    assertEquals(Location.memOf(Binary.plus(r(28), k(4))), mem);

    Binary b = Binary.plus(r(24), k(1));
    assertSame(b, b.withSubExps(b.getSubExp1(), b.getSubExp2()));
    assertSame(b, b.withOper(Oper.PLUS));
    assertEquals(Oper.MINUS, b.withOper(Oper.MINUS).getOper());
    assertEquals(Binary.plus(k(1), r(24)), b.commute());
  }

  @Test
  public void testWithChildrenKeepsFields() {
    Statement s = StubStatement.assign(5, r(24));
    RefExp ref = RefExp.get(r(24), s);
    Exp rebuilt = ref.withChildren(Collections.<Exp>singletonList(r(25)));
    assertTrue(rebuilt instanceof RefExp);
    assertSame(s, ((RefExp)rebuilt).getDef().getStatement());

    TypedExp typed = TypedExp.get(Types.INT32, r(24));
    Exp rt = typed.withChildren(Collections.<Exp>singletonList(r(25)));
    assertEquals(Types.INT32, ((TypedExp)rt).getType());
  }

  @Test(expected=DIRCRuntimeError.class)
  public void testWrongArity() {
    Binary.plus(r(24), k(1)).withChildren(Arrays.<Exp>asList(r(24)));
  }

  @Test(expected=DIRCRuntimeError.class)
  public void testNullChild() {
    Location.memOf(null);
  }

  @Test
  public void testClone() {
    Exp e = Ternary.tern(Binary.get(Oper.LESS, r(24), k(0)),
                         Unary.neg(r(24)), r(24));
    Exp c = e.clone();
    assertNotSame(e, c);
    assertEquals(e, c);
    assertNotSame(e.getSubExp1(), c.getSubExp1());
  }

  @Test
  public void testFunctionConstantOrder() {
    Procedure p1 = new StubProcedure("f", Platform.PENTIUM, false);
    Procedure p2 = new StubProcedure("f", Platform.PENTIUM, false);
    Const f1 = Const.getFunc(p1);
    Const f2 = Const.getFunc(p2);
    assertEquals(f1, Const.getFunc(p1));
    assertEquals(f1, f1.clone());
    assertEquals(0, f1.compareTo(f1.clone()));
    assertFalse(f1.equals(f2));
    // Same name: first procedure used orders first
    assertTrue(f1.compareTo(f2) < 0);
    assertTrue(f2.compareTo(f1) > 0);
    for (int i = 0; i < 10; i++) {
      assertTrue(Const.getFunc(p1).compareTo(Const.getFunc(p2)) < 0);
    }
    assertTrue(Const.getFunc(new StubProcedure("a", Platform.PENTIUM, false))
                    .compareTo(f1) < 0);
  }

  private static final Type[] CORPUS_TYPES = new Type[] {
    Types.INT32, Types.BOOL, Types.pointerTo(Types.CHAR), Types.floatType(64)
  };

  private static final Oper[] CORPUS_BINOPS = new Oper[] {
    Oper.PLUS, Oper.MINUS, Oper.MULT, Oper.BIT_AND, Oper.LESS
  };

  /**
   * Random tree over all non-wildcard node kinds
   */
  private static Exp randomExp(Random rand, int depth,
                               List<Procedure> procs, List<Statement> defs) {
    int choice = depth == 0 ? rand.nextInt(4) : rand.nextInt(11);
    switch (choice) {
      case 0:
        return Const.get(rand.nextInt(3)).withConscript(rand.nextInt(2));
      case 1:
        return r(24 + rand.nextInt(3));
      case 2:
        switch (rand.nextInt(3)) {
          case 0:
            return Const.get(rand.nextBoolean() ? "a" : "b");
          case 1:
            return Const.getFunc(procs.get(rand.nextInt(procs.size())));
          default:
            return Const.getFlt(rand.nextInt(2) + 0.5);
        }
      case 3:
        if (rand.nextInt(4) == 0) {
          return rand.nextBoolean() ? Terminal.nil()
                                    : Terminal.bool(rand.nextBoolean());
        }
        return TypeVal.get(CORPUS_TYPES[rand.nextInt(CORPUS_TYPES.length)]);
      case 4:
        return Location.memOf(randomExp(rand, depth - 1, procs, defs));
      case 5:
        return rand.nextBoolean()
            ? Unary.neg(randomExp(rand, depth - 1, procs, defs))
            : Unary.addrOf(randomExp(rand, depth - 1, procs, defs));
      case 6:
      case 7:
        return Binary.get(CORPUS_BINOPS[rand.nextInt(CORPUS_BINOPS.length)],
                          randomExp(rand, depth - 1, procs, defs),
                          randomExp(rand, depth - 1, procs, defs));
      case 8:
        return Ternary.tern(randomExp(rand, depth - 1, procs, defs),
                            randomExp(rand, depth - 1, procs, defs),
                            randomExp(rand, depth - 1, procs, defs));
      case 9:
        return TypedExp.get(CORPUS_TYPES[rand.nextInt(CORPUS_TYPES.length)],
                            randomExp(rand, depth - 1, procs, defs));
      default:
        Exp loc = rand.nextBoolean() ? r(24 + rand.nextInt(2))
                : Location.memOf(randomExp(rand, depth - 1, procs, defs));
        int d = rand.nextInt(defs.size() + 1);
        return d == defs.size() ? RefExp.get(loc, Def.IMPLICIT)
                                : RefExp.get(loc, defs.get(d));
    }
  }

  @Test
  public void testOrderingGeneratedCorpus() {
    Random rand = new Random(20131017L);
    List<Procedure> procs = new ArrayList<Procedure>();
    procs.add(new StubProcedure("f", Platform.PENTIUM, false));
    procs.add(new StubProcedure("f", Platform.PENTIUM, false));
    procs.add(new StubProcedure("g", Platform.PENTIUM, false));
    List<Statement> defs = new ArrayList<Statement>();
    for (int i = 1; i <= 3; i++) {
      defs.add(StubStatement.assign(i, r(24)));
    }

    List<Exp> corpus = new ArrayList<Exp>();
    for (int i = 0; i < 300; i++) {
      Exp e = randomExp(rand, 3, procs, defs);
      corpus.add(e);
      if (i % 5 == 0) {
        corpus.add(e.clone());
      }
    }

    for (Exp a: corpus) {
      for (Exp b: corpus) {
        int ab = a.compareTo(b);
        assertEquals("equals vs compareTo: " + a + " vs " + b,
                     a.equals(b), ab == 0);
        assertEquals("antisymmetric: " + a + " vs " + b,
                     Integer.signum(ab), -Integer.signum(b.compareTo(a)));
        if (ab == 0) {
          assertEquals(a.hashCode(), b.hashCode());
        }
      }
    }

    List<Exp> sorted = new ArrayList<Exp>(corpus);
    Collections.sort(sorted);
    int n = sorted.size();
    for (int i = 0; i + 1 < n; i++) {
      assertTrue(sorted.get(i).compareTo(sorted.get(i + 1)) <= 0);
    }
    for (int t = 0; t < 20000; t++) {
      int[] idx = new int[] {rand.nextInt(n), rand.nextInt(n), rand.nextInt(n)};
      Arrays.sort(idx);
      Exp a = sorted.get(idx[0]);
      Exp b = sorted.get(idx[1]);
      Exp c = sorted.get(idx[2]);
      assertTrue("transitive: " + a + " <= " + b + " <= " + c,
                 a.compareTo(c) <= 0);
    }
  }

  @Test
  public void testOrdering() {
    List<Exp> exps = new ArrayList<Exp>();
    exps.add(Binary.plus(r(24), k(2)));
    exps.add(r(25));
    exps.add(k(3));
    exps.add(Location.memOf(r(28)));
    exps.add(r(24));
    exps.add(Binary.plus(r(24), k(1)));
    exps.add(Const.get("s"));

    for (Exp a: exps) {
      assertEquals(0, a.compareTo(a.clone()));
      for (Exp b: exps) {
        assertEquals("antisymmetric: " + a + " vs " + b,
            Integer.signum(a.compareTo(b)), -Integer.signum(b.compareTo(a)));
        if (a.compareTo(b) == 0) {
          assertEquals(a, b);
        }
      }
    }

    assertTrue(r(24).compareTo(r(25)) < 0);
    assertTrue(Binary.plus(r(24), k(1)).compareTo(
               Binary.plus(r(24), k(2))) < 0);

    List<Exp> sorted = new ArrayList<Exp>(exps);
    Collections.sort(sorted);
    Collections.reverse(exps);
    Collections.sort(exps);
    assertEquals("sort is independent of input order", sorted, exps);
  }

  @Test
  public void testPredicates() {
    assertTrue(r(24).isRegN(24));
    assertFalse(r(24).isRegN(25));
    assertTrue(r(24).isRegOfK());
    assertFalse(Location.regOf(Location.temp("tmp")).isRegOfK());
    assertTrue(Location.regOf(Location.temp("tmp")).isTemp());
    assertTrue(Location.memOf(k(0x1000)).isMemOfConst());
    assertTrue(Unary.get(Oper.MEM_OF, r(28)) instanceof Location);

    Exp afp = Terminal.get(Oper.AFP);
    assertTrue(afp.isAfpTerm());
    assertTrue(Binary.minus(afp, k(8)).isAfpTerm());
    assertTrue(TypedExp.get(Types.INT32, Binary.plus(afp, k(4))).isAfpTerm());
    assertFalse(Binary.plus(afp, r(24)).isAfpTerm());
    assertFalse(r(28).isAfpTerm());

    assertEquals(3, Unary.var(3).getVarIndex());
    assertEquals(r(24), Unary.get(Oper.GUARD, r(24)).getGuard());
    assertNull(r(24).getGuard());

    assertEquals("hi", Const.get("hi").getAnyStrConst());
    assertEquals("hi", Unary.addrOf(Location.memOf(Const.get("hi")))
                            .getAnyStrConst());
    assertEquals("hi", Unary.addrOf(RefExp.get(Const.get("hi"), Def.IMPLICIT))
                            .getAnyStrConst());
    assertNull(r(24).getAnyStrConst());
  }

  @Test
  public void testTerminals() {
    assertSame(Terminal.trueExp(), Terminal.bool(true));
    assertSame(Terminal.falseExp(), Terminal.bool(false));
    assertTrue(Terminal.trueExp().isBoolConst());
    assertTrue(Terminal.nil().isNil());
    assertNotSame(Terminal.nil(), Terminal.nil().clone());
    assertEquals(Terminal.nil(), Terminal.nil().clone());
  }

  @Test
  public void testConstWithInt() {
    Const c = Const.get(4).withConscript(3);
    Const d = c.withInt(8);
    assertEquals(8, d.getInt());
    assertEquals(3, d.getConscript());
  }

  @Test
  public void testList() {
    Exp list = Binary.list(Arrays.<Exp>asList(r(24), r(25)));
    assertEquals(Oper.LIST, list.getOper());
    assertEquals(r(24), list.getSubExp1());
    assertEquals(r(25), list.getSubExp2().getSubExp1());
    assertTrue(list.getSubExp2().getSubExp2().isNil());
    assertTrue(Binary.list(new ArrayList<Exp>()).isNil());
  }
}
