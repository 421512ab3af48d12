package exm.dirc.ir.match;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.RefExp;
import exm.dirc.ir.tree.RefExp.Def;
import exm.dirc.ir.tree.StubStatement;
import exm.dirc.ir.tree.Unary;

public class StringPatternMatcherTest {

  private static Exp r(int n) {
    return Location.regOf(n);
  }

  @Test
  public void testImplicitSubscript() {
    Exp e = RefExp.get(Location.memOf(Binary.plus(r(28), Const.get(4))),
                       Def.IMPLICIT);
    Map<String, Exp> bindings = new HashMap<String, Exp>();
    assertTrue(StringPatternMatcher.match(e, "m[a + 4]{-}", bindings));
    assertEquals(r(28), bindings.get("a"));

    bindings.clear();
    assertFalse(StringPatternMatcher.match(e, "m[a - 4]{-}", bindings));
  }

  @Test
  public void testNumberedSubscript() {
    Exp e = RefExp.get(r(24), StubStatement.assign(7, r(24)));
    Map<String, Exp> bindings = new HashMap<String, Exp>();
    assertTrue(StringPatternMatcher.match(e, "x{7}", bindings));
    assertEquals(r(24), bindings.get("x"));
    assertFalse(StringPatternMatcher.match(e, "x{8}", bindings));
    assertFalse(StringPatternMatcher.match(e, "x{-}", bindings));
  }

  @Test
  public void testLocations() {
    Map<String, Exp> bindings = new HashMap<String, Exp>();
    Exp mem = Location.memOf(Binary.minus(r(29), Const.get(8)));
    assertTrue(StringPatternMatcher.match(mem, "m[base - off]", bindings));
    assertEquals(r(29), bindings.get("base"));
    assertEquals(Const.get(8), bindings.get("off"));
    assertFalse(StringPatternMatcher.match(mem, "r[base]", bindings));

    bindings.clear();
    assertTrue(StringPatternMatcher.match(Unary.addrOf(mem), "a[m[p]]",
                                          bindings));
    assertEquals(Binary.minus(r(29), Const.get(8)), bindings.get("p"));
  }

  @Test
  public void testMemberAndIndex() {
    Map<String, Exp> bindings = new HashMap<String, Exp>();
    Exp member = Binary.get(Oper.MEMBER_ACCESS, Location.local("s", null),
                            Const.get("field"));
    assertTrue(StringPatternMatcher.match(member, "v.field", bindings));
    assertEquals(Location.local("s", null), bindings.get("v"));

    bindings.clear();
    Exp index = Binary.get(Oper.ARRAY_INDEX, Location.local("arr", null),
                           r(24));
    assertTrue(StringPatternMatcher.match(index, "a[i]", bindings));
    assertEquals(r(24), bindings.get("i"));
  }

  @Test
  public void testLiteral() {
    Map<String, Exp> bindings = new HashMap<String, Exp>();
    assertTrue(StringPatternMatcher.match(Binary.plus(r(24), Const.get(1)),
                                          "r24 + 1", bindings));
    assertTrue(bindings.isEmpty());
  }

  @Test
  public void testTopLevelIndex() {
    assertEquals(6, StringPatternMatcher.topLevelIndexOf("m[a+b]+c", '+'));
    assertEquals(-1, StringPatternMatcher.topLevelIndexOf("{a-b}", '-'));
  }
}
