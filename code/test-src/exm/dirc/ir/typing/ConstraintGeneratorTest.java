package exm.dirc.ir.typing;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.lang.Types;
import exm.dirc.common.lang.Types.Type;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.RefExp;
import exm.dirc.ir.tree.RefExp.Def;
import exm.dirc.ir.tree.Terminal;
import exm.dirc.ir.tree.Ternary;
import exm.dirc.ir.tree.TypeVal;
import exm.dirc.ir.tree.Unary;

public class ConstraintGeneratorTest {

  private static Exp r(int n) {
    return Location.regOf(n);
  }

  private static Exp k(int n) {
    return Const.get(n);
  }

  private static Exp tv(Type t) {
    return TypeVal.get(t);
  }

  private static Exp typeOf(Exp e) {
    return Unary.get(Oper.TYPE_OF, e);
  }

  private static Exp eq(Exp a, Exp b) {
    return Binary.get(Oper.EQUALS, a, b);
  }

  private static Exp gen(Exp e, Exp result) {
    return ConstraintGenerator.genConstraints(e, result);
  }

  @Test
  public void testIntConstAgainstType() {
    assertEquals(eq(typeOf(k(5)), tv(Types.INT32)), gen(k(5), tv(Types.INT32)));
    assertEquals("ints can be floats", eq(typeOf(k(5)), tv(Types.floatType(32))),
                 gen(k(5), tv(Types.floatType(32))));
    assertEquals("small ints are not pointers", Terminal.falseExp(),
                 gen(k(5), tv(Types.pointerTo(Types.CHAR))));
    Type ptr = Types.pointerTo(Types.INT32);
    assertEquals(eq(typeOf(k(0x1000)), tv(ptr)), gen(k(0x1000), tv(ptr)));
    assertEquals("large unsigned value", eq(typeOf(k(-4)), tv(ptr)),
                 gen(k(-4), tv(ptr)));
  }

  @Test
  public void testOtherConstsAgainstType() {
    Type charPtr = Types.pointerTo(Types.CHAR);
    Exp str = Const.get("hello");
    assertEquals(eq(typeOf(str), tv(charPtr)), gen(str, tv(charPtr)));
    Type arrPtr = Types.pointerTo(Types.arrayOf(Types.CHAR, 10));
    assertEquals(eq(typeOf(str), tv(arrPtr)), gen(str, tv(arrPtr)));
    assertEquals(Terminal.falseExp(), gen(str, tv(Types.INT32)));

    Exp flt = Const.getFlt(1.5);
    assertEquals(eq(typeOf(flt), tv(Types.floatType(64))),
                 gen(flt, tv(Types.floatType(64))));
    assertEquals(Terminal.falseExp(), gen(flt, tv(Types.INT32)));
  }

  @Test
  public void testConstsAgainstVariable() {
    Exp var = typeOf(r(24));
    assertEquals(eq(var, tv(Types.intType(64))), gen(Const.getLong(3), var));
    assertEquals(eq(var, tv(Types.pointerTo(Types.CHAR))),
                 gen(Const.get("s"), var));
    assertEquals(eq(var, tv(Types.floatType(64))), gen(Const.getFlt(2.0), var));

    Exp intCon = gen(k(3), var);
    assertEquals(Oper.OR, intCon.getOper());
    Exp intAlt = intCon.getSubExp1();
    assertEquals(eq(var, tv(Types.INT_ANY)), intAlt.getSubExp1());
    assertEquals(eq(typeOf(k(3)), tv(Types.INT_ANY)), intAlt.getSubExp2());
    Exp ptrAlt = intCon.getSubExp2();
    assertEquals(Oper.AND, ptrAlt.getOper());
    TypeVal ptr = (TypeVal)ptrAlt.getSubExp1().getSubExp2();
    assertEquals(true, ptr.getType().isPointerToAlpha());
  }

  @Test
  public void testLocations() {
    Exp var = typeOf(r(25));
    assertEquals(Terminal.trueExp(), gen(r(24), tv(Types.INT32)));
    assertEquals(eq(typeOf(r(24)), var), gen(r(24), var));
    Exp local = Location.local("x", null);
    assertEquals(eq(typeOf(local), var), gen(local, var));
    assertEquals(Terminal.trueExp(), gen(Location.memOf(r(28)), var));

    Exp ref = RefExp.get(r(24), Def.IMPLICIT);
    assertEquals(eq(typeOf(ref), var), gen(ref, var));
    assertEquals(Terminal.trueExp(),
                 gen(RefExp.get(Location.memOf(r(28)), Def.IMPLICIT), var));
  }

  @Test
  public void testConversions() {
    Exp itof = Ternary.get(Oper.ITOF, k(32), k(64), r(24));
    assertEquals(Terminal.trueExp(), gen(itof, tv(Types.floatType(64))));
    assertEquals(Terminal.falseExp(), gen(itof, tv(Types.INT32)));

    Exp var = typeOf(r(25));
    Exp fromConst = gen(Ternary.get(Oper.ITOF, k(32), k(64), k(7)), var);
    assertEquals(Binary.get(Oper.AND, eq(var, tv(Types.floatType(64))),
                            eq(typeOf(k(7)), tv(Types.intType(32)))),
                 fromConst);

    assertEquals(Terminal.trueExp(),
        gen(Ternary.get(Oper.TRUNCU, k(32), k(16), r(24)), var));
  }

  @Test(expected=DIRCRuntimeError.class)
  public void testConversionNeedsConstSize() {
    gen(Ternary.get(Oper.SGN_EX, r(1), k(32), r(24)), tv(Types.INT32));
  }

  @Test
  public void testFloatAndBitOps() {
    // Registers against a known type add nothing
    Exp fplus = Binary.get(Oper.FPLUS, r(32), r(33));
    assertEquals(Terminal.falseExp(), gen(fplus, tv(Types.INT32)));
    Exp var = typeOf(r(34));
    Exp dbl = tv(Types.floatType(64));
    assertEquals(Binary.get(Oper.AND,
                   Binary.get(Oper.AND, Terminal.trueExp(), Terminal.trueExp()),
                   eq(var, dbl)),
                 gen(fplus, var));

    Exp and = Binary.get(Oper.BIT_AND, r(24), r(25));
    assertEquals(Terminal.falseExp(), gen(and, tv(Types.floatType(32))));
    Exp word = tv(Types.INT32);
    assertEquals(Binary.get(Oper.AND,
                   Binary.get(Oper.AND, Terminal.trueExp(), Terminal.trueExp()),
                   eq(var, word)),
                 gen(and, var));
  }

  @Test
  public void testPlusMinus() {
    Exp sum = Binary.plus(r(24), k(4));
    assertEquals(eq(typeOf(k(4)), tv(Types.INT_ANY)),
                 gen(sum, tv(Types.INT32)));

    Exp diff = Binary.minus(r(24), k(4));
    assertEquals("small constant can't be added to a pointer",
                 Terminal.falseExp(),
                 gen(diff, tv(Types.pointerTo(Types.INT32))));

    assertEquals(Terminal.falseExp(), gen(sum, tv(Types.floatType(32))));
  }

  @Test
  public void testSize() {
    Exp sized = Binary.size(16, r(24));
    assertEquals(eq(typeOf(r(24)), tv(Types.intType(16))),
                 gen(sized, tv(Types.INT_ANY)));
    assertEquals(Terminal.trueExp(), gen(sized, tv(Types.intType(16))));
    assertEquals(Terminal.falseExp(), gen(sized, tv(Types.INT32)));
    Exp var = typeOf(r(25));
    assertEquals(eq(var, tv(Types.sizeType(16))), gen(sized, var));
  }

  @Test
  public void testOtherOperators() {
    assertEquals(Terminal.trueExp(),
                 gen(Binary.mult(r(24), r(25)), tv(Types.INT32)));
    assertEquals(Terminal.trueExp(), gen(Terminal.get(Oper.PC), tv(Types.INT32)));
  }

  @Test
  public void testSimplifyConstraint() {
    assertEquals(Terminal.trueExp(), ConstraintGenerator.simplifyConstraint(
        eq(tv(Types.INT32), tv(Types.INT32))));
    assertEquals(Terminal.falseExp(), ConstraintGenerator.simplifyConstraint(
        eq(tv(Types.INT32), tv(Types.floatType(32)))));

    Exp alpha = eq(tv(Types.pointerToAlpha()), tv(Types.pointerTo(Types.CHAR)));
    assertEquals("type variables are not folded", alpha,
                 ConstraintGenerator.simplifyConstraint(alpha));

    Exp loc = eq(typeOf(r(24)), tv(Types.INT32));
    assertEquals(loc, ConstraintGenerator.simplifyConstraint(
        Binary.get(Oper.AND, eq(tv(Types.CHAR), tv(Types.CHAR)), loc)));
    assertEquals(loc, ConstraintGenerator.simplifyConstraint(
        Binary.get(Oper.OR, loc, eq(tv(Types.CHAR), tv(Types.INT32)))));
    assertEquals(Terminal.falseExp(), ConstraintGenerator.simplifyConstraint(
        Binary.get(Oper.AND, loc, eq(tv(Types.CHAR), tv(Types.INT32)))));
  }
}
