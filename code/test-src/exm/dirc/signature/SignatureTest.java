package exm.dirc.signature;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.lang.Types;
import exm.dirc.common.util.Result;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.RefExp;
import exm.dirc.ir.tree.RefExp.Def;

public class SignatureTest {

  private static Exp r(int n) {
    return Location.regOf(n);
  }

  private static Exp mem(int reg, int k) {
    return Location.memOf(Binary.plus(r(reg), Const.get(k)));
  }

  @Test
  public void testGenericParameters() {
    Signature sig = new Signature("f");
    assertEquals(Platform.GENERIC, sig.getPlatform());
    assertEquals(CallConv.NONE, sig.getConvention());
    assertTrue(sig.isUnknown());

    sig.addParameter();
    sig.addParameter("count");
    assertEquals(2, sig.getNumParams());
    assertEquals("param1", sig.getParamName(0));
    assertEquals(Location.param("param1", null), sig.getParamExp(0));
    assertEquals("count", sig.getParamName(1));
    assertEquals(Location.param("param2", null), sig.getParamExp(1));
    assertEquals(1, sig.findParam("count"));
    assertEquals(-1, sig.findParam("other"));
  }

  @Test
  public void testFreshNamesSkipTaken() {
    Signature sig = new Signature("f");
    sig.addParameter(Types.INT32, "param2", r(24));
    sig.addParameter(Types.INT32, null, r(25));
    assertEquals("param3", sig.getParamName(1));
  }

  @Test
  public void testAnonymousName() {
    assertEquals(Signature.ANON_NAME, new Signature((String) null).getName());
  }

  @Test
  public void testParameterEdits() {
    Signature sig = new Signature("f");
    sig.addParameter(Types.INT32, "a", r(24));
    sig.addParameter(Types.CHAR, "b", r(25));
    assertEquals(1, sig.findParam(r(25)));
    sig.setParamType("b", Types.INT32);
    assertEquals(Types.INT32, sig.getParamType(1));
    sig.renameParam("a", "x");
    assertEquals("x", sig.getParamName(0));
    sig.removeParameter(r(24));
    assertEquals(1, sig.getNumParams());
    assertEquals("b", sig.getParamName(0));
    sig.setNumParams(0);
    assertEquals(0, sig.getNumParams());
  }

  @Test(expected=DIRCRuntimeError.class)
  public void testBadParamIndex() {
    new Signature("f").getParamExp(0);
  }

  @Test
  public void testReturns() {
    Signature sig = new Signature("f");
    sig.addReturn(Types.INT32, r(24));
    sig.addReturn(r(28));
    assertEquals(2, sig.getNumReturns());
    assertEquals(1, sig.findReturn(r(28)));
    assertEquals(Types.INT32, sig.getTypeFor(r(24)));
    assertNull(sig.getTypeFor(r(25)));
    sig.removeReturn(r(24));
    assertEquals(r(28), sig.getReturnExp(0));
  }

  @Test(expected=DIRCRuntimeError.class)
  public void testReturnNeedsLocation() {
    new Signature("f").addReturn(Types.INT32, null);
  }

  @Test
  public void testPrint() {
    Signature sig = new Signature("f");
    assertEquals("void f()", sig.toString());
    sig.addReturn(Types.INT32, r(24));
    sig.addParameter(Types.INT32, "x", r(25));
    sig.addParameter(Types.pointerTo(Types.CHAR), "s", r(26));
    assertEquals("{ int r24 } f(int x r25, char * s r26)", sig.toString());
    sig.setForced(true);
    assertTrue(sig.toString().startsWith("*forced* "));
  }

  @Test
  public void testEqualityIgnoresNames() {
    Signature a = new Signature("a");
    Signature b = new Signature("b");
    a.addParameter(Types.INT32, "x", r(24));
    b.addParameter(Types.INT32, "y", r(24));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    b.addReturn(Types.INT32, r(24));
    assertNotEquals(a, b);
  }

  @Test
  public void testCloneIsDeep() {
    Signature sig = new Signature("f");
    sig.addParameter(Types.INT32, "x", r(24));
    Signature copy = sig.clone();
    copy.setParamName(0, "y");
    assertEquals("x", sig.getParamName(0));
    assertEquals(sig, copy);
  }

  @Test
  public void testInstantiate() {
    assertTrue(Signature.instantiate(Platform.PENTIUM, CallConv.C, "f")
                 instanceof CallingConvention.PentiumSignature);
    assertTrue(Signature.instantiate(Platform.PENTIUM, CallConv.PASCAL, "f")
                 instanceof CallingConvention.Win32Signature);
    assertTrue(Signature.instantiate(Platform.PENTIUM, CallConv.THISCALL, "f")
                 instanceof CallingConvention.Win32ThiscallSignature);
    assertTrue(Signature.instantiate(Platform.SPARC, CallConv.PASCAL, "f")
                 instanceof CallingConvention.SparcSignature);
    assertTrue(Signature.instantiate(Platform.MIPS, CallConv.C, "f")
                 instanceof CallingConvention.MIPSSignature);
    assertTrue(Signature.instantiate(Platform.SPARC, CallConv.THISCALL, "f")
                 instanceof CustomSignature);
    assertTrue(Signature.instantiate(Platform.M68K, CallConv.C, "f")
                 instanceof CustomSignature);
  }

  @Test
  public void testStackRegisterByPlatform() {
    assertEquals(Integer.valueOf(28),
                 Signature.getStackRegister(Platform.PENTIUM).getValue());
    assertEquals(Integer.valueOf(14),
                 Signature.getStackRegister(Platform.SPARC).getValue());
    assertEquals(Integer.valueOf(3),
                 Signature.getStackRegister(Platform.ST20).getValue());
    Result<Integer> none = Signature.getStackRegister(Platform.GENERIC);
    assertTrue(none.isError());
    assertTrue(new Signature("f").getStackRegister().isError());
  }

  @Test
  public void testABIDefines() {
    List<Exp> pentium = Signature.getABIDefines(Platform.PENTIUM);
    assertEquals(Arrays.asList(r(24), r(25), r(26)), pentium);
    assertEquals(10, Signature.getABIDefines(Platform.PPC).size());
    assertTrue(Signature.getABIDefines(Platform.SPARC).contains(r(1)));
    assertTrue(Signature.getABIDefines(Platform.MIPS).isEmpty());
  }

  @Test
  public void testStackLocals() {
    Signature sig = new Signature("f");
    Exp below = Location.memOf(Binary.minus(r(28), Const.get(8)));
    assertTrue(sig.isStackLocal(Platform.PENTIUM, below));
    assertFalse("locals grow down", sig.isStackLocal(Platform.PENTIUM,
                                                      mem(28, 8)));
    assertTrue(sig.isStackLocal(Platform.PENTIUM, Location.memOf(r(28))));
    Exp implicitSp = Binary.minus(RefExp.get(r(28), Def.IMPLICIT),
                                  Const.get(4));
    assertTrue(sig.isStackLocal(Platform.PENTIUM, Location.memOf(implicitSp)));
    assertTrue(sig.isAddrOfStackLocal(Platform.PENTIUM, implicitSp));
    assertFalse("no stack register", sig.isStackLocal(Platform.GENERIC, below));
    assertFalse(sig.isStackLocal(Platform.PENTIUM, r(28)));
  }

  @Test
  public void testLocalOffsetDirection() {
    Signature sig = new Signature("f");
    assertTrue(sig.isLocalOffsetNegative());
    assertFalse(sig.isOpCompatStackLocal(Oper.PLUS));
    Signature sparc = new CallingConvention.SparcSignature("f");
    assertTrue(sparc.isLocalOffsetPositive());
    assertTrue(sparc.isStackLocal(Platform.SPARC, mem(14, 64)));
    assertFalse("parameter area", sparc.isStackLocal(Platform.SPARC, mem(14, 96)));
  }

  @Test
  public void testParameterEqualityIgnoresName() {
    Parameter a = new Parameter(Types.INT32, "a", r(24));
    Parameter b = new Parameter(Types.INT32, "b", r(24));
    assertEquals(a, b);
    assertNotEquals(a, new Parameter(Types.CHAR, "a", r(24)));
    assertEquals("int a r24", a.toString());
  }

  @Test
  public void testCustomSignature() {
    CustomSignature sig = new CustomSignature("f");
    assertTrue(sig.getStackRegister().isError());
    assertNull(sig.getProven(r(5)));
    sig.setSP(5);
    assertEquals(Integer.valueOf(5), sig.getStackRegister().getValue());
    assertEquals(0, sig.findReturn(r(5)));
    assertEquals(Binary.plus(r(5), Const.get(4)), sig.getProven(r(5)));
    assertTrue(sig.isPreserved(r(5)));
    assertFalse(sig.isPreserved(r(6)));
    assertTrue(sig.isPromoted());

    CustomSignature copy = sig.clone();
    assertEquals(Integer.valueOf(5), copy.getStackRegister().getValue());
  }
}
