package exm.dirc.signature;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.After;
import org.junit.Test;

import exm.dirc.common.Settings;
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.lang.Types;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.StubProcedure;
import exm.dirc.ir.tree.Terminal;
import exm.dirc.signature.CallingConvention.MIPSSignature;
import exm.dirc.signature.CallingConvention.PPCSignature;
import exm.dirc.signature.CallingConvention.PentiumSignature;
import exm.dirc.signature.CallingConvention.ST20Signature;
import exm.dirc.signature.CallingConvention.SparcLibSignature;
import exm.dirc.signature.CallingConvention.SparcSignature;
import exm.dirc.signature.CallingConvention.Win32Signature;
import exm.dirc.signature.CallingConvention.Win32ThiscallSignature;

public class CallingConventionTest {

  @After
  public void resetSettings() {
    Settings.reset(Settings.SIGNATURE_PROMOTE);
  }

  private static Exp r(int n) {
    return Location.regOf(n);
  }

  private static Exp plus(int reg, int k) {
    return Binary.plus(r(reg), Const.get(k));
  }

  private static Exp mem(int reg, int k) {
    return Location.memOf(plus(reg, k));
  }

  private static StubProcedure win32Proc() {
    StubProcedure proc = new StubProcedure("WinMain", Platform.PENTIUM, true);
    proc.setProven(Terminal.get(Oper.PC), Location.memOf(r(28)));
    proc.setProven(r(28), plus(28, 4));
    return proc;
  }

  @Test
  public void testPentiumArguments() {
    Signature sig = new PentiumSignature("f");
    assertEquals(Platform.PENTIUM, sig.getPlatform());
    assertEquals(CallConv.C, sig.getConvention());
    assertEquals("stack pointer is always returned", r(28), sig.getReturnExp(0));
    sig.setNumParams(3);
    assertEquals(mem(28, 4), sig.getParamExp(0));
    assertEquals(mem(28, 12), sig.getParamExp(2));
    assertEquals("param3", sig.getParamName(2));
    assertEquals(mem(28, 16), sig.getArgumentExp(3));
  }

  @Test
  public void testStackPointerParamShiftsArguments() {
    Signature sig = new Win32Signature("f");
    sig.addParameter(Types.INT32, "sp", r(28));
    sig.addParameter(Types.INT32, null, null);
    assertEquals(mem(28, 4), sig.getParamExp(1));
  }

  @Test
  public void testPentiumReturns() {
    Signature sig = new PentiumSignature("f");
    sig.addReturn(Types.INT32, null);
    sig.addReturn(Types.floatType(64), null);
    sig.addReturn(Types.VOID, r(25));
    assertEquals(3, sig.getNumReturns());
    assertEquals(r(24), sig.getReturnExp(1));
    assertEquals(r(32), sig.getReturnExp(2));
    assertEquals("{ void * r28, int r24, double r32 } f()", sig.toString());
  }

  @Test
  public void testWin32ProvenPopsParameters() {
    Signature sig = new Win32Signature("f");
    sig.setNumParams(2);
    assertEquals(plus(28, 12), sig.getProven(r(28)));
    assertEquals(r(29), sig.getProven(r(29)));
    assertNull(sig.getProven(r(24)));
    assertEquals(Location.memOf(Binary.get(Oper.MINUS, r(28), Terminal.wild())),
                 sig.getStackWildcard());
  }

  @Test
  public void testThiscall() {
    Signature sig = new Win32ThiscallSignature("f");
    assertEquals(CallConv.THISCALL, sig.getConvention());
    assertEquals(r(25), sig.getArgumentExp(0));
    sig.setNumParams(2);
    assertEquals(r(25), sig.getParamExp(0));
    assertEquals(mem(28, 4), sig.getParamExp(1));
    assertEquals(mem(28, 8), sig.getArgumentExp(2));
    assertEquals(plus(28, 8), sig.getProven(r(28)));
  }

  @Test
  public void testPentiumPreserved() {
    Signature sig = new PentiumSignature("f");
    assertEquals(plus(28, 4), sig.getProven(r(28)));
    assertEquals(r(27), sig.getProven(r(27)));
    assertTrue(sig.isPreserved(r(29)));
    assertTrue(sig.isPreserved(r(6)));
    assertFalse(sig.isPreserved(r(24)));
    assertFalse(sig.isPreserved(Location.memOf(r(28))));
  }

  @Test
  public void testPentiumLibraryDefines() {
    Signature sig = new PentiumSignature("f");
    List<ImplicitDef> defs = new ArrayList<ImplicitDef>();
    sig.setLibraryDefines(defs);
    assertEquals(4, defs.size());
    assertEquals(r(24), defs.get(0).getLocation());
    assertEquals(Types.sizeType(32), defs.get(0).getType());
    assertEquals(r(28), defs.get(3).getLocation());

    sig.addReturn(Types.INT32, r(24));
    defs = new ArrayList<ImplicitDef>();
    sig.setLibraryDefines(defs);
    assertEquals(Types.INT32, defs.get(0).getType());

    sig.setLibraryDefines(defs);
    assertEquals("existing defines are kept", 4, defs.size());
  }

  @Test
  public void testPentiumComparators() {
    Signature sig = new PentiumSignature("f");
    List<Exp> rets = new ArrayList<Exp>(Arrays.asList(r(26), r(30), r(24)));
    Collections.sort(rets, sig.getReturnComparator());
    assertEquals(Arrays.asList(r(24), r(30), r(26)), rets);

    List<Exp> args = new ArrayList<Exp>(
        Arrays.asList(r(25), mem(28, 8), mem(28, 4)));
    Collections.sort(args, sig.getArgumentComparator());
    assertEquals(Arrays.asList(mem(28, 4), mem(28, 8), r(25)), args);
  }

  @Test
  public void testSparcArguments() {
    Signature sig = new SparcSignature("f");
    assertEquals(r(14), sig.getReturnExp(0));
    assertEquals(r(8), sig.getArgumentExp(0));
    assertEquals(r(13), sig.getArgumentExp(5));
    assertEquals(mem(14, 92), sig.getArgumentExp(6));
    assertEquals(mem(14, 96), sig.getArgumentExp(7));
    assertEquals(r(24), sig.getEarlyParamExp(0));
    assertEquals(mem(30, 92), sig.getEarlyParamExp(6));
    sig.addReturn(Types.INT32, null);
    assertEquals(r(8), sig.getReturnExp(1));
    assertEquals(Location.memOf(Binary.plus(r(14), Terminal.wild())),
                 sig.getStackWildcard());
  }

  @Test
  public void testSparcPreserved() {
    Signature sig = new SparcSignature("f");
    assertTrue(sig.isPreserved(r(14)));
    assertTrue(sig.isPreserved(r(30)));
    assertEquals(r(24), sig.getProven(r(24)));
    assertFalse(sig.isPreserved(r(8)));
    assertFalse(sig.isPreserved(r(3)));
    assertNull(sig.getProven(r(3)));

    Signature lib = new SparcLibSignature("f");
    assertTrue(lib.isPreserved(r(3)));
    assertEquals(r(3), lib.getProven(r(3)));
    assertFalse(lib.isPreserved(r(5)));

    List<ImplicitDef> defs = new ArrayList<ImplicitDef>();
    sig.setLibraryDefines(defs);
    assertEquals(8, defs.size());
    assertEquals(r(15), defs.get(7).getLocation());
  }

  @Test
  public void testSparcComparators() {
    Signature sig = new SparcSignature("f");
    List<Exp> rets = new ArrayList<Exp>(
        Arrays.asList(mem(14, 64), r(32), r(24), r(8)));
    Collections.sort(rets, sig.getReturnComparator());
    assertEquals(Arrays.asList(r(8), r(32), mem(14, 64), r(24)), rets);

    List<Exp> args = new ArrayList<Exp>(
        Arrays.asList(mem(30, 96), r(9), mem(30, 92), r(8)));
    Collections.sort(args, sig.getArgumentComparator());
    assertEquals(Arrays.asList(r(8), r(9), mem(30, 92), mem(30, 96)), args);
  }

  @Test
  public void testPPC() {
    Signature sig = new PPCSignature("f");
    assertEquals(r(1), sig.getReturnExp(0));
    assertEquals(r(3), sig.getArgumentExp(0));
    assertEquals(r(10), sig.getArgumentExp(7));
    assertEquals(mem(1, 8), sig.getArgumentExp(8));
    assertEquals(mem(1, 12), sig.getArgumentExp(9));
    assertEquals(r(1), sig.getProven(r(1)));
    assertNull(sig.getProven(r(3)));
    assertEquals(Integer.valueOf(1), sig.getStackRegister().getValue());
    sig.addReturn(Types.INT32, null);
    assertEquals(r(3), sig.getReturnExp(1));
  }

  @Test
  public void testMIPS() {
    Signature sig = new MIPSSignature("f");
    assertEquals(r(8), sig.getArgumentExp(0));
    assertEquals(r(11), sig.getArgumentExp(3));
    assertEquals(mem(29, 16), sig.getArgumentExp(4));
    sig.addReturn(Types.floatType(32), null);
    sig.addReturn(Types.INT32, null);
    assertEquals(r(32), sig.getReturnExp(1));
    assertEquals(r(2), sig.getReturnExp(2));
    assertTrue(sig.isPreserved(r(29)));

    List<ImplicitDef> defs = new ArrayList<ImplicitDef>();
    sig.setLibraryDefines(defs);
    assertEquals(9, defs.size());
    assertEquals(r(30), defs.get(8).getLocation());
  }

  @Test
  public void testST20() {
    Signature sig = new ST20Signature("f");
    assertEquals(r(3), sig.getReturnExp(0));
    assertEquals(mem(3, 4), sig.getArgumentExp(0));
    assertEquals(mem(3, 8), sig.getArgumentExp(1));
    assertEquals(r(3), sig.getProven(r(3)));
    assertEquals(r(1), sig.getProven(r(1)));
    assertTrue(sig.isPreserved(r(3)));
    sig.addReturn(Types.INT32, null);
    assertEquals(r(0), sig.getReturnExp(1));
  }

  @Test
  public void testCloneKeepsConvention() {
    Signature sig = new SparcSignature("f");
    sig.setNumParams(2);
    Signature copy = sig.clone();
    assertTrue(copy instanceof SparcSignature);
    assertEquals(sig, copy);
  }

  @Test
  public void testPromoteWin32() {
    StubProcedure proc = win32Proc();
    Signature sig = new Signature("WinMain");
    sig.addParameter(Types.INT32, "h", mem(28, 4));
    Signature promoted = sig.promote(proc);
    assertTrue(promoted instanceof Win32Signature);
    assertFalse(promoted.isUnknown());
    assertEquals("h", promoted.getParamName(0));
    assertSame("already promoted", promoted, promoted.promote(proc));
  }

  @Test
  public void testPromoteFallsBackToPentium() {
    StubProcedure proc = new StubProcedure("main", Platform.PENTIUM, true);
    proc.setProven(r(28), plus(28, 4));
    Signature promoted = new Signature("main").promote(proc);
    assertTrue(promoted instanceof PentiumSignature);

    StubProcedure elf = new StubProcedure("main", Platform.PENTIUM, false);
    elf.setProven(Terminal.get(Oper.PC), Location.memOf(r(28)));
    elf.setProven(r(28), plus(28, 4));
    assertTrue(new Signature("main").promote(elf) instanceof PentiumSignature);
  }

  @Test
  public void testPromoteOtherPlatforms() {
    Signature sig = new Signature("f");
    assertTrue(sig.promote(new StubProcedure("f", Platform.SPARC, false))
                 instanceof SparcSignature);
    assertTrue(sig.promote(new StubProcedure("f", Platform.PPC, false))
                 instanceof PPCSignature);
    assertTrue(sig.promote(new StubProcedure("f", Platform.ST20, false))
                 instanceof ST20Signature);
    assertSame("no promotion for mips", sig,
               sig.promote(new StubProcedure("f", Platform.MIPS, false)));
    assertSame(sig, sig.promote(new StubProcedure("f", Platform.GENERIC, false)));
  }

  @Test
  public void testPromotionDisabled() {
    Settings.set(Settings.SIGNATURE_PROMOTE, "false");
    Signature sig = new Signature("WinMain");
    assertSame(sig, sig.promote(win32Proc()));
  }

  @Test
  public void testPromotionOrder() {
    List<CallingConvention.ConventionEntry> entries =
              CallingConvention.getPromotions(Platform.PENTIUM);
    assertEquals(2, entries.size());
    assertEquals("win32", entries.get(0).getName());
    assertTrue(CallingConvention.getPromotions(Platform.MIPS).isEmpty());
  }
}
