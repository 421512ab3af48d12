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
package exm.dirc.signature;

import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableListMultimap;

import exm.dirc.common.Logging;
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.lang.Types;
import exm.dirc.common.lang.Types.Type;
import exm.dirc.common.util.Result;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.Procedure;
import exm.dirc.ir.tree.Terminal;

/**
 * Signatures for specific platforms and calling conventions, and the
 * rules for promoting a generic signature to one of them.
 */
public class CallingConvention {

  private static final Logger logger = Logging.getDircLogger();

  /**
   * A convention a signature may be promoted to
   */
  public abstract static class ConventionEntry {
    private final String name;

    protected ConventionEntry(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    /**
     * @return true if the procedure follows this convention
     */
    public abstract boolean qualified(Procedure proc, Signature candidate);

    /**
     * @return a signature of this convention with the old signature's
     *         parameters and returns
     */
    public abstract Signature create(Signature old);

    @Override
    public String toString() {
      return name;
    }
  }

  private static final ConventionEntry WIN32 = new ConventionEntry("win32") {
    @Override
    public boolean qualified(Procedure proc, Signature candidate) {
      return Win32Signature.qualified(proc, candidate);
    }

    @Override
    public Signature create(Signature old) {
      return new Win32Signature(old);
    }
  };

  private static final ConventionEntry PENTIUM =
                                    new ConventionEntry("stdc pentium") {
    @Override
    public boolean qualified(Procedure proc, Signature candidate) {
      return PentiumSignature.qualified(proc, candidate);
    }

    @Override
    public Signature create(Signature old) {
      return new PentiumSignature(old);
    }
  };

  private static final ConventionEntry SPARC = new ConventionEntry("stdc sparc") {
    @Override
    public boolean qualified(Procedure proc, Signature candidate) {
      return SparcSignature.qualified(proc, candidate);
    }

    @Override
    public Signature create(Signature old) {
      return new SparcSignature(old);
    }
  };

  private static final ConventionEntry PPC = new ConventionEntry("stdc ppc") {
    @Override
    public boolean qualified(Procedure proc, Signature candidate) {
      return PPCSignature.qualified(proc, candidate);
    }

    @Override
    public Signature create(Signature old) {
      return new PPCSignature(old);
    }
  };

  private static final ConventionEntry ST20 = new ConventionEntry("stdc st20") {
    @Override
    public boolean qualified(Procedure proc, Signature candidate) {
      return ST20Signature.qualified(proc, candidate);
    }

    @Override
    public Signature create(Signature old) {
      return new ST20Signature(old);
    }
  };

  /**
   * Conventions to try for each platform, in priority order
   */
  private static final ImmutableListMultimap<Platform, ConventionEntry>
      PROMOTIONS = ImmutableListMultimap.<Platform, ConventionEntry>builder()
                    .put(Platform.PENTIUM, WIN32)
                    .put(Platform.PENTIUM, PENTIUM)
                    .put(Platform.SPARC, SPARC)
                    .put(Platform.PPC, PPC)
                    .put(Platform.ST20, ST20)
                    .build();

  public static List<ConventionEntry> getPromotions(Platform platform) {
    return PROMOTIONS.get(platform);
  }

  /**
   * @return promoted copy of sig, or null if no convention qualifies
   */
  static Signature promote(Procedure proc, Signature sig) {
    for (ConventionEntry entry: PROMOTIONS.get(proc.getPlatform())) {
      if (logger.isDebugEnabled()) {
        logger.debug("consider promotion to " + entry.getName() +
                     " signature for " + proc.getName());
      }
      if (entry.qualified(proc, sig)) {
        Signature promoted = entry.create(sig);
        promoted.setUnknown(false);
        return promoted;
      }
    }
    return null;
  }

  private static Exp regPlus(int reg, int k) {
    return Binary.plus(Location.regOf(reg), Const.get(k));
  }

  private static Exp memRegPlus(int reg, int k) {
    return Location.memOf(regPlus(reg, k));
  }

  private static Exp stackWildcard(Oper op, int reg) {
    return Location.memOf(Binary.get(op, Location.regOf(reg),
                                     Terminal.wild()));
  }

  /**
   * @return n for r[n], or -1 for anything else
   */
  private static int regNum(Exp e) {
    if (!e.isRegOfK()) {
      return -1;
    }
    return ((Const)e.getSubExp1()).getInt();
  }

  private static boolean firstParamIs(Signature sig, Exp loc) {
    return sig.getNumParams() > 0 && sig.getParamExp(0).equals(loc);
  }

  /* Pentium conventions share return and argument ordering */

  private static boolean pentiumReturnCompare(Exp a, Exp b) {
    // eax, then the top of the float stack
    if (a.isRegN(24)) {
      return true;
    } else if (b.isRegN(24)) {
      return false;
    } else if (a.isRegN(30)) {
      return true;
    } else if (b.isRegN(30)) {
      return false;
    }
    return a.compareTo(b) < 0;
  }

  private static boolean pentiumArgumentCompare(Exp a, Exp b) {
    int ma = Signature.stackOffset(a, 28);
    int mb = Signature.stackOffset(b, 28);
    if (ma != 0 && mb != 0) {
      return ma < mb;
    } else if (ma != 0) {
      return true;
    } else if (mb != 0) {
      return false;
    }
    return a.compareTo(b) < 0;
  }

  private static boolean pentiumIsPreserved(Exp e) {
    switch (regNum(e)) {
      case 29: // ebp
      case 27: // ebx
      case 30: // esi
      case 31: // edi
      case 3:  // bx
      case 5:  // bp
      case 6:  // si
      case 7:  // di
      case 11: // bl
      case 15: // bh
        return true;
      default:
        return false;
    }
  }

  private static void pentiumLibraryDefines(Signature sig,
                                            List<ImplicitDef> defs) {
    if (!defs.isEmpty()) {
      return;
    }
    Type eaxType = Types.sizeType(32);
    if (sig.getNumReturns() > 1) {
      // The stack pointer is always the first return
      eaxType = sig.getReturnType(1);
    }
    defs.add(new ImplicitDef(eaxType, Location.regOf(24)));
    defs.add(new ImplicitDef(Types.VOID, Location.regOf(25)));
    defs.add(new ImplicitDef(Types.VOID, Location.regOf(26)));
    defs.add(new ImplicitDef(Types.VOID, Location.regOf(28)));
  }

  /**
   * Callee-pop stdcall convention of Windows.  All parameters are
   * pushed on the stack.
   */
  public static class Win32Signature extends Signature {

    public Win32Signature(String name) {
      super(name);
      addReturn(Location.regOf(28));
    }

    public Win32Signature(Signature old) {
      super(old);
    }

    @Override
    public Win32Signature clone() {
      return new Win32Signature(this);
    }

    /**
     * The procedure returns through m[esp] and pops the return address
     */
    public static boolean qualified(Procedure proc, Signature candidate) {
      if (proc.getPlatform() != Platform.PENTIUM || !proc.isWin32()) {
        return false;
      }
      Exp provenPC = proc.getProven(Terminal.get(Oper.PC));
      if (provenPC == null ||
          !provenPC.equals(Location.memOf(Location.regOf(28)))) {
        return false;
      }
      Exp provenSP = proc.getProven(Location.regOf(28));
      return provenSP != null && provenSP.equals(regPlus(28, 4));
    }

    @Override
    public Platform getPlatform() {
      return Platform.PENTIUM;
    }

    @Override
    public CallConv getConvention() {
      return CallConv.PASCAL;
    }

    @Override
    public void addReturn(Type type, Exp exp) {
      if (type.isVoid()) {
        return;
      }
      if (exp == null) {
        exp = Location.regOf(type.isFloat() ? 32 : 24);
      }
      super.addReturn(type, exp);
    }

    @Override
    public Exp getArgumentExp(int n) {
      if (n < params.size()) {
        return super.getArgumentExp(n);
      }
      if (firstParamIs(this, Location.regOf(28))) {
        n--;
      }
      return memRegPlus(28, (n + 1) * 4);
    }

    /**
     * @return number of parameters, not counting esp
     */
    protected int stackParamCount() {
      int nparams = params.size();
      if (firstParamIs(this, Location.regOf(28))) {
        nparams--;
      }
      return nparams;
    }

    @Override
    public Exp getStackWildcard() {
      return stackWildcard(Oper.MINUS, 28);
    }

    @Override
    public Result<Integer> getStackRegister() {
      return Result.ofValue(28);
    }

    @Override
    public Exp getProven(Exp left) {
      switch (regNum(left)) {
        case 28:
          // Callee pops its parameters
          return regPlus(28, 4 + stackParamCount() * 4);
        case 27:
        case 29:
        case 30:
        case 31:
          return Location.regOf(regNum(left));
        default:
          return null;
      }
    }

    @Override
    public boolean isPreserved(Exp e) {
      return pentiumIsPreserved(e);
    }

    @Override
    public void setLibraryDefines(List<ImplicitDef> defs) {
      pentiumLibraryDefines(this, defs);
    }

    @Override
    public boolean returnCompare(Exp a, Exp b) {
      return pentiumReturnCompare(a, b);
    }

    @Override
    public boolean argumentCompare(Exp a, Exp b) {
      return pentiumArgumentCompare(a, b);
    }

    @Override
    public boolean isPromoted() {
      return true;
    }
  }

  /**
   * Windows thiscall: the object pointer is passed in ecx, the other
   * parameters as for {@link Win32Signature}.
   */
  public static class Win32ThiscallSignature extends Win32Signature {

    public Win32ThiscallSignature(String name) {
      super(name);
    }

    public Win32ThiscallSignature(Signature old) {
      super(old);
    }

    @Override
    public Win32ThiscallSignature clone() {
      return new Win32ThiscallSignature(this);
    }

    @Override
    public CallConv getConvention() {
      return CallConv.THISCALL;
    }

    @Override
    public Exp getArgumentExp(int n) {
      if (n < params.size()) {
        return params.get(n).getExp();
      }
      if (firstParamIs(this, Location.regOf(28))) {
        n--;
      }
      if (n == 0) {
        return Location.regOf(25);
      }
      return memRegPlus(28, n * 4);
    }

    @Override
    public Exp getProven(Exp left) {
      if (left.isRegN(28)) {
        // ecx is not on the stack
        return regPlus(28, 4 + stackParamCount() * 4 - 4);
      }
      return super.getProven(left);
    }
  }

  /**
   * Caller-pop C convention on pentium
   */
  public static class PentiumSignature extends Signature {

    public PentiumSignature(String name) {
      super(name);
      addReturn(Location.regOf(28));
    }

    public PentiumSignature(Signature old) {
      super(old);
    }

    @Override
    public PentiumSignature clone() {
      return new PentiumSignature(this);
    }

    public static boolean qualified(Procedure proc, Signature candidate) {
      // Any pentium procedure qualifies for now
      return proc.getPlatform() == Platform.PENTIUM;
    }

    @Override
    public Platform getPlatform() {
      return Platform.PENTIUM;
    }

    @Override
    public CallConv getConvention() {
      return CallConv.C;
    }

    @Override
    public void addReturn(Type type, Exp exp) {
      if (type.isVoid()) {
        return;
      }
      if (exp == null) {
        exp = Location.regOf(type.isFloat() ? 32 : 24);
      }
      super.addReturn(type, exp);
    }

    @Override
    public Exp getArgumentExp(int n) {
      if (n < params.size()) {
        return super.getArgumentExp(n);
      }
      if (firstParamIs(this, Location.regOf(28))) {
        n--;
      }
      return memRegPlus(28, (n + 1) * 4);
    }

    @Override
    public Exp getStackWildcard() {
      return stackWildcard(Oper.MINUS, 28);
    }

    @Override
    public Result<Integer> getStackRegister() {
      return Result.ofValue(28);
    }

    @Override
    public Exp getProven(Exp left) {
      int r = regNum(left);
      switch (r) {
        case 28:
          return regPlus(28, 4);
        case 27:
        case 29:
        case 30:
        case 31:
          return Location.regOf(r);
        default:
          return null;
      }
    }

    @Override
    public boolean isPreserved(Exp e) {
      return pentiumIsPreserved(e);
    }

    @Override
    public void setLibraryDefines(List<ImplicitDef> defs) {
      pentiumLibraryDefines(this, defs);
    }

    @Override
    public boolean returnCompare(Exp a, Exp b) {
      return pentiumReturnCompare(a, b);
    }

    @Override
    public boolean argumentCompare(Exp a, Exp b) {
      return pentiumArgumentCompare(a, b);
    }

    @Override
    public boolean isPromoted() {
      return true;
    }
  }

  /**
   * SPARC: six register arguments, register windows, locals at
   * positive offsets from %sp
   */
  public static class SparcSignature extends Signature {

    /** First stack argument offset from %sp */
    private static final int STACK_ARGS_OFFSET = 92;

    public SparcSignature(String name) {
      super(name);
      addReturn(Location.regOf(14));
    }

    public SparcSignature(Signature old) {
      super(old);
    }

    @Override
    public SparcSignature clone() {
      return new SparcSignature(this);
    }

    public static boolean qualified(Procedure proc, Signature candidate) {
      return proc.getPlatform() == Platform.SPARC;
    }

    @Override
    public Platform getPlatform() {
      return Platform.SPARC;
    }

    @Override
    public CallConv getConvention() {
      return CallConv.C;
    }

    @Override
    public void addReturn(Type type, Exp exp) {
      if (type.isVoid()) {
        return;
      }
      if (exp == null) {
        exp = Location.regOf(8);
      }
      super.addReturn(type, exp);
    }

    @Override
    public Exp getArgumentExp(int n) {
      if (n < params.size()) {
        return super.getArgumentExp(n);
      }
      if (n >= 6) {
        return memRegPlus(14, STACK_ARGS_OFFSET + (n - 6) * 4);
      }
      return Location.regOf(8 + n);
    }

    /**
     * After the callee's save, the out registers are the in registers
     * and the old %sp is %fp
     */
    @Override
    public Exp getEarlyParamExp(int n) {
      if (n >= 6) {
        return memRegPlus(30, STACK_ARGS_OFFSET + (n - 6) * 4);
      }
      return Location.regOf(24 + n);
    }

    @Override
    public Exp getStackWildcard() {
      return stackWildcard(Oper.PLUS, 14);
    }

    @Override
    public Result<Integer> getStackRegister() {
      return Result.ofValue(14);
    }

    protected boolean isPreservedReg(int r) {
      // %sp and the in registers
      return r == 14 || (r >= 24 && r <= 31);
    }

    @Override
    public Exp getProven(Exp left) {
      if (isPreservedReg(regNum(left))) {
        return left;
      }
      return null;
    }

    @Override
    public boolean isPreserved(Exp e) {
      return isPreservedReg(regNum(e));
    }

    @Override
    public void setLibraryDefines(List<ImplicitDef> defs) {
      if (!defs.isEmpty()) {
        return;
      }
      for (int r = 8; r <= 15; r++) {
        defs.add(new ImplicitDef(Types.VOID, Location.regOf(r)));
      }
    }

    @Override
    public boolean isLocalOffsetPositive() {
      return true;
    }

    /**
     * [sp+0] to [sp+88] are locals, [sp+92] and up are parameters
     */
    @Override
    public boolean isAddrOfStackLocal(Platform platform, Exp e) {
      if (e.isAddrOf()) {
        return isStackLocal(platform, e.getSubExp1());
      }
      Exp sp = Location.regOf(14);
      Oper op = e.getOper();
      if (op != Oper.MINUS && op != Oper.PLUS) {
        return isStackPointer(e, sp);
      }
      Exp k = e.getSubExp2();
      if (!k.isIntConst() || !isStackPointer(e.getSubExp1(), sp)) {
        return false;
      }
      return ((Const)k).getInt() < STACK_ARGS_OFFSET;
    }

    @Override
    public boolean returnCompare(Exp a, Exp b) {
      // %o0, then %f0, then %f0-1, then m[%sp+64]
      Exp spPlus64 = memRegPlus(14, 64);
      if (a.isRegN(8)) {
        return true;
      } else if (b.isRegN(8)) {
        return false;
      } else if (a.isRegN(32)) {
        return true;
      } else if (b.isRegN(32)) {
        return false;
      } else if (a.isRegN(64)) {
        return true;
      } else if (b.isRegN(64)) {
        return false;
      } else if (a.equals(spPlus64)) {
        return true;
      } else if (b.equals(spPlus64)) {
        return false;
      }
      return a.compareTo(b) < 0;
    }

    @Override
    public boolean argumentCompare(Exp a, Exp b) {
      // %o0-%o5 first, in order
      int ra = outRegister(a);
      int rb = outRegister(b);
      if (ra != 0 && rb != 0) {
        return ra < rb;
      } else if (ra != 0) {
        return true;
      } else if (rb != 0) {
        return false;
      }

      int ma = stackOffset(a, 30);
      int mb = stackOffset(b, 30);
      if (ma != 0 && mb != 0) {
        return ma < mb;
      } else if (ma != 0) {
        return true;
      } else if (mb != 0) {
        return false;
      }
      return a.compareTo(b) < 0;
    }

    private static int outRegister(Exp e) {
      int r = regNum(e);
      return (r >= 8 && r <= 13) ? r : 0;
    }

    @Override
    public boolean isPromoted() {
      return true;
    }
  }

  /**
   * SPARC library code also preserves the application globals %g2-%g4
   */
  public static class SparcLibSignature extends SparcSignature {

    public SparcLibSignature(String name) {
      super(name);
    }

    public SparcLibSignature(Signature old) {
      super(old);
    }

    @Override
    public SparcLibSignature clone() {
      return new SparcLibSignature(this);
    }

    @Override
    protected boolean isPreservedReg(int r) {
      return super.isPreservedReg(r) || (r >= 2 && r <= 4);
    }
  }

  public static class PPCSignature extends Signature {

    public PPCSignature(String name) {
      super(name);
      addReturn(Location.regOf(1));
    }

    public PPCSignature(Signature old) {
      super(old);
    }

    @Override
    public PPCSignature clone() {
      return new PPCSignature(this);
    }

    public static boolean qualified(Procedure proc, Signature candidate) {
      return proc.getPlatform() == Platform.PPC;
    }

    @Override
    public Platform getPlatform() {
      return Platform.PPC;
    }

    @Override
    public CallConv getConvention() {
      return CallConv.C;
    }

    @Override
    public void addReturn(Type type, Exp exp) {
      if (type.isVoid()) {
        return;
      }
      if (exp == null) {
        exp = Location.regOf(3);
      }
      super.addReturn(type, exp);
    }

    @Override
    public Exp getArgumentExp(int n) {
      if (n < params.size()) {
        return super.getArgumentExp(n);
      }
      if (n >= 8) {
        // Ninth and later at m[%r1+8], m[%r1+12], ...
        return memRegPlus(1, 8 + (n - 8) * 4);
      }
      return Location.regOf(3 + n);
    }

    @Override
    public Exp getStackWildcard() {
      return stackWildcard(Oper.MINUS, 1);
    }

    @Override
    public Result<Integer> getStackRegister() {
      return Result.ofValue(1);
    }

    @Override
    public Exp getProven(Exp left) {
      return regNum(left) == 1 ? left : null;
    }

    @Override
    public boolean isPreserved(Exp e) {
      return regNum(e) == 1;
    }

    @Override
    public void setLibraryDefines(List<ImplicitDef> defs) {
      if (!defs.isEmpty()) {
        return;
      }
      // Caller-save registers
      for (int r = 3; r <= 12; r++) {
        defs.add(new ImplicitDef(Types.VOID, Location.regOf(r)));
      }
    }

    @Override
    public boolean isLocalOffsetPositive() {
      return true;
    }

    @Override
    public boolean isPromoted() {
      return true;
    }
  }

  public static class MIPSSignature extends Signature {

    public MIPSSignature(String name) {
      super(name);
      addReturn(Location.regOf(2));
    }

    public MIPSSignature(Signature old) {
      super(old);
    }

    @Override
    public MIPSSignature clone() {
      return new MIPSSignature(this);
    }

    public static boolean qualified(Procedure proc, Signature candidate) {
      return proc.getPlatform() == Platform.MIPS;
    }

    @Override
    public Platform getPlatform() {
      return Platform.MIPS;
    }

    @Override
    public CallConv getConvention() {
      return CallConv.C;
    }

    @Override
    public void addReturn(Type type, Exp exp) {
      if (type.isVoid()) {
        return;
      }
      if (exp == null) {
        // $f0 for floats, $2 otherwise
        exp = Location.regOf(type.isFloat() ? 32 : 2);
      }
      super.addReturn(type, exp);
    }

    @Override
    public Exp getArgumentExp(int n) {
      if (n < params.size()) {
        return super.getArgumentExp(n);
      }
      if (n >= 4) {
        // Past the home locations of the register arguments
        return memRegPlus(29, 4 * 4 + (n - 4) * 4);
      }
      return Location.regOf(8 + n);
    }

    @Override
    public Exp getStackWildcard() {
      return stackWildcard(Oper.MINUS, 29);
    }

    @Override
    public Result<Integer> getStackRegister() {
      return Result.ofValue(29);
    }

    @Override
    public Exp getProven(Exp left) {
      return regNum(left) == 29 ? left : null;
    }

    @Override
    public boolean isPreserved(Exp e) {
      return regNum(e) == 29;
    }

    @Override
    public void setLibraryDefines(List<ImplicitDef> defs) {
      if (!defs.isEmpty()) {
        return;
      }
      for (int r = 16; r <= 23; r++) {
        defs.add(new ImplicitDef(Types.VOID, Location.regOf(r)));
      }
      defs.add(new ImplicitDef(Types.VOID, Location.regOf(30)));
    }

    @Override
    public boolean isLocalOffsetPositive() {
      return true;
    }

    @Override
    public boolean isPromoted() {
      return true;
    }
  }

  public static class ST20Signature extends Signature {

    public ST20Signature(String name) {
      super(name);
      addReturn(Location.regOf(3));
    }

    public ST20Signature(Signature old) {
      super(old);
    }

    @Override
    public ST20Signature clone() {
      return new ST20Signature(this);
    }

    public static boolean qualified(Procedure proc, Signature candidate) {
      return proc.getPlatform() == Platform.ST20;
    }

    @Override
    public Platform getPlatform() {
      return Platform.ST20;
    }

    @Override
    public CallConv getConvention() {
      return CallConv.C;
    }

    @Override
    public void addReturn(Type type, Exp exp) {
      if (type.isVoid()) {
        return;
      }
      if (exp == null) {
        exp = Location.regOf(0);
      }
      super.addReturn(type, exp);
    }

    @Override
    public Exp getArgumentExp(int n) {
      if (n < params.size()) {
        return super.getArgumentExp(n);
      }
      if (firstParamIs(this, Location.regOf(3))) {
        n--;
      }
      return memRegPlus(3, (n + 1) * 4);
    }

    @Override
    public Exp getStackWildcard() {
      return stackWildcard(Oper.MINUS, 3);
    }

    @Override
    public Result<Integer> getStackRegister() {
      return Result.ofValue(3);
    }

    @Override
    public Exp getProven(Exp left) {
      int r = regNum(left);
      switch (r) {
        case 3:
          return left;
        case 0:
        case 1:
        case 2:
          // A, B and C are callee save
          return Location.regOf(r);
        default:
          return null;
      }
    }

    @Override
    public boolean isPreserved(Exp e) {
      return regNum(e) == 3;
    }

    @Override
    public boolean isPromoted() {
      return true;
    }
  }
}
