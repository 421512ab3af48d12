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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Objects;

import exm.dirc.common.Logging;
import exm.dirc.common.Settings;
import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.lang.Types;
import exm.dirc.common.lang.Types.Type;
import exm.dirc.common.util.Result;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.Procedure;
import exm.dirc.ir.tree.RefExp;

/**
 * The signature of a procedure: its parameters and returns, and the
 * calling convention that maps them to locations.
 *
 * This base class has no convention of its own.  Convention-specific
 * subclasses live in {@link CallingConvention}; use
 * {@link #instantiate(Platform, CallConv, String)} to get one.
 *
 * Signatures are mutable and not thread-safe.
 */
public class Signature {

  private static final Logger logger = Logging.getDircLogger();

  public static final String ANON_NAME = "<ANON>";

  protected String name;
  protected final List<Parameter> params = new ArrayList<Parameter>();
  protected final List<Return> returns = new ArrayList<Return>();
  protected Type retType = Types.VOID;
  protected boolean ellipsis = false;
  protected boolean unknown = true;
  protected boolean forced = false;
  protected String preferredName = null;
  protected Type preferredReturn = null;
  protected List<Integer> preferredParams = new ArrayList<Integer>();
  /** File the signature was read from, informational only */
  protected String sigFile = null;

  public Signature(String name) {
    this.name = (name == null) ? ANON_NAME : name;
  }

  /**
   * Copy constructor.  Parameters and returns are deep copied.
   */
  protected Signature(Signature old) {
    this.name = old.name;
    for (Parameter p: old.params) {
      params.add(p.clone());
    }
    for (Return r: old.returns) {
      returns.add(r.clone());
    }
    this.retType = old.retType;
    this.ellipsis = old.ellipsis;
    this.unknown = old.unknown;
    this.forced = old.forced;
    this.preferredName = old.preferredName;
    this.preferredReturn = old.preferredReturn;
    this.preferredParams = new ArrayList<Integer>(old.preferredParams);
    this.sigFile = old.sigFile;
  }

  /**
   * Create a signature for a platform and calling convention.
   * @return the matching convention, or a {@link CustomSignature} if the
   *         pair is not supported
   */
  public static Signature instantiate(Platform platform, CallConv cc,
                                      String name) {
    switch (platform) {
      case PENTIUM:
        if (cc == CallConv.PASCAL) {
          // Assume pascal convention on pentium means Windows
          return new CallingConvention.Win32Signature(name);
        } else if (cc == CallConv.THISCALL) {
          return new CallingConvention.Win32ThiscallSignature(name);
        } else {
          return new CallingConvention.PentiumSignature(name);
        }
      case SPARC:
        if (cc == CallConv.C || cc == CallConv.PASCAL) {
          return new CallingConvention.SparcSignature(name);
        }
        break;
      case PPC:
        return new CallingConvention.PPCSignature(name);
      case ST20:
        return new CallingConvention.ST20Signature(name);
      case MIPS:
        return new CallingConvention.MIPSSignature(name);
      default:
        break;
    }
    Logging.uniqueWarn("unknown signature: " + cc.getName() + " " +
                       platform.getName());
    return new CustomSignature(name);
  }

  @Override
  public Signature clone() {
    return new Signature(this);
  }

  public static String getPlatformName(Platform p) {
    return p.getName();
  }

  public static String getConventionName(CallConv cc) {
    return cc.getName();
  }

  public Platform getPlatform() {
    return Platform.GENERIC;
  }

  public CallConv getConvention() {
    return CallConv.NONE;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  /* Returns */

  public void addReturn(Type type, Exp exp) {
    if (exp == null) {
      throw new DIRCRuntimeError("No location for return of type " +
                                 type + " in " + name);
    }
    returns.add(new Return(type, exp));
  }

  /**
   * Add a return of unknown type
   */
  public void addReturn(Exp exp) {
    addReturn(Types.pointerTo(Types.VOID), exp);
  }

  public void removeReturn(Exp exp) {
    int i = findReturn(exp);
    if (i != -1) {
      returns.remove(i);
    }
  }

  public int getNumReturns() {
    return returns.size();
  }

  public Exp getReturnExp(int i) {
    return returns.get(i).getExp();
  }

  public Type getReturnType(int i) {
    return returns.get(i).getType();
  }

  public void setReturnType(int i, Type type) {
    if (i < returns.size()) {
      returns.get(i).setType(type);
    }
  }

  public List<Return> getReturns() {
    return Collections.unmodifiableList(returns);
  }

  /**
   * @return index of the return in location exp, or -1
   */
  public int findReturn(Exp exp) {
    for (int i = 0; i < returns.size(); i++) {
      if (returns.get(i).getExp().equals(exp)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * @return type of the value returned in location exp, or null
   */
  public Type getTypeFor(Exp exp) {
    int i = findReturn(exp);
    return i == -1 ? null : returns.get(i).getType();
  }

  public Type getRetType() {
    return retType;
  }

  public void setRetType(Type retType) {
    this.retType = retType;
  }

  /* Parameters */

  public void addParameter() {
    addParameter(Types.VOID, null, null, null);
  }

  public void addParameter(String name) {
    addParameter(Types.VOID, name, null, null);
  }

  public void addParameter(Exp exp, Type type) {
    addParameter(type, null, exp, null);
  }

  public void addParameter(Type type, String name, Exp exp) {
    addParameter(type, name, exp, null);
  }

  /**
   * Add a parameter.
   * @param type
   * @param name if null, a fresh name "paramN" is chosen
   * @param exp if null, the convention's location for the next argument
   * @param boundMax may be null
   */
  public void addParameter(Type type, String name, Exp exp, String boundMax) {
    if (exp == null) {
      exp = getArgumentExp(params.size());
    }
    if (exp == null) {
      String msg = "No expression for parameter " +
              (type == null ? "<notype>" : type.getCtype()) + " " +
              (name == null ? "<noname>" : name);
      logger.error(msg);
      throw new DIRCRuntimeError(msg);
    }
    if (name == null) {
      name = freshParamName();
    }
    params.add(new Parameter(type, name, exp, boundMax));
  }

  /**
   * Add a parameter, filling in a missing name or location
   */
  public void addParameter(Parameter param) {
    String pName = param.getName();
    if (pName != null && pName.isEmpty()) {
      pName = null;
    }
    if (param.getType() == null || param.getExp() == null || pName == null) {
      addParameter(param.getType(), pName, param.getExp(),
                   param.getBoundMax());
    } else {
      params.add(param);
    }
  }

  private String freshParamName() {
    int n = params.size() + 1;
    while (true) {
      String candidate = "param" + n;
      if (findParam(candidate) == -1) {
        return candidate;
      }
      n++;
    }
  }

  public void removeParameter(Exp exp) {
    int i = findParam(exp);
    if (i != -1) {
      removeParameter(i);
    }
  }

  public void removeParameter(int i) {
    checkParamIndex(i);
    params.remove(i);
  }

  /**
   * Truncate the parameter list, or extend it with default parameters
   */
  public void setNumParams(int n) {
    while (params.size() > n) {
      params.remove(params.size() - 1);
    }
    while (params.size() < n) {
      addParameter();
    }
  }

  public int getNumParams() {
    return params.size();
  }

  public List<Parameter> getParameters() {
    return Collections.unmodifiableList(params);
  }

  public String getParamName(int i) {
    checkParamIndex(i);
    return params.get(i).getName();
  }

  public Exp getParamExp(int i) {
    checkParamIndex(i);
    return params.get(i).getExp();
  }

  /**
   * @return type of parameter i, or null if there is no such parameter
   *         (e.g. the parameters of a recursive call are not known yet)
   */
  public Type getParamType(int i) {
    if (i < 0 || i >= params.size()) {
      return null;
    }
    return params.get(i).getType();
  }

  public String getParamBoundMax(int i) {
    checkParamIndex(i);
    String s = params.get(i).getBoundMax();
    if (s == null || s.isEmpty()) {
      return null;
    }
    return s;
  }

  public void setParamType(int i, Type type) {
    checkParamIndex(i);
    params.get(i).setType(type);
  }

  public void setParamType(String paramName, Type type) {
    int i = findParam(paramName);
    if (i == -1) {
      logger.warn("could not set type for unknown parameter " + paramName);
      return;
    }
    params.get(i).setType(type);
  }

  public void setParamType(Exp exp, Type type) {
    int i = findParam(exp);
    if (i == -1) {
      logger.warn("could not set type for unknown parameter expression "
                  + exp);
      return;
    }
    params.get(i).setType(type);
  }

  public void setParamName(int i, String paramName) {
    checkParamIndex(i);
    params.get(i).setName(paramName);
  }

  public void setParamExp(int i, Exp exp) {
    checkParamIndex(i);
    params.get(i).setExp(exp);
  }

  /**
   * @return index of the parameter passed in exp, or -1
   */
  public int findParam(Exp exp) {
    for (int i = 0; i < params.size(); i++) {
      if (params.get(i).getExp().equals(exp)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * @return index of the parameter with the name, or -1
   */
  public int findParam(String paramName) {
    for (int i = 0; i < params.size(); i++) {
      if (params.get(i).getName().equals(paramName)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Rename the first parameter called oldName
   */
  public void renameParam(String oldName, String newName) {
    int i = findParam(oldName);
    if (i != -1) {
      params.get(i).setName(newName);
    }
  }

  private void checkParamIndex(int i) {
    if (i < 0 || i >= params.size()) {
      throw new DIRCRuntimeError("Parameter index " + i +
            " out of range for " + name + " with " + params.size() +
            " parameters");
    }
  }

  /* Flags and hints */

  public boolean hasEllipsis() {
    return ellipsis;
  }

  public void setHasEllipsis(boolean ellipsis) {
    this.ellipsis = ellipsis;
  }

  public boolean isUnknown() {
    return unknown;
  }

  public void setUnknown(boolean unknown) {
    this.unknown = unknown;
  }

  public boolean isForced() {
    return forced;
  }

  public void setForced(boolean forced) {
    this.forced = forced;
  }

  public String getPreferredName() {
    return preferredName;
  }

  public void setPreferredName(String preferredName) {
    this.preferredName = preferredName;
  }

  public Type getPreferredReturn() {
    return preferredReturn;
  }

  public void setPreferredReturn(Type preferredReturn) {
    this.preferredReturn = preferredReturn;
  }

  public List<Integer> getPreferredParams() {
    return Collections.unmodifiableList(preferredParams);
  }

  public void addPreferredParam(int n) {
    preferredParams.add(n);
  }

  public String getSigFile() {
    return sigFile;
  }

  public void setSigFile(String sigFile) {
    this.sigFile = sigFile;
  }

  /* Convention-specific behaviour.  The defaults apply to signatures
   * with no known convention. */

  /**
   * @param n argument index
   * @return location argument n is passed in
   */
  public Exp getArgumentExp(int n) {
    if (n < params.size()) {
      return getParamExp(n);
    }
    return Location.param("param" + (n + 1), null);
  }

  /**
   * Location of parameter n as seen on entry to the callee, before
   * any register window is shifted
   */
  public Exp getEarlyParamExp(int n) {
    return getArgumentExp(n);
  }

  /**
   * @return pattern matching stack locations, or null if unknown
   */
  public Exp getStackWildcard() {
    return null;
  }

  /**
   * @param left a location
   * @return what the location is proven equal to on exit, or null
   */
  public Exp getProven(Exp left) {
    return null;
  }

  /**
   * @return true if the convention preserves location e
   */
  public boolean isPreserved(Exp e) {
    return false;
  }

  /**
   * Add the locations defined by a library call.  Does nothing if defs
   * is not empty.
   */
  public void setLibraryDefines(List<ImplicitDef> defs) {
    // No convention, nothing known to be defined
  }

  /**
   * @return true if return location a should come before b
   */
  public boolean returnCompare(Exp a, Exp b) {
    return a.compareTo(b) < 0;
  }

  /**
   * @return true if argument location a should come before b
   */
  public boolean argumentCompare(Exp a, Exp b) {
    return a.compareTo(b) < 0;
  }

  public Comparator<Exp> getReturnComparator() {
    return new Comparator<Exp>() {
      @Override
      public int compare(Exp a, Exp b) {
        return lessToCompare(returnCompare(a, b), returnCompare(b, a));
      }
    };
  }

  public Comparator<Exp> getArgumentComparator() {
    return new Comparator<Exp>() {
      @Override
      public int compare(Exp a, Exp b) {
        return lessToCompare(argumentCompare(a, b), argumentCompare(b, a));
      }
    };
  }

  private static int lessToCompare(boolean aLess, boolean bLess) {
    if (aLess) {
      return -1;
    } else if (bLess) {
      return 1;
    } else {
      return 0;
    }
  }

  public boolean isLocalOffsetPositive() {
    return false;
  }

  public boolean isLocalOffsetNegative() {
    return !isLocalOffsetPositive();
  }

  /**
   * @return true if sp op K can address a local for this convention
   */
  public boolean isOpCompatStackLocal(Oper op) {
    if (op == Oper.MINUS) {
      return isLocalOffsetNegative();
    } else if (op == Oper.PLUS) {
      return isLocalOffsetPositive();
    }
    return false;
  }

  /**
   * @return true if e is m[..] of a stack local address
   */
  public boolean isStackLocal(Platform platform, Exp e) {
    if (e.isSubscript()) {
      return isStackLocal(platform, e.getSubExp1());
    }
    if (!e.isMemOf()) {
      return false;
    }
    return isAddrOfStackLocal(platform, e.getSubExp1());
  }

  /**
   * @return true if e is sp, sp{-}, or sp +/- K in the direction locals
   *         grow, or the address of a stack local
   */
  public boolean isAddrOfStackLocal(Platform platform, Exp e) {
    if (e.isAddrOf()) {
      return isStackLocal(platform, e.getSubExp1());
    }
    Result<Integer> spReg = getStackRegister(platform);
    if (spReg.isError()) {
      return false;
    }
    Exp sp = Location.regOf(spReg.getValue());
    Oper op = e.getOper();
    if (op != Oper.MINUS && op != Oper.PLUS) {
      return isStackPointer(e, sp);
    }
    if (!isOpCompatStackLocal(op)) {
      return false;
    }
    if (!e.getSubExp2().isIntConst()) {
      return false;
    }
    return isStackPointer(e.getSubExp1(), sp);
  }

  /**
   * sp, or sp with an implicit definition
   */
  protected static boolean isStackPointer(Exp e, Exp sp) {
    if (e.isSubscript()) {
      return ((RefExp)e).isImplicitDef() && e.getSubExp1().equals(sp);
    }
    return e.equals(sp);
  }

  /**
   * From m[sp + K] or m[sp - K], with sp optionally subscripted,
   * return K or -K
   * @return the offset, or 0 if e does not have that form
   */
  protected static int stackOffset(Exp e, int sp) {
    if (!e.isMemOf()) {
      return 0;
    }
    Exp addr = e.getSubExp1();
    Oper op = addr.getOper();
    if (op != Oper.PLUS && op != Oper.MINUS) {
      return 0;
    }
    Exp base = addr.getSubExp1();
    if (base.isSubscript()) {
      base = base.getSubExp1();
    }
    if (!base.isRegN(sp) || !addr.getSubExp2().isIntConst()) {
      return 0;
    }
    int k = ((Const)addr.getSubExp2()).getInt();
    return op == Oper.MINUS ? -k : k;
  }

  /**
   * @return the stack pointer register number for this convention
   */
  public Result<Integer> getStackRegister() {
    return Result.ofError("stack register not defined for this convention");
  }

  /**
   * Stack pointer register by platform, for use before a signature is
   * promoted
   */
  public static Result<Integer> getStackRegister(Platform platform) {
    switch (platform) {
      case PENTIUM:
        return Result.ofValue(28);
      case SPARC:
        return Result.ofValue(14);
      case PPC:
        return Result.ofValue(1);
      case MIPS:
        return Result.ofValue(29);
      case ST20:
        return Result.ofValue(3);
      default:
        return Result.ofError("stack register not defined for platform "
                              + platform.getName());
    }
  }

  /**
   * Registers not preserved by procedures following the platform's ABI
   */
  public static List<Exp> getABIDefines(Platform platform) {
    List<Exp> defs = new ArrayList<Exp>();
    switch (platform) {
      case PENTIUM:
        defs.add(Location.regOf(24));
        defs.add(Location.regOf(25));
        defs.add(Location.regOf(26));
        break;
      case SPARC:
        for (int r = 8; r <= 13; r++) {
          defs.add(Location.regOf(r));
        }
        defs.add(Location.regOf(1));
        break;
      case PPC:
        for (int r = 3; r <= 12; r++) {
          defs.add(Location.regOf(r));
        }
        break;
      case ST20:
        defs.add(Location.regOf(0));
        defs.add(Location.regOf(1));
        defs.add(Location.regOf(2));
        break;
      default:
        break;
    }
    return defs;
  }

  /* Promotion */

  public boolean isPromoted() {
    return false;
  }

  /**
   * Find a more specific signature for the procedure.
   * @param proc procedure this is the signature of
   * @return a new promoted signature, or this if none qualifies
   */
  public Signature promote(Procedure proc) {
    if (isPromoted()) {
      return this;
    }
    if (!Settings.getBooleanUnchecked(Settings.SIGNATURE_PROMOTE)) {
      return this;
    }
    Signature promoted = CallingConvention.promote(proc, this);
    if (promoted == null) {
      return this;
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Promoted signature of " + proc.getName() + " to " +
                   promoted.getPlatform() + "/" + promoted.getConvention());
    }
    return promoted;
  }

  /* Equality and printing */

  /**
   * Signatures are equal if their parameters and returns are.  Names
   * are not significant.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Signature)) {
      return false;
    }
    Signature other = (Signature)obj;
    return params.equals(other.params) && returns.equals(other.returns);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(params, returns);
  }

  public void print(StringBuilder sb) {
    if (forced) {
      sb.append("*forced* ");
    }
    if (returns.isEmpty()) {
      sb.append("void ");
    } else {
      sb.append("{ ");
      for (int i = 0; i < returns.size(); i++) {
        Return r = returns.get(i);
        sb.append(r.getType().getCtype()).append(" ").append(r.getExp());
        if (i != returns.size() - 1) {
          sb.append(",");
        }
        sb.append(" ");
      }
      sb.append("} ");
    }
    sb.append(name).append("(");
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(params.get(i).toString());
    }
    sb.append(")");
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    print(sb);
    return sb.toString();
  }
}
