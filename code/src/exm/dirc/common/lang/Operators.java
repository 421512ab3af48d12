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
package exm.dirc.common.lang;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import exm.dirc.common.exceptions.DIRCRuntimeError;

/**
 * This class defines the operator tags of IR expressions and their
 * surface syntax.
 */
public class Operators {

  /**
   * Operator tag of an expression node.  Declaration order is the primary
   * key of the expression order, so do not reorder casually.
   */
  public static enum Oper {
    // Integer arithmetic; S suffix is signed
    PLUS, MINUS, MULT, MULTS, DIV, DIVS, MOD, MODS, NEG,
    // Logical and comparisons
    AND, OR, EQUALS, NOT_EQUAL, LESS, GTR, LESS_EQ, GTR_EQ,
    LESS_UNS, GTR_UNS, LESS_EQ_UNS, GTR_EQ_UNS,
    NOT, LNOT, SIGN_EXT,
    // Bit operations
    BIT_AND, BIT_OR, BIT_XOR, SHIFT_L, SHIFT_R, SHIFT_RA,
    ROTATE_L, ROTATE_R, ROTATE_LC, ROTATE_RC,
    UPPER, LOWER,
    // Floating point
    FPLUS, FMINUS, FMULT, FDIV, FNEG,
    POW, SQRT, SIN, COS, TAN, ARC_TAN, LOG2, LOG10, LOGE,
    SQRTS, SQRTD, SQRTQ,
    EXECUTE, MACH_FTR, SUCCESSOR,
    // Conversions, mostly ternary (from size, to size, expression)
    TRUNCU, TRUNCS, ZFILL, SGN_EX, FSIZE, ITOF, FTOI, FROUND, FTRUNC, FABS,
    OP_TABLE,
    TERN, AT,
    // Structural
    TYPED_EXP, FLAG_CALL, FLAG_DEF, LIST, EXP_TABLE, NAME_TABLE, GUARD,
    MEMBER_ACCESS, ARRAY_INDEX, SIZE,
    // Locations and location-like
    REG_OF, MEM_OF, ADDR_OF, VAR, TYPE_OF, KIND_OF, INIT_VALUE_OF, PHI,
    LOCAL, GLOBAL, PARAM, TEMP,
    SUBSCRIPT,
    // Constants
    INT_CONST, LONG_CONST, FLT_CONST, STR_CONST, FUNC_CONST,
    // Wildcards
    WILD_INT_CONST, WILD_STR_CONST, WILD_MEM_OF, WILD_REG_OF, WILD_ADDR_OF,
    // Machine terminals
    PC, FLAGS, FFLAGS, CF, ZF, OF, NF, DF, AFP, AGP, ANULL, FPUSH, FPOP,
    DEFINE_ALL,
    NIL, TRUE, FALSE, WILD,
    TYPE_VAL,
  }

  private static final Map<Oper, String> binarySpellings =
                          new EnumMap<Oper, String>(Oper.class);
  private static final Map<Oper, String> terminalSpellings =
                          new EnumMap<Oper, String>(Oper.class);
  private static final Map<Oper, String> unaryFunctionNames =
                          new EnumMap<Oper, String>(Oper.class);
  private static final Map<Oper, String> ternaryFunctionNames =
                          new EnumMap<Oper, String>(Oper.class);
  private static final Map<Oper, Oper> inverseComparisons =
                          new EnumMap<Oper, Oper>(Oper.class);

  private static final Set<Oper> locationOps = EnumSet.of(
      Oper.REG_OF, Oper.MEM_OF, Oper.LOCAL, Oper.GLOBAL, Oper.PARAM,
      Oper.TEMP);

  private static final Set<Oper> constOps = EnumSet.of(
      Oper.INT_CONST, Oper.LONG_CONST, Oper.FLT_CONST, Oper.STR_CONST,
      Oper.FUNC_CONST);

  private static final Set<Oper> wildcardOps = EnumSet.of(
      Oper.WILD, Oper.WILD_INT_CONST, Oper.WILD_STR_CONST,
      Oper.WILD_MEM_OF, Oper.WILD_REG_OF, Oper.WILD_ADDR_OF);

  private static final Set<Oper> flagOps = EnumSet.of(
      Oper.CF, Oper.ZF, Oper.OF, Oper.NF, Oper.DF, Oper.FLAGS, Oper.FFLAGS);

  private static final Set<Oper> commutativeOps = EnumSet.of(
      Oper.PLUS, Oper.MULT, Oper.MULTS, Oper.BIT_OR, Oper.BIT_AND,
      Oper.BIT_XOR, Oper.AND, Oper.OR, Oper.EQUALS, Oper.NOT_EQUAL,
      Oper.FPLUS, Oper.FMULT);

  static {
    binarySpellings.put(Oper.PLUS, " + ");
    binarySpellings.put(Oper.MINUS, " - ");
    binarySpellings.put(Oper.MULT, " * ");
    binarySpellings.put(Oper.MULTS, " *! ");
    binarySpellings.put(Oper.DIV, " / ");
    binarySpellings.put(Oper.DIVS, " /! ");
    binarySpellings.put(Oper.MOD, " % ");
    binarySpellings.put(Oper.MODS, " %! ");
    binarySpellings.put(Oper.FPLUS, " +f ");
    binarySpellings.put(Oper.FMINUS, " -f ");
    binarySpellings.put(Oper.FMULT, " *f ");
    binarySpellings.put(Oper.FDIV, " /f ");
    binarySpellings.put(Oper.POW, " pow ");
    binarySpellings.put(Oper.AND, " and ");
    binarySpellings.put(Oper.OR, " or ");
    binarySpellings.put(Oper.BIT_AND, " & ");
    binarySpellings.put(Oper.BIT_OR, " | ");
    binarySpellings.put(Oper.BIT_XOR, " ^ ");
    binarySpellings.put(Oper.EQUALS, " = ");
    binarySpellings.put(Oper.NOT_EQUAL, " ~= ");
    binarySpellings.put(Oper.LESS, " < ");
    binarySpellings.put(Oper.GTR, " > ");
    binarySpellings.put(Oper.LESS_EQ, " <= ");
    binarySpellings.put(Oper.GTR_EQ, " >= ");
    binarySpellings.put(Oper.LESS_UNS, " <u ");
    binarySpellings.put(Oper.GTR_UNS, " >u ");
    binarySpellings.put(Oper.LESS_EQ_UNS, " <=u ");
    binarySpellings.put(Oper.GTR_EQ_UNS, " >=u ");
    binarySpellings.put(Oper.UPPER, " GT ");
    binarySpellings.put(Oper.LOWER, " LT ");
    binarySpellings.put(Oper.SHIFT_L, " << ");
    binarySpellings.put(Oper.SHIFT_R, " >> ");
    binarySpellings.put(Oper.SHIFT_RA, " >>A ");
    binarySpellings.put(Oper.ROTATE_L, " rl ");
    binarySpellings.put(Oper.ROTATE_R, " rr ");
    binarySpellings.put(Oper.ROTATE_LC, " rlc ");
    binarySpellings.put(Oper.ROTATE_RC, " rrc ");

    terminalSpellings.put(Oper.PC, "%pc");
    terminalSpellings.put(Oper.FLAGS, "%flags");
    terminalSpellings.put(Oper.FFLAGS, "%fflags");
    terminalSpellings.put(Oper.CF, "%CF");
    terminalSpellings.put(Oper.ZF, "%ZF");
    terminalSpellings.put(Oper.OF, "%OF");
    terminalSpellings.put(Oper.NF, "%NF");
    terminalSpellings.put(Oper.DF, "%DF");
    terminalSpellings.put(Oper.AFP, "%afp");
    terminalSpellings.put(Oper.AGP, "%agp");
    terminalSpellings.put(Oper.WILD, "WILD");
    terminalSpellings.put(Oper.ANULL, "%anul");
    terminalSpellings.put(Oper.FPUSH, "FPUSH");
    terminalSpellings.put(Oper.FPOP, "FPOP");
    terminalSpellings.put(Oper.WILD_MEM_OF, "m[WILD]");
    terminalSpellings.put(Oper.WILD_REG_OF, "r[WILD]");
    terminalSpellings.put(Oper.WILD_ADDR_OF, "a[WILD]");
    terminalSpellings.put(Oper.WILD_INT_CONST, "WILDINT");
    terminalSpellings.put(Oper.WILD_STR_CONST, "WILDSTR");
    terminalSpellings.put(Oper.NIL, "");
    terminalSpellings.put(Oper.TRUE, "true");
    terminalSpellings.put(Oper.FALSE, "false");
    terminalSpellings.put(Oper.DEFINE_ALL, "<all>");

    unaryFunctionNames.put(Oper.SQRTS, "SQRTs");
    unaryFunctionNames.put(Oper.SQRTD, "SQRTd");
    unaryFunctionNames.put(Oper.SQRTQ, "SQRTq");
    unaryFunctionNames.put(Oper.SQRT, "sqrt");
    unaryFunctionNames.put(Oper.SIN, "sin");
    unaryFunctionNames.put(Oper.COS, "cos");
    unaryFunctionNames.put(Oper.TAN, "tan");
    unaryFunctionNames.put(Oper.ARC_TAN, "arctan");
    unaryFunctionNames.put(Oper.LOG2, "log2");
    unaryFunctionNames.put(Oper.LOG10, "log10");
    unaryFunctionNames.put(Oper.LOGE, "loge");
    unaryFunctionNames.put(Oper.EXECUTE, "execute");
    unaryFunctionNames.put(Oper.MACH_FTR, "machine");
    unaryFunctionNames.put(Oper.SUCCESSOR, "succ");
    unaryFunctionNames.put(Oper.PHI, "phi");
    unaryFunctionNames.put(Oper.FTRUNC, "ftrunc");
    unaryFunctionNames.put(Oper.FABS, "fabs");

    ternaryFunctionNames.put(Oper.TRUNCU, "truncu");
    ternaryFunctionNames.put(Oper.TRUNCS, "truncs");
    ternaryFunctionNames.put(Oper.ZFILL, "zfill");
    ternaryFunctionNames.put(Oper.SGN_EX, "sgnex");
    ternaryFunctionNames.put(Oper.FSIZE, "fsize");
    ternaryFunctionNames.put(Oper.ITOF, "itof");
    ternaryFunctionNames.put(Oper.FTOI, "ftoi");
    ternaryFunctionNames.put(Oper.FROUND, "fround");
    ternaryFunctionNames.put(Oper.FTRUNC, "ftrunc");
    ternaryFunctionNames.put(Oper.OP_TABLE, "optable");

    addInversePair(Oper.EQUALS, Oper.NOT_EQUAL);
    addInversePair(Oper.LESS, Oper.GTR_EQ);
    addInversePair(Oper.LESS_EQ, Oper.GTR);
    addInversePair(Oper.LESS_UNS, Oper.GTR_EQ_UNS);
    addInversePair(Oper.LESS_EQ_UNS, Oper.GTR_UNS);
  }

  private static void addInversePair(Oper a, Oper b) {
    inverseComparisons.put(a, b);
    inverseComparisons.put(b, a);
  }

  /**
   * @param op
   * @return infix spelling with surrounding spaces, or null if op is
   *        not an infix binary operator
   */
  public static String binarySpelling(Oper op) {
    return binarySpellings.get(op);
  }

  public static String terminalSpelling(Oper op) {
    return terminalSpellings.get(op);
  }

  /**
   * @return name of function-like unary operator, e.g. "sqrt", or null
   */
  public static String unaryFunctionName(Oper op) {
    return unaryFunctionNames.get(op);
  }

  /**
   * @return name of function-like ternary operator, e.g. "truncu", or null
   */
  public static String ternaryFunctionName(Oper op) {
    return ternaryFunctionNames.get(op);
  }

  public static boolean isComparison(Oper op) {
    return inverseComparisons.containsKey(op);
  }

  /**
   * @param op a comparison operator
   * @return the comparison that is true exactly when op is false
   */
  public static Oper inverseComparison(Oper op) {
    Oper inverse = inverseComparisons.get(op);
    if (inverse == null) {
      throw new DIRCRuntimeError("Not a comparison: " + op);
    }
    return inverse;
  }

  public static boolean isLocation(Oper op) {
    return locationOps.contains(op);
  }

  public static boolean isConst(Oper op) {
    return constOps.contains(op);
  }

  public static boolean isWildcard(Oper op) {
    return wildcardOps.contains(op);
  }

  public static boolean isFlag(Oper op) {
    return flagOps.contains(op);
  }

  public static boolean isCommutative(Oper op) {
    return commutativeOps.contains(op);
  }

  /**
   * Name used for operators in diagnostic output, e.g. "opPlus"
   */
  public static String operName(Oper op) {
    StringBuilder sb = new StringBuilder("op");
    boolean upper = true;
    for (char c: op.name().toCharArray()) {
      if (c == '_') {
        upper = true;
      } else if (upper) {
        sb.append(c);
        upper = false;
      } else {
        sb.append(Character.toLowerCase(c));
      }
    }
    return sb.toString();
  }
}
