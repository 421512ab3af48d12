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
package exm.dirc.ir.opt;

import java.util.EnumSet;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.dirc.common.Logging;
import exm.dirc.common.Settings;
import exm.dirc.common.lang.Operators;
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.lang.Types;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.FlagDef;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.RefExp;
import exm.dirc.ir.tree.RefExp.Def;
import exm.dirc.ir.tree.Statement;
import exm.dirc.ir.tree.Ternary;
import exm.dirc.ir.tree.Terminal;
import exm.dirc.ir.tree.TypedExp;
import exm.dirc.ir.tree.Unary;

/**
 * Local algebraic simplification of expressions.
 *
 * All rewrites are bottom-up and produce new nodes: the input is never
 * modified, and unchanged subtrees are shared with the result.
 */
public class ExpSimplifier {

  private static final Logger logger = Logging.getDircLogger();

  /** Operators that get integer constants moved to the right */
  private static final Set<Oper> CONST_RIGHT_OPS = EnumSet.of(
      Oper.PLUS, Oper.MULT, Oper.MULTS, Oper.BIT_OR, Oper.BIT_AND);

  private static final Set<Oper> INCLUSIVE_COMPARISONS = EnumSet.of(
      Oper.GTR_EQ, Oper.LESS_EQ, Oper.GTR_EQ_UNS, Oper.LESS_EQ_UNS);

  /**
   * Apply {@link #polySimplify(Exp)} until nothing changes.
   * @param e
   * @return simplified expression, equal to e if no rule applied
   */
  public static Exp simplify(Exp e) {
    int maxPasses = Settings.getIntUnchecked(Settings.SIMPLIFY_MAX_PASSES);
    boolean logChanges = Settings.getBooleanUnchecked(
                                          Settings.SIMPLIFY_LOG_CHANGES);
    Exp curr = e;
    boolean converged = false;
    for (int pass = 0; pass < maxPasses; pass++) {
      Exp next = polySimplify(curr);
      if (next == curr || next.equals(curr)) {
        converged = true;
        break;
      }
      if (logChanges && logger.isDebugEnabled()) {
        logger.debug("simplified " + curr + " to " + next);
      }
      curr = next;
    }
    if (!converged) {
      Logging.uniqueWarn("Simplification of " + e + " did not converge after "
                        + maxPasses + " passes, stopped at " + curr);
    }
    if (Settings.getBooleanUnchecked(Settings.SIMPLIFY_ARITH_AFTER)) {
      curr = ArithSimplifier.simplifyArith(curr);
    }
    return curr;
  }

  /**
   * One bottom-up pass of local rewrite rules.
   * @param e
   * @return the rewritten expression, or e itself if no rule applied
   */
  public static Exp polySimplify(Exp e) {
    if (e instanceof RefExp) {
      return polySimplifyRef((RefExp)e);
    } else if (e instanceof TypedExp) {
      return polySimplifyTyped((TypedExp)e);
    } else if (e instanceof FlagDef) {
      return ((FlagDef)e).withSubExp1(polySimplify(e.getSubExp1()));
    } else if (e instanceof Location) {
      return polySimplifyLocation((Location)e);
    } else if (e instanceof Unary) {
      return polySimplifyUnary((Unary)e);
    } else if (e instanceof Binary) {
      return polySimplifyBinary((Binary)e);
    } else if (e instanceof Ternary) {
      return polySimplifyTernary((Ternary)e);
    } else {
      // Leaves are already as simple as they get
      return e;
    }
  }

  private static Exp polySimplifyUnary(Unary e) {
    Oper op = e.getOper();
    Exp sub = polySimplify(e.getSubExp1());

    if ((op == Oper.NOT || op == Oper.LNOT) && sub instanceof Binary
        && sub.isComparison()) {
      Binary cmp = (Binary)sub;
      return cmp.withOper(Operators.inverseComparison(cmp.getOper()));
    }

    switch (op) {
      case NEG:
      case NOT:
      case LNOT:
        if (sub.isIntConst()) {
          int k = intVal(sub);
          int result;
          if (op == Oper.NEG) {
            result = -k;
          } else if (op == Oper.NOT) {
            result = ~k;
          } else {
            result = (k == 0) ? 1 : 0;
          }
          return ((Const)sub).withInt(result);
        } else if (sub.getOper() == op) {
          return sub.getSubExp1();
        }
        break;
      case ADDR_OF:
        if (sub.isMemOf()) {
          return sub.getSubExp1();
        }
        break;
      default:
        break;
    }
    return e.withSubExp1(sub);
  }

  private static Exp polySimplifyLocation(Location e) {
    Exp res = polySimplifyUnary(e);
    if (res.isMemOf() && res.getSubExp1().isAddrOf()) {
      return res.getSubExp1().getSubExp1();
    }
    return res;
  }

  private static Exp polySimplifyTyped(TypedExp e) {
    Exp sub = e.getSubExp1();
    if (sub.isRegOf()) {
      return sub;
    }
    return e.withSubExp1(simplify(sub));
  }

  private static Exp polySimplifyRef(RefExp e) {
    Exp sub = e.getSubExp1();
    Exp newSub = polySimplify(sub);
    if (newSub != sub) {
      return e.withSubExp1(newSub);
    }

    Def def = e.getDef();
    if (sub.getOper() == Oper.DF && def.getKind() == Def.Kind.IMPLICIT) {
      // Direction flag is clear on entry
      return Const.get(0);
    }

    if (sub.isRegN(0) && def.getKind() == Def.Kind.DEFINED) {
      Statement stmt = def.getStatement();
      if (stmt.isAssign() && stmt.getLeft() != null
          && stmt.getLeft().isRegN(24)) {
        // Low half of a 32-bit register defined by the same statement
        return TypedExp.get(Types.intType(16),
                            RefExp.get(Location.regOf(24), def));
      }
    }
    return e;
  }

  private static Exp polySimplifyBinary(Binary e) {
    Oper op = e.getOper();
    Exp s1 = polySimplify(e.getSubExp1());
    Exp s2 = polySimplify(e.getSubExp2());

    if (s1.isIntConst() && s2.isIntConst()) {
      Exp folded = foldIntConsts(op, intVal(s1), intVal(s2));
      if (folded != null) {
        return folded;
      }
    }

    if ((op == Oper.BIT_XOR || op == Oper.MINUS) && s1.equals(s2)) {
      return Const.get(0);
    }
    if ((op == Oper.BIT_OR || op == Oper.BIT_AND) && s1.equals(s2)) {
      return s1;
    }
    if (op == Oper.EQUALS && s1.equals(s2)) {
      return Terminal.trueExp();
    }

    // Canonical operand order
    if (s1.isIntConst() && CONST_RIGHT_OPS.contains(op)) {
      Exp tmp = s1;
      s1 = s2;
      s2 = tmp;
    } else if (s1.isBoolConst() && !s2.isBoolConst() &&
               (op == Oper.AND || op == Oper.OR)) {
      Exp tmp = s1;
      s1 = s2;
      s2 = tmp;
    } else if (op == Oper.PLUS && isAddrOfGlobal(s2) && !isAddrOfGlobal(s1)) {
      Exp tmp = s1;
      s1 = s2;
      s2 = tmp;
    }

    Oper op1 = s1.getOper();
    Oper op2 = s2.getOper();

    if (op == Oper.PLUS && op1 == Oper.PLUS && s2.isIntConst()
        && s1.getSubExp2().isIntConst()) {
      // (x + a) + b => x + (a+b)
      Const a = (Const)s1.getSubExp2();
      return Binary.plus(s1.getSubExp1(), a.withInt(a.getInt() + intVal(s2)));
    }
    if (op == Oper.PLUS && op1 == Oper.MINUS && s2.isIntConst()
        && s1.getSubExp2().isIntConst()) {
      // (x - a) + b => x + (b-a)
      Const a = (Const)s1.getSubExp2();
      return Binary.plus(s1.getSubExp1(), a.withInt(intVal(s2) - a.getInt()));
    }
    if ((op == Oper.PLUS || op == Oper.MINUS) && isMult(op1)
        && s2.equals(s1.getSubExp1())) {
      // (x*k) + x => x*(k+1)
      return Binary.get(op1, s1.getSubExp1(),
                        Binary.get(op, s1.getSubExp2(), Const.get(1)));
    }
    if (op == Oper.PLUS && isMult(op2) && s1.equals(s2.getSubExp1())) {
      // x + x*k => x*(k+1)
      return Binary.get(op2, s2.getSubExp1(),
                        Binary.plus(s2.getSubExp2(), Const.get(1)));
    }

    // a + -K => a - K, a - -K => a + K
    if ((op == Oper.PLUS || op == Oper.MINUS) && s2.isIntConst()
        && intVal(s2) < 0 && intVal(s2) != Integer.MIN_VALUE) {
      s2 = ((Const)s2).withInt(-intVal(s2));
      op = (op == Oper.PLUS) ? Oper.MINUS : Oper.PLUS;
    }

    if ((op == Oper.PLUS || op == Oper.MINUS || op == Oper.BIT_OR)
        && isInt(s2, 0)) {
      return s1;
    }
    if (op == Oper.OR && s2.isFalse()) {
      return s1;
    }
    if ((isMult(op) || op == Oper.BIT_AND) && isInt(s2, 0)) {
      return Const.get(0);
    }
    if (op == Oper.AND && s2.isFalse()) {
      return Terminal.falseExp();
    }
    if (isMult(op) && isInt(s2, 1)) {
      return s1;
    }
    if (isDiv(op) && isMult(op1) && s2.equals(s1.getSubExp2())) {
      // (x*y)/y => x
      return s1.getSubExp1();
    }
    if (isDiv(op) && isInt(s2, 1)) {
      return s1;
    }
    if (isMod(op) && isInt(s2, 1)) {
      return Const.get(0);
    }
    if (isMod(op) && isMult(op1) && s2.equals(s1.getSubExp2())) {
      // (x*y)%y => 0
      return Const.get(0);
    }
    if (op == Oper.BIT_AND && isInt(s2, -1)) {
      return s1;
    }
    if (op == Oper.AND && isNonZero(s2)) {
      return s1;
    }
    if (op == Oper.OR && isNonZero(s2)) {
      return Terminal.trueExp();
    }

    if ((op == Oper.SHIFT_L || op == Oper.SHIFT_R) && s2.isIntConst()) {
      int k = intVal(s2);
      if (k >= 0 && k < 32) {
        Oper newOp = (op == Oper.SHIFT_L) ? Oper.MULT : Oper.DIV;
        return Binary.get(newOp, s1, ((Const)s2).withInt(1 << k));
      }
    }

    if (op == Oper.EQUALS && isInt(s2, 1) && op1 == Oper.EQUALS) {
      // (x = y) = 1 => x = y
      return s1;
    }
    if (op == Oper.EQUALS && isInt(s2, 0) && op1 == Oper.PLUS
        && s1.getSubExp2().isIntConst()) {
      int n = intVal(s1.getSubExp2());
      if (n < 0) {
        // x + -n = 0 => x = n
        return Binary.get(Oper.EQUALS, s1.getSubExp1(), Const.get(-n));
      }
    }
    if (op == Oper.EQUALS && isInt(s2, 0) && op1 == Oper.EQUALS) {
      return Binary.get(Oper.NOT_EQUAL, s1.getSubExp1(), s1.getSubExp2());
    }
    if (op == Oper.NOT_EQUAL && isInt(s2, 1) && op1 == Oper.EQUALS) {
      return Binary.get(Oper.NOT_EQUAL, s1.getSubExp1(), s1.getSubExp2());
    }
    if (op == Oper.NOT_EQUAL && isInt(s2, 0) && op1 == Oper.EQUALS) {
      return s1;
    }
    if (op == Oper.NOT_EQUAL && isInt(s2, 0) && op1 == Oper.MINUS
        && isInt(s1.getSubExp1(), 0)) {
      // (0 - x) ~= 0 => x ~= 0
      return Binary.get(Oper.NOT_EQUAL, s1.getSubExp2(), s2);
    }
    if (op == Oper.EQUALS && isInt(s2, 0) && op1 == Oper.GTR) {
      return Binary.get(Oper.LESS_EQ, s1.getSubExp1(), s1.getSubExp2());
    }
    if (op == Oper.EQUALS && isInt(s2, 0) && op1 == Oper.GTR_UNS) {
      return Binary.get(Oper.LESS_EQ_UNS, s1.getSubExp1(), s1.getSubExp2());
    }
    if (op == Oper.OR && op2 == Oper.EQUALS && INCLUSIVE_COMPARISONS.contains(op1)
        && sameOperands(s1, s2)) {
      // (x <= y) or (x = y) => x <= y
      return s1;
    }

    if (op == Oper.AND || op == Oper.OR) {
      // No arithmetic rules apply to logical connectives
      return rebuild(e, op, s1, s2);
    }

    if (op == Oper.PLUS && op2 == Oper.MULT && s1.equals(s2.getSubExp1())
        && s2.getSubExp2().isIntConst()) {
      // a + a*n => a*(n+1)
      Const n = (Const)s2.getSubExp2();
      return Binary.mult(s1, n.withInt(n.getInt() + 1));
    }
    if (op == Oper.MULT && op1 == Oper.MULT && s2.isIntConst()
        && s1.getSubExp2().isIntConst()) {
      // a*n*m => a*(n*m)
      Const n = (Const)s1.getSubExp2();
      return Binary.mult(s1.getSubExp1(), n.withInt(n.getInt() * intVal(s2)));
    }

    if (op == Oper.FMINUS && s1.isFltConst()
        && ((Const)s1).getFlt() == 0.0) {
      return Unary.get(Oper.FNEG, s2);
    }

    if ((op == Oper.PLUS || op == Oper.MINUS) && isMult(op1)
        && s2.isIntConst() && s1.getSubExp2().isIntConst()
        && intVal(s1.getSubExp2()) == intVal(s2)) {
      // (x*n) + n => (x+1)*n
      return Binary.get(op1, Binary.get(op, s1.getSubExp1(), Const.get(1)),
                        s2);
    }
    if ((op == Oper.PLUS || op == Oper.MINUS) && op1 == Oper.PLUS
        && s2.isIntConst()) {
      Exp prod = s1.getSubExp2();
      if (isMult(prod.getOper()) && prod.getSubExp2().isIntConst()
          && intVal(prod.getSubExp2()) == intVal(s2)) {
        // (y + x*n) + n => y + (x+1)*n
        return Binary.plus(s1.getSubExp1(),
            Binary.get(prod.getOper(),
                       Binary.get(op, prod.getSubExp1(), Const.get(1)), s2));
      }
    }

    if ((op == Oper.DIV || op == Oper.MOD) && op1 == Oper.PLUS
        && s2.isIntConst() && intVal(s2) != 0) {
      Exp sumOfProducts = simplifySumOfProducts(op, s1, intVal(s2));
      if (sumOfProducts != null) {
        return sumOfProducts;
      }
    }

    if (op == Oper.BIT_AND && op1 == Oper.MINUS && isInt(s1.getSubExp1(), 0)) {
      Exp cmp = s1.getSubExp2();
      if (cmp.getOper() == Oper.LESS_UNS && isInt(cmp.getSubExp1(), 0)) {
        // (0 - (0 <u e1)) & e2 => e2
        return s2;
      }
    }

    if (op == Oper.SIZE && s2 instanceof Location) {
      return s2;
    }

    return rebuild(e, op, s1, s2);
  }

  /**
   * ((x*a) + (y*b)) / c or % c, where c divides a and/or b
   * @return the rewritten expression, or null if the rule does not apply
   */
  private static Exp simplifySumOfProducts(Oper op, Exp sum, int c) {
    Exp left = sum.getSubExp1();
    Exp right = sum.getSubExp2();
    if (left.getOper() != Oper.MULT || right.getOper() != Oper.MULT
        || !left.getSubExp2().isIntConst() || !right.getSubExp2().isIntConst()) {
      return null;
    }
    int a = intVal(left.getSubExp2());
    int b = intVal(right.getSubExp2());
    boolean aDiv = a % c == 0;
    boolean bDiv = b % c == 0;
    if (op == Oper.DIV) {
      if (aDiv && bDiv) {
        return Binary.plus(Binary.mult(left.getSubExp1(), Const.get(a / c)),
                           Binary.mult(right.getSubExp1(), Const.get(b / c)));
      }
      return null;
    }
    assert(op == Oper.MOD);
    if (aDiv && bDiv) {
      return Const.get(0);
    } else if (aDiv) {
      return Binary.get(Oper.MOD, right, Const.get(c));
    } else if (bDiv) {
      return Binary.get(Oper.MOD, left, Const.get(c));
    }
    return null;
  }

  private static Exp polySimplifyTernary(Ternary e) {
    Oper op = e.getOper();
    Exp s1 = polySimplify(e.getSubExp1());
    Exp s2 = polySimplify(e.getSubExp2());
    Exp s3 = polySimplify(e.getSubExp3());

    switch (op) {
      case TERN:
        if (isInt(s2, 1) && isInt(s3, 0)) {
          return s1;
        } else if (isInt(s1, 1)) {
          return s2;
        } else if (isInt(s1, 0)) {
          return s3;
        }
        break;
      case SGN_EX:
      case ZFILL:
        if (s3.isIntConst()) {
          return s3;
        }
        break;
      case FSIZE:
        if (s3.getOper() == Oper.ITOF && s1.equals(s3.getSubExp2())
            && s2.equals(s3.getSubExp1())) {
          return s3;
        } else if (s3.isFltConst()) {
          return s3;
        }
        break;
      case ITOF:
        if (isInt(s2, 32) && s3.isIntConst()) {
          return Const.getFlt(Float.intBitsToFloat(intVal(s3)));
        }
        break;
      case TRUNCU:
      case TRUNCS:
        if (isInt(s1, 32) && s3.isIntConst()) {
          if (isInt(s2, 16)) {
            return Const.get(intVal(s3) & 0xffff);
          } else if (isInt(s2, 8)) {
            return Const.get(intVal(s3) & 0xff);
          }
        }
        break;
      default:
        break;
    }
    return e.withSubExps(s1, s2, s3);
  }

  /**
   * Remove redundant a[m[..]] and m[a[..]] pairs anywhere in the tree.
   * @param e
   * @return rewritten expression, or e if nothing changed
   */
  public static Exp simplifyAddr(Exp e) {
    if (e instanceof Unary) {
      Unary u = (Unary)e;
      Exp sub = u.getSubExp1();
      if (u.isMemOf() && sub.isAddrOf()) {
        return simplifyAddr(sub.getSubExp1());
      }
      if (u.isAddrOf()) {
        if (sub.isMemOf()) {
          return simplifyAddr(sub.getSubExp1());
        }
        if (sub.getOper() == Oper.SIZE && sub.getSubExp2().isMemOf()) {
          return simplifyAddr(sub.getSubExp2().getSubExp1());
        }
      }
      return u.withSubExp1(simplifyAddr(sub));
    } else if (e instanceof Binary) {
      Binary b = (Binary)e;
      return b.withSubExps(simplifyAddr(b.getSubExp1()),
                           simplifyAddr(b.getSubExp2()));
    } else if (e instanceof Ternary) {
      Ternary t = (Ternary)e;
      return t.withSubExps(simplifyAddr(t.getSubExp1()),
          simplifyAddr(t.getSubExp2()), simplifyAddr(t.getSubExp3()));
    }
    return e;
  }

  /**
   * Fold a binary operator over two int constants.
   * @return folded constant, or null if op can't be folded
   */
  static Exp foldIntConsts(Oper op, int k1, int k2) {
    switch (op) {
      case PLUS:
        return Const.get(k1 + k2);
      case MINUS:
        return Const.get(k1 - k2);
      case MULT:
      case MULTS:
        // Low 32 bits are the same for signed and unsigned products
        return Const.get(k1 * k2);
      case DIV:
        return k2 == 0 ? null : Const.get(Integer.divideUnsigned(k1, k2));
      case DIVS:
        return k2 == 0 ? null : Const.get(k1 / k2);
      case MOD:
        return k2 == 0 ? null : Const.get(Integer.remainderUnsigned(k1, k2));
      case MODS:
        return k2 == 0 ? null : Const.get(k1 % k2);
      case SHIFT_L:
        if (Integer.compareUnsigned(k2, 32) >= 0) {
          return Const.get(0);
        }
        return Const.get(k1 << k2);
      case SHIFT_R:
        // Logical shift, consistent with x >> k => x / 2^k
        return Const.get(k1 >>> k2);
      case SHIFT_RA:
        return Const.get((k1 >> k2) | (((1 << k2) - 1) << (32 - k2)));
      case BIT_OR:
        return Const.get(k1 | k2);
      case BIT_AND:
        return Const.get(k1 & k2);
      case BIT_XOR:
        return Const.get(k1 ^ k2);
      case EQUALS:
        return boolInt(k1 == k2);
      case NOT_EQUAL:
        return boolInt(k1 != k2);
      case LESS:
        return boolInt(k1 < k2);
      case GTR:
        return boolInt(k1 > k2);
      case LESS_EQ:
        return boolInt(k1 <= k2);
      case GTR_EQ:
        return boolInt(k1 >= k2);
      case LESS_UNS:
        return boolInt(Integer.compareUnsigned(k1, k2) < 0);
      case GTR_UNS:
        return boolInt(Integer.compareUnsigned(k1, k2) > 0);
      case LESS_EQ_UNS:
        return boolInt(Integer.compareUnsigned(k1, k2) <= 0);
      case GTR_EQ_UNS:
        return boolInt(Integer.compareUnsigned(k1, k2) >= 0);
      default:
        return null;
    }
  }

  private static Const boolInt(boolean b) {
    return Const.get(b ? 1 : 0);
  }

  private static Exp rebuild(Binary e, Oper op, Exp s1, Exp s2) {
    if (op == e.getOper()) {
      return e.withSubExps(s1, s2);
    }
    return Binary.get(op, s1, s2);
  }

  private static boolean sameOperands(Exp a, Exp b) {
    Exp a1 = a.getSubExp1(), a2 = a.getSubExp2();
    Exp b1 = b.getSubExp1(), b2 = b.getSubExp2();
    return (a1.equals(b1) && a2.equals(b2)) ||
           (a1.equals(b2) && a2.equals(b1));
  }

  /**
   * a[g{..}] for some global g
   */
  private static boolean isAddrOfGlobal(Exp e) {
    if (!e.isAddrOf()) {
      return false;
    }
    Exp sub = e.getSubExp1();
    return sub.isSubscript() && sub.getSubExp1().isGlobal();
  }

  private static boolean isNonZero(Exp e) {
    return e.isTrue() || (e.isIntConst() && intVal(e) != 0);
  }

  private static boolean isMult(Oper op) {
    return op == Oper.MULT || op == Oper.MULTS;
  }

  private static boolean isDiv(Oper op) {
    return op == Oper.DIV || op == Oper.DIVS;
  }

  private static boolean isMod(Oper op) {
    return op == Oper.MOD || op == Oper.MODS;
  }

  static boolean isInt(Exp e, int k) {
    return e.isIntConst() && intVal(e) == k;
  }

  static int intVal(Exp e) {
    return ((Const)e).getInt();
  }
}
