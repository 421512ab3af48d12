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
package exm.dirc.ir.typing;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.lang.Types;
import exm.dirc.common.lang.Types.ArrayType;
import exm.dirc.common.lang.Types.PointerType;
import exm.dirc.common.lang.Types.Type;
import exm.dirc.ir.opt.ExpSimplifier;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.RefExp;
import exm.dirc.ir.tree.Ternary;
import exm.dirc.ir.tree.Terminal;
import exm.dirc.ir.tree.TypeVal;
import exm.dirc.ir.tree.Unary;

/**
 * Generates type constraints for constraint-based type analysis.
 *
 * A constraint is a boolean expression over terms T[e] (written
 * {@code TYPE_OF(e)}) and type values.  The result argument is either
 * a known type, as a {@link TypeVal}, or a type variable.
 */
public class ConstraintGenerator {

  /**
   * @param e expression to constrain
   * @param result type value or type variable e must agree with
   * @return constraint, never null
   */
  public static Exp genConstraints(Exp e, Exp result) {
    if (e instanceof Const) {
      return constConstraints((Const)e, result);
    } else if (e instanceof RefExp) {
      return refConstraints((RefExp)e, result);
    } else if (e instanceof Unary) {
      return unaryConstraints((Unary)e, result);
    } else if (e instanceof Binary) {
      return binaryConstraints((Binary)e, result);
    } else if (e instanceof Ternary) {
      return ternaryConstraints((Ternary)e, result);
    }
    return Terminal.trueExp();
  }

  private static Exp constConstraints(Const c, Exp result) {
    if (result.isTypeVal()) {
      Type t = ((TypeVal)result).getType();
      boolean match;
      switch (c.getOper()) {
        case INT_CONST:
          match = intConstMatches(t, Integer.compareUnsigned(c.getInt(), 0x100) >= 0);
          break;
        case LONG_CONST:
          match = intConstMatches(t, Long.compareUnsigned(c.getLong(), 0x100) >= 0);
          break;
        case STR_CONST:
          match = isCharPointer(t);
          break;
        case FLT_CONST:
          match = t.isFloat();
          break;
        default:
          match = false;
          break;
      }
      if (!match) {
        return Terminal.falseExp();
      }
      // Not cloned, so the constant can be coerced after type analysis
      return Binary.get(Oper.EQUALS, typeOf(c), result.clone());
    }

    Type t;
    switch (c.getOper()) {
      case INT_CONST: {
        // Both integer, or both pointer
        TypeVal intVal = TypeVal.get(Types.INT_ANY);
        TypeVal ptrVal = TypeVal.get(Types.pointerToAlpha());
        return Binary.get(Oper.OR,
            Binary.get(Oper.AND, equal(result.clone(), intVal),
                                 equal(typeOf(c), intVal)),
            Binary.get(Oper.AND, equal(result.clone(), ptrVal),
                                 equal(typeOf(c), ptrVal)));
      }
      case LONG_CONST:
        t = Types.intType(64);
        break;
      case STR_CONST:
        t = Types.pointerTo(Types.CHAR);
        break;
      case FLT_CONST:
        // Size unknown, assume double
        t = Types.floatType(64);
        break;
      default:
        return Terminal.trueExp();
    }
    return equal(result.clone(), TypeVal.get(t));
  }

  /**
   * Integer constants match any integer, and floats.  Values of 0x100
   * and up may be pointers.
   */
  private static boolean intConstMatches(Type t, boolean couldBePointer) {
    return t.isInteger() || t.isFloat() || (couldBePointer && t.isPointer());
  }

  private static boolean isCharPointer(Type t) {
    if (!t.isPointer()) {
      return false;
    }
    Type pointsTo = ((PointerType)t).getPointsTo();
    if (pointsTo.isChar()) {
      return true;
    }
    return pointsTo.isArray() && ((ArrayType)pointsTo).getBaseType().isChar();
  }

  private static Exp unaryConstraints(Unary e, Exp result) {
    if (result.isTypeVal()) {
      // TODO: detect conflicts between the location type and result
      return Terminal.trueExp();
    }
    if (isTypedLocation(e.getOper())) {
      return equal(typeOf(e.clone()), result.clone());
    }
    return Terminal.trueExp();
  }

  private static Exp refConstraints(RefExp e, Exp result) {
    if (isTypedLocation(e.getSubExp1().getOper())) {
      return equal(typeOf(e.clone()), result.clone());
    }
    return Terminal.trueExp();
  }

  private static boolean isTypedLocation(Oper op) {
    switch (op) {
      case REG_OF:
      case PARAM:
      case GLOBAL:
      case LOCAL:
        return true;
      default:
        return false;
    }
  }

  private static Exp ternaryConstraints(Ternary e, Exp result) {
    Oper op = e.getOper();
    if (op != Oper.FSIZE && op != Oper.ITOF && op != Oper.FTOI
        && op != Oper.SGN_EX) {
      return Terminal.trueExp();
    }
    int fromSize = sizeArg(e.getSubExp1(), e);
    int toSize = sizeArg(e.getSubExp2(), e);
    Type argHasToBe;
    Type retHasToBe;
    switch (op) {
      case FSIZE:
        argHasToBe = Types.floatType(fromSize);
        retHasToBe = Types.floatType(toSize);
        break;
      case ITOF:
        argHasToBe = Types.intType(fromSize);
        retHasToBe = Types.floatType(toSize);
        break;
      case FTOI:
        argHasToBe = Types.floatType(fromSize);
        retHasToBe = Types.intType(toSize);
        break;
      default:
        argHasToBe = Types.intType(fromSize);
        retHasToBe = Types.intType(toSize);
        break;
    }

    Exp res = null;
    if (result.isTypeVal()) {
      Type t = ((TypeVal)result).getType();
      if (!retHasToBe.sameBroadType(t)) {
        return Terminal.falseExp();
      }
    } else {
      res = equal(result, TypeVal.get(retHasToBe));
    }
    Exp argCon = genConstraints(e.getSubExp3(), TypeVal.get(argHasToBe));
    if (res == null) {
      return argCon;
    }
    return Binary.get(Oper.AND, res, argCon);
  }

  private static int sizeArg(Exp size, Exp parent) {
    if (!size.isIntConst()) {
      throw new DIRCRuntimeError("Expected constant size in " + parent);
    }
    return ((Const)size).getInt();
  }

  private static Exp binaryConstraints(Binary e, Exp result) {
    Type restrictTo = null;
    if (result.isTypeVal()) {
      restrictTo = ((TypeVal)result).getType();
    }
    TypeVal intVal = TypeVal.get(Types.INT_ANY);
    switch (e.getOper()) {
      case FPLUS:
      case FMINUS:
      case FMULT:
      case FDIV: {
        if (restrictTo != null && !restrictTo.isFloat()) {
          return Terminal.falseExp();
        }
        TypeVal fltVal = TypeVal.get(Types.floatType(64));
        Exp res = constrainSubs(e, fltVal, fltVal);
        if (restrictTo == null) {
          res = Binary.get(Oper.AND, res, equal(result.clone(), fltVal));
        }
        return res;
      }
      case BIT_AND:
      case BIT_OR:
      case BIT_XOR: {
        if (restrictTo != null && !restrictTo.isInteger()) {
          return Terminal.falseExp();
        }
        TypeVal wordVal = TypeVal.get(Types.INT32);
        Exp res = constrainSubs(e, wordVal, wordVal);
        if (restrictTo == null) {
          res = Binary.get(Oper.AND, res, equal(result.clone(), wordVal));
        }
        return res;
      }
      case PLUS: {
        TypeVal ptrVal = TypeVal.get(Types.pointerToAlpha());
        Exp res = null;
        if (restrictTo == null || restrictTo.isInteger()) {
          // int + int -> int
          res = alternative(res, e, intVal, intVal, result, intVal);
        }
        if (restrictTo == null || restrictTo.isPointer()) {
          // ptr + int -> ptr, int + ptr -> ptr
          res = alternative(res, e, ptrVal, intVal, result, ptrVal);
          res = alternative(res, e, intVal, ptrVal, result, ptrVal);
        }
        return res == null ? Terminal.falseExp() : ExpSimplifier.simplify(res);
      }
      case MINUS: {
        TypeVal ptrVal = TypeVal.get(Types.pointerToAlpha());
        Exp res = null;
        if (restrictTo == null || restrictTo.isInteger()) {
          // int - int -> int, ptr - ptr -> int
          res = alternative(res, e, intVal, intVal, result, intVal);
          res = alternative(res, e, ptrVal, ptrVal, result, intVal);
        }
        if (restrictTo == null || restrictTo.isPointer()) {
          // ptr - int -> ptr
          res = alternative(res, e, ptrVal, intVal, result, ptrVal);
        }
        return res == null ? Terminal.falseExp() : ExpSimplifier.simplify(res);
      }
      case SIZE: {
        int size = sizeArg(e.getSubExp1(), e);
        if (restrictTo != null) {
          int restrictSize = restrictTo.getSize();
          if (restrictSize == 0) {
            // Same broad type, now with a known size
            return equal(typeOf(e.getSubExp2()),
                         TypeVal.get(restrictTo.withSize(size)));
          }
          return Terminal.bool(restrictSize == size);
        }
        return equal(result.clone(), TypeVal.get(Types.sizeType(size)));
      }
      default:
        return Terminal.trueExp();
    }
  }

  /**
   * Add the alternative "sub1 : t1 and sub2 : t2 [and result = resType]"
   * to an existing disjunction
   */
  private static Exp alternative(Exp prev, Binary e, TypeVal t1, TypeVal t2,
                                 Exp result, TypeVal resType) {
    Exp alt = constrainSubs(e, t1, t2);
    if (!result.isTypeVal()) {
      alt = Binary.get(Oper.AND, alt, equal(result.clone(), resType.clone()));
    }
    if (prev == null) {
      return alt;
    }
    return Binary.get(Oper.OR, prev, alt);
  }

  private static Exp constrainSubs(Binary e, TypeVal t1, TypeVal t2) {
    return Binary.get(Oper.AND, genConstraints(e.getSubExp1(), t1),
                                genConstraints(e.getSubExp2(), t2));
  }

  /**
   * Fold comparisons between known types, then simplify logical
   * connectives.
   * @param e constraint
   * @return simplified constraint
   */
  public static Exp simplifyConstraint(Exp e) {
    if (e instanceof Binary) {
      Binary b = (Binary)e;
      b = b.withSubExps(simplifyConstraint(b.getSubExp1()),
                        simplifyConstraint(b.getSubExp2()));
      switch (b.getOper()) {
        case EQUALS:
          if (b.getSubExp1().isTypeVal() && b.getSubExp2().isTypeVal()) {
            Type t1 = ((TypeVal)b.getSubExp1()).getType();
            Type t2 = ((TypeVal)b.getSubExp2()).getType();
            if (!t1.isPointerToAlpha() && !t2.isPointerToAlpha()) {
              return Terminal.bool(t1.equals(t2));
            }
          }
          return b;
        case AND:
        case OR:
          return ExpSimplifier.simplify(b);
        default:
          return b;
      }
    } else if (e instanceof Unary) {
      Unary u = (Unary)e;
      Exp res = u.withSubExp1(simplifyConstraint(u.getSubExp1()));
      if (res.getOper() == Oper.NOT || res.getOper() == Oper.LNOT) {
        return ExpSimplifier.simplify(res);
      }
      return res;
    }
    return e;
  }

  private static Exp typeOf(Exp e) {
    return Unary.get(Oper.TYPE_OF, e);
  }

  private static Exp equal(Exp a, Exp b) {
    return Binary.get(Oper.EQUALS, a, b);
  }
}
