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
package exm.dirc.ir.tree;

import java.util.List;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.collect.MapMaker;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.lang.Types;
import exm.dirc.common.lang.Types.Type;

/**
 * A constant: integer, long, float, string or function.
 *
 * The conscript is a tag that distinguishes otherwise equal constants,
 * e.g. two occurrences of the constant 4 in different statements.
 * Zero means no conscript.
 */
public class Const extends Exp {

  /**
   * Order of first use for procedures of function constants.  Breaks
   * ties between distinct procedures with the same name.
   */
  private static final ConcurrentMap<Procedure, Long> funcSeqs =
                    new MapMaker().weakKeys().makeMap();
  private static final AtomicLong nextFuncSeq = new AtomicLong();

  private final long intVal;
  private final double fltVal;
  private final String strVal;
  private final Procedure func;
  private final int conscript;
  private final Type type;

  private Const(Oper op, long intVal, double fltVal, String strVal,
                Procedure func, int conscript, Type type) {
    super(op);
    this.intVal = intVal;
    this.fltVal = fltVal;
    this.strVal = strVal;
    this.func = func;
    this.conscript = conscript;
    this.type = type;
  }

  public static Const get(int val) {
    return new Const(Oper.INT_CONST, val, 0.0, null, null, 0, Types.VOID);
  }

  public static Const getLong(long val) {
    return new Const(Oper.LONG_CONST, val, 0.0, null, null, 0, Types.VOID);
  }

  public static Const getFlt(double val) {
    return new Const(Oper.FLT_CONST, 0, val, null, null, 0, Types.VOID);
  }

  public static Const get(String val) {
    if (val == null) {
      throw new DIRCRuntimeError("Null string constant");
    }
    return new Const(Oper.STR_CONST, 0, 0.0, val, null, 0, Types.VOID);
  }

  public static Const getFunc(Procedure proc) {
    if (proc == null) {
      throw new DIRCRuntimeError("Null function constant");
    }
    funcSeq(proc);
    return new Const(Oper.FUNC_CONST, 0, 0.0, null, proc, 0, Types.VOID);
  }

  public int getInt() {
    assert(op == Oper.INT_CONST) : op;
    return (int)intVal;
  }

  public long getLong() {
    assert(op == Oper.INT_CONST || op == Oper.LONG_CONST) : op;
    return intVal;
  }

  public double getFlt() {
    assert(op == Oper.FLT_CONST) : op;
    return fltVal;
  }

  public String getStr() {
    assert(op == Oper.STR_CONST) : op;
    return strVal;
  }

  public Procedure getFunc() {
    assert(op == Oper.FUNC_CONST) : op;
    return func;
  }

  /**
   * @return the function's name for function constants, otherwise null
   */
  public String getFuncName() {
    return func == null ? null : func.getName();
  }

  public int getConscript() {
    return conscript;
  }

  public Type getType() {
    return type;
  }

  public Const withConscript(int newConscript) {
    return new Const(op, intVal, fltVal, strVal, func, newConscript, type);
  }

  public Const withType(Type newType) {
    assert(newType != null);
    return new Const(op, intVal, fltVal, strVal, func, conscript, newType);
  }

  /**
   * @return integer constant with same conscript and type
   */
  public Const withInt(int newVal) {
    assert(op == Oper.INT_CONST) : op;
    return new Const(op, newVal, fltVal, strVal, func, conscript, type);
  }

  @Override
  public int getArity() {
    return 0;
  }

  @Override
  public Exp withChildren(List<Exp> children) {
    checkArity(children);
    return this;
  }

  @Override
  public Const clone() {
    return new Const(op, intVal, fltVal, strVal, func, conscript, type);
  }

  @Override
  protected boolean equalsExp(Exp o) {
    if (otherIsMatchingWild(o)) {
      return true;
    }
    if (op != o.op) {
      return false;
    }
    Const other = (Const)o;
    if (conscript != other.conscript) {
      return false;
    }
    return compareValue(other) == 0;
  }

  @Override
  public boolean equalsNoSubscript(Exp o) {
    return equalsExp(stripSubscript(o));
  }

  private int compareValue(Const other) {
    switch (op) {
      case INT_CONST:
      case LONG_CONST:
        return Long.compare(intVal, other.intVal);
      case FLT_CONST:
        return Double.compare(fltVal, other.fltVal);
      case STR_CONST:
        return strVal.compareTo(other.strVal);
      case FUNC_CONST:
        if (func == other.func) {
          return 0;
        }
        int nameComp = String.valueOf(func.getName()).compareTo(
                       String.valueOf(other.func.getName()));
        if (nameComp != 0) {
          return nameComp;
        }
        return Long.compare(funcSeq(func), funcSeq(other.func));
      default:
        throw new DIRCRuntimeError("Unexpected constant operator " + op);
    }
  }

  private static long funcSeq(Procedure proc) {
    Long seq = funcSeqs.get(proc);
    if (seq == null) {
      Long fresh = nextFuncSeq.incrementAndGet();
      seq = funcSeqs.putIfAbsent(proc, fresh);
      if (seq == null) {
        seq = fresh;
      }
    }
    return seq;
  }

  @Override
  public int compareTo(Exp o) {
    int comp = compareHeader(o);
    if (comp != 0) {
      return comp;
    }
    Const other = (Const)o;
    comp = Integer.compare(conscript, other.conscript);
    if (comp != 0) {
      return comp;
    }
    return compareValue(other);
  }

  @Override
  public int hashCode() {
    int hash = op.hashCode() * 31 + conscript;
    switch (op) {
      case INT_CONST:
      case LONG_CONST:
        return hash ^ Long.valueOf(intVal).hashCode();
      case FLT_CONST:
        return hash ^ Double.valueOf(fltVal).hashCode();
      case STR_CONST:
        return hash ^ strVal.hashCode();
      default:
        return hash ^ System.identityHashCode(func);
    }
  }
}
