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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators;
import exm.dirc.common.lang.Operators.Oper;

/**
 * A leaf with no data other than its operator: special registers,
 * flags, wildcards, nil and the boolean constants.
 */
public class Terminal extends Exp {

  /** Terminals carry no state, so share one instance per operator */
  private static final Map<Oper, Terminal> instances =
                          new EnumMap<Oper, Terminal>(Oper.class);
  static {
    for (Oper op: Oper.values()) {
      if (Operators.terminalSpelling(op) != null) {
        instances.put(op, new Terminal(op));
      }
    }
  }

  private Terminal(Oper op) {
    super(op);
  }

  public static Terminal get(Oper op) {
    Terminal t = instances.get(op);
    if (t == null) {
      throw new DIRCRuntimeError("Not a terminal operator: " + op);
    }
    return t;
  }

  public static Terminal wild() {
    return get(Oper.WILD);
  }

  public static Terminal nil() {
    return get(Oper.NIL);
  }

  public static Terminal trueExp() {
    return get(Oper.TRUE);
  }

  public static Terminal falseExp() {
    return get(Oper.FALSE);
  }

  public static Terminal bool(boolean val) {
    return val ? trueExp() : falseExp();
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

  /**
   * Terminals are immutable and stateless: the copy is a fresh instance
   * that is never handed out by {@link #get(Oper)}
   */
  @Override
  public Terminal clone() {
    return new Terminal(op);
  }

  @Override
  protected boolean equalsExp(Exp o) {
    if (op == o.op || o.op == Oper.WILD) {
      return true;
    }
    switch (op) {
      case WILD:
        return true;
      case WILD_INT_CONST:
        return o.op == Oper.INT_CONST;
      case WILD_STR_CONST:
        return o.op == Oper.STR_CONST;
      case WILD_REG_OF:
        return o.op == Oper.REG_OF;
      case WILD_MEM_OF:
        return o.op == Oper.MEM_OF;
      case WILD_ADDR_OF:
        return o.op == Oper.ADDR_OF;
      default:
        return false;
    }
  }

  @Override
  public boolean equalsNoSubscript(Exp o) {
    return equalsExp(stripSubscript(o));
  }

  @Override
  public int hashCode() {
    return op.hashCode();
  }
}
