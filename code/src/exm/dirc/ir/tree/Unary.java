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

import java.util.Collections;
import java.util.List;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators;
import exm.dirc.common.lang.Operators.Oper;

/**
 * An operator applied to one child expression.
 */
public class Unary extends Exp {

  protected final Exp sub1;

  protected Unary(Oper op, Exp sub1) {
    super(op);
    this.sub1 = checkChild(op, sub1);
  }

  /**
   * Build a unary expression.  Location operators produce a
   * {@link Location} with no procedure.
   */
  public static Exp get(Oper op, Exp sub1) {
    if (Operators.isLocation(op)) {
      return Location.get(op, sub1, null);
    }
    switch (op) {
      case SUBSCRIPT:
      case TYPED_EXP:
      case FLAG_DEF:
        throw new DIRCRuntimeError("Use the dedicated factory for " + op);
      default:
        return new Unary(op, sub1);
    }
  }

  public static Exp addrOf(Exp sub1) {
    return get(Oper.ADDR_OF, sub1);
  }

  public static Exp neg(Exp sub1) {
    return get(Oper.NEG, sub1);
  }

  public static Exp not(Exp sub1) {
    return get(Oper.NOT, sub1);
  }

  public static Exp lnot(Exp sub1) {
    return get(Oper.LNOT, sub1);
  }

  /**
   * v[n]: an indexed variable
   */
  public static Exp var(int n) {
    return get(Oper.VAR, Const.get(n));
  }

  @Override
  public int getArity() {
    return 1;
  }

  @Override
  public List<Exp> getChildren() {
    return Collections.singletonList(sub1);
  }

  @Override
  public Exp getSubExp1() {
    return sub1;
  }

  /**
   * @return same operator and any other fields, different child
   */
  public Exp withSubExp1(Exp newSub1) {
    if (newSub1 == sub1) {
      return this;
    }
    return rebuild(newSub1);
  }

  /**
   * @return same kind of node with a new child
   */
  protected Exp rebuild(Exp newSub1) {
    return new Unary(op, newSub1);
  }

  @Override
  public Exp withChildren(List<Exp> children) {
    checkArity(children);
    return withSubExp1(children.get(0));
  }

  @Override
  public Exp clone() {
    return rebuild(sub1.clone());
  }

  @Override
  protected boolean equalsExp(Exp o) {
    if (otherIsMatchingWild(o)) {
      return true;
    }
    if (op != o.op || !(o instanceof Unary)) {
      return false;
    }
    return sub1.equals(((Unary)o).sub1);
  }

  @Override
  public boolean equalsNoSubscript(Exp o) {
    Exp other = stripSubscript(o);
    if (otherIsMatchingWild(other)) {
      return true;
    }
    if (op != other.op || !(other instanceof Unary)) {
      return false;
    }
    return sub1.equalsNoSubscript(((Unary)other).sub1);
  }

  @Override
  public int hashCode() {
    return op.hashCode() * 31 + sub1.hashCode();
  }
}
