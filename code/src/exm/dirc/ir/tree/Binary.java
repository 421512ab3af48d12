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

import java.util.Arrays;
import java.util.List;

import exm.dirc.common.lang.Operators.Oper;

/**
 * A binary operator, including the structural operators LIST, SIZE,
 * FLAG_CALL, MEMBER_ACCESS and ARRAY_INDEX.
 */
public class Binary extends Exp {

  private final Exp sub1;
  private final Exp sub2;

  private Binary(Oper op, Exp sub1, Exp sub2) {
    super(op);
    this.sub1 = checkChild(op, sub1);
    this.sub2 = checkChild(op, sub2);
  }

  public static Binary get(Oper op, Exp sub1, Exp sub2) {
    return new Binary(op, sub1, sub2);
  }

  public static Binary plus(Exp sub1, Exp sub2) {
    return get(Oper.PLUS, sub1, sub2);
  }

  public static Binary minus(Exp sub1, Exp sub2) {
    return get(Oper.MINUS, sub1, sub2);
  }

  public static Binary mult(Exp sub1, Exp sub2) {
    return get(Oper.MULT, sub1, sub2);
  }

  /**
   * Build a right-nested LIST terminated by nil
   */
  public static Exp list(List<Exp> items) {
    Exp result = Terminal.nil();
    for (int i = items.size() - 1; i >= 0; i--) {
      result = get(Oper.LIST, items.get(i), result);
    }
    return result;
  }

  /**
   * size(n, e): e known to be n bits wide
   */
  public static Binary size(int bits, Exp sub) {
    return get(Oper.SIZE, Const.get(bits), sub);
  }

  @Override
  public int getArity() {
    return 2;
  }

  @Override
  public List<Exp> getChildren() {
    return Arrays.asList(sub1, sub2);
  }

  @Override
  public Exp getSubExp1() {
    return sub1;
  }

  @Override
  public Exp getSubExp2() {
    return sub2;
  }

  public Binary withSubExps(Exp newSub1, Exp newSub2) {
    if (newSub1 == sub1 && newSub2 == sub2) {
      return this;
    }
    return new Binary(op, newSub1, newSub2);
  }

  public Binary withOper(Oper newOp) {
    if (newOp == op) {
      return this;
    }
    return new Binary(newOp, sub1, sub2);
  }

  /**
   * @return same operator with children swapped
   */
  public Binary commute() {
    return new Binary(op, sub2, sub1);
  }

  @Override
  public Exp withChildren(List<Exp> children) {
    checkArity(children);
    return withSubExps(children.get(0), children.get(1));
  }

  @Override
  public Binary clone() {
    return new Binary(op, sub1.clone(), sub2.clone());
  }

  @Override
  protected boolean equalsExp(Exp o) {
    if (o.op == Oper.WILD) {
      return true;
    }
    if (op != o.op || !(o instanceof Binary)) {
      return false;
    }
    Binary other = (Binary)o;
    return sub1.equals(other.sub1) && sub2.equals(other.sub2);
  }

  @Override
  public boolean equalsNoSubscript(Exp o) {
    Exp other = stripSubscript(o);
    if (other.op == Oper.WILD) {
      return true;
    }
    if (op != other.op || !(other instanceof Binary)) {
      return false;
    }
    Binary b = (Binary)other;
    return sub1.equalsNoSubscript(b.sub1) && sub2.equalsNoSubscript(b.sub2);
  }

  @Override
  public int hashCode() {
    return (op.hashCode() * 31 + sub1.hashCode()) * 31 + sub2.hashCode();
  }
}
