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
 * A ternary operator: conditional, bit extraction, or one of the
 * function-like conversions (truncu, sgnex, fsize, itof, ...).
 * For the conversions the first two children are the source and
 * destination sizes.
 */
public class Ternary extends Exp {

  private final Exp sub1;
  private final Exp sub2;
  private final Exp sub3;

  private Ternary(Oper op, Exp sub1, Exp sub2, Exp sub3) {
    super(op);
    this.sub1 = checkChild(op, sub1);
    this.sub2 = checkChild(op, sub2);
    this.sub3 = checkChild(op, sub3);
  }

  public static Ternary get(Oper op, Exp sub1, Exp sub2, Exp sub3) {
    return new Ternary(op, sub1, sub2, sub3);
  }

  /**
   * cond ? a : b
   */
  public static Ternary tern(Exp cond, Exp a, Exp b) {
    return get(Oper.TERN, cond, a, b);
  }

  @Override
  public int getArity() {
    return 3;
  }

  @Override
  public List<Exp> getChildren() {
    return Arrays.asList(sub1, sub2, sub3);
  }

  @Override
  public Exp getSubExp1() {
    return sub1;
  }

  @Override
  public Exp getSubExp2() {
    return sub2;
  }

  @Override
  public Exp getSubExp3() {
    return sub3;
  }

  public Ternary withSubExps(Exp newSub1, Exp newSub2, Exp newSub3) {
    if (newSub1 == sub1 && newSub2 == sub2 && newSub3 == sub3) {
      return this;
    }
    return new Ternary(op, newSub1, newSub2, newSub3);
  }

  @Override
  public Exp withChildren(List<Exp> children) {
    checkArity(children);
    return withSubExps(children.get(0), children.get(1), children.get(2));
  }

  @Override
  public Ternary clone() {
    return new Ternary(op, sub1.clone(), sub2.clone(), sub3.clone());
  }

  @Override
  protected boolean equalsExp(Exp o) {
    if (o.op == Oper.WILD) {
      return true;
    }
    if (op != o.op || !(o instanceof Ternary)) {
      return false;
    }
    Ternary other = (Ternary)o;
    return sub1.equals(other.sub1) && sub2.equals(other.sub2) &&
           sub3.equals(other.sub3);
  }

  @Override
  public boolean equalsNoSubscript(Exp o) {
    Exp other = stripSubscript(o);
    if (other.op == Oper.WILD) {
      return true;
    }
    if (op != other.op || !(other instanceof Ternary)) {
      return false;
    }
    Ternary t = (Ternary)other;
    return sub1.equalsNoSubscript(t.sub1) &&
           sub2.equalsNoSubscript(t.sub2) &&
           sub3.equalsNoSubscript(t.sub3);
  }

  @Override
  public int hashCode() {
    int hash = op.hashCode() * 31 + sub1.hashCode();
    hash = hash * 31 + sub2.hashCode();
    return hash * 31 + sub3.hashCode();
  }
}
