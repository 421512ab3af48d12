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

import org.apache.log4j.Logger;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators;
import exm.dirc.common.lang.Operators.Oper;

/**
 * An expression in the decompiler's intermediate representation.
 *
 * Expressions are immutable, so subtrees can be shared freely between
 * parent expressions.  Every rewrite returns a new node.
 *
 * Equality is structural and honours wildcard operators: see the notes
 * on {@link #equals(Object)}.  The natural order is a total order over
 * expressions which agrees with equality for expressions without
 * wildcards.
 */
public abstract class Exp implements Comparable<Exp> {

  protected final Oper op;

  protected Exp(Oper op) {
    assert(op != null);
    this.op = op;
  }

  public Oper getOper() {
    return op;
  }

  /**
   * @return number of child expressions
   */
  public abstract int getArity();

  /**
   * @return list of children, in order.  Empty for leaves
   */
  public List<Exp> getChildren() {
    return Collections.emptyList();
  }

  /**
   * @return first child, or null if there is none
   */
  public Exp getSubExp1() {
    return null;
  }

  /**
   * @return second child, or null if there is none
   */
  public Exp getSubExp2() {
    return null;
  }

  /**
   * @return third child, or null if there is none
   */
  public Exp getSubExp3() {
    return null;
  }

  /**
   * Create a node of the same kind with different children.  Any
   * other fields (type, definition, procedure) are kept.
   * @param children must have exactly {@link #getArity()} elements
   * @return new node, or this if the children are the same instances
   */
  public abstract Exp withChildren(List<Exp> children);

  /**
   * @return a deep copy that is equal to, but not the same instance as,
   *         this expression
   */
  @Override
  public abstract Exp clone();

  /**
   * Structural equality.
   *
   * Wildcards: WILD on either side matches anything.  A constant,
   * register, memory or address-of node matches a wildcard of the
   * corresponding shape passed as the argument, and a wildcard terminal
   * matches any node of the corresponding shape passed as the argument.
   * Pattern searches always call {@code pattern.equals(candidate)}.
   */
  @Override
  public final boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Exp)) {
      return false;
    }
    return equalsExp((Exp)obj);
  }

  protected abstract boolean equalsExp(Exp o);

  /**
   * Hash code consistent with equals for expressions that contain no
   * wildcards.  Do not use patterns as hash keys.
   */
  @Override
  public abstract int hashCode();

  /**
   * Equality that ignores subscripts on the other expression, so that
   * x equals x{anything}.
   */
  public abstract boolean equalsNoSubscript(Exp o);

  /**
   * Check whether other is WILD, or a wildcard matching this node's shape
   */
  protected boolean otherIsMatchingWild(Exp other) {
    switch (other.op) {
      case WILD:
        return true;
      case WILD_INT_CONST:
        return op == Oper.INT_CONST;
      case WILD_STR_CONST:
        return op == Oper.STR_CONST;
      case WILD_REG_OF:
        return op == Oper.REG_OF;
      case WILD_MEM_OF:
        return op == Oper.MEM_OF;
      case WILD_ADDR_OF:
        return op == Oper.ADDR_OF;
      default:
        return false;
    }
  }

  protected static Exp stripSubscript(Exp e) {
    if (e.op == Oper.SUBSCRIPT) {
      return e.getSubExp1();
    }
    return e;
  }

  /**
   * Compare operator tags, then arity
   */
  protected int compareHeader(Exp o) {
    int opComp = op.compareTo(o.op);
    if (opComp != 0) {
      return opComp;
    }
    return Integer.compare(getArity(), o.getArity());
  }

  protected static int compareChildren(Exp a, Exp b) {
    int n = a.getArity();
    assert(n == b.getArity());
    for (int i = 0; i < n; i++) {
      int comp = a.getChildren().get(i).compareTo(b.getChildren().get(i));
      if (comp != 0) {
        return comp;
      }
    }
    return 0;
  }

  @Override
  public int compareTo(Exp o) {
    int comp = compareHeader(o);
    if (comp != 0) {
      return comp;
    }
    return compareChildren(this, o);
  }

  /**
   * Canonical infix form
   */
  @Override
  public String toString() {
    return ExpPrinter.print(this);
  }

  public void print(StringBuilder sb) {
    ExpPrinter.print(sb, this);
  }

  public String printAsHL() {
    return ExpPrinter.printAsHL(this);
  }

  public String printt() {
    return ExpPrinter.printt(this);
  }

  /**
   * Log the operator tree at debug level, one node per line
   */
  public void printx(Logger logger) {
    if (logger.isDebugEnabled()) {
      logger.debug("\n" + ExpPrinter.printTree(this));
    }
  }

  public String getOperName() {
    return Operators.operName(op);
  }

  protected static Exp checkChild(Oper op, Exp child) {
    if (child == null) {
      throw new DIRCRuntimeError("Null child for operator " + op);
    }
    return child;
  }

  protected void checkArity(List<Exp> children) {
    if (children.size() != getArity()) {
      throw new DIRCRuntimeError("Expected " + getArity() + " children for "
                  + op + " but got " + children.size());
    }
  }

  /* Predicates.  All are pure. */

  public boolean isIntConst() {
    return op == Oper.INT_CONST;
  }

  public boolean isLongConst() {
    return op == Oper.LONG_CONST;
  }

  public boolean isFltConst() {
    return op == Oper.FLT_CONST;
  }

  public boolean isStrConst() {
    return op == Oper.STR_CONST;
  }

  public boolean isFuncConst() {
    return op == Oper.FUNC_CONST;
  }

  public boolean isConst() {
    return Operators.isConst(op);
  }

  public boolean isTerminal() {
    return getArity() == 0;
  }

  public boolean isTrue() {
    return op == Oper.TRUE;
  }

  public boolean isFalse() {
    return op == Oper.FALSE;
  }

  public boolean isBoolConst() {
    return op == Oper.TRUE || op == Oper.FALSE;
  }

  public boolean isNil() {
    return op == Oper.NIL;
  }

  public boolean isWild() {
    return op == Oper.WILD;
  }

  public boolean isRegOf() {
    return op == Oper.REG_OF;
  }

  public boolean isMemOf() {
    return op == Oper.MEM_OF;
  }

  public boolean isAddrOf() {
    return op == Oper.ADDR_OF;
  }

  public boolean isSubscript() {
    return op == Oper.SUBSCRIPT;
  }

  public boolean isTypedExp() {
    return op == Oper.TYPED_EXP;
  }

  public boolean isTypeVal() {
    return op == Oper.TYPE_VAL;
  }

  public boolean isLocation() {
    return Operators.isLocation(op);
  }

  public boolean isGlobal() {
    return op == Oper.GLOBAL;
  }

  public boolean isLocal() {
    return op == Oper.LOCAL;
  }

  public boolean isParam() {
    return op == Oper.PARAM;
  }

  public boolean isComparison() {
    return Operators.isComparison(op);
  }

  public boolean isFlagCall() {
    return op == Oper.FLAG_CALL;
  }

  /**
   * True for a temporary, or a register named by a temporary
   */
  public boolean isTemp() {
    if (op == Oper.TEMP) {
      return true;
    }
    return op == Oper.REG_OF && getSubExp1().op == Oper.TEMP;
  }

  /**
   * True for r[K] where K is an integer constant
   */
  public boolean isRegOfK() {
    return op == Oper.REG_OF && getSubExp1().op == Oper.INT_CONST;
  }

  /**
   * True for r[n]
   */
  public boolean isRegN(int n) {
    if (op != Oper.REG_OF) {
      return false;
    }
    Exp sub = getSubExp1();
    return sub.op == Oper.INT_CONST && ((Const)sub).getInt() == n;
  }

  /**
   * True for m[K] where K is an integer constant
   */
  public boolean isMemOfConst() {
    return op == Oper.MEM_OF && getSubExp1().op == Oper.INT_CONST;
  }

  /**
   * True for %afp, %afp + K, %afp - K, or a[m[...]] of one of those,
   * optionally inside a typed expression
   */
  public boolean isAfpTerm() {
    Exp cur = this;
    if (cur.op == Oper.TYPED_EXP) {
      cur = cur.getSubExp1();
    }
    if (cur.op == Oper.ADDR_OF && cur.getSubExp1().op == Oper.MEM_OF) {
      cur = cur.getSubExp1().getSubExp1();
    }
    if (cur.op == Oper.AFP) {
      return true;
    }
    if (cur.op != Oper.PLUS && cur.op != Oper.MINUS) {
      return false;
    }
    return cur.getSubExp1().op == Oper.AFP &&
           cur.getSubExp2().op == Oper.INT_CONST;
  }

  /**
   * @return index of v[K]
   */
  public int getVarIndex() {
    if (op != Oper.VAR || !getSubExp1().isIntConst()) {
      throw new DIRCRuntimeError("Not an indexed variable: " + this);
    }
    return ((Const)getSubExp1()).getInt();
  }

  /**
   * @return guard expression, or null if this is not a guard
   */
  public Exp getGuard() {
    if (op == Oper.GUARD) {
      return getSubExp1();
    }
    return null;
  }

  /**
   * Find a string constant in "s", a["s"], a[m["s"]] or a["s"{d}]
   * @return the string, or null if there is none
   */
  public String getAnyStrConst() {
    Exp e = this;
    if (op == Oper.ADDR_OF) {
      e = getSubExp1();
      if (e.op == Oper.SUBSCRIPT) {
        e = e.getSubExp1();
      }
      if (e.op == Oper.MEM_OF) {
        e = e.getSubExp1();
      }
    }
    if (e.op != Oper.STR_CONST) {
      return null;
    }
    return ((Const)e).getStr();
  }
}
