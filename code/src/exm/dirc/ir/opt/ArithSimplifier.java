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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Ternary;
import exm.dirc.ir.tree.Unary;

/**
 * Simplification of sums and differences, e.g.
 * (r28 + 108) - (r28 + 92) to 16.
 */
public class ArithSimplifier {

  /**
   * Terms of a sum, split by sign
   */
  public static class Terms {
    public final List<Exp> positives = new ArrayList<Exp>();
    public final List<Exp> negatives = new ArrayList<Exp>();
    public final List<Integer> integers = new ArrayList<Integer>();
  }

  public static Exp simplifyArith(Exp e) {
    if (e instanceof Unary) {
      Oper op = e.getOper();
      if (op == Oper.MEM_OF || op == Oper.REG_OF || op == Oper.ADDR_OF
          || op == Oper.SUBSCRIPT) {
        Unary u = (Unary)e;
        return u.withSubExp1(simplifyArith(u.getSubExp1()));
      }
      return e;
    } else if (e instanceof Ternary) {
      Ternary t = (Ternary)e;
      return t.withSubExps(simplifyArith(t.getSubExp1()),
          simplifyArith(t.getSubExp2()), simplifyArith(t.getSubExp3()));
    } else if (e instanceof Binary) {
      return simplifyArithBinary((Binary)e);
    }
    return e;
  }

  private static Exp simplifyArithBinary(Binary e) {
    Binary b = e.withSubExps(simplifyArith(e.getSubExp1()),
                             simplifyArith(e.getSubExp2()));
    if (b.getOper() != Oper.PLUS && b.getOper() != Oper.MINUS) {
      return b;
    }

    Terms terms = new Terms();
    partitionTerms(b, terms, false);
    cancelTerms(terms.positives, terms.negatives);

    int sum = 0;
    for (Integer k: terms.integers) {
      sum += k;
    }

    List<Exp> pos = terms.positives;
    List<Exp> neg = terms.negatives;
    if (pos.isEmpty()) {
      if (neg.isEmpty()) {
        return Const.get(sum);
      }
      return Binary.minus(Const.get(sum), accumulate(neg));
    }

    Exp result;
    if (neg.isEmpty()) {
      result = accumulate(pos);
    } else {
      result = Binary.minus(accumulate(pos), accumulate(neg));
    }
    if (sum == 0) {
      return result;
    } else if (sum < 0) {
      return Binary.minus(result, Const.get(-sum));
    } else {
      return Binary.plus(result, Const.get(sum));
    }
  }

  /**
   * Split a tree of + and - into terms.  Typed expressions are looked
   * through.
   * @param e
   * @param terms accumulates the terms
   * @param negate true if e is on the right of an odd number of minuses
   */
  public static void partitionTerms(Exp e, Terms terms, boolean negate) {
    switch (e.getOper()) {
      case PLUS:
        partitionTerms(e.getSubExp1(), terms, negate);
        partitionTerms(e.getSubExp2(), terms, negate);
        break;
      case MINUS:
        partitionTerms(e.getSubExp1(), terms, negate);
        partitionTerms(e.getSubExp2(), terms, !negate);
        break;
      case TYPED_EXP:
        partitionTerms(e.getSubExp1(), terms, negate);
        break;
      case INT_CONST: {
        int k = ((Const)e).getInt();
        terms.integers.add(negate ? -k : k);
        break;
      }
      default:
        if (negate) {
          terms.negatives.add(e);
        } else {
          terms.positives.add(e);
        }
    }
  }

  /**
   * Remove pairs of equal terms with opposite signs
   */
  private static void cancelTerms(List<Exp> positives, List<Exp> negatives) {
    Iterator<Exp> pit = positives.iterator();
    while (pit.hasNext()) {
      Exp p = pit.next();
      Iterator<Exp> nit = negatives.iterator();
      while (nit.hasNext()) {
        if (p.equals(nit.next())) {
          nit.remove();
          pit.remove();
          break;
        }
      }
    }
  }

  /**
   * Sum of a list of expressions.  Elements are cloned.
   * @param exps
   * @return 0 for an empty list, otherwise a right-nested chain of +
   */
  public static Exp accumulate(List<Exp> exps) {
    if (exps.isEmpty()) {
      return Const.get(0);
    }
    int last = exps.size() - 1;
    Exp result = exps.get(last).clone();
    for (int i = last - 1; i >= 0; i--) {
      result = Binary.plus(exps.get(i).clone(), result);
    }
    return result;
  }
}
