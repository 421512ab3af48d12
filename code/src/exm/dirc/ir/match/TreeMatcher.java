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
package exm.dirc.ir.match;

import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Terminal;
import exm.dirc.ir.tree.Unary;

/**
 * Structural matching against patterns containing variables v[n].
 *
 * The result is a list of bindings built from LIST and EQUALS nodes,
 * e.g. v[1] = r28, v[2] = 4 with a nil tail; nil alone for a match
 * without bindings; or null if there is no match.
 */
public class TreeMatcher {

  public static Exp match(Exp e, Exp pattern) {
    if (e instanceof Binary) {
      return matchBinary((Binary)e, pattern);
    } else if (e instanceof Unary) {
      if (e.getOper() == pattern.getOper() && pattern.getArity() == 1) {
        return match(e.getSubExp1(), pattern.getSubExp1());
      }
    }
    return matchLeaf(e, pattern);
  }

  private static Exp matchLeaf(Exp e, Exp pattern) {
    if (e.equals(pattern)) {
      return Terminal.nil();
    }
    if (pattern.getOper() == Oper.VAR) {
      return binding(pattern.clone(), e.clone(), Terminal.nil());
    }
    return null;
  }

  private static Exp binding(Exp var, Exp value, Exp tail) {
    return Binary.get(Oper.LIST, Binary.get(Oper.EQUALS, var, value), tail);
  }

  private static Exp matchBinary(Binary e, Exp pattern) {
    if (e.getOper() != pattern.getOper() || pattern.getArity() != 2) {
      return matchLeaf(e, pattern);
    }
    Exp lhs = match(e.getSubExp1(), pattern.getSubExp1());
    if (lhs == null) {
      return null;
    }
    Exp rhs = match(e.getSubExp2(), pattern.getSubExp2());
    if (rhs == null) {
      return null;
    }
    if (lhs.isNil()) {
      return rhs;
    }
    if (rhs.isNil()) {
      return lhs;
    }

    // Merge, checking that both sides agree on shared variables
    Exp result = Terminal.nil();
    for (Exp l = lhs; !l.isNil(); l = l.getSubExp2()) {
      Exp lBinding = l.getSubExp1();
      for (Exp r = rhs; !r.isNil(); r = r.getSubExp2()) {
        Exp rBinding = r.getSubExp1();
        if (lBinding.getSubExp1().equals(rBinding.getSubExp1()) &&
            !lBinding.getSubExp2().equals(rBinding.getSubExp2())) {
          return null;
        }
      }
      result = Binary.get(Oper.LIST, lBinding.clone(), result);
    }
    for (Exp r = rhs; !r.isNil(); r = r.getSubExp2()) {
      result = Binary.get(Oper.LIST, r.getSubExp1().clone(), result);
    }
    return result;
  }
}
