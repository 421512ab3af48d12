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
import java.util.List;

import org.apache.log4j.Logger;

import exm.dirc.common.Logging;
import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.util.Pair;
import exm.dirc.ir.match.ExpSearch;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.RefExp;
import exm.dirc.ir.tree.RefExp.Def;
import exm.dirc.ir.tree.Ternary;
import exm.dirc.ir.tree.Terminal;
import exm.dirc.ir.tree.Unary;
import exm.dirc.ir.visit.SizeStripper;
import exm.dirc.ir.visit.UsedLocsFinder;

/**
 * Whole-tree rewrites built on search and replace.
 */
public class ExpTransforms {

  private static final Logger logger = Logging.getDircLogger();

  /**
   * Replace the first succ(r[K]) with r[K+1]
   * @param e
   * @return rewritten expression, or e if there is no successor
   */
  public static Exp fixSuccessor(Exp e) {
    Exp pattern = Unary.get(Oper.SUCCESSOR, Location.regOf(Terminal.wild()));
    Exp succ = ExpSearch.search(pattern, e);
    if (succ == null) {
      return e;
    }
    Exp regNum = succ.getSubExp1().getSubExp1();
    if (!regNum.isIntConst()) {
      throw new DIRCRuntimeError("Successor of non-constant register: "
                                 + succ);
    }
    Exp next = Location.regOf(((Const)regNum).getInt() + 1);
    if (logger.isTraceEnabled()) {
      logger.trace("fixSuccessor: " + succ + " => " + next);
    }
    return ExpSearch.searchReplace(succ, next, e).val1;
  }

  /**
   * Replace every zfill(..) and sgnex(..) with its operand
   */
  public static Exp killFill(Exp e) {
    Exp result = e;
    for (Oper op: new Oper[] {Oper.ZFILL, Oper.SGN_EX}) {
      Exp pattern = Ternary.get(op, Terminal.wild(), Terminal.wild(),
                                Terminal.wild());
      List<Exp> matches = new ArrayList<Exp>();
      ExpSearch.searchAll(pattern, result, matches);
      for (Exp match: matches) {
        result = ExpSearch.searchReplaceAll(match, match.getSubExp3(),
                                            result, false).val1;
      }
    }
    return result;
  }

  /**
   * Strip all subscripts from an expression.
   * @param e
   * @return (expression without subscripts, true if every removed
   *          definition was implicit or statement number 0)
   */
  public static Pair<Exp, Boolean> removeSubscripts(Exp e) {
    Exp result = e;
    boolean allZero = true;
    boolean found = true;
    // Removing an outer subscript can change the text of an inner one,
    // so repeat until a pass changes nothing
    while (found) {
      found = false;
      for (Exp loc: UsedLocsFinder.findUsedLocs(result, false)) {
        if (!(loc instanceof RefExp)) {
          continue;
        }
        RefExp ref = (RefExp)loc;
        if (!isZeroDef(ref.getDef())) {
          allZero = false;
        }
        Pair<Exp, Boolean> replaced = ExpSearch.searchReplaceAll(ref,
                            ref.getSubExp1().clone(), result, false);
        result = replaced.val1;
        found = found || replaced.val2;
      }
    }
    return Pair.create(result, allZero);
  }

  private static boolean isZeroDef(Def def) {
    switch (def.getKind()) {
      case IMPLICIT:
        return true;
      case DEFINED:
        return def.getStatement().getNumber() == 0;
      default:
        return false;
    }
  }

  /**
   * Replace size(n, x) with x everywhere
   */
  public static Exp stripSizes(Exp e) {
    return SizeStripper.stripSizes(e);
  }
}
