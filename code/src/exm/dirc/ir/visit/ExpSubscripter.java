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
package exm.dirc.ir.visit;

import java.util.ArrayDeque;
import java.util.Deque;

import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.RefExp;
import exm.dirc.ir.tree.RefExp.Def;
import exm.dirc.ir.tree.Statement;
import exm.dirc.ir.tree.Terminal;

/**
 * Subscript each occurrence of a location with a definition.
 * Expressions that are already subscripted are not changed, and only
 * memory references are subscripted both inside and outside.
 */
public class ExpSubscripter extends ExpModifier {
  private final Exp search;
  private final Def def;

  /** Whether each location or array index being visited matched */
  private final Deque<Boolean> matched = new ArrayDeque<Boolean>();

  public ExpSubscripter(Exp search, Def def) {
    this.search = search;
    this.def = def;
  }

  /**
   * Subscript occurrences of search in e with {def}
   * @param def defining statement, or null for an implicit definition
   */
  public static Exp expSubscriptVar(Exp e, Exp search, Statement def) {
    return ExpWalk.accept(e, new ExpSubscripter(search, Def.of(def)));
  }

  /**
   * Subscript occurrences of search in e with {-}
   */
  public static Exp expSubscriptValNull(Exp e, Exp search) {
    return expSubscriptVar(e, search, null);
  }

  /**
   * Subscript all locations in e with {-}
   */
  public static Exp expSubscriptAllNull(Exp e) {
    return expSubscriptVar(e, Terminal.wild(), null);
  }

  @Override
  public Exp preVisit(Location e, VisitFlag recur) {
    boolean match = e.equals(search);
    matched.push(match);
    // Only m[..] is subscripted inside as well
    recur.set(!match || e.isMemOf());
    return e;
  }

  @Override
  public Exp postVisit(Location e) {
    if (matched.pop()) {
      return RefExp.get(e, def);
    }
    return e;
  }

  @Override
  public Exp preVisit(Binary e, VisitFlag recur) {
    // array[index] is like m[addr]: it needs a subscript
    matched.push(e.getOper() == Oper.ARRAY_INDEX && e.equals(search));
    recur.set();
    return e;
  }

  @Override
  public Exp postVisit(Binary e) {
    if (matched.pop()) {
      return RefExp.get(e, def);
    }
    return e;
  }

  @Override
  public Exp preVisit(Terminal e) {
    if (e.equals(search)) {
      return RefExp.get(e, def);
    }
    return e;
  }

  @Override
  public Exp preVisit(RefExp e, VisitFlag recur) {
    // Already subscripted: leave it alone
    recur.clear();
    return e;
  }
}
