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

import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.FlagDef;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.RefExp;
import exm.dirc.ir.tree.Terminal;
import exm.dirc.ir.tree.Ternary;
import exm.dirc.ir.tree.TypeVal;
import exm.dirc.ir.tree.TypedExp;
import exm.dirc.ir.tree.Unary;

/**
 * Rewriting visitor, driven by
 * {@link ExpWalk#accept(Exp, ExpModifier)}.
 *
 * For each node, the pre-visit hook may return a replacement and says
 * whether to recurse; the children of the returned node are then
 * rewritten, and the post-visit hook gets the rebuilt node.  Nodes
 * are only rebuilt when a child actually changed.
 *
 * The pre-visit hook must return a node of the same kind, except that
 * locations and terminals may be replaced by subscripted expressions,
 * and binaries by unaries.  Post-visit hooks may return anything.
 */
public abstract class ExpModifier {

  public Exp preVisit(Const e) {
    return e;
  }

  public Exp preVisit(Terminal e) {
    return e;
  }

  public Exp preVisit(TypeVal e) {
    return e;
  }

  public Exp preVisit(Unary e, VisitFlag recur) {
    recur.set();
    return e;
  }

  public Exp preVisit(Binary e, VisitFlag recur) {
    recur.set();
    return e;
  }

  public Exp preVisit(Ternary e, VisitFlag recur) {
    recur.set();
    return e;
  }

  public Exp preVisit(TypedExp e, VisitFlag recur) {
    recur.set();
    return e;
  }

  public Exp preVisit(FlagDef e, VisitFlag recur) {
    recur.set();
    return e;
  }

  public Exp preVisit(RefExp e, VisitFlag recur) {
    recur.set();
    return e;
  }

  public Exp preVisit(Location e, VisitFlag recur) {
    recur.set();
    return e;
  }

  public Exp postVisit(Const e) {
    return e;
  }

  public Exp postVisit(Terminal e) {
    return e;
  }

  public Exp postVisit(TypeVal e) {
    return e;
  }

  public Exp postVisit(Unary e) {
    return e;
  }

  public Exp postVisit(Binary e) {
    return e;
  }

  public Exp postVisit(Ternary e) {
    return e;
  }

  public Exp postVisit(TypedExp e) {
    return e;
  }

  public Exp postVisit(FlagDef e) {
    return e;
  }

  public Exp postVisit(RefExp e) {
    return e;
  }

  public Exp postVisit(Location e) {
    return e;
  }
}
