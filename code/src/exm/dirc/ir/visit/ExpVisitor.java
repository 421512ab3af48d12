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
import exm.dirc.ir.tree.FlagDef;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.RefExp;
import exm.dirc.ir.tree.Terminal;
import exm.dirc.ir.tree.Ternary;
import exm.dirc.ir.tree.TypeVal;
import exm.dirc.ir.tree.TypedExp;
import exm.dirc.ir.tree.Unary;

/**
 * Read-only visitor over expression trees, driven by
 * {@link ExpWalk#accept(exm.dirc.ir.tree.Exp, ExpVisitor)}.
 *
 * Each visit method returns false to stop the whole traversal.  Visit
 * methods for nodes with children may set the flag to take over the
 * traversal of that node: the walker then does not visit the children
 * and uses the returned value as is.
 */
public abstract class ExpVisitor {

  public boolean visit(Const e) {
    return true;
  }

  public boolean visit(Terminal e) {
    return true;
  }

  public boolean visit(TypeVal e) {
    return true;
  }

  public boolean visit(Unary e, VisitFlag override) {
    return true;
  }

  public boolean visit(Binary e, VisitFlag override) {
    return true;
  }

  public boolean visit(Ternary e, VisitFlag override) {
    return true;
  }

  public boolean visit(TypedExp e, VisitFlag override) {
    return true;
  }

  public boolean visit(FlagDef e, VisitFlag override) {
    return true;
  }

  public boolean visit(RefExp e, VisitFlag override) {
    return true;
  }

  public boolean visit(Location e, VisitFlag override) {
    return true;
  }
}
