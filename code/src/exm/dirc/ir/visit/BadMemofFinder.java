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

import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.RefExp;

/**
 * Look for a memory reference without a subscript, including inside
 * the addresses of subscripted ones.
 */
public class BadMemofFinder extends ExpVisitor {
  private boolean found = false;

  public static boolean containsBadMemof(Exp e) {
    BadMemofFinder bmf = new BadMemofFinder();
    ExpWalk.accept(e, bmf);
    return bmf.found;
  }

  public boolean isFound() {
    return found;
  }

  @Override
  public boolean visit(Location e, VisitFlag override) {
    if (e.isMemOf()) {
      found = true;
      return false;
    }
    return true;
  }

  @Override
  public boolean visit(RefExp e, VisitFlag override) {
    Exp base = e.getSubExp1();
    if (base.isMemOf()) {
      ExpWalk.accept(base.getSubExp1(), this);
      if (found) {
        return false;
      }
    }
    override.set();
    return true;
  }
}
