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
import exm.dirc.ir.tree.Exp;

/**
 * Look for a flag function call
 */
public class FlagsFinder extends ExpVisitor {
  private boolean found = false;

  public static boolean containsFlags(Exp e) {
    FlagsFinder ff = new FlagsFinder();
    ExpWalk.accept(e, ff);
    return ff.found;
  }

  public boolean isFound() {
    return found;
  }

  @Override
  public boolean visit(Binary e, VisitFlag override) {
    if (e.isFlagCall()) {
      found = true;
      return false;
    }
    return true;
  }
}
