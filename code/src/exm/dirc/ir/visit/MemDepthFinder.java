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

/**
 * Find the deepest nesting of m[..] in an expression, e.g. 2 for
 * m[m[r28] + 4]
 */
public class MemDepthFinder extends ExpVisitor {
  private int depth = 0;

  public static int getMemDepth(Exp e) {
    MemDepthFinder mdf = new MemDepthFinder();
    ExpWalk.accept(e, mdf);
    return mdf.depth;
  }

  public int getDepth() {
    return depth;
  }

  @Override
  public boolean visit(Location e, VisitFlag override) {
    if (e.isMemOf()) {
      int inner = getMemDepth(e.getSubExp1());
      depth = Math.max(depth, inner + 1);
      override.set();
    }
    return true;
  }
}
