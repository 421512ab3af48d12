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
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.Ternary;
import exm.dirc.ir.tree.Unary;

/**
 * Measure how complex an expression is, by counting operators and
 * memory references.  Used to prefer the simpler of two equivalent
 * expressions.
 */
public class ComplexityFinder extends ExpVisitor {
  private int count = 0;

  public static int getComplexityDepth(Exp e) {
    ComplexityFinder cf = new ComplexityFinder();
    ExpWalk.accept(e, cf);
    return cf.count;
  }

  public int getDepth() {
    return count;
  }

  @Override
  public boolean visit(Location e, VisitFlag override) {
    if (e.isMemOf()) {
      count++;
    }
    return true;
  }

  @Override
  public boolean visit(Unary e, VisitFlag override) {
    count++;
    return true;
  }

  @Override
  public boolean visit(Binary e, VisitFlag override) {
    count++;
    return true;
  }

  @Override
  public boolean visit(Ternary e, VisitFlag override) {
    count++;
    return true;
  }
}
