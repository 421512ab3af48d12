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
import exm.dirc.ir.tree.Procedure;

/**
 * Find the procedure of the first location that has one
 */
public class GetProcVisitor extends ExpVisitor {
  private Procedure proc = null;

  /**
   * @return procedure, or null if no location has one
   */
  public static Procedure findProc(Exp e) {
    GetProcVisitor gpv = new GetProcVisitor();
    ExpWalk.accept(e, gpv);
    return gpv.proc;
  }

  public Procedure getProc() {
    return proc;
  }

  @Override
  public boolean visit(Location e, VisitFlag override) {
    proc = e.getProc();
    return proc == null;
  }
}
