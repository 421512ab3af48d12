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
 * Set the enclosing procedure of every location
 */
public class FixProcVisitor extends ExpModifier {
  private final Procedure proc;

  public FixProcVisitor(Procedure proc) {
    this.proc = proc;
  }

  public static Exp fixLocationProc(Exp e, Procedure proc) {
    return ExpWalk.accept(e, new FixProcVisitor(proc));
  }

  @Override
  public Exp postVisit(Location e) {
    if (e.getProc() == proc) {
      return e;
    }
    return e.withProc(proc);
  }
}
