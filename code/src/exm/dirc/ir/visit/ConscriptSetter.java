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

import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Location;

/**
 * Give each constant a distinct conscript, or clear all conscripts.
 * Constants naming a location (register numbers, local and global
 * names) and the sizes of size casts are left alone.
 */
public class ConscriptSetter extends ExpModifier {
  private int curConscript;
  private final boolean clear;
  /** Set when the next constant is the name of a location or a size */
  private boolean inLocalGlobal = false;

  public ConscriptSetter(int start, boolean clear) {
    this.curConscript = start;
    this.clear = clear;
  }

  /**
   * @return the last conscript assigned
   */
  public int getLast() {
    return curConscript;
  }

  public Exp apply(Exp e) {
    return ExpWalk.accept(e, this);
  }

  @Override
  public Exp preVisit(Const e) {
    Exp result = e;
    if (!inLocalGlobal) {
      if (clear) {
        result = e.withConscript(0);
      } else {
        curConscript++;
        result = e.withConscript(curConscript);
      }
    }
    inLocalGlobal = false;
    return result;
  }

  @Override
  public Exp preVisit(Location e, VisitFlag recur) {
    Oper op = e.getOper();
    if (op == Oper.LOCAL || op == Oper.GLOBAL || op == Oper.REG_OF ||
        op == Oper.PARAM) {
      inLocalGlobal = true;
    }
    recur.set();
    return e;
  }

  @Override
  public Exp preVisit(Binary e, VisitFlag recur) {
    if (e.getOper() == Oper.SIZE) {
      inLocalGlobal = true;
    }
    recur.set();
    return e;
  }
}
