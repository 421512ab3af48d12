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
package exm.dirc.ir.tree;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators;
import exm.dirc.common.lang.Operators.Oper;

/**
 * A storage location: register, memory, local, global, parameter
 * or temporary.  May refer back to the procedure it belongs to; the
 * procedure is not part of equality or ordering.
 */
public class Location extends Unary {

  /** Enclosing procedure, or null if unknown */
  private final Procedure proc;

  private Location(Oper op, Exp sub1, Procedure proc) {
    super(op, sub1);
    this.proc = proc;
  }

  public static Location get(Oper op, Exp sub1, Procedure proc) {
    if (!Operators.isLocation(op)) {
      throw new DIRCRuntimeError("Not a location operator: " + op);
    }
    return new Location(op, sub1, proc);
  }

  public static Location regOf(int regNum) {
    return get(Oper.REG_OF, Const.get(regNum), null);
  }

  public static Location regOf(Exp regExp) {
    return get(Oper.REG_OF, regExp, null);
  }

  public static Location memOf(Exp addr) {
    return get(Oper.MEM_OF, addr, null);
  }

  public static Location memOf(Exp addr, Procedure proc) {
    return get(Oper.MEM_OF, addr, proc);
  }

  public static Location temp(String name) {
    return get(Oper.TEMP, Const.get(name), null);
  }

  public static Location local(String name, Procedure proc) {
    return get(Oper.LOCAL, Const.get(name), proc);
  }

  public static Location global(String name, Procedure proc) {
    return get(Oper.GLOBAL, Const.get(name), proc);
  }

  public static Location param(String name, Procedure proc) {
    return get(Oper.PARAM, Const.get(name), proc);
  }

  public Procedure getProc() {
    return proc;
  }

  public Location withProc(Procedure newProc) {
    return new Location(op, sub1, newProc);
  }

  @Override
  protected Exp rebuild(Exp newSub1) {
    return new Location(op, newSub1, proc);
  }
}
