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
package exm.dirc.signature;

import exm.dirc.common.util.Result;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Location;

/**
 * A signature with a user-chosen stack pointer, for conventions that
 * are not otherwise supported.
 */
public class CustomSignature extends Signature {

  /** Stack pointer register, or 0 if not set */
  private int sp = 0;

  public CustomSignature(String name) {
    super(name);
  }

  public CustomSignature(Signature old) {
    super(old);
    if (old instanceof CustomSignature) {
      this.sp = ((CustomSignature)old).sp;
    }
  }

  @Override
  public CustomSignature clone() {
    return new CustomSignature(this);
  }

  /**
   * Choose the stack pointer.  The stack pointer is added as a return.
   */
  public void setSP(int sp) {
    this.sp = sp;
    if (sp != 0) {
      addReturn(Location.regOf(sp));
    }
  }

  @Override
  public Result<Integer> getStackRegister() {
    if (sp == 0) {
      return super.getStackRegister();
    }
    return Result.ofValue(sp);
  }

  @Override
  public Exp getProven(Exp left) {
    if (sp != 0 && left.isRegN(sp)) {
      return Binary.plus(Location.regOf(sp), Const.get(4));
    }
    return null;
  }

  @Override
  public boolean isPreserved(Exp e) {
    return sp != 0 && e.isRegN(sp);
  }

  @Override
  public boolean isPromoted() {
    return true;
  }
}
