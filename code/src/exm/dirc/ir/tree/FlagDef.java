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

import exm.dirc.common.lang.Operators.Oper;

/**
 * Definition of a flag function: the child is the parameter list,
 * and the name identifies the register transfers that compute the
 * flags.
 */
public class FlagDef extends Unary {

  private final String rtlName;

  private FlagDef(Exp params, String rtlName) {
    super(Oper.FLAG_DEF, params);
    this.rtlName = rtlName;
  }

  public static FlagDef get(Exp params, String rtlName) {
    return new FlagDef(params, rtlName);
  }

  public String getRtlName() {
    return rtlName;
  }

  @Override
  protected Exp rebuild(Exp newSub1) {
    return new FlagDef(newSub1, rtlName);
  }
}
