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

import exm.dirc.common.lang.Types.Type;
import exm.dirc.ir.tree.Exp;

/**
 * A location defined, with unknown value, by a call that follows a
 * calling convention.
 */
public class ImplicitDef {
  private final Type type;
  private final Exp location;

  public ImplicitDef(Type type, Exp location) {
    assert(type != null);
    assert(location != null);
    this.type = type;
    this.location = location;
  }

  public Type getType() {
    return type;
  }

  public Exp getLocation() {
    return location;
  }

  @Override
  public String toString() {
    return "*" + type.getCtype() + "* " + location + " := -";
  }
}
