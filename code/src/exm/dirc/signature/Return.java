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

import com.google.common.base.Objects;

import exm.dirc.common.lang.Types.Type;
import exm.dirc.ir.tree.Exp;

/**
 * A value returned in a location
 */
public class Return {
  private Type type;
  private final Exp exp;

  public Return(Type type, Exp exp) {
    this.type = type;
    this.exp = exp;
  }

  public Type getType() {
    return type;
  }

  public void setType(Type type) {
    this.type = type;
  }

  public Exp getExp() {
    return exp;
  }

  @Override
  public Return clone() {
    return new Return(type, exp.clone());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Return)) {
      return false;
    }
    Return other = (Return)obj;
    return Objects.equal(type, other.type) && Objects.equal(exp, other.exp);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type, exp);
  }

  @Override
  public String toString() {
    return type.getCtype() + " " + exp;
  }
}
