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
 * A formal parameter: its type, name and the location it is passed in.
 */
public class Parameter {
  private Type type;
  private String name;
  private Exp exp;
  /** Name of another parameter giving this one's upper bound, or null */
  private String boundMax;

  public Parameter(Type type, String name, Exp exp, String boundMax) {
    this.type = type;
    this.name = name;
    this.exp = exp;
    this.boundMax = boundMax;
  }

  public Parameter(Type type, String name, Exp exp) {
    this(type, name, exp, null);
  }

  public Type getType() {
    return type;
  }

  public void setType(Type type) {
    this.type = type;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public Exp getExp() {
    return exp;
  }

  public void setExp(Exp exp) {
    this.exp = exp;
  }

  public String getBoundMax() {
    return boundMax;
  }

  public void setBoundMax(String boundMax) {
    this.boundMax = boundMax;
  }

  @Override
  public Parameter clone() {
    return new Parameter(type, name, exp == null ? null : exp.clone(),
                         boundMax);
  }

  /**
   * Parameters are equal if they have the same type and location.
   * Names are not significant.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Parameter)) {
      return false;
    }
    Parameter other = (Parameter)obj;
    return Objects.equal(type, other.type) && Objects.equal(exp, other.exp);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type, exp);
  }

  @Override
  public String toString() {
    return type.getCtype() + " " + name + " " + exp;
  }
}
