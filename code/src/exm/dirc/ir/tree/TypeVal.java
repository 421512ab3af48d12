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

import java.util.List;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.lang.Types.Type;

/**
 * A type used as a value, e.g. in type constraints: T[x] = <int>
 */
public class TypeVal extends Exp {

  private final Type val;

  private TypeVal(Type val) {
    super(Oper.TYPE_VAL);
    if (val == null) {
      throw new DIRCRuntimeError("Null type value");
    }
    this.val = val;
  }

  public static TypeVal get(Type val) {
    return new TypeVal(val);
  }

  public Type getType() {
    return val;
  }

  @Override
  public int getArity() {
    return 0;
  }

  @Override
  public Exp withChildren(List<Exp> children) {
    checkArity(children);
    return this;
  }

  @Override
  public TypeVal clone() {
    return new TypeVal(val);
  }

  @Override
  protected boolean equalsExp(Exp o) {
    if (o.op == Oper.WILD) {
      return true;
    }
    if (o.op != Oper.TYPE_VAL) {
      return false;
    }
    return val.equals(((TypeVal)o).val);
  }

  @Override
  public boolean equalsNoSubscript(Exp o) {
    return equalsExp(stripSubscript(o));
  }

  @Override
  public int compareTo(Exp o) {
    int comp = compareHeader(o);
    if (comp != 0) {
      return comp;
    }
    return val.compareTo(((TypeVal)o).val);
  }

  @Override
  public int hashCode() {
    return op.hashCode() * 31 + val.hashCode();
  }
}
