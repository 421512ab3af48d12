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
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.lang.Types.Type;

/**
 * An expression annotated with a type
 */
public class TypedExp extends Unary {

  private final Type type;

  private TypedExp(Type type, Exp sub1) {
    super(Oper.TYPED_EXP, sub1);
    if (type == null) {
      throw new DIRCRuntimeError("Null type for typed expression");
    }
    this.type = type;
  }

  public static TypedExp get(Type type, Exp sub1) {
    return new TypedExp(type, sub1);
  }

  public Type getType() {
    return type;
  }

  public TypedExp withType(Type newType) {
    return new TypedExp(newType, sub1);
  }

  @Override
  protected Exp rebuild(Exp newSub1) {
    return new TypedExp(type, newSub1);
  }

  @Override
  protected boolean equalsExp(Exp o) {
    if (o.op == Oper.WILD) {
      return true;
    }
    if (o.op != Oper.TYPED_EXP) {
      return false;
    }
    TypedExp other = (TypedExp)o;
    return type.equals(other.type) && sub1.equals(other.sub1);
  }

  @Override
  public boolean equalsNoSubscript(Exp o) {
    Exp other = stripSubscript(o);
    if (other.op == Oper.WILD) {
      return true;
    }
    if (other.op != Oper.TYPED_EXP) {
      return false;
    }
    TypedExp t = (TypedExp)other;
    return type.equals(t.type) && sub1.equalsNoSubscript(t.sub1);
  }

  @Override
  public int compareTo(Exp o) {
    int comp = compareHeader(o);
    if (comp != 0) {
      return comp;
    }
    comp = type.compareTo(((TypedExp)o).type);
    if (comp != 0) {
      return comp;
    }
    return sub1.compareTo(o.getSubExp1());
  }

  @Override
  public int hashCode() {
    return super.hashCode() * 31 + type.hashCode();
  }
}
