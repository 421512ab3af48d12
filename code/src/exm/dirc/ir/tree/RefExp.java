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
 * A subscripted expression e{d}: the value of location e as defined by
 * definition d, in SSA form.
 */
public class RefExp extends Unary {

  /**
   * The definition a subscript refers to
   */
  public static final class Def {
    public static enum Kind {
      /** Matches any definition */
      WILD,
      /** No defining statement: the value on entry */
      IMPLICIT,
      DEFINED,
    }

    public static final Def WILD = new Def(Kind.WILD, null);
    public static final Def IMPLICIT = new Def(Kind.IMPLICIT, null);

    private final Kind kind;
    private final Statement stmt;

    private Def(Kind kind, Statement stmt) {
      this.kind = kind;
      this.stmt = stmt;
    }

    /**
     * @param stmt defining statement, or null for an implicit definition
     */
    public static Def of(Statement stmt) {
      if (stmt == null) {
        return IMPLICIT;
      }
      return new Def(Kind.DEFINED, stmt);
    }

    public Kind getKind() {
      return kind;
    }

    /**
     * @return defining statement, or null
     */
    public Statement getStatement() {
      return stmt;
    }

    public boolean isWild() {
      return kind == Kind.WILD;
    }

    /**
     * @return true for no statement, or an implicit statement
     */
    public boolean isImplicit() {
      return kind == Kind.IMPLICIT ||
             (kind == Kind.DEFINED && stmt.isImplicit());
    }

    public boolean matches(Def other) {
      if (kind == Kind.WILD || other.kind == Kind.WILD) {
        return true;
      }
      if (kind == Kind.IMPLICIT) {
        return other.isImplicit();
      }
      if (other.kind == Kind.IMPLICIT) {
        return isImplicit();
      }
      return stmt == other.stmt;
    }

    public int compareTo(Def other) {
      if (matches(other)) {
        return 0;
      }
      boolean implicit = isImplicit();
      if (implicit != other.isImplicit()) {
        return implicit ? -1 : 1;
      }
      // Both statements: order by number
      int comp = Integer.compare(stmt.getNumber(), other.stmt.getNumber());
      if (comp != 0) {
        return comp;
      }
      return Integer.compare(System.identityHashCode(stmt),
                             System.identityHashCode(other.stmt));
    }

    @Override
    public String toString() {
      switch (kind) {
        case WILD:
          return "WILD";
        case IMPLICIT:
          return "-";
        default:
          return String.valueOf(stmt.getNumber());
      }
    }
  }

  private final Def def;

  private RefExp(Exp sub1, Def def) {
    super(Oper.SUBSCRIPT, sub1);
    assert(def != null);
    this.def = def;
  }

  public static RefExp get(Exp sub1, Def def) {
    return new RefExp(sub1, def);
  }

  /**
   * @param stmt defining statement, or null for implicit
   */
  public static RefExp get(Exp sub1, Statement stmt) {
    return new RefExp(sub1, Def.of(stmt));
  }

  public static RefExp wild(Exp sub1) {
    return new RefExp(sub1, Def.WILD);
  }

  public Def getDef() {
    return def;
  }

  public RefExp withDef(Def newDef) {
    return new RefExp(sub1, newDef);
  }

  public boolean isImplicitDef() {
    return def.isImplicit();
  }

  @Override
  protected Exp rebuild(Exp newSub1) {
    return new RefExp(newSub1, def);
  }

  @Override
  protected boolean equalsExp(Exp o) {
    if (o.op == Oper.WILD) {
      return true;
    }
    if (o.op != Oper.SUBSCRIPT) {
      return false;
    }
    RefExp other = (RefExp)o;
    return sub1.equals(other.sub1) && def.matches(other.def);
  }

  /**
   * The subscript on this side is ignored too
   */
  @Override
  public boolean equalsNoSubscript(Exp o) {
    return sub1.equalsNoSubscript(o);
  }

  @Override
  public int compareTo(Exp o) {
    int comp = compareHeader(o);
    if (comp != 0) {
      return comp;
    }
    RefExp other = (RefExp)o;
    comp = sub1.compareTo(other.sub1);
    if (comp != 0) {
      return comp;
    }
    return def.compareTo(other.def);
  }

  @Override
  public int hashCode() {
    return op.hashCode() * 31 + sub1.hashCode();
  }
}
