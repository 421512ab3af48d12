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

import java.util.ArrayList;
import java.util.List;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.ir.tree.Binary;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.FlagDef;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.RefExp;
import exm.dirc.ir.tree.Terminal;
import exm.dirc.ir.tree.Ternary;
import exm.dirc.ir.tree.TypeVal;
import exm.dirc.ir.tree.TypedExp;
import exm.dirc.ir.tree.Unary;

/**
 * Drivers for expression visitors and modifiers.  Both walk the tree
 * pre-order, children left to right.
 */
public class ExpWalk {

  /**
   * Walk the tree with a read-only visitor
   * @return false if the visitor stopped the traversal
   */
  public static boolean accept(Exp e, ExpVisitor v) {
    if (e instanceof Const) {
      return v.visit((Const)e);
    } else if (e instanceof Terminal) {
      return v.visit((Terminal)e);
    } else if (e instanceof TypeVal) {
      return v.visit((TypeVal)e);
    }

    VisitFlag override = new VisitFlag(false);
    boolean ret;
    if (e instanceof Location) {
      ret = v.visit((Location)e, override);
    } else if (e instanceof RefExp) {
      ret = v.visit((RefExp)e, override);
    } else if (e instanceof TypedExp) {
      ret = v.visit((TypedExp)e, override);
    } else if (e instanceof FlagDef) {
      ret = v.visit((FlagDef)e, override);
    } else if (e instanceof Unary) {
      ret = v.visit((Unary)e, override);
    } else if (e instanceof Binary) {
      ret = v.visit((Binary)e, override);
    } else if (e instanceof Ternary) {
      ret = v.visit((Ternary)e, override);
    } else {
      throw new DIRCRuntimeError("Unknown expression class " +
                                 e.getClass().getName());
    }
    if (override.isSet()) {
      return ret;
    }
    for (Exp child: e.getChildren()) {
      if (!ret) {
        break;
      }
      ret = accept(child, v);
    }
    return ret;
  }

  /**
   * Rewrite the tree with a modifier
   * @return the rewritten tree, or e itself if nothing changed
   */
  public static Exp accept(Exp e, ExpModifier m) {
    if (e instanceof Const) {
      Exp ret = m.preVisit((Const)e);
      checkKind(e, ret, Const.class, null);
      return m.postVisit((Const)ret);
    } else if (e instanceof TypeVal) {
      Exp ret = m.preVisit((TypeVal)e);
      checkKind(e, ret, TypeVal.class, null);
      return m.postVisit((TypeVal)ret);
    } else if (e instanceof Terminal) {
      Exp ret = m.preVisit((Terminal)e);
      checkKind(e, ret, Terminal.class, RefExp.class);
      return postVisit(ret, m);
    }

    VisitFlag recur = new VisitFlag(false);
    Exp ret;
    if (e instanceof Location) {
      ret = m.preVisit((Location)e, recur);
      checkKind(e, ret, Location.class, RefExp.class);
    } else if (e instanceof RefExp) {
      ret = m.preVisit((RefExp)e, recur);
      if (recur.isSet()) {
        ret = modifyChildren(ret, m);
      }
      if (!(ret instanceof RefExp)) {
        // Replaced with a different kind of expression: no post visit
        return ret;
      }
      return m.postVisit((RefExp)ret);
    } else if (e instanceof TypedExp) {
      ret = m.preVisit((TypedExp)e, recur);
      checkKind(e, ret, TypedExp.class, null);
    } else if (e instanceof FlagDef) {
      ret = m.preVisit((FlagDef)e, recur);
      checkKind(e, ret, FlagDef.class, null);
    } else if (e instanceof Unary) {
      ret = m.preVisit((Unary)e, recur);
      checkKind(e, ret, Unary.class, null);
    } else if (e instanceof Binary) {
      ret = m.preVisit((Binary)e, recur);
      checkKind(e, ret, Binary.class, Unary.class);
    } else if (e instanceof Ternary) {
      ret = m.preVisit((Ternary)e, recur);
      checkKind(e, ret, Ternary.class, null);
    } else {
      throw new DIRCRuntimeError("Unknown expression class " +
                                 e.getClass().getName());
    }

    if (recur.isSet()) {
      ret = modifyChildren(ret, m);
    }
    return postVisit(ret, m);
  }

  private static Exp modifyChildren(Exp e, ExpModifier m) {
    List<Exp> children = e.getChildren();
    List<Exp> newChildren = new ArrayList<Exp>(children.size());
    boolean changed = false;
    for (Exp child: children) {
      Exp newChild = accept(child, m);
      if (newChild != child) {
        changed = true;
      }
      newChildren.add(newChild);
    }
    if (!changed) {
      return e;
    }
    return e.withChildren(newChildren);
  }

  private static Exp postVisit(Exp e, ExpModifier m) {
    if (e instanceof Const) {
      return m.postVisit((Const)e);
    } else if (e instanceof TypeVal) {
      return m.postVisit((TypeVal)e);
    } else if (e instanceof Terminal) {
      return m.postVisit((Terminal)e);
    } else if (e instanceof Location) {
      return m.postVisit((Location)e);
    } else if (e instanceof RefExp) {
      return m.postVisit((RefExp)e);
    } else if (e instanceof TypedExp) {
      return m.postVisit((TypedExp)e);
    } else if (e instanceof FlagDef) {
      return m.postVisit((FlagDef)e);
    } else if (e instanceof Unary) {
      return m.postVisit((Unary)e);
    } else if (e instanceof Binary) {
      return m.postVisit((Binary)e);
    } else {
      assert(e instanceof Ternary) : e.getClass();
      return m.postVisit((Ternary)e);
    }
  }

  /**
   * Check that a pre-visit hook returned an allowed kind of node
   * @param alt second allowed class, or null
   */
  private static void checkKind(Exp orig, Exp ret, Class<?> expected,
                                Class<?> alt) {
    if (ret == null) {
      throw new DIRCRuntimeError("Modifier returned null for " + orig);
    }
    if (expected.isInstance(ret) || (alt != null && alt.isInstance(ret))) {
      return;
    }
    throw new DIRCRuntimeError("Modifier replaced " +
        orig.getClass().getSimpleName() + " " + orig + " with " +
        ret.getClass().getSimpleName() + " " + ret);
  }
}
