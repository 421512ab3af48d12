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

import java.util.Set;
import java.util.TreeSet;

import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.Location;
import exm.dirc.ir.tree.RefExp;
import exm.dirc.ir.tree.Terminal;

/**
 * Collect the locations an expression uses.  A subscripted location is
 * used as a whole; only the address of a subscripted m[..] is
 * searched further.
 */
public class UsedLocsFinder extends ExpVisitor {

  private final Set<Exp> used;
  /** If true, only collect locations inside m[..] */
  private boolean memOnly;

  public UsedLocsFinder(Set<Exp> used, boolean memOnly) {
    this.used = used;
    this.memOnly = memOnly;
  }

  public static Set<Exp> findUsedLocs(Exp e, boolean memOnly) {
    Set<Exp> used = new TreeSet<Exp>();
    ExpWalk.accept(e, new UsedLocsFinder(used, memOnly));
    return used;
  }

  public Set<Exp> getUsed() {
    return used;
  }

  @Override
  public boolean visit(Location e, VisitFlag override) {
    if (!memOnly) {
      used.add(e);
    }
    if (e.isMemOf()) {
      // Everything inside the address is used, memOnly or not
      boolean wasMemOnly = memOnly;
      memOnly = false;
      ExpWalk.accept(e.getSubExp1(), this);
      memOnly = wasMemOnly;
      override.set();
    }
    return true;
  }

  @Override
  public boolean visit(Terminal e) {
    if (memOnly) {
      return true;
    }
    switch (e.getOper()) {
      case PC:
      case FLAGS:
      case FFLAGS:
      case DEFINE_ALL:
      case DF:
      case CF:
      case ZF:
      case NF:
      case OF:
        used.add(e);
        break;
      default:
        break;
    }
    return true;
  }

  @Override
  public boolean visit(RefExp e, VisitFlag override) {
    if (memOnly) {
      return true;
    }
    used.add(e);
    Exp refd = e.getSubExp1();
    if (refd.isMemOf()) {
      ExpWalk.accept(refd.getSubExp1(), this);
    } else if (refd.getOper() == Oper.ARRAY_INDEX) {
      ExpWalk.accept(refd.getSubExp1(), this);
      ExpWalk.accept(refd.getSubExp2(), this);
    } else if (refd.getOper() == Oper.MEMBER_ACCESS) {
      ExpWalk.accept(refd.getSubExp1(), this);
    }
    override.set();
    return true;
  }
}
