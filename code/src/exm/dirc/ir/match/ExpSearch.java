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
package exm.dirc.ir.match;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.dirc.common.Logging;
import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.common.util.Pair;
import exm.dirc.ir.tree.Exp;

/**
 * Search expressions for subexpressions equal to a pattern, which may
 * contain wildcards, and replace them.
 *
 * Patterns are always compared with {@code pattern.equals(candidate)}.
 * The search does not descend into a subscripted expression that
 * matched, nor into the child of an initial value e'.
 */
public class ExpSearch {

  private static final Logger logger = Logging.getDircLogger();

  /**
   * @return first match in pre-order, or null if none
   */
  public static Exp search(Exp pattern, Exp root) {
    List<Exp> matches = new ArrayList<Exp>();
    doSearch(pattern, root, matches, true);
    if (matches.isEmpty()) {
      return null;
    }
    return matches.get(0);
  }

  /**
   * Find all matches, appending them to out in pre-order
   * @return true if anything matched
   */
  public static boolean searchAll(Exp pattern, Exp root, List<Exp> out) {
    int before = out.size();
    doSearch(pattern, root, out, false);
    return out.size() > before;
  }

  private static void doSearch(Exp pattern, Exp e, List<Exp> matches,
                               boolean once) {
    boolean match = pattern.equals(e);
    if (match) {
      matches.add(e);
      if (once) {
        return;
      }
    }
    if (match && e.getOper() == Oper.SUBSCRIPT) {
      return;
    }
    if (e.getOper() == Oper.INIT_VALUE_OF) {
      return;
    }
    int before = matches.size();
    for (Exp child: e.getChildren()) {
      doSearch(pattern, child, matches, once);
      if (once && matches.size() > before) {
        return;
      }
    }
  }

  /**
   * Replace the first match
   * @return (new root, whether anything changed)
   */
  public static Pair<Exp, Boolean> searchReplace(Exp pattern,
                                        Exp replacement, Exp root) {
    return searchReplaceAll(pattern, replacement, root, true);
  }

  /**
   * Replace every match with a copy of replacement.  Matches inside a
   * replaced subtree are replaced along with it.  Subtrees without a
   * match are shared with the original tree.
   * @param once if true, only replace the first match
   * @return (new root, whether anything changed)
   */
  public static Pair<Exp, Boolean> searchReplaceAll(Exp pattern,
                          Exp replacement, Exp root, boolean once) {
    int[] count = new int[1];
    Exp result = doReplace(pattern, replacement, root, once, count);
    if (count[0] > 0 && logger.isTraceEnabled()) {
      logger.trace("replaced " + count[0] + " occurrence(s) of " + pattern +
                   " with " + replacement + " in " + root);
    }
    return Pair.create(result, count[0] > 0);
  }

  private static Exp doReplace(Exp pattern, Exp replacement, Exp e,
                               boolean once, int[] count) {
    if (pattern.equals(e)) {
      count[0]++;
      return replacement.clone();
    }
    if (e.getOper() == Oper.INIT_VALUE_OF || e.isTerminal()) {
      return e;
    }
    List<Exp> children = e.getChildren();
    List<Exp> newChildren = new ArrayList<Exp>(children.size());
    boolean changed = false;
    for (Exp child: children) {
      Exp newChild = child;
      if (!once || count[0] == 0) {
        newChild = doReplace(pattern, replacement, child, once, count);
      }
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
}
