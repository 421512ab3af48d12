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

import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.dirc.common.lang.Operators.Oper;
import exm.dirc.ir.tree.Const;
import exm.dirc.ir.tree.Exp;
import exm.dirc.ir.tree.RefExp;
import exm.dirc.ir.tree.RefExp.Def;

/**
 * Match expressions against patterns written in the printed syntax,
 * e.g. "m[a + 4]{-}".  Alphanumeric words in the pattern are variables
 * that bind to the subexpression at that position.  Matching is
 * permissive: it is meant for recognising idioms, not for parsing.
 */
public class StringPatternMatcher {

  /**
   * @param bindings variables bound by a successful match are added here
   * @return true if e matches pattern
   */
  public static boolean match(Exp e, String pattern, Map<String, Exp> bindings) {
    if (e.toString().equals(pattern)) {
      return true;
    }
    if (isVariable(pattern)) {
      bindings.put(pattern, e);
      return true;
    }

    switch (e.getOper()) {
      case ADDR_OF:
        if (pattern.startsWith("a[") && pattern.endsWith("]")) {
          return match(e.getSubExp1(), inner(pattern), bindings);
        }
        return false;
      case REG_OF:
      case MEM_OF: {
        String prefix = e.getOper() == Oper.REG_OF ? "r[" : "m[";
        if (!pattern.startsWith(prefix) || !pattern.endsWith("]")) {
          return false;
        }
        return match(e.getSubExp1(), inner(pattern), bindings);
      }
      case MEMBER_ACCESS:
        return matchMemberAccess(e, pattern, bindings);
      case ARRAY_INDEX: {
        if (!pattern.endsWith("]")) {
          return false;
        }
        int open = pattern.lastIndexOf('[');
        if (open < 0) {
          return false;
        }
        String base = pattern.substring(0, open).trim();
        String index = pattern.substring(open + 1, pattern.length() - 1).trim();
        return match(e.getSubExp1(), base, bindings) &&
               match(e.getSubExp2(), index, bindings);
      }
      case PLUS:
        return matchSplit(e, pattern, '+', bindings);
      case MINUS:
        return matchSplit(e, pattern, '-', bindings);
      case SUBSCRIPT:
        return matchSubscript((RefExp)e, pattern, bindings);
      default:
        return false;
    }
  }

  /**
   * Pattern variables are non-empty and alphanumeric
   */
  static boolean isVariable(String pattern) {
    return !pattern.isEmpty() && StringUtils.isAlphanumeric(pattern);
  }

  /**
   * @return the text between "x[" and the final "]"
   */
  private static String inner(String pattern) {
    return pattern.substring(2, pattern.length() - 1);
  }

  private static boolean matchSplit(Exp e, String pattern, char operator,
                                    Map<String, Exp> bindings) {
    int split = topLevelIndexOf(pattern, operator);
    if (split < 0) {
      return false;
    }
    String left = pattern.substring(0, split).trim();
    String right = pattern.substring(split + 1).trim();
    return match(e.getSubExp1(), left, bindings) &&
           match(e.getSubExp2(), right, bindings);
  }

  private static boolean matchMemberAccess(Exp e, String pattern,
                                           Map<String, Exp> bindings) {
    int split = topLevelIndexOf(pattern, '.');
    if (split < 0) {
      return false;
    }
    String base = pattern.substring(0, split);
    String member = pattern.substring(split + 1);
    if (!match(e.getSubExp1(), base, bindings)) {
      return false;
    }
    Exp memberExp = e.getSubExp2();
    if (memberExp.isStrConst() && member.equals(((Const)memberExp).getStr())) {
      return true;
    }
    if (isVariable(member)) {
      bindings.put(member, memberExp);
      return true;
    }
    return false;
  }

  private static boolean matchSubscript(RefExp e, String pattern,
                                        Map<String, Exp> bindings) {
    if (!pattern.endsWith("}")) {
      return false;
    }
    Def def = e.getDef();
    if (pattern.endsWith("{-}")) {
      if (def.getKind() != Def.Kind.IMPLICIT) {
        return false;
      }
      return match(e.getSubExp1(),
                   pattern.substring(0, pattern.length() - 3).trim(), bindings);
    }
    int open = pattern.lastIndexOf('{');
    if (open < 0 || def.getStatement() == null) {
      return false;
    }
    String num = pattern.substring(open + 1, pattern.length() - 1).trim();
    if (!StringUtils.isNumeric(num) ||
        Integer.parseInt(num) != def.getStatement().getNumber()) {
      return false;
    }
    return match(e.getSubExp1(), pattern.substring(0, open).trim(), bindings);
  }

  /**
   * Find a character outside any bracketed span: [..], {..} or (..)
   * @return index, or -1 if not found
   */
  static int topLevelIndexOf(String s, char c) {
    int i = 0;
    while (i < s.length()) {
      char cur = s.charAt(i);
      if (cur == c) {
        return i;
      }
      char close = closingBracket(cur);
      if (close != 0) {
        // Skip to the matching close bracket
        i++;
        while (i < s.length() && s.charAt(i) != close) {
          i++;
        }
      }
      i++;
    }
    return -1;
  }

  private static char closingBracket(char c) {
    switch (c) {
      case '[':
        return ']';
      case '{':
        return '}';
      case '(':
        return ')';
      default:
        return 0;
    }
  }
}
