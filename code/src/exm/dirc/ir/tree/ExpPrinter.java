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

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.lang.Operators;
import exm.dirc.common.lang.Operators.Oper;

/**
 * Render expressions in the canonical infix syntax, e.g.
 * m[r28 + 4]{12} or truncu(32,16,r24).
 */
public class ExpPrinter {

  private static final int HEX_THRESHOLD = 1000;

  public static String print(Exp e) {
    StringBuilder sb = new StringBuilder();
    print(sb, e);
    return sb.toString();
  }

  /**
   * Print with the brackets of a top level r[..] or v[..] removed
   */
  public static String printAsHL(Exp e) {
    String s = print(e);
    if (s.length() >= 4 && s.charAt(1) == '[') {
      s = s.charAt(0) + s.substring(2, s.length() - 1);
    }
    return s;
  }

  /**
   * Print, appending the size for a typed expression, e.g. " *int* r24<32>"
   */
  public static String printt(Exp e) {
    String s = print(e);
    if (e.getOper() != Oper.TYPED_EXP) {
      return s;
    }
    return s + "<" + ((TypedExp)e).getType().getSize() + ">";
  }

  /**
   * Print as a child: add parentheses around infix operators
   */
  public static void printr(StringBuilder sb, Exp e) {
    if (needsParens(e)) {
      sb.append("(");
      print(sb, e);
      sb.append(")");
    } else {
      print(sb, e);
    }
  }

  private static boolean needsParens(Exp e) {
    if (e instanceof Binary) {
      return e.getOper() != Oper.SIZE && e.getOper() != Oper.LIST;
    }
    if (e instanceof Ternary) {
      return Operators.ternaryFunctionName(e.getOper()) == null;
    }
    return false;
  }

  public static void print(StringBuilder sb, Exp e) {
    if (e instanceof Const) {
      printConst(sb, (Const)e, true);
    } else if (e instanceof Terminal) {
      sb.append(Operators.terminalSpelling(e.getOper()));
    } else if (e instanceof TypeVal) {
      sb.append("<").append(((TypeVal)e).getType().getCtype()).append(">");
    } else if (e instanceof TypedExp) {
      sb.append(" *").append(((TypedExp)e).getType().getCtype()).append("* ");
      print(sb, e.getSubExp1());
    } else if (e instanceof RefExp) {
      print(sb, e.getSubExp1());
      sb.append("{").append(((RefExp)e).getDef()).append("}");
    } else if (e instanceof FlagDef) {
      sb.append("FLAGDEF(");
      print(sb, e.getSubExp1());
      sb.append(")");
    } else if (e instanceof Unary) {
      printUnary(sb, e);
    } else if (e instanceof Binary) {
      printBinary(sb, e);
    } else if (e instanceof Ternary) {
      printTernary(sb, e);
    } else {
      throw new DIRCRuntimeError("Unknown expression class " +
                                 e.getClass().getName());
    }
  }

  private static void printConst(StringBuilder sb, Const c, boolean quotes) {
    switch (c.getOper()) {
      case INT_CONST:
      case LONG_CONST: {
        long val = c.getLong();
        if (val < -HEX_THRESHOLD || val > HEX_THRESHOLD) {
          if (val < 0) {
            sb.append("-");
          }
          sb.append("0x").append(Long.toHexString(Math.abs(val)));
        } else {
          sb.append(val);
        }
        if (c.isLongConst()) {
          sb.append("LL");
        }
        break;
      }
      case FLT_CONST:
        sb.append(String.format(Locale.ROOT, "%.4f", c.getFlt()));
        break;
      case STR_CONST:
        if (quotes) {
          sb.append("\"").append(c.getStr()).append("\"");
        } else {
          sb.append(c.getStr());
        }
        break;
      case FUNC_CONST:
        sb.append(c.getFuncName());
        break;
      default:
        throw new DIRCRuntimeError("Invalid constant operator " + c.getOper());
    }
    if (c.getConscript() != 0) {
      sb.append("\\").append(c.getConscript()).append("\\");
    }
  }

  private static void printNoQuotes(StringBuilder sb, Exp e) {
    if (e instanceof Const) {
      printConst(sb, (Const)e, false);
    } else {
      print(sb, e);
    }
  }

  private static void printUnary(StringBuilder sb, Exp e) {
    Oper op = e.getOper();
    Exp p1 = e.getSubExp1();
    switch (op) {
      case REG_OF:
        if (p1.isIntConst()) {
          sb.append("r").append(((Const)p1).getInt());
        } else if (p1.isTemp()) {
          print(sb, p1);
        } else {
          sb.append("r[");
          print(sb, p1);
          sb.append("]");
        }
        return;
      case MEM_OF:
      case ADDR_OF:
      case VAR:
      case TYPE_OF:
      case KIND_OF:
        sb.append(bracketPrefix(op)).append("[");
        if (op == Oper.VAR) {
          printNoQuotes(sb, p1);
        } else {
          print(sb, p1);
        }
        sb.append("]");
        return;
      case NOT:
        sb.append("~");
        printr(sb, p1);
        return;
      case LNOT:
        sb.append("L~");
        printr(sb, p1);
        return;
      case FNEG:
        sb.append("~f ");
        printr(sb, p1);
        return;
      case NEG:
        sb.append("-");
        printr(sb, p1);
        return;
      case SIGN_EXT:
        printr(sb, p1);
        sb.append("!");
        return;
      case SGN_EX:
        printr(sb, p1);
        sb.append("! ");
        return;
      case TEMP:
        if (p1.getOper() == Oper.WILD_STR_CONST) {
          sb.append("t[");
          print(sb, p1);
          sb.append("]");
          return;
        }
        printNoQuotes(sb, p1);
        return;
      case GLOBAL:
      case LOCAL:
      case PARAM:
        printNoQuotes(sb, p1);
        return;
      case INIT_VALUE_OF:
        printr(sb, p1);
        sb.append("'");
        return;
      default:
        break;
    }
    String fn = Operators.unaryFunctionName(op);
    if (fn == null) {
      throw new DIRCRuntimeError("Invalid unary operator " + op);
    }
    sb.append(fn).append("(");
    printr(sb, p1);
    sb.append(")");
  }

  private static String bracketPrefix(Oper op) {
    switch (op) {
      case MEM_OF:
        return "m";
      case ADDR_OF:
        return "a";
      case VAR:
        return "v";
      case TYPE_OF:
        return "T";
      case KIND_OF:
        return "K";
      default:
        throw new DIRCRuntimeError("No bracket form for " + op);
    }
  }

  private static void printBinary(StringBuilder sb, Exp e) {
    Oper op = e.getOper();
    Exp p1 = e.getSubExp1();
    Exp p2 = e.getSubExp2();
    switch (op) {
      case SIZE:
        // The size is printed after the expression
        printr(sb, p2);
        sb.append("*");
        printr(sb, p1);
        sb.append("*");
        return;
      case FLAG_CALL:
        printNoQuotes(sb, p1);
        sb.append("( ");
        printr(sb, p2);
        sb.append(" )");
        return;
      case EXP_TABLE:
      case NAME_TABLE:
        sb.append(op == Oper.EXP_TABLE ? "exptable(" : "nametable(");
        print(sb, p1);
        sb.append(", ");
        print(sb, p2);
        sb.append(")");
        return;
      case LIST:
        print(sb, p1);
        if (!p2.isNil()) {
          sb.append(", ");
        }
        print(sb, p2);
        return;
      case MEMBER_ACCESS:
        print(sb, p1);
        sb.append(".");
        printNoQuotes(sb, p2);
        return;
      case ARRAY_INDEX:
        print(sb, p1);
        sb.append("[");
        print(sb, p2);
        sb.append("]");
        return;
      default:
        break;
    }
    String spelling = Operators.binarySpelling(op);
    if (spelling == null) {
      throw new DIRCRuntimeError("Invalid binary operator " + op);
    }
    printr(sb, p1);
    sb.append(spelling);
    printr(sb, p2);
  }

  private static void printTernary(StringBuilder sb, Exp e) {
    Oper op = e.getOper();
    Exp p1 = e.getSubExp1();
    Exp p2 = e.getSubExp2();
    Exp p3 = e.getSubExp3();
    String fn = Operators.ternaryFunctionName(op);
    if (fn != null) {
      sb.append(fn).append("(");
      print(sb, p1);
      sb.append(",");
      print(sb, p2);
      sb.append(",");
      print(sb, p3);
      sb.append(")");
      return;
    }
    printr(sb, p1);
    if (op == Oper.TERN) {
      sb.append(" ? ");
      printr(sb, p2);
      sb.append(" : ");
      print(sb, p3);
    } else if (op == Oper.AT) {
      sb.append("@");
      printr(sb, p2);
      sb.append(":");
      printr(sb, p3);
    } else {
      throw new DIRCRuntimeError("Invalid ternary operator " + op);
    }
  }

  /**
   * One node per line, children indented by two spaces
   */
  public static String printTree(Exp e) {
    StringBuilder sb = new StringBuilder();
    printTree(sb, e, 0);
    return sb.toString();
  }

  private static void printTree(StringBuilder sb, Exp e, int depth) {
    sb.append(StringUtils.repeat(' ', depth * 2));
    sb.append(e.getOperName());
    if (e instanceof Const) {
      sb.append(" ");
      printConst(sb, (Const)e, true);
    } else if (e instanceof TypedExp) {
      sb.append(" ").append(((TypedExp)e).getType().getCtype());
    } else if (e instanceof TypeVal) {
      sb.append(" ").append(((TypeVal)e).getType().getCtype());
    } else if (e instanceof RefExp) {
      sb.append(" {").append(((RefExp)e).getDef()).append("}");
    }
    sb.append("\n");
    for (Exp child: e.getChildren()) {
      printTree(sb, child, depth + 1);
    }
  }
}
