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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.IdentityHashMap;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.dirc.common.Logging;

/**
 * Write expression trees in graphviz dot format, for debugging.
 * Each node instance gets its own graph node, so shared subtrees
 * appear once with several incoming edges.
 */
public class DotExporter {

  private static final Logger logger = Logging.getDircLogger();

  private final Map<Exp, Integer> ids = new IdentityHashMap<Exp, Integer>();
  private final StringBuilder out = new StringBuilder();

  private DotExporter() {
  }

  public static String toDot(Exp e) {
    DotExporter exporter = new DotExporter();
    exporter.out.append("digraph Exp {\n");
    exporter.appendNode(e);
    exporter.out.append("}");
    return exporter.out.toString();
  }

  public static void writeDotFile(Exp e, File file) throws IOException {
    try {
      FileUtils.writeStringToFile(file, toDot(e), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      logger.warn("Could not write dot file " + file + ": " + ex.getMessage());
      throw ex;
    }
  }

  private String name(Exp e) {
    return "e" + ids.get(e);
  }

  /**
   * Emit node and edges for e and its children.
   * @return false if the node was already emitted
   */
  private boolean appendNode(Exp e) {
    if (ids.containsKey(e)) {
      return false;
    }
    ids.put(e, ids.size() + 1);
    String name = name(e);

    if (e instanceof Terminal) {
      out.append(name).append(" [shape=parallelogram,label=\"")
         .append(e.getOperName()).append("\"];\n");
      return true;
    }

    out.append(name).append(" [shape=record,label=\"{")
       .append(e.getOperName()).append(" | ");
    if (e instanceof Const) {
      out.append(escape(ExpPrinter.print(e)));
    } else if (e instanceof TypeVal) {
      out.append(escape(((TypeVal)e).getType().getCtype()));
    } else if (e instanceof TypedExp) {
      out.append(escape(((TypedExp)e).getType().getCtype())).append(" | ");
    } else if (e instanceof FlagDef) {
      out.append("{ RTL ").append(escape(((FlagDef)e).getRtlName()))
         .append(" } | ");
    }
    int arity = e.getArity();
    if (arity == 1) {
      out.append("<p1>");
    } else if (arity == 2) {
      out.append("{<p1> | <p2>}");
    } else if (arity == 3) {
      out.append("{<p1> | <p2> | <p3>}");
    }
    out.append(" }\"];\n");

    int port = 1;
    for (Exp child: e.getChildren()) {
      appendNode(child);
      out.append(name).append(":p").append(port).append("->")
         .append(name(child)).append(";\n");
      port++;
    }
    return true;
  }

  private static String escape(String s) {
    if (s == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (char c: s.toCharArray()) {
      if (c == '"' || c == '{' || c == '}' || c == '|' ||
          c == '<' || c == '>') {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
