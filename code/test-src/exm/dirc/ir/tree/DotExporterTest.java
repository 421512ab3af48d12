package exm.dirc.ir.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class DotExporterTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testNodesAndEdges() {
    Exp e = Location.memOf(Binary.plus(Location.regOf(28), Const.get(4)));
    String dot = DotExporter.toDot(e);
    assertTrue(dot.startsWith("digraph Exp {\n"));
    assertTrue(dot.endsWith("}"));
    assertTrue(dot.contains("e1 [shape=record,label=\"{opMemOf | <p1> }\"];"));
    assertTrue(dot.contains("e1:p1->e2;"));
    assertTrue(dot.contains("e2:p1->e3;"));
    assertTrue(dot.contains("e2:p2->e5;"));
    assertTrue(dot.contains("opIntConst | 28"));
  }

  @Test
  public void testTerminalShape() {
    String dot = DotExporter.toDot(Terminal.wild());
    assertTrue(dot.contains("e1 [shape=parallelogram,label=\"opWild\"];"));
  }

  @Test
  public void testSharedSubtreeEmittedOnce() {
    Exp r24 = Location.regOf(24);
    String dot = DotExporter.toDot(Binary.plus(r24, r24));
    assertTrue(dot.contains("e1:p1->e2;"));
    assertTrue(dot.contains("e1:p2->e2;"));
    assertEquals(dot.indexOf("e2 [shape"), dot.lastIndexOf("e2 [shape"));
  }

  @Test
  public void testWriteFile() throws IOException {
    File out = tmp.newFile("exp.dot");
    Exp e = Binary.plus(Location.regOf(24), Const.get(1));
    DotExporter.writeDotFile(e, out);
    assertEquals(DotExporter.toDot(e),
                 FileUtils.readFileToString(out, StandardCharsets.UTF_8));
  }
}
