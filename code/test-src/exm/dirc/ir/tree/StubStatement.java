package exm.dirc.ir.tree;

import exm.dirc.common.lang.Types.Type;

/**
 * Minimal statement for building subscripted expressions in tests
 */
public class StubStatement implements Statement {
  private final int number;
  private final Exp left;
  private final boolean implicit;

  public StubStatement(int number, Exp left, boolean implicit) {
    this.number = number;
    this.left = left;
    this.implicit = implicit;
  }

  public static StubStatement assign(int number, Exp left) {
    return new StubStatement(number, left, false);
  }

  @Override
  public int getNumber() {
    return number;
  }

  @Override
  public boolean isImplicit() {
    return implicit;
  }

  @Override
  public boolean isAssign() {
    return left != null;
  }

  @Override
  public Exp getLeft() {
    return left;
  }

  @Override
  public Type getTypeFor(Exp loc) {
    return null;
  }
}
