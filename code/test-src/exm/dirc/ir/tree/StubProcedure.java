package exm.dirc.ir.tree;

import java.util.HashMap;
import java.util.Map;

import exm.dirc.signature.Platform;
import exm.dirc.signature.Signature;

/**
 * Procedure with settable proven facts, for signature tests
 */
public class StubProcedure implements Procedure {
  private final String name;
  private final Platform platform;
  private final boolean win32;
  private final Map<Exp, Exp> proven = new HashMap<Exp, Exp>();
  private Signature signature;

  public StubProcedure(String name, Platform platform, boolean win32) {
    this.name = name;
    this.platform = platform;
    this.win32 = win32;
    this.signature = new Signature(name);
  }

  public void setProven(Exp left, Exp right) {
    proven.put(left, right);
  }

  public void setSignature(Signature signature) {
    this.signature = signature;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public Signature getSignature() {
    return signature;
  }

  @Override
  public Platform getPlatform() {
    return platform;
  }

  @Override
  public boolean isWin32() {
    return win32;
  }

  @Override
  public Exp getProven(Exp left) {
    return proven.get(left);
  }
}
