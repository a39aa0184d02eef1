package vhdlgen.syntax;

import java.util.Objects;

/**
 * A variable declaration inside a process (although this isn't enforced here).
 */
public final class VarDecl extends VHDLDecl {
  private final VHDLType type;

  public VarDecl(String name, VHDLType type) {
    super(name);
    this.type = Objects.requireNonNull(type);
  }

  public VHDLType getType() { return type; }
}
