package vhdlgen.syntax;

import java.util.Objects;

/**
 * A normal scalar variable reference.
 */
public final class VarRef extends VHDLExpr {
  private final String name;

  public VarRef(String name) { this.name = Objects.requireNonNull(name); }

  public String getName() { return name; }
}
