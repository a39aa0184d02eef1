package vhdlgen.syntax;

import java.util.Objects;

/**
 * A declaration of some sort (variable, component). The name is the declared identifier, not the type.
 */
public abstract sealed class VHDLDecl extends VHDLElement permits ComponentDecl, VarDecl {
  protected final String name;

  protected VHDLDecl(String name) { this.name = Objects.requireNonNull(name); }

  public String getName() { return name; }
}
