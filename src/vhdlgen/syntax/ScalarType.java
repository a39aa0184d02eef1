package vhdlgen.syntax;

import java.util.Objects;

/**
 * A type at the moment is just a name, e.g. "integer" or "std_logic".
 */
public final class ScalarType extends VHDLType {
  private final String name;

  public ScalarType(String name) { this.name = Objects.requireNonNull(name); }

  public String getName() { return name; }

  @Override
  public String toString() {
    return name;
  }
}
