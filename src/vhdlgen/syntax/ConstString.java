package vhdlgen.syntax;

import java.util.Objects;

/**
 * A string literal. The value is stored without delimiters.
 */
public final class ConstString extends VHDLExpr {
  private final String value;

  public ConstString(String value) { this.value = Objects.requireNonNull(value); }

  public String getValue() { return value; }
}
