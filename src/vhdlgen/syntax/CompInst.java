package vhdlgen.syntax;

import java.util.Objects;

/**
 * Instantiation of a component.
 * Port mappings are not generated yet, so this binds an instance name to the component only.
 */
public final class CompInst extends ConcStmt {
  private final String instName;
  private final String compName;

  public CompInst(String instName, String compName) {
    this.instName = Objects.requireNonNull(instName);
    this.compName = Objects.requireNonNull(compName);
  }

  public String getInstName() { return instName; }

  public String getCompName() { return compName; }
}
