package vhdlgen.syntax;

import java.util.Optional;

/**
 * A concurrent statement appears in architecture bodies but not processes.
 */
public abstract sealed class ConcStmt extends VHDLElement permits CompInst, Process {
  private Architecture parent = null;

  /** The architecture this statement was added to, if any. */
  public Optional<Architecture> getParent() { return Optional.ofNullable(parent); }

  /** Only called by {@link Architecture#addStmt(ConcStmt)}. */
  void attachTo(Architecture arch) {
    if (parent != null)
      throw new IllegalStateException("Statement is already part of architecture " + parent.getName() + " of " + parent.getEntityName());
    parent = arch;
  }
}
