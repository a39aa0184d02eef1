package vhdlgen.syntax;

/**
 * Any sequential statement in a process.
 */
public abstract sealed class SeqStmt extends VHDLElement permits WaitStmt, PCallStmt {}
