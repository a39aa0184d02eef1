package vhdlgen.syntax;

/**
 * Suspends the process indefinitely. Waiting on events or for a time is not supported yet.
 */
public final class WaitStmt extends SeqStmt {}
