package vhdlgen.syntax;

import java.util.Objects;

/**
 * A procedure call. Which is a statement, unlike a function call which is an expression.
 */
public final class PCallStmt extends SeqStmt {
  private final String name;
  private final ExprList exprs = new ExprList();

  public PCallStmt(String name) { this.name = Objects.requireNonNull(name); }

  public void addExpr(VHDLExpr expr) { exprs.addExpr(expr); }

  public String getName() { return name; }

  /** The argument list, in call order. */
  public ExprList getArgs() { return exprs; }
}
