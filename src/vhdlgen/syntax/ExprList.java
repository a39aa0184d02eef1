package vhdlgen.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of expressions, rendered as a parenthesized, comma-separated group (e.g. call arguments).
 */
public final class ExprList extends VHDLExpr {
  private final List<VHDLExpr> exprs = new ArrayList<>();

  public void addExpr(VHDLExpr expr) { exprs.add(Objects.requireNonNull(expr)); }

  public List<VHDLExpr> getExprs() { return Collections.unmodifiableList(exprs); }

  public int size() { return exprs.size(); }

  public boolean isEmpty() { return exprs.isEmpty(); }
}
