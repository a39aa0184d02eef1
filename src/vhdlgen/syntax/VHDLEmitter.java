package vhdlgen.syntax;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders syntax elements as VHDL text.
 * Each element kind is handled by exactly one branch of the dispatch for its taxonomy.
 * Block elements (entities, architectures, declarations, statements) always write complete lines,
 * each starting with the indentation of its nesting level. Types and expressions are written inline.
 */
public class VHDLEmitter {
  public static final String DEFAULT_INDENT = "  ";

  private final Appendable out;
  private final String tab;

  public VHDLEmitter(Appendable out, String tab) {
    this.out = Objects.requireNonNull(out);
    this.tab = Objects.requireNonNull(tab);
  }

  public VHDLEmitter(Appendable out) { this(out, DEFAULT_INDENT); }

  public void emit(VHDLElement element, int level) throws IOException {
    if (element instanceof Entity)
      emitEntity((Entity)element, level);
    else if (element instanceof Architecture)
      emitArch((Architecture)element, level);
    else if (element instanceof ConcStmt)
      emitConcStmt((ConcStmt)element, level);
    else if (element instanceof SeqStmt)
      emitSeqStmt((SeqStmt)element, level);
    else if (element instanceof VHDLDecl)
      emitDecl((VHDLDecl)element, level);
    else if (element instanceof VHDLExpr)
      emitExpr((VHDLExpr)element);
    else if (element instanceof VHDLType)
      emitType((VHDLType)element);
    else
      throw new IllegalStateException("Unhandled element kind " + element.getClass().getSimpleName());
  }

  public void emitEntity(Entity ent, int level) throws IOException {
    emitUseClauses(ent.getPackages(), level);
    emitComment(ent, level);
    line(level, "entity " + ent.getName() + " is");
    line(level, "end entity;");
    blankLine();
    emitArch(ent.getArch(), level);
  }

  /**
   * Writes one library clause per distinct library, followed by one use clause per package and a blank line.
   * Writes nothing if there are no packages.
   */
  void emitUseClauses(List<String> packages, int level) throws IOException {
    if (packages.isEmpty())
      return;
    List<String> libraries = packages.stream()
                                 .map(spec -> spec.split("\\.", 2)[0])
                                 .filter(lib -> !lib.equalsIgnoreCase("work") && !lib.equalsIgnoreCase("std"))
                                 .distinct()
                                 .collect(Collectors.toList());
    for (String lib : libraries)
      line(level, "library " + lib + ";");
    for (String spec : packages) {
      int dots = (int)spec.chars().filter(c -> c == '.').count();
      if (dots == 0)
        continue; // library only
      line(level, "use " + spec + (dots == 1 ? ".all" : "") + ";");
    }
    blankLine();
  }

  public void emitArch(Architecture arch, int level) throws IOException {
    emitComment(arch, level);
    line(level, "architecture " + arch.getName() + " of " + arch.getEntityName() + " is");
    for (VHDLDecl decl : arch.getDecls())
      emitDecl(decl, level + 1);
    line(level, "begin");
    for (ConcStmt stmt : arch.getStmts())
      emitConcStmt(stmt, level + 1);
    line(level, "end architecture;");
  }

  public void emitConcStmt(ConcStmt stmt, int level) throws IOException {
    emitComment(stmt, level);
    if (stmt instanceof Process) {
      Process proc = (Process)stmt;
      line(level, (proc.isAnonymous() ? "" : proc.getName() + ": ") + "process is");
      for (VHDLDecl decl : proc.getDecls())
        emitDecl(decl, level + 1);
      line(level, "begin");
      for (SeqStmt seq : proc.getStmts())
        emitSeqStmt(seq, level + 1);
      line(level, "end process;");
    } else if (stmt instanceof CompInst) {
      CompInst inst = (CompInst)stmt;
      line(level, inst.getInstName() + ": " + inst.getCompName() + ";");
    } else
      throw new IllegalStateException("Unhandled concurrent statement " + stmt.getClass().getSimpleName());
  }

  public void emitSeqStmt(SeqStmt stmt, int level) throws IOException {
    emitComment(stmt, level);
    if (stmt instanceof WaitStmt) {
      line(level, "wait;");
    } else if (stmt instanceof PCallStmt) {
      PCallStmt pcall = (PCallStmt)stmt;
      indent(level);
      out.append(pcall.getName());
      // A call without arguments has no parentheses in VHDL
      if (!pcall.getArgs().isEmpty())
        emitExpr(pcall.getArgs());
      out.append(";\n");
    } else
      throw new IllegalStateException("Unhandled sequential statement " + stmt.getClass().getSimpleName());
  }

  public void emitDecl(VHDLDecl decl, int level) throws IOException {
    if (decl instanceof VarDecl) {
      VarDecl var = (VarDecl)decl;
      indent(level);
      out.append("variable ").append(var.getName()).append(" : ");
      emitType(var.getType());
      out.append(";");
      emitComment(var, level, true);
      out.append("\n");
    } else if (decl instanceof ComponentDecl) {
      emitComment(decl, level);
      line(level, "component " + decl.getName() + " is");
      line(level, "end component;");
    } else
      throw new IllegalStateException("Unhandled declaration " + decl.getClass().getSimpleName());
  }

  public void emitExpr(VHDLExpr expr) throws IOException {
    if (expr instanceof VarRef) {
      out.append(((VarRef)expr).getName());
    } else if (expr instanceof ConstString) {
      out.append('"').append(((ConstString)expr).getValue()).append('"');
    } else if (expr instanceof ExprList) {
      out.append('(');
      boolean first = true;
      for (VHDLExpr sub : ((ExprList)expr).getExprs()) {
        if (!first)
          out.append(", ");
        emitExpr(sub);
        first = false;
      }
      out.append(')');
    } else
      throw new IllegalStateException("Unhandled expression " + expr.getClass().getSimpleName());
  }

  public void emitType(VHDLType type) throws IOException {
    if (type instanceof ScalarType)
      out.append(((ScalarType)type).getName());
    else
      throw new IllegalStateException("Unhandled type " + type.getClass().getSimpleName());
  }

  /** Writes the comment of an element as preceding lines. */
  void emitComment(VHDLElement element, int level) throws IOException { emitComment(element, level, false); }

  /**
   * Writes the comment of an element, if it has one.
   * @param endOfLine If true, the comment is appended to the current line and the caller terminates the line.
   *     Otherwise, each comment line is written as its own line at the given level.
   */
  void emitComment(VHDLElement element, int level, boolean endOfLine) throws IOException {
    if (!element.hasComment())
      return;
    List<String> commentLines = element.getComment().lines().collect(Collectors.toList());
    if (endOfLine) {
      out.append("  -- ").append(String.join(" ", commentLines));
      return;
    }
    for (String commentLine : commentLines)
      line(level, commentLine.isEmpty() ? "--" : "-- " + commentLine);
  }

  private void indent(int level) throws IOException { out.append(tab.repeat(level)); }

  private void line(int level, String text) throws IOException {
    indent(level);
    out.append(text).append('\n');
  }

  private void blankLine() throws IOException { out.append('\n'); }
}
