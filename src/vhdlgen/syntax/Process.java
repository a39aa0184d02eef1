package vhdlgen.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Container for sequential statements.
 * Holds the local declarations and the statements of one process, both in insertion order.
 */
public final class Process extends ConcStmt {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final String name;
  private final List<VHDLDecl> decls = new ArrayList<>();
  private final List<SeqStmt> stmts = new ArrayList<>();
  /** Names of all VarDecl entries in decls */
  private final HashSet<String> varNames = new HashSet<>();

  /**
   * @param name The process label, or "" for an anonymous process.
   */
  public Process(String name) { this.name = Objects.requireNonNull(name); }

  public Process() { this(""); }

  public String getName() { return name; }

  public boolean isAnonymous() { return name.isEmpty(); }

  /**
   * Appends a declaration.
   * @throws DuplicateDeclarationException if decl is a variable and a variable of the same name is already declared here.
   *     Other declaration kinds are not checked.
   */
  public void addDecl(VHDLDecl decl) throws DuplicateDeclarationException {
    Objects.requireNonNull(decl);
    if (decl instanceof VarDecl) {
      if (!varNames.add(decl.getName()))
        throw new DuplicateDeclarationException(describe(), decl.getName());
    }
    decls.add(decl);
    logger.trace("Declared {} in {}", decl.getName(), describe());
  }

  public void addStmt(SeqStmt stmt) { stmts.add(Objects.requireNonNull(stmt)); }

  public boolean haveDeclaredVar(String name) { return varNames.contains(name); }

  public List<VHDLDecl> getDecls() { return Collections.unmodifiableList(decls); }

  public List<SeqStmt> getStmts() { return Collections.unmodifiableList(stmts); }

  private String describe() { return isAnonymous() ? "anonymous process" : "process " + name; }
}
