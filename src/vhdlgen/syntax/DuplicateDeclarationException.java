package vhdlgen.syntax;

/**
 * Thrown when a declaration would introduce a name that its scope already declares.
 * The scope is left unchanged.
 */
@SuppressWarnings("serial")
public class DuplicateDeclarationException extends Exception {
  private final String scope;
  private final String declName;

  public DuplicateDeclarationException(String scope, String declName) {
    super("'" + declName + "' is already declared in " + scope);
    this.scope = scope;
    this.declName = declName;
  }

  /** Human-readable description of the scope, e.g. "process proc". */
  public String getScope() { return scope; }

  public String getDeclName() { return declName; }
}
