package vhdlgen.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * An architecture which implements an entity.
 */
public final class Architecture extends VHDLElement {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String DEFAULT_NAME = "Behavioural";

  private final String name;
  private final String entity;
  private Entity parent = null;
  private final List<VHDLDecl> decls = new ArrayList<>();
  private final List<ConcStmt> stmts = new ArrayList<>();
  /** Names of all ComponentDecl entries in decls */
  private final HashSet<String> componentNames = new HashSet<>();

  /**
   * @param entity Name of the entity this architecture implements.
   * @param name Name of the architecture.
   */
  public Architecture(String entity, String name) {
    this.entity = Objects.requireNonNull(entity);
    this.name = Objects.requireNonNull(name);
  }

  public Architecture(String entity) { this(entity, DEFAULT_NAME); }

  public String getName() { return name; }

  public String getEntityName() { return entity; }

  /** The entity owning this architecture, set once the entity is constructed. */
  public Optional<Entity> getParent() { return Optional.ofNullable(parent); }

  /**
   * Appends a declaration.
   * @throws DuplicateDeclarationException if decl is a component declaration and a component of the same name is already declared here
   */
  public void addDecl(VHDLDecl decl) throws DuplicateDeclarationException {
    Objects.requireNonNull(decl);
    if (decl instanceof ComponentDecl) {
      if (!componentNames.add(decl.getName()))
        throw new DuplicateDeclarationException("architecture " + name + " of " + entity, decl.getName());
    }
    decls.add(decl);
  }

  /**
   * Appends a concurrent statement and makes this architecture its parent.
   * @throws IllegalStateException if the statement already belongs to an architecture
   */
  public void addStmt(ConcStmt stmt) {
    stmt.attachTo(this);
    stmts.add(stmt);
  }

  public boolean haveDeclaredComponent(String name) { return componentNames.contains(name); }

  public List<VHDLDecl> getDecls() { return Collections.unmodifiableList(decls); }

  public List<ConcStmt> getStmts() { return Collections.unmodifiableList(stmts); }

  /** Only called by the {@link Entity} constructor. */
  void attachTo(Entity ent) {
    if (parent != null)
      throw new IllegalStateException("Architecture " + name + " is already owned by entity " + parent.getName());
    parent = ent;
    logger.trace("Architecture {} attached to entity {}", name, ent.getName());
  }
}
