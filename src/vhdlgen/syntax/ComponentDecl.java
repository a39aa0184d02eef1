package vhdlgen.syntax;

/**
 * A forward declaration of a component.
 * Component declarations can only be created for entities generated by this code generator,
 * which is why the constructor is private (use {@link #componentDeclFor(Entity)} instead).
 */
public final class ComponentDecl extends VHDLDecl {
  private final String derivedFrom;

  private ComponentDecl(String name, String derivedFrom) {
    super(name);
    this.derivedFrom = derivedFrom;
  }

  /**
   * Creates the declaration of the component matching an entity.
   * @param ent The entity to declare. The declaration takes over its name and derivation provenance.
   */
  public static ComponentDecl componentDeclFor(Entity ent) { return new ComponentDecl(ent.getName(), ent.getDerivedFrom()); }

  /** Name of the source module the declared entity was derived from. */
  public String getDerivedFrom() { return derivedFrom; }
}
