package vhdlgen.syntax;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * An entity defines the interface of a module and owns its single architecture.
 * Entities are derived from instantiations of source module scopes in the design hierarchy;
 * {@link #getDerivedFrom()} names that module.
 */
public final class Entity extends VHDLElement {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final String name;
  private final String derivedFrom;
  private final Architecture arch;
  private final LinkedHashSet<String> uses = new LinkedHashSet<>();

  /**
   * @param name Entity name.
   * @param derivedFrom Name of the source module this entity was derived from.
   * @param arch The architecture implementing this entity. It must have been created for this entity name and may not belong to another
   *     entity.
   */
  public Entity(String name, String derivedFrom, Architecture arch) {
    this.name = Objects.requireNonNull(name);
    this.derivedFrom = Objects.requireNonNull(derivedFrom);
    this.arch = Objects.requireNonNull(arch);
    if (!arch.getEntityName().equals(name))
      throw new IllegalArgumentException("Architecture " + arch.getName() + " implements " + arch.getEntityName() + ", not " + name);
    arch.attachTo(this);
  }

  public String getName() { return name; }

  public String getDerivedFrom() { return derivedFrom; }

  public Architecture getArch() { return arch; }

  /**
   * Records a package this entity depends on, e.g. "ieee.std_logic_1164".
   * Each package is recorded once; the use clauses are emitted in the order of first request.
   * @return true iff the package was not recorded before
   */
  public boolean requiresPackage(String spec) {
    boolean added = uses.add(Objects.requireNonNull(spec));
    if (!added)
      logger.debug("Entity {} already requires package {}", name, spec);
    return added;
  }

  /** The recorded packages, in recorded order. */
  public List<String> getPackages() { return new ArrayList<>(uses); }

  /** Writes the entity, starting at the top level. */
  public void emit(Appendable out) throws IOException { emit(out, 0); }
}
