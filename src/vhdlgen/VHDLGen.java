package vhdlgen;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import vhdlgen.frontend.DesignReader;
import vhdlgen.syntax.Entity;
import vhdlgen.syntax.VHDLEmitter;
import vhdlgen.ui.VHDLGenConfig;
import vhdlgen.util.FileWriter;

/**
 * Collects the entities of one or more design descriptions and writes one VHDL file per entity.
 */
public class VHDLGen {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private VHDLGenConfig cfg = new VHDLGenConfig();
  private List<Entity> entities = new ArrayList<>();
  private boolean readErrors = false;

  public void setConfig(VHDLGenConfig cfg) { this.cfg = cfg; }

  /**
   * Adds an entity that was built directly through the syntax classes.
   * @return false if an entity of the same name is already present; the entity is not added then
   */
  public boolean addEntity(Entity ent) {
    if (entities.stream().anyMatch(other -> other.getName().equals(ent.getName()))) {
      logger.error("Entity {} is defined more than once. Ignoring the later definition.", ent.getName());
      readErrors = true;
      return false;
    }
    entities.add(ent);
    return true;
  }

  public List<Entity> getEntities() { return Collections.unmodifiableList(entities); }

  /**
   * Reads the entities of a design description. Components can refer to entities of previously added designs.
   * @return false if the description had errors; entities without errors are added nevertheless
   */
  public boolean addDesign(InputStream designIn) {
    DesignReader reader = new DesignReader(cfg, entities);
    List<Entity> read = reader.Read(designIn);
    entities.addAll(read);
    logger.debug("Read {} entities", read.size());
    if (reader.HasErrors())
      readErrors = true;
    return !reader.HasErrors();
  }

  public boolean addDesign(File designFile) {
    try (InputStream designIn = new FileInputStream(designFile)) {
      return addDesign(designIn);
    } catch (IOException e) {
      logger.error("Design file {} could not be read: {}", designFile, e.getMessage());
      readErrors = true;
      return false;
    }
  }

  /** Returns the VHDL text of a single entity. */
  public String emitEntity(Entity ent) {
    StringBuilder text = new StringBuilder();
    try {
      new VHDLEmitter(text, cfg.indent).emitEntity(ent, 0);
    } catch (IOException e) {
      // StringBuilder does not throw
      throw new IllegalStateException(e);
    }
    return text.toString();
  }

  /**
   * Writes one file per entity into the output directory, named after the entity.
   * @return true iff all designs were read without errors and all files were written
   */
  public boolean Generate(String outPath) {
    if (entities.isEmpty())
      logger.warn("No entities to generate");
    FileWriter toFile = new FileWriter();
    for (Entity ent : entities) {
      logger.debug("Generating entity {} (derived from {})", ent.getName(), ent.getDerivedFrom());
      toFile.UpdateContent(ent.getName() + cfg.file_extension, emitEntity(ent));
    }
    boolean success = toFile.WriteFiles(outPath);
    return success && !readErrors;
  }
}
