package vhdlgen.frontend;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import vhdlgen.syntax.Architecture;
import vhdlgen.syntax.CompInst;
import vhdlgen.syntax.ComponentDecl;
import vhdlgen.syntax.ConstString;
import vhdlgen.syntax.DuplicateDeclarationException;
import vhdlgen.syntax.Entity;
import vhdlgen.syntax.ExprList;
import vhdlgen.syntax.PCallStmt;
import vhdlgen.syntax.Process;
import vhdlgen.syntax.ScalarType;
import vhdlgen.syntax.SeqStmt;
import vhdlgen.syntax.VHDLExpr;
import vhdlgen.syntax.VarDecl;
import vhdlgen.syntax.VarRef;
import vhdlgen.syntax.WaitStmt;
import vhdlgen.ui.VHDLGenConfig;

/**
 * Builds entities from a YAML design description.
 * The document is a list of entity maps. Components may only be declared for entities that are already known,
 * i.e. that appear earlier in the document or were passed to the constructor.
 * Problems are logged, the offending item is skipped and {@link #HasErrors()} is set.
 */
public class DesignReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final VHDLGenConfig cfg;
  /** Known entities by name, including the ones read by this reader */
  private final LinkedHashMap<String, Entity> known = new LinkedHashMap<>();
  private boolean errors = false;

  /**
   * @param cfg The tool configuration (default architecture name and packages)
   * @param knownEntities Entities read previously that components may be declared for
   */
  public DesignReader(VHDLGenConfig cfg, Collection<Entity> knownEntities) {
    this.cfg = cfg;
    knownEntities.forEach(ent -> known.put(ent.getName(), ent));
  }

  public boolean HasErrors() { return errors; }

  /**
   * Reads all entities of a design description.
   * @return The entities in document order, excluding skipped ones
   */
  public List<Entity> Read(InputStream yamlIn) {
    Yaml yaml = new Yaml();
    List<Entity> ret = new ArrayList<>();
    Object readData;
    try {
      readData = yaml.load(yamlIn);
    } catch (YAMLException e) {
      Error("The design description is not valid YAML: {}", e.getMessage());
      return ret;
    }
    if (readData == null)
      return ret;
    if (!(readData instanceof List)) {
      Error("The design description should be a list of entities");
      return ret;
    }
    for (Object readEntity : (List<?>)readData) {
      if (!(readEntity instanceof Map)) {
        Error("Ignoring design entry {}, expected an entity description", readEntity);
        continue;
      }
      Entity ent = ReadEntity((Map<?, ?>)readEntity);
      if (ent != null) {
        known.put(ent.getName(), ent);
        ret.add(ent);
      }
    }
    return ret;
  }

  private Entity ReadEntity(Map<?, ?> readEntity) {
    String entityName = GetString(readEntity, "entity", "");
    if (entityName.isEmpty()) {
      Error("An entity name should be provided. Ignoring entity {}.", readEntity);
      return null;
    }
    if (known.containsKey(entityName)) {
      Error("Entity {} is defined more than once. Ignoring the later definition.", entityName);
      return null;
    }
    String derivedFrom = GetString(readEntity, "derived from", entityName);
    Architecture arch = new Architecture(entityName, GetString(readEntity, "architecture", cfg.architecture_name));

    for (Object componentName : GetList(readEntity, "components")) {
      if (componentName == null) {
        Error("Entity {}: Ignoring empty component entry", entityName);
        continue;
      }
      Entity componentEnt = known.get(componentName.toString());
      if (componentEnt == null) {
        Error("Entity {}: Cannot declare component {}, no such entity was defined before", entityName, componentName);
        continue;
      }
      try {
        arch.addDecl(ComponentDecl.componentDeclFor(componentEnt));
      } catch (DuplicateDeclarationException e) {
        Error("Entity {}: {}", entityName, e.getMessage());
      }
    }

    for (Object readStmt : GetList(readEntity, "statements")) {
      if (!(readStmt instanceof Map)) {
        Error("Entity {}: Ignoring statement {}, expected 'instance' or 'process'", entityName, readStmt);
        continue;
      }
      Map<?, ?> stmtMap = (Map<?, ?>)readStmt;
      if (stmtMap.containsKey("instance")) {
        String instName = GetString(stmtMap, "instance", "");
        String compName = GetString(stmtMap, "component", "");
        if (!arch.haveDeclaredComponent(compName)) {
          Error("Entity {}: Instance {} refers to undeclared component '{}'", entityName, instName, compName);
          continue;
        }
        CompInst inst = new CompInst(instName, compName);
        inst.setComment(GetString(stmtMap, "comment", ""));
        arch.addStmt(inst);
      } else if (stmtMap.containsKey("process")) {
        arch.addStmt(ReadProcess(entityName, stmtMap));
      } else {
        Error("Entity {}: Ignoring statement {}, expected 'instance' or 'process'", entityName, stmtMap);
      }
    }

    Entity ent = new Entity(entityName, derivedFrom, arch);
    ent.setComment(GetString(readEntity, "comment", ""));
    List<Object> packages = new ArrayList<>(cfg.default_packages);
    packages.addAll(GetList(readEntity, "packages"));
    for (Object pkg : packages) {
      if (pkg == null) {
        Error("Entity {}: Ignoring empty package entry", entityName);
        continue;
      }
      ent.requiresPackage(pkg.toString());
    }
    logger.debug("Read entity {} derived from {} with {} statements", entityName, derivedFrom, arch.getStmts().size());
    return ent;
  }

  private Process ReadProcess(String entityName, Map<?, ?> procMap) {
    Object procName = procMap.get("process");
    Process proc = new Process(procName == null ? "" : procName.toString());
    proc.setComment(GetString(procMap, "comment", ""));
    for (Object readVar : GetList(procMap, "variables")) {
      if (!(readVar instanceof Map)) {
        Error("Entity {}: Ignoring variable {}, expected 'name' and 'type'", entityName, readVar);
        continue;
      }
      Map<?, ?> varMap = (Map<?, ?>)readVar;
      String varName = GetString(varMap, "name", "");
      String typeName = GetString(varMap, "type", "");
      if (varName.isEmpty() || typeName.isEmpty()) {
        Error("Entity {}: Ignoring variable {}, expected 'name' and 'type'", entityName, varMap);
        continue;
      }
      VarDecl decl = new VarDecl(varName, new ScalarType(typeName));
      decl.setComment(GetString(varMap, "comment", ""));
      try {
        proc.addDecl(decl);
      } catch (DuplicateDeclarationException e) {
        Error("Entity {}: {}", entityName, e.getMessage());
      }
    }
    for (Object readStmt : GetList(procMap, "statements")) {
      SeqStmt stmt = ReadSeqStmt(entityName, readStmt);
      if (stmt != null)
        proc.addStmt(stmt);
    }
    return proc;
  }

  private SeqStmt ReadSeqStmt(String entityName, Object readStmt) {
    if ("wait".equals(readStmt))
      return new WaitStmt();
    if (readStmt instanceof Map) {
      Map<?, ?> stmtMap = (Map<?, ?>)readStmt;
      SeqStmt stmt = null;
      if (stmtMap.containsKey("wait")) {
        stmt = new WaitStmt();
      } else if (stmtMap.containsKey("call")) {
        PCallStmt pcall = new PCallStmt(GetString(stmtMap, "call", ""));
        for (Object readArg : GetList(stmtMap, "args")) {
          VHDLExpr arg = ReadExpr(entityName, readArg);
          if (arg == null)
            return null;
          pcall.addExpr(arg);
        }
        stmt = pcall;
      }
      if (stmt != null) {
        stmt.setComment(GetString(stmtMap, "comment", ""));
        return stmt;
      }
    }
    Error("Entity {}: Ignoring sequential statement {}, expected 'wait' or 'call'", entityName, readStmt);
    return null;
  }

  private VHDLExpr ReadExpr(String entityName, Object readExpr) {
    if (readExpr instanceof Map) {
      Map<?, ?> exprMap = (Map<?, ?>)readExpr;
      if (exprMap.containsKey("var"))
        return new VarRef(GetString(exprMap, "var", ""));
      if (exprMap.containsKey("string"))
        return new ConstString(GetString(exprMap, "string", ""));
      if (exprMap.containsKey("list")) {
        ExprList list = new ExprList();
        for (Object readSub : GetList(exprMap, "list")) {
          VHDLExpr sub = ReadExpr(entityName, readSub);
          if (sub == null)
            return null;
          list.addExpr(sub);
        }
        return list;
      }
    }
    Error("Entity {}: Unsupported expression {}, expected 'var', 'string' or 'list'", entityName, readExpr);
    return null;
  }

  private void Error(String message, Object... params) {
    errors = true;
    logger.error(message, params);
  }

  private static String GetString(Map<?, ?> map, String key, String defaultValue) {
    Object value = map.get(key);
    return (value == null) ? defaultValue : value.toString();
  }

  private static List<?> GetList(Map<?, ?> map, String key) {
    Object value = map.get(key);
    if (value == null)
      return List.of();
    if (value instanceof List)
      return (List<?>)value;
    return List.of(value);
  }
}
