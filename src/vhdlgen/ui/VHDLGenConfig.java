package vhdlgen.ui;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Data-Class to hold tool options.
 */
public class VHDLGenConfig {

  /** Indentation added per nesting level */
  public String indent = "  ";
  /** Architecture name for entities that do not name theirs */
  public String architecture_name = "Behavioural";
  /** Packages required by every generated entity, before the entity's own packages */
  public List<String> default_packages = new ArrayList<>();
  /** Extension of the generated files, including the dot */
  public String file_extension = ".vhd";

  /**
   * Reads a configuration from YAML. Keys missing in the YAML document keep their default values.
   * An empty document results in the default configuration.
   * @throws YAMLException if the document is not valid YAML or does not match the configuration keys
   */
  public static VHDLGenConfig load(InputStream yamlIn) {
    Yaml yaml = new Yaml(new Constructor(VHDLGenConfig.class, new LoaderOptions()));
    VHDLGenConfig cfg = yaml.load(yamlIn);
    return (cfg == null) ? new VHDLGenConfig() : cfg;
  }
}
