package vhdlgen.ui;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.error.YAMLException;

class VHDLGenConfigTest {

  static VHDLGenConfig load(String yaml) { return VHDLGenConfig.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))); }

  @Test
  void testLoad() {
    VHDLGenConfig cfg = load("indent: \"\\t\"\n"
                             + "architecture_name: rtl\n"
                             + "default_packages:\n"
                             + "  - ieee.std_logic_1164\n"
                             + "  - ieee.numeric_std\n");
    Assertions.assertEquals("\t", cfg.indent);
    Assertions.assertEquals("rtl", cfg.architecture_name);
    Assertions.assertEquals(List.of("ieee.std_logic_1164", "ieee.numeric_std"), cfg.default_packages);
    Assertions.assertEquals(".vhd", cfg.file_extension);
  }

  @Test
  void testEmptyIsDefault() {
    VHDLGenConfig cfg = load("");
    Assertions.assertEquals("  ", cfg.indent);
    Assertions.assertEquals("Behavioural", cfg.architecture_name);
    Assertions.assertTrue(cfg.default_packages.isEmpty());
  }

  @Test
  void testInvalidConfig() {
    Assertions.assertThrows(YAMLException.class, () -> load("indent: [\n"));
    Assertions.assertThrows(YAMLException.class, () -> load("no_such_option: 1\n"));
  }
}
