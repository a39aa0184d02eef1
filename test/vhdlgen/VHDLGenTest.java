package vhdlgen;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import vhdlgen.syntax.Architecture;
import vhdlgen.syntax.Entity;
import vhdlgen.ui.VHDLGenConfig;

class VHDLGenTest {

  @TempDir
  Path outDir;

  @Test
  void testGenerate() throws Exception {
    VHDLGen gen = new VHDLGen();
    VHDLGenConfig cfg = new VHDLGenConfig();
    cfg.indent = "    ";
    gen.setConfig(cfg);
    String design = "- entity: sub\n"
                    + "- entity: top\n"
                    + "  packages: [ieee.std_logic_1164]\n"
                    + "  components: [sub]\n"
                    + "  statements:\n"
                    + "    - instance: u1\n"
                    + "      component: sub\n";
    Assertions.assertTrue(gen.addDesign(new ByteArrayInputStream(design.getBytes(StandardCharsets.UTF_8))));
    Assertions.assertTrue(gen.addEntity(new Entity("extra", "extra_mod", new Architecture("extra"))));
    Assertions.assertEquals(3, gen.getEntities().size());
    Assertions.assertTrue(gen.Generate(outDir.toString()));

    String top = Files.readString(outDir.resolve("top.vhd"));
    Assertions.assertEquals("library ieee;\n"
                                + "use ieee.std_logic_1164.all;\n"
                                + "\n"
                                + "entity top is\n"
                                + "end entity;\n"
                                + "\n"
                                + "architecture Behavioural of top is\n"
                                + "    component sub is\n"
                                + "    end component;\n"
                                + "begin\n"
                                + "    u1: sub;\n"
                                + "end architecture;\n",
                            top);
    Assertions.assertTrue(Files.exists(outDir.resolve("sub.vhd")));
    Assertions.assertTrue(Files.exists(outDir.resolve("extra.vhd")));
  }

  @Test
  void testGenerateReportsReadErrors() throws Exception {
    VHDLGen gen = new VHDLGen();
    Assertions.assertFalse(gen.addDesign(new ByteArrayInputStream("- entity: top\n  components: [nope]\n".getBytes(StandardCharsets.UTF_8))));
    Assertions.assertFalse(gen.Generate(outDir.toString()));
    Assertions.assertTrue(Files.exists(outDir.resolve("top.vhd")));
    Assertions.assertFalse(gen.addDesign(outDir.resolve("missing.yaml").toFile()));
  }

  @Test
  void testInvalidDesignFile() throws Exception {
    Path designFile = outDir.resolve("broken.yaml");
    Files.writeString(designFile, "- entity: [top\n");
    VHDLGen gen = new VHDLGen();
    Assertions.assertFalse(gen.addDesign(designFile.toFile()));
    Assertions.assertTrue(gen.getEntities().isEmpty());
    Assertions.assertFalse(gen.Generate(outDir.resolve("out").toString()));
  }

  @Test
  void testDuplicateEntityRejected() throws Exception {
    VHDLGen gen = new VHDLGen();
    Entity first = new Entity("dup", "first_mod", new Architecture("dup"));
    Assertions.assertTrue(gen.addEntity(first));
    Assertions.assertFalse(gen.addEntity(new Entity("dup", "second_mod", new Architecture("dup"))));
    Assertions.assertEquals(1, gen.getEntities().size());
    Assertions.assertSame(first, gen.getEntities().get(0));
    Assertions.assertFalse(gen.addDesign(new ByteArrayInputStream("- entity: dup\n".getBytes(StandardCharsets.UTF_8))));
    Assertions.assertEquals(1, gen.getEntities().size());
    Assertions.assertFalse(gen.Generate(outDir.toString()));
    Assertions.assertEquals(1, Files.readString(outDir.resolve("dup.vhd")).lines().filter(l -> l.equals("entity dup is")).count());
  }
}
