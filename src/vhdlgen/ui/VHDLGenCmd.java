package vhdlgen.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.error.YAMLException;
import vhdlgen.VHDLGen;

public class VHDLGenCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("vhdlgencmd - generate VHDL entities from a design description", options);
    System.exit(-1);
  };

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    options.addOption(Option.builder("d")
                          .longOpt("design")
                          .argName("design.yaml")
                          .hasArgs()
                          .required(true)
                          .desc("YAML-file(s) describing the entities to generate, read in the given order")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory to generate output-files in, 'results' by default")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with tool options (indent, architecture_name, default_packages, file_extension)")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    //////////   collect options   //////////
    CommandLineParser parser = new DefaultParser();
    String[] designFiles = new String[0];
    String outputDir = "";
    String configFile = null;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelpAndExit(options);
      }

      designFiles = line.getOptionValues("d");
      outputDir = (line.hasOption("o") ? line.getOptionValue("o") : "results");
      configFile = line.getOptionValue("c");

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    //////////   read configuration and designs, generate   //////////
    VHDLGen gen = new VHDLGen();
    if (configFile != null) {
      try (InputStream configIn = new FileInputStream(configFile)) {
        gen.setConfig(VHDLGenConfig.load(configIn));
      } catch (IOException e) {
        logger.error("Config file {} could not be opened", configFile);
        printHelpAndExit(options);
      } catch (YAMLException e) {
        logger.error("Config file {} is not a valid configuration: {}", configFile, e.getMessage());
        printHelpAndExit(options);
      }
    }
    for (String designFile : designFiles)
      gen.addDesign(new File(designFile));
    boolean success = gen.Generate(outputDir);

    System.exit(success ? 0 : 1);
  }
}
