package vhdlgen.util;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for writing files.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** key: file relative path, value: content to write. Order is the order files were first added. */
  private LinkedHashMap<String, StringBuilder> contents = new LinkedHashMap<String, StringBuilder>();

  /**
   * Appends text to a file that will be written by {@link FileWriter#WriteFiles(String)}.
   *
   * @param file The relative path to the file. The path string should be equal for all updates that target the same file.
   * @param text The text to append, including line breaks.
   */
  public void UpdateContent(String file, String text) { contents.computeIfAbsent(file, file_ -> new StringBuilder()).append(text); }

  /**
   * Returns the content collected for a file so far, or "" if nothing was added for it.
   */
  public String GetContent(String file) {
    StringBuilder content = contents.get(file);
    return (content == null) ? "" : content.toString();
  }

  /**
   * Writes all files for which content has been registered with this FileWriter. Existing files are overwritten.
   *
   * @param out_path Base output directory. If set to null, the current directory will be used.
   * @return true iff all files were written
   */
  public boolean WriteFiles(String out_path) {
    boolean success = true;
    for (String key : contents.keySet()) {
      success &= WriteFile(contents.get(key).toString(), key, out_path == null ? "" : out_path);
    }
    return success;
  }

  private boolean WriteFile(String content, String file, String out_path) {
    File outFile = Paths.get(out_path, file).toFile();
    // create output path if necessary
    File parent = outFile.getAbsoluteFile().getParentFile();
    if (parent != null)
      parent.mkdirs();

    logger.info("Writing " + outFile.getPath());
    try (PrintWriter out = new PrintWriter(new OutputStreamWriter(new FileOutputStream(outFile), StandardCharsets.UTF_8))) {
      out.print(content);
      out.flush();
      if (out.checkError()) {
        logger.fatal("Error writing file " + outFile.getPath());
        return false;
      }
    } catch (IOException e) {
      logger.fatal("File " + outFile.getPath() + " could not be opened for writing", e);
      return false;
    }
    return true;
  }
}
