package io.schemagen.codegen;

import java.nio.file.Path;
import org.apache.commons.lang3.StringUtils;

/** Derives the name of the generated schema object. */
public final class SchemaNames {

  public static final String DEFAULT_SCHEMA_NAME = "generated_schema";

  private SchemaNames() {}

  /**
   * Turns any string into an identifier: runs of characters other than letters, digits and
   * {@code _} become {@code _}, leading and trailing {@code _} are removed, and a leading digit
   * gets a {@code _} prefix.
   */
  public static String cleanup(String schemaName) {
    String name = schemaName.replaceAll("[^A-Za-z0-9_]+", "_");
    name = StringUtils.strip(name, "_");
    if (!name.isEmpty() && Character.isDigit(name.charAt(0))) {
      name = "_" + name;
    }
    return name;
  }

  /**
   * The base name of the output file, else of the input file, without extension. Falls back to
   * {@value #DEFAULT_SCHEMA_NAME} when both are standard streams (null).
   */
  public static String derive(Path output, Path input) {
    if (output != null) {
      return baseName(output);
    } else if (input != null) {
      return baseName(input);
    }
    return DEFAULT_SCHEMA_NAME;
  }

  static String baseName(Path path) {
    String fileName = path.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
