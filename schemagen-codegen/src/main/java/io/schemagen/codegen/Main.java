package io.schemagen.codegen;

import io.schemagen.codegen.exceptions.CodegenException;
import io.schemagen.codegen.introspection.Schema;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <pre>
 * schemagen [schema.json] [schema.py] [--schema-name NAME]
 * </pre>
 *
 * <p>Reads the introspection JSON from the given file, or standard input when omitted or {@code
 * -}. Writes next to the input file as {@code <schema name>.py} unless an output file is given, or
 * to standard output when reading standard input. Generated source is always UTF-8 encoded,
 * whatever the platform charset.
 */
public final class Main {

  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private static final String USAGE =
      "usage: schemagen [-h] [--schema-name SCHEMA_NAME] [schema.json] [schema.py]";

  private Main() {}

  public static void main(String[] args) {
    int status = run(args, System.in, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
    List<String> positional = new ArrayList<>();
    String schemaName = null;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("-h".equals(arg) || "--help".equals(arg)) {
        stdout.println(USAGE);
        return 0;
      } else if ("-s".equals(arg) || "--schema-name".equals(arg)) {
        if (i + 1 >= args.length) {
          stderr.println(USAGE);
          stderr.println("schemagen: error: " + arg + " expects a value");
          return EXIT_USAGE;
        }
        schemaName = args[++i];
      } else if (arg.startsWith("--schema-name=")) {
        schemaName = arg.substring("--schema-name=".length());
      } else if (arg.startsWith("-") && !"-".equals(arg)) {
        stderr.println(USAGE);
        stderr.println("schemagen: error: unrecognized argument " + arg);
        return EXIT_USAGE;
      } else {
        positional.add(arg);
      }
    }
    if (positional.size() > 2) {
      stderr.println(USAGE);
      stderr.println("schemagen: error: too many arguments");
      return EXIT_USAGE;
    }

    Path input = positional.size() > 0 ? toPath(positional.get(0)) : null;
    Path output = positional.size() > 1 ? toPath(positional.get(1)) : null;
    boolean toStdout = positional.size() > 1 ? output == null : input == null;

    if (schemaName == null || schemaName.isEmpty()) {
      schemaName = SchemaNames.derive(output, input);
    }
    schemaName = SchemaNames.cleanup(schemaName);
    if (schemaName.isEmpty()) {
      schemaName = SchemaNames.DEFAULT_SCHEMA_NAME;
    }
    if (!toStdout && output == null) {
      output = input.resolveSibling(schemaName + ".py");
    }

    try {
      Schema schema;
      if (input == null) {
        schema = Schema.initialize(stdin);
      } else {
        try (InputStream in = Files.newInputStream(input)) {
          schema = Schema.initialize(in);
        }
      }
      String source = new SchemaCodegen().generate(schema, schemaName);
      if (toStdout) {
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        stdout.write(bytes, 0, bytes.length);
        stdout.flush();
      } else {
        LOG.info("Writing to: {}", output);
        Files.writeString(output, source, StandardCharsets.UTF_8);
      }
      return 0;
    } catch (CodegenException | IOException e) {
      LOG.error("Generation failed: {}", e.getMessage());
      stderr.println("schemagen: error: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private static Path toPath(String arg) {
    return "-".equals(arg) ? null : Path.of(arg);
  }
}
