package io.schemagen.codegen.maven;

import io.schemagen.codegen.SchemaNames;
import io.schemagen.codegen.exceptions.CodegenException;
import io.schemagen.codegen.introspection.CodegenVisitor;
import io.schemagen.codegen.introspection.EmissionPhase;
import io.schemagen.codegen.introspection.Schema;
import io.schemagen.codegen.introspection.SchemaVisitor;
import io.schemagen.codegen.introspection.Type;
import io.schemagen.codegen.render.SgqlcRenderer;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.lang3.StringUtils;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

/** Generates the {@code sgqlc} client module of a GraphQL introspection schema. */
@Mojo(name = "codegen", defaultPhase = LifecyclePhase.GENERATE_SOURCES, threadSafe = true)
public class SchemagenCodegenMojo extends AbstractMojo {

  /** specify output file encoding; defaults to source encoding */
  @Parameter(property = "project.build.sourceEncoding")
  protected String outputEncoding;

  /** The introspection JSON file. */
  @Parameter(property = "schemagen.introspectionJson", required = true)
  protected File introspectionJson;

  /**
   * Name of the schema object in the generated module. Defaults to the base name of the
   * introspection file.
   */
  @Parameter(property = "schemagen.schemaName")
  protected String schemaName;

  /** Specify output directory where the module is generated. */
  @Parameter(defaultValue = "${project.build.directory}/generated-sources/schemagen")
  private File outputDirectory;

  @Override
  public void execute() throws MojoExecutionException, MojoFailureException {
    outputEncoding = validateEncoding(outputEncoding);

    if (introspectionJson == null || !introspectionJson.isFile()) {
      throw new MojoFailureException(
          String.format("Introspection file %s not found", introspectionJson));
    }

    String name =
        SchemaNames.cleanup(
            StringUtils.isBlank(schemaName)
                ? SchemaNames.derive(null, introspectionJson.toPath())
                : schemaName);
    if (name.isEmpty()) {
      name = SchemaNames.DEFAULT_SCHEMA_NAME;
    }

    String source;
    try (InputStream in = new FileInputStream(introspectionJson)) {
      Schema schema = Schema.initialize(in);
      CodegenVisitor codegen = new CodegenVisitor(schema, new SgqlcRenderer(name));
      schema.visit(loggingVisitor(codegen));
      source = codegen.getSource();
    } catch (CodegenException | IOException e) {
      throw new MojoFailureException(e.getMessage(), e);
    }

    File outputDir = getOutputDirectory();
    if (!outputDir.exists() && !outputDir.mkdirs()) {
      throw new MojoExecutionException("Failed to create output directory: " + outputDir);
    }
    Path dest = outputDir.toPath().resolve(name + ".py");
    try {
      Files.writeString(dest, source, Charset.forName(outputEncoding));
    } catch (IOException e) {
      throw new MojoExecutionException("Failed to write " + dest, e);
    }
    getLog().info(String.format("Generated schema %s in %s", name, dest));
  }

  private SchemaVisitor loggingVisitor(SchemaVisitor codegen) {
    return new SchemaVisitor() {
      @Override
      public void visitHeader() throws CodegenException {
        codegen.visitHeader();
      }

      @Override
      public void visitPhase(EmissionPhase phase) throws CodegenException {
        getLog().debug(String.format("Generating %s", phase.getBanner()));
        codegen.visitPhase(phase);
      }

      @Override
      public void visitScalar(Type type) throws CodegenException {
        getLog().info(String.format("Generating scalar %s", type.getName()));
        codegen.visitScalar(type);
      }

      @Override
      public void visitEnum(Type type) throws CodegenException {
        getLog().info(String.format("Generating enum %s", type.getName()));
        codegen.visitEnum(type);
      }

      @Override
      public void visitInput(Type type) throws CodegenException {
        getLog().info(String.format("Generating input %s", type.getName()));
        codegen.visitInput(type);
      }

      @Override
      public void visitInterface(Type type) throws CodegenException {
        getLog().info(String.format("Generating interface %s", type.getName()));
        codegen.visitInterface(type);
      }

      @Override
      public void visitObject(Type type) throws CodegenException {
        getLog().info(String.format("Generating object %s", type.getName()));
        codegen.visitObject(type);
      }

      @Override
      public void visitUnion(Type type) throws CodegenException {
        getLog().info(String.format("Generating union %s", type.getName()));
        codegen.visitUnion(type);
      }

      @Override
      public void visitEntryPoints() throws CodegenException {
        getLog().info("Generating schema entry points");
        codegen.visitEntryPoints();
      }
    };
  }

  public File getOutputDirectory() {
    return outputDirectory;
  }

  /**
   * Validates the given encoding.
   *
   * @return the validated encoding. If {@code null} was provided, returns the platform default
   *     encoding.
   */
  private String validateEncoding(String encoding) {
    return (encoding == null)
        ? Charset.defaultCharset().name()
        : Charset.forName(encoding.trim()).name();
  }
}
