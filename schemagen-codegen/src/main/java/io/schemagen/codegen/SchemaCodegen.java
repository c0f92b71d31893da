package io.schemagen.codegen;

import io.schemagen.codegen.exceptions.CodegenException;
import io.schemagen.codegen.introspection.CodegenVisitor;
import io.schemagen.codegen.introspection.Schema;
import io.schemagen.codegen.render.SgqlcRenderer;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Generates the {@code sgqlc} client module of an introspection schema. */
public class SchemaCodegen {

  private static final Logger LOG = LoggerFactory.getLogger(SchemaCodegen.class);

  /**
   * Generates the module source.
   *
   * @param schema the loaded schema
   * @param schemaName name of the schema object in the generated module, a valid identifier
   * @return the module source; nothing is produced when generation fails
   * @throws CodegenException if the schema cannot be generated
   */
  public String generate(Schema schema, String schemaName) throws CodegenException {
    CodegenVisitor codegen = new CodegenVisitor(schema, new SgqlcRenderer(schemaName));
    schema.visit(codegen);
    LOG.debug("Generated {} declarations for {}", codegen.getDeclaredTypes().size(), schemaName);
    return codegen.getSource();
  }

  public String generate(InputStream in, String schemaName) throws IOException, CodegenException {
    return generate(Schema.initialize(in), schemaName);
  }
}
