package io.schemagen.codegen.introspection;

import io.schemagen.codegen.literal.LiteralEvaluator;
import io.schemagen.codegen.render.DeclarationRenderer;

/** State shared by the visitors of one generation run. */
record CodegenContext(
    Schema schema,
    DeclarationRenderer renderer,
    IdentifierNamer namer,
    LiteralEvaluator literalEvaluator,
    EmittedTypes emittedTypes,
    TypeReferenceResolver resolver,
    StringBuilder output) {

  static CodegenContext create(Schema schema, DeclarationRenderer renderer, IdentifierNamer namer) {
    EmittedTypes emittedTypes = new EmittedTypes();
    return new CodegenContext(
        schema,
        renderer,
        namer,
        new LiteralEvaluator(),
        emittedTypes,
        new TypeReferenceResolver(emittedTypes),
        new StringBuilder());
  }
}
