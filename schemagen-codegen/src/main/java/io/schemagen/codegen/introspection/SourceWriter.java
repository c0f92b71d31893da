package io.schemagen.codegen.introspection;

import io.schemagen.codegen.declaration.Declaration;
import io.schemagen.codegen.exceptions.ConsistencyException;

/**
 * Appends rendered declarations to the in-memory output. Nothing reaches a file before the whole
 * run succeeded.
 */
abstract class SourceWriter {

  private final CodegenContext context;

  SourceWriter(CodegenContext context) {
    this.context = context;
  }

  CodegenContext getContext() {
    return context;
  }

  void write(Declaration declaration) throws ConsistencyException {
    context.emittedTypes().add(declaration.name());
    context.output().append(context.renderer().renderDeclaration(declaration));
  }
}
