package io.schemagen.codegen.render;

import io.schemagen.codegen.declaration.Declaration;

/** Turns declarations into the concrete syntax of a target runtime. */
public interface DeclarationRenderer {

  /**
   * Module preamble: imports, the schema object, and the fixups the optional support modules need.
   */
  String renderHeader(boolean usesDateTime, boolean usesPagination);

  String renderBanner(String title);

  String renderDeclaration(Declaration declaration);

  /** Assigns the root operation types; a null name means the schema has no such root. */
  String renderEntryPoints(String queryType, String mutationType, String subscriptionType);
}
