package io.schemagen.codegen.introspection;

/** Maps schema names of fields and arguments to identifiers of the generated code. */
@FunctionalInterface
public interface IdentifierNamer {

  String toIdentifier(String graphqlName);
}
