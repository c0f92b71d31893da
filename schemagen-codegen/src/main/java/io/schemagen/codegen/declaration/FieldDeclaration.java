package io.schemagen.codegen.declaration;

import java.util.List;

/**
 * @param identifier the output name of the field
 * @param graphqlName the field name in the schema
 * @param type resolved type of the field
 * @param args arguments of an output field, empty for input fields
 */
public record FieldDeclaration(
    String identifier, String graphqlName, TypeReference type, List<ArgumentDeclaration> args) {

  public boolean hasArgs() {
    return !args.isEmpty();
  }
}
