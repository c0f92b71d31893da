package io.schemagen.codegen.declaration;

/**
 * @param identifier the output name of the argument
 * @param graphqlName the argument name in the schema
 * @param type resolved type of the argument
 * @param defaultValue the default, or null when the schema declares none
 */
public record ArgumentDeclaration(
    String identifier, String graphqlName, TypeReference type, ArgumentDefault defaultValue) {}
