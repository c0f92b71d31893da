package io.schemagen.codegen.introspection;

import io.schemagen.codegen.exceptions.CodegenException;

/** Receives the parts of a schema in emission order, see {@link Schema#visit}. */
public interface SchemaVisitor {

  void visitHeader() throws CodegenException;

  void visitPhase(EmissionPhase phase) throws CodegenException;

  void visitScalar(Type type) throws CodegenException;

  void visitEnum(Type type) throws CodegenException;

  void visitInput(Type type) throws CodegenException;

  void visitInterface(Type type) throws CodegenException;

  void visitObject(Type type) throws CodegenException;

  void visitUnion(Type type) throws CodegenException;

  void visitEntryPoints() throws CodegenException;
}
