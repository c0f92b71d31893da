package io.schemagen.codegen.exceptions;

/**
 * An internal invariant of the generation pipeline does not hold, e.g. an implemented interface
 * was not declared before its implementor. Usually points to an incomplete or cyclic schema.
 */
public class ConsistencyException extends CodegenException {

  public ConsistencyException(String message) {
    super(message);
  }
}
