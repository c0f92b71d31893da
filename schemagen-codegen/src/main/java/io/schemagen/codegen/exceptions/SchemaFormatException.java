package io.schemagen.codegen.exceptions;

/**
 * The input document is not a JSON object, or matches none of the accepted introspection shapes.
 */
public class SchemaFormatException extends CodegenException {

  public SchemaFormatException(String message) {
    super(message);
  }

  public SchemaFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
