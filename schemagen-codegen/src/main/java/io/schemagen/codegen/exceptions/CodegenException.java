package io.schemagen.codegen.exceptions;

/** Base class of every failure that aborts a generation run. */
public abstract class CodegenException extends Exception {

  public CodegenException(String message) {
    super(message);
  }

  public CodegenException(String message, Throwable cause) {
    super(message, cause);
  }
}
