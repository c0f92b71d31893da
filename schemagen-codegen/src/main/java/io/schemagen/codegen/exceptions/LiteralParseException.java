package io.schemagen.codegen.exceptions;

public class LiteralParseException extends CodegenException {

  private final String literal;

  public LiteralParseException(String literal, String reason) {
    super(String.format("Invalid GraphQL value literal '%s': %s", literal, reason));
    this.literal = literal;
  }

  public LiteralParseException(String literal, Throwable cause) {
    super(
        String.format("Invalid GraphQL value literal '%s': %s", literal, cause.getMessage()),
        cause);
    this.literal = literal;
  }

  /** The raw literal text that failed to parse. */
  public String getLiteral() {
    return literal;
  }
}
