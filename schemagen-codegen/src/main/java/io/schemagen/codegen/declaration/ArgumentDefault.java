package io.schemagen.codegen.declaration;

/** Default value of a field argument. */
public sealed interface ArgumentDefault
    permits ArgumentDefault.VariableDefault, ArgumentDefault.LiteralDefault {

  /** A {@code $name} default, bound to a query variable at run time. */
  record VariableDefault(String variableName) implements ArgumentDefault {}

  /**
   * An evaluated literal: {@code null}, a {@link Boolean}, a {@link Number}, a {@link String}, a
   * {@link java.util.List} or a {@link java.util.Map} of those.
   */
  record LiteralDefault(Object value) implements ArgumentDefault {}
}
