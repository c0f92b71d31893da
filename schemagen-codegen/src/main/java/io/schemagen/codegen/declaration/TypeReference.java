package io.schemagen.codegen.declaration;

/**
 * How a declaration refers to another type. {@link Resolved} points at a type declared earlier in
 * the output; {@link Forward} names a type the target runtime has to look up lazily, at first use.
 */
public sealed interface TypeReference
    permits TypeReference.NonNull,
        TypeReference.ListOf,
        TypeReference.Resolved,
        TypeReference.Forward {

  /** Name of the innermost named type. */
  String typeName();

  record NonNull(TypeReference ofType) implements TypeReference {
    @Override
    public String typeName() {
      return ofType.typeName();
    }
  }

  record ListOf(TypeReference ofType) implements TypeReference {
    @Override
    public String typeName() {
      return ofType.typeName();
    }
  }

  record Resolved(String name) implements TypeReference {
    @Override
    public String typeName() {
      return name;
    }
  }

  record Forward(String name) implements TypeReference {
    @Override
    public String typeName() {
      return name;
    }
  }
}
