package io.schemagen.codegen.introspection;

import io.schemagen.codegen.declaration.TypeReference;
import io.schemagen.codegen.exceptions.ConsistencyException;
import java.util.Set;

/**
 * Resolves field and argument types against what has been declared so far.
 *
 * <p>A named type becomes a {@link TypeReference.Resolved} reference only when it is already
 * declared and no field of the declaration being written carries the same name, since such a field
 * would hide the type inside the declaration body. Everything else is a {@link
 * TypeReference.Forward} reference.
 */
public class TypeReferenceResolver {

  private final EmittedTypes emittedTypes;

  public TypeReferenceResolver(EmittedTypes emittedTypes) {
    this.emittedTypes = emittedTypes;
  }

  /**
   * @param ref the introspection type reference, possibly wrapped
   * @param siblings names of the fields of the declaration being written
   */
  public TypeReference resolve(TypeRef ref, Set<String> siblings) throws ConsistencyException {
    if (ref == null || ref.getKind() == null) {
      throw new ConsistencyException("Missing type reference");
    }
    switch (ref.getKind()) {
      case NON_NULL:
        return new TypeReference.NonNull(resolve(wrapped(ref), siblings));
      case LIST:
        return new TypeReference.ListOf(resolve(wrapped(ref), siblings));
      default:
        break;
    }

    String name = ref.getName();
    if (name == null) {
      throw new ConsistencyException("Type reference of kind " + ref.getKind() + " has no name");
    }
    if (emittedTypes.contains(name) && !siblings.contains(name)) {
      return new TypeReference.Resolved(name);
    }
    return new TypeReference.Forward(name);
  }

  private static TypeRef wrapped(TypeRef ref) throws ConsistencyException {
    if (ref.getOfType() == null) {
      throw new ConsistencyException(ref.getKind() + " type reference does not wrap any type");
    }
    return ref.getOfType();
  }
}
