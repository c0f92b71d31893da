package io.schemagen.codegen.introspection;

/**
 * A reference to a type as found in a field or argument: either a named type or an anonymous
 * LIST/NON_NULL wrapper around another reference.
 */
public class TypeRef {

  private TypeKind kind;
  private String name;
  private TypeRef ofType;

  public TypeRef() {}

  TypeRef(TypeKind kind, String name, TypeRef ofType) {
    this.kind = kind;
    this.name = name;
    this.ofType = ofType;
  }

  public static TypeRef named(TypeKind kind, String name) {
    return new TypeRef(kind, name, null);
  }

  public static TypeRef nonNull(TypeRef ofType) {
    return new TypeRef(TypeKind.NON_NULL, null, ofType);
  }

  public static TypeRef listOf(TypeRef ofType) {
    return new TypeRef(TypeKind.LIST, null, ofType);
  }

  public TypeKind getKind() {
    return kind;
  }

  public void setKind(TypeKind kind) {
    this.kind = kind;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public TypeRef getOfType() {
    return ofType;
  }

  public void setOfType(TypeRef ofType) {
    this.ofType = ofType;
  }

  @Override
  public String toString() {
    if (kind == TypeKind.NON_NULL) {
      return ofType + "!";
    } else if (kind == TypeKind.LIST) {
      return "[" + ofType + "]";
    }
    return String.valueOf(name);
  }
}
