package io.schemagen.codegen.introspection;

import java.util.EnumSet;
import java.util.Set;

/** The four phases declarations are emitted in, each claiming a fixed set of kinds. */
public enum EmissionPhase {
  SCALARS_AND_ENUMS("Scalars and Enumerations", EnumSet.of(TypeKind.SCALAR, TypeKind.ENUM)),
  INPUT_OBJECTS("Input Objects", EnumSet.of(TypeKind.INPUT_OBJECT)),
  OUTPUT_OBJECTS_AND_INTERFACES(
      "Output Objects and Interfaces", EnumSet.of(TypeKind.OBJECT, TypeKind.INTERFACE)),
  UNIONS("Unions", EnumSet.of(TypeKind.UNION));

  private final String banner;
  private final Set<TypeKind> kinds;

  EmissionPhase(String banner, Set<TypeKind> kinds) {
    this.banner = banner;
    this.kinds = kinds;
  }

  public String getBanner() {
    return banner;
  }

  public boolean claims(Type type) {
    return type.getKind() != null && kinds.contains(type.getKind());
  }
}
