package io.schemagen.codegen.introspection;

import java.util.Set;

/** Type names the generator treats specially. */
public final class BuiltinTypes {

  public static final Set<String> SCALARS = Set.of("Int", "Float", "String", "Boolean", "ID");

  public static final Set<String> DATETIME_SCALARS = Set.of("DateTime", "Date", "Time");

  /** Node identity and page info types of the cursor pagination (Relay) convention. */
  public static final Set<String> PAGINATION_TYPES = Set.of("Node", "PageInfo");

  public static final String CONNECTION_SUFFIX = "Connection";

  public static final Set<String> INTROSPECTION_ENUMS = Set.of("__TypeKind", "__DirectiveLocation");

  public static final Set<String> INTROSPECTION_OBJECTS =
      Set.of("__Schema", "__Type", "__Field", "__Directive", "__EnumValue", "__InputValue");

  private BuiltinTypes() {}

  /** Introspection meta types are claimed by their phase but never declared. */
  public static boolean isIntrospectionType(Type type) {
    return switch (type.getKind()) {
      case ENUM -> INTROSPECTION_ENUMS.contains(type.getName());
      case OBJECT -> INTROSPECTION_OBJECTS.contains(type.getName());
      default -> false;
    };
  }
}
