package io.schemagen.codegen.introspection;

import java.util.List;

/** Result of {@link TypeClassifier#classify}: one ordered bucket per {@link EmissionPhase}. */
public record ClassifiedTypes(
    List<Type> scalarsAndEnums,
    List<Type> inputObjects,
    List<Type> outputObjectsAndInterfaces,
    List<Type> unions) {

  public List<Type> get(EmissionPhase phase) {
    return switch (phase) {
      case SCALARS_AND_ENUMS -> scalarsAndEnums;
      case INPUT_OBJECTS -> inputObjects;
      case OUTPUT_OBJECTS_AND_INTERFACES -> outputObjectsAndInterfaces;
      case UNIONS -> unions;
    };
  }
}
