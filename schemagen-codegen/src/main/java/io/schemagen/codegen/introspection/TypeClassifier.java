package io.schemagen.codegen.introspection;

import io.schemagen.codegen.exceptions.ConsistencyException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Splits the schema types into the emission phases. Each phase only looks at what the previous
 * phases left over, so a type is claimed exactly once.
 */
public class TypeClassifier {

  private final DependencyOrder dependencyOrder;

  public TypeClassifier() {
    this(new DependencyOrder());
  }

  public TypeClassifier(DependencyOrder dependencyOrder) {
    this.dependencyOrder = dependencyOrder;
  }

  /**
   * Classifies {@code types}, keeping their relative order except in the output objects and
   * interfaces bucket, which is put in dependency order.
   *
   * @param types the schema types, usually sorted by name
   * @return the four buckets
   * @throws ConsistencyException if some type is claimed by no phase, or the interfaces form a
   *     cycle
   */
  public ClassifiedTypes classify(List<Type> types) throws ConsistencyException {
    Map<EmissionPhase, List<Type>> buckets = new EnumMap<>(EmissionPhase.class);
    List<Type> todo = types;
    for (EmissionPhase phase : EmissionPhase.values()) {
      List<Type> claimed = new ArrayList<>();
      List<Type> remaining = new ArrayList<>();
      for (Type type : todo) {
        if (phase.claims(type)) {
          claimed.add(type);
        } else {
          remaining.add(type);
        }
      }
      buckets.put(phase, claimed);
      todo = remaining;
    }

    if (!todo.isEmpty()) {
      throw new ConsistencyException(
          "Types not claimed by any emission phase: "
              + todo.stream()
                  .map(t -> t.getName() + " (" + t.getKind() + ")")
                  .collect(Collectors.joining(", ")));
    }

    return new ClassifiedTypes(
        List.copyOf(buckets.get(EmissionPhase.SCALARS_AND_ENUMS)),
        List.copyOf(buckets.get(EmissionPhase.INPUT_OBJECTS)),
        dependencyOrder.sort(buckets.get(EmissionPhase.OUTPUT_OBJECTS_AND_INTERFACES)),
        List.copyOf(buckets.get(EmissionPhase.UNIONS)));
  }
}
