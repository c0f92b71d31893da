package io.schemagen.codegen.introspection;

import io.schemagen.codegen.exceptions.ConsistencyException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Orders output objects and interfaces so that every interface comes before the types
 * implementing it, directly or through other interfaces.
 *
 * <p>The order is a stable topological sort of the "implemented by" graph. Among the types whose
 * interfaces have all been placed, those implementing no interface at all go first, then the
 * others, each group in input order.
 */
public class DependencyOrder {

  public List<Type> sort(List<Type> types) throws ConsistencyException {
    int count = types.size();
    Map<String, Integer> indexByName = new HashMap<>();
    for (int i = 0; i < count; i++) {
      indexByName.put(types.get(i).getName(), i);
    }

    int[] pending = new int[count];
    List<List<Integer>> implementors = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      implementors.add(new ArrayList<>());
    }
    for (int i = 0; i < count; i++) {
      for (String iface : types.get(i).getInterfaceNames()) {
        // interfaces outside of this bucket do not constrain the order
        Integer dependency = indexByName.get(iface);
        if (dependency != null) {
          pending[i]++;
          implementors.get(dependency).add(i);
        }
      }
    }

    PriorityQueue<Integer> ready =
        new PriorityQueue<>(
            Comparator.comparing((Integer i) -> types.get(i).hasInterfaces())
                .thenComparingInt(i -> i));
    for (int i = 0; i < count; i++) {
      if (pending[i] == 0) {
        ready.add(i);
      }
    }

    List<Type> sorted = new ArrayList<>(count);
    while (!ready.isEmpty()) {
      int next = ready.poll();
      sorted.add(types.get(next));
      for (int implementor : implementors.get(next)) {
        if (--pending[implementor] == 0) {
          ready.add(implementor);
        }
      }
    }

    if (sorted.size() != count) {
      List<String> cyclic = new ArrayList<>();
      for (int i = 0; i < count; i++) {
        if (pending[i] > 0) {
          cyclic.add(types.get(i).getName());
        }
      }
      throw new ConsistencyException(
          "Cyclic interface implementation between: " + String.join(", ", cyclic));
    }
    return List.copyOf(sorted);
  }
}
