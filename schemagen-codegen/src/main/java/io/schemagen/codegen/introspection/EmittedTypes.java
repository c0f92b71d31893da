package io.schemagen.codegen.introspection;

import io.schemagen.codegen.exceptions.ConsistencyException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Names declared so far, in declaration order. Grows by one entry per declaration. */
public class EmittedTypes {

  private final Set<String> names = new LinkedHashSet<>();

  public void add(String name) throws ConsistencyException {
    if (!names.add(name)) {
      throw new ConsistencyException(String.format("Type %s is declared twice", name));
    }
  }

  public boolean contains(String name) {
    return names.contains(name);
  }

  public int size() {
    return names.size();
  }

  public List<String> asList() {
    return List.copyOf(names);
  }
}
