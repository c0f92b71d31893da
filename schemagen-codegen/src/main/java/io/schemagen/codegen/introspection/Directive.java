package io.schemagen.codegen.introspection;

import java.util.List;

public class Directive {

  private String name;
  private String description;
  private List<String> locations;
  private List<InputValue> args;

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public List<String> getLocations() {
    return locations == null ? List.of() : locations;
  }

  public void setLocations(List<String> locations) {
    this.locations = locations;
  }

  public List<InputValue> getArgs() {
    return args == null ? List.of() : args;
  }

  public void setArgs(List<InputValue> args) {
    this.args = args;
  }

  @Override
  public String toString() {
    return "Directive{" + "name='" + name + '\'' + ", args=" + args + '}';
  }
}
