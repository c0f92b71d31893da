package io.schemagen.codegen.introspection;

/** The {@code queryType}, {@code mutationType} and {@code subscriptionType} entries. */
public class RootType {

  private String name;

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return "RootType{" + "name='" + name + '\'' + '}';
  }
}
