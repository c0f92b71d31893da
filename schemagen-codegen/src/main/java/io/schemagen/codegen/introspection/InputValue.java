package io.schemagen.codegen.introspection;

/** An argument of an output field, or a field of an input object. */
public class InputValue {

  private String name;
  private String description;
  private TypeRef type;
  private String defaultValue;

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

  public TypeRef getType() {
    return type;
  }

  public void setType(TypeRef type) {
    this.type = type;
  }

  /** Raw GraphQL literal of the default value, a {@code $variable} reference, or null. */
  public String getDefaultValue() {
    return defaultValue;
  }

  public void setDefaultValue(String defaultValue) {
    this.defaultValue = defaultValue;
  }

  public boolean hasDefaultValue() {
    return defaultValue != null && !defaultValue.isEmpty();
  }

  @Override
  public String toString() {
    return "InputValue{"
        + "name='"
        + name
        + '\''
        + ", type="
        + type
        + ", defaultValue='"
        + defaultValue
        + '\''
        + '}';
  }
}
