package io.schemagen.codegen.introspection;

import jakarta.json.bind.annotation.JsonbProperty;
import java.util.List;

public class Field {

  private String name;
  private String description;
  private TypeRef type;
  private List<InputValue> args;

  @JsonbProperty("isDeprecated")
  private boolean deprecated;

  private String deprecationReason;

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

  public List<InputValue> getArgs() {
    return args == null ? List.of() : args;
  }

  public void setArgs(List<InputValue> args) {
    this.args = args;
  }

  public boolean isDeprecated() {
    return deprecated;
  }

  public void setDeprecated(boolean deprecated) {
    this.deprecated = deprecated;
  }

  public String getDeprecationReason() {
    return deprecationReason;
  }

  public void setDeprecationReason(String deprecationReason) {
    this.deprecationReason = deprecationReason;
  }

  @Override
  public String toString() {
    return "Field{" + "name='" + name + '\'' + ", type=" + type + ", args=" + args + '}';
  }
}
