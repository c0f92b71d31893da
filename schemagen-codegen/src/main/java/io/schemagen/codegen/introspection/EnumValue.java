package io.schemagen.codegen.introspection;

import jakarta.json.bind.annotation.JsonbProperty;

public class EnumValue {

  private String name;
  private String description;

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
    return "EnumValue{" + "name='" + name + '\'' + ", deprecated=" + deprecated + '}';
  }
}
