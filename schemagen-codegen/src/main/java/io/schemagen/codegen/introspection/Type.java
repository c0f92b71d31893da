package io.schemagen.codegen.introspection;

import java.util.List;

/** A named type of the schema. Wrapper kinds never appear here, only inside a {@link TypeRef}. */
public class Type {

  private TypeKind kind;
  private String name;
  private String description;
  private List<Field> fields;
  private List<InputValue> inputFields;
  private List<TypeRef> interfaces;
  private List<TypeRef> possibleTypes;
  private List<EnumValue> enumValues;

  public TypeKind getKind() {
    return kind;
  }

  public void setKind(TypeKind kind) {
    this.kind = kind;
  }

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

  public List<Field> getFields() {
    return fields == null ? List.of() : fields;
  }

  public void setFields(List<Field> fields) {
    this.fields = fields;
  }

  public List<InputValue> getInputFields() {
    return inputFields == null ? List.of() : inputFields;
  }

  public void setInputFields(List<InputValue> inputFields) {
    this.inputFields = inputFields;
  }

  public List<TypeRef> getInterfaces() {
    return interfaces == null ? List.of() : interfaces;
  }

  public void setInterfaces(List<TypeRef> interfaces) {
    this.interfaces = interfaces;
  }

  public List<TypeRef> getPossibleTypes() {
    return possibleTypes == null ? List.of() : possibleTypes;
  }

  public void setPossibleTypes(List<TypeRef> possibleTypes) {
    this.possibleTypes = possibleTypes;
  }

  public List<EnumValue> getEnumValues() {
    return enumValues == null ? List.of() : enumValues;
  }

  public void setEnumValues(List<EnumValue> enumValues) {
    this.enumValues = enumValues;
  }

  public boolean hasInterfaces() {
    return !getInterfaces().isEmpty();
  }

  public List<String> getInterfaceNames() {
    return getInterfaces().stream().map(TypeRef::getName).toList();
  }

  @Override
  public String toString() {
    return "Type{"
        + "kind="
        + kind
        + ", name='"
        + name
        + '\''
        + ", fields="
        + fields
        + ", inputFields="
        + inputFields
        + ", interfaces="
        + interfaces
        + ", possibleTypes="
        + possibleTypes
        + ", enumValues="
        + enumValues
        + '}';
  }
}
