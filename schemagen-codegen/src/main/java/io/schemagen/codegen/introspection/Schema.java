package io.schemagen.codegen.introspection;

import static java.util.Comparator.comparing;

import io.schemagen.codegen.exceptions.CodegenException;
import io.schemagen.codegen.exceptions.SchemaFormatException;
import jakarta.json.Json;
import jakarta.json.JsonException;
import jakarta.json.JsonObject;
import jakarta.json.JsonReader;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;
import jakarta.json.bind.Jsonb;
import jakarta.json.bind.JsonbBuilder;
import jakarta.json.bind.JsonbException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The introspection schema: every named type sorted by name, the root operation types and the
 * directives. Built once by {@link #initialize} or {@link #parse} and only read afterwards.
 */
public class Schema {

  private static final Logger LOG = LoggerFactory.getLogger(Schema.class);

  private static final Jsonb JSONB = JsonbBuilder.create();

  private RootType queryType;
  private RootType mutationType;
  private RootType subscriptionType;
  private List<Type> types;
  private List<Directive> directives;

  private Map<String, Type> typeByName = Map.of();
  private boolean usesDateTime;
  private boolean usesPagination;

  public static Schema initialize(InputStream in) throws IOException, SchemaFormatException {
    return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
  }

  /**
   * Parses an introspection document. The introspection object may be given as is, wrapped in a
   * query result ({@code {"data": {"__schema": ...}}}) or under a {@code __schema} key.
   *
   * @param json the document text
   * @return the loaded schema
   * @throws SchemaFormatException if the document is not a JSON object of a known shape
   */
  public static Schema parse(String json) throws SchemaFormatException {
    JsonValue document;
    try (JsonReader reader = Json.createReader(new StringReader(json))) {
      document = reader.readValue();
    } catch (JsonException e) {
      throw new SchemaFormatException("schema is not valid JSON: " + e.getMessage(), e);
    }
    if (document.getValueType() != JsonValue.ValueType.OBJECT) {
      throw new SchemaFormatException("schema must be a JSON object");
    }

    JsonObject introspection = unwrap(document.asJsonObject());
    if (!isPresent(introspection, "types")) {
      throw new SchemaFormatException("introspection object has no types");
    }

    Schema schema;
    try {
      schema = JSONB.fromJson(introspection.toString(), Schema.class);
    } catch (JsonbException e) {
      throw new SchemaFormatException("cannot read introspection object: " + e.getMessage(), e);
    }
    schema.index();
    LOG.debug(
        "Loaded schema with {} types and {} directives (date/time: {}, pagination: {})",
        schema.types.size(),
        schema.getDirectives().size(),
        schema.usesDateTime,
        schema.usesPagination);
    return schema;
  }

  private static JsonObject unwrap(JsonObject document) throws SchemaFormatException {
    if (isPresent(document, "types")) {
      return document;
    }
    if (isPresent(document, "data")
        && document.get("data").getValueType() == JsonValue.ValueType.OBJECT) {
      JsonObject data = document.getJsonObject("data");
      if (isPresent(data, "__schema")) {
        return asObject(data.get("__schema"));
      }
    }
    if (isPresent(document, "__schema")) {
      return asObject(document.get("__schema"));
    }
    throw new SchemaFormatException("schema must be introspection object or query result");
  }

  private static JsonObject asObject(JsonValue value) throws SchemaFormatException {
    if (value.getValueType() != JsonValue.ValueType.OBJECT) {
      throw new SchemaFormatException("__schema must be a JSON object");
    }
    return value.asJsonObject();
  }

  /** A key is present when its value is neither null, false, nor an empty array or object. */
  private static boolean isPresent(JsonObject object, String key) {
    JsonValue value = object.get(key);
    if (value == null) {
      return false;
    }
    return switch (value.getValueType()) {
      case NULL, FALSE -> false;
      case ARRAY -> !value.asJsonArray().isEmpty();
      case OBJECT -> !value.asJsonObject().isEmpty();
      case STRING -> !((JsonString) value).getString().isEmpty();
      default -> true;
    };
  }

  private void index() {
    if (types == null) {
      types = List.of();
    }
    Map<String, Type> byName = new LinkedHashMap<>();
    for (Type type : types) {
      byName.put(type.getName(), type);
      if (BuiltinTypes.DATETIME_SCALARS.contains(type.getName())) {
        usesDateTime = true;
      } else if (BuiltinTypes.PAGINATION_TYPES.contains(type.getName())) {
        usesPagination = true;
      }
    }
    typeByName = Collections.unmodifiableMap(byName);
  }

  public RootType getQueryType() {
    return queryType;
  }

  public void setQueryType(RootType queryType) {
    this.queryType = queryType;
  }

  public RootType getMutationType() {
    return mutationType;
  }

  public void setMutationType(RootType mutationType) {
    this.mutationType = mutationType;
  }

  public RootType getSubscriptionType() {
    return subscriptionType;
  }

  public void setSubscriptionType(RootType subscriptionType) {
    this.subscriptionType = subscriptionType;
  }

  public List<Type> getTypes() {
    return types;
  }

  public void setTypes(List<Type> types) {
    this.types = types == null ? null : types.stream().sorted(comparing(Type::getName)).toList();
  }

  public List<Directive> getDirectives() {
    return directives == null ? List.of() : directives;
  }

  public void setDirectives(List<Directive> directives) {
    this.directives = directives;
  }

  public Type getType(String name) {
    return typeByName.get(name);
  }

  public String getQueryTypeName() {
    return queryType == null ? null : queryType.getName();
  }

  public String getMutationTypeName() {
    return mutationType == null ? null : mutationType.getName();
  }

  public String getSubscriptionTypeName() {
    return subscriptionType == null ? null : subscriptionType.getName();
  }

  /** True when the schema declares one of the date/time scalars. */
  public boolean usesDateTime() {
    return usesDateTime;
  }

  /** True when the schema declares the pagination {@code Node} or {@code PageInfo} types. */
  public boolean usesPagination() {
    return usesPagination;
  }

  /**
   * Walks the types phase by phase in emission order. Introspection meta types are skipped.
   *
   * @param visitor receives the header, each phase with its types, then the entry points
   * @throws CodegenException if classification or the visitor fails
   */
  public void visit(SchemaVisitor visitor) throws CodegenException {
    ClassifiedTypes classified = new TypeClassifier().classify(types);

    visitor.visitHeader();
    for (EmissionPhase phase : EmissionPhase.values()) {
      visitor.visitPhase(phase);
      for (Type type : classified.get(phase)) {
        if (BuiltinTypes.isIntrospectionType(type)) {
          continue;
        }
        switch (type.getKind()) {
          case SCALAR -> visitor.visitScalar(type);
          case ENUM -> visitor.visitEnum(type);
          case INPUT_OBJECT -> visitor.visitInput(type);
          case INTERFACE -> visitor.visitInterface(type);
          case OBJECT -> visitor.visitObject(type);
          case UNION -> visitor.visitUnion(type);
          default -> throw new IllegalStateException("Unexpected kind " + type.getKind());
        }
      }
    }
    visitor.visitEntryPoints();
  }

  @Override
  public String toString() {
    return "Schema{"
        + "queryType="
        + queryType
        + ", mutationType="
        + mutationType
        + ", subscriptionType="
        + subscriptionType
        + ", types="
        + types
        + '}';
  }
}
