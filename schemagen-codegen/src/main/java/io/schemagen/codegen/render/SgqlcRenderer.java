package io.schemagen.codegen.render;

import io.schemagen.codegen.declaration.ArgumentDeclaration;
import io.schemagen.codegen.declaration.ArgumentDefault;
import io.schemagen.codegen.declaration.Capability;
import io.schemagen.codegen.declaration.Declaration;
import io.schemagen.codegen.declaration.FieldDeclaration;
import io.schemagen.codegen.declaration.TypeReference;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/**
 * Renders a Python module declaring the schema with the {@code sgqlc.types} client runtime.
 *
 * <p>Forward references are written as quoted type names, which {@code sgqlc} resolves against the
 * schema object the first time the field is used.
 */
public class SgqlcRenderer implements DeclarationRenderer {

  private static final String BAR = StringUtils.repeat('#', 72);

  private final String schemaName;

  public SgqlcRenderer(String schemaName) {
    this.schemaName = schemaName;
  }

  @Override
  public String renderHeader(boolean usesDateTime, boolean usesPagination) {
    StringBuilder sb = new StringBuilder("import sgqlc.types\n");
    if (usesDateTime) {
      sb.append("import sgqlc.types.datetime\n");
    }
    if (usesPagination) {
      sb.append("import sgqlc.types.relay\n");
    }
    sb.append("\n\n").append(schemaName).append(" = sgqlc.types.Schema()\n\n\n");
    if (usesPagination) {
      sb.append("# Unexport Node/PageInfo, let schema re-declare them\n")
          .append(schemaName)
          .append(" -= sgqlc.types.relay.Node\n")
          .append(schemaName)
          .append(" -= sgqlc.types.relay.PageInfo\n\n\n");
    }
    return sb.toString();
  }

  @Override
  public String renderBanner(String title) {
    return "\n" + BAR + "\n# " + title + "\n" + BAR + "\n";
  }

  @Override
  public String renderDeclaration(Declaration declaration) {
    if (declaration instanceof Declaration.Scalar scalar) {
      return renderScalar(scalar);
    } else if (declaration instanceof Declaration.Enumeration enumeration) {
      return renderEnum(enumeration);
    } else if (declaration instanceof Declaration.Container container) {
      return renderContainer(container);
    } else if (declaration instanceof Declaration.Union union) {
      return renderUnion(union);
    }
    throw new IllegalArgumentException("Unknown declaration " + declaration);
  }

  @Override
  public String renderEntryPoints(String queryType, String mutationType, String subscriptionType) {
    return String.format(
        "%1$s.query_type = %2$s\n%1$s.mutation_type = %3$s\n%1$s.subscription_type = %4$s\n\n",
        schemaName, rootName(queryType), rootName(mutationType), rootName(subscriptionType));
  }

  private String renderScalar(Declaration.Scalar scalar) {
    String name = scalar.name();
    return switch (scalar.flavor()) {
      case BUILTIN -> name + " = sgqlc.types." + name + "\n\n";
      case DATETIME -> name + " = sgqlc.types.datetime." + name + "\n\n";
      case CUSTOM -> classHeader(name, "sgqlc.types.Scalar") + "\n\n";
    };
  }

  private String renderEnum(Declaration.Enumeration enumeration) {
    return classHeader(enumeration.name(), "sgqlc.types.Enum")
        + "    __choices__ = "
        + PythonLiterals.tupleRepr(enumeration.choices())
        + "\n\n\n";
  }

  private String renderContainer(Declaration.Container container) {
    List<String> bases = new ArrayList<>();
    bases.add(baseOf(container.capability()));
    bases.addAll(container.interfaces());

    List<String> identifiers =
        container.fields().stream().map(FieldDeclaration::identifier).toList();
    StringBuilder sb =
        new StringBuilder(classHeader(container.name(), String.join(", ", bases)))
            .append("    __field_names__ = ")
            .append(PythonLiterals.tupleRepr(identifiers))
            .append('\n');
    for (FieldDeclaration field : container.fields()) {
      sb.append("    ")
          .append(field.identifier())
          .append(" = sgqlc.types.Field(")
          .append(renderReference(field.type()))
          .append(", graphql_name=")
          .append(PythonLiterals.stringRepr(field.graphqlName()));
      if (field.hasArgs()) {
        sb.append(", args=sgqlc.types.ArgDict((\n");
        for (ArgumentDeclaration arg : field.args()) {
          sb.append("        (")
              .append(PythonLiterals.stringRepr(arg.identifier()))
              .append(", sgqlc.types.Arg(")
              .append(renderReference(arg.type()))
              .append(", graphql_name=")
              .append(PythonLiterals.stringRepr(arg.graphqlName()))
              .append(", default=")
              .append(renderDefault(arg.defaultValue()))
              .append(")),\n");
        }
        sb.append("))\n    ");
      }
      sb.append(")\n");
    }
    return sb.append("\n\n").toString();
  }

  private String renderUnion(Declaration.Union union) {
    List<String> members = union.possibleTypes();
    return classHeader(union.name(), "sgqlc.types.Union")
        + "    __types__ = ("
        + String.join(", ", members)
        + (members.size() == 1 ? "," : "")
        + ")\n\n\n";
  }

  private String classHeader(String name, String bases) {
    return "class " + name + "(" + bases + "):\n    __schema__ = " + schemaName + "\n";
  }

  static String renderReference(TypeReference reference) {
    if (reference instanceof TypeReference.NonNull nonNull) {
      return "sgqlc.types.non_null(" + renderReference(nonNull.ofType()) + ")";
    } else if (reference instanceof TypeReference.ListOf listOf) {
      return "sgqlc.types.list_of(" + renderReference(listOf.ofType()) + ")";
    } else if (reference instanceof TypeReference.Resolved resolved) {
      return resolved.name();
    } else if (reference instanceof TypeReference.Forward forward) {
      return PythonLiterals.stringRepr(forward.name());
    }
    throw new IllegalArgumentException("Unknown type reference " + reference);
  }

  static String renderDefault(ArgumentDefault defaultValue) {
    if (defaultValue == null) {
      return "None";
    } else if (defaultValue instanceof ArgumentDefault.VariableDefault variable) {
      return "sgqlc.types.Variable(" + PythonLiterals.stringRepr(variable.variableName()) + ")";
    }
    return PythonLiterals.repr(((ArgumentDefault.LiteralDefault) defaultValue).value());
  }

  private static String baseOf(Capability capability) {
    return switch (capability) {
      case OBJECT -> "sgqlc.types.Type";
      case INTERFACE -> "sgqlc.types.Interface";
      case INPUT -> "sgqlc.types.Input";
      case CONNECTION -> "sgqlc.types.relay.Connection";
    };
  }

  private static String rootName(String name) {
    return name == null ? "None" : name;
  }
}
