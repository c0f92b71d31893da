package io.schemagen.codegen.introspection;

import io.schemagen.codegen.declaration.ArgumentDeclaration;
import io.schemagen.codegen.declaration.ArgumentDefault;
import io.schemagen.codegen.declaration.Declaration;
import io.schemagen.codegen.declaration.FieldDeclaration;
import io.schemagen.codegen.exceptions.CodegenException;
import io.schemagen.codegen.exceptions.ConsistencyException;
import io.schemagen.codegen.exceptions.LiteralParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

abstract class AbstractVisitor extends SourceWriter {

  AbstractVisitor(CodegenContext context) {
    super(context);
  }

  void visit(Type type) throws CodegenException {
    Declaration declaration = generateDeclaration(type);
    write(declaration);
  }

  Schema getSchema() {
    return getContext().schema();
  }

  abstract Declaration generateDeclaration(Type type) throws CodegenException;

  List<FieldDeclaration> outputFields(Type owner, List<Field> fields) throws CodegenException {
    List<String> identifiers = identifiers(owner, fields.stream().map(Field::getName).toList());
    Set<String> siblings = siblings(fields.stream().map(Field::getName).toList(), identifiers);

    List<FieldDeclaration> declarations = new ArrayList<>(fields.size());
    for (int i = 0; i < fields.size(); i++) {
      Field field = fields.get(i);
      declarations.add(
          new FieldDeclaration(
              identifiers.get(i),
              field.getName(),
              getContext().resolver().resolve(field.getType(), siblings),
              arguments(owner, field, siblings)));
    }
    return declarations;
  }

  List<FieldDeclaration> inputFields(Type owner, List<InputValue> fields)
      throws ConsistencyException {
    List<String> identifiers =
        identifiers(owner, fields.stream().map(InputValue::getName).toList());
    Set<String> siblings =
        siblings(fields.stream().map(InputValue::getName).toList(), identifiers);

    List<FieldDeclaration> declarations = new ArrayList<>(fields.size());
    for (int i = 0; i < fields.size(); i++) {
      InputValue field = fields.get(i);
      declarations.add(
          new FieldDeclaration(
              identifiers.get(i),
              field.getName(),
              getContext().resolver().resolve(field.getType(), siblings),
              List.of()));
    }
    return declarations;
  }

  private List<ArgumentDeclaration> arguments(Type owner, Field field, Set<String> siblings)
      throws CodegenException {
    List<InputValue> args = field.getArgs();
    List<String> identifiers =
        identifiers(owner, args.stream().map(InputValue::getName).toList());

    List<ArgumentDeclaration> declarations = new ArrayList<>(args.size());
    for (int i = 0; i < args.size(); i++) {
      InputValue arg = args.get(i);
      declarations.add(
          new ArgumentDeclaration(
              identifiers.get(i),
              arg.getName(),
              getContext().resolver().resolve(arg.getType(), siblings),
              defaultValue(arg)));
    }
    return declarations;
  }

  private ArgumentDefault defaultValue(InputValue arg) throws LiteralParseException {
    if (!arg.hasDefaultValue()) {
      return null;
    }
    String text = arg.getDefaultValue();
    if (text.startsWith("$")) {
      return new ArgumentDefault.VariableDefault(text.substring(1));
    }
    return new ArgumentDefault.LiteralDefault(getContext().literalEvaluator().evaluate(text));
  }

  /** Output identifiers of {@code names}; two names may not share one identifier. */
  private List<String> identifiers(Type owner, List<String> names) throws ConsistencyException {
    Map<String, String> seen = new HashMap<>();
    List<String> identifiers = new ArrayList<>(names.size());
    for (String name : names) {
      String identifier = getContext().namer().toIdentifier(name);
      String previous = seen.putIfAbsent(identifier, name);
      if (previous != null && !previous.equals(name)) {
        throw new ConsistencyException(
            String.format(
                "%s: '%s' and '%s' both map to identifier '%s'",
                owner.getName(), previous, name, identifier));
      }
      identifiers.add(identifier);
    }
    return identifiers;
  }

  private static Set<String> siblings(List<String> names, List<String> identifiers) {
    Set<String> siblings = new HashSet<>(names);
    siblings.addAll(identifiers);
    return siblings;
  }
}
