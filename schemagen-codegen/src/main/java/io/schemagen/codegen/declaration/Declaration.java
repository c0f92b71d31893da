package io.schemagen.codegen.declaration;

import java.util.List;

/** One declaration of the generated output. */
public sealed interface Declaration
    permits Declaration.Scalar,
        Declaration.Enumeration,
        Declaration.Container,
        Declaration.Union {

  String name();

  record Scalar(String name, ScalarFlavor flavor) implements Declaration {}

  record Enumeration(String name, List<String> choices) implements Declaration {}

  /**
   * An input object, interface or object.
   *
   * @param capability the runtime base type
   * @param interfaces implemented interfaces, all declared before this one
   * @param fields own fields, excluding those inherited from {@code interfaces}
   */
  record Container(
      String name, Capability capability, List<String> interfaces, List<FieldDeclaration> fields)
      implements Declaration {}

  record Union(String name, List<String> possibleTypes) implements Declaration {}
}
