package io.schemagen.codegen.introspection;

import java.util.Set;

/**
 * camelCase to snake_case, as the {@code sgqlc} runtime names its fields. Python keywords get a
 * trailing underscore.
 */
public class PythonIdentifierNamer implements IdentifierNamer {

  private static final Set<String> PYTHON_KEYWORDS =
      Set.of(
          "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
          "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
          "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
          "try", "while", "with", "yield");

  @Override
  public String toIdentifier(String graphqlName) {
    StringBuilder sb = new StringBuilder(graphqlName.length() + 4);
    for (int i = 0; i < graphqlName.length(); i++) {
      char c = graphqlName.charAt(i);
      if (Character.isUpperCase(c)) {
        if (sb.length() > 0) {
          sb.append('_');
        }
        c = Character.toLowerCase(c);
      }
      sb.append(c);
    }
    String name = sb.toString();
    return PYTHON_KEYWORDS.contains(name) ? name + "_" : name;
  }
}
