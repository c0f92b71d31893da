package io.schemagen.codegen.introspection;

import io.schemagen.codegen.declaration.Declaration;

class EnumVisitor extends AbstractVisitor {

  EnumVisitor(CodegenContext context) {
    super(context);
  }

  @Override
  Declaration generateDeclaration(Type type) {
    return new Declaration.Enumeration(
        type.getName(), type.getEnumValues().stream().map(EnumValue::getName).toList());
  }
}
