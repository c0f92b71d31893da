package io.schemagen.codegen.introspection;

import io.schemagen.codegen.declaration.Declaration;

class UnionVisitor extends AbstractVisitor {

  UnionVisitor(CodegenContext context) {
    super(context);
  }

  @Override
  Declaration generateDeclaration(Type type) {
    return new Declaration.Union(
        type.getName(), type.getPossibleTypes().stream().map(TypeRef::getName).toList());
  }
}
