package io.schemagen.codegen.introspection;

import io.schemagen.codegen.declaration.Capability;
import io.schemagen.codegen.declaration.Declaration;
import io.schemagen.codegen.exceptions.CodegenException;
import java.util.List;

class InterfaceVisitor extends AbstractVisitor {

  InterfaceVisitor(CodegenContext context) {
    super(context);
  }

  @Override
  Declaration generateDeclaration(Type type) throws CodegenException {
    return new Declaration.Container(
        type.getName(), Capability.INTERFACE, List.of(), outputFields(type, type.getFields()));
  }
}
