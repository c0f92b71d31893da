package io.schemagen.codegen.introspection;

import io.schemagen.codegen.declaration.Capability;
import io.schemagen.codegen.declaration.Declaration;
import io.schemagen.codegen.exceptions.ConsistencyException;
import java.util.List;

class InputVisitor extends AbstractVisitor {

  InputVisitor(CodegenContext context) {
    super(context);
  }

  @Override
  Declaration generateDeclaration(Type type) throws ConsistencyException {
    return new Declaration.Container(
        type.getName(), Capability.INPUT, List.of(), inputFields(type, type.getInputFields()));
  }
}
