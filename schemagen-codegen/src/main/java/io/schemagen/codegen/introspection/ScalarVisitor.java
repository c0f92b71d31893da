package io.schemagen.codegen.introspection;

import io.schemagen.codegen.declaration.Declaration;
import io.schemagen.codegen.declaration.ScalarFlavor;

class ScalarVisitor extends AbstractVisitor {

  ScalarVisitor(CodegenContext context) {
    super(context);
  }

  @Override
  Declaration generateDeclaration(Type type) {
    String name = type.getName();
    ScalarFlavor flavor;
    if (BuiltinTypes.SCALARS.contains(name)) {
      flavor = ScalarFlavor.BUILTIN;
    } else if (BuiltinTypes.DATETIME_SCALARS.contains(name)) {
      flavor = ScalarFlavor.DATETIME;
    } else {
      flavor = ScalarFlavor.CUSTOM;
    }
    return new Declaration.Scalar(name, flavor);
  }
}
