package io.schemagen.codegen.introspection;

import io.schemagen.codegen.declaration.Capability;
import io.schemagen.codegen.declaration.Declaration;
import io.schemagen.codegen.exceptions.CodegenException;
import io.schemagen.codegen.exceptions.ConsistencyException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

class ObjectVisitor extends AbstractVisitor {

  ObjectVisitor(CodegenContext context) {
    super(context);
  }

  @Override
  Declaration generateDeclaration(Type type) throws CodegenException {
    String name = type.getName();
    Capability capability =
        getSchema().usesPagination() && name.endsWith(BuiltinTypes.CONNECTION_SUFFIX)
            ? Capability.CONNECTION
            : Capability.OBJECT;

    // fields of implemented interfaces are inherited, never declared again
    Set<String> inheritedFields = new HashSet<>();
    for (String ifaceName : type.getInterfaceNames()) {
      Type iface = getSchema().getType(ifaceName);
      if (iface == null) {
        throw new ConsistencyException(
            String.format("%s implements unknown interface %s", name, ifaceName));
      }
      if (!getContext().emittedTypes().contains(ifaceName)) {
        throw new ConsistencyException(
            String.format("%s implements %s, which is not declared before it", name, ifaceName));
      }
      for (Field field : iface.getFields()) {
        inheritedFields.add(field.getName());
      }
    }

    List<Field> ownFields =
        type.getFields().stream().filter(f -> !inheritedFields.contains(f.getName())).toList();
    return new Declaration.Container(
        name, capability, type.getInterfaceNames(), outputFields(type, ownFields));
  }
}
