package io.schemagen.codegen.declaration;

/** Base types provided by the target runtime. */
public enum Capability {
  OBJECT,
  INTERFACE,
  INPUT,
  CONNECTION
}
