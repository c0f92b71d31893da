package io.schemagen.codegen.declaration;

public enum ScalarFlavor {
  /** Alias of a scalar built into the target runtime. */
  BUILTIN,
  /** Alias of the runtime's date/time support. */
  DATETIME,
  /** A scalar the schema defines itself. */
  CUSTOM
}
