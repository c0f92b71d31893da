package io.schemagen.codegen.introspection;

import io.schemagen.codegen.exceptions.CodegenException;
import io.schemagen.codegen.render.DeclarationRenderer;
import java.util.List;

/**
 * Generates the declarations of a schema. Pass it to {@link Schema#visit}, then read the result
 * with {@link #getSource()}.
 */
public class CodegenVisitor implements SchemaVisitor {

  static final String ENTRY_POINTS_BANNER = "Schema Entry Points";

  private final CodegenContext context;
  private final ScalarVisitor scalarVisitor;
  private final EnumVisitor enumVisitor;
  private final InputVisitor inputVisitor;
  private final InterfaceVisitor interfaceVisitor;
  private final ObjectVisitor objectVisitor;
  private final UnionVisitor unionVisitor;

  public CodegenVisitor(Schema schema, DeclarationRenderer renderer) {
    this(schema, renderer, new PythonIdentifierNamer());
  }

  public CodegenVisitor(Schema schema, DeclarationRenderer renderer, IdentifierNamer namer) {
    this.context = CodegenContext.create(schema, renderer, namer);
    this.scalarVisitor = new ScalarVisitor(context);
    this.enumVisitor = new EnumVisitor(context);
    this.inputVisitor = new InputVisitor(context);
    this.interfaceVisitor = new InterfaceVisitor(context);
    this.objectVisitor = new ObjectVisitor(context);
    this.unionVisitor = new UnionVisitor(context);
  }

  @Override
  public void visitHeader() {
    Schema schema = context.schema();
    append(context.renderer().renderHeader(schema.usesDateTime(), schema.usesPagination()));
  }

  @Override
  public void visitPhase(EmissionPhase phase) {
    append(context.renderer().renderBanner(phase.getBanner()));
  }

  @Override
  public void visitScalar(Type type) throws CodegenException {
    scalarVisitor.visit(type);
  }

  @Override
  public void visitEnum(Type type) throws CodegenException {
    enumVisitor.visit(type);
  }

  @Override
  public void visitInput(Type type) throws CodegenException {
    inputVisitor.visit(type);
  }

  @Override
  public void visitInterface(Type type) throws CodegenException {
    interfaceVisitor.visit(type);
  }

  @Override
  public void visitObject(Type type) throws CodegenException {
    objectVisitor.visit(type);
  }

  @Override
  public void visitUnion(Type type) throws CodegenException {
    unionVisitor.visit(type);
  }

  @Override
  public void visitEntryPoints() {
    Schema schema = context.schema();
    append(context.renderer().renderBanner(ENTRY_POINTS_BANNER));
    append(
        context
            .renderer()
            .renderEntryPoints(
                schema.getQueryTypeName(),
                schema.getMutationTypeName(),
                schema.getSubscriptionTypeName()));
  }

  /** The generated source so far. */
  public String getSource() {
    return context.output().toString();
  }

  /** Names of the declared types, in declaration order. */
  public List<String> getDeclaredTypes() {
    return context.emittedTypes().asList();
  }

  private void append(String text) {
    context.output().append(text);
  }
}
