package io.schemagen.codegen.introspection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.schemagen.codegen.declaration.TypeReference;
import io.schemagen.codegen.exceptions.ConsistencyException;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TypeReferenceResolverTest {

  private EmittedTypes emittedTypes;
  private TypeReferenceResolver resolver;

  @BeforeEach
  public void setUp() throws Exception {
    emittedTypes = new EmittedTypes();
    emittedTypes.add("String");
    emittedTypes.add("Color");
    resolver = new TypeReferenceResolver(emittedTypes);
  }

  @Test
  public void testWrappedDeclaredType() throws Exception {
    TypeRef ref =
        TypeRef.nonNull(TypeRef.listOf(TypeRef.nonNull(TypeRef.named(TypeKind.SCALAR, "String"))));

    TypeReference resolved = resolver.resolve(ref, Set.of());

    assertThat(resolved)
        .isEqualTo(
            new TypeReference.NonNull(
                new TypeReference.ListOf(
                    new TypeReference.NonNull(new TypeReference.Resolved("String")))));
    assertThat(resolved.typeName()).isEqualTo("String");
  }

  @Test
  public void testUndeclaredTypeIsForward() throws Exception {
    TypeReference resolved =
        resolver.resolve(TypeRef.listOf(TypeRef.named(TypeKind.OBJECT, "Item")), Set.of());

    assertThat(resolved).isEqualTo(new TypeReference.ListOf(new TypeReference.Forward("Item")));
  }

  @Test
  public void testSiblingShadowsDeclaredType() throws Exception {
    TypeRef ref = TypeRef.named(TypeKind.ENUM, "Color");

    assertThat(resolver.resolve(ref, Set.of("Color", "name")))
        .isEqualTo(new TypeReference.Forward("Color"));
    assertThat(resolver.resolve(ref, Set.of("color")))
        .isEqualTo(new TypeReference.Resolved("Color"));
  }

  @Test
  public void testBecomesResolvedOnceDeclared() throws Exception {
    TypeRef ref = TypeRef.named(TypeKind.OBJECT, "Item");
    assertThat(resolver.resolve(ref, Set.of())).isInstanceOf(TypeReference.Forward.class);

    emittedTypes.add("Item");

    assertThat(resolver.resolve(ref, Set.of())).isInstanceOf(TypeReference.Resolved.class);
  }

  @Test
  public void testWrapperWithoutWrappedType() {
    assertThatThrownBy(() -> resolver.resolve(TypeRef.nonNull(null), Set.of()))
        .isInstanceOf(ConsistencyException.class)
        .hasMessage("NON_NULL type reference does not wrap any type");
  }

  @Test
  public void testNamedTypeWithoutName() {
    assertThatThrownBy(() -> resolver.resolve(TypeRef.named(TypeKind.OBJECT, null), Set.of()))
        .isInstanceOf(ConsistencyException.class);
    assertThatThrownBy(() -> resolver.resolve(null, Set.of()))
        .isInstanceOf(ConsistencyException.class)
        .hasMessage("Missing type reference");
  }

  @Test
  public void testDuplicateDeclaration() {
    assertThatThrownBy(() -> emittedTypes.add("Color"))
        .isInstanceOf(ConsistencyException.class)
        .hasMessage("Type Color is declared twice");
    assertThat(emittedTypes.asList()).containsExactly("String", "Color");
    assertThat(emittedTypes.size()).isEqualTo(2);
  }
}
