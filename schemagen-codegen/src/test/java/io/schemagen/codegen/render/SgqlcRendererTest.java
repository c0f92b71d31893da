package io.schemagen.codegen.render;

import static org.assertj.core.api.Assertions.assertThat;

import io.schemagen.codegen.declaration.ArgumentDeclaration;
import io.schemagen.codegen.declaration.ArgumentDefault;
import io.schemagen.codegen.declaration.Capability;
import io.schemagen.codegen.declaration.Declaration;
import io.schemagen.codegen.declaration.FieldDeclaration;
import io.schemagen.codegen.declaration.ScalarFlavor;
import io.schemagen.codegen.declaration.TypeReference;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class SgqlcRendererTest {

  private final SgqlcRenderer renderer = new SgqlcRenderer("my_schema");

  @Test
  public void testHeader() {
    assertThat(renderer.renderHeader(false, false))
        .isEqualTo("import sgqlc.types\n\n\nmy_schema = sgqlc.types.Schema()\n\n\n");
    assertThat(renderer.renderHeader(true, true))
        .isEqualTo(
            "import sgqlc.types\n"
                + "import sgqlc.types.datetime\n"
                + "import sgqlc.types.relay\n"
                + "\n\n"
                + "my_schema = sgqlc.types.Schema()\n\n\n"
                + "# Unexport Node/PageInfo, let schema re-declare them\n"
                + "my_schema -= sgqlc.types.relay.Node\n"
                + "my_schema -= sgqlc.types.relay.PageInfo\n\n\n");
  }

  @Test
  public void testBanner() {
    String bar = "#".repeat(72);
    assertThat(renderer.renderBanner("Unions")).isEqualTo("\n" + bar + "\n# Unions\n" + bar + "\n");
  }

  @Test
  public void testScalars() {
    assertThat(renderer.renderDeclaration(new Declaration.Scalar("Int", ScalarFlavor.BUILTIN)))
        .isEqualTo("Int = sgqlc.types.Int\n\n");
    assertThat(renderer.renderDeclaration(new Declaration.Scalar("Date", ScalarFlavor.DATETIME)))
        .isEqualTo("Date = sgqlc.types.datetime.Date\n\n");
    assertThat(renderer.renderDeclaration(new Declaration.Scalar("URI", ScalarFlavor.CUSTOM)))
        .isEqualTo("class URI(sgqlc.types.Scalar):\n    __schema__ = my_schema\n\n\n");
  }

  @Test
  public void testEnum() {
    assertThat(renderer.renderDeclaration(new Declaration.Enumeration("Order", List.of("ASC"))))
        .isEqualTo(
            "class Order(sgqlc.types.Enum):\n"
                + "    __schema__ = my_schema\n"
                + "    __choices__ = ('ASC',)\n\n\n");
  }

  @Test
  public void testContainerWithInterfaces() {
    Declaration declaration =
        new Declaration.Container(
            "User",
            Capability.OBJECT,
            List.of("Node", "Actor"),
            List.of(
                new FieldDeclaration(
                    "login",
                    "login",
                    new TypeReference.NonNull(new TypeReference.Resolved("String")),
                    List.of()),
                new FieldDeclaration(
                    "best_friend", "bestFriend", new TypeReference.Forward("User"), List.of())));

    assertThat(renderer.renderDeclaration(declaration))
        .isEqualTo(
            "class User(sgqlc.types.Type, Node, Actor):\n"
                + "    __schema__ = my_schema\n"
                + "    __field_names__ = ('login', 'best_friend')\n"
                + "    login = sgqlc.types.Field(sgqlc.types.non_null(String),"
                + " graphql_name='login')\n"
                + "    best_friend = sgqlc.types.Field('User', graphql_name='bestFriend')\n"
                + "\n\n");
  }

  @Test
  public void testFieldArguments() {
    FieldDeclaration field =
        new FieldDeclaration(
            "items",
            "items",
            new TypeReference.ListOf(new TypeReference.Resolved("Item")),
            List.of(
                new ArgumentDeclaration(
                    "first",
                    "first",
                    new TypeReference.Resolved("Int"),
                    new ArgumentDefault.LiteralDefault(10)),
                new ArgumentDeclaration(
                    "filter",
                    "filter",
                    new TypeReference.Forward("Filter"),
                    new ArgumentDefault.LiteralDefault(Map.of("text", "x"))),
                new ArgumentDeclaration(
                    "after",
                    "after",
                    new TypeReference.Resolved("String"),
                    new ArgumentDefault.VariableDefault("cursor")),
                new ArgumentDeclaration(
                    "order_by", "orderBy", new TypeReference.Resolved("Order"), null)));
    Declaration declaration =
        new Declaration.Container("Query", Capability.OBJECT, List.of(), List.of(field));

    assertThat(renderer.renderDeclaration(declaration))
        .isEqualTo(
            "class Query(sgqlc.types.Type):\n"
                + "    __schema__ = my_schema\n"
                + "    __field_names__ = ('items',)\n"
                + "    items = sgqlc.types.Field(sgqlc.types.list_of(Item), graphql_name='items',"
                + " args=sgqlc.types.ArgDict((\n"
                + "        ('first', sgqlc.types.Arg(Int, graphql_name='first', default=10)),\n"
                + "        ('filter', sgqlc.types.Arg('Filter', graphql_name='filter',"
                + " default={'text': 'x'})),\n"
                + "        ('after', sgqlc.types.Arg(String, graphql_name='after',"
                + " default=sgqlc.types.Variable('cursor'))),\n"
                + "        ('order_by', sgqlc.types.Arg(Order, graphql_name='orderBy',"
                + " default=None)),\n"
                + "))\n"
                + "    )\n"
                + "\n\n");
  }

  @Test
  public void testCapabilities() {
    assertThat(
            renderer.renderDeclaration(
                new Declaration.Container("F", Capability.INPUT, List.of(), List.of())))
        .startsWith("class F(sgqlc.types.Input):\n");
    assertThat(
            renderer.renderDeclaration(
                new Declaration.Container("N", Capability.INTERFACE, List.of(), List.of())))
        .startsWith("class N(sgqlc.types.Interface):\n");
    assertThat(
            renderer.renderDeclaration(
                new Declaration.Container(
                    "UserConnection", Capability.CONNECTION, List.of(), List.of())))
        .isEqualTo(
            "class UserConnection(sgqlc.types.relay.Connection):\n"
                + "    __schema__ = my_schema\n"
                + "    __field_names__ = ()\n"
                + "\n\n");
  }

  @Test
  public void testUnion() {
    assertThat(renderer.renderDeclaration(new Declaration.Union("One", List.of("A"))))
        .isEqualTo(
            "class One(sgqlc.types.Union):\n"
                + "    __schema__ = my_schema\n"
                + "    __types__ = (A,)\n\n\n");
    assertThat(renderer.renderDeclaration(new Declaration.Union("Two", List.of("A", "B"))))
        .endsWith("    __types__ = (A, B)\n\n\n");
  }

  @Test
  public void testEntryPoints() {
    assertThat(renderer.renderEntryPoints("Query", null, "Subscription"))
        .isEqualTo(
            "my_schema.query_type = Query\n"
                + "my_schema.mutation_type = None\n"
                + "my_schema.subscription_type = Subscription\n\n");
  }
}
