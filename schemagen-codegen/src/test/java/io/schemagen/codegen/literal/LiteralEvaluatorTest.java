package io.schemagen.codegen.literal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.schemagen.codegen.exceptions.LiteralParseException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

public class LiteralEvaluatorTest {

  private final LiteralEvaluator evaluator = new LiteralEvaluator();

  @Test
  public void testScalars() throws Exception {
    assertThat(evaluator.evaluate("42")).isEqualTo(42);
    assertThat(evaluator.evaluate("-7")).isEqualTo(-7);
    assertThat(evaluator.evaluate("3.25")).isEqualTo(3.25d);
    assertThat(evaluator.evaluate("1.5e3")).isEqualTo(1500.0d);
    assertThat(evaluator.evaluate("\"hello\"")).isEqualTo("hello");
    assertThat(evaluator.evaluate("true")).isEqualTo(Boolean.TRUE);
    assertThat(evaluator.evaluate("false")).isEqualTo(Boolean.FALSE);
    assertThat(evaluator.evaluate("null")).isNull();
  }

  @Test
  public void testEnumValueIsItsName() throws Exception {
    assertThat(evaluator.evaluate("ASC")).isEqualTo("ASC");
  }

  @Test
  public void testIntegersWidenWithMagnitude() throws Exception {
    assertThat(evaluator.evaluate("2147483647")).isInstanceOf(Integer.class);
    assertThat(evaluator.evaluate("2147483648")).isEqualTo(2147483648L);
    assertThat(evaluator.evaluate("123456789012345678901234567890"))
        .isEqualTo(new BigInteger("123456789012345678901234567890"));
  }

  @Test
  public void testStringEscapes() throws Exception {
    assertThat(evaluator.evaluate("\"a\\nb \\u0041\"")).isEqualTo("a\nb A");
  }

  @Test
  public void testList() throws Exception {
    assertThat(evaluator.evaluate("[1, \"two\", null, [true]]"))
        .isEqualTo(Arrays.asList(1, "two", null, List.of(true)));
    assertThat(evaluator.evaluate("[]")).isEqualTo(List.of());
  }

  @Test
  public void testObjectKeepsFieldOrder() throws Exception {
    Object value = evaluator.evaluate("{b: 1, a: {c: [RED, GREEN]}}");
    assertThat(value)
        .asInstanceOf(InstanceOfAssertFactories.map(String.class, Object.class))
        .containsExactly(
            Map.entry("b", 1), Map.entry("a", Map.of("c", List.of("RED", "GREEN"))));
  }

  @Test
  public void testNegativeZeroKeepsItsSign() throws Exception {
    assertThat(evaluator.evaluate("-0.0")).isEqualTo(-0.0d);
    assertThat(evaluator.evaluate("0.0")).isEqualTo(0.0d);
    assertThat(evaluator.evaluate("[1.5, -0e3]")).isEqualTo(List.of(1.5d, -0.0d));
    assertThat(evaluator.evaluate("{a:\n  -0.0}")).isEqualTo(Map.of("a", -0.0d));
  }

  @Test
  public void testSyntaxError() {
    assertThatThrownBy(() -> evaluator.evaluate("[1, 2"))
        .isInstanceOf(LiteralParseException.class)
        .hasMessageContaining("[1, 2")
        .satisfies(e -> assertThat(((LiteralParseException) e).getLiteral()).isEqualTo("[1, 2"));
    assertThatThrownBy(() -> evaluator.evaluate("{a 1}"))
        .isInstanceOf(LiteralParseException.class);
  }

  @Test
  public void testNestedVariableIsRejected() {
    assertThatThrownBy(() -> evaluator.evaluate("[$first]"))
        .isInstanceOf(LiteralParseException.class);
  }
}
