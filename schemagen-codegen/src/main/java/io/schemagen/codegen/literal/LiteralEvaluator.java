package io.schemagen.codegen.literal;

import graphql.language.ArrayValue;
import graphql.language.BooleanValue;
import graphql.language.EnumValue;
import graphql.language.FloatValue;
import graphql.language.IntValue;
import graphql.language.NullValue;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.SourceLocation;
import graphql.language.StringValue;
import graphql.language.Value;
import graphql.language.VariableReference;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import io.schemagen.codegen.exceptions.LiteralParseException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates GraphQL value literals, as found in argument default values, into plain Java values.
 *
 * <table>
 *   <caption>Mapping</caption>
 *   <tr><th>literal</th><th>value</th></tr>
 *   <tr>
 *     <td>{@code 42}</td>
 *     <td>{@link Integer}, {@link Long} or {@link BigInteger} by magnitude</td>
 *   </tr>
 *   <tr><td>{@code 3.14}</td><td>{@link Double}</td></tr>
 *   <tr><td>{@code "hi"}</td><td>{@link String}</td></tr>
 *   <tr><td>{@code true}</td><td>{@link Boolean}</td></tr>
 *   <tr><td>{@code SOME_ENUM_VALUE}</td><td>the enum value name as a {@link String}</td></tr>
 *   <tr><td>{@code null}</td><td>{@code null}</td></tr>
 *   <tr><td>{@code [1, 2]}</td><td>{@link List}</td></tr>
 *   <tr><td>{@code {a: 1}}</td><td>{@link LinkedHashMap}, keys in written order</td></tr>
 * </table>
 */
public class LiteralEvaluator {

  private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
  private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  /**
   * Parses and evaluates a literal.
   *
   * @param literal the literal text
   * @return the evaluated value, possibly null
   * @throws LiteralParseException if the text is not a valid constant GraphQL value
   */
  public Object evaluate(String literal) throws LiteralParseException {
    Value<?> value;
    try {
      value = Parser.parseValue(literal);
    } catch (InvalidSyntaxException e) {
      throw new LiteralParseException(literal, e);
    }
    return evaluate(literal, value);
  }

  private Object evaluate(String literal, Value<?> value) throws LiteralParseException {
    if (value instanceof IntValue intValue) {
      return toInteger(intValue.getValue());
    } else if (value instanceof FloatValue floatValue) {
      return toDouble(literal, floatValue);
    } else if (value instanceof StringValue stringValue) {
      return stringValue.getValue();
    } else if (value instanceof BooleanValue booleanValue) {
      return booleanValue.isValue();
    } else if (value instanceof EnumValue enumValue) {
      return enumValue.getName();
    } else if (value instanceof NullValue) {
      return null;
    } else if (value instanceof ArrayValue arrayValue) {
      List<Object> list = new ArrayList<>(arrayValue.getValues().size());
      for (Value<?> item : arrayValue.getValues()) {
        list.add(evaluate(literal, item));
      }
      return list;
    } else if (value instanceof ObjectValue objectValue) {
      Map<String, Object> map = new LinkedHashMap<>();
      for (ObjectField field : objectValue.getObjectFields()) {
        map.put(field.getName(), evaluate(literal, field.getValue()));
      }
      return map;
    } else if (value instanceof VariableReference variable) {
      throw new LiteralParseException(
          literal, "variable $" + variable.getName() + " is not allowed inside a value");
    }
    throw new LiteralParseException(
        literal, "unsupported value node " + value.getClass().getSimpleName());
  }

  /** The parser drops the sign of a negative zero; it is read back from the literal text. */
  private static Double toDouble(String literal, FloatValue value) {
    double d = value.getValue().doubleValue();
    if (d == 0 && isNegative(literal, value.getSourceLocation())) {
      return -0.0d;
    }
    return d;
  }

  private static boolean isNegative(String literal, SourceLocation location) {
    if (location == null) {
      return false;
    }
    int offset = 0;
    for (int line = 1; line < location.getLine(); line++) {
      offset = literal.indexOf('\n', offset) + 1;
      if (offset == 0) {
        return false;
      }
    }
    offset += location.getColumn() - 1;
    return offset >= 0 && offset < literal.length() && literal.charAt(offset) == '-';
  }

  private static Number toInteger(BigInteger value) {
    if (value.compareTo(INT_MIN) >= 0 && value.compareTo(INT_MAX) <= 0) {
      return value.intValue();
    } else if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
      return value.longValue();
    }
    return value;
  }
}
