package com.example.awstools.core.dynamo;

import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * One {@code key operator value} term of a key, filter or update condition.
 *
 * <p>{@link Operator#BETWEEN} takes exactly two values (low, high); every other operator takes one.
 *
 * @param key attribute name
 * @param operator comparison
 * @param values operand values
 */
public record KeyCondition(String key, Operator operator, List<AttributeValue> values) {

  /** Comparisons supported by DynamoDB condition expressions. */
  public enum Operator {
    EQ("="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    BETWEEN("BETWEEN"),
    BEGINS_WITH("begins_with");

    private final String token;

    Operator(final String token) {
      this.token = token;
    }

    /** Expression syntax of this operator. */
    public String token() {
      return token;
    }
  }

  public KeyCondition {
    if (key == null || key.isBlank()) throw new IllegalArgumentException("key is required");
    Objects.requireNonNull(operator, "operator");
    values = List.copyOf(values);
    final var expected = operator == Operator.BETWEEN ? 2 : 1;
    if (values.size() != expected)
      throw new IllegalArgumentException(
          operator + " takes " + expected + " value(s), got " + values.size());
  }

  public static KeyCondition of(
      final String key, final Operator operator, final AttributeValue value) {
    return new KeyCondition(key, operator, List.of(value));
  }

  public static KeyCondition eq(final String key, final AttributeValue value) {
    return of(key, Operator.EQ, value);
  }

  public static KeyCondition eq(final String key, final String value) {
    return eq(key, AttributeValue.fromS(value));
  }

  public static KeyCondition between(
      final String key, final AttributeValue low, final AttributeValue high) {
    return new KeyCondition(key, Operator.BETWEEN, List.of(low, high));
  }

  public static KeyCondition beginsWith(final String key, final String prefix) {
    return of(key, Operator.BEGINS_WITH, AttributeValue.fromS(prefix));
  }
}
