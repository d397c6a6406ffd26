package com.example.awstools.core.dynamo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Renders ordered {@link KeyCondition}s into a conjunctive DynamoDB condition expression.
 *
 * <p>Placeholders are positional and carry the caller's prefix: condition {@code n} gets the name
 * {@code #<prefix>_n}; values take {@code :<prefix>_0, :<prefix>_1, ...} in order, a {@code
 * BETWEEN} using two of them. For example {@code [pk = "a", ts BETWEEN 1 AND 9]} with prefix
 * {@code i} renders {@code #i_0 = :i_0 AND #i_1 BETWEEN :i_1 AND :i_2}.
 */
final class ConditionExpressions {

  /** Prefix for key and filter conditions. */
  static final String KEY_PREFIX = "i";

  /** Prefix for conditions guarding an update. */
  static final String CONDITION_PREFIX = "c";

  private ConditionExpressions() {}

  /**
   * A rendered expression and its placeholder bindings.
   *
   * @param expression expression text
   * @param names {@code #placeholder -> attribute name}
   * @param values {@code :placeholder -> value}
   */
  record Expression(
      String expression, Map<String, String> names, Map<String, AttributeValue> values) {}

  static Expression render(final String prefix, final List<KeyCondition> conditions) {
    final var terms = new ArrayList<String>(conditions.size());
    final var names = new LinkedHashMap<String, String>();
    final var values = new LinkedHashMap<String, AttributeValue>();

    var valueIndex = 0;
    for (var i = 0; i < conditions.size(); i++) {
      final var condition = conditions.get(i);
      final var name = "#" + prefix + "_" + i;
      names.put(name, condition.key());

      final var placeholders = new ArrayList<String>(condition.values().size());
      for (final var value : condition.values()) {
        final var placeholder = ":" + prefix + "_" + valueIndex++;
        values.put(placeholder, value);
        placeholders.add(placeholder);
      }

      terms.add(term(name, condition.operator(), placeholders));
    }

    return new Expression(String.join(" AND ", terms), names, values);
  }

  private static String term(
      final String name, final KeyCondition.Operator operator, final List<String> placeholders) {
    return switch (operator) {
      case BETWEEN -> name + " BETWEEN " + placeholders.get(0) + " AND " + placeholders.get(1);
      case BEGINS_WITH -> "begins_with(" + name + ", " + placeholders.get(0) + ")";
      default -> name + " " + operator.token() + " " + placeholders.get(0);
    };
  }
}
