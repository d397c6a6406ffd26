package com.example.awstools.core.dynamo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Changes applied by {@link DynamoTools#updateItem}: attributes to overwrite, numeric attributes to
 * increment, and optional conditions the stored item must satisfy.
 *
 * <pre>{@code
 * var update = ItemUpdate.builder()
 *     .set("status", AttributeValue.fromS("SHIPPED"))
 *     .increment("version", 1)
 *     .condition(KeyCondition.eq("status", "PACKED"))
 *     .build();
 * // SET #s_0 = :s_0 ADD #a_0 :a_0, condition #c_0 = :c_0
 * }</pre>
 *
 * @param set attributes to set unconditionally
 * @param increment numeric attributes to add to
 * @param conditions conditions guarding the update, empty for an unconditional update
 */
public record ItemUpdate(
    Map<String, AttributeValue> set, Map<String, Number> increment, List<KeyCondition> conditions) {

  static final String SET_PREFIX = "s";
  static final String ADD_PREFIX = "a";

  public ItemUpdate {
    set = set == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(set));
    increment =
        increment == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(increment));
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** True when neither attributes to set nor to increment were given. */
  public boolean isEmpty() {
    return set.isEmpty() && increment.isEmpty();
  }

  /**
   * Renders the update expression, omitting the clause of an empty map.
   *
   * @return {@code SET ... ADD ...} expression with its bindings
   */
  ConditionExpressions.Expression render() {
    final var names = new LinkedHashMap<String, String>();
    final var values = new LinkedHashMap<String, AttributeValue>();
    final var clauses = new ArrayList<String>(2);

    if (!set.isEmpty()) {
      final var assignments = new ArrayList<String>(set.size());
      var i = 0;
      for (final var entry : set.entrySet()) {
        final var name = "#" + SET_PREFIX + "_" + i;
        final var value = ":" + SET_PREFIX + "_" + i++;
        names.put(name, entry.getKey());
        values.put(value, entry.getValue());
        assignments.add(name + " = " + value);
      }
      clauses.add("SET " + String.join(", ", assignments));
    }

    if (!increment.isEmpty()) {
      final var additions = new ArrayList<String>(increment.size());
      var i = 0;
      for (final var entry : increment.entrySet()) {
        final var name = "#" + ADD_PREFIX + "_" + i;
        final var value = ":" + ADD_PREFIX + "_" + i++;
        names.put(name, entry.getKey());
        values.put(value, AttributeValue.fromN(entry.getValue().toString()));
        additions.add(name + " " + value);
      }
      clauses.add("ADD " + String.join(", ", additions));
    }

    return new ConditionExpressions.Expression(String.join(" ", clauses), names, values);
  }

  /** Fluent builder for {@link ItemUpdate}. */
  public static class Builder {
    private final Map<String, AttributeValue> set = new LinkedHashMap<>();
    private final Map<String, Number> increment = new LinkedHashMap<>();
    private final List<KeyCondition> conditions = new ArrayList<>();

    public Builder set(final String attribute, final AttributeValue value) {
      set.put(attribute, value);
      return this;
    }

    public Builder set(final Map<String, AttributeValue> attributes) {
      set.putAll(attributes);
      return this;
    }

    public Builder increment(final String attribute, final Number by) {
      increment.put(attribute, by);
      return this;
    }

    public Builder condition(final KeyCondition condition) {
      conditions.add(condition);
      return this;
    }

    public ItemUpdate build() {
      return new ItemUpdate(set, increment, conditions);
    }
  }
}
