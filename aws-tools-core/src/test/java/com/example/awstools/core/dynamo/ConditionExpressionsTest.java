package com.example.awstools.core.dynamo;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class ConditionExpressionsTest {

  @Test
  @DisplayName("Renders one placeholder pair per condition joined with AND")
  void rendersConjunction() {
    final var expression =
        ConditionExpressions.render(
            ConditionExpressions.KEY_PREFIX,
            List.of(
                KeyCondition.eq("pk", "user#1"),
                KeyCondition.of("sk", KeyCondition.Operator.GE, AttributeValue.fromN("10"))));

    assertEquals("#i_0 = :i_0 AND #i_1 >= :i_1", expression.expression());
    assertEquals(Map.of("#i_0", "pk", "#i_1", "sk"), expression.names());
    assertEquals(
        Map.of(":i_0", AttributeValue.fromS("user#1"), ":i_1", AttributeValue.fromN("10")),
        expression.values());
  }

  @Test
  @DisplayName("BETWEEN consumes two value placeholders and shifts the following ones")
  void betweenUsesTwoValues() {
    final var expression =
        ConditionExpressions.render(
            ConditionExpressions.KEY_PREFIX,
            List.of(
                KeyCondition.between("ts", AttributeValue.fromN("1"), AttributeValue.fromN("9")),
                KeyCondition.eq("pk", "a")));

    assertEquals("#i_0 BETWEEN :i_0 AND :i_1 AND #i_1 = :i_2", expression.expression());
    assertEquals(AttributeValue.fromN("1"), expression.values().get(":i_0"));
    assertEquals(AttributeValue.fromN("9"), expression.values().get(":i_1"));
    assertEquals(AttributeValue.fromS("a"), expression.values().get(":i_2"));
  }

  @Test
  @DisplayName("begins_with renders as a function call")
  void beginsWith() {
    final var expression =
        ConditionExpressions.render(
            ConditionExpressions.CONDITION_PREFIX, List.of(KeyCondition.beginsWith("sk", "2024-")));

    assertEquals("begins_with(#c_0, :c_0)", expression.expression());
  }

  @Test
  @DisplayName("Every operator renders its own token")
  void operatorTokens() {
    for (final var operator : KeyCondition.Operator.values()) {
      if (operator == KeyCondition.Operator.BETWEEN
          || operator == KeyCondition.Operator.BEGINS_WITH) continue;
      final var expression =
          ConditionExpressions.render(
              ConditionExpressions.KEY_PREFIX,
              List.of(KeyCondition.of("k", operator, AttributeValue.fromS("v"))));
      assertEquals("#i_0 " + operator.token() + " :i_0", expression.expression());
    }
  }

  @Test
  @DisplayName("Conditions reject a wrong number of values and a blank key")
  void conditionValidation() {
    assertThrows(
        IllegalArgumentException.class,
        () -> KeyCondition.of("ts", KeyCondition.Operator.BETWEEN, AttributeValue.fromN("1")));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new KeyCondition(
                "pk",
                KeyCondition.Operator.EQ,
                List.of(AttributeValue.fromS("a"), AttributeValue.fromS("b"))));
    assertThrows(IllegalArgumentException.class, () -> KeyCondition.eq(" ", "a"));
  }
}
