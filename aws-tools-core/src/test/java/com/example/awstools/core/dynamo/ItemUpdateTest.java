package com.example.awstools.core.dynamo;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class ItemUpdateTest {

  @Test
  @DisplayName("Renders SET and ADD clauses with distinct placeholders")
  void rendersSetAndAdd() {
    final var expression =
        ItemUpdate.builder()
            .set("status", AttributeValue.fromS("SHIPPED"))
            .set("carrier", AttributeValue.fromS("UPS"))
            .increment("version", 1)
            .build()
            .render();

    assertEquals("SET #s_0 = :s_0, #s_1 = :s_1 ADD #a_0 :a_0", expression.expression());
    assertEquals(
        Map.of("#s_0", "status", "#s_1", "carrier", "#a_0", "version"), expression.names());
    assertEquals(AttributeValue.fromN("1"), expression.values().get(":a_0"));
    assertEquals(AttributeValue.fromS("UPS"), expression.values().get(":s_1"));
  }

  @Test
  @DisplayName("Omits the clause of an empty map")
  void onlyIncrement() {
    final var expression = ItemUpdate.builder().increment("hits", 5L).build().render();

    assertEquals("ADD #a_0 :a_0", expression.expression());
    assertEquals(AttributeValue.fromN("5"), expression.values().get(":a_0"));
  }

  @Test
  @DisplayName("Null maps are treated as empty")
  void nullsAreEmpty() {
    final var update = new ItemUpdate(null, null, null);

    assertTrue(update.isEmpty());
    assertTrue(update.conditions().isEmpty());
  }
}
