package com.example.awstools.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AwsToolsExceptionTest {

  private static final ErrorContext CONTEXT =
      ErrorContext.of("DynamoTools", "getItem", "table", "orders", "key", null);

  @Test
  @DisplayName("Backend failures keep the unwrapped cause and its message")
  void backendUnwrapsFutureWrappers() {
    final var cause = new IllegalStateException("connection reset");
    final var error = AwsToolsException.backend(CONTEXT, new CompletionException(cause));

    assertEquals(ErrorCode.BACKEND_FAILURE, error.code());
    assertSame(cause, error.getCause());
    assertEquals("connection reset", error.getMessage());
    assertSame(CONTEXT, error.context());
  }

  @Test
  @DisplayName("Wrapping an AwsToolsException returns it unchanged")
  void backendKeepsExistingEnvelope() {
    final var original = AwsToolsException.badParam(CONTEXT);
    assertSame(original, AwsToolsException.backend(CONTEXT, original));
  }

  @Test
  @DisplayName("Fallback failures carry the primary failure as suppressed")
  void fallbackCarriesPrimary() {
    final var primary = new IllegalStateException("DAX unavailable");
    final var fallback = new IllegalStateException("DynamoDB unavailable");
    final var error = AwsToolsException.fallbackExhausted(CONTEXT, fallback, primary);

    assertEquals(ErrorCode.FALLBACK_EXHAUSTED, error.code());
    assertSame(fallback, error.getCause());
    assertSame(primary, error.primaryFailure().orElseThrow());
    assertArrayEquals(new Throwable[] {primary}, error.getSuppressed());
  }

  @Test
  @DisplayName("Context keeps parameters in order, null values included")
  void contextSnapshot() {
    assertEquals(2, CONTEXT.params().size());
    assertEquals("table", CONTEXT.params().keySet().iterator().next());
    assertTrue(CONTEXT.params().containsKey("key"));
    assertThrows(UnsupportedOperationException.class, () -> CONTEXT.params().put("x", 1));
    assertThrows(IllegalArgumentException.class, () -> ErrorContext.of("c", "o", "dangling"));
  }
}
