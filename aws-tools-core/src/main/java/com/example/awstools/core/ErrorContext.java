package com.example.awstools.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diagnostic context attached to every {@link AwsToolsException}.
 *
 * <p>The context is informational only; callers branch on {@link AwsToolsException#code()} and
 * the cause, never on this snapshot.
 *
 * @param component originating tools class (e.g., {@code DynamoTools})
 * @param operation operation name (e.g., {@code queryHashKey})
 * @param params snapshot of the operation inputs, in declaration order; values may be null
 */
public record ErrorContext(String component, String operation, Map<String, Object> params) {

  public ErrorContext {
    params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  /**
   * Creates a context from alternating parameter names and values.
   *
   * @param component originating component
   * @param operation operation name
   * @param namesAndValues {@code name1, value1, name2, value2, ...}
   * @return the context
   * @throws IllegalArgumentException if an odd number of name/value arguments is given
   */
  public static ErrorContext of(
      final String component, final String operation, final Object... namesAndValues) {
    if (namesAndValues.length % 2 != 0)
      throw new IllegalArgumentException("namesAndValues must come in pairs");
    final var params = new LinkedHashMap<String, Object>();
    for (var i = 0; i < namesAndValues.length; i += 2)
      params.put(String.valueOf(namesAndValues[i]), namesAndValues[i + 1]);
    return new ErrorContext(component, operation, params);
  }
}
