package com.example.awstools.core;

import java.util.Collection;
import java.util.Map;

/** Argument checks shared by the tools' input validation. */
public final class Params {

  private Params() {}

  public static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }

  public static boolean isEmpty(final Map<?, ?> value) {
    return value == null || value.isEmpty();
  }

  public static boolean isEmpty(final Collection<?> value) {
    return value == null || value.isEmpty();
  }

  /** Number of elements, 0 for {@code null}. */
  public static int sizeOf(final Collection<?> value) {
    return value == null ? 0 : value.size();
  }
}
