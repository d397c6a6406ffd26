package com.example.awstools.core.paging;

/**
 * Caller-side pagination controls.
 *
 * @param startCursor cursor to start from, {@code null} to start at the beginning
 * @param maxResults ceiling on the number of accumulated items, {@code null} for no ceiling
 * @param <C> cursor type
 */
public record PageRequest<C>(C startCursor, Integer maxResults) {

  public PageRequest {
    if (maxResults != null && maxResults < 1)
      throw new IllegalArgumentException("maxResults must be >= 1");
  }

  /** Reads everything from the beginning. */
  public static <C> PageRequest<C> all() {
    return new PageRequest<>(null, null);
  }

  /** Reads everything from {@code cursor}. */
  public static <C> PageRequest<C> startingAt(final C cursor) {
    return new PageRequest<>(cursor, null);
  }

  /** Reads at most {@code maxResults} items from the beginning. */
  public static <C> PageRequest<C> limitedTo(final int maxResults) {
    return new PageRequest<>(null, maxResults);
  }

  /** Returns a copy with the given ceiling. */
  public PageRequest<C> withMaxResults(final int max) {
    return new PageRequest<>(startCursor, max);
  }
}
