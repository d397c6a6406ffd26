package com.example.awstools.core.paging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable fold state of a pagination: the items gathered so far and the cursor of the next page.
 *
 * <p>{@link #append(Page)} returns a new state, so a failed page leaves the previous state intact
 * and a different backend can resume from it.
 *
 * @param items items gathered so far
 * @param cursor cursor to fetch the next page with
 * @param maxResults optional ceiling
 * @param <T> item type
 * @param <C> cursor type
 */
public record Accumulation<T, C>(List<T> items, C cursor, Integer maxResults) {

  public Accumulation {
    items = Collections.unmodifiableList(items);
  }

  /** Initial state for a request. */
  public static <T, C> Accumulation<T, C> start(final PageRequest<C> request) {
    return new Accumulation<>(List.of(), request.startCursor(), request.maxResults());
  }

  /** Items still allowed by the ceiling, or {@code null} without one. */
  public Integer remaining() {
    return maxResults == null ? null : maxResults - items.size();
  }

  /**
   * Folds a page into a new state, truncating it to the ceiling.
   *
   * @param page page just fetched with {@link #cursor()}
   * @return the next state
   */
  public Accumulation<T, C> append(final Page<T, C> page) {
    final var pageItems = page.itemsOrEmpty();
    final var remaining = remaining();
    final var take =
        remaining == null ? pageItems.size() : Math.max(0, Math.min(remaining, pageItems.size()));

    final var merged = new ArrayList<T>(items.size() + take);
    merged.addAll(items);
    merged.addAll(pageItems.subList(0, take));
    return new Accumulation<>(merged, page.nextCursor(), maxResults);
  }

  /** True once there is no further page or the ceiling is reached. */
  public boolean isComplete() {
    return cursor == null || (maxResults != null && items.size() >= maxResults);
  }

  public AccumulatedResult<T, C> toResult() {
    return new AccumulatedResult<>(items, cursor);
  }
}
