package com.example.awstools.core.paging;

import java.util.List;

/**
 * Items merged from successive pages.
 *
 * @param items items in page arrival order
 * @param lastCursor cursor reported by the last executed page; pass it as a start cursor to resume
 * @param <T> item type
 * @param <C> cursor type
 */
public record AccumulatedResult<T, C>(List<T> items, C lastCursor) {

  public AccumulatedResult {
    items = List.copyOf(items);
  }

  /** Whether the backend reported more data after the last page. */
  public boolean hasMore() {
    return lastCursor != null;
  }
}
