package com.example.awstools.core.paging;

import java.util.List;

/**
 * One page returned by a backend.
 *
 * @param items items in backend order; {@code null} when the backend returned no items field
 * @param nextCursor continuation token, {@code null} when no more data exists
 * @param <T> item type
 * @param <C> cursor type
 */
public record Page<T, C>(List<T> items, C nextCursor) {

  /** Items of this page, an empty list when the backend sent none. */
  public List<T> itemsOrEmpty() {
    return items == null ? List.of() : items;
  }
}
