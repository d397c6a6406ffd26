package com.example.awstools.core.paging;

import reactor.core.publisher.Mono;

/**
 * Fetches one page from a backend.
 *
 * @param <T> item type
 * @param <C> cursor type
 */
@FunctionalInterface
public interface PageFetcher<T, C> {

  /**
   * Fetches the page starting at {@code cursor}.
   *
   * @param cursor start position, {@code null} for the first page
   * @param remaining items still wanted, {@code null} when unbounded; backends may use it as a page
   *     size hint
   * @return the page
   */
  Mono<Page<T, C>> fetch(C cursor, Integer remaining);
}
