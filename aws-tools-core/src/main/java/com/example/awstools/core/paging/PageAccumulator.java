package com.example.awstools.core.paging;

import com.example.awstools.core.AwsToolsException;
import com.example.awstools.core.retry.Retry;
import com.example.awstools.core.retry.RetryClassifier;
import reactor.core.publisher.Mono;

/**
 * Drives a paged backend operation until the data or the ceiling is exhausted.
 *
 * <p>Pages are fetched strictly one after another. Every page fetch is retried through {@link
 * Retry#onRetryable}; a page that still fails ends the accumulation with a {@link
 * PaginationException}, and the items gathered so far are not emitted.
 *
 * <pre>{@code
 * Mono<AccumulatedResult<String, String>> keys =
 *     PageAccumulator.accumulate(
 *         (token, remaining) -> listPage(bucket, token),
 *         PageRequest.limitedTo(500),
 *         RetryClassifier.defaultClassifier(),
 *         Retry.Policy.defaults());
 * }</pre>
 */
public final class PageAccumulator {

  private PageAccumulator() {}

  /**
   * Accumulates pages from the start of {@code request}.
   *
   * @param fetcher page source
   * @param request start cursor and optional ceiling
   * @param classifier retryability of page failures
   * @param policy retry policy applied per page
   * @param <T> item type
   * @param <C> cursor type
   * @return merged items and the last cursor
   */
  public static <T, C> Mono<AccumulatedResult<T, C>> accumulate(
      final PageFetcher<T, C> fetcher,
      final PageRequest<C> request,
      final RetryClassifier classifier,
      final Retry.Policy policy) {
    return resume(fetcher, Accumulation.start(request), classifier, policy);
  }

  /**
   * Continues an accumulation from {@code state}, fetching the page at {@code state.cursor()}.
   *
   * @param fetcher page source
   * @param state state to continue from
   * @param classifier retryability of page failures
   * @param policy retry policy applied per page
   * @param <T> item type
   * @param <C> cursor type
   * @return merged items and the last cursor
   */
  public static <T, C> Mono<AccumulatedResult<T, C>> resume(
      final PageFetcher<T, C> fetcher,
      final Accumulation<T, C> state,
      final RetryClassifier classifier,
      final Retry.Policy policy) {
    return Retry.onRetryable(
            () -> fetcher.fetch(state.cursor(), state.remaining()),
            classifier,
            policy,
            exhausted ->
                Mono.error(
                    new PaginationException(state, AwsToolsException.unwrap(exhausted), true)))
        .onErrorMap(
            e -> !(e instanceof PaginationException),
            e -> new PaginationException(state, AwsToolsException.unwrap(e), false))
        .flatMap(
            page -> {
              final var next = state.append(page);
              if (next.isComplete()) return Mono.just(next.toResult());
              return resume(fetcher, next, classifier, policy);
            });
  }
}
