package com.example.awstools.core.dynamo;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.awstools.core.AwsToolsException;
import com.example.awstools.core.ErrorContext;
import com.example.awstools.core.paging.AccumulatedResult;
import com.example.awstools.core.paging.Accumulation;
import com.example.awstools.core.paging.Page;
import com.example.awstools.core.paging.PageAccumulator;
import com.example.awstools.core.paging.PageFetcher;
import com.example.awstools.core.paging.PageRequest;
import com.example.awstools.core.paging.PaginationException;
import com.example.awstools.core.retry.Retry;
import com.example.awstools.core.retry.RetryClassifier;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;

/**
 * Runs DynamoDB calls against the primary client and, when a {@link ClientKind#CACHE_PROXY} primary
 * exhausts its retries, re-runs them against a direct DynamoDB client.
 *
 * <p>The fallback client gets its own retry budget and is never substituted itself. If it fails
 * too, the surfaced error is the fallback's, with the primary's failure attached. Non-retryable
 * primary failures and {@link ClientKind#DIRECT} primaries never fall back.
 */
final class BackendSubstitution implements AutoCloseable {

  private final DynamoDbAsyncClient primary;
  private final ClientKind kind;
  private final Supplier<DynamoDbAsyncClient> fallbackFactory;
  private final boolean ownsFallback;
  private final RetryClassifier classifier;
  private final Retry.Policy policy;
  private final System.Logger logger;

  private DynamoDbAsyncClient fallbackClient;

  BackendSubstitution(
      final DynamoDbAsyncClient primary,
      final ClientKind kind,
      final Supplier<DynamoDbAsyncClient> fallbackFactory,
      final boolean ownsFallback,
      final RetryClassifier classifier,
      final Retry.Policy policy,
      final System.Logger logger) {
    this.primary = primary;
    this.kind = kind;
    this.fallbackFactory = fallbackFactory;
    this.ownsFallback = ownsFallback;
    this.classifier = classifier;
    this.policy = policy;
    this.logger = logger;
  }

  /**
   * Fetches one page from a given client.
   *
   * @param <T> item type
   * @param <C> cursor type
   */
  @FunctionalInterface
  interface ClientPageFetcher<T, C> {
    Mono<Page<T, C>> fetch(DynamoDbAsyncClient client, C cursor, Integer remaining);

    default PageFetcher<T, C> on(final DynamoDbAsyncClient client) {
      return (cursor, remaining) -> fetch(client, cursor, remaining);
    }
  }

  /**
   * Executes a single-shot call.
   *
   * @param context error context of the calling operation
   * @param call backend call to run against a client
   * @param <R> response type
   * @return the response, or an {@link AwsToolsException}
   */
  <R> Mono<R> call(
      final ErrorContext context, final Function<DynamoDbAsyncClient, CompletableFuture<R>> call) {
    return Retry.onRetryable(
            () -> Mono.fromFuture(() -> call.apply(primary)),
            classifier,
            policy,
            exhausted -> callOnFallback(context, call, exhausted))
        .onErrorMap(e -> AwsToolsException.backend(context, e));
  }

  /**
   * Executes a paged call, resuming on the fallback from the failing page when allowed.
   *
   * @param context error context of the calling operation
   * @param fetcher page fetch against a client
   * @param request start cursor and optional ceiling
   * @param <T> item type
   * @param <C> cursor type
   * @return merged pages, or an {@link AwsToolsException}
   */
  <T, C> Mono<AccumulatedResult<T, C>> paginate(
      final ErrorContext context,
      final ClientPageFetcher<T, C> fetcher,
      final PageRequest<C> request) {
    return PageAccumulator.accumulate(fetcher.on(primary), request, classifier, policy)
        .onErrorResume(
            PaginationException.class, failure -> resumeOnFallback(context, fetcher, failure))
        .onErrorMap(e -> AwsToolsException.backend(context, causeOf(e)));
  }

  private <R> Mono<R> callOnFallback(
      final ErrorContext context,
      final Function<DynamoDbAsyncClient, CompletableFuture<R>> call,
      final Throwable primaryFailure) {
    if (kind != ClientKind.CACHE_PROXY) return Mono.error(primaryFailure);

    logSwitch(context, primaryFailure);
    return Retry.onRetryable(
            () -> Mono.fromFuture(() -> call.apply(fallback())), classifier, policy)
        .onErrorMap(e -> fallbackExhausted(context, e, primaryFailure));
  }

  private <T, C> Mono<AccumulatedResult<T, C>> resumeOnFallback(
      final ErrorContext context,
      final ClientPageFetcher<T, C> fetcher,
      final PaginationException failure) {
    if (!failure.retriesExhausted() || kind != ClientKind.CACHE_PROXY)
      return Mono.error(failure.getCause());

    @SuppressWarnings("unchecked")
    final var state = (Accumulation<T, C>) failure.state();
    final var primaryFailure = failure.getCause();

    logSwitch(context, primaryFailure);
    return Mono.defer(
            () -> PageAccumulator.resume(fetcher.on(fallback()), state, classifier, policy))
        .onErrorMap(e -> fallbackExhausted(context, causeOf(e), primaryFailure));
  }

  private AwsToolsException fallbackExhausted(
      final ErrorContext context, final Throwable fallbackFailure, final Throwable primaryFailure) {
    logger.log(
        WARNING,
        "Direct DynamoDB fallback failed for {0}.{1}: {2}",
        context.component(),
        context.operation(),
        AwsToolsException.unwrap(fallbackFailure).getMessage());
    return AwsToolsException.fallbackExhausted(context, fallbackFailure, primaryFailure);
  }

  private void logSwitch(final ErrorContext context, final Throwable primaryFailure) {
    logger.log(
        INFO,
        "Cache proxy exhausted {0} attempts for {1}.{2} ({3}), falling back to direct DynamoDB",
        policy.maxAttempts(),
        context.component(),
        context.operation(),
        AwsToolsException.unwrap(primaryFailure).getMessage());
  }

  /** Lazily builds the fallback client, once. */
  synchronized DynamoDbAsyncClient fallback() {
    return Optional.ofNullable(fallbackClient)
        .orElseGet(() -> fallbackClient = fallbackFactory.get());
  }

  private static Throwable causeOf(final Throwable e) {
    return e instanceof PaginationException pagination ? pagination.getCause() : e;
  }

  @Override
  public synchronized void close() {
    if (ownsFallback && fallbackClient != null) {
      fallbackClient.close();
      fallbackClient = null;
    }
  }
}
