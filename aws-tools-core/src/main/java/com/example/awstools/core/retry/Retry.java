package com.example.awstools.core.retry;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;

/**
 * Backoff retrier for asynchronous backend calls.
 *
 * <p>Operations are {@link Supplier}s of {@link Mono}; every attempt calls the supplier again, so
 * the arguments captured by the supplier are identical on each attempt. Waiting between attempts
 * uses {@link Mono#delay(Duration)} and suspends only the calling operation.
 *
 * <h2>Plain Backoff</h2>
 *
 * <pre>{@code
 * Mono<GetItemResponse> response =
 *     Retry.backoff(() -> Mono.fromFuture(() -> client.getItem(request)), Retry.Policy.defaults());
 * }</pre>
 *
 * <h2>Retry Only When The Backend Says So</h2>
 *
 * <pre>{@code
 * Mono<GetItemResponse> response =
 *     Retry.onRetryable(
 *         () -> Mono.fromFuture(() -> client.getItem(request)),
 *         RetryClassifier.defaultClassifier(),
 *         Retry.Policy.exponential(3, 100L));
 * }</pre>
 */
public final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  private Retry() {}

  /**
   * Retry policy.
   *
   * @param maxAttempts total number of attempts, including the first; must be >= 1
   * @param baseIntervalMillis wait after the first failure in milliseconds; must be >= 0
   * @param exponential when true the wait doubles after every failure, otherwise it stays flat
   */
  public record Policy(int maxAttempts, long baseIntervalMillis, boolean exponential) {

    /** Default attempt budget. */
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    /** Default wait after the first failure. */
    public static final long DEFAULT_BASE_INTERVAL_MILLIS = 200L;

    public Policy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      if (baseIntervalMillis < 0)
        throw new IllegalArgumentException("baseIntervalMillis must be >= 0");
    }

    /**
     * Exponential policy: 5 attempts, 200ms, 400ms, 800ms, 1600ms between them.
     *
     * @return default policy
     */
    public static Policy defaults() {
      return exponential(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_INTERVAL_MILLIS);
    }

    /**
     * Creates an exponential backoff policy.
     *
     * @param attempts number of attempts (including first)
     * @param baseIntervalMillis wait after the first failure
     * @return exponential policy
     */
    public static Policy exponential(final int attempts, final long baseIntervalMillis) {
      return new Policy(attempts, baseIntervalMillis, true);
    }

    /**
     * Creates a fixed delay policy.
     *
     * @param attempts number of attempts (including first)
     * @param intervalMillis wait between attempts
     * @return fixed delay policy
     */
    public static Policy fixed(final int attempts, final long intervalMillis) {
      return new Policy(attempts, intervalMillis, false);
    }

    /**
     * Returns a copy of this policy with a different attempt budget.
     *
     * @param attempts number of attempts (including first)
     * @return policy with the same interval settings
     */
    public Policy withMaxAttempts(final int attempts) {
      return new Policy(attempts, baseIntervalMillis, exponential);
    }

    /**
     * Calculates the wait that follows a given number of failed attempts.
     *
     * @param failedAttempts failures so far (1-based)
     * @return delay in milliseconds before the next attempt
     */
    public long calculateDelay(final int failedAttempts) {
      if (failedAttempts < 1) return 0L;
      if (!exponential) return baseIntervalMillis;
      final var delay = baseIntervalMillis * Math.pow(2, failedAttempts - 1);
      return delay >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) delay;
    }
  }

  /**
   * Runs {@code operation} up to {@code policy.maxAttempts()} times, retrying on any error.
   *
   * @param operation operation to execute; called once per attempt
   * @param policy retry policy
   * @param <T> result type
   * @return the first successful result, or the final attempt's error unchanged
   */
  public static <T> Mono<T> backoff(final Supplier<Mono<T>> operation, final Policy policy) {
    return Mono.defer(operation)
        .onErrorResume(e -> retryAfter(operation, policy, 1, e, Mono::error));
  }

  /**
   * Runs {@code operation} once and, if its failure is retryable, keeps retrying with backoff.
   *
   * <p>A non-retryable first failure propagates after exactly one attempt. Once the first failure
   * is classified as retryable, subsequent failures are retried until the budget is spent.
   *
   * @param operation operation to execute; called once per attempt
   * @param classifier decides whether the first failure is transient
   * @param policy retry policy; {@code maxAttempts} counts the first attempt
   * @param <T> result type
   * @return the first successful result, or the last error unchanged
   */
  public static <T> Mono<T> onRetryable(
      final Supplier<Mono<T>> operation, final RetryClassifier classifier, final Policy policy) {
    return onRetryable(operation, classifier, policy, Mono::error);
  }

  /**
   * Like {@link #onRetryable(Supplier, RetryClassifier, Policy)}, handing the final error to
   * {@code onExhausted} when the retry budget runs out.
   *
   * <p>{@code onExhausted} is only consulted after a retryable failure used up every attempt; it is
   * never called for a non-retryable first failure.
   *
   * @param operation operation to execute; called once per attempt
   * @param classifier decides whether the first failure is transient
   * @param policy retry policy
   * @param onExhausted continuation receiving the last error once the budget is spent
   * @param <T> result type
   * @return the first successful result, the result of {@code onExhausted}, or the error
   */
  public static <T> Mono<T> onRetryable(
      final Supplier<Mono<T>> operation,
      final RetryClassifier classifier,
      final Policy policy,
      final Function<Throwable, Mono<T>> onExhausted) {
    return Mono.defer(operation)
        .onErrorResume(
            e -> {
              if (!classifier.isRetryable(e)) return Mono.error(e);
              return retryAfter(operation, policy, 1, e, onExhausted);
            });
  }

  private static <T> Mono<T> retryAfter(
      final Supplier<Mono<T>> operation,
      final Policy policy,
      final int failedAttempts,
      final Throwable lastError,
      final Function<Throwable, Mono<T>> onExhausted) {
    if (failedAttempts >= policy.maxAttempts()) {
      if (policy.maxAttempts() > 1)
        LOGGER.log(WARNING, "All {0} retry attempts failed", failedAttempts);
      return onExhausted.apply(lastError);
    }

    final var delay = policy.calculateDelay(failedAttempts);
    LOGGER.log(DEBUG, "Attempt {0} failed, retrying in {1} ms...", failedAttempts, delay);

    return Mono.delay(Duration.ofMillis(delay))
        .then(Mono.defer(operation))
        .onErrorResume(e -> retryAfter(operation, policy, failedAttempts + 1, e, onExhausted));
  }
}
