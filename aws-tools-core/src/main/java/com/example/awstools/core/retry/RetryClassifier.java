package com.example.awstools.core.retry;

import com.example.awstools.core.AwsToolsException;
import java.util.function.Predicate;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Decides whether a failed backend call is transient.
 *
 * <p>The default classifier trusts the flag the backend attaches to its own errors ({@link
 * SdkException#retryable()}); it inspects no status codes, messages or exception types. Backends
 * that never set the flag are therefore never retried by it.
 *
 * <h3>Combining Classifiers</h3>
 *
 * <pre>{@code
 * var classifier = RetryClassifier.defaultClassifier()
 *     .or(RetryClassifier.custom(e -> e instanceof ProvisionedThroughputExceededException));
 * }</pre>
 */
@FunctionalInterface
public interface RetryClassifier {

  /**
   * Determines if the failure may succeed on a later attempt.
   *
   * @param failure the failure, possibly wrapped by a future
   * @return true if retryable
   */
  boolean isRetryable(Throwable failure);

  /**
   * Returns the classifier that honors only the backend-provided retryable flag.
   *
   * @return default classifier
   */
  static RetryClassifier defaultClassifier() {
    return RetryClassifier::isFlaggedRetryable;
  }

  /**
   * Creates a classifier from a predicate.
   *
   * @param predicate the predicate to use
   * @return custom classifier
   */
  static RetryClassifier custom(final Predicate<Throwable> predicate) {
    return predicate::test;
  }

  /**
   * Combines this classifier with another using OR logic.
   *
   * @param other the other classifier
   * @return combined classifier
   */
  default RetryClassifier or(final RetryClassifier other) {
    return e -> this.isRetryable(e) || other.isRetryable(e);
  }

  /**
   * Checks the backend-provided retryable flag.
   *
   * @param failure the failure to check
   * @return true if the backend marked the failure as retryable
   */
  static boolean isFlaggedRetryable(final Throwable failure) {
    if (failure == null) return false;
    return AwsToolsException.unwrap(failure) instanceof SdkException sdk && sdk.retryable();
  }
}
