package com.example.awstools.core;

import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Structured failure surfaced by every tools operation.
 *
 * <p>For backend failures the message is the backend's own message and the backend exception is
 * the cause, so callers can keep branching on the original error. The {@link ErrorContext} is fixed
 * at construction.
 */
public class AwsToolsException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final ErrorCode code;
  private final transient ErrorContext context;
  private final Throwable primaryFailure;

  AwsToolsException(
      final ErrorCode code,
      final String message,
      final ErrorContext context,
      final Throwable cause,
      final Throwable primaryFailure) {
    super(message, cause);
    this.code = code;
    this.context = context;
    this.primaryFailure = primaryFailure;
    if (primaryFailure != null) addSuppressed(primaryFailure);
  }

  /** Invalid or missing arguments; the backend was not invoked. */
  public static AwsToolsException badParam(final ErrorContext context) {
    return new AwsToolsException(
        ErrorCode.BAD_PARAM, ErrorCode.BAD_PARAM.name(), context, null, null);
  }

  /** The backend answered but returned nothing to read. */
  public static AwsToolsException notFound(final ErrorContext context) {
    return new AwsToolsException(
        ErrorCode.NOT_FOUND, ErrorCode.NOT_FOUND.name(), context, null, null);
  }

  /** The backend answered that the resource does not exist. */
  public static AwsToolsException notFound(final ErrorContext context, final Throwable cause) {
    return new AwsToolsException(
        ErrorCode.NOT_FOUND, ErrorCode.NOT_FOUND.name(), context, unwrap(cause), null);
  }

  /**
   * Wraps a backend failure. An {@code AwsToolsException} is returned unchanged.
   *
   * @param context call context
   * @param failure backend failure, possibly wrapped in a {@link CompletionException}
   * @return the structured failure
   */
  public static AwsToolsException backend(final ErrorContext context, final Throwable failure) {
    final var cause = unwrap(failure);
    if (cause instanceof AwsToolsException tools) return tools;
    return new AwsToolsException(
        ErrorCode.BACKEND_FAILURE, cause.getMessage(), context, cause, null);
  }

  /**
   * Failure of the direct fallback client after the caching-proxy client exhausted its retries.
   *
   * @param context call context
   * @param fallbackFailure error reported by the fallback client, used as cause and message
   * @param primaryFailure error that made the primary client give up
   * @return the structured failure
   */
  public static AwsToolsException fallbackExhausted(
      final ErrorContext context, final Throwable fallbackFailure, final Throwable primaryFailure) {
    final var cause = unwrap(fallbackFailure);
    return new AwsToolsException(
        ErrorCode.FALLBACK_EXHAUSTED, cause.getMessage(), context, cause, unwrap(primaryFailure));
  }

  /** A payload could not be decompressed or parsed. */
  public static AwsToolsException decodeFailure(final ErrorContext context, final Throwable cause) {
    return new AwsToolsException(
        ErrorCode.DECODE_FAILURE, ErrorCode.DECODE_FAILURE.name(), context, unwrap(cause), null);
  }

  /**
   * Strips {@link CompletionException} and {@link ExecutionException} wrappers added by futures.
   *
   * @param failure the failure to inspect
   * @return the innermost non-wrapper throwable, or {@code failure} itself
   */
  public static Throwable unwrap(final Throwable failure) {
    var current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  public ErrorCode code() {
    return code;
  }

  public ErrorContext context() {
    return context;
  }

  /** The primary client's failure when the fallback client also failed. */
  public Optional<Throwable> primaryFailure() {
    return Optional.ofNullable(primaryFailure);
  }

  @Override
  public String toString() {
    return getClass().getName()
        + ": ["
        + code
        + "] "
        + getMessage()
        + " ("
        + context.component()
        + "."
        + context.operation()
        + " "
        + context.params()
        + ")";
  }
}
