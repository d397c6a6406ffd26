package com.example.awstools.core.paging;

/**
 * Terminates an accumulation whose current page could not be fetched.
 *
 * <p>Carries the state the failing page was fetched from, so that another backend can {@linkplain
 * PageAccumulator#resume resume} from it. Callers outside the tools only ever see the cause.
 */
public class PaginationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final transient Accumulation<?, ?> state;
  private final boolean retriesExhausted;

  public PaginationException(
      final Accumulation<?, ?> state, final Throwable cause, final boolean retriesExhausted) {
    super(cause.getMessage(), cause);
    this.state = state;
    this.retriesExhausted = retriesExhausted;
  }

  /** State before the failing page. */
  public Accumulation<?, ?> state() {
    return state;
  }

  /** True when the failure was retryable and every attempt failed. */
  public boolean retriesExhausted() {
    return retriesExhausted;
  }
}
