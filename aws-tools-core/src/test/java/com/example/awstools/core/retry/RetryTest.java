package com.example.awstools.core.retry;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.exception.RetryableException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

class RetryTest {

  private static final Retry.Policy FAST = Retry.Policy.exponential(5, 1L);

  private static Mono<String> failingTimes(
      final AtomicInteger attempts, final int failures, final RuntimeException error) {
    return Mono.defer(
        () ->
            attempts.incrementAndGet() <= failures ? Mono.<String>error(error) : Mono.just("ok"));
  }

  @Nested
  class PolicyTests {

    @Test
    @DisplayName("Default policy is 5 attempts with a 200ms exponential base")
    void defaults() {
      final var policy = Retry.Policy.defaults();
      assertEquals(5, policy.maxAttempts());
      assertEquals(200L, policy.baseIntervalMillis());
      assertTrue(policy.exponential());
    }

    @Test
    @DisplayName("Exponential delays double after every failure")
    void exponentialDelays() {
      final var policy = Retry.Policy.defaults();
      assertEquals(0L, policy.calculateDelay(0));
      assertEquals(200L, policy.calculateDelay(1));
      assertEquals(400L, policy.calculateDelay(2));
      assertEquals(800L, policy.calculateDelay(3));
      assertEquals(1600L, policy.calculateDelay(4));
    }

    @Test
    @DisplayName("Fixed delays stay flat")
    void fixedDelays() {
      final var policy = Retry.Policy.fixed(3, 50L);
      assertEquals(50L, policy.calculateDelay(1));
      assertEquals(50L, policy.calculateDelay(2));
    }

    @Test
    @DisplayName("Huge attempt counts saturate instead of overflowing")
    void delaySaturates() {
      assertEquals(Long.MAX_VALUE, Retry.Policy.exponential(100, 1000L).calculateDelay(90));
    }

    @Test
    @DisplayName("Invalid budgets and intervals are rejected")
    void validation() {
      assertThrows(IllegalArgumentException.class, () -> Retry.Policy.exponential(0, 10L));
      assertThrows(IllegalArgumentException.class, () -> Retry.Policy.fixed(1, -1L));
    }

    @Test
    @DisplayName("withMaxAttempts keeps interval settings")
    void withMaxAttempts() {
      final var policy = Retry.Policy.fixed(3, 25L).withMaxAttempts(7);
      assertEquals(new Retry.Policy(7, 25L, false), policy);
    }
  }

  @Nested
  class BackoffTests {

    @Test
    @DisplayName("Succeeds after k failures using k+1 attempts")
    void succeedsAfterFailures() {
      final var attempts = new AtomicInteger();
      final var result =
          Retry.backoff(
                  () -> failingTimes(attempts, 2, new IllegalStateException("boom")), FAST)
              .block();

      assertEquals("ok", result);
      assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("Exhausting the budget surfaces the last error unchanged")
    void exhaustsBudget() {
      final var attempts = new AtomicInteger();
      final var error = new IllegalStateException("always");
      final var mono = Retry.backoff(() -> failingTimes(attempts, Integer.MAX_VALUE, error), FAST);

      final var thrown = assertThrows(IllegalStateException.class, mono::block);
      assertSame(error, thrown);
      assertEquals(5, attempts.get());
    }
  }

  @Nested
  class OnRetryableTests {

    @Test
    @DisplayName("Retryable failures are retried until success")
    void retriesRetryable() {
      final var attempts = new AtomicInteger();
      final var result =
          Retry.onRetryable(
                  () -> failingTimes(attempts, 3, RetryableException.create("throttled")),
                  RetryClassifier.defaultClassifier(),
                  FAST)
              .block();

      assertEquals("ok", result);
      assertEquals(4, attempts.get());
    }

    @Test
    @DisplayName("A non-retryable failure is surfaced after exactly one attempt")
    void doesNotRetryPermanentFailure() {
      final var attempts = new AtomicInteger();
      final var error = ResourceNotFoundException.builder().message("no table").build();
      final var mono =
          Retry.onRetryable(
              () -> failingTimes(attempts, Integer.MAX_VALUE, error),
              RetryClassifier.defaultClassifier(),
              FAST);

      final var thrown = assertThrows(ResourceNotFoundException.class, mono::block);
      assertSame(error, thrown);
      assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("Budget of one means a single attempt even for retryable failures")
    void singleAttemptBudget() {
      final var attempts = new AtomicInteger();
      final var mono =
          Retry.onRetryable(
              () -> failingTimes(attempts, Integer.MAX_VALUE, RetryableException.create("x")),
              RetryClassifier.defaultClassifier(),
              Retry.Policy.exponential(1, 1L));

      assertThrows(RetryableException.class, mono::block);
      assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("onExhausted receives the last error once the budget is spent")
    void onExhaustedContinuation() {
      final var attempts = new AtomicInteger();
      final var seen = new AtomicReference<Throwable>();
      final var error = RetryableException.create("still throttled");

      final var result =
          Retry.onRetryable(
                  () -> failingTimes(attempts, Integer.MAX_VALUE, error),
                  RetryClassifier.defaultClassifier(),
                  Retry.Policy.exponential(3, 1L),
                  e -> {
                    seen.set(e);
                    return Mono.just("fallback");
                  })
              .block();

      assertEquals("fallback", result);
      assertEquals(3, attempts.get());
      assertSame(error, seen.get());
    }

    @Test
    @DisplayName("onExhausted is not consulted for a non-retryable failure")
    void onExhaustedSkippedForPermanentFailure() {
      final var invoked = new AtomicInteger();
      final var mono =
          Retry.onRetryable(
              () -> Mono.<String>error(new IllegalArgumentException("bad")),
              RetryClassifier.defaultClassifier(),
              FAST,
              e -> {
                invoked.incrementAndGet();
                return Mono.just("fallback");
              });

      assertThrows(IllegalArgumentException.class, mono::block);
      assertEquals(0, invoked.get());
    }
  }
}
