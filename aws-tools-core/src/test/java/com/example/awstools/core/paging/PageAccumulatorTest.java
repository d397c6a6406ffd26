package com.example.awstools.core.paging;

import static org.junit.jupiter.api.Assertions.*;

import com.example.awstools.core.retry.Retry;
import com.example.awstools.core.retry.RetryClassifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.exception.RetryableException;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;

class PageAccumulatorTest {

  private static final Retry.Policy FAST = Retry.Policy.exponential(3, 1L);
  private static final RetryClassifier CLASSIFIER = RetryClassifier.defaultClassifier();

  /** Serves pages keyed by cursor: page {@code i} is requested with cursor {@code "p" + i}. */
  private static final class ScriptedFetcher implements PageFetcher<String, String> {
    private final List<Page<String, String>> pages;
    private final List<String> cursors = new ArrayList<>();
    private final List<Integer> remainders = new ArrayList<>();

    @SafeVarargs
    ScriptedFetcher(final Page<String, String>... pages) {
      this.pages = Arrays.asList(pages);
    }

    @Override
    public Mono<Page<String, String>> fetch(final String cursor, final Integer remaining) {
      cursors.add(cursor);
      remainders.add(remaining);
      final var index = cursor == null ? 0 : Integer.parseInt(cursor.substring(1));
      return Mono.just(pages.get(index));
    }
  }

  private static Page<String, String> page(final String next, final String... items) {
    return new Page<>(List.of(items), next);
  }

  @Nested
  class Accumulating {

    @Test
    @DisplayName("Concatenates pages in arrival order until the cursor runs out")
    void mergesAllPages() {
      final var fetcher =
          new ScriptedFetcher(page("p1", "a", "b"), page("p2", "c"), page(null, "d"));

      final var result =
          PageAccumulator.accumulate(fetcher, PageRequest.all(), CLASSIFIER, FAST).block();

      assertEquals(List.of("a", "b", "c", "d"), result.items());
      assertNull(result.lastCursor());
      assertFalse(result.hasMore());
      assertEquals(Arrays.asList(null, "p1", "p2"), fetcher.cursors);
    }

    @Test
    @DisplayName("Starts from the requested cursor")
    void startsAtCursor() {
      final var fetcher = new ScriptedFetcher(page("p1", "a"), page(null, "b"));

      final var result =
          PageAccumulator.accumulate(fetcher, PageRequest.startingAt("p1"), CLASSIFIER, FAST)
              .block();

      assertEquals(List.of("b"), result.items());
      assertEquals(List.of("p1"), fetcher.cursors);
    }

    @Test
    @DisplayName("Ceiling truncates mid-page and reports that page's cursor")
    void ceilingTruncatesMidPage() {
      final var fetcher = new ScriptedFetcher(page("p1", "a", "b"), page(null, "c"));

      final var result =
          PageAccumulator.accumulate(fetcher, PageRequest.limitedTo(1), CLASSIFIER, FAST).block();

      assertEquals(List.of("a"), result.items());
      assertEquals("p1", result.lastCursor());
      assertTrue(result.hasMore());
      assertEquals(1, fetcher.cursors.size());
    }

    @Test
    @DisplayName("Each page is asked only for the items still allowed by the ceiling")
    void passesRemainingCount() {
      final var fetcher = new ScriptedFetcher(page("p1", "a", "b"), page("p2", "c", "d"));

      final var result =
          PageAccumulator.accumulate(fetcher, PageRequest.limitedTo(3), CLASSIFIER, FAST).block();

      assertEquals(List.of("a", "b", "c"), result.items());
      assertEquals("p2", result.lastCursor());
      assertEquals(List.of(3, 1), fetcher.remainders);
    }

    @Test
    @DisplayName("A page without an items field counts as empty and paging continues")
    void missingItemsIsEmptyPage() {
      final var fetcher = new ScriptedFetcher(new Page<>(null, "p1"), page(null, "a"));

      final var result =
          PageAccumulator.accumulate(fetcher, PageRequest.all(), CLASSIFIER, FAST).block();

      assertEquals(List.of("a"), result.items());
    }

    @Test
    @DisplayName("No ceiling means remaining is null on every page")
    void noCeiling() {
      final var fetcher = new ScriptedFetcher(page("p1", "a"), page(null, "b"));

      PageAccumulator.accumulate(fetcher, PageRequest.all(), CLASSIFIER, FAST).block();

      assertEquals(Arrays.asList(null, null), fetcher.remainders);
    }
  }

  @Nested
  class Failures {

    @Test
    @DisplayName("A retryable page failure is retried and the fold continues")
    void retriesFailingPage() {
      final var calls = new AtomicInteger();
      final PageFetcher<String, String> fetcher =
          (cursor, remaining) -> {
            if (cursor == null) return Mono.just(page("p1", "a"));
            if (calls.incrementAndGet() < 3)
              return Mono.error(RetryableException.create("throttled"));
            return Mono.just(page(null, "b"));
          };

      final var result =
          PageAccumulator.accumulate(fetcher, PageRequest.all(), CLASSIFIER, FAST).block();

      assertEquals(List.of("a", "b"), result.items());
      assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("Exhausted retries report the failing page's state")
    void exhaustedCarriesState() {
      final var calls = new AtomicInteger();
      final var error = RetryableException.create("throttled");
      final PageFetcher<String, String> fetcher =
          (cursor, remaining) -> {
            if (cursor == null) return Mono.just(page("p1", "a"));
            calls.incrementAndGet();
            return Mono.error(error);
          };

      final var mono = PageAccumulator.accumulate(fetcher, PageRequest.all(), CLASSIFIER, FAST);
      final var thrown = assertThrows(PaginationException.class, mono::block);

      assertTrue(thrown.retriesExhausted());
      assertSame(error, thrown.getCause());
      assertEquals("p1", thrown.state().cursor());
      assertEquals(List.of("a"), thrown.state().items());
      assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("A non-retryable failure stops after one attempt")
    void permanentFailure() {
      final var calls = new AtomicInteger();
      final var error = NoSuchBucketException.builder().message("no bucket").build();
      final PageFetcher<String, String> fetcher =
          (cursor, remaining) -> {
            calls.incrementAndGet();
            return Mono.error(error);
          };

      final var mono = PageAccumulator.accumulate(fetcher, PageRequest.all(), CLASSIFIER, FAST);
      final var thrown = assertThrows(PaginationException.class, mono::block);

      assertFalse(thrown.retriesExhausted());
      assertSame(error, thrown.getCause());
      assertEquals("no bucket", thrown.getMessage());
      assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Resuming from a saved state keeps the items gathered before it")
    void resumeFromState() {
      final var state = new Accumulation<String, String>(List.of("a"), "p1", null);
      final var fetcher = new ScriptedFetcher(page("p1", "x"), page(null, "b"));

      final var result = PageAccumulator.resume(fetcher, state, CLASSIFIER, FAST).block();

      assertEquals(List.of("a", "b"), result.items());
      assertEquals(List.of("p1"), fetcher.cursors);
    }
  }

  @Nested
  class Requests {

    @Test
    @DisplayName("A ceiling below one is rejected")
    void rejectsNonPositiveCeiling() {
      assertThrows(IllegalArgumentException.class, () -> PageRequest.limitedTo(0));
      assertThrows(
          IllegalArgumentException.class, () -> PageRequest.<String>all().withMaxResults(-1));
    }

    @Test
    @DisplayName("Appending never exceeds the ceiling")
    void appendRespectsCeiling() {
      final var state = Accumulation.<String, String>start(PageRequest.limitedTo(2));
      final var next = state.append(page("p1", "a", "b", "c"));

      assertEquals(List.of("a", "b"), next.items());
      assertTrue(next.isComplete());
      assertEquals(Integer.valueOf(0), next.remaining());
      assertTrue(state.items().isEmpty());
    }
  }
}
